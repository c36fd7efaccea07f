package com.questrail.svga.model;

/**
 * Binary asset stored in the {@code images} map of a document.
 *
 * <p>The decoder always produces {@link Base64Image}, which keeps a decoded
 * document text-only for interchange with editing front ends. Code that
 * synthesizes new assets may hand over {@link RawImage} directly; the encoder
 * accepts both.</p>
 */
public sealed interface ImageAsset
        permits Base64Image, RawImage {
}

package com.questrail.svga.model;

import java.util.List;
import java.util.Objects;

/**
 * A named layer: an image reference plus a per-frame animation track.
 *
 * <p>{@code imageKey} must resolve in {@link SvgaDocument#images()} once the
 * document has been encoded. {@code matteKey} is empty when the sprite is not
 * masked; otherwise it names another sprite's image.</p>
 */
public record SpriteEntity(
        String imageKey,
        String matteKey,
        List<FrameEntity> frames
) {
    public SpriteEntity {
        imageKey = Objects.requireNonNullElse(imageKey, "");
        matteKey = Objects.requireNonNullElse(matteKey, "");
        frames = (frames == null) ? List.of() : List.copyOf(frames);
    }

    public static SpriteEntity of(String imageKey, List<FrameEntity> frames) {
        return new SpriteEntity(imageKey, "", frames);
    }

    public boolean hasImage() {
        return !imageKey.isEmpty();
    }

    public boolean hasMatte() {
        return !matteKey.isEmpty();
    }
}

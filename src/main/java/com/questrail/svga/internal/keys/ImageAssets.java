package com.questrail.svga.internal.keys;

import com.questrail.svga.model.Base64Image;
import com.questrail.svga.model.ImageAsset;
import com.questrail.svga.model.RawImage;

import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns an {@link ImageAsset} back into bytes.
 */
public final class ImageAssets
{
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ImageAssets() {}

    /**
     * Returns the asset bytes, or empty if the asset holds no usable data.
     *
     * <p>Base64 text may carry a {@code data:} URI prefix, may omit its
     * padding and may be wrapped across lines. Whitespace is dropped before
     * decoding; any other character outside the alphabet makes the text
     * undecodable.</p>
     */
    public static Optional<byte[]> bytes(ImageAsset asset) {
        if (asset instanceof RawImage raw) {
            return raw.isEmpty() ? Optional.empty() : Optional.of(raw.bytes());
        }
        if (asset instanceof Base64Image text) {
            return decodeBase64(text.base64());
        }
        return Optional.empty();
    }

    static Optional<byte[]> decodeBase64(String text) {
        String clean = text;
        final int comma = clean.indexOf(',');
        if (comma >= 0) {
            clean = clean.substring(comma + 1);
        }
        clean = WHITESPACE.matcher(clean).replaceAll("");
        if (clean.isEmpty()) {
            return Optional.empty();
        }
        try {
            byte[] decoded = Base64.getDecoder().decode(clean);
            return decoded.length == 0 ? Optional.empty() : Optional.of(decoded);
        }
        catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

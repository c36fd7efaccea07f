package com.questrail.svga.synth;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Procedural motion applied to a synthesized layer. Presets combine freely.
 */
public enum AnimationPreset {
    /** Sinusoidal uniform scale around the rectangle centre. */
    PULSE,
    /** Sinusoidal vertical bob. */
    FLOAT,
    /** Tilted highlight bands sweeping left to right. */
    SHINE;

    /**
     * Parses preset names case-insensitively. {@code "none"} and blank names
     * are ignored.
     *
     * @throws IllegalArgumentException for any other unknown name
     */
    public static Set<AnimationPreset> parse(Iterable<String> names) {
        final Set<AnimationPreset> presets = EnumSet.noneOf(AnimationPreset.class);
        for (String name : names) {
            final String n = (name == null) ? "" : name.trim().toUpperCase(Locale.ROOT);
            if (n.isEmpty() || n.equals("NONE")) {
                continue;
            }
            presets.add(valueOf(n));
        }
        return presets;
    }
}

package com.questrail.svga.compose;

import com.questrail.svga.raster.TextStyle;
import com.questrail.svga.synth.AnimationConfig;
import com.questrail.svga.synth.AnimationPreset;
import com.questrail.svga.synth.TargetRect;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A layer as the user placed it: a named box, its content and its motion.
 *
 * <p>Instances are immutable; the {@code with...} methods return copies.</p>
 */
public final class EditorLayer
{
    private final LayerKind kind;
    private final String name;
    private final TargetRect rect;
    private final Set<AnimationPreset> presets;
    private final AnimationConfig config;
    private final TextStyle textStyle;
    private final byte[] image;

    private EditorLayer(LayerKind kind,
                        String name,
                        TargetRect rect,
                        Set<AnimationPreset> presets,
                        AnimationConfig config,
                        TextStyle textStyle,
                        byte[] image) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.rect = Objects.requireNonNull(rect, "rect");
        this.presets = Collections.unmodifiableSet(presets.isEmpty()
                ? EnumSet.noneOf(AnimationPreset.class)
                : EnumSet.copyOf(presets));
        this.config = Objects.requireNonNull(config, "config");
        this.textStyle = textStyle;
        this.image = image;
    }

    public static EditorLayer key(String name, TargetRect rect) {
        return new EditorLayer(LayerKind.KEY, name, rect, Set.of(), AnimationConfig.DEFAULT, null, null);
    }

    public static EditorLayer text(String name, TargetRect rect, TextStyle style) {
        Objects.requireNonNull(style, "style");
        return new EditorLayer(LayerKind.TEXT, name, rect, Set.of(), AnimationConfig.DEFAULT, style, null);
    }

    /**
     * @param image encoded picture, or {@code null} when none was chosen yet
     */
    public static EditorLayer image(String name, TargetRect rect, byte[] image) {
        return new EditorLayer(LayerKind.IMAGE, name, rect, Set.of(), AnimationConfig.DEFAULT,
                null, image == null ? null : image.clone());
    }

    public EditorLayer withPresets(Set<AnimationPreset> newPresets) {
        Objects.requireNonNull(newPresets, "newPresets");
        return new EditorLayer(kind, name, rect, newPresets, config, textStyle, image);
    }

    public EditorLayer withConfig(AnimationConfig newConfig) {
        return new EditorLayer(kind, name, rect, presets, newConfig, textStyle, image);
    }

    public EditorLayer withRect(TargetRect newRect) {
        return new EditorLayer(kind, name, newRect, presets, config, textStyle, image);
    }

    public LayerKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public TargetRect rect() {
        return rect;
    }

    public Set<AnimationPreset> presets() {
        return presets;
    }

    public AnimationConfig config() {
        return config;
    }

    public Optional<TextStyle> textStyle() {
        return Optional.ofNullable(textStyle);
    }

    public Optional<byte[]> image() {
        return Optional.ofNullable(image).map(byte[]::clone);
    }

    @Override
    public String toString() {
        return "EditorLayer{" + kind + " '" + name + "' " + rect + " " + presets + "}";
    }
}

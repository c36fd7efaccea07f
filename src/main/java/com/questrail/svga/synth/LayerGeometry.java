package com.questrail.svga.synth;

import com.questrail.svga.model.FrameEntity;
import com.questrail.svga.model.Layout;
import com.questrail.svga.model.Transform;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * LayerGeometry
 * -----------------------------------------------------------------------------
 * Per-frame keyframe math for synthesized layers. Pure and synchronous.
 *
 * <h2>Main track</h2>
 * <p>With {@code progress = i / N} and {@code θ = progress · 2π · cycles}:</p>
 * <ul>
 *   <li>pulse: {@code scale = 1 + sin(θ) · 0.05 · intensity}</li>
 *   <li>float: {@code offsetY = sin(θ) · 6 · intensity}</li>
 * </ul>
 * <p>Scaling is about the rectangle centre, so the translation absorbs
 * {@code size · (1 − scale) / 2}. Both presets contribute to the same frame.</p>
 *
 * <h2>Shine track</h2>
 * <p>A parallelogram tilted 30° sweeps from fully left of the rectangle to
 * fully right of it once per cycle. Its centre is
 * {@code cx = start + (end − start) · progress + bandOffset} with
 * {@code start = −bandWidth − xOffset}, {@code end = width + bandWidth + xOffset}
 * and {@code xOffset = height · tan(30°)}.</p>
 */
public final class LayerGeometry
{
    static final double PULSE_AMPLITUDE = 0.05;
    static final double FLOAT_AMPLITUDE = 6.0;
    static final double SHINE_BAND_FRACTION = 0.4;
    static final double SHINE_TAN = Math.tan(Math.toRadians(30.0));

    private LayerGeometry() {}

    /**
     * Frames of the main sprite.
     */
    public static List<FrameEntity> mainTrack(TargetRect rect,
                                              Set<AnimationPreset> presets,
                                              AnimationConfig config,
                                              int totalFrames) {
        final List<FrameEntity> frames = new ArrayList<>(Math.max(0, totalFrames));
        final boolean pulse = presets.contains(AnimationPreset.PULSE);
        final boolean bob = presets.contains(AnimationPreset.FLOAT);

        for (int i = 0; i < totalFrames; i++) {
            if (rect.isDegenerate()) {
                frames.add(FrameEntity.of(0f, Layout.ZERO, Transform.IDENTITY));
                continue;
            }

            final double progress = (double) i / totalFrames;
            final double theta = progress * 2.0 * Math.PI * config.cycles();
            final double wave = Math.sin(theta);

            final double scale = pulse ? 1.0 + wave * PULSE_AMPLITUDE * config.intensity() : 1.0;
            final double offsetY = bob ? wave * FLOAT_AMPLITUDE * config.intensity() : 0.0;

            final double tx = rect.x() + rect.width() * (1.0 - scale) / 2.0;
            final double ty = rect.y() + rect.height() * (1.0 - scale) / 2.0 + offsetY;

            frames.add(FrameEntity.of(
                    1f,
                    Layout.ofSize(rect.width(), rect.height()),
                    Transform.scaleAndTranslate((float) scale, (float) tx, (float) ty)));
        }
        return frames;
    }

    /**
     * Frames of one shine band.
     */
    public static List<FrameEntity> shineTrack(TargetRect rect,
                                               ShineBand band,
                                               AnimationConfig config,
                                               int totalFrames) {
        final List<FrameEntity> frames = new ArrayList<>(Math.max(0, totalFrames));
        final double w = rect.width();
        final double h = rect.height();
        final double xOffset = h * SHINE_TAN;
        final double bandWidth = w * SHINE_BAND_FRACTION * config.intensity();
        final double start = -bandWidth - xOffset;
        final double end = w + bandWidth + xOffset;

        final Layout layout = Layout.ofSize(rect.width(), rect.height());
        final Transform placement = Transform.translate(rect.x(), rect.y());

        for (int i = 0; i < totalFrames; i++) {
            final double progress = ((double) i / totalFrames * config.cycles()) % 1.0;
            final double cx = start + (end - start) * progress + band.offset(w);
            frames.add(new FrameEntity(
                    band.alpha(),
                    layout,
                    placement,
                    bandClipPath(cx, xOffset, bandWidth, h),
                    List.of()));
        }
        return frames;
    }

    /**
     * Tilted band centred on {@code cx}: top edge shifted right by
     * {@code xOffset}, bottom edge shifted left by it.
     */
    static String bandClipPath(double cx, double xOffset, double bandWidth, double height) {
        final double x1 = cx + xOffset - bandWidth / 2;
        final double x2 = cx + xOffset + bandWidth / 2;
        final double x3 = cx - xOffset + bandWidth / 2;
        final double x4 = cx - xOffset - bandWidth / 2;
        final String h = number(height);
        return "M " + number(x1) + " 0"
                + " L " + number(x2) + " 0"
                + " L " + number(x3) + " " + h
                + " L " + number(x4) + " " + h
                + " Z";
    }

    /**
     * Shortest plain decimal form: no exponent, no trailing zeros.
     */
    static String number(double value) {
        if (!Double.isFinite(value)) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

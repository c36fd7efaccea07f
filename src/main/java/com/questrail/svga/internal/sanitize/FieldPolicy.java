package com.questrail.svga.internal.sanitize;

import com.questrail.svga.model.EllipseArgs;
import com.questrail.svga.model.Layout;
import com.questrail.svga.model.RectArgs;
import com.questrail.svga.model.RgbaColor;
import com.questrail.svga.model.Transform;

/**
 * FieldPolicy
 * -----------------------------------------------------------------------------
 * The two numeric normalization rules applied before encoding.
 *
 * <h2>Epsilon-nonzero</h2>
 * <p>Proto3 drops zero-valued scalars from the wire. Several native SVGA
 * players treat a frame whose {@code Layout} lost its fields as malformed, so
 * {@code Layout.{x,y,width,height}} and {@code Transform.{tx,ty}} are bumped
 * to {@value #EPSILON} (keeping the sign) whenever {@code |v| <= 1e-5}.
 * This must never be applied to colours, stroke widths or the matrix
 * scale/skew components.</p>
 *
 * <h2>Safe-float</h2>
 * <p>Every other float passes through unchanged, true zero included.
 * Non-finite values are replaced by the caller's default.</p>
 *
 * <p>Each structural object is rebuilt field by field under one of the two
 * rules. There is no generic copy path.</p>
 */
public final class FieldPolicy
{
    /** Magnitude substituted for near-zero layout/translation values. */
    public static final float EPSILON = 0.00001f;

    private FieldPolicy() {}

    /**
     * Epsilon-nonzero rule.
     */
    public static float nonZero(float value, float fallback) {
        final float v = Float.isFinite(value) ? value : fallback;
        if (Math.abs(v) <= EPSILON) {
            return Math.copySign(EPSILON, v);
        }
        return v;
    }

    /**
     * Safe-float rule.
     */
    public static float safe(float value, float fallback) {
        return Float.isFinite(value) ? value : fallback;
    }

    public static float safe(float value) {
        return safe(value, 0f);
    }

    public static Layout layout(Layout layout) {
        final Layout l = (layout == null) ? Layout.ZERO : layout;
        return new Layout(
                nonZero(l.x(), 0f),
                nonZero(l.y(), 0f),
                nonZero(l.width(), 0f),
                nonZero(l.height(), 0f));
    }

    public static Transform transform(Transform transform) {
        final Transform t = (transform == null) ? Transform.IDENTITY : transform;
        return new Transform(
                safe(t.a(), 1f),
                safe(t.b(), 0f),
                safe(t.c(), 0f),
                safe(t.d(), 1f),
                nonZero(t.tx(), 0f),
                nonZero(t.ty(), 0f));
    }

    public static RgbaColor color(RgbaColor color) {
        if (color == null) {
            return null;
        }
        return new RgbaColor(
                safe(color.r()),
                safe(color.g()),
                safe(color.b()),
                safe(color.a()));
    }

    public static RectArgs rect(RectArgs rect) {
        return new RectArgs(
                safe(rect.x()),
                safe(rect.y()),
                safe(rect.width()),
                safe(rect.height()),
                safe(rect.cornerRadius()));
    }

    public static EllipseArgs ellipse(EllipseArgs ellipse) {
        return new EllipseArgs(
                safe(ellipse.x()),
                safe(ellipse.y()),
                safe(ellipse.radiusX()),
                safe(ellipse.radiusY()));
    }

    /**
     * Frame alpha; non-finite becomes opaque.
     */
    public static float alpha(float alpha) {
        return safe(alpha, 1f);
    }
}

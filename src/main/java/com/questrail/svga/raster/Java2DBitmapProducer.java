package com.questrail.svga.raster;

import com.questrail.svga.internal.keys.FallbackAsset;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Font;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.LinearGradientPaint;
import java.awt.RenderingHints;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;
import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;

import javax.imageio.ImageIO;

/**
 * Java2DBitmapProducer
 * =============================================================================
 * {@link BitmapProducer} backed by {@code java.awt} and {@code javax.imageio}.
 *
 * <p>Work runs on the supplied {@link Executor}. Output is always
 * {@link BufferedImage#TYPE_INT_ARGB} encoded as PNG.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does not own or shut down the executor.</p>
 *
 * <h2>Shine rasters</h2>
 * <p>With content, the content's alpha is filled with a diagonal white and
 * pale-gold gradient and softened with a 2 px blur. Without content, the whole
 * box is filled with a paler gradient and a 4 px blur bloom is drawn over it.</p>
 */
public final class Java2DBitmapProducer implements BitmapProducer
{
    static final float[] SILHOUETTE_STOPS = {0f, 0.2f, 0.5f, 0.8f, 1f};
    static final Color[] SILHOUETTE_COLORS = {
            Color.WHITE, new Color(0xFFE082), Color.WHITE, new Color(0xFFE082), Color.WHITE};
    static final float SILHOUETTE_BLUR = 2f;

    static final float[] BLOCK_STOPS = {0f, 0.3f, 0.5f, 0.7f, 1f};
    static final Color[] BLOCK_COLORS = {
            Color.WHITE, new Color(0xFFF8E1), Color.WHITE, new Color(0xFFF8E1), Color.WHITE};
    static final float BLOCK_BLUR = 4f;

    /** Line height of rendered text relative to its font size. */
    static final float LINE_HEIGHT = 1.2f;

    private static final RenderingHints HINTS;
    static {
        RenderingHints hints = new RenderingHints(
                RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        hints.put(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        hints.put(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        hints.put(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        hints.put(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
        hints.put(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
        HINTS = hints;
    }

    private final Executor executor;

    public Java2DBitmapProducer(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Runs on the common fork-join pool.
     */
    public Java2DBitmapProducer() {
        this(ForkJoinPool.commonPool());
    }

    @Override
    public CompletableFuture<byte[]> transparent(int width, int height) {
        return async(() -> png(canvas(width, height)));
    }

    @Override
    public CompletableFuture<byte[]> renderText(TextStyle style, int width, int height) {
        Objects.requireNonNull(style, "style");
        return async(() -> png(drawText(style, width, height)));
    }

    @Override
    public CompletableFuture<byte[]> fitImage(byte[] image, int width, int height) {
        Objects.requireNonNull(image, "image");
        final byte[] input = image.clone();
        return async(() -> read(input)
                .map(source -> png(contain(source, width, height)))
                .orElseGet(FallbackAsset::png));
    }

    @Override
    public CompletableFuture<byte[]> shine(byte[] source, int width, int height) {
        if (source == null) {
            return async(() -> png(block(width, height)));
        }
        final byte[] input = source.clone();
        return async(() -> read(input)
                .map(content -> png(silhouette(content, width, height)))
                .orElseGet(FallbackAsset::png));
    }

    @Override
    public CompletableFuture<byte[]> normalize(byte[] image) {
        Objects.requireNonNull(image, "image");
        final byte[] input = image.clone();
        return async(() -> read(input)
                .map(source -> {
                    BufferedImage argb = canvas(source.getWidth(), source.getHeight());
                    Graphics2D g = argb.createGraphics();
                    try {
                        g.drawImage(source, 0, 0, null);
                    } finally {
                        g.dispose();
                    }
                    return png(argb);
                })
                .orElse(input));
    }

    /**
     * Size of the box that holds {@code style} unscaled: advance width plus
     * 4 px, and {@code 1.2 · fontSize} high, both rounded up.
     */
    public static Dimension measureText(TextStyle style) {
        final Font font = font(style);
        final FontRenderContext frc = new FontRenderContext(new AffineTransform(), true, true);
        final double advance = font.getStringBounds(style.text(), frc).getWidth();
        return new Dimension(
                (int) Math.ceil(advance + 4),
                (int) Math.ceil(style.fontSize() * LINE_HEIGHT));
    }

    // -------------------------------------------------------------------------
    // Drawing
    // -------------------------------------------------------------------------

    static BufferedImage drawText(TextStyle style, int width, int height) {
        final BufferedImage image = canvas(width, height);
        if (style.text().isEmpty()) {
            return image;
        }
        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHints(HINTS);
            final Font font = font(style);
            g.setFont(font);

            final FontRenderContext frc = g.getFontRenderContext();
            final Rectangle2D bounds = font.getStringBounds(style.text(), frc);
            final double textWidth = bounds.getWidth();
            final double textHeight = style.fontSize() * LINE_HEIGHT;
            final double fit = Math.min(1.0, Math.min(
                    textWidth > 0 ? image.getWidth() / textWidth : 1.0,
                    image.getHeight() / textHeight));

            g.translate(image.getWidth() / 2.0, image.getHeight() / 2.0);
            g.scale(fit, fit);

            final float halfHeight = (float) (textHeight / 2);
            if (style.isGradient()) {
                g.setPaint(new GradientPaint(0f, -halfHeight, style.color(),
                                             0f, halfHeight, style.gradientEnd()));
            } else {
                g.setPaint(style.color());
            }

            // centre on the midpoint between ascent and descent
            final LineMetrics metrics = font.getLineMetrics(style.text(), frc);
            final float baseline = (metrics.getAscent() - metrics.getDescent()) / 2f;
            g.drawString(style.text(), (float) (-textWidth / 2), baseline);
        } finally {
            g.dispose();
        }
        return image;
    }

    static BufferedImage contain(BufferedImage source, int width, int height) {
        final BufferedImage image = canvas(width, height);
        final int w = image.getWidth();
        final int h = image.getHeight();
        final double sourceRatio = (double) source.getWidth() / source.getHeight();
        final double targetRatio = (double) w / h;

        final double drawW;
        final double drawH;
        if (sourceRatio > targetRatio) {
            drawW = w;
            drawH = w / sourceRatio;
        } else {
            drawH = h;
            drawW = h * sourceRatio;
        }

        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHints(HINTS);
            g.translate((w - drawW) / 2, (h - drawH) / 2);
            g.scale(drawW / source.getWidth(), drawH / source.getHeight());
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return image;
    }

    static BufferedImage silhouette(BufferedImage content, int width, int height) {
        final BufferedImage tinted = canvas(width, height);
        final Graphics2D g = tinted.createGraphics();
        try {
            g.setRenderingHints(HINTS);
            g.drawImage(content, 0, 0, tinted.getWidth(), tinted.getHeight(), null);
            g.setComposite(AlphaComposite.SrcIn);
            g.setPaint(diagonal(tinted.getWidth(), tinted.getHeight(), SILHOUETTE_STOPS, SILHOUETTE_COLORS));
            g.fillRect(0, 0, tinted.getWidth(), tinted.getHeight());
        } finally {
            g.dispose();
        }
        return blur(tinted, SILHOUETTE_BLUR);
    }

    static BufferedImage block(int width, int height) {
        final BufferedImage image = canvas(width, height);
        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHints(HINTS);
            g.setPaint(diagonal(image.getWidth(), image.getHeight(), BLOCK_STOPS, BLOCK_COLORS));
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            // bloom: blurred copy over the sharp fill
            g.drawImage(blur(image, BLOCK_BLUR), 0, 0, null);
        } finally {
            g.dispose();
        }
        return image;
    }

    private static LinearGradientPaint diagonal(int width, int height, float[] stops, Color[] colors) {
        return new LinearGradientPaint(0f, 0f, width, height, stops, colors);
    }

    /**
     * Separable Gaussian blur with standard deviation {@code sigma}, done in
     * premultiplied space so transparent neighbours do not darken edges.
     *
     * <p>Pixels outside the image count as transparent: the source is padded
     * by the kernel radius, convolved with zero fill and cropped back, so the
     * border fades out like every other edge.</p>
     */
    static BufferedImage blur(BufferedImage source, float sigma) {
        final Kernel horizontal = gaussian(sigma, true);
        final Kernel vertical = gaussian(sigma, false);
        final int radius = horizontal.getXOrigin();

        final BufferedImage padded = new BufferedImage(
                source.getWidth() + radius * 2, source.getHeight() + radius * 2, BufferedImage.TYPE_INT_ARGB_PRE);
        final Graphics2D g = padded.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(source, radius, radius, null);
        } finally {
            g.dispose();
        }

        final BufferedImage pass = new ConvolveOp(horizontal, ConvolveOp.EDGE_ZERO_FILL, null).filter(padded, null);
        final BufferedImage done = new ConvolveOp(vertical, ConvolveOp.EDGE_ZERO_FILL, null).filter(pass, null);
        return copy(done.getSubimage(radius, radius, source.getWidth(), source.getHeight()), BufferedImage.TYPE_INT_ARGB);
    }

    static Kernel gaussian(float sigma, boolean horizontal) {
        final int radius = (int) Math.ceil(sigma * 3);
        final int size = radius * 2 + 1;
        final float[] weights = new float[size];
        float sum = 0f;
        for (int i = 0; i < size; i++) {
            final int d = i - radius;
            weights[i] = (float) Math.exp(-(d * d) / (2.0 * sigma * sigma));
            sum += weights[i];
        }
        for (int i = 0; i < size; i++) {
            weights[i] /= sum;
        }
        return horizontal ? new Kernel(size, 1, weights) : new Kernel(1, size, weights);
    }

    // -------------------------------------------------------------------------
    // Plumbing
    // -------------------------------------------------------------------------

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    private static Font font(TextStyle style) {
        return new Font(style.fontFamily(), Font.BOLD, 1).deriveFont(style.fontSize());
    }

    static BufferedImage canvas(int width, int height) {
        return new BufferedImage(Math.max(1, width), Math.max(1, height), BufferedImage.TYPE_INT_ARGB);
    }

    private static BufferedImage copy(BufferedImage source, int type) {
        final BufferedImage target = new BufferedImage(source.getWidth(), source.getHeight(), type);
        final Graphics2D g = target.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    static Optional<BufferedImage> read(byte[] bytes) {
        if (bytes.length == 0) {
            return Optional.empty();
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
                return Optional.empty();
            }
            return Optional.of(image);
        } catch (IOException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static byte[] png(BufferedImage image) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new IllegalStateException("PNG image writer not available");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}

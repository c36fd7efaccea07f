package com.questrail.svga.raster;

import com.questrail.svga.internal.keys.FallbackAsset;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Java2DBitmapProducerTest
 * -----------------------------------------------------------------------------
 * Runs the producer on the calling thread and inspects decoded output.
 */
final class Java2DBitmapProducerTest
{
    private final Java2DBitmapProducer producer = new Java2DBitmapProducer(Runnable::run);

    private static BufferedImage decode(byte[] png) throws IOException
    {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertNotNull(image, "output is not a readable image");
        return image;
    }

    private static byte[] solid(int width, int height, Color color, String format) throws IOException
    {
        int type = format.equals("png") ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage image = new BufferedImage(width, height, type);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertTrue(ImageIO.write(image, format, out));
        return out.toByteArray();
    }

    private static int alpha(BufferedImage image, int x, int y)
    {
        return image.getRGB(x, y) >>> 24;
    }

    @Test
    void transparentHasRequestedSizeAndNoInk() throws IOException
    {
        BufferedImage image = decode(producer.transparent(37, 12).join());

        assertEquals(37, image.getWidth());
        assertEquals(12, image.getHeight());
        assertTrue(image.getColorModel().hasAlpha());
        assertEquals(0, alpha(image, 0, 0));
        assertEquals(0, alpha(image, 36, 11));
    }

    @Test
    void nonPositiveSizesClampToOnePixel() throws IOException
    {
        BufferedImage image = decode(producer.transparent(0, -4).join());
        assertEquals(1, image.getWidth());
        assertEquals(1, image.getHeight());
    }

    @Test
    void pixelsRoundsUp()
    {
        assertEquals(101, BitmapProducer.pixels(100.2f));
        assertEquals(100, BitmapProducer.pixels(100f));
        assertEquals(1, BitmapProducer.pixels(0f));
        assertEquals(1, BitmapProducer.pixels(-3f));
        assertEquals(1, BitmapProducer.pixels(Float.NaN));
    }

    @Test
    void fitImageLetterboxesWideSource() throws IOException
    {
        byte[] wide = solid(200, 100, Color.RED, "png");

        BufferedImage fitted = decode(producer.fitImage(wide, 100, 100).join());

        assertEquals(100, fitted.getWidth());
        assertEquals(100, fitted.getHeight());
        // drawn 100x50, centred vertically
        assertEquals(0, alpha(fitted, 50, 5));
        assertEquals(255, alpha(fitted, 50, 50));
        assertEquals(0, alpha(fitted, 50, 94));
    }

    @Test
    void fitImageOfGarbageIsFallback()
    {
        byte[] out = producer.fitImage(new byte[] { 1, 2, 3 }, 10, 10).join();
        assertTrue(FallbackAsset.isFallback(out));
    }

    @Test
    void normalizeConvertsToArgbPng() throws IOException
    {
        byte[] jpeg = solid(8, 6, Color.BLUE, "jpg");

        byte[] png = producer.normalize(jpeg).join();
        BufferedImage image = decode(png);

        assertEquals((byte) 0x89, png[0]);
        assertEquals(8, image.getWidth());
        assertEquals(6, image.getHeight());
        assertTrue(image.getColorModel().hasAlpha());
        assertEquals(255, alpha(image, 3, 3));
    }

    @Test
    void normalizeKeepsUnreadableInput()
    {
        byte[] garbage = { 7, 7, 7 };
        assertArrayEquals(garbage, producer.normalize(garbage).join());
    }

    @Test
    void shineBlockFillsWholeBox() throws IOException
    {
        BufferedImage block = decode(producer.shine(null, 40, 20).join());

        assertEquals(40, block.getWidth());
        assertEquals(20, block.getHeight());
        assertTrue(alpha(block, 20, 10) > 250);
        // pale gold or white everywhere: red channel near saturation
        assertTrue(((block.getRGB(20, 10) >> 16) & 0xFF) > 240);
    }

    @Test
    void shineSilhouetteFollowsContentAlpha() throws IOException
    {
        BufferedImage content = new BufferedImage(40, 40, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = content.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, 20, 40);
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(content, "png", out);

        BufferedImage shine = decode(producer.shine(out.toByteArray(), 40, 40).join());

        // inside the content: opaque and tinted light, not black
        assertTrue(alpha(shine, 8, 20) > 200);
        assertTrue(((shine.getRGB(8, 20) >> 16) & 0xFF) > 200);
        // far from the content: still transparent
        assertEquals(0, alpha(shine, 34, 20));
    }

    @Test
    void shineOfGarbageIsFallback()
    {
        assertTrue(FallbackAsset.isFallback(producer.shine(new byte[] { 0 }, 5, 5).join()));
    }

    @Test
    void blurFadesTheImageBorder()
    {
        BufferedImage opaque = new BufferedImage(30, 30, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = opaque.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, 30, 30);
        } finally {
            g.dispose();
        }

        BufferedImage blurred = Java2DBitmapProducer.blur(opaque, 2f);

        assertEquals(30, blurred.getWidth());
        assertEquals(30, blurred.getHeight());
        assertTrue(alpha(blurred, 15, 15) >= 254);
        // one pixel in from the edge the kernel still reaches outside the image
        assertTrue(alpha(blurred, 1, 15) < 230);
        assertTrue(alpha(blurred, 15, 28) < 230);
        assertTrue(alpha(blurred, 0, 0) < 128);
        assertTrue(alpha(blurred, 0, 15) > alpha(blurred, 0, 0));
        // colour survives the fade because the blur runs premultiplied
        assertTrue(((blurred.getRGB(0, 0) >> 16) & 0xFF) > 240);
    }

    @Test
    void gaussianKernelIsNormalized()
    {
        float[] weights = Java2DBitmapProducer.gaussian(2f, true).getKernelData(null);

        assertEquals(13, weights.length);
        float sum = 0f;
        for (float w : weights) {
            sum += w;
        }
        assertEquals(1f, sum, 1e-5f);
        assertTrue(weights[6] > weights[0]);
    }

    @Test
    void textStyleHexColours()
    {
        assertEquals(new Color(0xFF, 0xE0, 0x82), TextStyle.hex("#FFE082"));
        assertEquals(Color.WHITE, TextStyle.hex("ffffff"));
        assertThrows(IllegalArgumentException.class, () -> TextStyle.hex("#FFF"));
        assertThrows(IllegalArgumentException.class, () -> TextStyle.hex("#GGGGGG"));
    }

    @Test
    void textStyleDefaults()
    {
        TextStyle style = TextStyle.solid("Hi", 24f, " ", Color.BLACK);
        assertEquals(TextStyle.DEFAULT_FONT_FAMILY, style.fontFamily());
        assertFalse(style.isGradient());
        assertTrue(TextStyle.gradient("Hi", 24f, "Serif", Color.RED, Color.BLUE).isGradient());
        assertThrows(IllegalArgumentException.class, () -> TextStyle.solid("Hi", 0f, null, Color.BLACK));
    }
}

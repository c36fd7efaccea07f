package com.questrail.svga.synth;

import com.questrail.svga.model.FrameEntity;
import com.questrail.svga.model.ImageAsset;
import com.questrail.svga.model.MovieParams;
import com.questrail.svga.model.RawImage;
import com.questrail.svga.model.SpriteEntity;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.raster.FakeBitmapProducer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.questrail.svga.raster.FakeBitmapProducer.marker;
import static com.questrail.svga.raster.FakeBitmapProducer.text;
import static org.junit.jupiter.api.Assertions.*;

/**
 * LayerSynthesizerTest
 * -----------------------------------------------------------------------------
 * Splicing synthesized layers into a document, with and without a bitmap
 * producer in the loop.
 */
final class LayerSynthesizerTest
{
    private static final byte[] MAIN = marker("main");
    private static final byte[] SHINE = marker("shine");

    private final LayerSynthesizer synthesizer = new LayerSynthesizer();
    private final FakeBitmapProducer producer = new FakeBitmapProducer();

    private static SvgaDocument base(int frames)
    {
        return new SvgaDocument("2.0", new MovieParams(300f, 400f, 20, frames),
                Map.of("bg", new RawImage(marker("bg"))),
                List.of(SpriteEntity.of("bg", List.of())),
                List.of());
    }

    private static SynthesisRequest.Builder request()
    {
        return SynthesisRequest.builder()
                .withRect(10f, 20f, 100.4f, 50f)
                .withKeyName("My Key!");
    }

    @Test
    void staticLayerAddsOneSpriteAndOneAsset()
    {
        SvgaDocument out = synthesizer.synthesize(base(10), request().build(), new LayerRasters(MAIN, null));

        assertEquals(List.of("bg", "My_Key_"), List.copyOf(out.images().keySet()));
        assertEquals(new RawImage(MAIN), out.images().get("My_Key_"));
        assertEquals(2, out.sprites().size());

        SpriteEntity sprite = out.sprites().get(1);
        assertEquals("My_Key_", sprite.imageKey());
        assertEquals(10, sprite.frames().size());
    }

    @Test
    void pulseWithTenFramesStaysWithinAmplitude()
    {
        SvgaDocument out = synthesizer.synthesize(base(10),
                request().withPresets(AnimationPreset.PULSE).build(), new LayerRasters(MAIN, null));

        List<FrameEntity> frames = out.sprites().get(1).frames();
        assertEquals(10, frames.size());
        assertEquals(1f, frames.get(0).transform().a());

        float max = 0f;
        for (FrameEntity frame : frames) {
            max = Math.max(max, frame.transform().a());
        }
        assertTrue(max <= 1.05f + 1e-6f);
        assertEquals(1 + 0.05 * Math.sin(2 * Math.PI * 0.2), max, 1e-4);
    }

    @Test
    void shineAddsThreeBandsAfterMainSprite()
    {
        SvgaDocument out = synthesizer.synthesize(base(10),
                request().withPresets(AnimationPreset.PULSE, AnimationPreset.SHINE).build(),
                new LayerRasters(MAIN, SHINE));

        assertEquals(List.of("bg", "My_Key_", "My_Key__shine"), List.copyOf(out.images().keySet()));
        assertEquals(new RawImage(SHINE), out.images().get("My_Key__shine"));

        List<SpriteEntity> sprites = out.sprites();
        assertEquals(5, sprites.size());
        assertEquals("My_Key_", sprites.get(1).imageKey());
        float[] alphas = { 0.3f, 0.9f, 0.3f };
        for (int i = 0; i < 3; i++) {
            SpriteEntity band = sprites.get(2 + i);
            assertEquals("My_Key__shine", band.imageKey());
            assertEquals(10, band.frames().size());
            assertEquals(alphas[i], band.frames().get(0).alpha());
            assertTrue(band.frames().get(0).hasClipPath());
        }
    }

    @Test
    void inputDocumentIsUntouched()
    {
        SvgaDocument input = base(10);
        Map<String, ImageAsset> imagesBefore = input.images();
        List<SpriteEntity> spritesBefore = input.sprites();

        SvgaDocument out = synthesizer.synthesize(input,
                request().withPresets(AnimationPreset.SHINE).build(), new LayerRasters(MAIN, SHINE));

        assertNotSame(input, out);
        assertEquals(1, input.images().size());
        assertEquals(1, input.sprites().size());
        assertSame(imagesBefore, input.images());
        assertSame(spritesBefore, input.sprites());
        assertNotSame(input.images(), out.images());
    }

    @Test
    void zeroFrameMovieGetsEmptyTracks()
    {
        SvgaDocument out = synthesizer.synthesize(base(0),
                request().withPresets(AnimationPreset.SHINE).build(), new LayerRasters(MAIN, SHINE));

        assertEquals(5, out.sprites().size());
        for (SpriteEntity sprite : out.sprites()) {
            assertTrue(sprite.frames().isEmpty());
        }
    }

    @Test
    void shineWithoutShineRasterIsRejected()
    {
        SynthesisRequest shine = request().withPresets(AnimationPreset.SHINE).build();
        assertThrows(IllegalArgumentException.class,
                () -> synthesizer.synthesize(base(10), shine, new LayerRasters(MAIN, null)));
    }

    @Test
    void sameKeyTwiceReplacesAssetAndKeepsBothSprites()
    {
        SvgaDocument once = synthesizer.synthesize(base(4), request().build(), new LayerRasters(MAIN, null));
        SvgaDocument twice = synthesizer.synthesize(once, request().build(), new LayerRasters(marker("v2"), null));

        assertEquals(2, twice.images().size());
        assertEquals(new RawImage(marker("v2")), twice.images().get("My_Key_"));
        assertEquals(3, twice.sprites().size());
    }

    @Test
    void keyLayerGetsTransparentRasterOfCeiledSize()
    {
        SvgaDocument out = synthesizer.synthesize(base(10), request().build(), producer).join();

        assertEquals(List.of("transparent:101x50"), producer.calls());
        assertEquals("transparent:101x50", text(((RawImage) out.images().get("My_Key_")).bytes()));
    }

    @Test
    void keyLayerShineUsesBlock()
    {
        synthesizer.synthesize(base(10), request().withPresets(AnimationPreset.SHINE).build(), producer).join();

        assertTrue(producer.calls().contains("shine:block:101x50"));
    }

    @Test
    void contentLayerShineUsesSilhouette()
    {
        SvgaDocument out = synthesizer.synthesize(base(10),
                request().withRaster(marker("content")).withPresets(AnimationPreset.SHINE).build(),
                producer).join();

        assertEquals(List.of("shine:content:101x50"), producer.calls());
        assertEquals("content", text(((RawImage) out.images().get("My_Key_")).bytes()));
        assertEquals("shine:content:101x50", text(((RawImage) out.images().get("My_Key__shine")).bytes()));
    }

    @Test
    void emptyCallerRasterIsKeptButShineFallsBackToBlock()
    {
        SvgaDocument out = synthesizer.synthesize(base(10),
                request().withRaster(new byte[0]).withPresets(AnimationPreset.SHINE).build(),
                producer).join();

        assertEquals(List.of("shine:block:101x50"), producer.calls());
        assertTrue(((RawImage) out.images().get("My_Key_")).isEmpty());
    }
}

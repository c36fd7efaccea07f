package com.questrail.svga.internal.keys;

import com.questrail.svga.model.Base64Image;
import com.questrail.svga.model.ImageAsset;
import com.questrail.svga.model.RawImage;
import com.questrail.svga.observability.RecordingObservabilitySink;
import com.questrail.svga.observability.RepairKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class KeyRegistryTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void sanitizeReplacesEveryUnsafeCharacter() {
        assertEquals("My_Key_", KeyRegistry.sanitize("My Key!"));
        assertEquals("a-b_c9", KeyRegistry.sanitize("a-b_c9"));
        assertEquals("___", KeyRegistry.sanitize("中文."));
        assertEquals("", KeyRegistry.sanitize(null));
        assertEquals("", KeyRegistry.sanitize(""));
    }

    @Test
    void registeredKeysResolveWithoutRepair() {
        KeyRegistry registry = KeyRegistry.register(Map.of("img 1", new Base64Image("AQID")), sink);

        assertEquals("img_1", registry.resolve("img 1", "sprite #0"));
        assertEquals("img_1", registry.resolve("img_1", "sprite #1"));
        assertTrue(sink.getRepairs().isEmpty());
        assertArrayEquals(new byte[] { 1, 2, 3 }, ((RawImage) registry.assets().get("img_1")).bytes());
    }

    @Test
    void danglingReferenceGetsFallbackOnce() {
        KeyRegistry registry = KeyRegistry.register(Map.of(), sink);

        assertEquals("ghost", registry.resolve("ghost", "sprite #0"));
        assertEquals("ghost", registry.resolve("ghost", "sprite #1"));

        assertTrue(FallbackAsset.isFallback(((RawImage) registry.assets().get("ghost")).bytes()));
        assertEquals(1, sink.getRepairs(RepairKind.INVALID_REFERENCE).size());
    }

    @Test
    void emptyReferenceStaysEmpty() {
        KeyRegistry registry = KeyRegistry.register(Map.of(), sink);

        assertEquals("", registry.resolve("", "sprite #0"));
        assertEquals("", registry.resolve(null, "sprite #0"));
        assertTrue(registry.assets().isEmpty());
        assertTrue(sink.getRepairs().isEmpty());
    }

    @Test
    void collisionsAreSuffixed() {
        Map<String, ImageAsset> images = new LinkedHashMap<>();
        images.put("x.1", new RawImage(new byte[] { 1 }));
        images.put("x 1", new RawImage(new byte[] { 2 }));
        images.put("x/1", new RawImage(new byte[] { 3 }));

        KeyRegistry registry = KeyRegistry.register(images, sink);

        assertEquals(List.of("x_1", "x_1_2", "x_1_3"), List.copyOf(registry.assets().keySet()));
        assertEquals("x_1_2", registry.remap("x 1"));
        assertEquals("x_1_3", registry.remap("x/1"));
        assertEquals(2, sink.getRepairs(RepairKind.KEY_COLLISION).size());
    }

    @Test
    void remapNeverInsertsAssets() {
        KeyRegistry registry = KeyRegistry.register(Map.of(), sink);

        assertEquals("song_mp3", registry.remap("song.mp3"));
        assertTrue(registry.assets().isEmpty());
    }

    @Test
    void fallbackPngIsOnePixelPng() {
        byte[] png = FallbackAsset.png();

        assertEquals((byte) 0x89, png[0]);
        assertEquals('P', png[1]);
        assertEquals(1, png[19]);
        assertEquals(1, png[23]);
        png[0] = 0;
        assertTrue(FallbackAsset.isFallback(FallbackAsset.png()));
    }

    @Test
    void imageAssetsDecodeVariants() {
        assertArrayEquals(new byte[] { 1, 2, 3 }, ImageAssets.bytes(new Base64Image("AQID")).orElseThrow());
        assertArrayEquals(new byte[] { 1, 2, 3 },
                ImageAssets.bytes(new Base64Image("data:image/png;base64,AQID")).orElseThrow());
        assertTrue(ImageAssets.bytes(new Base64Image("")).isEmpty());
        assertTrue(ImageAssets.bytes(new Base64Image("%%%")).isEmpty());
        assertTrue(ImageAssets.bytes(new RawImage(new byte[0])).isEmpty());
    }

    @Test
    void lineWrappedBase64IsDecoded() {
        byte[] png = FallbackAsset.png();
        String wrapped = Base64.getMimeEncoder(8, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(png);
        assertTrue(wrapped.contains("\n"));

        assertArrayEquals(png, ImageAssets.bytes(new Base64Image(wrapped)).orElseThrow());
        assertArrayEquals(png, ImageAssets.bytes(new Base64Image(wrapped.replace("\n", "\r\n"))).orElseThrow());
        assertArrayEquals(new byte[] { 1, 2, 3 },
                ImageAssets.bytes(new Base64Image("data:image/png;base64, AQ\n ID\t")).orElseThrow());
        assertTrue(ImageAssets.bytes(new Base64Image("AQ%ID")).isEmpty());
        assertTrue(ImageAssets.bytes(new Base64Image(" \n\t ")).isEmpty());
    }

    @Test
    void lineWrappedAssetKeepsItsBytesThroughKeyRepair() {
        byte[] png = FallbackAsset.png();
        String wrapped = Base64.getMimeEncoder(16, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(png);
        Map<String, ImageAsset> images = new LinkedHashMap<>();
        images.put("wrapped", new Base64Image(wrapped));

        KeyRegistry registry = KeyRegistry.register(images, sink);

        assertArrayEquals(png, ((RawImage) registry.assets().get("wrapped")).bytes());
        assertTrue(sink.getRepairs(RepairKind.INVALID_RASTER_DATA).isEmpty());
    }
}

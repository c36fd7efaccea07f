package com.questrail.svga.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SvgaDocumentTest {

    @Test
    void containersAreCopiedOnConstruction() {
        Map<String, ImageAsset> images = new LinkedHashMap<>();
        images.put("a", new Base64Image("AQID"));
        List<SpriteEntity> sprites = new ArrayList<>();
        sprites.add(SpriteEntity.of("a", List.of()));

        SvgaDocument doc = new SvgaDocument("2.0", MovieParams.EMPTY, images, sprites, null);
        images.put("b", new Base64Image("AQID"));
        sprites.clear();

        assertEquals(1, doc.images().size());
        assertEquals(1, doc.sprites().size());
        assertTrue(doc.audios().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> doc.images().put("c", new Base64Image("")));
    }

    @Test
    void withLayersAppendsAndOverrides() {
        SvgaDocument doc = new SvgaDocument("2.0", new MovieParams(1f, 1f, 20, 3),
                Map.of("a", new Base64Image("AQID")), List.of(SpriteEntity.of("a", List.of())), List.of());

        SvgaDocument next = doc.withLayers(
                Map.of("a", new RawImage(new byte[] { 5 }), "b", new RawImage(new byte[] { 6 })),
                List.of(SpriteEntity.of("b", List.of())));

        assertEquals(new RawImage(new byte[] { 5 }), next.images().get("a"));
        assertEquals(2, next.images().size());
        assertEquals(List.of("a", "b"), next.sprites().stream().map(SpriteEntity::imageKey).toList());
        assertEquals(new Base64Image("AQID"), doc.images().get("a"));
        assertEquals(1, doc.sprites().size());
    }

    @Test
    void totalFramesIsNeverNegative() {
        assertEquals(0, SvgaDocument.empty(new MovieParams(1f, 1f, 20, -3)).totalFrames());
        assertEquals(7, SvgaDocument.empty(new MovieParams(1f, 1f, 20, 7)).totalFrames());
    }

    @Test
    void frameDefaults() {
        FrameEntity frame = new FrameEntity(1f, null, null, null, null);

        assertEquals(Layout.ZERO, frame.layout());
        assertEquals(Transform.IDENTITY, frame.transform());
        assertFalse(frame.hasClipPath());
        assertTrue(frame.shapes().isEmpty());
    }

    @Test
    void rawImageComparesByContent() {
        byte[] bytes = { 1, 2, 3 };
        RawImage image = new RawImage(bytes);
        bytes[0] = 9;

        assertEquals(new RawImage(new byte[] { 1, 2, 3 }), image);
        assertEquals(3, image.length());
        assertEquals("AQID", Base64Image.encode(image.bytes()).base64());
    }

    @Test
    void enumsMapWireValues() {
        assertEquals(ShapeType.KEEP, ShapeType.fromWire(3));
        assertEquals(2, LineJoin.BEVEL.wireValue());
        assertEquals(LineCap.SQUARE, LineCap.fromWire(2));
    }
}

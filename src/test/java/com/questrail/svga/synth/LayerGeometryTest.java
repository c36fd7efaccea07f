package com.questrail.svga.synth;

import com.questrail.svga.model.FrameEntity;
import com.questrail.svga.model.Layout;
import com.questrail.svga.model.Transform;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LayerGeometryTest
 * -----------------------------------------------------------------------------
 * Keyframe math for the main track and the shine bands.
 */
final class LayerGeometryTest
{
    private static final double DELTA = 1e-4;
    private static final TargetRect RECT = new TargetRect(10f, 20f, 100f, 50f);

    @Test
    void pulseScalesAboutCentre()
    {
        List<FrameEntity> frames = LayerGeometry.mainTrack(
                RECT, EnumSet.of(AnimationPreset.PULSE), AnimationConfig.DEFAULT, 4);

        assertEquals(4, frames.size());
        assertEquals(new Transform(1f, 0f, 0f, 1f, 10f, 20f), frames.get(0).transform());

        // i = 1 of 4 is a quarter turn: sin = 1
        Transform peak = frames.get(1).transform();
        assertEquals(1.05, peak.a(), DELTA);
        assertEquals(1.05, peak.d(), DELTA);
        assertEquals(0f, peak.b());
        assertEquals(7.5, peak.tx(), DELTA);
        assertEquals(18.75, peak.ty(), DELTA);

        Transform trough = frames.get(3).transform();
        assertEquals(0.95, trough.a(), DELTA);
    }

    @Test
    void floatMovesVertically()
    {
        List<FrameEntity> frames = LayerGeometry.mainTrack(
                RECT, EnumSet.of(AnimationPreset.FLOAT), new AnimationConfig(1f, 2f), 4);

        Transform peak = frames.get(1).transform();
        assertEquals(1f, peak.a());
        assertEquals(10f, peak.tx(), DELTA);
        assertEquals(32f, peak.ty(), DELTA);
        assertEquals(Layout.ofSize(100f, 50f), frames.get(1).layout());
        assertEquals(1f, frames.get(1).alpha());
    }

    @Test
    void presetsCombine()
    {
        List<FrameEntity> frames = LayerGeometry.mainTrack(
                RECT, EnumSet.of(AnimationPreset.PULSE, AnimationPreset.FLOAT), AnimationConfig.DEFAULT, 4);

        Transform peak = frames.get(1).transform();
        assertEquals(1.05, peak.a(), DELTA);
        assertEquals(18.75 + 6.0, peak.ty(), DELTA);
    }

    @Test
    void cyclesRepeatTheMotion()
    {
        List<FrameEntity> frames = LayerGeometry.mainTrack(
                RECT, EnumSet.of(AnimationPreset.PULSE), new AnimationConfig(2f, 1f), 8);

        assertEquals(frames.get(1).transform().a(), frames.get(5).transform().a(), 1e-6);
        assertEquals(1.05, frames.get(1).transform().a(), DELTA);
    }

    @Test
    void staticLayerHoldsPlacement()
    {
        List<FrameEntity> frames = LayerGeometry.mainTrack(RECT, Set.of(), AnimationConfig.DEFAULT, 3);

        for (FrameEntity frame : frames) {
            assertEquals(new Transform(1f, 0f, 0f, 1f, 10f, 20f), frame.transform());
            assertFalse(frame.hasClipPath());
        }
    }

    @Test
    void degenerateRectProducesInvisibleFrames()
    {
        List<FrameEntity> frames = LayerGeometry.mainTrack(
                new TargetRect(5f, 5f, 0f, 30f), EnumSet.of(AnimationPreset.PULSE), AnimationConfig.DEFAULT, 5);

        assertEquals(5, frames.size());
        for (FrameEntity frame : frames) {
            assertEquals(0f, frame.alpha());
            assertEquals(Layout.ZERO, frame.layout());
            assertEquals(Transform.IDENTITY, frame.transform());
        }
    }

    @Test
    void zeroFramesGivesEmptyTracks()
    {
        assertTrue(LayerGeometry.mainTrack(RECT, Set.of(), AnimationConfig.DEFAULT, 0).isEmpty());
        assertTrue(LayerGeometry.shineTrack(RECT, ShineBand.CENTER, AnimationConfig.DEFAULT, 0).isEmpty());
    }

    @Test
    void shineFramesArePlacedAtRect()
    {
        List<FrameEntity> frames = LayerGeometry.shineTrack(RECT, ShineBand.LEADING, AnimationConfig.DEFAULT, 10);

        assertEquals(10, frames.size());
        for (FrameEntity frame : frames) {
            assertEquals(0.3f, frame.alpha());
            assertEquals(Layout.ofSize(100f, 50f), frame.layout());
            assertEquals(new Transform(1f, 0f, 0f, 1f, 10f, 20f), frame.transform());
            assertTrue(frame.hasClipPath());
        }
    }

    @Test
    void shineBandStartsFullyLeftOfRect()
    {
        FrameEntity first = LayerGeometry.shineTrack(RECT, ShineBand.CENTER, AnimationConfig.DEFAULT, 10).get(0);
        double[] x = clipXs(first.clipPath());

        double xOffset = 50 * Math.tan(Math.toRadians(30));
        double cx = -40 - xOffset;
        assertEquals(cx + xOffset - 20, x[0], DELTA);
        assertEquals(cx + xOffset + 20, x[1], DELTA);
        assertEquals(cx - xOffset + 20, x[2], DELTA);
        assertEquals(cx - xOffset - 20, x[3], DELTA);
        // the whole parallelogram is left of the rectangle
        for (double v : x) {
            assertTrue(v < 0);
        }
    }

    @Test
    void shineBandsAreOffsetByFivePercentOfWidth()
    {
        double leading = clipXs(LayerGeometry.shineTrack(RECT, ShineBand.LEADING, AnimationConfig.DEFAULT, 10)
                .get(3).clipPath())[0];
        double center = clipXs(LayerGeometry.shineTrack(RECT, ShineBand.CENTER, AnimationConfig.DEFAULT, 10)
                .get(3).clipPath())[0];
        double trailing = clipXs(LayerGeometry.shineTrack(RECT, ShineBand.TRAILING, AnimationConfig.DEFAULT, 10)
                .get(3).clipPath())[0];

        assertEquals(-5.0, leading - center, DELTA);
        assertEquals(5.0, trailing - center, DELTA);
    }

    @Test
    void shineSweepsLeftToRight()
    {
        List<FrameEntity> frames = LayerGeometry.shineTrack(RECT, ShineBand.CENTER, AnimationConfig.DEFAULT, 10);

        double previous = Double.NEGATIVE_INFINITY;
        for (FrameEntity frame : frames) {
            double x1 = clipXs(frame.clipPath())[0];
            assertTrue(x1 > previous);
            previous = x1;
        }
    }

    @Test
    void intensityWidensBand()
    {
        double[] x = clipXs(LayerGeometry.shineTrack(RECT, ShineBand.CENTER, new AnimationConfig(1f, 0.5f), 10)
                .get(0).clipPath());
        assertEquals(20.0, x[1] - x[0], DELTA);
    }

    @Test
    void clipPathShape()
    {
        String path = LayerGeometry.bandClipPath(50, 10, 20, 40);
        assertEquals("M 50 0 L 70 0 L 50 40 L 30 40 Z", path);
    }

    @Test
    void numbersAreShortestPlainDecimals()
    {
        assertEquals("100", LayerGeometry.number(100.0));
        assertEquals("0.5", LayerGeometry.number(0.5));
        assertEquals("-12.25", LayerGeometry.number(-12.25));
        assertEquals("0.0000001", LayerGeometry.number(1e-7));
        assertEquals("0", LayerGeometry.number(Double.NaN));
    }

    /** x coordinates of the four clip-path vertices, in path order. */
    private static double[] clipXs(String path)
    {
        String[] t = path.split(" ");
        assertEquals("M", t[0]);
        assertEquals("Z", t[12]);
        return new double[] {
                Double.parseDouble(t[1]),
                Double.parseDouble(t[4]),
                Double.parseDouble(t[7]),
                Double.parseDouble(t[10])
        };
    }
}

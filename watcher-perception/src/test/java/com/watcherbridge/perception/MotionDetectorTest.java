package com.watcherbridge.perception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MotionDetectorTest {

    private MotionDetector detector;

    @BeforeEach
    void setUp() {
        detector = new MotionDetector(0.05);
    }

    @Test
    void detect_firstFrame_isNeverMotion() throws IOException {
        assertFalse(detector.detect(png(32, 32, Color.WHITE, 0)));
    }

    @Test
    void detect_identicalFrames_noMotion() throws IOException {
        byte[] frame = png(32, 32, Color.GRAY, 0);
        detector.detect(frame);
        assertFalse(detector.detect(frame));
    }

    @Test
    void detect_largeChange_isMotion() throws IOException {
        detector.detect(png(32, 32, Color.BLACK, 0));
        assertTrue(detector.detect(png(32, 32, Color.WHITE, 0)));
    }

    @Test
    void detect_smallPatchBelowThreshold_noMotion() throws IOException {
        detector.detect(png(40, 40, Color.BLACK, 0));
        // 4x4 white patch: 16 of 1600 pixels = 1%
        assertFalse(detector.detect(png(40, 40, Color.BLACK, 4)));
    }

    @Test
    void detect_patchAboveThreshold_isMotion() throws IOException {
        detector.detect(png(40, 40, Color.BLACK, 0));
        // 20x20 patch = 25%
        assertTrue(detector.detect(png(40, 40, Color.BLACK, 20)));
    }

    @Test
    void detect_differentSizes_previousIsRescaled() throws IOException {
        detector.detect(png(64, 64, Color.DARK_GRAY, 0));
        assertFalse(detector.detect(png(32, 32, Color.DARK_GRAY, 0)));
        assertTrue(detector.detect(png(16, 16, Color.WHITE, 0)));
    }

    @Test
    void detect_undecodableFrame_noMotionAndBecomesReference() throws IOException {
        detector.detect(png(16, 16, Color.BLACK, 0));
        assertFalse(detector.detect(new byte[]{1, 2, 3}));
        // the garbage frame is now the reference, so the next call cannot compare either
        assertFalse(detector.detect(png(16, 16, Color.WHITE, 0)));
    }

    @Test
    void detect_callerReusingItsBuffer_doesNotAlterReference() throws IOException {
        byte[] buffer = png(16, 16, Color.BLACK, 0);
        detector.detect(buffer);
        Arrays.fill(buffer, (byte) 0);

        assertTrue(detector.detect(png(16, 16, Color.WHITE, 0)));
    }

    @Test
    void setThreshold_isClamped() {
        detector.setThreshold(4.0);
        assertEquals(1.0, detector.getThreshold());
        detector.setThreshold(-1);
        assertEquals(0.0, detector.getThreshold());
    }

    private static byte[] png(int w, int h, Color background, int whitePatch) throws IOException {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(background);
        g.fillRect(0, 0, w, h);
        if (whitePatch > 0) {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, whitePatch, whitePatch);
        }
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }
}

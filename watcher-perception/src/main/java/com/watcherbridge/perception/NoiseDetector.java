package com.watcherbridge.perception;

import lombok.extern.slf4j.Slf4j;

/**
 * RMS loudness heuristic over 16-bit signed little-endian PCM.
 */
@Slf4j
public class NoiseDetector {

    private volatile double threshold;

    public NoiseDetector(double threshold) {
        setThreshold(threshold);
    }

    /**
     * @return {@code true} when the buffer's RMS exceeds the threshold;
     *         {@code false} for buffers shorter than one sample
     */
    public boolean detect(byte[] pcm) {
        if (pcm == null || pcm.length < 2) {
            return false;
        }
        double rms = rms(pcm);
        boolean noise = rms > threshold;
        if (noise) {
            log.debug("Noise detected: RMS={}", String.format("%.2f", rms));
        }
        return noise;
    }

    /**
     * Root mean square of the samples. A trailing odd byte is ignored.
     */
    public static double rms(byte[] pcm) {
        int samples = pcm.length / 2;
        if (samples == 0) {
            return 0.0;
        }
        double sumSquares = 0;
        for (int i = 0; i < samples; i++) {
            short s = (short) ((pcm[2 * i] & 0xFF) | (pcm[2 * i + 1] << 8));
            sumSquares += (double) s * s;
        }
        return Math.sqrt(sumSquares / samples);
    }

    public double getThreshold() {
        return threshold;
    }

    /** Negative thresholds are clamped to zero. */
    public void setThreshold(double threshold) {
        this.threshold = Math.max(0.0, threshold);
    }
}

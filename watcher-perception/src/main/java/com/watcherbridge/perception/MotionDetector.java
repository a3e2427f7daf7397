package com.watcherbridge.perception;

import lombok.extern.slf4j.Slf4j;

/**
 * Frame-difference motion heuristic.
 * <p>
 * Keeps a private copy of the previous frame and replaces it after every
 * call, whatever the outcome. Not thread-safe; the owner calls it from a single thread.
 */
@Slf4j
public class MotionDetector {

    /** Luminance delta above which a pixel counts as changed. */
    public static final int PIXEL_CHANGE_THRESHOLD = 25;

    private byte[] previousFrame;
    private volatile double threshold;

    public MotionDetector(double threshold) {
        setThreshold(threshold);
    }

    /**
     * Compare {@code currentFrame} with the previous one.
     *
     * @return {@code true} when the changed-pixel ratio exceeds the threshold;
     *         always {@code false} for the first frame or an undecodable one
     */
    public boolean detect(byte[] currentFrame) {
        byte[] previous = previousFrame;
        previousFrame = currentFrame != null ? currentFrame.clone() : null;
        if (previous == null) {
            return false;
        }
        try {
            GreyFrame current = GreyFrame.decode(currentFrame);
            GreyFrame last = GreyFrame.decode(previous);
            if (current == null || last == null) {
                log.debug("Motion detection skipped: frame could not be decoded");
                return false;
            }
            last = last.resizeTo(current.width(), current.height());

            double ratio = current.changedRatio(last, PIXEL_CHANGE_THRESHOLD);
            boolean motion = ratio > threshold;
            if (motion) {
                log.debug("Motion detected: {}% pixels changed", String.format("%.2f", ratio * 100));
            }
            return motion;
        } catch (Exception e) {
            log.error("Motion detection error: {}", e.getMessage());
            return false;
        }
    }

    /** Forget the reference frame; the next call is treated as the first. */
    public void reset() {
        previousFrame = null;
    }

    public double getThreshold() {
        return threshold;
    }

    /** Threshold is clamped to [0, 1]. */
    public void setThreshold(double threshold) {
        this.threshold = Math.max(0.0, Math.min(1.0, threshold));
    }
}

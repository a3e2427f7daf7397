package com.watcherbridge.perception;

import com.watcherbridge.common.collab.VisionResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Perception state and heuristics for one device: motion and noise detectors,
 * the scene analyzer, and the monitoring and force-next-analysis flags.
 * <p>
 * Frame handling is confined to the gateway lane; flags are volatile so
 * health reporting may read them from elsewhere.
 */
public class PerceptionPipeline {

    private final MotionDetector motion;
    private final NoiseDetector noise;
    private final SceneAnalyzer scene;

    private volatile boolean monitoringEnabled;
    private volatile boolean forceNextAnalysis;

    public PerceptionPipeline(MotionDetector motion, NoiseDetector noise, SceneAnalyzer scene) {
        this.motion = motion;
        this.noise = noise;
        this.scene = scene;
    }

    public boolean detectMotion(byte[] frame) {
        return motion.detect(frame);
    }

    public boolean detectNoise(byte[] pcm) {
        return noise.detect(pcm);
    }

    public CompletableFuture<Optional<VisionResult>> analyzeScene(byte[] frame, String prompt, boolean force) {
        return scene.analyze(frame, prompt, force);
    }

    public CompletableFuture<Optional<VisionResult>> describeImage(byte[] image, String question) {
        return scene.describe(image, question);
    }

    /** Make the next image go to scene analysis regardless of motion or throttle. */
    public void requestForcedAnalysis() {
        forceNextAnalysis = true;
    }

    /**
     * @return whether a forced analysis was pending; the request is cleared
     */
    public boolean consumeForcedAnalysis() {
        boolean pending = forceNextAnalysis;
        forceNextAnalysis = false;
        return pending;
    }

    public boolean isForcedAnalysisPending() {
        return forceNextAnalysis;
    }

    public boolean isMonitoringEnabled() {
        return monitoringEnabled;
    }

    public void setMonitoringEnabled(boolean monitoringEnabled) {
        this.monitoringEnabled = monitoringEnabled;
    }

    public void setMotionThreshold(double threshold) {
        motion.setThreshold(threshold);
    }

    public double getMotionThreshold() {
        return motion.getThreshold();
    }

    public void setNoiseThreshold(double threshold) {
        noise.setThreshold(threshold);
    }

    public double getNoiseThreshold() {
        return noise.getThreshold();
    }

    public SceneAnalyzer getSceneAnalyzer() {
        return scene;
    }
}

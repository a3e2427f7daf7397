package com.watcherbridge.perception;

import com.watcherbridge.common.collab.VisionProvider;
import com.watcherbridge.common.collab.VisionResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Throttled front end to the vision backend.
 * <p>
 * The throttle slot is taken when a call is admitted, so two overlapping
 * non-forced calls cannot both reach the backend. A failed call gives the
 * slot back. Successful analyses are stored in the {@link SnapshotStore}.
 */
@Slf4j
public class SceneAnalyzer {

    public static final Duration MIN_INTERVAL = Duration.ofSeconds(30);
    public static final String DEFAULT_PROMPT =
            "Describe what you see in this image. Focus on any people, animals, or unusual activity.";

    private static final long NEVER = Long.MIN_VALUE;

    private final VisionProvider vision;
    private final SnapshotStore snapshots;
    private final Clock clock;
    private final Executor executor;
    private final AtomicLong lastAnalysisAt = new AtomicLong(NEVER);

    public SceneAnalyzer(VisionProvider vision, SnapshotStore snapshots, Clock clock, Executor executor) {
        this.vision = vision;
        this.snapshots = snapshots;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Describe a frame.
     *
     * @param prompt question for the backend; blank means {@link #DEFAULT_PROMPT}
     * @param force  bypass the throttle
     * @return empty when throttled or when the backend failed; never completes exceptionally
     */
    public CompletableFuture<Optional<VisionResult>> analyze(byte[] image, String prompt, boolean force) {
        long now = clock.millis();
        long previous = lastAnalysisAt.get();
        if (!force) {
            boolean throttled = previous != NEVER && now - previous < MIN_INTERVAL.toMillis();
            if (throttled || !lastAnalysisAt.compareAndSet(previous, now)) {
                log.debug("Vision analysis rate limited");
                return CompletableFuture.completedFuture(Optional.empty());
            }
        } else {
            lastAnalysisAt.set(now);
        }

        String effectivePrompt = prompt == null || prompt.isBlank() ? DEFAULT_PROMPT : prompt;
        return CompletableFuture.supplyAsync(() -> {
            try {
                VisionResult result = vision.analyze(image, effectivePrompt);
                log.info("Vision analysis: confidence={}", String.format("%.2f", result.confidence()));
                snapshots.save(image);
                return Optional.of(result);
            } catch (RuntimeException e) {
                log.error("Vision analysis error: {}", e.getMessage());
                lastAnalysisAt.compareAndSet(now, previous);
                return Optional.<VisionResult>empty();
            }
        }, executor);
    }

    /**
     * Answer a one-off question about an image the device uploaded. Not
     * throttled, not counted against the throttle and not stored.
     *
     * @return empty when the backend failed; never completes exceptionally
     */
    public CompletableFuture<Optional<VisionResult>> describe(byte[] image, String question) {
        String effectivePrompt = question == null || question.isBlank() ? DEFAULT_PROMPT : question;
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Optional.of(vision.analyze(image, effectivePrompt));
            } catch (RuntimeException e) {
                log.warn("Vision description failed: {}", e.getMessage());
                return Optional.<VisionResult>empty();
            }
        }, executor);
    }

    /**
     * @return epoch millis of the last admitted analysis, or empty if none
     */
    public Optional<Long> getLastAnalysisAt() {
        long at = lastAnalysisAt.get();
        return at == NEVER ? Optional.empty() : Optional.of(at);
    }
}

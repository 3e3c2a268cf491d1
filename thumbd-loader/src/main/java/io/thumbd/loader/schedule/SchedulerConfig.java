package io.thumbd.loader.schedule;

import java.time.Duration;
import java.util.Objects;

public record SchedulerConfig(
    Duration preloadInitialDelay,
    Duration preloadMinDelay,
    Duration preloadMaxDelay,
    Duration preloadDelayIncrease,
    Duration preloadDelayDecrease,
    Duration variantDelay,
    int variantBatchSize,
    Duration controllerInterval,
    double emaAlpha
) {

    public static final Duration DEFAULT_PRELOAD_INITIAL_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_PRELOAD_MIN_DELAY = Duration.ofMillis(250);
    public static final Duration DEFAULT_PRELOAD_MAX_DELAY = Duration.ofMillis(1400);
    public static final Duration DEFAULT_PRELOAD_DELAY_INCREASE = Duration.ofMillis(200);
    public static final Duration DEFAULT_PRELOAD_DELAY_DECREASE = Duration.ofMillis(100);
    public static final Duration DEFAULT_VARIANT_DELAY = Duration.ofMillis(200);
    public static final int DEFAULT_VARIANT_BATCH_SIZE = 4;
    public static final Duration DEFAULT_CONTROLLER_INTERVAL = Duration.ofMillis(500);
    public static final double DEFAULT_EMA_ALPHA = 0.2;

    public SchedulerConfig {
        Objects.requireNonNull(preloadInitialDelay, "preloadInitialDelay");
        Objects.requireNonNull(preloadMinDelay, "preloadMinDelay");
        Objects.requireNonNull(preloadMaxDelay, "preloadMaxDelay");
        Objects.requireNonNull(preloadDelayIncrease, "preloadDelayIncrease");
        Objects.requireNonNull(preloadDelayDecrease, "preloadDelayDecrease");
        Objects.requireNonNull(variantDelay, "variantDelay");
        Objects.requireNonNull(controllerInterval, "controllerInterval");
        if (preloadMinDelay.isNegative() || preloadMinDelay.compareTo(preloadMaxDelay) > 0) {
            throw new IllegalArgumentException("preloadMinDelay must be in [0, preloadMaxDelay]");
        }
        if (preloadInitialDelay.compareTo(preloadMinDelay) < 0
            || preloadInitialDelay.compareTo(preloadMaxDelay) > 0) {
            throw new IllegalArgumentException("preloadInitialDelay must be within [preloadMinDelay, preloadMaxDelay]");
        }
        if (preloadDelayIncrease.isNegative() || preloadDelayDecrease.isNegative()) {
            throw new IllegalArgumentException("preload delay steps must not be negative");
        }
        if (variantDelay.isNegative()) {
            throw new IllegalArgumentException("variantDelay must not be negative");
        }
        if (variantBatchSize <= 0) {
            throw new IllegalArgumentException("variantBatchSize must be positive");
        }
        if (controllerInterval.isNegative() || controllerInterval.isZero()) {
            throw new IllegalArgumentException("controllerInterval must be positive");
        }
        if (emaAlpha <= 0.0 || emaAlpha > 1.0) {
            throw new IllegalArgumentException("emaAlpha must be in (0, 1]");
        }
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
            DEFAULT_PRELOAD_INITIAL_DELAY,
            DEFAULT_PRELOAD_MIN_DELAY,
            DEFAULT_PRELOAD_MAX_DELAY,
            DEFAULT_PRELOAD_DELAY_INCREASE,
            DEFAULT_PRELOAD_DELAY_DECREASE,
            DEFAULT_VARIANT_DELAY,
            DEFAULT_VARIANT_BATCH_SIZE,
            DEFAULT_CONTROLLER_INTERVAL,
            DEFAULT_EMA_ALPHA
        );
    }

    public SchedulerConfig withVariantBatchSize(int variantBatchSize) {
        return new SchedulerConfig(
            preloadInitialDelay, preloadMinDelay, preloadMaxDelay, preloadDelayIncrease,
            preloadDelayDecrease, variantDelay, variantBatchSize, controllerInterval, emaAlpha
        );
    }

    public SchedulerConfig withControllerInterval(Duration controllerInterval) {
        return new SchedulerConfig(
            preloadInitialDelay, preloadMinDelay, preloadMaxDelay, preloadDelayIncrease,
            preloadDelayDecrease, variantDelay, variantBatchSize, controllerInterval, emaAlpha
        );
    }

    public SchedulerConfig withEmaAlpha(double emaAlpha) {
        return new SchedulerConfig(
            preloadInitialDelay, preloadMinDelay, preloadMaxDelay, preloadDelayIncrease,
            preloadDelayDecrease, variantDelay, variantBatchSize, controllerInterval, emaAlpha
        );
    }
}

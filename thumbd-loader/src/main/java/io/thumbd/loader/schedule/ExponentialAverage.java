package io.thumbd.loader.schedule;

/**
 * Exponentially weighted moving average. Starts at zero; not thread-safe.
 */
final class ExponentialAverage {

    private final double alpha;
    private double value;

    ExponentialAverage(double alpha) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be in (0, 1]");
        }
        this.alpha = alpha;
    }

    double update(double sample) {
        value = alpha * sample + (1.0 - alpha) * value;
        return value;
    }

    double value() {
        return value;
    }

    void reset() {
        value = 0.0;
    }
}

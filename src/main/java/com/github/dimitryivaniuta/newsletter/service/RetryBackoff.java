package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.config.AppProperties;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Exponential back-off with jitter between successive claims of a failing task.
 */
@Component
public class RetryBackoff {

    private final Duration base;
    private final Duration max;

    @Autowired
    public RetryBackoff(AppProperties properties) {
        this(properties.getDelivery().getRetry().getBaseBackoff(), properties.getDelivery().getRetry().getMaxBackoff());
    }

    RetryBackoff(Duration base, Duration max) {
        if (base.isNegative() || base.isZero() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Invalid retry back-off: base=" + base + " max=" + max);
        }
        this.base = base;
        this.max = max;
    }

    /**
     * Delay before the next claim after {@code attempt} failed attempts.
     *
     * <p>{@code base * 2^(attempt-1)}, capped at {@code max}, times a jitter in [0.5, 1.5), never below {@code base}
     * nor above {@code max}.</p>
     *
     * @param attempt failed attempts so far, starting at 1
     * @return delay
     */
    public Duration forAttempt(int attempt) {
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        double candidateMs = base.toMillis() * Math.pow(2.0, exponent);
        long capped = (long) Math.min(candidateMs, max.toMillis());

        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long withJitter = (long) (capped * jitter);

        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }
}

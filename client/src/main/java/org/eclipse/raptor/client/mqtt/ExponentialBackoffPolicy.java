/*******************************************************************************
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/

package org.eclipse.raptor.client.mqtt;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A backoff policy which doubles the wait time with every consecutive failure.
 * <p>
 * The wait time after {@code n} consecutive failures is {@code min(2^n, max)} seconds.
 * The failure counter itself is unbounded.
 * <p>
 * Failures are logged with escalating severity: the first failure of a series is logged
 * at level WARN, then only every {@value #FAILURE_LOG_INTERVAL}th consecutive failure
 * is logged at level ERROR. All other failures are logged at level DEBUG.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    /**
     * The maximum wait time used if none is given explicitly.
     */
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(300);
    /**
     * The number of consecutive failures after which a failure is logged at level ERROR.
     */
    public static final int FAILURE_LOG_INTERVAL = 10;

    private static final Logger LOG = LoggerFactory.getLogger(ExponentialBackoffPolicy.class);
    // 2^62 seconds is the largest power of two that still fits into a long
    private static final int MAX_EXPONENT = 62;

    private final String name;
    private final Duration maxBackoff;

    private int failureCount;
    private Instant lastAttempt;

    /**
     * Creates a new policy with a maximum wait time of {@link #DEFAULT_MAX_BACKOFF}.
     *
     * @param name The name of the component using the policy (used for logging).
     * @throws NullPointerException if name is {@code null}.
     */
    public ExponentialBackoffPolicy(final String name) {
        this(name, DEFAULT_MAX_BACKOFF);
    }

    /**
     * Creates a new policy.
     *
     * @param name The name of the component using the policy (used for logging).
     * @param maxBackoff The maximum amount of time to wait between attempts.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if max backoff is negative.
     */
    public ExponentialBackoffPolicy(final String name, final Duration maxBackoff) {
        this.name = Objects.requireNonNull(name);
        this.maxBackoff = Objects.requireNonNull(maxBackoff);
        if (maxBackoff.isNegative()) {
            throw new IllegalArgumentException("max backoff must not be negative");
        }
    }

    /**
     * Computes the wait time after a number of consecutive failures.
     *
     * @param failures The number of failures.
     * @param maxBackoff The upper bound.
     * @return The wait time.
     */
    static Duration waitTime(final int failures, final Duration maxBackoff) {
        if (failures <= 0) {
            return Duration.ZERO;
        }
        if (failures > MAX_EXPONENT) {
            return maxBackoff;
        }
        final Duration exponential = Duration.ofSeconds(1L << failures);
        return exponential.compareTo(maxBackoff) < 0 ? exponential : maxBackoff;
    }

    /**
     * Gets the upper bound of the wait time.
     *
     * @return The maximum wait time.
     */
    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    @Override
    public synchronized Duration waitTime() {
        return waitTime(failureCount, maxBackoff);
    }

    @Override
    public synchronized boolean shouldAttempt(final Instant now) {
        Objects.requireNonNull(now);
        return remainingWait(now).isZero();
    }

    @Override
    public synchronized Duration remainingWait(final Instant now) {
        Objects.requireNonNull(now);
        if (failureCount == 0 || lastAttempt == null) {
            return Duration.ZERO;
        }
        final Duration remaining = waitTime().minus(Duration.between(lastAttempt, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    @Override
    public synchronized void recordAttempt(final Instant now) {
        this.lastAttempt = Objects.requireNonNull(now);
    }

    @Override
    public synchronized boolean tryAttempt(final Instant now) {
        if (shouldAttempt(now)) {
            recordAttempt(now);
            return true;
        }
        return false;
    }

    @Override
    public synchronized void recordSuccess() {
        if (failureCount > 0) {
            LOG.info("{}: MQTT connection restored after {} failed attempts", name, failureCount);
            failureCount = 0;
        }
    }

    @Override
    public synchronized int recordFailure(final Throwable cause) {
        // saturate instead of wrapping around
        if (failureCount < Integer.MAX_VALUE) {
            failureCount++;
        }
        final long retryIn = waitTime().toSeconds();
        final String reason = cause == null ? "unknown error" : String.valueOf(cause.getMessage());
        if (failureCount == 1) {
            LOG.warn("{}: error communicating with MQTT broker: {}. Will retry in {}s", name, reason, retryIn);
        } else if (failureCount % FAILURE_LOG_INTERVAL == 0) {
            LOG.error("{}: still unable to connect to MQTT broker after {} attempts: {}. Next retry in {}s",
                    name, failureCount, reason, retryIn);
        } else {
            LOG.debug("{}: attempt {} to communicate with MQTT broker failed: {}. Next retry in {}s",
                    name, failureCount, reason, retryIn);
        }
        return failureCount;
    }

    @Override
    public synchronized int getFailureCount() {
        return failureCount;
    }

    @Override
    public String toString() {
        return new StringBuilder("ExponentialBackoffPolicy [name: ").append(name)
                .append(", max-backoff: ").append(maxBackoff)
                .append("]")
                .toString();
    }
}

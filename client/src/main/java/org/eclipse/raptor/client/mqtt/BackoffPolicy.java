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

/**
 * A strategy for deciding when a new attempt to connect to the broker may be made.
 * <p>
 * Implementations keep track of the number of consecutive failed attempts and the
 * point in time of the last attempt. Implementations must be safe for use by
 * multiple threads.
 */
public interface BackoffPolicy {

    /**
     * Gets the amount of time that needs to pass after the last attempt before
     * another attempt is permitted.
     *
     * @return The wait time, {@link Duration#ZERO} if the last attempt succeeded.
     */
    Duration waitTime();

    /**
     * Checks whether an attempt is permitted at a given point in time.
     *
     * @param now The point in time.
     * @return {@code true} if no attempt has failed since the last success, no attempt has been
     *         recorded yet or the wait time has passed since the last recorded attempt.
     */
    boolean shouldAttempt(Instant now);

    /**
     * Gets the amount of time left until an attempt is permitted.
     *
     * @param now The point in time to determine the remaining time for.
     * @return The remaining time, {@link Duration#ZERO} if an attempt is permitted.
     */
    Duration remainingWait(Instant now);

    /**
     * Records an attempt.
     *
     * @param now The point in time at which the attempt is made.
     */
    void recordAttempt(Instant now);

    /**
     * Atomically checks if an attempt is permitted and records the attempt if so.
     *
     * @param now The point in time.
     * @return {@code true} if the attempt is permitted and has been recorded.
     */
    boolean tryAttempt(Instant now);

    /**
     * Records the success of the last attempt.
     * <p>
     * Resets the failure count to zero.
     */
    void recordSuccess();

    /**
     * Records the failure of the last attempt.
     *
     * @param cause The reason for the failure or {@code null} if unknown.
     * @return The number of consecutive failures, including this one.
     */
    int recordFailure(Throwable cause);

    /**
     * Gets the number of consecutive failed attempts.
     *
     * @return The failure count.
     */
    int getFailureCount();

    /**
     * Gets a policy that permits every attempt.
     * <p>
     * The returned policy still counts failures but never delays an attempt.
     *
     * @return The policy.
     */
    static BackoffPolicy none() {
        return new ExponentialBackoffPolicy("no-backoff", Duration.ZERO);
    }
}

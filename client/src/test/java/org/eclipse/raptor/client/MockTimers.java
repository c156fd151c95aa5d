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

package org.eclipse.raptor.client;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.vertx.core.Handler;
import io.vertx.core.Vertx;

/**
 * Keeps track of timers set on a mocked vert.x instance and fires them on demand.
 */
public final class MockTimers {

    private final Map<Long, PendingTimer> pending = new LinkedHashMap<>();
    private long nextTimerId = 1;

    private MockTimers() {
    }

    /**
     * Registers a new instance with a mocked vert.x instance.
     * <p>
     * None of the timers set on the vert.x instance will fire unless explicitly
     * triggered by means of {@link #fire(long)}. Like vert.x, the mock rejects
     * delays shorter than one millisecond.
     *
     * @param vertx The mocked vert.x instance.
     * @return The timers.
     */
    public static MockTimers install(final Vertx vertx) {
        final MockTimers timers = new MockTimers();
        when(vertx.setTimer(anyLong(), VertxMockSupport.anyHandler())).thenAnswer(invocation -> {
            final Long delay = invocation.getArgument(0);
            final Handler<Long> handler = invocation.getArgument(1);
            if (delay < 1) {
                throw new IllegalArgumentException("Cannot schedule a timer with delay < 1 ms");
            }
            return timers.add(delay, handler);
        });
        when(vertx.cancelTimer(anyLong())).thenAnswer(invocation -> {
            final Long timerId = invocation.getArgument(0);
            return timers.pending.remove(timerId) != null;
        });
        return timers;
    }

    private synchronized long add(final long delay, final Handler<Long> handler) {
        final long timerId = nextTimerId++;
        pending.put(timerId, new PendingTimer(delay, handler));
        return timerId;
    }

    /**
     * Gets the delays of all timers that have neither fired nor been cancelled.
     *
     * @return The delays in the order the timers have been set.
     */
    public synchronized List<Long> pendingDelays() {
        final List<Long> delays = new ArrayList<>();
        pending.values().forEach(timer -> delays.add(timer.delay));
        return delays;
    }

    /**
     * Fires the oldest pending timer with a given delay.
     *
     * @param delay The delay that the timer has been set with.
     * @return {@code true} if a matching timer has been found.
     */
    public boolean fire(final long delay) {
        final Optional<Map.Entry<Long, PendingTimer>> timer;
        synchronized (this) {
            timer = pending.entrySet().stream()
                    .filter(entry -> entry.getValue().delay == delay)
                    .findFirst();
            timer.ifPresent(entry -> pending.remove(entry.getKey()));
        }
        timer.ifPresent(entry -> entry.getValue().handler.handle(entry.getKey()));
        return timer.isPresent();
    }

    private static final class PendingTimer {

        private final long delay;
        private final Handler<Long> handler;

        PendingTimer(final long delay, final Handler<Long> handler) {
            this.delay = delay;
            this.handler = handler;
        }
    }
}

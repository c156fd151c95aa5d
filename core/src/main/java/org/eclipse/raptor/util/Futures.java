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

package org.eclipse.raptor.util;

import java.util.Objects;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Utility methods for working with vert.x futures.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Interface representing blocking code to be executed.
     *
     * @param <T> The type of the result.
     */
    @FunctionalInterface
    public interface BlockingCode<T> {

        /**
         * Blocking method to run.
         *
         * @return The result of the method execution.
         * @throws Exception if the code fails.
         */
        T run() throws Exception;
    }

    /**
     * Runs blocking code on a worker thread using {@link Vertx#executeBlocking(io.vertx.core.Handler, io.vertx.core.Handler)}.
     * <p>
     * Any exception thrown by the code is reported as the cause of the
     * returned failed future.
     *
     * @param <T> The type of the result.
     * @param vertx The vert.x instance to run the code on.
     * @param blocking The blocking code.
     * @return The future, reporting the result.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static <T> Future<T> executeBlocking(final Vertx vertx, final BlockingCode<T> blocking) {
        Objects.requireNonNull(vertx);
        Objects.requireNonNull(blocking);

        final Promise<T> result = Promise.promise();

        vertx.executeBlocking(promise -> {
            try {
                promise.complete(blocking.run());
            } catch (final Exception e) {
                promise.fail(e);
            }
        }, result);

        return result.future();
    }
}

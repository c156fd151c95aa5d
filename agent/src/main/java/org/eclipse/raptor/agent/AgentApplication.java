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

package org.eclipse.raptor.agent;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.eclipse.raptor.client.telemetry.InMemoryTelemetrySource;
import org.eclipse.raptor.config.AgentConfig;
import org.eclipse.raptor.config.AgentConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Vertx;

/**
 * The agent's main class.
 * <p>
 * Loads the configuration from the file given as the first command line argument or by
 * the {@code RAPTOR_CONFIG} environment variable and deploys the {@link AgentVerticle}.
 */
public final class AgentApplication {

    private static final Logger LOG = LoggerFactory.getLogger(AgentApplication.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private AgentApplication() {
        // prevent instantiation
    }

    /**
     * Starts the agent.
     *
     * @param args The command line arguments.
     */
    public static void main(final String[] args) {

        final AgentConfig config;
        try {
            final Path path = AgentConfigLoader.resolvePath(args, System.getenv());
            config = AgentConfigLoader.load(path);
        } catch (final IllegalArgumentException e) {
            LOG.error("cannot load configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        final Vertx vertx = Vertx.vertx();
        final AgentVerticle verticle = new AgentVerticle(
                config,
                new InMemoryTelemetrySource(),
                new LoggingMessageDispatcher());

        vertx.deployVerticle(verticle)
            .onSuccess(id -> {
                LOG.info("successfully deployed agent [deployment ID: {}]", id);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(vertx)));
            })
            .onFailure(t -> {
                LOG.error("failed to deploy agent", t);
                vertx.close().onComplete(r -> System.exit(1));
            });
    }

    private static void shutdown(final Vertx vertx) {
        LOG.info("shutting down agent");
        final CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(r -> latch.countDown());
        try {
            if (!latch.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("agent did not shut down within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

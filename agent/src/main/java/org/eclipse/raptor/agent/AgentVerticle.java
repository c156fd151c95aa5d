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

import java.util.Objects;

import org.eclipse.raptor.client.mqtt.ConnectionHealthChecker;
import org.eclipse.raptor.client.mqtt.MqttPublisher;
import org.eclipse.raptor.client.mqtt.PersistentListener;
import org.eclipse.raptor.client.telemetry.DeviceTelemetryClient;
import org.eclipse.raptor.client.telemetry.TelemetrySource;
import org.eclipse.raptor.config.AgentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;

/**
 * The verticle running the agent's cloud connection.
 * <p>
 * On start-up, the verticle checks if the broker can be reached, starts listening for
 * messages on the device's messages topic and then periodically uploads the stored
 * telemetry data. A failed health check is logged only, since both the listener and the
 * uploads recover by themselves once the broker becomes available.
 */
public class AgentVerticle extends AbstractVerticle {

    private static final Logger LOG = LoggerFactory.getLogger(AgentVerticle.class);

    private final AgentConfig config;
    private final TelemetrySource telemetrySource;
    private final InboundMessageDispatcher dispatcher;

    private DeviceTelemetryClient telemetryClient;
    private PersistentListener listener;
    private long uploadTimerId = -1;
    private boolean uploadInProgress;

    /**
     * Creates a new verticle.
     *
     * @param config The agent's configuration.
     * @param telemetrySource The store to upload telemetry data from.
     * @param dispatcher The business logic to pass received messages to.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public AgentVerticle(
            final AgentConfig config,
            final TelemetrySource telemetrySource,
            final InboundMessageDispatcher dispatcher) {
        this.config = Objects.requireNonNull(config);
        this.telemetrySource = Objects.requireNonNull(telemetrySource);
        this.dispatcher = Objects.requireNonNull(dispatcher);
    }

    /**
     * Gets the client for uploading data to the device's topics.
     *
     * @return The client or {@code null} if the verticle has not been started yet.
     */
    public final DeviceTelemetryClient getTelemetryClient() {
        return telemetryClient;
    }

    @Override
    public void start(final Promise<Void> startPromise) {

        final MqttPublisher publisher = new MqttPublisher(vertx, config.getMqttConfig());
        telemetryClient = new DeviceTelemetryClient(vertx, config.getTopicConfig(), publisher, telemetrySource);
        listener = new PersistentListener(vertx, config.getMqttConfig(), config.getTopicConfig().getMessagesTopic());
        listener.handler(dispatcher::dispatch);
        listener.endHandler(v -> LOG.debug("message stream has ended"));

        new ConnectionHealthChecker(vertx, config.getMqttConfig()).checkConnection()
            .onSuccess(healthy -> {
                if (!healthy) {
                    LOG.warn("MQTT broker [{}:{}] is not reachable, will keep trying in the background",
                            config.getMqttConfig().getHost(), config.getMqttConfig().getPort());
                }
            })
            .compose(healthy -> listener.start())
            .onSuccess(ok -> {
                final long intervalMillis = config.getTopicConfig().getIntervalSeconds() * 1000L;
                uploadTimerId = vertx.setPeriodic(intervalMillis, tid -> uploadBacklog());
                LOG.info("agent started, uploading telemetry data every {}s to {}",
                        config.getTopicConfig().getIntervalSeconds(), config.getTopicConfig().getTelemetryTopic());
            })
            .onComplete(startPromise);
    }

    /**
     * Uploads the stored telemetry data unless an upload is already in progress.
     *
     * @return A future indicating the outcome of the upload (see {@link DeviceTelemetryClient#uploadBacklog()}).
     *         The future is succeeded with {@code false} if the upload has been skipped.
     */
    Future<Boolean> uploadBacklog() {
        if (uploadInProgress) {
            LOG.debug("previous telemetry upload still in progress, skipping upload");
            return Future.succeededFuture(Boolean.FALSE);
        }
        uploadInProgress = true;
        return telemetryClient.uploadBacklog()
                .onComplete(r -> uploadInProgress = false);
    }

    @Override
    public void stop(final Promise<Void> stopPromise) {
        if (uploadTimerId != -1) {
            vertx.cancelTimer(uploadTimerId);
        }
        final Future<Void> listenerStopped = listener == null ? Future.succeededFuture() : listener.stop();
        listenerStopped
            .onSuccess(ok -> LOG.info("agent stopped"))
            .onComplete(stopPromise);
    }
}

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

package org.eclipse.raptor.client.telemetry;

import java.util.Objects;

import org.eclipse.raptor.client.mqtt.MqttPublisher;
import org.eclipse.raptor.config.TopicConfig;
import org.eclipse.raptor.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * A client for uploading a device's data to the topics configured for the device.
 * <p>
 * All uploads go through the same {@link MqttPublisher} and are thus throttled by the
 * publisher's backoff policy. None of the methods fail: the outcome of an upload is
 * reported by means of the boolean result only.
 */
public final class DeviceTelemetryClient {

    private static final Logger LOG = LoggerFactory.getLogger(DeviceTelemetryClient.class);

    private final Vertx vertx;
    private final TopicConfig topicConfig;
    private final MqttPublisher publisher;
    private final TelemetrySource telemetrySource;

    /**
     * Creates a new client.
     *
     * @param vertx The vert.x instance to run blocking store access on.
     * @param topicConfig The topics to publish to.
     * @param publisher The publisher to use.
     * @param telemetrySource The store to read the telemetry backlog from.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public DeviceTelemetryClient(
            final Vertx vertx,
            final TopicConfig topicConfig,
            final MqttPublisher publisher,
            final TelemetrySource telemetrySource) {
        this.vertx = Objects.requireNonNull(vertx);
        this.topicConfig = Objects.requireNonNull(topicConfig);
        this.publisher = Objects.requireNonNull(publisher);
        this.telemetrySource = Objects.requireNonNull(telemetrySource);
    }

    /**
     * Uploads the stored telemetry records.
     * <p>
     * Reads up to the configured backlog limit of records from the telemetry source and
     * publishes them as a single JSON array to the telemetry topic. Once the broker has
     * acknowledged the message, the uploaded records are removed from the source.
     *
     * @return A future that is succeeded with {@code true} if the records have been uploaded
     *         and removed or if there were no records to upload. Otherwise the future
     *         is succeeded with {@code false}.
     */
    public Future<Boolean> uploadBacklog() {
        return Futures.executeBlocking(vertx, () -> telemetrySource.getStoredTelemetry(topicConfig.getBacklogLimit()))
                .compose(backlog -> {
                    if (backlog.isEmpty()) {
                        LOG.debug("no stored telemetry data to upload");
                        return Future.succeededFuture(Boolean.TRUE);
                    }
                    return publisher.publish(topicConfig.getTelemetryTopic(), backlog.getRecords())
                            .compose(published -> {
                                if (!published) {
                                    return Future.succeededFuture(Boolean.FALSE);
                                }
                                LOG.debug("uploaded {} telemetry records", backlog.size());
                                return Futures.executeBlocking(vertx, () -> {
                                    telemetrySource.removeStoredTelemetry(backlog.getIds());
                                    return Boolean.TRUE;
                                });
                            });
                })
                .otherwise(t -> {
                    LOG.error("error uploading telemetry data", t);
                    return Boolean.FALSE;
                });
    }

    /**
     * Uploads the response to a command.
     *
     * @param response The response.
     * @return A future indicating the outcome.
     * @throws NullPointerException if response is {@code null}.
     */
    public Future<Boolean> publishCommandResponse(final JsonObject response) {
        Objects.requireNonNull(response);
        LOG.info("command response: {}", response.encode());
        return publisher.publish(topicConfig.getResponseTopic(), response);
    }

    /**
     * Uploads the device's status.
     *
     * @param status The status information.
     * @return A future indicating the outcome. The future is succeeded with {@code false}
     *         if no status topic has been configured.
     * @throws NullPointerException if status is {@code null}.
     */
    public Future<Boolean> publishStatus(final JsonObject status) {
        Objects.requireNonNull(status);
        try {
            return publisher.publish(topicConfig.getStatusTopic(), status);
        } catch (final IllegalStateException e) {
            LOG.error("cannot upload status: {}", e.getMessage());
            return Future.succeededFuture(Boolean.FALSE);
        }
    }

    /**
     * Uploads an alarm.
     *
     * @param alarm The alarm.
     * @return A future indicating the outcome. The future is succeeded with {@code false}
     *         if no alarms topic has been configured.
     * @throws NullPointerException if alarm is {@code null}.
     */
    public Future<Boolean> publishAlarm(final JsonObject alarm) {
        Objects.requireNonNull(alarm);
        try {
            return publisher.publish(topicConfig.getAlarmsTopic(), alarm);
        } catch (final IllegalStateException e) {
            LOG.error("cannot upload alarm: {}", e.getMessage());
            return Future.succeededFuture(Boolean.FALSE);
        }
    }
}

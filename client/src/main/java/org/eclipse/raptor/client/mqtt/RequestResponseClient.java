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
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.raptor.config.MqttConnectionConfig;
import org.eclipse.raptor.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.mqtt.MqttClientOptions;
import io.vertx.mqtt.messages.MqttPublishMessage;

/**
 * A client for sending a command and waiting for the correlated response.
 * <p>
 * Each exchange uses a dedicated connection with an ephemeral client identifier.
 * The client subscribes to the response topic <em>before</em> publishing the command
 * so that a fast response cannot get lost. Incoming messages that are not valid JSON
 * objects or that carry a different correlation identifier are discarded.
 * <p>
 * The request's timeout bounds the whole exchange, including connection establishment.
 * Once the exchange has completed, the connection is closed and any response arriving
 * later is discarded.
 */
public final class RequestResponseClient {

    /**
     * The prefix of the client identifiers used for exchanges.
     */
    public static final String CLIENT_ID_PREFIX = "raptor-mqtt-ui";
    /**
     * The keep-alive interval (seconds) used for exchanges.
     */
    public static final int KEEP_ALIVE_SECONDS = 60;

    private static final Logger LOG = LoggerFactory.getLogger(RequestResponseClient.class);
    private static final int MAX_LOGGED_PAYLOAD_LENGTH = 200;

    private final Vertx vertx;
    private final MqttConnectionConfig config;
    private final MqttConnectionFactory connectionFactory;

    /**
     * Creates a new client.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public RequestResponseClient(final Vertx vertx, final MqttConnectionConfig config) {
        this(vertx, config, MqttConnectionFactory.newConnectionFactory(vertx));
    }

    /**
     * Creates a new client.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @param connectionFactory The factory to use for connecting to the broker.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public RequestResponseClient(
            final Vertx vertx,
            final MqttConnectionConfig config,
            final MqttConnectionFactory connectionFactory) {
        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.connectionFactory = Objects.requireNonNull(connectionFactory);
    }

    static String newClientId() {
        return CLIENT_ID_PREFIX + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Sends a command and waits for the correlated response.
     *
     * @param commandTopic The topic to send the command to.
     * @param responseTopic The topic that the response is expected on.
     * @param payload The command.
     * @param correlationId The correlation identifier.
     * @param timeout The maximum time the whole exchange may take.
     * @return A future indicating the outcome (see {@link #sendAndWait(CorrelatedRequest)}).
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the payload contains a different correlation identifier
     *                                  or the timeout is not positive.
     */
    public Future<Optional<JsonObject>> sendAndWait(
            final String commandTopic,
            final String responseTopic,
            final JsonObject payload,
            final String correlationId,
            final Duration timeout) {
        return sendAndWait(CorrelatedRequest.of(commandTopic, responseTopic, payload, correlationId, timeout));
    }

    /**
     * Sends a command and waits for the correlated response.
     *
     * @param request The command and correlation information.
     * @return A future that is succeeded with the first response carrying the request's
     *         correlation identifier or with an empty optional if no such response has been
     *         received within the request's timeout or the exchange failed. The future is never failed.
     * @throws NullPointerException if request is {@code null}.
     */
    public Future<Optional<JsonObject>> sendAndWait(final CorrelatedRequest request) {
        Objects.requireNonNull(request);

        final Promise<Optional<JsonObject>> result = Promise.promise();
        final AtomicReference<MqttClientSession> sessionRef = new AtomicReference<>();

        // vert.x rejects timers shorter than one millisecond
        final long timerId = vertx.setTimer(Math.max(1, request.getTimeout().toMillis()), tid -> {
            if (result.tryComplete(Optional.empty())) {
                LOG.warn("timeout waiting for response to {}: {}",
                        request.getCorrelationIdField(), request.getCorrelationId());
            }
        });

        final MqttClientOptions options = MqttConnectionFactory.createClientOptions(config);
        options.setClientId(newClientId());
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        options.setCleanSession(true);

        connectionFactory.connect(config, options)
            .compose(client -> {
                final MqttClientSession session = new MqttClientSession(vertx, client, config.getAckTimeoutMillis());
                sessionRef.set(session);
                if (result.future().isComplete()) {
                    // timed out while connecting
                    session.close();
                    return Future.succeededFuture();
                }
                session.messageHandler(msg -> handleResponse(msg, request, result));
                session.connectionLossHandler(result::tryFail);
                return session.subscribe(request.getResponseTopic(), MqttQoS.AT_LEAST_ONCE)
                        .compose(grantedQos -> {
                            LOG.info("subscribed to response topic: {}", request.getResponseTopic());
                            return session.publish(OutboundMessage.of(
                                    request.getCommandTopic(),
                                    request.getPayload(),
                                    MqttQoS.AT_LEAST_ONCE,
                                    false));
                        })
                        .onSuccess(ok -> LOG.info("published command to topic: {} [{}: {}]",
                                request.getCommandTopic(), request.getCorrelationIdField(),
                                request.getCorrelationId()));
            })
            .onFailure(result::tryFail);

        return result.future()
                .otherwise(t -> {
                    LOG.error("error sending command [{}: {}] and waiting for response: {}",
                            request.getCorrelationIdField(), request.getCorrelationId(), t.getMessage());
                    return Optional.empty();
                })
                .eventually(v -> {
                    vertx.cancelTimer(timerId);
                    return Optional.ofNullable(sessionRef.get())
                            .map(MqttClientSession::close)
                            .orElseGet(Future::succeededFuture);
                });
    }

    private void handleResponse(
            final MqttPublishMessage message,
            final CorrelatedRequest request,
            final Promise<Optional<JsonObject>> result) {

        if (result.future().isComplete()) {
            return;
        }
        final Object decoded;
        try {
            decoded = Json.decodeValue(message.payload());
        } catch (final DecodeException e) {
            LOG.warn("received invalid JSON response: {}",
                    Strings.abbreviate(message.payload().toString(), MAX_LOGGED_PAYLOAD_LENGTH));
            return;
        }
        if (!(decoded instanceof JsonObject)) {
            LOG.warn("received response that is not a JSON object: {}",
                    Strings.abbreviate(String.valueOf(decoded), MAX_LOGGED_PAYLOAD_LENGTH));
            return;
        }
        final JsonObject response = (JsonObject) decoded;
        if (request.matches(response)) {
            LOG.info("received matching response for {}: {}", request.getCorrelationIdField(), request.getCorrelationId());
            result.tryComplete(Optional.of(response));
        } else {
            LOG.debug("received response for different {}: {}, expected: {}",
                    request.getCorrelationIdField(),
                    response.getValue(request.getCorrelationIdField()),
                    request.getCorrelationId());
        }
    }
}

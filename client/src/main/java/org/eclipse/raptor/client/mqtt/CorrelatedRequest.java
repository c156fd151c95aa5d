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

import io.vertx.core.json.JsonObject;

/**
 * A command to be sent to a peer together with the information required for
 * correlating the peer's response.
 * <p>
 * The command payload carries the correlation identifier in a well-known field
 * ({@value #DEFAULT_CORRELATION_ID_FIELD} by default). The response is expected
 * to echo the identifier in the same field.
 */
public final class CorrelatedRequest {

    /**
     * The name of the field carrying the correlation identifier if none is given explicitly.
     */
    public static final String DEFAULT_CORRELATION_ID_FIELD = "action_id";
    /**
     * The time to wait for a response if none is given explicitly.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String commandTopic;
    private final String responseTopic;
    private final JsonObject payload;
    private final String correlationId;
    private final String correlationIdField;
    private final Duration timeout;

    private CorrelatedRequest(
            final String commandTopic,
            final String responseTopic,
            final JsonObject payload,
            final String correlationId,
            final String correlationIdField,
            final Duration timeout) {

        this.commandTopic = Objects.requireNonNull(commandTopic);
        this.responseTopic = Objects.requireNonNull(responseTopic);
        this.correlationId = Objects.requireNonNull(correlationId);
        this.correlationIdField = Objects.requireNonNull(correlationIdField);
        this.timeout = Objects.requireNonNull(timeout);
        Objects.requireNonNull(payload);

        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        final Object idInPayload = payload.getValue(correlationIdField);
        if (idInPayload == null) {
            this.payload = payload.copy().put(correlationIdField, correlationId);
        } else if (correlationId.equals(idInPayload)) {
            this.payload = payload.copy();
        } else {
            throw new IllegalArgumentException(String.format(
                    "payload contains different correlation id [%s: %s]", correlationIdField, idInPayload));
        }
    }

    /**
     * Creates a request using the default timeout and correlation field.
     *
     * @param commandTopic The topic to send the command to.
     * @param responseTopic The topic that the response is expected on.
     * @param payload The command. The correlation identifier is added if not contained already.
     * @param correlationId The correlation identifier.
     * @return The request.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the payload contains a different correlation identifier.
     */
    public static CorrelatedRequest of(
            final String commandTopic,
            final String responseTopic,
            final JsonObject payload,
            final String correlationId) {
        return of(commandTopic, responseTopic, payload, correlationId, DEFAULT_TIMEOUT);
    }

    /**
     * Creates a request using the default correlation field.
     *
     * @param commandTopic The topic to send the command to.
     * @param responseTopic The topic that the response is expected on.
     * @param payload The command. The correlation identifier is added if not contained already.
     * @param correlationId The correlation identifier.
     * @param timeout The maximum time the whole exchange may take.
     * @return The request.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the payload contains a different correlation identifier
     *                                  or the timeout is not positive.
     */
    public static CorrelatedRequest of(
            final String commandTopic,
            final String responseTopic,
            final JsonObject payload,
            final String correlationId,
            final Duration timeout) {
        return new CorrelatedRequest(commandTopic, responseTopic, payload, correlationId,
                DEFAULT_CORRELATION_ID_FIELD, timeout);
    }

    /**
     * Creates a copy of this request which uses another field for the correlation identifier.
     *
     * @param field The name of the field.
     * @return The new request.
     * @throws NullPointerException if field is {@code null}.
     */
    public CorrelatedRequest withCorrelationIdField(final String field) {
        final JsonObject original = payload.copy();
        original.remove(correlationIdField);
        return new CorrelatedRequest(commandTopic, responseTopic, original, correlationId, field, timeout);
    }

    /**
     * Gets the topic to send the command to.
     *
     * @return The topic.
     */
    public String getCommandTopic() {
        return commandTopic;
    }

    /**
     * Gets the topic to subscribe to for the response.
     *
     * @return The topic.
     */
    public String getResponseTopic() {
        return responseTopic;
    }

    /**
     * Gets the command payload.
     *
     * @return A copy of the payload, containing the correlation identifier.
     */
    public JsonObject getPayload() {
        return payload.copy();
    }

    /**
     * Gets the correlation identifier.
     *
     * @return The identifier.
     */
    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Gets the name of the field carrying the correlation identifier.
     *
     * @return The field name.
     */
    public String getCorrelationIdField() {
        return correlationIdField;
    }

    /**
     * Gets the maximum amount of time the whole exchange may take.
     *
     * @return The timeout.
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Checks if a response carries this request's correlation identifier.
     *
     * @param response The response.
     * @return {@code true} if the response's correlation field contains this request's identifier.
     */
    public boolean matches(final JsonObject response) {
        return response != null && correlationId.equals(response.getValue(correlationIdField));
    }
}

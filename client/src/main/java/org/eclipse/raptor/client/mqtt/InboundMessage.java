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

import java.util.Objects;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A message received by a {@link PersistentListener}.
 * <p>
 * Only messages whose payload could be decoded as JSON are represented by instances of this class.
 */
public final class InboundMessage {

    private final String topic;
    private final Buffer payload;
    private final Object body;
    private final MqttQoS qos;
    private final boolean retained;

    /**
     * Creates a new message.
     *
     * @param topic The topic that the message has been published to.
     * @param payload The raw payload.
     * @param body The decoded payload.
     * @param qos The quality of service that the message has been delivered with.
     * @param retained {@code true} if the broker delivered a retained message.
     * @throws NullPointerException if topic, payload or QoS are {@code null}.
     */
    public InboundMessage(
            final String topic,
            final Buffer payload,
            final Object body,
            final MqttQoS qos,
            final boolean retained) {
        this.topic = Objects.requireNonNull(topic);
        this.payload = Objects.requireNonNull(payload);
        this.body = body;
        this.qos = Objects.requireNonNull(qos);
        this.retained = retained;
    }

    public String getTopic() {
        return topic;
    }

    public Buffer getPayload() {
        return payload;
    }

    /**
     * Gets the decoded payload.
     *
     * @return The JSON value, i.e. a {@code JsonObject}, {@code JsonArray}, {@code String},
     *         {@code Number}, {@code Boolean} or {@code null}.
     */
    public Object getBody() {
        return body;
    }

    /**
     * Gets the decoded payload as a JSON object.
     *
     * @return The object or {@code null} if the payload is not a JSON object.
     */
    public JsonObject getBodyAsJsonObject() {
        return body instanceof JsonObject ? (JsonObject) body : null;
    }

    /**
     * Gets the decoded payload as a JSON array.
     *
     * @return The array or {@code null} if the payload is not a JSON array.
     */
    public JsonArray getBodyAsJsonArray() {
        return body instanceof JsonArray ? (JsonArray) body : null;
    }

    public MqttQoS getQos() {
        return qos;
    }

    public boolean isRetained() {
        return retained;
    }

    @Override
    public String toString() {
        return new StringBuilder("InboundMessage [topic: ").append(topic)
                .append(", qos: ").append(qos)
                .append(", retained: ").append(retained)
                .append(", payload size: ").append(payload.length())
                .append("]")
                .toString();
    }
}

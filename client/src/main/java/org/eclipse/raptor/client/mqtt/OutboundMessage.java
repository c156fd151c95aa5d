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
import io.vertx.core.json.Json;

/**
 * A message to be published to the broker.
 */
public final class OutboundMessage {

    private final String topic;
    private final Object payload;
    private final MqttQoS qos;
    private final boolean retain;

    private OutboundMessage(final String topic, final Object payload, final MqttQoS qos, final boolean retain) {
        this.topic = Objects.requireNonNull(topic);
        this.payload = payload;
        this.qos = Objects.requireNonNull(qos);
        this.retain = retain;
    }

    /**
     * Creates a message to be published with QoS 1 (at least once).
     *
     * @param topic The topic to publish to.
     * @param payload The payload. Any JSON value, e.g. a {@code JsonObject}, {@code JsonArray},
     *                {@code String} or {@code Number}. A {@link Buffer} is sent as is.
     * @return The message.
     * @throws NullPointerException if topic is {@code null}.
     */
    public static OutboundMessage of(final String topic, final Object payload) {
        return new OutboundMessage(topic, payload, MqttQoS.AT_LEAST_ONCE, false);
    }

    /**
     * Creates a message.
     *
     * @param topic The topic to publish to.
     * @param payload The payload (see {@link #of(String, Object)}).
     * @param qos The quality of service to publish with.
     * @param retain {@code true} if the broker should retain the message.
     * @return The message.
     * @throws NullPointerException if topic or QoS are {@code null}.
     */
    public static OutboundMessage of(final String topic, final Object payload, final MqttQoS qos, final boolean retain) {
        return new OutboundMessage(topic, payload, qos, retain);
    }

    /**
     * Gets the topic to publish to.
     *
     * @return The topic.
     */
    public String getTopic() {
        return topic;
    }

    /**
     * Gets the payload.
     *
     * @return The payload.
     */
    public Object getPayload() {
        return payload;
    }

    /**
     * Gets the quality of service to publish with.
     *
     * @return The QoS.
     */
    public MqttQoS getQos() {
        return qos;
    }

    /**
     * Checks if the broker should retain the message.
     *
     * @return {@code true} if the message should be retained.
     */
    public boolean isRetain() {
        return retain;
    }

    /**
     * Gets the payload's wire representation.
     *
     * @return The JSON encoded payload.
     * @throws io.vertx.core.json.EncodeException if the payload cannot be encoded to JSON.
     */
    public Buffer encodePayload() {
        if (payload instanceof Buffer) {
            return (Buffer) payload;
        }
        return Json.encodeToBuffer(payload);
    }

    /**
     * Creates a copy of this message which carries the payload's wire representation.
     * <p>
     * Later changes to this message's payload do not affect the returned message.
     *
     * @return The encoded message.
     * @throws io.vertx.core.json.EncodeException if the payload cannot be encoded to JSON.
     */
    public OutboundMessage encode() {
        final Buffer wireFormat = payload instanceof Buffer ? ((Buffer) payload).copy() : Json.encodeToBuffer(payload);
        return new OutboundMessage(topic, wireFormat, qos, retain);
    }

    @Override
    public String toString() {
        return new StringBuilder("OutboundMessage [topic: ").append(topic)
                .append(", qos: ").append(qos)
                .append(", retain: ").append(retain)
                .append("]")
                .toString();
    }
}

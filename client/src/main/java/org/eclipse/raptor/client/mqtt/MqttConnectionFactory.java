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

import org.eclipse.raptor.config.MqttConnectionConfig;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.mqtt.MqttClient;
import io.vertx.mqtt.MqttClientOptions;

/**
 * A factory for connections to an MQTT broker.
 * <p>
 * Every invocation of {@link #connect(MqttConnectionConfig, MqttClientOptions)} opens a new
 * connection. Connections are never shared or pooled.
 */
public interface MqttConnectionFactory {

    /**
     * Connects to the broker.
     *
     * @param config The broker's address.
     * @param options The client options to use for connecting, including the credentials.
     * @return A future indicating the outcome of the connection attempt.
     *         The future will be completed with the connected client or failed with
     *         an exception indicating why the connection could not be established.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    Future<MqttClient> connect(MqttConnectionConfig config, MqttClientOptions options);

    /**
     * Creates client options from connection properties.
     * <p>
     * The returned options contain the credentials, client identifier, keep-alive interval,
     * clean session flag and connect timeout. Components may further customize the returned
     * object before connecting.
     *
     * @param config The connection properties.
     * @return The client options.
     * @throws NullPointerException if config is {@code null}.
     */
    static MqttClientOptions createClientOptions(final MqttConnectionConfig config) {
        final MqttClientOptions options = new MqttClientOptions();
        options.setUsername(config.getUsername());
        options.setPassword(config.getPassword());
        options.setKeepAliveInterval(config.getKeepAliveSeconds());
        options.setCleanSession(config.isCleanSession());
        options.setConnectTimeout(config.getConnectTimeoutMillis());
        if (config.getClientId() != null) {
            options.setClientId(config.getClientId());
        }
        return options;
    }

    /**
     * Creates a new factory using the default implementation.
     *
     * @param vertx The vert.x instance to create clients on.
     * @return The factory.
     * @throws NullPointerException if vertx is {@code null}.
     */
    static MqttConnectionFactory newConnectionFactory(final Vertx vertx) {
        return new VertxMqttConnectionFactory(vertx);
    }
}

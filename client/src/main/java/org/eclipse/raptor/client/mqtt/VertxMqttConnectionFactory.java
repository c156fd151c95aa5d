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

import org.eclipse.raptor.config.MqttConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.mqtt.MqttClient;
import io.vertx.mqtt.MqttClientOptions;

/**
 * A connection factory based on the vert.x MQTT client.
 */
public final class VertxMqttConnectionFactory implements MqttConnectionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(VertxMqttConnectionFactory.class);

    private final Vertx vertx;

    /**
     * Creates a new factory.
     *
     * @param vertx The vert.x instance to create clients on.
     * @throws NullPointerException if vertx is {@code null}.
     */
    public VertxMqttConnectionFactory(final Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx);
    }

    @Override
    public Future<MqttClient> connect(final MqttConnectionConfig config, final MqttClientOptions options) {
        Objects.requireNonNull(config);
        Objects.requireNonNull(options);

        final MqttClient client = MqttClient.create(vertx, options);
        LOG.debug("connecting to MQTT broker [host: {}, port: {}, client-id: {}]",
                config.getHost(), config.getPort(), options.getClientId());
        return client.connect(config.getPort(), config.getHost())
                .map(conAck -> {
                    LOG.debug("connected to MQTT broker [host: {}, port: {}, session present: {}]",
                            config.getHost(), config.getPort(), conAck.isSessionPresent());
                    return client;
                })
                .recover(t -> {
                    if (ConnectionFaults.isAuthenticationFault(t)) {
                        LOG.debug("MQTT broker [host: {}, port: {}] rejected credentials of user [{}]",
                                config.getHost(), config.getPort(), options.getUsername());
                    } else {
                        LOG.debug("failed to connect to MQTT broker [host: {}, port: {}]",
                                config.getHost(), config.getPort(), t);
                    }
                    return Future.failedFuture(t);
                });
    }
}

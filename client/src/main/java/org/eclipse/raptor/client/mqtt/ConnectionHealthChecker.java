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

import java.net.ConnectException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.raptor.config.MqttConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.mqtt.MqttClientOptions;

/**
 * A probe for checking if the broker can be reached.
 * <p>
 * A check connects to the broker, subscribes to the broker's uptime topic and disconnects again.
 * The check is bounded by a timeout covering all of these steps. The checker is stateless and
 * does not affect the backoff state of any other component.
 */
public final class ConnectionHealthChecker {

    /**
     * The topic subscribed to in order to verify that the broker processes requests.
     */
    public static final String PROBE_TOPIC = "$SYS/broker/uptime";
    /**
     * The default maximum amount of time a check may take.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    /**
     * The keep-alive interval (seconds) used for probe connections.
     */
    public static final int KEEP_ALIVE_SECONDS = 10;

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionHealthChecker.class);

    private final Vertx vertx;
    private final MqttConnectionConfig config;
    private final MqttConnectionFactory connectionFactory;
    private final Duration timeout;

    /**
     * Creates a new checker using the default timeout.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ConnectionHealthChecker(final Vertx vertx, final MqttConnectionConfig config) {
        this(vertx, config, MqttConnectionFactory.newConnectionFactory(vertx), DEFAULT_TIMEOUT);
    }

    /**
     * Creates a new checker.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @param connectionFactory The factory to use for connecting to the broker.
     * @param timeout The maximum amount of time a check may take.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the timeout is not positive.
     */
    public ConnectionHealthChecker(
            final Vertx vertx,
            final MqttConnectionConfig config,
            final MqttConnectionFactory connectionFactory,
            final Duration timeout) {
        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.connectionFactory = Objects.requireNonNull(connectionFactory);
        this.timeout = Objects.requireNonNull(timeout);
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Checks if the broker can be reached.
     *
     * @return A future that is succeeded with {@code true} if a connection could be established
     *         and the broker acknowledged the subscription to {@value #PROBE_TOPIC} within the
     *         timeout, or with {@code false} otherwise. The future is never failed.
     */
    public Future<Boolean> checkConnection() {

        final Promise<Boolean> result = Promise.promise();
        final AtomicReference<MqttClientSession> sessionRef = new AtomicReference<>();

        final long timeoutMillis = Math.max(1, timeout.toMillis());
        final long timerId = vertx.setTimer(timeoutMillis, tid -> {
            if (result.tryComplete(Boolean.FALSE)) {
                LOG.warn("MQTT connection test timed out after {} seconds", timeout.toSeconds());
            }
        });

        final MqttClientOptions options = MqttConnectionFactory.createClientOptions(config);
        options.setClientId(null);
        options.setCleanSession(true);
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        options.setConnectTimeout((int) Math.min(timeoutMillis, config.getConnectTimeoutMillis()));

        connectionFactory.connect(config, options)
            .compose(client -> {
                final MqttClientSession session = new MqttClientSession(vertx, client, config.getAckTimeoutMillis());
                sessionRef.set(session);
                if (result.future().isComplete()) {
                    // timed out while connecting
                    return session.close();
                }
                return session.subscribe(PROBE_TOPIC, MqttQoS.AT_MOST_ONCE).mapEmpty();
            })
            .onSuccess(ok -> {
                if (result.tryComplete(Boolean.TRUE)) {
                    LOG.info("successfully connected to MQTT broker [{}:{}] and subscribed to probe topic",
                            config.getHost(), config.getPort());
                }
            })
            .onFailure(t -> {
                if (result.tryComplete(Boolean.FALSE)) {
                    logFailure(t);
                }
            });

        return result.future()
                .eventually(v -> {
                    vertx.cancelTimer(timerId);
                    return Optional.ofNullable(sessionRef.get())
                            .map(MqttClientSession::close)
                            .orElseGet(Future::succeededFuture);
                });
    }

    private void logFailure(final Throwable error) {
        if (isConnectionRefused(error)) {
            LOG.warn("MQTT connection refused - check broker address and port [{}:{}]",
                    config.getHost(), config.getPort());
        } else if (ConnectionFaults.isAuthenticationFault(error)) {
            LOG.warn("MQTT connection check failed: broker rejected credentials [username: {}]",
                    config.getUsername());
        } else {
            LOG.warn("MQTT connection check failed: {}", error.getMessage());
        }
    }

    private static boolean isConnectionRefused(final Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof ConnectException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }
}

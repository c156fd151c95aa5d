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

import java.time.Clock;
import java.util.Objects;

import org.eclipse.raptor.config.MqttConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.EncodeException;
import io.vertx.mqtt.MqttClientOptions;

/**
 * A client for publishing messages to the broker.
 * <p>
 * Every message is published on a connection of its own which is closed right after the
 * broker has acknowledged the message. Attempts are throttled by a {@link BackoffPolicy}
 * that is shared by all invocations of {@link #publish(OutboundMessage)} on the same
 * instance, i.e. once publishing has failed, subsequent attempts are skipped until the
 * policy's wait time has passed.
 * <p>
 * Publishing never fails with an exception. The outcome is reported by means of the
 * boolean result only.
 */
public final class MqttPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(MqttPublisher.class);

    private final Vertx vertx;
    private final MqttConnectionConfig config;
    private final MqttConnectionFactory connectionFactory;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;

    /**
     * Creates a new publisher using exponential backoff.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public MqttPublisher(final Vertx vertx, final MqttConnectionConfig config) {
        this(vertx, config, MqttConnectionFactory.newConnectionFactory(vertx),
                new ExponentialBackoffPolicy("publisher"), Clock.systemUTC());
    }

    /**
     * Creates a new publisher.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @param connectionFactory The factory to use for connecting to the broker.
     * @param backoffPolicy The policy to throttle connection attempts with.
     * @param clock The clock to determine the time of connection attempts with.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public MqttPublisher(
            final Vertx vertx,
            final MqttConnectionConfig config,
            final MqttConnectionFactory connectionFactory,
            final BackoffPolicy backoffPolicy,
            final Clock clock) {
        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.connectionFactory = Objects.requireNonNull(connectionFactory);
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Gets the policy used for throttling connection attempts.
     *
     * @return The policy.
     */
    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    /**
     * Publishes a payload with QoS 1.
     *
     * @param topic The topic to publish to.
     * @param payload The payload (see {@link OutboundMessage#of(String, Object)}).
     * @return A future indicating the outcome (see {@link #publish(OutboundMessage)}).
     * @throws NullPointerException if topic is {@code null}.
     */
    public Future<Boolean> publish(final String topic, final Object payload) {
        return publish(OutboundMessage.of(topic, payload));
    }

    /**
     * Publishes a message.
     * <p>
     * The attempt is skipped without connecting to the broker if the backoff policy does not
     * permit an attempt at this time.
     *
     * @param message The message to publish.
     * @return A future that is succeeded with {@code true} if the message has been published
     *         successfully or with {@code false} if the attempt has been skipped or failed
     *         or if the payload cannot be encoded.
     *         The future is never failed.
     * @throws NullPointerException if message is {@code null}.
     */
    public Future<Boolean> publish(final OutboundMessage message) {
        Objects.requireNonNull(message);

        final OutboundMessage encodedMessage;
        try {
            encodedMessage = message.encode();
        } catch (final EncodeException e) {
            LOG.error("cannot encode payload of {}", message, e);
            return Future.succeededFuture(Boolean.FALSE);
        }

        if (!backoffPolicy.tryAttempt(clock.instant())) {
            LOG.info("skipping MQTT connection attempt due to backoff (waiting for {}s)",
                    backoffPolicy.waitTime().toSeconds());
            return Future.succeededFuture(Boolean.FALSE);
        }

        final MqttClientOptions options = MqttConnectionFactory.createClientOptions(config);
        // the configured identifier is reserved for the persistent listener
        options.setClientId(null);
        options.setCleanSession(true);

        return connectionFactory.connect(config, options)
                .map(client -> new MqttClientSession(vertx, client, config.getAckTimeoutMillis()))
                .compose(session -> session.publish(encodedMessage)
                        .eventually(v -> session.close()))
                .map(ok -> {
                    LOG.debug("published {}", message);
                    backoffPolicy.recordSuccess();
                    return Boolean.TRUE;
                })
                .otherwise(t -> {
                    backoffPolicy.recordFailure(t);
                    return Boolean.FALSE;
                });
    }
}

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
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.eclipse.raptor.config.MqttConnectionConfig;
import org.eclipse.raptor.util.Lifecycle;
import org.eclipse.raptor.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.mqtt.MqttClientOptions;
import io.vertx.mqtt.messages.MqttPublishMessage;

/**
 * A long-lived subscription to a topic which survives connection loss.
 * <p>
 * Once started, the listener connects to the broker using the configured client identifier,
 * subscribes to the topic and passes every message with a valid JSON payload to the
 * handler registered by means of {@link #handler(Handler)}. Messages with a payload that
 * cannot be decoded are logged and skipped.
 * <p>
 * If the connection cannot be established or gets lost, the listener reconnects as soon as
 * its {@link BackoffPolicy} permits. While waiting, the listener wakes up at least every
 * {@link #MAX_BACKOFF_SLICE} in order to stay responsive to {@link #stop()}.
 * <p>
 * The stream of messages ends when {@link #stop()} is invoked. The end handler is
 * invoked exactly once, after the connection has been closed. Messages arriving after
 * the listener has been stopped are discarded.
 * <p>
 * Instances are not thread safe. All methods must be invoked on the vert.x context
 * that {@link #start()} has been invoked on.
 */
public final class PersistentListener implements Lifecycle {

    /**
     * The maximum amount of time to wait in one go for the backoff policy to permit
     * a connection attempt.
     */
    public static final Duration MAX_BACKOFF_SLICE = Duration.ofSeconds(10);
    /**
     * The default amount of time to pause after an unexpected error.
     */
    public static final Duration DEFAULT_UNEXPECTED_FAULT_PAUSE = Duration.ofSeconds(5);

    private static final Logger LOG = LoggerFactory.getLogger(PersistentListener.class);
    private static final int MAX_LOGGED_PAYLOAD_LENGTH = 200;

    private final Vertx vertx;
    private final MqttConnectionConfig config;
    private final String topic;
    private final MqttConnectionFactory connectionFactory;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;

    private MqttQoS qos = MqttQoS.AT_LEAST_ONCE;
    private boolean acceptRetained = true;
    private Duration unexpectedFaultPause = DEFAULT_UNEXPECTED_FAULT_PAUSE;

    private Handler<InboundMessage> messageHandler;
    private Handler<Void> endHandler;
    private ListenerState state = ListenerState.DISCONNECTED;
    private MqttClientSession session;
    private Long timerId;
    private long connectionAttempt;
    private boolean started;
    private Promise<Void> stopResult;

    /**
     * Creates a listener using exponential backoff.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @param topic The topic filter to subscribe to.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public PersistentListener(final Vertx vertx, final MqttConnectionConfig config, final String topic) {
        this(vertx, config, topic, MqttConnectionFactory.newConnectionFactory(vertx),
                new ExponentialBackoffPolicy("listener"), Clock.systemUTC());
    }

    /**
     * Creates a listener.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The properties for connecting to the broker.
     * @param topic The topic filter to subscribe to.
     * @param connectionFactory The factory to use for connecting to the broker.
     * @param backoffPolicy The policy to throttle connection attempts with. The policy
     *                      must not be shared with other components.
     * @param clock The clock to determine the time of connection attempts with.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public PersistentListener(
            final Vertx vertx,
            final MqttConnectionConfig config,
            final String topic,
            final MqttConnectionFactory connectionFactory,
            final BackoffPolicy backoffPolicy,
            final Clock clock) {
        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.topic = Objects.requireNonNull(topic);
        this.connectionFactory = Objects.requireNonNull(connectionFactory);
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Sets the maximum quality of service to subscribe with.
     * <p>
     * The default value of this property is {@link MqttQoS#AT_LEAST_ONCE}.
     *
     * @param qos The QoS.
     * @return This listener for command chaining.
     * @throws NullPointerException if qos is {@code null}.
     */
    public PersistentListener setQos(final MqttQoS qos) {
        this.qos = Objects.requireNonNull(qos);
        return this;
    }

    /**
     * Sets whether retained messages delivered by the broker upon subscribing
     * should be passed to the handler.
     * <p>
     * The default value of this property is {@code true}.
     *
     * @param acceptRetained {@code false} if retained messages should be skipped.
     * @return This listener for command chaining.
     */
    public PersistentListener setAcceptRetained(final boolean acceptRetained) {
        this.acceptRetained = acceptRetained;
        return this;
    }

    /**
     * Sets the amount of time to pause before reconnecting after an unexpected error.
     * <p>
     * The default value of this property is {@link #DEFAULT_UNEXPECTED_FAULT_PAUSE}.
     *
     * @param pause The pause.
     * @return This listener for command chaining.
     * @throws NullPointerException if pause is {@code null}.
     * @throws IllegalArgumentException if pause is negative.
     */
    public PersistentListener setUnexpectedFaultPause(final Duration pause) {
        Objects.requireNonNull(pause);
        if (pause.isNegative()) {
            throw new IllegalArgumentException("pause must not be negative");
        }
        this.unexpectedFaultPause = pause;
        return this;
    }

    /**
     * Sets the handler to pass received messages to.
     * <p>
     * Any exception thrown by the handler is logged and does not end the stream.
     *
     * @param handler The handler or {@code null} to discard messages.
     * @return This listener for command chaining.
     */
    public PersistentListener handler(final Handler<InboundMessage> handler) {
        this.messageHandler = handler;
        return this;
    }

    /**
     * Sets the handler to invoke once the stream of messages has ended.
     *
     * @param handler The handler or {@code null}.
     * @return This listener for command chaining.
     */
    public PersistentListener endHandler(final Handler<Void> handler) {
        this.endHandler = handler;
        return this;
    }

    /**
     * Gets the current state of this listener.
     *
     * @return The state.
     */
    public ListenerState getState() {
        return state;
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
     * Starts listening.
     * <p>
     * The first connection attempt is made immediately. The returned future does not
     * wait for the connection to be established.
     *
     * @return A succeeded future if the listener has been started or a failed future
     *         if it has already been started or stopped before.
     */
    @Override
    public Future<Void> start() {
        if (started || stopResult != null) {
            return Future.failedFuture(new IllegalStateException("listener has already been started"));
        }
        started = true;
        LOG.debug("starting MQTT listener [topic: {}, {}]", topic, config);
        connectOrWait();
        return Future.succeededFuture();
    }

    /**
     * Stops listening.
     * <p>
     * Cancels a pending connection attempt, closes the connection to the broker
     * and then invokes the end handler.
     *
     * @return A future that is succeeded once the listener has been stopped.
     *         Invoking this method more than once returns the same future.
     */
    @Override
    public Future<Void> stop() {
        if (stopResult != null) {
            return stopResult.future();
        }
        stopResult = Promise.promise();
        cancelTimer();
        // invalidate callbacks of an ongoing connection attempt
        connectionAttempt++;
        setState(ListenerState.CLOSED);

        final Future<Void> closeResult = Optional.ofNullable(session)
                .map(MqttClientSession::close)
                .orElseGet(Future::succeededFuture);
        session = null;
        closeResult.onComplete(r -> {
            LOG.info("MQTT listener on topic [{}] stopped", topic);
            final Handler<Void> handler = endHandler;
            if (handler != null) {
                handler.handle(null);
            }
            stopResult.complete();
        });
        return stopResult.future();
    }

    private boolean isStopped() {
        return stopResult != null;
    }

    private void setState(final ListenerState newState) {
        if (state != newState) {
            LOG.trace("listener state change [topic: {}]: {} -> {}", topic, state, newState);
            state = newState;
        }
    }

    private void schedule(final Duration delay, final Runnable action) {
        final long millis = Math.max(1, delay.toMillis());
        timerId = vertx.setTimer(millis, tid -> {
            timerId = null;
            action.run();
        });
    }

    private void cancelTimer() {
        Optional.ofNullable(timerId).ifPresent(vertx::cancelTimer);
        timerId = null;
    }

    private void connectOrWait() {
        if (isStopped()) {
            return;
        }
        final Instant now = clock.instant();
        if (backoffPolicy.tryAttempt(now)) {
            connect();
        } else {
            final Duration remaining = backoffPolicy.remainingWait(now);
            final Duration slice = remaining.compareTo(MAX_BACKOFF_SLICE) < 0 ? remaining : MAX_BACKOFF_SLICE;
            setState(ListenerState.BACKOFF_WAIT);
            LOG.debug("waiting for backoff: {}ms before next connection attempt", slice.toMillis());
            schedule(slice, this::connectOrWait);
        }
    }

    private void connect() {
        setState(ListenerState.CONNECTING);
        final long attempt = ++connectionAttempt;
        final MqttClientOptions options = MqttConnectionFactory.createClientOptions(config);

        LOG.debug("starting attempt to connect to MQTT broker [{}:{}]", config.getHost(), config.getPort());
        connectionFactory.connect(config, options)
            .compose(client -> {
                final MqttClientSession newSession = new MqttClientSession(vertx, client, config.getAckTimeoutMillis());
                if (attempt != connectionAttempt) {
                    LOG.debug("connected but will directly close connection because listener has been stopped");
                    newSession.close();
                    return Future.succeededFuture();
                }
                session = newSession;
                newSession.messageHandler(this::onMessage);
                newSession.connectionLossHandler(t -> onFault(attempt, t));
                return newSession.subscribe(topic, qos)
                        .onSuccess(grantedQos -> onSubscribed(attempt, grantedQos))
                        .mapEmpty();
            })
            .onFailure(t -> onFault(attempt, t));
    }

    private void onSubscribed(final long attempt, final MqttQoS grantedQos) {
        if (attempt != connectionAttempt) {
            return;
        }
        setState(ListenerState.CONNECTED);
        if (backoffPolicy.getFailureCount() == 0) {
            LOG.info("MQTT listener established on topic: {} [granted qos: {}]", topic, grantedQos);
        } else {
            backoffPolicy.recordSuccess();
        }
    }

    private void onFault(final long attempt, final Throwable error) {
        if (attempt != connectionAttempt) {
            // already handled or listener stopped
            return;
        }
        connectionAttempt++;
        Optional.ofNullable(session).ifPresent(MqttClientSession::close);
        session = null;
        backoffPolicy.recordFailure(error);
        setState(ListenerState.DISCONNECTED);

        if (ConnectionFaults.isConnectivityFault(error)) {
            if (ConnectionFaults.isAuthenticationFault(error)) {
                LOG.warn("MQTT broker rejected credentials of listener [client-id: {}]", config.getClientId());
            }
            connectOrWait();
        } else {
            LOG.error("unexpected error in MQTT listener", error);
            schedule(unexpectedFaultPause, this::connectOrWait);
        }
    }

    private void onMessage(final MqttPublishMessage message) {
        if (isStopped()) {
            LOG.trace("discarding message [topic: {}] received after listener has been stopped", message.topicName());
            return;
        }
        if (message.isRetain() && !acceptRetained) {
            LOG.debug("skipping retained message [topic: {}]", message.topicName());
            return;
        }
        final Object body;
        try {
            body = Json.decodeValue(message.payload());
        } catch (final DecodeException e) {
            LOG.error("received invalid JSON payload: {}",
                    Strings.abbreviate(message.payload().toString(), MAX_LOGGED_PAYLOAD_LENGTH));
            return;
        }
        final InboundMessage inbound = new InboundMessage(
                message.topicName(),
                message.payload(),
                body,
                message.qosLevel(),
                message.isRetain());
        final Handler<InboundMessage> handler = messageHandler;
        if (handler == null) {
            LOG.debug("no handler registered, discarding {}", inbound);
            return;
        }
        try {
            handler.handle(inbound);
        } catch (final RuntimeException e) {
            LOG.error("error processing {}", inbound, e);
        }
    }
}

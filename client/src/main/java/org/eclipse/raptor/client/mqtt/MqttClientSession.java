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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.mqtt.MqttClient;
import io.vertx.mqtt.messages.MqttPublishMessage;
import io.vertx.mqtt.messages.MqttSubAckMessage;

/**
 * A single connection to an MQTT broker.
 * <p>
 * Wraps a connected {@link MqttClient} and provides future based operations that
 * complete only once the broker has acknowledged the corresponding PUBLISH or SUBSCRIBE
 * packet. Acknowledgements that do not arrive within the configured timeout fail the
 * operation with a {@link BrokerConnectionException}.
 * <p>
 * A session is used by exactly one component. It must be closed on every exit path.
 */
public final class MqttClientSession {

    /**
     * The SUBACK return code indicating that the broker rejected a subscription.
     */
    static final int SUBACK_FAILURE = 0x80;

    private static final Logger LOG = LoggerFactory.getLogger(MqttClientSession.class);

    private final Vertx vertx;
    private final MqttClient client;
    private final long ackTimeoutMillis;
    private final Map<Integer, Promise<Integer>> pendingPubAcks = new HashMap<>();
    private final Map<Integer, Integer> earlyPubAcks = new HashMap<>();
    private final Map<Integer, Promise<List<Integer>>> pendingSubAcks = new HashMap<>();
    private final Map<Integer, List<Integer>> earlySubAcks = new HashMap<>();

    private Handler<MqttPublishMessage> messageHandler;
    private Handler<Throwable> connectionLossHandler;
    private boolean closed;
    private Future<Void> closeResult;

    /**
     * Creates a session for a connected client.
     *
     * @param vertx The vert.x instance to use for timers.
     * @param client The connected client.
     * @param ackTimeoutMillis The maximum time to wait for acknowledgements.
     * @throws NullPointerException if vertx or client are {@code null}.
     */
    public MqttClientSession(final Vertx vertx, final MqttClient client, final long ackTimeoutMillis) {
        this.vertx = Objects.requireNonNull(vertx);
        this.client = Objects.requireNonNull(client);
        this.ackTimeoutMillis = ackTimeoutMillis;

        client.publishCompletionHandler(this::onPublishAcknowledged);
        client.subscribeCompletionHandler(this::onSubscribeAcknowledged);
        client.publishHandler(this::onMessage);
        client.closeHandler(v -> onConnectionClosed());
        client.exceptionHandler(t -> LOG.debug("error on MQTT connection", t));
    }

    /**
     * Sets the handler to invoke for messages received on any of this session's subscriptions.
     *
     * @param handler The handler or {@code null} to discard messages.
     * @return This session for command chaining.
     */
    public MqttClientSession messageHandler(final Handler<MqttPublishMessage> handler) {
        synchronized (this) {
            this.messageHandler = handler;
        }
        return this;
    }

    /**
     * Sets the handler to invoke when the connection is lost unexpectedly.
     * <p>
     * The handler is not invoked if the session is closed by means of {@link #close()}.
     *
     * @param handler The handler or {@code null}.
     * @return This session for command chaining.
     */
    public MqttClientSession connectionLossHandler(final Handler<Throwable> handler) {
        synchronized (this) {
            this.connectionLossHandler = handler;
        }
        return this;
    }

    /**
     * Publishes a message.
     *
     * @param message The message to publish.
     * @return A future indicating the outcome. For QoS 0 the future is completed once the
     *         message has been written to the connection, otherwise it is completed once the
     *         broker has acknowledged the message. The future is failed with a
     *         {@link BrokerConnectionException} if the acknowledgement does not arrive in time
     *         or the connection is lost.
     * @throws NullPointerException if message is {@code null}.
     */
    public Future<Void> publish(final OutboundMessage message) {
        Objects.requireNonNull(message);

        if (isClosed()) {
            return Future.failedFuture(new BrokerConnectionException("session is closed"));
        }
        return client.publish(message.getTopic(), message.encodePayload(), message.getQos(), false, message.isRetain())
                .compose(messageId -> {
                    LOG.trace("sent PUBLISH [topic: {}, message id: {}, qos: {}]",
                            message.getTopic(), messageId, message.getQos());
                    if (message.getQos() == MqttQoS.AT_MOST_ONCE) {
                        return Future.succeededFuture();
                    }
                    return awaitAck(messageId, pendingPubAcks, earlyPubAcks, "PUBACK").mapEmpty();
                });
    }

    /**
     * Subscribes to a topic.
     *
     * @param topic The topic filter to subscribe to.
     * @param qos The maximum quality of service to receive messages with.
     * @return A future indicating the outcome. The future is completed with the QoS granted
     *         by the broker or failed with a {@link BrokerConnectionException} if the broker
     *         rejected the subscription, did not acknowledge it in time or the connection is lost.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<MqttQoS> subscribe(final String topic, final MqttQoS qos) {
        Objects.requireNonNull(topic);
        Objects.requireNonNull(qos);

        if (isClosed()) {
            return Future.failedFuture(new BrokerConnectionException("session is closed"));
        }
        return client.subscribe(topic, qos.value())
                .compose(messageId -> awaitAck(messageId, pendingSubAcks, earlySubAcks, "SUBACK"))
                .compose(grantedQoSLevels -> {
                    if (grantedQoSLevels.isEmpty() || grantedQoSLevels.get(0) == SUBACK_FAILURE) {
                        return Future.failedFuture(new BrokerConnectionException(
                                String.format("broker rejected subscription to topic [%s]", topic)));
                    }
                    final MqttQoS granted = MqttQoS.valueOf(grantedQoSLevels.get(0));
                    LOG.debug("subscribed to topic [{}, requested qos: {}, granted qos: {}]", topic, qos, granted);
                    return Future.succeededFuture(granted);
                });
    }

    /**
     * Checks if this session has been closed or the connection has been lost.
     *
     * @return {@code true} if no more operations can be performed.
     */
    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Closes this session.
     * <p>
     * Disconnects from the broker if still connected and fails all operations waiting for
     * acknowledgements. Invoking this method multiple times has no additional effect.
     *
     * @return A future that is succeeded once the connection has been closed.
     *         The future never fails.
     */
    public Future<Void> close() {
        final List<Promise<?>> pending;
        synchronized (this) {
            if (closeResult != null) {
                return closeResult;
            }
            closed = true;
            messageHandler = null;
            connectionLossHandler = null;
            pending = drainPendingOperations();
            if (client.isConnected()) {
                closeResult = client.disconnect()
                        .recover(t -> {
                            LOG.debug("error disconnecting from MQTT broker", t);
                            return Future.succeededFuture();
                        });
            } else {
                closeResult = Future.succeededFuture();
            }
        }
        failAll(pending, new BrokerConnectionException("session has been closed"));
        return closeResult;
    }

    private <T> Future<T> awaitAck(
            final Integer messageId,
            final Map<Integer, Promise<T>> pending,
            final Map<Integer, T> early,
            final String packetType) {

        final Promise<T> ack = Promise.promise();
        synchronized (this) {
            if (early.containsKey(messageId)) {
                return Future.succeededFuture(early.remove(messageId));
            }
            if (closed) {
                return Future.failedFuture(new BrokerConnectionException("session is closed"));
            }
            pending.put(messageId, ack);
        }
        final long timerId = vertx.setTimer(ackTimeoutMillis, tid -> {
            final boolean timedOut;
            synchronized (this) {
                timedOut = pending.remove(messageId) != null;
            }
            if (timedOut) {
                ack.tryFail(new BrokerConnectionException(String.format(
                        "no %s received for message [id: %d] within %dms", packetType, messageId, ackTimeoutMillis)));
            }
        });
        return ack.future().onComplete(r -> vertx.cancelTimer(timerId));
    }

    private void onPublishAcknowledged(final Integer messageId) {
        final Promise<Integer> ack;
        synchronized (this) {
            ack = pendingPubAcks.remove(messageId);
            if (ack == null && !closed) {
                earlyPubAcks.put(messageId, messageId);
            }
        }
        if (ack != null) {
            LOG.trace("received PUBACK [message id: {}]", messageId);
            ack.tryComplete(messageId);
        }
    }

    private void onSubscribeAcknowledged(final MqttSubAckMessage subAck) {
        final Promise<List<Integer>> ack;
        synchronized (this) {
            ack = pendingSubAcks.remove(subAck.messageId());
            if (ack == null && !closed) {
                earlySubAcks.put(subAck.messageId(), subAck.grantedQoSLevels());
            }
        }
        if (ack != null) {
            ack.tryComplete(subAck.grantedQoSLevels());
        }
    }

    private void onMessage(final MqttPublishMessage message) {
        final Handler<MqttPublishMessage> handler;
        synchronized (this) {
            handler = closed ? null : messageHandler;
        }
        if (handler == null) {
            LOG.trace("discarding message [topic: {}] received on closed session", message.topicName());
        } else {
            handler.handle(message);
        }
    }

    private void onConnectionClosed() {
        final List<Promise<?>> pending;
        final Handler<Throwable> lossHandler;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            closeResult = Future.succeededFuture();
            lossHandler = connectionLossHandler;
            connectionLossHandler = null;
            messageHandler = null;
            pending = drainPendingOperations();
        }
        final BrokerConnectionException cause = new BrokerConnectionException("connection to MQTT broker lost");
        LOG.debug("connection to MQTT broker closed unexpectedly");
        failAll(pending, cause);
        if (lossHandler != null) {
            lossHandler.handle(cause);
        }
    }

    private List<Promise<?>> drainPendingOperations() {
        final List<Promise<?>> pending = new ArrayList<>(pendingPubAcks.values());
        pending.addAll(pendingSubAcks.values());
        pendingPubAcks.clear();
        pendingSubAcks.clear();
        earlyPubAcks.clear();
        earlySubAcks.clear();
        return pending;
    }

    private static void failAll(final List<Promise<?>> pending, final Throwable cause) {
        pending.forEach(promise -> promise.tryFail(cause));
    }
}

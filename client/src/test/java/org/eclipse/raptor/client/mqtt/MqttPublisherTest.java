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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static com.google.common.truth.Truth.assertThat;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.eclipse.raptor.client.MockTimers;
import org.eclipse.raptor.client.MutableClock;
import org.eclipse.raptor.config.MqttConnectionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.mqtt.MqttClient;
import io.vertx.mqtt.MqttClientOptions;

/**
 * Tests verifying behavior of {@link MqttPublisher}.
 *
 */
class MqttPublisherTest {

    private static final String TOPIC = "site-1/telemetry";
    private static final long ACK_TIMEOUT = 60_000L;

    private Vertx vertx;
    private MockTimers timers;
    private MutableClock clock;
    private MqttConnectionFactory connectionFactory;
    private MqttClientMock broker;
    private ExponentialBackoffPolicy backoffPolicy;
    private MqttPublisher publisher;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        vertx = mock(Vertx.class);
        timers = MockTimers.install(vertx);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        broker = new MqttClientMock();
        connectionFactory = mock(MqttConnectionFactory.class);
        when(connectionFactory.connect(any(), any())).thenReturn(Future.succeededFuture(broker.client));
        backoffPolicy = new ExponentialBackoffPolicy("publisher");
        final MqttConnectionConfig config = MqttConnectionConfig.builder("broker.local")
                .username("device")
                .password("secret")
                .clientId("device-1")
                .ackTimeout(ACK_TIMEOUT)
                .build();
        publisher = new MqttPublisher(vertx, config, connectionFactory, backoffPolicy, clock);
    }

    /**
     * Verifies that a message is published with QoS 1 on a dedicated connection
     * which is closed afterwards.
     */
    @Test
    public void testPublishSucceeds() {
        final Future<Boolean> result = publisher.publish(TOPIC, new JsonObject().put("value", 42));

        assertThat(result.result()).isTrue();
        assertThat(broker.publishedTopics).containsExactly(TOPIC);
        assertThat(broker.publishedPayloads.get(0).toJsonObject()).isEqualTo(new JsonObject().put("value", 42));
        assertThat(broker.isConnected()).isFalse();
        verify(broker.client).disconnect();

        final ArgumentCaptor<MqttClientOptions> options = ArgumentCaptor.forClass(MqttClientOptions.class);
        verify(connectionFactory).connect(any(), options.capture());
        assertThat(options.getValue().getUsername()).isEqualTo("device");
        assertThat(options.getValue().isCleanSession()).isTrue();
        assertThat(options.getValue().getClientId()).isNotEqualTo("device-1");
    }

    /**
     * Verifies that a successful publish operation resets the failure count.
     */
    @Test
    public void testPublishSuccessResetsFailures() {
        backoffPolicy.recordFailure(new ConnectException());
        backoffPolicy.recordFailure(new ConnectException());
        clock.advance(Duration.ofMinutes(10));

        assertThat(publisher.publish(TOPIC, "ok").result()).isTrue();
        assertThat(backoffPolicy.getFailureCount()).isEqualTo(0);
    }

    /**
     * Verifies that a failed connection attempt is reported as {@code false}
     * and increments the failure count.
     */
    @Test
    public void testPublishFailsIfBrokerIsUnreachable() {
        when(connectionFactory.connect(any(), any()))
            .thenReturn(Future.failedFuture(new ConnectException("Connection refused")));

        final Future<Boolean> result = publisher.publish(TOPIC, new JsonObject().put("value", 42));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.result()).isFalse();
        assertThat(backoffPolicy.getFailureCount()).isEqualTo(1);
    }

    /**
     * Verifies that no connection is attempted while the backoff policy
     * does not permit an attempt.
     */
    @Test
    public void testPublishIsSkippedDuringBackoff() {
        when(connectionFactory.connect(any(), any()))
            .thenReturn(Future.failedFuture(new ConnectException("Connection refused")));
        assertThat(publisher.publish(TOPIC, "first").result()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(publisher.publish(TOPIC, "second").result()).isFalse();
        verify(connectionFactory, times(1)).connect(any(), any());
        assertThat(backoffPolicy.getFailureCount()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(1));
        when(connectionFactory.connect(any(), any())).thenReturn(Future.succeededFuture(broker.client));
        assertThat(publisher.publish(TOPIC, "third").result()).isTrue();
        assertThat(broker.publishedPayloads.get(0).toString()).isEqualTo("\"third\"");
    }

    /**
     * Verifies that publishing fails and the connection is closed if the broker does not
     * acknowledge the message in time.
     */
    @Test
    public void testPublishFailsOnMissingPubAck() {
        broker.ackPublishes = false;

        final Future<Boolean> result = publisher.publish(TOPIC, "ok");
        assertThat(result.isComplete()).isFalse();

        timers.fire(ACK_TIMEOUT);
        assertThat(result.result()).isFalse();
        assertThat(backoffPolicy.getFailureCount()).isEqualTo(1);
        verify(broker.client).disconnect();
    }

    /**
     * Verifies that a payload which cannot be encoded is rejected without connecting.
     */
    @Test
    public void testPublishRejectsUnencodablePayload() {
        final Future<Boolean> result = publisher.publish(TOPIC, new Object());

        assertThat(result.result()).isFalse();
        verify(connectionFactory, never()).connect(any(), any());
        assertThat(backoffPolicy.getFailureCount()).isEqualTo(0);
    }

    /**
     * Verifies that the payload is encoded when publishing is requested, so that changes
     * made to the payload afterwards are not sent to the broker.
     */
    @Test
    public void testPublishSendsPayloadAsOfInvocation() {
        final Promise<MqttClient> connectAttempt = Promise.promise();
        when(connectionFactory.connect(any(), any())).thenReturn(connectAttempt.future());

        final JsonObject payload = new JsonObject().put("value", 42);
        final Future<Boolean> result = publisher.publish(TOPIC, payload);
        payload.put("value", 0);
        connectAttempt.complete(broker.client);

        assertThat(result.result()).isTrue();
        assertThat(broker.publishedPayloads.get(0).toJsonObject()).isEqualTo(new JsonObject().put("value", 42));
    }

    /**
     * Verifies that only one of several overlapping publish operations connects to the
     * broker once the backoff wait time has passed, and that its failure is counted once.
     */
    @Test
    public void testOverlappingPublishesShareBackoffState() {
        final Promise<MqttClient> connectAttempt = Promise.promise();
        when(connectionFactory.connect(any(), any())).thenReturn(connectAttempt.future());
        backoffPolicy.recordAttempt(clock.instant());
        backoffPolicy.recordFailure(new ConnectException("Connection refused"));
        clock.advance(Duration.ofSeconds(2));

        final Future<Boolean> first = publisher.publish(TOPIC, "first");
        final Future<Boolean> second = publisher.publish(TOPIC, "second");
        final Future<Boolean> third = publisher.publish(TOPIC, "third");

        assertThat(first.isComplete()).isFalse();
        assertThat(second.result()).isFalse();
        assertThat(third.result()).isFalse();
        verify(connectionFactory, times(1)).connect(any(), any());

        connectAttempt.fail(new ConnectException("Connection refused"));
        assertThat(first.result()).isFalse();
        assertThat(backoffPolicy.getFailureCount()).isEqualTo(2);
    }

    /**
     * Verifies that every failed attempt of publish operations running concurrently on
     * multiple threads is counted exactly once.
     *
     * @throws Exception if the publishing threads cannot be run.
     */
    @Test
    public void testConcurrentPublishesCountEveryFailure() throws Exception {
        final int threadCount = 8;
        final int publishesPerThread = 50;
        when(connectionFactory.connect(any(), any()))
            .thenReturn(Future.failedFuture(new ConnectException("Connection refused")));
        final BackoffPolicy noBackoff = BackoffPolicy.none();
        final MqttPublisher concurrentPublisher = new MqttPublisher(vertx,
                MqttConnectionConfig.builder("broker.local").build(), connectionFactory, noBackoff, clock);

        final CountDownLatch startSignal = new CountDownLatch(1);
        final List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            tasks.add(() -> {
                startSignal.await();
                int failed = 0;
                for (int j = 0; j < publishesPerThread; j++) {
                    if (!concurrentPublisher.publish(TOPIC, j).result()) {
                        failed++;
                    }
                }
                return failed;
            });
        }
        final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            final List<java.util.concurrent.Future<Integer>> outcomes = new ArrayList<>();
            tasks.forEach(task -> outcomes.add(executor.submit(task)));
            startSignal.countDown();
            int failedPublishes = 0;
            for (final java.util.concurrent.Future<Integer> outcome : outcomes) {
                failedPublishes += outcome.get(10, TimeUnit.SECONDS);
            }
            assertThat(failedPublishes).isEqualTo(threadCount * publishesPerThread);
        } finally {
            executor.shutdownNow();
        }
        assertThat(noBackoff.getFailureCount()).isEqualTo(threadCount * publishesPerThread);
        verify(connectionFactory, times(threadCount * publishesPerThread)).connect(any(), any());
    }
}

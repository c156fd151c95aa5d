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
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static com.google.common.truth.Truth.assertThat;

import java.net.ConnectException;
import java.time.Duration;

import org.eclipse.raptor.client.MockTimers;
import org.eclipse.raptor.config.MqttConnectionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.mqtt.MqttClient;
import io.vertx.mqtt.MqttClientOptions;
import io.vertx.mqtt.MqttConnectionException;

/**
 * Tests verifying behavior of {@link ConnectionHealthChecker}.
 *
 */
class ConnectionHealthCheckerTest {

    private Vertx vertx;
    private MockTimers timers;
    private MqttConnectionFactory connectionFactory;
    private MqttClientMock broker;
    private ConnectionHealthChecker checker;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        vertx = mock(Vertx.class);
        timers = MockTimers.install(vertx);
        broker = new MqttClientMock();
        connectionFactory = mock(MqttConnectionFactory.class);
        when(connectionFactory.connect(any(), any())).thenReturn(Future.succeededFuture(broker.client));
        final MqttConnectionConfig config = MqttConnectionConfig.builder("broker.local")
                .username("device")
                .password("secret")
                .clientId("device-1")
                .build();
        checker = new ConnectionHealthChecker(vertx, config, connectionFactory,
                ConnectionHealthChecker.DEFAULT_TIMEOUT);
    }

    /**
     * Verifies that the check succeeds if the broker acknowledges the probe subscription
     * and that the probe connection is closed afterwards.
     */
    @Test
    public void testCheckSucceedsForHealthyBroker() {
        final Future<Boolean> result = checker.checkConnection();

        assertThat(result.result()).isTrue();
        assertThat(broker.subscribedTopics).containsExactly(ConnectionHealthChecker.PROBE_TOPIC);
        assertThat(broker.isConnected()).isFalse();
        assertThat(timers.pendingDelays()).isEmpty();

        final ArgumentCaptor<MqttClientOptions> options = ArgumentCaptor.forClass(MqttClientOptions.class);
        verify(connectionFactory).connect(any(), options.capture());
        assertThat(options.getValue().getKeepAliveInterval()).isEqualTo(ConnectionHealthChecker.KEEP_ALIVE_SECONDS);
        assertThat(options.getValue().getClientId()).isNotEqualTo("device-1");
    }

    /**
     * Verifies that the check fails if the broker refuses the connection.
     */
    @Test
    public void testCheckFailsForRefusedConnection() {
        when(connectionFactory.connect(any(), any()))
            .thenReturn(Future.failedFuture(new ConnectException("Connection refused")));

        final Future<Boolean> result = checker.checkConnection();

        assertThat(result.succeeded()).isTrue();
        assertThat(result.result()).isFalse();
    }

    /**
     * Verifies that the check fails if the broker rejects the credentials.
     */
    @Test
    public void testCheckFailsForRejectedCredentials() {
        when(connectionFactory.connect(any(), any())).thenReturn(Future.failedFuture(
                new MqttConnectionException(MqttConnectReturnCode.CONNECTION_REFUSED_BAD_USER_NAME_OR_PASSWORD)));

        assertThat(checker.checkConnection().result()).isFalse();
    }

    /**
     * Verifies that the check fails if the broker does not respond in time.
     */
    @Test
    public void testCheckFailsOnTimeout() {
        final Promise<MqttClient> connectAttempt = Promise.promise();
        when(connectionFactory.connect(any(), any())).thenReturn(connectAttempt.future());

        final Future<Boolean> result = checker.checkConnection();
        assertThat(result.isComplete()).isFalse();

        timers.fire(ConnectionHealthChecker.DEFAULT_TIMEOUT.toMillis());
        assertThat(result.result()).isFalse();

        connectAttempt.complete(broker.client);
        verify(broker.client, never()).subscribe(any(String.class), anyInt());
        verify(broker.client).disconnect();
    }

    /**
     * Verifies that a timeout shorter than one millisecond is rounded up to the
     * shortest timer vert.x supports instead of failing the check.
     */
    @Test
    public void testCheckSupportsSubMillisecondTimeout() {
        final Promise<MqttClient> connectAttempt = Promise.promise();
        when(connectionFactory.connect(any(), any())).thenReturn(connectAttempt.future());
        final ConnectionHealthChecker impatientChecker = new ConnectionHealthChecker(vertx,
                MqttConnectionConfig.builder("broker.local").build(), connectionFactory, Duration.ofNanos(500_000));

        final Future<Boolean> result = impatientChecker.checkConnection();

        final ArgumentCaptor<MqttClientOptions> options = ArgumentCaptor.forClass(MqttClientOptions.class);
        verify(connectionFactory).connect(any(), options.capture());
        assertThat(options.getValue().getConnectTimeout()).isEqualTo(1);
        assertThat(timers.pendingDelays()).containsExactly(1L);
        assertThat(timers.fire(1L)).isTrue();
        assertThat(result.result()).isFalse();
    }
}

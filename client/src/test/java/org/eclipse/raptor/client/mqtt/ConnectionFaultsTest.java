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

import static com.google.common.truth.Truth.assertThat;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.vertx.core.VertxException;
import io.vertx.mqtt.MqttConnectionException;

/**
 * Tests verifying behavior of {@link ConnectionFaults}.
 *
 */
class ConnectionFaultsTest {

    /**
     * Verifies that transport and protocol level failures are classified as connectivity faults.
     */
    @Test
    public void testIsConnectivityFault() {
        assertThat(ConnectionFaults.isConnectivityFault(new ConnectException("Connection refused"))).isTrue();
        assertThat(ConnectionFaults.isConnectivityFault(new TimeoutException())).isTrue();
        assertThat(ConnectionFaults.isConnectivityFault(new BrokerConnectionException("no PUBACK"))).isTrue();
        assertThat(ConnectionFaults.isConnectivityFault(new VertxException("Connection was closed"))).isTrue();
        assertThat(ConnectionFaults.isConnectivityFault(
                new MqttConnectionException(MqttConnectReturnCode.CONNECTION_REFUSED_SERVER_UNAVAILABLE))).isTrue();
        assertThat(ConnectionFaults.isConnectivityFault(
                new IllegalStateException("wrapped", new ConnectException()))).isTrue();
    }

    /**
     * Verifies that programming errors are not classified as connectivity faults.
     */
    @Test
    public void testIsNotConnectivityFault() {
        assertThat(ConnectionFaults.isConnectivityFault(new IllegalStateException("unexpected"))).isFalse();
        assertThat(ConnectionFaults.isConnectivityFault(new VertxException("something else"))).isFalse();
        assertThat(ConnectionFaults.isConnectivityFault(null)).isFalse();
    }

    /**
     * Verifies that rejected credentials are detected.
     */
    @Test
    public void testIsAuthenticationFault() {
        assertThat(ConnectionFaults.isAuthenticationFault(
                new MqttConnectionException(MqttConnectReturnCode.CONNECTION_REFUSED_NOT_AUTHORIZED))).isTrue();
        assertThat(ConnectionFaults.isAuthenticationFault(
                new MqttConnectionException(MqttConnectReturnCode.CONNECTION_REFUSED_SERVER_UNAVAILABLE))).isFalse();
        assertThat(ConnectionFaults.isAuthenticationFault(new ConnectException())).isFalse();
    }
}

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

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.vertx.core.VertxException;
import io.vertx.mqtt.MqttConnectionException;

/**
 * Helper for classifying failures that occur while communicating with an MQTT broker.
 */
public final class ConnectionFaults {

    private static final String CONNECTION_CLOSED = "Connection was closed";

    private ConnectionFaults() {
    }

    /**
     * Checks whether a failure has been caused by a broken or refused connection.
     *
     * @param error The failure.
     * @return {@code true} if the failure is (or has been caused by) a connectivity problem,
     *         e.g. the broker being unreachable, rejecting the credentials, resetting the
     *         transport or not responding in time.
     */
    public static boolean isConnectivityFault(final Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof BrokerConnectionException
                    || t instanceof MqttConnectionException
                    || t instanceof IOException
                    || t instanceof TimeoutException) {
                return true;
            }
            if (t instanceof VertxException && CONNECTION_CLOSED.equals(t.getMessage())) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    /**
     * Checks whether a failure has been caused by the broker rejecting the client's credentials.
     *
     * @param error The failure.
     * @return {@code true} if the broker refused the connection because of bad credentials
     *         or missing authorization.
     */
    public static boolean isAuthenticationFault(final Throwable error) {
        if (error instanceof MqttConnectionException) {
            final MqttConnectReturnCode code = ((MqttConnectionException) error).code();
            return code == MqttConnectReturnCode.CONNECTION_REFUSED_BAD_USER_NAME_OR_PASSWORD
                    || code == MqttConnectReturnCode.CONNECTION_REFUSED_NOT_AUTHORIZED;
        }
        return false;
    }
}

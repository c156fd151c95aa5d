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

/**
 * Indicates that the connection to the MQTT broker could not be established,
 * has been lost or that the broker did not respond in time.
 * <p>
 * Failures of this kind are recovered from by trying again later.
 */
public class BrokerConnectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message.
     *
     * @param message The detail message.
     */
    public BrokerConnectionException(final String message) {
        super(message);
    }

    /**
     * Creates a new exception for a detail message and a root cause.
     *
     * @param message The detail message.
     * @param cause The root cause.
     */
    public BrokerConnectionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

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
 * The states of a {@link PersistentListener}.
 */
public enum ListenerState {

    /**
     * No connection is established and no connection attempt is in progress.
     */
    DISCONNECTED,
    /**
     * Waiting for the backoff policy to permit the next connection attempt.
     */
    BACKOFF_WAIT,
    /**
     * A connection is being established and the subscription is being created.
     */
    CONNECTING,
    /**
     * The subscription is active and messages are being received.
     */
    CONNECTED,
    /**
     * The listener has been stopped. This is a terminal state.
     */
    CLOSED
}

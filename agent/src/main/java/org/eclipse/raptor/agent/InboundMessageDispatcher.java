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

package org.eclipse.raptor.agent;

import org.eclipse.raptor.client.mqtt.InboundMessage;

/**
 * Business logic processing the messages received on the agent's messages topic.
 */
@FunctionalInterface
public interface InboundMessageDispatcher {

    /**
     * Processes a message.
     * <p>
     * This method is invoked on the vert.x event loop and must not block.
     *
     * @param message The message.
     */
    void dispatch(InboundMessage message);
}

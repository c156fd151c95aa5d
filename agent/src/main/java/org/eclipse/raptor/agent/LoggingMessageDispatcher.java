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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A dispatcher which only logs the messages it receives.
 */
public final class LoggingMessageDispatcher implements InboundMessageDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingMessageDispatcher.class);

    @Override
    public void dispatch(final InboundMessage message) {
        LOG.info("received message on topic [{}]: {}", message.getTopic(), message.getBody());
    }
}

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

package org.eclipse.raptor.config;

import java.util.Objects;

/**
 * The configuration of the agent's cloud connection.
 */
public final class AgentConfig {

    private final MqttConnectionConfig mqttConfig;
    private final TopicConfig topicConfig;

    /**
     * Creates a new configuration.
     *
     * @param mqttConfig The properties for connecting to the broker.
     * @param topicConfig The topic layout.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public AgentConfig(final MqttConnectionConfig mqttConfig, final TopicConfig topicConfig) {
        this.mqttConfig = Objects.requireNonNull(mqttConfig);
        this.topicConfig = Objects.requireNonNull(topicConfig);
    }

    /**
     * Gets the properties for connecting to the broker.
     *
     * @return The properties.
     */
    public MqttConnectionConfig getMqttConfig() {
        return mqttConfig;
    }

    /**
     * Gets the topic layout.
     *
     * @return The topic configuration.
     */
    public TopicConfig getTopicConfig() {
        return topicConfig;
    }
}

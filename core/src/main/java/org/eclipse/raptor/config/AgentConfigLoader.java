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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * Loads the agent's configuration from a JSON file.
 * <p>
 * The file is expected to contain an {@code mqtt} object with the broker connection
 * properties and a {@code telemetry} object with the topic layout, e.g.
 * <pre>
 * {
 *   "mqtt": { "broker": "mqtt.example.com", "port": 1883, "username": "dev", "password": "secret", "client_id": "raptor-1" },
 *   "telemetry": { "interval": 60, "root_path": "raptors/raptor-1", "telemetry_path": "telemetry", "messages_path": "messages" }
 * }
 * </pre>
 */
public final class AgentConfigLoader {

    /**
     * The name of the environment variable containing the path to the configuration file.
     */
    public static final String ENV_CONFIG_PATH = "RAPTOR_CONFIG";
    /**
     * The path of the configuration file used if none is given explicitly.
     */
    public static final String DEFAULT_CONFIG_PATH = "/etc/raptor/agent.json";

    static final String SECTION_MQTT = "mqtt";
    static final String SECTION_TELEMETRY = "telemetry";

    private static final Logger LOG = LoggerFactory.getLogger(AgentConfigLoader.class);

    private AgentConfigLoader() {
    }

    /**
     * Determines the configuration file to use.
     *
     * @param args The program arguments. The first argument, if present, is used as the path.
     * @param env The environment to look up {@value #ENV_CONFIG_PATH} in.
     * @return The path of the configuration file.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static Path resolvePath(final String[] args, final Map<String, String> env) {
        Objects.requireNonNull(args);
        Objects.requireNonNull(env);

        if (args.length > 0) {
            return Path.of(args[0]);
        }
        return Path.of(env.getOrDefault(ENV_CONFIG_PATH, DEFAULT_CONFIG_PATH));
    }

    /**
     * Loads the configuration from a file.
     *
     * @param path The path to the file.
     * @return The configuration.
     * @throws NullPointerException if path is {@code null}.
     * @throws IllegalArgumentException if the file cannot be read or does not contain
     *                                  a valid configuration.
     */
    public static AgentConfig load(final Path path) {
        Objects.requireNonNull(path);

        LOG.info("loading configuration from {}", path);
        final String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new IllegalArgumentException("cannot read configuration file " + path, e);
        }
        try {
            return fromJson(new JsonObject(content));
        } catch (final DecodeException e) {
            throw new IllegalArgumentException("configuration file " + path + " does not contain a JSON object", e);
        }
    }

    /**
     * Creates the configuration from its JSON representation.
     *
     * @param json The JSON object containing the {@code mqtt} and {@code telemetry} sections.
     * @return The configuration.
     * @throws NullPointerException if json is {@code null}.
     * @throws IllegalArgumentException if a section is missing or invalid.
     */
    public static AgentConfig fromJson(final JsonObject json) {
        Objects.requireNonNull(json);

        final AgentConfig config;
        try {
            config = new AgentConfig(
                    MqttConnectionConfig.fromJson(section(json, SECTION_MQTT)),
                    TopicConfig.fromJson(section(json, SECTION_TELEMETRY)));
        } catch (final ClassCastException e) {
            throw new IllegalArgumentException("configuration contains property of wrong type", e);
        }
        LOG.debug("using {}", config.getMqttConfig());
        return config;
    }

    private static JsonObject section(final JsonObject json, final String name) {
        final Object section = json.getValue(name);
        if (!(section instanceof JsonObject)) {
            throw new IllegalArgumentException(String.format("configuration lacks [%s] object", name));
        }
        return (JsonObject) section;
    }
}

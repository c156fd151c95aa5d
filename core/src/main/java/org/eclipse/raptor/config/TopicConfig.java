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

import org.eclipse.raptor.util.Strings;

import io.vertx.core.json.JsonObject;

/**
 * The topic layout and upload schedule used by the agent.
 * <p>
 * Every topic is made up of the device's root path and a fixed suffix per purpose,
 * separated by {@value #PATH_SEPARATOR}.
 */
public final class TopicConfig {

    /**
     * The character separating the root path from the purpose specific suffix.
     */
    public static final String PATH_SEPARATOR = "/";
    /**
     * The suffix used for command responses if none is configured.
     */
    public static final String DEFAULT_RESPONSE_PATH = "cmd_response";
    /**
     * The maximum number of stored telemetry records uploaded at once if no limit is configured.
     */
    public static final int DEFAULT_BACKLOG_LIMIT = 200;

    static final String FIELD_INTERVAL = "interval";
    static final String FIELD_ROOT_PATH = "root_path";
    static final String FIELD_TELEMETRY_PATH = "telemetry_path";
    static final String FIELD_STATUS_PATH = "status_path";
    static final String FIELD_ALARMS_PATH = "alarms_path";
    static final String FIELD_MESSAGES_PATH = "messages_path";
    static final String FIELD_RESPONSE_PATH = "response_path";
    static final String FIELD_BACKLOG_LIMIT = "backlog_limit";

    private final int intervalSeconds;
    private final String rootPath;
    private final String telemetryPath;
    private final String statusPath;
    private final String alarmsPath;
    private final String messagesPath;
    private final String responsePath;
    private final int backlogLimit;

    private TopicConfig(
            final int intervalSeconds,
            final String rootPath,
            final String telemetryPath,
            final String statusPath,
            final String alarmsPath,
            final String messagesPath,
            final String responsePath,
            final int backlogLimit) {
        this.intervalSeconds = intervalSeconds;
        this.rootPath = rootPath;
        this.telemetryPath = telemetryPath;
        this.statusPath = statusPath;
        this.alarmsPath = alarmsPath;
        this.messagesPath = messagesPath;
        this.responsePath = responsePath;
        this.backlogLimit = backlogLimit;
    }

    /**
     * Creates a topic configuration from its JSON representation.
     * <p>
     * The {@code interval}, {@code root_path}, {@code telemetry_path} and {@code messages_path}
     * properties are mandatory.
     *
     * @param json The JSON object.
     * @return The configuration.
     * @throws NullPointerException if json is {@code null}.
     * @throws IllegalArgumentException if a mandatory property is missing or any of the
     *                                  properties has an invalid value.
     */
    public static TopicConfig fromJson(final JsonObject json) {
        Objects.requireNonNull(json);

        final int interval;
        try {
            interval = Integer.parseInt(String.valueOf(requireValue(json, FIELD_INTERVAL)));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("telemetry interval must be an integer", e);
        }
        if (interval <= 0) {
            throw new IllegalArgumentException("telemetry interval must be positive");
        }
        final int backlogLimit;
        try {
            backlogLimit = json.getInteger(FIELD_BACKLOG_LIMIT, DEFAULT_BACKLOG_LIMIT);
        } catch (final ClassCastException e) {
            throw new IllegalArgumentException("backlog limit must be an integer", e);
        }
        if (backlogLimit <= 0) {
            throw new IllegalArgumentException("backlog limit must be positive");
        }
        return new TopicConfig(
                interval,
                requireString(json, FIELD_ROOT_PATH),
                requireString(json, FIELD_TELEMETRY_PATH),
                optionalString(json, FIELD_STATUS_PATH, ""),
                optionalString(json, FIELD_ALARMS_PATH, ""),
                requireString(json, FIELD_MESSAGES_PATH),
                optionalString(json, FIELD_RESPONSE_PATH, DEFAULT_RESPONSE_PATH),
                backlogLimit);
    }

    private static Object requireValue(final JsonObject json, final String name) {
        final Object value = json.getValue(name);
        if (value == null) {
            throw new IllegalArgumentException(String.format("telemetry configuration lacks property [%s]", name));
        }
        return value;
    }

    private static String requireString(final JsonObject json, final String name) {
        final Object value = requireValue(json, name);
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(String.format("property [%s] must be a string", name));
        }
        return (String) value;
    }

    private static String optionalString(final JsonObject json, final String name, final String defaultValue) {
        final Object value = json.getValue(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(String.format("property [%s] must be a string", name));
        }
        return (String) value;
    }

    private String topic(final String path) {
        if (Strings.isNullOrEmpty(path)) {
            throw new IllegalStateException("no path configured for topic");
        }
        return rootPath + PATH_SEPARATOR + path;
    }

    /**
     * Gets the period at which stored telemetry data is uploaded.
     *
     * @return The interval in seconds.
     */
    public int getIntervalSeconds() {
        return intervalSeconds;
    }

    /**
     * Gets the maximum number of stored telemetry records to upload at once.
     *
     * @return The limit.
     */
    public int getBacklogLimit() {
        return backlogLimit;
    }

    /**
     * Gets the device's root path.
     *
     * @return The path.
     */
    public String getRootPath() {
        return rootPath;
    }

    /**
     * Gets the topic that telemetry data is published to.
     *
     * @return The topic name.
     */
    public String getTelemetryTopic() {
        return topic(telemetryPath);
    }

    /**
     * Gets the topic that status information is published to.
     *
     * @return The topic name.
     * @throws IllegalStateException if no status path has been configured.
     */
    public String getStatusTopic() {
        return topic(statusPath);
    }

    /**
     * Gets the topic that alarms are published to.
     *
     * @return The topic name.
     * @throws IllegalStateException if no alarms path has been configured.
     */
    public String getAlarmsTopic() {
        return topic(alarmsPath);
    }

    /**
     * Gets the topic that the agent listens on for inbound commands and messages.
     *
     * @return The topic name.
     */
    public String getMessagesTopic() {
        return topic(messagesPath);
    }

    /**
     * Gets the topic that command responses are published to.
     *
     * @return The topic name.
     */
    public String getResponseTopic() {
        return topic(responsePath);
    }
}

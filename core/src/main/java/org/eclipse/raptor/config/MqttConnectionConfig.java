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
 * Properties required for connecting to an MQTT broker.
 * <p>
 * Instances are immutable. They are either created from the {@code mqtt} section of the
 * agent's configuration file by means of {@link #fromJson(JsonObject)} or by means of a
 * {@link Builder}. Both validate the values and fail fast on a malformed configuration.
 */
public final class MqttConnectionConfig {

    /**
     * The default MQTT port.
     */
    public static final int DEFAULT_PORT = 1883;
    /**
     * The default keep-alive interval (seconds).
     */
    public static final int DEFAULT_KEEP_ALIVE = 60;
    /**
     * The default clean session flag.
     * <p>
     * The broker keeps the subscriptions and queued QoS 1 messages of the device's
     * listener while the device is offline.
     */
    public static final boolean DEFAULT_CLEAN_SESSION = false;
    /**
     * The default amount of time (milliseconds) to wait for a TCP connection to be established.
     */
    public static final int DEFAULT_CONNECT_TIMEOUT = 5000; // ms
    /**
     * The default amount of time (milliseconds) to wait for a PUBACK or SUBACK packet.
     */
    public static final long DEFAULT_ACK_TIMEOUT = 10_000L; // ms
    /**
     * The telemetry format used if none is configured.
     */
    public static final String FORMAT_FLAT = "flat-1";

    static final String FIELD_BROKER = "broker";
    static final String FIELD_PORT = "port";
    static final String FIELD_USERNAME = "username";
    static final String FIELD_PASSWORD = "password";
    static final String FIELD_CLIENT_ID = "client_id";
    static final String FIELD_FORMAT = "format";
    static final String FIELD_KEEP_ALIVE = "keepalive";
    static final String FIELD_CLEAN_SESSION = "clean_session";
    static final String FIELD_CONNECT_TIMEOUT = "connect_timeout_ms";
    static final String FIELD_ACK_TIMEOUT = "ack_timeout_ms";

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String clientId;
    private final String format;
    private final int keepAliveSeconds;
    private final boolean cleanSession;
    private final int connectTimeoutMillis;
    private final long ackTimeoutMillis;

    private MqttConnectionConfig(final Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.clientId = builder.clientId;
        this.format = builder.format;
        this.keepAliveSeconds = builder.keepAliveSeconds;
        this.cleanSession = builder.cleanSession;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.ackTimeoutMillis = builder.ackTimeoutMillis;
    }

    /**
     * Creates a new builder.
     *
     * @param host The host name or literal IP address of the broker.
     * @return The builder.
     * @throws NullPointerException if host is {@code null}.
     */
    public static Builder builder(final String host) {
        return new Builder(host);
    }

    /**
     * Creates connection properties from their JSON representation.
     * <p>
     * The {@code broker}, {@code port}, {@code username}, {@code password} and
     * {@code client_id} properties are mandatory.
     *
     * @param json The JSON object.
     * @return The properties.
     * @throws NullPointerException if json is {@code null}.
     * @throws IllegalArgumentException if a mandatory property is missing or any of the
     *                                  properties has an invalid value.
     */
    public static MqttConnectionConfig fromJson(final JsonObject json) {
        Objects.requireNonNull(json);

        final Object port = json.getValue(FIELD_PORT);
        if (!(port instanceof Integer)) {
            throw new IllegalArgumentException("port must be an integer");
        }
        try {
            return builder(requireString(json, FIELD_BROKER))
                    .port((Integer) port)
                    .username(requireString(json, FIELD_USERNAME))
                    .password(requireString(json, FIELD_PASSWORD))
                    .clientId(requireString(json, FIELD_CLIENT_ID))
                    .format(json.getString(FIELD_FORMAT, FORMAT_FLAT))
                    .keepAlive(json.getInteger(FIELD_KEEP_ALIVE, DEFAULT_KEEP_ALIVE))
                    .cleanSession(json.getBoolean(FIELD_CLEAN_SESSION, DEFAULT_CLEAN_SESSION))
                    .connectTimeout(json.getInteger(FIELD_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT))
                    .ackTimeout(json.getLong(FIELD_ACK_TIMEOUT, DEFAULT_ACK_TIMEOUT))
                    .build();
        } catch (final ClassCastException e) {
            throw new IllegalArgumentException("MQTT configuration contains property of wrong type", e);
        }
    }

    private static String requireString(final JsonObject json, final String name) {
        final String value = json.getString(name);
        if (value == null) {
            throw new IllegalArgumentException(String.format("MQTT configuration lacks property [%s]", name));
        }
        return value;
    }

    /**
     * Gets the host name or literal IP address of the broker.
     *
     * @return The host.
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets the port of the broker.
     *
     * @return The port number.
     */
    public int getPort() {
        return port;
    }

    /**
     * Gets the user name to authenticate with.
     *
     * @return The user name or {@code null} if the broker does not require authentication.
     */
    public String getUsername() {
        return username;
    }

    /**
     * Gets the password to authenticate with.
     *
     * @return The password or {@code null} if the broker does not require authentication.
     */
    public String getPassword() {
        return password;
    }

    /**
     * Gets the client identifier to use for the long-lived subscription.
     *
     * @return The identifier or {@code null} if the client should let the broker
     *         assign an identifier.
     */
    public String getClientId() {
        return clientId;
    }

    /**
     * Gets the name of the format that telemetry data is published in.
     *
     * @return The format name.
     */
    public String getFormat() {
        return format;
    }

    /**
     * Gets the keep-alive interval.
     *
     * @return The interval in seconds.
     */
    public int getKeepAliveSeconds() {
        return keepAliveSeconds;
    }

    /**
     * Checks whether the broker should discard session state on connect.
     *
     * @return {@code true} if a clean session should be requested.
     */
    public boolean isCleanSession() {
        return cleanSession;
    }

    /**
     * Gets the maximum amount of time to wait for a TCP connection to the broker
     * to be established.
     *
     * @return The timeout in milliseconds.
     */
    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    /**
     * Gets the maximum amount of time to wait for the broker to acknowledge
     * a PUBLISH or SUBSCRIBE packet.
     *
     * @return The timeout in milliseconds.
     */
    public long getAckTimeoutMillis() {
        return ackTimeoutMillis;
    }

    @Override
    public String toString() {
        return new StringBuilder("MqttConnectionConfig [host: ").append(host)
                .append(", port: ").append(port)
                .append(", username: ").append(username)
                .append(", client-id: ").append(clientId)
                .append(", keep-alive: ").append(keepAliveSeconds)
                .append(", clean-session: ").append(cleanSession)
                .append("]")
                .toString();
    }

    /**
     * A builder for connection properties.
     */
    public static final class Builder {

        private final String host;
        private int port = DEFAULT_PORT;
        private String username;
        private String password;
        private String clientId;
        private String format = FORMAT_FLAT;
        private int keepAliveSeconds = DEFAULT_KEEP_ALIVE;
        private boolean cleanSession = DEFAULT_CLEAN_SESSION;
        private int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT;
        private long ackTimeoutMillis = DEFAULT_ACK_TIMEOUT;

        private Builder(final String host) {
            this.host = Objects.requireNonNull(host);
        }

        /**
         * Sets the broker port.
         *
         * @param port The port number.
         * @return This builder for command chaining.
         */
        public Builder port(final int port) {
            this.port = port;
            return this;
        }

        /**
         * Sets the user name.
         *
         * @param username The user name.
         * @return This builder for command chaining.
         */
        public Builder username(final String username) {
            this.username = username;
            return this;
        }

        /**
         * Sets the password.
         *
         * @param password The password.
         * @return This builder for command chaining.
         */
        public Builder password(final String password) {
            this.password = password;
            return this;
        }

        /**
         * Sets the client identifier.
         *
         * @param clientId The identifier.
         * @return This builder for command chaining.
         */
        public Builder clientId(final String clientId) {
            this.clientId = clientId;
            return this;
        }

        /**
         * Sets the telemetry format name.
         *
         * @param format The format.
         * @return This builder for command chaining.
         * @throws NullPointerException if format is {@code null}.
         */
        public Builder format(final String format) {
            this.format = Objects.requireNonNull(format);
            return this;
        }

        /**
         * Sets the keep-alive interval.
         *
         * @param seconds The interval in seconds.
         * @return This builder for command chaining.
         */
        public Builder keepAlive(final int seconds) {
            this.keepAliveSeconds = seconds;
            return this;
        }

        /**
         * Sets the clean session flag.
         * <p>
         * The default value of this property is {@value MqttConnectionConfig#DEFAULT_CLEAN_SESSION}.
         *
         * @param cleanSession {@code true} if a clean session should be requested.
         * @return This builder for command chaining.
         */
        public Builder cleanSession(final boolean cleanSession) {
            this.cleanSession = cleanSession;
            return this;
        }

        /**
         * Sets the connect timeout.
         *
         * @param millis The timeout in milliseconds.
         * @return This builder for command chaining.
         */
        public Builder connectTimeout(final int millis) {
            this.connectTimeoutMillis = millis;
            return this;
        }

        /**
         * Sets the acknowledgement timeout.
         *
         * @param millis The timeout in milliseconds.
         * @return This builder for command chaining.
         */
        public Builder ackTimeout(final long millis) {
            this.ackTimeoutMillis = millis;
            return this;
        }

        /**
         * Creates connection properties from this builder's values.
         *
         * @return The properties.
         * @throws IllegalArgumentException if any of the values is invalid.
         */
        public MqttConnectionConfig build() {
            if (Strings.isNullOrEmpty(host)) {
                throw new IllegalArgumentException("broker host must not be empty");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535");
            }
            if (keepAliveSeconds < 0) {
                throw new IllegalArgumentException("keep-alive interval must not be negative");
            }
            if (connectTimeoutMillis <= 0) {
                throw new IllegalArgumentException("connect timeout must be positive");
            }
            if (ackTimeoutMillis <= 0) {
                throw new IllegalArgumentException("acknowledgement timeout must be positive");
            }
            return new MqttConnectionConfig(this);
        }
    }
}

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

package org.eclipse.raptor.client.telemetry;

import java.util.List;
import java.util.Objects;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A batch of stored telemetry records and the identifiers they are stored under.
 * <p>
 * The identifier at index {@code i} belongs to the record at index {@code i}.
 */
public final class TelemetryBacklog {

    private static final TelemetryBacklog EMPTY = new TelemetryBacklog(new JsonArray(), List.of());

    private final JsonArray records;
    private final List<Long> ids;

    private TelemetryBacklog(final JsonArray records, final List<Long> ids) {
        this.records = records;
        this.ids = ids;
    }

    /**
     * Gets an empty backlog.
     *
     * @return The backlog.
     */
    public static TelemetryBacklog empty() {
        return EMPTY;
    }

    /**
     * Creates a backlog.
     *
     * @param records The records.
     * @param ids The identifiers of the records.
     * @return The backlog.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the number of records and identifiers differ.
     */
    public static TelemetryBacklog of(final List<JsonObject> records, final List<Long> ids) {
        Objects.requireNonNull(records);
        Objects.requireNonNull(ids);
        if (records.size() != ids.size()) {
            throw new IllegalArgumentException("number of records and identifiers must match");
        }
        final JsonArray array = new JsonArray();
        records.forEach(record -> array.add(record.copy()));
        return new TelemetryBacklog(array, List.copyOf(ids));
    }

    /**
     * Gets the records.
     *
     * @return A copy of the records, in store order.
     */
    public JsonArray getRecords() {
        return records.copy();
    }

    /**
     * Gets the identifiers of the records.
     *
     * @return The unmodifiable list of identifiers.
     */
    public List<Long> getIds() {
        return ids;
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }
}

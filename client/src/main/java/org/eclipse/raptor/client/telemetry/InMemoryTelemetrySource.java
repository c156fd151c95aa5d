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

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.json.JsonObject;

/**
 * A bounded in-memory store of telemetry records.
 * <p>
 * Records that have no {@value #FIELD_TIMESTAMP} property are stamped with the time
 * (epoch seconds) they have been added at. Once the capacity is reached, the oldest
 * record is dropped for every record added.
 * <p>
 * This class is thread safe.
 */
public final class InMemoryTelemetrySource implements TelemetrySource {

    /**
     * The name of the property holding the time at which a record has been stored.
     */
    public static final String FIELD_TIMESTAMP = "timestamp";
    /**
     * The default maximum number of records kept.
     */
    public static final int DEFAULT_CAPACITY = 10_000;

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTelemetrySource.class);

    private final Map<Long, JsonObject> records = new LinkedHashMap<>();
    private final int capacity;
    private final Clock clock;
    private long nextId = 1;

    /**
     * Creates a store with the default capacity.
     */
    public InMemoryTelemetrySource() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    /**
     * Creates a store.
     *
     * @param capacity The maximum number of records to keep.
     * @param clock The clock to determine the time at which records are added.
     * @throws NullPointerException if clock is {@code null}.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    public InMemoryTelemetrySource(final int capacity, final Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Adds a record.
     *
     * @param record The record.
     * @return The identifier the record has been stored under.
     * @throws NullPointerException if record is {@code null}.
     */
    public synchronized long add(final JsonObject record) {
        Objects.requireNonNull(record);
        final JsonObject copy = record.copy();
        if (!copy.containsKey(FIELD_TIMESTAMP)) {
            copy.put(FIELD_TIMESTAMP, clock.instant().getEpochSecond());
        }
        if (records.size() >= capacity) {
            final Iterator<Long> oldest = records.keySet().iterator();
            LOG.debug("telemetry store is full, dropping record [id: {}]", oldest.next());
            oldest.remove();
        }
        final long id = nextId++;
        records.put(id, copy);
        return id;
    }

    /**
     * Gets the number of records in this store.
     *
     * @return The number of records.
     */
    public synchronized int size() {
        return records.size();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Returns the most recently added records first.
     */
    @Override
    public synchronized TelemetryBacklog getStoredTelemetry(final int limit) {
        if (records.isEmpty() || limit <= 0) {
            return TelemetryBacklog.empty();
        }
        final List<Long> allIds = new ArrayList<>(records.keySet());
        final List<Long> ids = new ArrayList<>();
        final List<JsonObject> batch = new ArrayList<>();
        for (int i = allIds.size() - 1; i >= 0 && ids.size() < limit; i--) {
            final Long id = allIds.get(i);
            ids.add(id);
            batch.add(records.get(id));
        }
        if (batch.size() > 1) {
            LOG.info("collected backlog of {} telemetry records", batch.size());
        }
        return TelemetryBacklog.of(batch, ids);
    }

    @Override
    public synchronized void removeStoredTelemetry(final List<Long> ids) {
        Objects.requireNonNull(ids);
        final Set<Long> toRemove = new HashSet<>(ids);
        final int sizeBefore = records.size();
        records.keySet().removeAll(toRemove);
        LOG.debug("removed {} telemetry records", sizeBefore - records.size());
    }
}

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

/**
 * A store of telemetry records that have not been uploaded yet.
 * <p>
 * Implementations may block, e.g. because they access a local database. Callers
 * running on a vert.x event loop must therefore invoke the methods on a worker thread.
 */
public interface TelemetrySource {

    /**
     * Gets the most recent stored records.
     *
     * @param limit The maximum number of records to return.
     * @return The records together with their identifiers (may be empty).
     * @throws RuntimeException if the store cannot be read.
     */
    TelemetryBacklog getStoredTelemetry(int limit);

    /**
     * Removes records from the store.
     *
     * @param ids The identifiers of the records to remove. Unknown identifiers are ignored.
     * @throws NullPointerException if ids is {@code null}.
     * @throws RuntimeException if the store cannot be updated.
     */
    void removeStoredTelemetry(List<Long> ids);
}

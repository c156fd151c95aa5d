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

package org.eclipse.raptor.util;

/**
 * A helper class for working with {@link String}s.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Checks if a value is {@code null} or empty.
     * <p>
     * The value is considered empty if its string representation (as returned by
     * {@link Object#toString()}) is {@code null} or has zero length.
     *
     * @param value The value to check.
     * @return {@code true} if the value is {@code null} or the string representation is empty.
     */
    public static boolean isNullOrEmpty(final Object value) {
        if (value == null) {
            return true;
        }

        final String s = value.toString();

        return s == null || s.isEmpty();
    }

    /**
     * Gets a printable, size limited representation of a byte payload.
     * <p>
     * Used for logging message payloads which may be arbitrarily large or
     * not contain text at all.
     *
     * @param payload The payload, interpreted as UTF-8.
     * @param maxLength The maximum number of characters to include.
     * @return The text, suffixed with {@code ...} if it has been truncated.
     */
    public static String abbreviate(final String payload, final int maxLength) {
        if (payload == null) {
            return "null";
        }
        if (payload.length() <= maxLength) {
            return payload;
        }
        return payload.substring(0, maxLength) + "...";
    }
}

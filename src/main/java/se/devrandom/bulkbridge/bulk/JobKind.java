/*
 * Bulkbridge - Salesforce Bulk Data Integration
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.bulkbridge.bulk;

public enum JobKind {
    INGEST("ingest"),
    QUERY("query");

    private final String pathSegment;

    JobKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /**
     * Path segment under {@code /jobs/}.
     */
    public String pathSegment() {
        return pathSegment;
    }

    public static JobKind fromString(String value) {
        for (JobKind kind : values()) {
            if (kind.pathSegment.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown job kind: " + value);
    }
}

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

public enum BulkOperation {
    INSERT("insert", JobKind.INGEST),
    UPDATE("update", JobKind.INGEST),
    UPSERT("upsert", JobKind.INGEST),
    DELETE("delete", JobKind.INGEST),
    HARD_DELETE("hardDelete", JobKind.INGEST),
    QUERY("query", JobKind.QUERY),
    QUERY_ALL("queryAll", JobKind.QUERY);

    private final String wireName;
    private final JobKind kind;

    BulkOperation(String wireName, JobKind kind) {
        this.wireName = wireName;
        this.kind = kind;
    }

    public String wireName() {
        return wireName;
    }

    public JobKind kind() {
        return kind;
    }

    public static BulkOperation fromWire(String value) {
        if (value != null) {
            for (BulkOperation op : values()) {
                if (op.wireName.equalsIgnoreCase(value.trim())) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown bulk operation: " + value);
    }
}

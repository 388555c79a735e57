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

import java.util.Map;

/**
 * Key that ties an ingest outcome back to the submitted row. Upserts use the external id,
 * update and delete use {@code Id}, inserts fall back to all field values in column order.
 */
public final class CorrelationKey {
    private static final String SEPARATOR = "\u001f";

    private CorrelationKey() {
    }

    /**
     * @param fields submitted values keyed by column name, in upload column order
     */
    public static String of(BulkOperation operation, String externalIdField, Map<String, String> fields) {
        String keyField = switch (operation) {
            case UPSERT -> externalIdField;
            case UPDATE, DELETE, HARD_DELETE -> "Id";
            default -> null;
        };
        if (keyField != null) {
            for (Map.Entry<String, String> entry : fields.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(keyField)) {
                    return entry.getValue();
                }
            }
        }
        return String.join(SEPARATOR, fields.values());
    }
}

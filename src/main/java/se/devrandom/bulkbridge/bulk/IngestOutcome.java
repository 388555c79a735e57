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
 * Per-record result of an ingest job.
 *
 * @param correlationKey key matching the outcome to the submitted row (external id, Id, or row signature)
 * @param fields         submitted field values echoed back by the service, in upload column order
 */
public record IngestOutcome(String recordId,
                            boolean success,
                            boolean created,
                            String errorCode,
                            String errorMessage,
                            String correlationKey,
                            Map<String, String> fields) {

    public static IngestOutcome success(String recordId, boolean created, String correlationKey, Map<String, String> fields) {
        return new IngestOutcome(recordId, true, created, null, null, correlationKey, fields);
    }

    /**
     * @param sfError raw {@code sf__Error} value, usually {@code CODE:message}
     */
    public static IngestOutcome failure(String recordId, String sfError, String correlationKey, Map<String, String> fields) {
        String code = null;
        String message = sfError;
        if (sfError != null) {
            int colon = sfError.indexOf(':');
            if (colon > 0 && sfError.substring(0, colon).matches("[A-Z_]+")) {
                code = sfError.substring(0, colon);
                message = sfError.substring(colon + 1).trim();
            }
        }
        return new IngestOutcome(recordId == null || recordId.isEmpty() ? null : recordId,
                false, false, code, message, correlationKey, fields);
    }
}

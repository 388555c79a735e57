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
package se.devrandom.bulkbridge.bulk.exception;

public class RateLimitException extends BulkApiException {
    private final boolean retryable;

    public RateLimitException(String message, String operation, String jobId, Integer httpStatus,
                              String responseBody, Throwable cause) {
        super(message, operation, jobId, httpStatus, responseBody, cause);
        this.retryable = true;
    }

    /**
     * Raised locally when the configured share of the daily API budget is used up.
     * Waiting a few seconds does not help, so it is not retried.
     */
    public static RateLimitException budgetExhausted(String operation, long used, long maxAllowed) {
        return new RateLimitException(
                String.format("API budget exhausted: used %d of %d allowed requests", used, maxAllowed),
                operation, false);
    }

    private RateLimitException(String message, String operation, boolean retryable) {
        super(message, operation, null, null, null, null);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}

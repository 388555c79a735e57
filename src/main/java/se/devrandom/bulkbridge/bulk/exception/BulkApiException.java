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

/**
 * Base class for every failure talking to the Bulk API.
 * Carries enough context (job id, operation, HTTP status, response body) to reproduce the failing request.
 */
public class BulkApiException extends RuntimeException {
    private final String jobId;
    private final String operation;
    private final Integer httpStatus;
    private final String responseBody;

    public BulkApiException(String message, String operation, String jobId, Integer httpStatus,
                            String responseBody, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
        this.operation = operation;
        this.httpStatus = httpStatus;
        this.responseBody = responseBody;
    }

    public BulkApiException(String message, String operation, String jobId) {
        this(message, operation, jobId, null, null, null);
    }

    public String getJobId() {
        return jobId;
    }

    public String getOperation() {
        return operation;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * Whether the failed call may succeed if repeated after a pause.
     */
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (operation != null) {
            sb.append(" [operation=").append(operation);
            if (jobId != null) {
                sb.append(", jobId=").append(jobId);
            }
            if (httpStatus != null) {
                sb.append(", status=").append(httpStatus);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}

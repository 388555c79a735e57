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
 * Success and error outcome sets of an ingest job do not add up to the submitted rows.
 */
public class OutcomeMismatchException extends DataConsistencyException {
    private final int submitted;
    private final int succeeded;
    private final int failed;

    public OutcomeMismatchException(String jobId, int submitted, int succeeded, int failed, String detail) {
        super(String.format("Submitted %d rows but got %d successful + %d failed outcomes%s",
                submitted, succeeded, failed, detail == null ? "" : " (" + detail + ")"), "fetchIngestResults", jobId);
        this.submitted = submitted;
        this.succeeded = succeeded;
        this.failed = failed;
    }

    public int getSubmitted() {
        return submitted;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }
}

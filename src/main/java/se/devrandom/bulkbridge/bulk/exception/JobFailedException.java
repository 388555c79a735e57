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

import se.devrandom.bulkbridge.bulk.JobState;

/**
 * A job reached {@code Failed} or {@code Aborted} on the server.
 */
public class JobFailedException extends BulkApiException {
    private final JobState state;

    public JobFailedException(String operation, String jobId, JobState state, String serverMessage) {
        super(String.format("Job ended with state=%s%s", state,
                serverMessage == null || serverMessage.isBlank() ? "" : ": " + serverMessage), operation, jobId);
        this.state = state;
    }

    public JobState getState() {
        return state;
    }
}

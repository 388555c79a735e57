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
package se.devrandom.bulkbridge.cli;

import se.devrandom.bulkbridge.bulk.exception.AuthenticationException;
import se.devrandom.bulkbridge.bulk.exception.BulkApiException;
import se.devrandom.bulkbridge.bulk.exception.DataConsistencyException;
import se.devrandom.bulkbridge.bulk.exception.JobFailedException;
import se.devrandom.bulkbridge.bulk.exception.JobStateException;
import se.devrandom.bulkbridge.bulk.exception.PollTimeoutException;

/**
 * Process exit codes. Partial row failures of an ingest job still exit with {@link #SUCCESS}.
 * Invalid arguments, including values the services reject as {@link IllegalArgumentException}, map to {@link #USAGE}.
 * So do requests the job's current state does not allow, such as resuming an {@code Open} ingest job.
 */
public enum ExitStatus {
    SUCCESS(0),
    FAILURE(1),
    USAGE(2),
    AUTHENTICATION(3),
    TRANSPORT(4),
    PARTIAL_DATA(5),
    POLL_TIMEOUT(6),
    JOB_FAILED(7);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitStatus of(Throwable error) {
        if (error instanceof UsageException || error instanceof IllegalArgumentException
                || error instanceof JobStateException) {
            return USAGE;
        }
        if (error instanceof AuthenticationException) {
            return AUTHENTICATION;
        }
        if (error instanceof DataConsistencyException) {
            return PARTIAL_DATA;
        }
        if (error instanceof PollTimeoutException) {
            return POLL_TIMEOUT;
        }
        if (error instanceof JobFailedException) {
            return JOB_FAILED;
        }
        if (error instanceof BulkApiException) {
            return TRANSPORT;
        }
        return FAILURE;
    }
}

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
package se.devrandom.bulkbridge.service;

import se.devrandom.bulkbridge.bulk.JobState;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one ingest run, as shown to the operator.
 *
 * @param resultFiles success and error CSVs written to the output directory
 */
public record IngestReport(String jobId,
                           String masterKey,
                           JobState state,
                           int submitted,
                           int succeeded,
                           int failed,
                           int unprocessed,
                           List<Path> resultFiles) {

    public boolean hasRowFailures() {
        return failed > 0 || unprocessed > 0;
    }
}

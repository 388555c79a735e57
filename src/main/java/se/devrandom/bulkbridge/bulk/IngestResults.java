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

import se.devrandom.bulkbridge.bulk.exception.OutcomeMismatchException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Success and failure outcomes of one ingest job, plus the raw CSV bodies they were parsed from.
 */
public class IngestResults {
    private final String jobId;
    private final int submittedRows;
    private final List<IngestOutcome> successes;
    private final List<IngestOutcome> failures;
    private final int unprocessedRows;
    private final String successCsv;
    private final String failureCsv;

    public IngestResults(String jobId, int submittedRows, List<IngestOutcome> successes, List<IngestOutcome> failures,
                         int unprocessedRows, String successCsv, String failureCsv) {
        this.jobId = jobId;
        this.submittedRows = submittedRows;
        this.successes = List.copyOf(successes);
        this.failures = List.copyOf(failures);
        this.unprocessedRows = unprocessedRows;
        this.successCsv = successCsv;
        this.failureCsv = failureCsv;
    }

    /**
     * Checks that every submitted row has exactly one outcome. Matching is by correlation key
     * since the service does not keep submission order. Rows a failed job never processed count
     * towards the total but carry no outcome.
     *
     * @param submittedKeys correlation keys of the uploaded rows, or null to check counts only
     * @throws OutcomeMismatchException when outcomes are missing, duplicated or unknown
     */
    public IngestResults reconcile(List<String> submittedKeys) {
        if (successes.size() + failures.size() + unprocessedRows != submittedRows) {
            throw new OutcomeMismatchException(jobId, submittedRows, successes.size(), failures.size(),
                    unprocessedRows == 0 ? null : unprocessedRows + " unprocessed");
        }
        if (submittedKeys == null) {
            return this;
        }
        Map<String, Integer> pending = new HashMap<>();
        for (String key : submittedKeys) {
            pending.merge(key, 1, Integer::sum);
        }
        for (IngestOutcome outcome : successes) {
            consume(pending, outcome);
        }
        for (IngestOutcome outcome : failures) {
            consume(pending, outcome);
        }
        return this;
    }

    private void consume(Map<String, Integer> pending, IngestOutcome outcome) {
        Integer left = pending.get(outcome.correlationKey());
        if (left == null || left == 0) {
            throw new OutcomeMismatchException(jobId, submittedRows, successes.size(), failures.size(),
                    "no submitted row matches outcome key '" + outcome.correlationKey() + "'");
        }
        pending.put(outcome.correlationKey(), left - 1);
    }

    public String getJobId() {
        return jobId;
    }

    public int getSubmittedRows() {
        return submittedRows;
    }

    public List<IngestOutcome> getSuccesses() {
        return successes;
    }

    public List<IngestOutcome> getFailures() {
        return failures;
    }

    public int getUnprocessedRows() {
        return unprocessedRows;
    }

    public String getSuccessCsv() {
        return successCsv;
    }

    public String getFailureCsv() {
        return failureCsv;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}

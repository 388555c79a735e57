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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.bulkbridge.bulk.exception.JobStateException;
import se.devrandom.bulkbridge.salesforce.objects.BulkJobInfo;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Handle for one server-side bulk job. Passed explicitly between orchestrator calls;
 * its state only changes through {@link #applyServerInfo(BulkJobInfo, Instant)}.
 */
public class BulkJob {
    private static final Logger log = LoggerFactory.getLogger(BulkJob.class);
    private static final DateTimeFormatter SALESFORCE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

    private final String jobId;
    private final JobKind kind;
    private final BulkOperation operation;
    private final String target;
    private final String externalIdField;
    private final String contentType = "CSV";
    private final List<ChunkJob> chunkJobs = new ArrayList<>();

    private JobState state;
    private Instant createdAt;
    private Instant closedAt;
    private String locator;
    private long numberRecordsProcessed;
    private long numberRecordsFailed;
    private String errorMessage;

    BulkJob(String jobId, BulkOperation operation, String target, String externalIdField, JobState state, Instant createdAt) {
        this.jobId = jobId;
        this.kind = operation.kind();
        this.operation = operation;
        this.target = target;
        this.externalIdField = externalIdField;
        this.state = state;
        this.createdAt = createdAt;
    }

    static BulkJob fromServerInfo(BulkJobInfo info, String target, Instant now) {
        BulkJob job = new BulkJob(info.getId(), BulkOperation.fromWire(info.getOperation()), target,
                info.getExternalIdFieldName(), JobState.fromWire(info.getState()), parseTimestamp(info.getCreatedDate(), now));
        job.copyCounters(info);
        job.markClosedIfTerminal(now);
        return job;
    }

    /**
     * Applies a status response. Terminal jobs are never reopened.
     */
    void applyServerInfo(BulkJobInfo info, Instant now) {
        JobState reported = JobState.fromWire(info.getState());
        if (state.isTerminal() && reported != state) {
            throw new JobStateException("applyServerInfo", jobId, state,
                    "server reported " + reported + " for a job that already terminated");
        }
        if (reported != state) {
            log.debug("Job {} {} -> {}", jobId, state, reported);
            state = reported;
            if (state.isTerminal()) {
                closedAt = now;
            }
        }
        copyCounters(info);
    }

    void markClosedIfTerminal(Instant now) {
        if (state.isTerminal() && closedAt == null) {
            closedAt = now;
        }
    }

    void copyCounters(BulkJobInfo info) {
        if (info.getNumberRecordsProcessed() != null) {
            numberRecordsProcessed = info.getNumberRecordsProcessed();
        }
        if (info.getNumberRecordsFailed() != null) {
            numberRecordsFailed = info.getNumberRecordsFailed();
        }
        if (info.getErrorMessage() != null) {
            errorMessage = info.getErrorMessage();
        }
    }

    private static Instant parseTimestamp(String value, Instant fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(value, SALESFORCE_TIMESTAMP).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable createdDate '{}', using local time", value);
            return fallback;
        }
    }

    void setLocator(String locator) {
        this.locator = locator;
    }

    void addChunkJob(ChunkJob chunkJob) {
        chunkJobs.add(chunkJob);
    }

    public String getJobId() {
        return jobId;
    }

    public JobKind getKind() {
        return kind;
    }

    public BulkOperation getOperation() {
        return operation;
    }

    /**
     * SObject name for ingest jobs, SOQL text for query jobs.
     */
    public String getTarget() {
        return target;
    }

    public String getExternalIdField() {
        return externalIdField;
    }

    public String getContentType() {
        return contentType;
    }

    public JobState getState() {
        return state;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    /**
     * Continuation token for the next result page, null before the first page and after the last one.
     */
    public String getLocator() {
        return locator;
    }

    public long getNumberRecordsProcessed() {
        return numberRecordsProcessed;
    }

    public long getNumberRecordsFailed() {
        return numberRecordsFailed;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<ChunkJob> getChunkJobs() {
        return Collections.unmodifiableList(chunkJobs);
    }

    public boolean isChunked() {
        return !chunkJobs.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("%s job %s (%s, %s)", kind.pathSegment(), jobId, operation.wireName(), state);
    }
}

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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import se.devrandom.bulkbridge.bulk.exception.JobStateException;
import se.devrandom.bulkbridge.bulk.exception.PollTimeoutException;
import se.devrandom.bulkbridge.salesforce.BulkApiClient;
import se.devrandom.bulkbridge.salesforce.objects.BulkJobInfo;
import se.devrandom.bulkbridge.salesforce.objects.QueryResultPage;
import se.devrandom.bulkbridge.util.CsvRecords;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives bulk jobs through their lifecycle: create, upload, close, poll, collect results, abort, delete.
 * Every transition is triggered by a server response; completion is never inferred from elapsed time
 * or row counts.
 */
@Service
public class BulkJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BulkJobOrchestrator.class);

    private static final CSVFormat RESULT_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    private final BulkApiClient client;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public BulkJobOrchestrator(BulkApiClient client) {
        this(client, Clock.systemUTC(), Sleeper.THREAD);
    }

    BulkJobOrchestrator(BulkApiClient client, Clock clock, Sleeper sleeper) {
        this.client = client;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public BulkJob createIngestJob(String objectName, BulkOperation operation, String externalIdField) {
        if (operation.kind() != JobKind.INGEST) {
            throw new IllegalArgumentException(operation.wireName() + " is not an ingest operation");
        }
        if (operation == BulkOperation.UPSERT && (externalIdField == null || externalIdField.isBlank())) {
            throw new IllegalArgumentException("upsert on " + objectName + " requires an external id field");
        }
        BulkJobInfo info = client.createIngestJob(objectName, operation,
                operation == BulkOperation.UPSERT ? externalIdField : null);
        BulkJob job = BulkJob.fromServerInfo(info, objectName, clock.instant());
        log.info("Created {}", job);
        return job;
    }

    public BulkJob createQueryJob(String soql, BulkOperation operation) {
        return submitQuery(soql, operation, null);
    }

    /**
     * Creates a query job the service splits into primary-key ranges. The partitions are
     * listed through {@link #listChunkJobs(BulkJob)} once the parent has completed.
     */
    public BulkJob createChunkedQueryJob(String soql, BulkOperation operation, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, was " + chunkSize);
        }
        return submitQuery(soql, operation, chunkSize);
    }

    private BulkJob submitQuery(String soql, BulkOperation operation, Integer chunkSize) {
        if (operation.kind() != JobKind.QUERY) {
            throw new IllegalArgumentException(operation.wireName() + " is not a query operation");
        }
        if (soql == null || soql.isBlank()) {
            throw new IllegalArgumentException("query must not be empty");
        }
        BulkJobInfo info = client.createQueryJob(soql, operation, chunkSize);
        BulkJob job = BulkJob.fromServerInfo(info, soql, clock.instant());
        log.info("Created {}", job);
        return job;
    }

    /**
     * Rebuilds a handle for a job created earlier, e.g. to resume polling after a timeout.
     */
    public BulkJob attach(JobKind kind, String jobId) {
        BulkJobInfo info = client.getJobInfo(kind, jobId);
        BulkJob job = BulkJob.fromServerInfo(info, info.getObject(), clock.instant());
        if (job.getKind() != kind) {
            throw new IllegalArgumentException("Job " + jobId + " is a " + job.getKind().pathSegment() + " job");
        }
        log.info("Attached to {}", job);
        return job;
    }

    public void uploadBatch(BulkJob job, byte[] csv) {
        requireKind(job, JobKind.INGEST, "uploadBatch");
        if (job.getState() != JobState.OPEN) {
            throw new JobStateException("uploadBatch", job.getJobId(), job.getState(), "uploads require an Open job");
        }
        client.uploadJobData(job.getJobId(), csv);
    }

    /**
     * Marks upload complete so the service starts processing. Closing a job twice is harmless.
     */
    public void closeJob(BulkJob job) {
        requireKind(job, JobKind.INGEST, "closeJob");
        if (job.getState() == JobState.UPLOAD_COMPLETE) {
            log.debug("{} already closed", job);
            return;
        }
        if (job.getState() != JobState.OPEN) {
            throw new JobStateException("closeJob", job.getJobId(), job.getState(), "only an Open job can be closed");
        }
        BulkJobInfo info = client.updateJobState(JobKind.INGEST, job.getJobId(), JobState.UPLOAD_COMPLETE);
        job.applyServerInfo(info, clock.instant());
        log.info("Closed {}", job);
    }

    /**
     * Polls until the job reaches a terminal state. Intermediate states are only logged, so a
     * {@link PollTimeoutException} leaves the job exactly as it was; calling again resumes polling.
     *
     * @return the terminal state, which may be {@code Failed} or {@code Aborted}
     * @throws PollTimeoutException when {@link PollPolicy#getMaxWait()} runs out first
     */
    public JobState pollUntilDone(BulkJob job, PollPolicy policy) {
        Instant start = clock.instant();
        Instant deadline = start.plus(policy.getMaxWait());
        JobState lastSeen = job.getState();

        for (int poll = 0; ; poll++) {
            BulkJobInfo info = client.getJobInfo(job.getKind(), job.getJobId());
            JobState reported = JobState.fromWire(info.getState());
            if (reported.isTerminal()) {
                job.applyServerInfo(info, clock.instant());
                log.info("{} finished after {} poll(s): processed={}, failed={}", job, poll + 1,
                        job.getNumberRecordsProcessed(), job.getNumberRecordsFailed());
                return reported;
            }
            if (reported != lastSeen) {
                log.info("Job {} is {}", job.getJobId(), reported);
                lastSeen = reported;
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                throw new PollTimeoutException(job.getJobId(), lastSeen, Duration.between(start, now));
            }
            Duration delay = policy.delayAfter(poll);
            Duration remaining = Duration.between(now, deadline);
            try {
                sleeper.sleep(delay.compareTo(remaining) > 0 ? remaining : delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while polling job " + job.getJobId(), e);
            }
        }
    }

    /**
     * Downloads success and failure outcomes and checks that they account for every submitted row.
     *
     * @param submittedKeys correlation keys of the uploaded rows, see {@link CorrelationKey}
     */
    public IngestResults fetchIngestResults(BulkJob job, List<String> submittedKeys) {
        return downloadIngestResults(job, submittedKeys.size()).reconcile(submittedKeys);
    }

    /**
     * Downloads the outcomes without reconciling them, so callers can persist what the service
     * returned before judging it. Call {@link IngestResults#reconcile(List)} afterwards.
     */
    public IngestResults downloadIngestResults(BulkJob job, int submittedRows) {
        requireKind(job, JobKind.INGEST, "fetchIngestResults");
        if (job.getState() != JobState.JOB_COMPLETE && job.getState() != JobState.FAILED) {
            throw new JobStateException("fetchIngestResults", job.getJobId(), job.getState(),
                    "results exist only for JobComplete or Failed jobs");
        }
        String successCsv = client.getIngestResults(job.getJobId(), "successfulResults");
        String failureCsv = client.getIngestResults(job.getJobId(), "failedResults");
        String unprocessedCsv = client.getIngestResults(job.getJobId(), "unprocessedrecords");

        List<IngestOutcome> successes = parseOutcomes(job, successCsv, true);
        List<IngestOutcome> failures = parseOutcomes(job, failureCsv, false);
        int unprocessed = Math.max(0, CsvRecords.split(unprocessedCsv).size() - 1);
        if (unprocessed > 0) {
            log.warn("{} has {} unprocessed record(s)", job, unprocessed);
        }
        log.info("{}: {} succeeded, {} failed", job, successes.size(), failures.size());

        return new IngestResults(job.getJobId(), submittedRows, successes, failures, unprocessed,
                successCsv, failureCsv);
    }

    private List<IngestOutcome> parseOutcomes(BulkJob job, String csv, boolean success) {
        List<IngestOutcome> outcomes = new ArrayList<>();
        if (csv == null || csv.isBlank()) {
            return outcomes;
        }
        try (CSVParser parser = CSVParser.parse(csv, RESULT_FORMAT)) {
            List<String> headerNames = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                Map<String, String> fields = new LinkedHashMap<>();
                for (String name : headerNames) {
                    if (!name.startsWith("sf__")) {
                        fields.put(name, record.isSet(name) ? record.get(name) : "");
                    }
                }
                String key = CorrelationKey.of(job.getOperation(), job.getExternalIdField(), fields);
                String recordId = record.isSet("sf__Id") ? record.get("sf__Id") : null;
                if (success) {
                    boolean created = record.isSet("sf__Created") && Boolean.parseBoolean(record.get("sf__Created"));
                    outcomes.add(IngestOutcome.success(recordId, created, key, fields));
                } else {
                    String error = record.isSet("sf__Error") ? record.get("sf__Error") : null;
                    outcomes.add(IngestOutcome.failure(recordId, error, key, fields));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable result CSV for job " + job.getJobId(), e);
        }
        return outcomes;
    }

    /**
     * Fetches one page of query results.
     *
     * @param locator null for the first page
     */
    public ResultBatch fetchResultPage(BulkJob job, String locator, int maxRecords) {
        requireKind(job, JobKind.QUERY, "fetchResultPage");
        if (job.getState() != JobState.JOB_COMPLETE) {
            throw new JobStateException("fetchResultPage", job.getJobId(), job.getState(),
                    "results are only available once the job is JobComplete");
        }
        QueryResultPage page = client.getQueryResults(job.getJobId(), locator, maxRecords);
        job.setLocator(page.locator());
        return new ResultBatch(CsvRecords.split(page.body()), locator == null, page.locator(), page.numberOfRecords());
    }

    /**
     * Lists the partitions of a completed chunked query, in the order the service reports them.
     */
    public List<ChunkJob> listChunkJobs(BulkJob parent) {
        requireKind(parent, JobKind.QUERY, "listChunkJobs");
        if (parent.isChunked()) {
            return parent.getChunkJobs();
        }
        List<BulkJobInfo> infos = client.listChunkJobs(parent.getJobId());
        Instant now = clock.instant();
        for (int i = 0; i < infos.size(); i++) {
            parent.addChunkJob(new ChunkJob(infos.get(i), parent, i, now));
        }
        log.info("{} split into {} chunk(s)", parent, infos.size());
        return parent.getChunkJobs();
    }

    public void abort(BulkJob job) {
        if (job.getState().isTerminal()) {
            throw new JobStateException("abort", job.getJobId(), job.getState(), "a terminated job cannot be aborted");
        }
        BulkJobInfo info = client.updateJobState(job.getKind(), job.getJobId(), JobState.ABORTED);
        job.applyServerInfo(info, clock.instant());
        log.info("Aborted {}", job);
    }

    public void delete(BulkJob job) {
        if (!job.getState().isTerminal()) {
            throw new JobStateException("delete", job.getJobId(), job.getState(), "only terminated jobs can be deleted");
        }
        client.deleteJob(job.getKind(), job.getJobId());
    }

    private static void requireKind(BulkJob job, JobKind kind, String operation) {
        if (job.getKind() != kind) {
            throw new IllegalArgumentException(operation + " needs a " + kind.pathSegment() + " job, got " + job);
        }
    }
}

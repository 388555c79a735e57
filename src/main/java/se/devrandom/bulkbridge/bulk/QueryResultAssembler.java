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
import org.springframework.stereotype.Service;
import se.devrandom.bulkbridge.bulk.exception.BulkApiException;
import se.devrandom.bulkbridge.bulk.exception.JobFailedException;
import se.devrandom.bulkbridge.bulk.exception.PartialChunkFailureException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a query job into one CSV file with a single header, following the locator chain page by page
 * and, for PK-chunked queries, merging the partitions in the order the service listed them.
 * The target file only appears once everything was downloaded.
 */
@Service
public class QueryResultAssembler {
    private static final Logger log = LoggerFactory.getLogger(QueryResultAssembler.class);
    private static final String LINE_END = "\n";

    private final BulkJobOrchestrator orchestrator;

    public QueryResultAssembler(BulkJobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public ExportSummary export(String soql, BulkOperation operation, ExportOptions options, Path output) {
        BulkJob job;
        if (options.resumeJobId() != null) {
            job = orchestrator.attach(JobKind.QUERY, options.resumeJobId());
        } else if (options.chunked()) {
            job = orchestrator.createChunkedQueryJob(soql, operation, options.chunkSize());
        } else {
            job = orchestrator.createQueryJob(soql, operation);
        }
        return assemble(job, options, output);
    }

    /**
     * Waits for the job and writes its complete result set to {@code output}.
     *
     * @throws PartialChunkFailureException when any partition ended Failed or Aborted; no file is written
     */
    public ExportSummary assemble(BulkJob job, ExportOptions options, Path output) {
        JobState state = orchestrator.pollUntilDone(job, options.pollPolicy());
        if (state != JobState.JOB_COMPLETE) {
            throw new JobFailedException("export", job.getJobId(), state, job.getErrorMessage());
        }

        Path target = output.toAbsolutePath();
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".part");
            ExportSummary summary;
            if (options.chunked()) {
                summary = mergeChunks(job, options, temp, target);
            } else {
                try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                    PartitionResult result = downloadPages(job, options.pageSize(), writer, true);
                    summary = new ExportSummary(job.getJobId(), target, result.pages, result.rows, 0);
                }
            }
            moveIntoPlace(temp, target);
            temp = null;
            log.info("Exported {} row(s) in {} page(s) from job {} to {}", summary.rows(), summary.pages(),
                    job.getJobId(), target);
            return summary;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write export to " + target, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Writes all pages of one job. Every page repeats the CSV header; only the first page's header
     * is kept, and only when {@code writeHeader} is set.
     */
    private PartitionResult downloadPages(BulkJob job, int pageSize, BufferedWriter writer, boolean writeHeader)
            throws IOException {
        PartitionResult result = new PartitionResult();
        String locator = null;
        do {
            ResultBatch batch = orchestrator.fetchResultPage(job, locator, pageSize);
            if (batch.firstPage()) {
                result.header = batch.headerRow();
                if (writeHeader && result.header != null) {
                    writer.write(result.header);
                    writer.write(LINE_END);
                }
            }
            for (String row : batch.dataRows()) {
                writer.write(row);
                writer.write(LINE_END);
            }
            result.pages++;
            result.rows += batch.dataRows().size();
            if (batch.numberOfRecords() >= 0 && batch.numberOfRecords() != batch.dataRows().size()) {
                log.warn("Job {} page {} announced {} record(s) but contained {}", job.getJobId(), result.pages,
                        batch.numberOfRecords(), batch.dataRows().size());
            }
            locator = batch.nextLocator();
        } while (locator != null);
        return result;
    }

    private ExportSummary mergeChunks(BulkJob parent, ExportOptions options, Path temp, Path target) throws IOException {
        List<ChunkJob> chunks = orchestrator.listChunkJobs(parent);
        if (chunks.isEmpty()) {
            throw PartialChunkFailureException.noPartitions(parent.getJobId());
        }
        List<Path> buffers = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(options.chunkWorkers(), new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("chunk-poller-" + counter.getAndIncrement());
                thread.setDaemon(false);
                return thread;
            }
        });

        try {
            List<Future<PartitionResult>> futures = new ArrayList<>();
            for (ChunkJob chunk : chunks) {
                Path buffer = Files.createTempFile(target.getParent(), "." + target.getFileName() + "-p" + chunk.getPartition(), ".part");
                buffers.add(buffer);
                futures.add(executor.submit(() -> pollAndDownload(chunk, options, buffer)));
            }

            List<PartitionResult> results = new ArrayList<>();
            List<String> failedPartitions = new ArrayList<>();
            RuntimeException firstError = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    PartitionResult result = futures.get(i).get();
                    results.add(result);
                    if (result.failedState != null) {
                        failedPartitions.add(chunks.get(i).describe() + " " + result.failedState);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.error("Chunk {} of job {} failed: {}", chunks.get(i).describe(), parent.getJobId(), cause.toString());
                    if (firstError == null) {
                        firstError = cause instanceof RuntimeException re ? re
                                : new BulkApiException("Chunk download failed: " + cause, "export", chunks.get(i).getJobId(),
                                null, null, cause);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for chunks of job " + parent.getJobId(), e);
                }
            }
            if (!failedPartitions.isEmpty()) {
                throw new PartialChunkFailureException(parent.getJobId(), failedPartitions);
            }
            if (firstError != null) {
                throw firstError;
            }

            int pages = 0;
            long rows = 0;
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                boolean headerWritten = false;
                for (int i = 0; i < results.size(); i++) {
                    PartitionResult result = results.get(i);
                    if (!headerWritten && result.header != null) {
                        writer.write(result.header);
                        writer.write(LINE_END);
                        headerWritten = true;
                    }
                    try (var lines = Files.newBufferedReader(buffers.get(i), StandardCharsets.UTF_8)) {
                        lines.transferTo(writer);
                    }
                    pages += result.pages;
                    rows += result.rows;
                }
            }
            return new ExportSummary(parent.getJobId(), target, pages, rows, chunks.size());
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    log.warn("Chunk executor did not terminate in 60 seconds, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error("Interrupted while waiting for chunk executor shutdown", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            for (Path buffer : buffers) {
                deleteQuietly(buffer);
            }
        }
    }

    private PartitionResult pollAndDownload(ChunkJob chunk, ExportOptions options, Path buffer) throws IOException {
        JobState state = orchestrator.pollUntilDone(chunk, options.pollPolicy());
        if (state != JobState.JOB_COMPLETE) {
            log.warn("Chunk {} of job {} ended {}", chunk.describe(), chunk.getParentJobId(), state);
            PartitionResult failed = new PartitionResult();
            failed.failedState = state;
            return failed;
        }
        try (BufferedWriter writer = Files.newBufferedWriter(buffer, StandardCharsets.UTF_8)) {
            PartitionResult result = downloadPages(chunk, options.pageSize(), writer, false);
            log.debug("Chunk {} downloaded: {} row(s) in {} page(s)", chunk.describe(), result.rows, result.pages);
            return result;
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }

    private static final class PartitionResult {
        String header;
        int pages;
        long rows;
        JobState failedState;
    }
}

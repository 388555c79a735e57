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

import org.apache.commons.csv.CSVFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import se.devrandom.bulkbridge.bulk.BulkJob;
import se.devrandom.bulkbridge.bulk.BulkJobOrchestrator;
import se.devrandom.bulkbridge.bulk.BulkOperation;
import se.devrandom.bulkbridge.bulk.CorrelationKey;
import se.devrandom.bulkbridge.bulk.IngestResults;
import se.devrandom.bulkbridge.bulk.JobKind;
import se.devrandom.bulkbridge.bulk.JobState;
import se.devrandom.bulkbridge.bulk.exception.JobFailedException;
import se.devrandom.bulkbridge.bulk.exception.JobStateException;
import se.devrandom.bulkbridge.bulk.exception.OutcomeMismatchException;
import se.devrandom.bulkbridge.config.BulkProperties;
import se.devrandom.bulkbridge.transform.CsvTable;
import se.devrandom.bulkbridge.transform.MappingConfigLoader;
import se.devrandom.bulkbridge.transform.MappingSpec;
import se.devrandom.bulkbridge.transform.RecordTransformer;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Convert, upload, wait, collect: one master file into Salesforce through a single ingest job.
 */
@Service
public class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);
    private static final CSVFormat UPLOAD_FORMAT = CSVFormat.DEFAULT.builder().setRecordSeparator("\n").build();

    private final MappingConfigLoader mappingConfigLoader;
    private final ConversionService conversionService;
    private final RecordTransformer recordTransformer;
    private final BulkJobOrchestrator orchestrator;
    private final IngestResultWriter resultWriter;
    private final BulkProperties bulkProperties;

    public IngestService(MappingConfigLoader mappingConfigLoader,
                         ConversionService conversionService,
                         RecordTransformer recordTransformer,
                         BulkJobOrchestrator orchestrator,
                         IngestResultWriter resultWriter,
                         BulkProperties bulkProperties) {
        this.mappingConfigLoader = mappingConfigLoader;
        this.conversionService = conversionService;
        this.recordTransformer = recordTransformer;
        this.orchestrator = orchestrator;
        this.resultWriter = resultWriter;
        this.bulkProperties = bulkProperties;
    }

    /**
     * @param allFile     legacy file to convert first, or null when {@code csvFile} is given
     * @param csvFile     already converted upload CSV, or null
     * @param resumeJobId job to keep polling after an earlier timeout, or null to create a new job
     * @throws JobFailedException       when the job ends {@code Failed} or {@code Aborted}; result files are
     *                                  written first when the service produced any
     * @throws OutcomeMismatchException when the outcomes do not account for every submitted row; the
     *                                  result files are written first
     */
    public IngestReport ingest(String masterKey, Path allFile, Path csvFile, String resumeJobId) {
        MappingSpec spec = mappingConfigLoader.forMasterKey(masterKey);
        BulkOperation operation = mappingConfigLoader.validateForIngest(spec);

        Path uploadCsv = csvFile;
        if (allFile != null) {
            uploadCsv = conversionService.convert(allFile, spec, null).output();
        }
        if (uploadCsv == null) {
            throw new IllegalArgumentException("Either an ALL file or a converted CSV is required");
        }
        CsvTable table = recordTransformer.readCsv(uploadCsv, spec);
        List<String> keys = correlationKeys(table, operation, spec.getExternalIdField());

        BulkJob job;
        if (resumeJobId != null) {
            job = orchestrator.attach(JobKind.INGEST, resumeJobId);
            if (job.getState() == JobState.OPEN) {
                throw new JobStateException("ingest", resumeJobId, job.getState(),
                        "upload was never completed; abort the job and start a new one");
            }
        } else {
            job = orchestrator.createIngestJob(spec.getSfObject(), operation, spec.getExternalIdField());
            for (byte[] part : uploadParts(table, bulkProperties.getIngest().getMaxUploadBytes())) {
                orchestrator.uploadBatch(job, part);
            }
            orchestrator.closeJob(job);
        }

        JobState state = orchestrator.pollUntilDone(job, bulkProperties.getPoll().toPolicy());
        if (state == JobState.ABORTED) {
            throw new JobFailedException("ingest", job.getJobId(), state, job.getErrorMessage());
        }

        IngestResults results = orchestrator.downloadIngestResults(job, keys.size());
        List<Path> files = resultWriter.write(spec.getMasterKey(), results);
        results.reconcile(keys);
        if (state != JobState.JOB_COMPLETE) {
            throw new JobFailedException("ingest", job.getJobId(), state, job.getErrorMessage());
        }

        IngestReport report = new IngestReport(job.getJobId(), spec.getMasterKey(), state, keys.size(),
                results.getSuccesses().size(), results.getFailures().size(), results.getUnprocessedRows(), files);
        if (report.hasRowFailures()) {
            log.warn("[{}] job {}: {} of {} row(s) failed, see {}", spec.getMasterKey(), job.getJobId(),
                    report.failed(), report.submitted(), files.get(1));
        } else {
            log.info("[{}] job {}: all {} row(s) succeeded", spec.getMasterKey(), job.getJobId(), report.submitted());
        }
        return report;
    }

    static List<String> correlationKeys(CsvTable table, BulkOperation operation, String externalIdField) {
        List<String> keys = new ArrayList<>(table.rows().size());
        for (List<String> row : table.rows()) {
            Map<String, String> fields = new LinkedHashMap<>();
            for (int i = 0; i < table.header().size(); i++) {
                fields.put(table.header().get(i), i < row.size() ? row.get(i) : "");
            }
            keys.add(CorrelationKey.of(operation, externalIdField, fields));
        }
        return keys;
    }

    /**
     * Serializes the table as UTF-8 LF CSV, split so no part exceeds {@code maxBytes}.
     * Every part starts with the header row.
     */
    static List<byte[]> uploadParts(CsvTable table, long maxBytes) {
        byte[] header = line(table.header());
        List<byte[]> parts = new ArrayList<>();
        ByteArrayOutputStream current = new ByteArrayOutputStream();
        current.writeBytes(header);
        int rowsInPart = 0;
        for (List<String> row : table.rows()) {
            byte[] bytes = line(row);
            if (rowsInPart > 0 && current.size() + bytes.length > maxBytes) {
                parts.add(current.toByteArray());
                current = new ByteArrayOutputStream();
                current.writeBytes(header);
                rowsInPart = 0;
            }
            if (header.length + bytes.length > maxBytes) {
                throw new IllegalArgumentException("A single row exceeds the upload limit of " + maxBytes + " bytes");
            }
            current.writeBytes(bytes);
            rowsInPart++;
        }
        parts.add(current.toByteArray());
        if (parts.size() > 1) {
            log.info("Upload split into {} part(s) of at most {} bytes", parts.size(), maxBytes);
        }
        return parts;
    }

    private static byte[] line(List<String> values) {
        return (UPLOAD_FORMAT.format(values.toArray()) + "\n").getBytes(StandardCharsets.UTF_8);
    }
}

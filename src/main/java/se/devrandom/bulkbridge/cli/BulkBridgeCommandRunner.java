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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import se.devrandom.bulkbridge.bulk.BulkJob;
import se.devrandom.bulkbridge.bulk.BulkJobOrchestrator;
import se.devrandom.bulkbridge.bulk.ExportSummary;
import se.devrandom.bulkbridge.bulk.JobKind;
import se.devrandom.bulkbridge.bulk.exception.BulkApiException;
import se.devrandom.bulkbridge.bulk.exception.PollTimeoutException;
import se.devrandom.bulkbridge.service.ConversionService;
import se.devrandom.bulkbridge.service.ExportRequest;
import se.devrandom.bulkbridge.service.ExportService;
import se.devrandom.bulkbridge.service.IngestReport;
import se.devrandom.bulkbridge.service.IngestService;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry point:
 * <pre>
 *   convert --input=FILE.ALL --config=mapping.yml [--output=out.csv]
 *   ingest  --mapping=KEY (--input=FILE.ALL | --csv=FILE.csv) [--job-id=ID]
 *   export  (--query=SOQL | --config=export.yml) [--operation=query|queryAll] [--output=FILE]
 *           [--page-size=N] [--chunk-size=N] [--job-id=ID]
 *   abort   --job-id=ID --kind=ingest|query
 * </pre>
 */
@Component
public class BulkBridgeCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(BulkBridgeCommandRunner.class);

    private final ConversionService conversionService;
    private final IngestService ingestService;
    private final ExportService exportService;
    private final BulkJobOrchestrator orchestrator;

    private int exitCode = ExitStatus.SUCCESS.code();

    public BulkBridgeCommandRunner(ConversionService conversionService,
                                   IngestService ingestService,
                                   ExportService exportService,
                                   BulkJobOrchestrator orchestrator) {
        this.conversionService = conversionService;
        this.ingestService = ingestService;
        this.exportService = exportService;
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.size() != 1) {
            log.error("Expected exactly one command (convert, ingest, export, abort), got {}", commands);
            exitCode = ExitStatus.USAGE.code();
            return;
        }
        String command = commands.get(0);
        try {
            switch (command) {
                case "convert" -> convert(args);
                case "ingest" -> ingest(args);
                case "export" -> export(args);
                case "abort" -> abort(args);
                default -> throw new UsageException("Unknown command: " + command);
            }
            exitCode = ExitStatus.SUCCESS.code();
        } catch (RuntimeException e) {
            ExitStatus status = ExitStatus.of(e);
            exitCode = status.code();
            if (e instanceof PollTimeoutException timeout) {
                log.error("{}. Resume with --job-id={}", timeout.getMessage(), timeout.getJobId());
            } else if (status == ExitStatus.USAGE) {
                log.error("{}: {}", command, e.getMessage());
            } else if (e instanceof BulkApiException) {
                log.error("{} failed: {}", command, e.getMessage());
                log.debug("Stack trace", e);
            } else {
                log.error("{} failed", command, e);
            }
            log.info("Exit status: {} ({})", exitCode, status);
        }
    }

    private void convert(ApplicationArguments args) {
        Path input = requiredPath(args, "input");
        Path config = requiredPath(args, "config");
        ConversionService.ConversionResult result = conversionService.convert(input, config, optionalPath(args, "output"));
        log.info("Converted {} row(s) for {} to {}", result.rows(), result.spec().getMasterKey(), result.output());
    }

    private void ingest(ApplicationArguments args) {
        String masterKey = required(args, "mapping");
        Path input = optionalPath(args, "input");
        Path csv = optionalPath(args, "csv");
        if ((input == null) == (csv == null)) {
            throw new UsageException("ingest needs exactly one of --input or --csv");
        }
        IngestReport report = ingestService.ingest(masterKey, input, csv, optional(args, "job-id"));

        log.info("=".repeat(80));
        log.info("INGEST SUMMARY [{}] job {}", report.masterKey(), report.jobId());
        log.info("  State      : {}", report.state());
        log.info("  Submitted  : {}", report.submitted());
        log.info("  Succeeded  : {}", report.succeeded());
        log.info("  Failed     : {}", report.failed());
        if (report.unprocessed() > 0) {
            log.info("  Unprocessed: {}", report.unprocessed());
        }
        report.resultFiles().forEach(file -> log.info("  File       : {}", file));
        log.info("=".repeat(80));
    }

    private void export(ApplicationArguments args) {
        String query = optional(args, "query");
        Path config = optionalPath(args, "config");
        String jobId = optional(args, "job-id");
        if (query != null && config != null) {
            throw new UsageException("export takes --query or --config, not both");
        }
        if (query == null && config == null && jobId == null) {
            throw new UsageException("export needs --query, --config or --job-id");
        }
        ExportSummary summary = exportService.export(new ExportRequest(query, config, optional(args, "operation"),
                optionalPath(args, "output"), optionalInt(args, "page-size"), optionalInt(args, "chunk-size"), jobId));

        log.info("=".repeat(80));
        log.info("EXPORT SUMMARY job {}", summary.jobId());
        log.info("  Pages : {}", summary.pages());
        log.info("  Rows  : {}", summary.rows());
        if (summary.partitions() > 0) {
            log.info("  Chunks: {}", summary.partitions());
        }
        log.info("  File  : {}", summary.output());
        log.info("=".repeat(80));
    }

    private void abort(ApplicationArguments args) {
        String jobId = required(args, "job-id");
        JobKind kind;
        try {
            kind = JobKind.fromString(required(args, "kind"));
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        BulkJob job = orchestrator.attach(kind, jobId);
        orchestrator.abort(job);
        log.info("Aborted {}", job);
    }

    private static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new UsageException("--" + name + " given more than once");
        }
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value;
    }

    private static String required(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            throw new UsageException("--" + name + " is required");
        }
        return value;
    }

    private static Path optionalPath(ApplicationArguments args, String name) {
        String value = optional(args, name);
        return value == null ? null : Paths.get(value);
    }

    private static Path requiredPath(ApplicationArguments args, String name) {
        return Paths.get(required(args, name));
    }

    private static Integer optionalInt(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " must be a number, got " + value);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.boot.DefaultApplicationArguments;
import se.devrandom.bulkbridge.bulk.BulkJob;
import se.devrandom.bulkbridge.bulk.BulkJobOrchestrator;
import se.devrandom.bulkbridge.bulk.ExportSummary;
import se.devrandom.bulkbridge.bulk.JobKind;
import se.devrandom.bulkbridge.bulk.JobState;
import se.devrandom.bulkbridge.bulk.exception.PollTimeoutException;
import se.devrandom.bulkbridge.service.ConversionService;
import se.devrandom.bulkbridge.service.ExportRequest;
import se.devrandom.bulkbridge.service.ExportService;
import se.devrandom.bulkbridge.service.IngestReport;
import se.devrandom.bulkbridge.service.IngestService;
import se.devrandom.bulkbridge.transform.MappingSpec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BulkBridgeCommandRunnerTest {

    @Mock
    private ConversionService conversionService;
    @Mock
    private IngestService ingestService;
    @Mock
    private ExportService exportService;
    @Mock
    private BulkJobOrchestrator orchestrator;

    private BulkBridgeCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new BulkBridgeCommandRunner(conversionService, ingestService, exportService, orchestrator);
    }

    private int run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
        return runner.getExitCode();
    }

    @Test
    void noCommand_isUsageError() {
        assertThat(run()).isEqualTo(ExitStatus.USAGE.code());
    }

    @Test
    void unknownCommand_isUsageError() {
        assertThat(run("restore")).isEqualTo(ExitStatus.USAGE.code());
    }

    @Test
    void convert_passesPaths() {
        MappingSpec spec = new MappingSpec();
        spec.setMasterKey("DPT");
        when(conversionService.convert(Paths.get("DPT.ALL"), Paths.get("DPT.yml"), null))
                .thenReturn(new ConversionService.ConversionResult(spec, Paths.get("out.csv"), 12));

        assertThat(run("convert", "--input=DPT.ALL", "--config=DPT.yml")).isZero();
        verify(conversionService).convert(Paths.get("DPT.ALL"), Paths.get("DPT.yml"), null);
    }

    @Test
    void convert_missingConfig_isUsageError() {
        assertThat(run("convert", "--input=DPT.ALL")).isEqualTo(ExitStatus.USAGE.code());
        verifyNoInteractions(conversionService);
    }

    @Test
    void ingest_requiresExactlyOneSource() {
        assertThat(run("ingest", "--mapping=DPT")).isEqualTo(ExitStatus.USAGE.code());
        assertThat(run("ingest", "--mapping=DPT", "--input=a.ALL", "--csv=a.csv")).isEqualTo(ExitStatus.USAGE.code());
        verifyNoInteractions(ingestService);
    }

    @Test
    void ingest_rowFailuresStillSucceed() {
        when(ingestService.ingest("DPT", Paths.get("DPT.ALL"), null, null)).thenReturn(
                new IngestReport("750A", "DPT", JobState.JOB_COMPLETE, 3, 2, 1, 0, List.of(Path.of("750A_DPT_error.csv"))));

        assertThat(run("ingest", "--mapping=DPT", "--input=DPT.ALL")).isEqualTo(ExitStatus.SUCCESS.code());
    }

    @Test
    void ingest_timeout_exitsWithPollTimeout() {
        when(ingestService.ingest("DPT", null, Paths.get("ready.csv"), "750A"))
                .thenThrow(new PollTimeoutException("750A", JobState.IN_PROGRESS, Duration.ofMinutes(10)));

        assertThat(run("ingest", "--mapping=DPT", "--csv=ready.csv", "--job-id=750A"))
                .isEqualTo(ExitStatus.POLL_TIMEOUT.code());
    }

    @Test
    void export_buildsRequestFromOptions() {
        when(exportService.export(any())).thenReturn(new ExportSummary("750Q", Paths.get("a.csv"), 2, 10, 3));

        assertThat(run("export", "--query=SELECT Id FROM Account", "--operation=queryAll", "--output=a.csv",
                "--page-size=500", "--chunk-size=100000")).isZero();

        ArgumentCaptor<ExportRequest> request = ArgumentCaptor.forClass(ExportRequest.class);
        verify(exportService).export(request.capture());
        assertThat(request.getValue()).isEqualTo(new ExportRequest("SELECT Id FROM Account", null, "queryAll",
                Paths.get("a.csv"), 500, 100000, null));
    }

    @Test
    void export_nonNumericPageSize_isUsageError() {
        assertThat(run("export", "--query=SELECT Id FROM Account", "--page-size=lots")).isEqualTo(ExitStatus.USAGE.code());
        verifyNoInteractions(exportService);
    }

    @Test
    void export_queryAndConfig_isUsageError() {
        assertThat(run("export", "--query=SELECT Id FROM Account", "--config=export.yml")).isEqualTo(ExitStatus.USAGE.code());
    }

    @Test
    void abort_attachesAndAborts() {
        BulkJob job = mock(BulkJob.class);
        when(orchestrator.attach(JobKind.QUERY, "750Q")).thenReturn(job);

        assertThat(run("abort", "--job-id=750Q", "--kind=query")).isZero();
        verify(orchestrator).abort(job);
    }

    @Test
    void abort_unknownKind_isUsageError() {
        assertThat(run("abort", "--job-id=750Q", "--kind=batch")).isEqualTo(ExitStatus.USAGE.code());
        verifyNoInteractions(orchestrator);
    }
}

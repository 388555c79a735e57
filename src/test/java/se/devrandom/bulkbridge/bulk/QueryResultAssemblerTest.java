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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import se.devrandom.bulkbridge.bulk.exception.JobFailedException;
import se.devrandom.bulkbridge.bulk.exception.PartialChunkFailureException;
import se.devrandom.bulkbridge.salesforce.BulkApiClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static se.devrandom.bulkbridge.bulk.TestJobs.info;
import static se.devrandom.bulkbridge.bulk.TestJobs.page;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class QueryResultAssemblerTest {
    private static final String SOQL = "SELECT Id, Name FROM Account";
    private static final PollPolicy FAST = PollPolicy.constant(Duration.ofMillis(1), Duration.ofMinutes(1));

    @Mock
    private BulkApiClient client;

    @TempDir
    Path tempDir;

    private QueryResultAssembler assembler;

    @BeforeEach
    void setUp() {
        BulkJobOrchestrator orchestrator = new BulkJobOrchestrator(client, Clock.systemUTC(), duration -> {
        });
        assembler = new QueryResultAssembler(orchestrator);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5})
    void export_multiplePages_writesHeaderOnce(int pageCount) throws IOException {
        when(client.createQueryJob(eq(SOQL), eq(BulkOperation.QUERY), isNull()))
                .thenReturn(info("750Q", "query", "UploadComplete"));
        when(client.getJobInfo(JobKind.QUERY, "750Q")).thenReturn(info("750Q", "query", "JobComplete"));
        for (int p = 0; p < pageCount; p++) {
            String locator = p == 0 ? null : "L" + p;
            String next = p == pageCount - 1 ? null : "L" + (p + 1);
            when(client.getQueryResults("750Q", locator, 3)).thenReturn(page(p * 3, 3, next));
        }
        Path output = tempDir.resolve("out/Account.csv");

        ExportSummary summary = assembler.export(SOQL, BulkOperation.QUERY, options(3, null), output);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1 + pageCount * 3);
        assertThat(lines).filteredOn("Id,Name"::equals).hasSize(1);
        assertThat(lines.get(0)).isEqualTo("Id,Name");
        assertThat(lines.get(1)).isEqualTo("a00,Name 0");
        assertThat(summary.pages()).isEqualTo(pageCount);
        assertThat(summary.rows()).isEqualTo(pageCount * 3L);
        assertThat(summary.partitions()).isZero();
        assertThat(summary.jobId()).isEqualTo("750Q");
    }

    @Test
    void export_jobFailed_writesNothing() throws IOException {
        when(client.createQueryJob(eq(SOQL), eq(BulkOperation.QUERY), isNull()))
                .thenReturn(info("750Q", "query", "UploadComplete"));
        var failed = info("750Q", "query", "Failed");
        failed.setErrorMessage("MALFORMED_QUERY");
        when(client.getJobInfo(JobKind.QUERY, "750Q")).thenReturn(failed);

        assertThatThrownBy(() -> assembler.export(SOQL, BulkOperation.QUERY, options(10, null), tempDir.resolve("a.csv")))
                .isInstanceOf(JobFailedException.class)
                .hasMessageContaining("MALFORMED_QUERY");
        assertThat(listFiles()).isEmpty();
    }

    @Test
    void export_chunked_concatenatesPartitionsWithOneHeader() throws IOException {
        givenChunkedJob("InProgress", "InProgress", "InProgress");
        completeChunks("750C0", "750C1", "750C2");
        when(client.getQueryResults("750C0", null, 1000)).thenReturn(page(0, 100, null));
        when(client.getQueryResults("750C1", null, 1000)).thenReturn(page(100, 60, "C1-2"));
        when(client.getQueryResults("750C1", "C1-2", 1000)).thenReturn(page(160, 40, null));
        when(client.getQueryResults("750C2", null, 1000)).thenReturn(page(200, 100, null));
        Path output = tempDir.resolve("Account.csv");

        ExportSummary summary = assembler.export(SOQL, BulkOperation.QUERY, options(1000, 100), output);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(301);
        assertThat(lines).filteredOn("Id,Name"::equals).hasSize(1);
        assertThat(lines.get(1)).isEqualTo("a00,Name 0");
        assertThat(lines.get(101)).isEqualTo("a0100,Name 100");
        assertThat(lines.get(300)).isEqualTo("a0299,Name 299");
        assertThat(summary.rows()).isEqualTo(300);
        assertThat(summary.pages()).isEqualTo(4);
        assertThat(summary.partitions()).isEqualTo(3);
        assertThat(listFiles()).containsExactly(output);
    }

    @Test
    void export_chunked_outputOrderDoesNotDependOnCompletionOrder() throws IOException {
        givenChunkedJob("InProgress", "InProgress", "InProgress");
        CountDownLatch laterChunksDownloaded = new CountDownLatch(2);
        when(client.getJobInfo(JobKind.QUERY, "750C0")).thenAnswer(invocation -> {
            assertThat(laterChunksDownloaded.await(10, TimeUnit.SECONDS)).isTrue();
            return info("750C0", "query", "JobComplete");
        });
        completeChunks("750C1", "750C2");
        when(client.getQueryResults("750C0", null, 50)).thenReturn(page(0, 2, null));
        when(client.getQueryResults("750C1", null, 50)).thenAnswer(invocation -> {
            laterChunksDownloaded.countDown();
            return page(2, 2, null);
        });
        when(client.getQueryResults("750C2", null, 50)).thenAnswer(invocation -> {
            laterChunksDownloaded.countDown();
            return page(4, 2, null);
        });
        Path output = tempDir.resolve("Account.csv");

        assembler.export(SOQL, BulkOperation.QUERY, options(50, 2), output);

        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).containsExactly(
                "Id,Name", "a00,Name 0", "a01,Name 1", "a02,Name 2", "a03,Name 3", "a04,Name 4", "a05,Name 5");
    }

    @Test
    void export_chunkFailed_raisesPartialFailureAndLeavesNoFile() throws IOException {
        givenChunkedJob("InProgress", "InProgress", "InProgress");
        completeChunks("750C0", "750C2");
        when(client.getJobInfo(JobKind.QUERY, "750C1")).thenReturn(info("750C1", "query", "Failed"));
        when(client.getQueryResults("750C0", null, 10)).thenReturn(page(0, 1, null));
        when(client.getQueryResults("750C2", null, 10)).thenReturn(page(2, 1, null));

        assertThatThrownBy(() -> assembler.export(SOQL, BulkOperation.QUERY, options(10, 1), tempDir.resolve("Account.csv")))
                .isInstanceOfSatisfying(PartialChunkFailureException.class, e ->
                        assertThat(e.getFailedPartitions()).containsExactly("#1 (750C1) Failed"));
        assertThat(listFiles()).isEmpty();
    }

    @Test
    void export_chunkedParentListsNoChunks_raisesPartialFailureAndLeavesNoFile() throws IOException {
        when(client.createQueryJob(eq(SOQL), eq(BulkOperation.QUERY), anyInt()))
                .thenReturn(info("750P", "query", "UploadComplete"));
        when(client.getJobInfo(JobKind.QUERY, "750P")).thenReturn(info("750P", "query", "JobComplete"));
        when(client.listChunkJobs("750P")).thenReturn(List.of());

        assertThatThrownBy(() -> assembler.export(SOQL, BulkOperation.QUERY, options(10, 100), tempDir.resolve("Account.csv")))
                .isInstanceOfSatisfying(PartialChunkFailureException.class, e -> {
                    assertThat(e.getJobId()).isEqualTo("750P");
                    assertThat(e.getMessage()).contains("without listing any chunk jobs");
                });
        assertThat(listFiles()).isEmpty();
    }

    @Test
    void export_resume_attachesInsteadOfCreating() throws IOException {
        var existing = info("750Q", "query", "InProgress");
        existing.setObject(null);
        when(client.getJobInfo(JobKind.QUERY, "750Q")).thenReturn(existing, info("750Q", "query", "JobComplete"));
        when(client.getQueryResults("750Q", null, 5)).thenReturn(page(0, 2, null));
        Path output = tempDir.resolve("resumed.csv");

        ExportSummary summary = assembler.export(null, BulkOperation.QUERY,
                new ExportOptions(5, null, 1, FAST, "750Q"), output);

        assertThat(summary.rows()).isEqualTo(2);
        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).hasSize(3);
        verify(client, never()).createQueryJob(any(), any(), any());
    }

    private ExportOptions options(int pageSize, Integer chunkSize) {
        return new ExportOptions(pageSize, chunkSize, 3, FAST, null);
    }

    private void givenChunkedJob(String... chunkStates) {
        when(client.createQueryJob(eq(SOQL), eq(BulkOperation.QUERY), anyInt()))
                .thenReturn(info("750P", "query", "UploadComplete"));
        when(client.getJobInfo(JobKind.QUERY, "750P")).thenReturn(info("750P", "query", "JobComplete"));
        when(client.listChunkJobs("750P")).thenReturn(List.of(
                info("750C0", "query", chunkStates[0]),
                info("750C1", "query", chunkStates[1]),
                info("750C2", "query", chunkStates[2])));
    }

    private void completeChunks(String... ids) {
        for (String id : ids) {
            when(client.getJobInfo(JobKind.QUERY, id)).thenReturn(info(id, "query", "JobComplete"));
        }
    }

    private List<Path> listFiles() throws IOException {
        try (Stream<Path> files = Files.walk(tempDir)) {
            return files.filter(Files::isRegularFile).toList();
        }
    }
}

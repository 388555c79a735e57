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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import se.devrandom.bulkbridge.bulk.BulkOperation;
import se.devrandom.bulkbridge.bulk.ExportOptions;
import se.devrandom.bulkbridge.bulk.ExportSummary;
import se.devrandom.bulkbridge.bulk.QueryResultAssembler;
import se.devrandom.bulkbridge.config.BulkProperties;
import se.devrandom.bulkbridge.salesforce.BulkApiClient;
import se.devrandom.bulkbridge.salesforce.objects.DescribeSObjectResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExportServiceTest {

    @Mock
    private QueryResultAssembler assembler;

    @Mock
    private BulkApiClient bulkApiClient;

    @TempDir
    Path tempDir;

    private BulkProperties properties;
    private ExportService service;

    @BeforeEach
    void setUp() {
        properties = new BulkProperties();
        properties.setOutputDir("exports");
        properties.getExport().setPageSize(50_000);
        properties.getExport().setChunkWorkers(2);
        Clock clock = Clock.fixed(Instant.parse("2025-03-05T09:15:30Z"), ZoneOffset.UTC);
        service = new ExportService(assembler, bulkApiClient, properties, clock);
        when(assembler.export(any(), any(), any(), any()))
                .thenAnswer(invocation -> new ExportSummary("750Q", invocation.getArgument(3), 1, 0, 0));
    }

    @Test
    void export_soql_usesDefaultsAndTimestampedOutput() {
        ExportSummary summary = service.export(new ExportRequest("SELECT Id FROM Account", null, null, null, null, null, null));

        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(assembler).export(eq("SELECT Id FROM Account"), eq(BulkOperation.QUERY), options.capture(),
                eq(Paths.get("exports", "Account_20250305_091530.csv")));
        assertThat(options.getValue().pageSize()).isEqualTo(50_000);
        assertThat(options.getValue().chunked()).isFalse();
        assertThat(options.getValue().chunkWorkers()).isEqualTo(2);
        assertThat(options.getValue().resumeJobId()).isNull();
        assertThat(summary.output()).isEqualTo(Paths.get("exports", "Account_20250305_091530.csv"));
    }

    @Test
    void export_explicitArguments_override() {
        Path output = tempDir.resolve("accounts.csv");

        service.export(new ExportRequest("SELECT Id FROM Account", null, "queryAll", output, 1000, 250_000, null));

        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(assembler).export(eq("SELECT Id FROM Account"), eq(BulkOperation.QUERY_ALL), options.capture(), eq(output));
        assertThat(options.getValue().pageSize()).isEqualTo(1000);
        assertThat(options.getValue().chunkSize()).isEqualTo(250_000);
    }

    @Test
    void export_config_buildsSoqlFromDescribedFields() throws IOException {
        Path config = Files.writeString(tempDir.resolve("department.yml"), """
                object_api: Department__c
                mappings:
                  - api: Id
                    object: Department__c
                  - api: Name
                    object: Department__c
                  - api: DptCode__c
                  - api: Name
                  - api: Missing__c
                    object: Department__c
                  - api: Email
                    object: Contact
                query_options:
                  where: Active__c = true
                  order_by: DptCode__c
                  limit: "100"
                page: 2000
                pk_chunking: 100000
                out: out/departments.csv
                """);
        when(bulkApiClient.describeSObject("Department__c")).thenReturn(describe("Name", "DptCode__c", "Active__c"));

        service.export(new ExportRequest(null, config, null, null, null, null, null));

        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(assembler).export(
                eq("SELECT Id, Name, DptCode__c FROM Department__c WHERE Active__c = true ORDER BY DptCode__c LIMIT 100"),
                eq(BulkOperation.QUERY), options.capture(), eq(Paths.get("out/departments.csv")));
        assertThat(options.getValue().pageSize()).isEqualTo(2000);
        assertThat(options.getValue().chunkSize()).isEqualTo(100_000);
    }

    @Test
    void export_configWithLiteralSoql_skipsDescribe() throws IOException {
        Path config = Files.writeString(tempDir.resolve("raw.yml"), """
                object_api: Department__c
                soql: "SELECT Id FROM Department__c WHERE CreatedDate = TODAY"
                operation: queryAll
                """);

        service.export(new ExportRequest(null, config, null, null, null, null, null));

        verify(assembler).export(eq("SELECT Id FROM Department__c WHERE CreatedDate = TODAY"), eq(BulkOperation.QUERY_ALL),
                any(), eq(Paths.get("exports", "Department__c_20250305_091530.csv")));
        verifyNoInteractions(bulkApiClient);
    }

    @Test
    void export_resumeWithoutQuery_isAllowed() {
        service.export(new ExportRequest(null, null, null, null, null, null, "750Q"));

        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(assembler).export(isNull(), eq(BulkOperation.QUERY), options.capture(),
                eq(Paths.get("exports", "export_20250305_091530.csv")));
        assertThat(options.getValue().resumeJobId()).isEqualTo("750Q");
    }

    @Test
    void export_nothingToRun_rejected() {
        assertThatThrownBy(() -> service.export(new ExportRequest(null, null, null, null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(assembler);
    }

    @Test
    void export_ingestOperation_rejected() {
        assertThatThrownBy(() -> service.export(new ExportRequest("SELECT Id FROM Account", null, "upsert", null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a query operation");
    }

    @Test
    void objectName_fromClauseOrFallback() {
        assertThat(ExportService.objectName("select Id, Name from Account where Name != null", null)).isEqualTo("Account");
        assertThat(ExportService.objectName("SELECT Id FROM\n  Custom_Object__c", null)).isEqualTo("Custom_Object__c");
        assertThat(ExportService.objectName("SELECT COUNT() x", null)).isEqualTo("export");
        assertThat(ExportService.objectName(null, null)).isEqualTo("export");
    }

    private static DescribeSObjectResult describe(String... fieldNames) {
        DescribeSObjectResult result = new DescribeSObjectResult();
        result.name = "Department__c";
        result.fields = new ArrayList<>();
        for (String name : fieldNames) {
            DescribeSObjectResult.Field field = new DescribeSObjectResult.Field();
            field.name = name;
            result.fields.add(field);
        }
        return result;
    }
}

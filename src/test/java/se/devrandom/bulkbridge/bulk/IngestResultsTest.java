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

import org.junit.jupiter.api.Test;
import se.devrandom.bulkbridge.bulk.exception.OutcomeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestResultsTest {

    private static IngestOutcome ok(String key) {
        return IngestOutcome.success("a01" + key, true, key, Map.of("Code__c", key));
    }

    private static IngestOutcome ko(String key) {
        return IngestOutcome.failure("", "DUPLICATE_VALUE:duplicate value found", key, Map.of("Code__c", key));
    }

    @Test
    void reconcile_everyRowAccountedFor_passes() {
        IngestResults results = new IngestResults("750A", 3, List.of(ok("A"), ok("B")), List.of(ko("C")), 0, "", "");

        assertThat(results.reconcile(List.of("C", "B", "A"))).isSameAs(results);
        assertThat(results.hasFailures()).isTrue();
    }

    @Test
    void reconcile_duplicateKeys_countedAsMultiset() {
        IngestResults results = new IngestResults("750A", 2, List.of(ok("A")), List.of(ko("A")), 0, "", "");

        results.reconcile(List.of("A", "A"));
    }

    @Test
    void reconcile_unknownKey_throws() {
        IngestResults results = new IngestResults("750A", 2, List.of(ok("A"), ok("X")), List.of(), 0, "", "");

        assertThatThrownBy(() -> results.reconcile(List.of("A", "B")))
                .isInstanceOf(OutcomeMismatchException.class)
                .hasMessageContaining("'X'");
    }

    @Test
    void reconcile_countMismatch_throws() {
        IngestResults results = new IngestResults("750A", 3, List.of(ok("A")), List.of(ko("B")), 0, "", "");

        assertThatThrownBy(() -> results.reconcile(null))
                .isInstanceOfSatisfying(OutcomeMismatchException.class, e -> {
                    assertThat(e.getSubmitted()).isEqualTo(3);
                    assertThat(e.getSucceeded()).isEqualTo(1);
                    assertThat(e.getFailed()).isEqualTo(1);
                });
    }

    @Test
    void reconcile_unprocessedRowsCloseTheGap() {
        IngestResults results = new IngestResults("750A", 3, List.of(ok("A")), List.of(), 2, "", "");

        results.reconcile(null);
        assertThat(results.getUnprocessedRows()).isEqualTo(2);
    }

    @Test
    void failure_splitsErrorCodeFromMessage() {
        IngestOutcome outcome = ko("A");

        assertThat(outcome.recordId()).isNull();
        assertThat(outcome.errorCode()).isEqualTo("DUPLICATE_VALUE");
        assertThat(outcome.errorMessage()).isEqualTo("duplicate value found");
        assertThat(IngestOutcome.failure(null, "plain message: x", "k", Map.of()).errorCode()).isNull();
    }

    @Test
    void correlationKey_dependsOnOperation() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("id", "a01");
        fields.put("Code__c", "D1");
        fields.put("Name", "Food");

        assertThat(CorrelationKey.of(BulkOperation.UPSERT, "code__c", fields)).isEqualTo("D1");
        assertThat(CorrelationKey.of(BulkOperation.UPDATE, null, fields)).isEqualTo("a01");
        assertThat(CorrelationKey.of(BulkOperation.INSERT, null, fields)).isEqualTo("a01\u001fD1\u001fFood");
    }
}

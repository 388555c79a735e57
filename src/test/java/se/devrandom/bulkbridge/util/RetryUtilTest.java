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
package se.devrandom.bulkbridge.util;

import org.junit.jupiter.api.Test;
import se.devrandom.bulkbridge.bulk.exception.BulkRequestException;
import se.devrandom.bulkbridge.bulk.exception.RateLimitException;
import se.devrandom.bulkbridge.bulk.exception.TransientServiceException;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryUtilTest {

    @Test
    void executeWithRetry_transientThenSuccess_returnsResult() {
        AtomicInteger calls = new AtomicInteger();

        String result = RetryUtil.executeWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientServiceException("HTTP 503", "getJobInfo", "750A", 503, null, null);
            }
            return "ok";
        }, 3, 1, "getJobInfo");

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void executeWithRetry_exhausted_rethrowsLastFailure() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            throw new TransientServiceException("HTTP 500 #" + calls.incrementAndGet(), "getJobInfo", null, 500, null, null);
        }, 2, 1, "getJobInfo"))
                .isInstanceOf(TransientServiceException.class)
                .hasMessageContaining("#2");
        assertThat(calls).hasValue(2);
    }

    @Test
    void executeWithRetry_clientError_isNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new BulkRequestException("HTTP 400", "createIngestJob", null, 400, null, null);
        }, 5, 1, "createIngestJob"))
                .isInstanceOf(BulkRequestException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void executeWithRetry_exhaustedBudget_isNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw RateLimitException.budgetExhausted("getJobInfo", 90, 90);
        }, 5, 1, "getJobInfo"))
                .isInstanceOf(RateLimitException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void executeWithRetry_otherRuntimeException_propagatesImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }, 5, 1, "x"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
    }
}

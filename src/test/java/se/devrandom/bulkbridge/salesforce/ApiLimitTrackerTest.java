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
package se.devrandom.bulkbridge.salesforce;

import org.junit.jupiter.api.Test;
import se.devrandom.bulkbridge.bulk.exception.RateLimitException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

class ApiLimitTrackerTest {

    @Test
    void beforeAnyHeader_budgetIsOpen() {
        ApiLimitTracker tracker = new ApiLimitTracker(80);

        assertThat(tracker.isLimitReached()).isFalse();
        assertThatCode(() -> tracker.checkBudget("getJobInfo")).doesNotThrowAnyException();
    }

    @Test
    void updateFromHeader_computesShareOfDailyLimit() {
        ApiLimitTracker tracker = new ApiLimitTracker(80);

        tracker.updateFromHeader("api-usage=7900/10000");

        assertThat(tracker.getUsedNow()).isEqualTo(7900);
        assertThat(tracker.getMaxAllowed()).isEqualTo(8000);
        assertThat(tracker.isLimitReached()).isFalse();

        tracker.updateFromHeader("api-usage=8000/10000");
        assertThatThrownBy(() -> tracker.checkBudget("createQueryJob"))
                .isInstanceOf(RateLimitException.class)
                .hasMessageContaining("8000 of 8000");
    }

    @Test
    void updateFromHeader_ignoresMissingOrUnrelatedValues() {
        ApiLimitTracker tracker = new ApiLimitTracker(50);

        tracker.updateFromHeader(null);
        tracker.updateFromHeader("per-app-api-usage");

        assertThat(tracker.getUsedNow()).isZero();
        assertThat(tracker.getMaxAllowed()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void constructor_rejectsOutOfRangePercent() {
        assertThatThrownBy(() -> new ApiLimitTracker(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ApiLimitTracker(101)).isInstanceOf(IllegalArgumentException.class);
    }
}

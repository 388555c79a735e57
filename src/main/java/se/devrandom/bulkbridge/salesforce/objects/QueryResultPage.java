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
package se.devrandom.bulkbridge.salesforce.objects;

/**
 * Raw body and paging headers of one {@code /results} response.
 *
 * @param locator         value of {@code Sforce-Locator}, null when it was absent or the literal "null"
 * @param numberOfRecords value of {@code Sforce-NumberOfRecords}, -1 when absent
 */
public record QueryResultPage(String body, String locator, int numberOfRecords) {
}

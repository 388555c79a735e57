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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Export definition file: an object and its fields, or a literal SOQL statement.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportConfig {
    @JsonProperty("object_api")
    public String objectApi;

    public List<FieldRef> mappings = new ArrayList<>();

    // takes precedence over mappings/query_options when set
    public String soql;

    @JsonProperty("query_options")
    public QueryOptions queryOptions = new QueryOptions();

    public String out;

    public String operation;

    public Integer page;

    @JsonProperty("pk_chunking")
    public Integer pkChunking;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FieldRef {
        public String api;
        public String object;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryOptions {
        public String where;
        @JsonProperty("order_by")
        public String orderBy;
        public String limit;
    }
}

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

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import se.devrandom.bulkbridge.bulk.BulkOperation;
import se.devrandom.bulkbridge.bulk.JobKind;
import se.devrandom.bulkbridge.bulk.JobState;
import se.devrandom.bulkbridge.bulk.exception.AuthenticationException;
import se.devrandom.bulkbridge.bulk.exception.BulkApiException;
import se.devrandom.bulkbridge.bulk.exception.BulkRequestException;
import se.devrandom.bulkbridge.bulk.exception.RateLimitException;
import se.devrandom.bulkbridge.bulk.exception.TransientServiceException;
import se.devrandom.bulkbridge.config.BulkProperties;
import se.devrandom.bulkbridge.config.SalesforceCredentials;
import se.devrandom.bulkbridge.salesforce.objects.BulkChunkList;
import se.devrandom.bulkbridge.salesforce.objects.BulkJobInfo;
import se.devrandom.bulkbridge.salesforce.objects.DescribeSObjectResult;
import se.devrandom.bulkbridge.salesforce.objects.QueryResultPage;
import se.devrandom.bulkbridge.util.RetryUtil;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin HTTP layer over the Bulk API 2.0 job endpoints. Each method is one request, retried on
 * transient failures and translated into the {@link BulkApiException} family. Job lifecycle rules
 * live in {@link se.devrandom.bulkbridge.bulk.BulkJobOrchestrator}.
 */
@Service
public class BulkApiClient {
    private static final Logger log = LoggerFactory.getLogger(BulkApiClient.class);

    static final String HEADER_LOCATOR = "Sforce-Locator";
    static final String HEADER_NUMBER_OF_RECORDS = "Sforce-NumberOfRecords";
    static final String HEADER_LIMIT_INFO = "Sforce-Limit-Info";
    static final String HEADER_PK_CHUNKING = "Sforce-Enable-PKChunking";
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final WebClient webClient;
    private final SalesforceCredentials salesforceCredentials;
    private final SalesforceAuthenticator authenticator;
    private final Optional<ApiLimitTracker> apiLimitTracker;
    private final int maxAttempts;
    private final long initialRetryDelayMs;

    @Autowired
    public BulkApiClient(WebClient webClient,
                         SalesforceCredentials salesforceCredentials,
                         SalesforceAuthenticator authenticator,
                         BulkProperties bulkProperties,
                         Optional<ApiLimitTracker> apiLimitTracker) {
        this.webClient = webClient;
        this.salesforceCredentials = salesforceCredentials;
        this.authenticator = authenticator;
        this.apiLimitTracker = apiLimitTracker;
        this.maxAttempts = bulkProperties.getRetry().getMaxAttempts();
        this.initialRetryDelayMs = bulkProperties.getRetry().getInitialDelay().toMillis();
    }

    public BulkJobInfo createIngestJob(String objectName, BulkOperation operation, String externalIdField) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("object", objectName);
        map.put("operation", operation.wireName());
        map.put("contentType", "CSV");
        map.put("lineEnding", "LF");
        map.put("columnDelimiter", "COMMA");
        if (externalIdField != null) {
            map.put("externalIdFieldName", externalIdField);
        }
        log.info("Creating {} ingest job for {}", operation.wireName(), objectName);
        return send("createIngestJob", null, HttpMethod.POST, jobsPath(JobKind.INGEST), map,
                MediaType.APPLICATION_JSON, Map.of(), BulkJobInfo.class).getBody();
    }

    /**
     * @param chunkSize PK chunk size, or null for an unchunked query
     */
    public BulkJobInfo createQueryJob(String soql, BulkOperation operation, Integer chunkSize) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("operation", operation.wireName());
        map.put("query", soql);
        map.put("contentType", "CSV");
        map.put("columnDelimiter", "COMMA");
        map.put("lineEnding", "LF");
        Map<String, String> headers = Map.of();
        if (chunkSize != null) {
            map.put("pkChunking", "chunkSize=" + chunkSize);
            headers = Map.of(HEADER_PK_CHUNKING, "chunkSize=" + chunkSize);
        }
        log.info("Creating {} job{}: {}", operation.wireName(),
                chunkSize == null ? "" : " with PK chunking (chunkSize=" + chunkSize + ")", soql);
        return send("createQueryJob", null, HttpMethod.POST, jobsPath(JobKind.QUERY), map,
                MediaType.APPLICATION_JSON, headers, BulkJobInfo.class).getBody();
    }

    public void uploadJobData(String jobId, byte[] csv) {
        log.info("Uploading {} bytes to ingest job {}", csv.length, jobId);
        send("uploadJobData", jobId, HttpMethod.PUT, jobsPath(JobKind.INGEST) + "/" + jobId + "/batches", csv,
                TEXT_CSV, Map.of(), String.class);
    }

    public BulkJobInfo updateJobState(JobKind kind, String jobId, JobState state) {
        log.info("Setting {} job {} to {}", kind.pathSegment(), jobId, state);
        return send("updateJobState", jobId, HttpMethod.PATCH, jobsPath(kind) + "/" + jobId,
                Map.of("state", state.wireName()), MediaType.APPLICATION_JSON, Map.of(), BulkJobInfo.class).getBody();
    }

    public BulkJobInfo getJobInfo(JobKind kind, String jobId) {
        return send("getJobInfo", jobId, HttpMethod.GET, jobsPath(kind) + "/" + jobId, null, null, Map.of(),
                BulkJobInfo.class).getBody();
    }

    public void deleteJob(JobKind kind, String jobId) {
        log.info("Deleting {} job {}", kind.pathSegment(), jobId);
        send("deleteJob", jobId, HttpMethod.DELETE, jobsPath(kind) + "/" + jobId, null, null, Map.of(), String.class);
    }

    /**
     * @param resultType {@code successfulResults}, {@code failedResults} or {@code unprocessedrecords}
     * @return CSV body decoded as UTF-8, empty when the service returned no content
     */
    public String getIngestResults(String jobId, String resultType) {
        ResponseEntity<byte[]> response = send("getIngestResults", jobId, HttpMethod.GET,
                jobsPath(JobKind.INGEST) + "/" + jobId + "/" + resultType, null, null, Map.of(), byte[].class);
        return decode(response.getBody());
    }

    /**
     * Downloads one page of query results. Salesforce sends the literal string "null" as locator
     * on the last page; that is normalized to null here.
     */
    public QueryResultPage getQueryResults(String jobId, String locator, int maxRecords) {
        StringBuilder path = new StringBuilder(jobsPath(JobKind.QUERY)).append('/').append(jobId)
                .append("/results?maxRecords=").append(maxRecords);
        if (locator != null) {
            path.append("&locator=").append(locator);
        }
        ResponseEntity<byte[]> response = send("getQueryResults", jobId, HttpMethod.GET, path.toString(), null, null,
                Map.of(), byte[].class);

        HttpHeaders headers = response.getHeaders();
        String nextLocator = headers.getFirst(HEADER_LOCATOR);
        if (nextLocator == null || nextLocator.isBlank() || "null".equals(nextLocator)) {
            nextLocator = null;
        }
        int numberOfRecords = -1;
        String count = headers.getFirst(HEADER_NUMBER_OF_RECORDS);
        if (count != null) {
            try {
                numberOfRecords = Integer.parseInt(count.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed {} header '{}' for job {}", HEADER_NUMBER_OF_RECORDS, count, jobId);
            }
        }
        log.debug("Fetched result page for job {} (records={}, nextLocator={})", jobId, numberOfRecords, nextLocator);
        return new QueryResultPage(decode(response.getBody()), nextLocator, numberOfRecords);
    }

    /**
     * Reads the chunk listing of a PK-chunked parent. A listing reported as not done yet is re-read
     * with the retry backoff; transport errors are already retried per request by {@code send}.
     */
    public List<BulkJobInfo> listChunkJobs(String parentJobId) {
        for (int attempt = 1; ; attempt++) {
            BulkChunkList chunkList = send("listChunkJobs", parentJobId, HttpMethod.GET,
                    jobsPath(JobKind.QUERY) + "/" + parentJobId + "/chunks", null, null, Map.of(), BulkChunkList.class)
                    .getBody();
            if (chunkList == null || chunkList.done) {
                return chunkList == null || chunkList.records == null ? List.of() : chunkList.records;
            }
            if (attempt >= maxAttempts) {
                throw new TransientServiceException("Chunk listing still not complete after " + attempt + " reads",
                        "listChunkJobs", parentJobId, null, null, null);
            }
            long delayMs = initialRetryDelayMs * (1L << (attempt - 1));
            log.info("Chunk listing of job {} not complete yet, re-reading in {}ms", parentJobId, delayMs);
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while reading chunks of job " + parentJobId, e);
            }
        }
    }

    public DescribeSObjectResult describeSObject(String objectName) {
        log.info("Describing {}", objectName);
        DescribeSObjectResult result = send("describeSObject", null, HttpMethod.GET,
                "/services/data/" + salesforceCredentials.getApiVersion() + "/sobjects/" + objectName + "/describe",
                null, null, Map.of(), DescribeSObjectResult.class).getBody();
        if (result == null) {
            throw new BulkRequestException("Empty describe response for " + objectName, "describeSObject", null,
                    null, null, null);
        }
        return result;
    }

    private String jobsPath(JobKind kind) {
        return "/services/data/" + salesforceCredentials.getApiVersion() + "/jobs/" + kind.pathSegment();
    }

    private <T> ResponseEntity<T> send(String operation, String jobId, HttpMethod method, String path, Object body,
                                       MediaType contentType, Map<String, String> extraHeaders, Class<T> responseType) {
        return RetryUtil.executeWithRetry(() -> {
            apiLimitTracker.ifPresent(tracker -> tracker.checkBudget(operation));
            SalesforceAccessToken token = authenticator.getAccessToken();
            URI uri = URI.create(authenticator.getInstanceUrl() + path);

            WebClient.RequestBodySpec request = webClient
                    .method(method)
                    .uri(uri)
                    .headers(httpHeaders -> {
                        httpHeaders.setBearerAuth(token.accessToken);
                        extraHeaders.forEach(httpHeaders::set);
                    })
                    .accept(MediaType.APPLICATION_JSON, TEXT_CSV);
            WebClient.RequestHeadersSpec<?> ready = body == null ? request
                    : request.contentType(contentType).bodyValue(body);

            try {
                ResponseEntity<T> response = ready.retrieve().toEntity(responseType).block();
                if (response == null) {
                    throw new TransientServiceException("Empty response", operation, jobId, null, null, null);
                }
                updateApiUsage(response.getHeaders());
                return response;
            } catch (WebClientResponseException e) {
                updateApiUsage(e.getHeaders());
                throw translate(e, operation, jobId);
            } catch (WebClientRequestException e) {
                throw new TransientServiceException("Request failed: " + e.getMessage(), operation, jobId,
                        null, null, e);
            }
        }, maxAttempts, initialRetryDelayMs, operation);
    }

    private void updateApiUsage(HttpHeaders headers) {
        if (headers == null) {
            return;
        }
        apiLimitTracker.ifPresent(tracker -> tracker.updateFromHeader(headers.getFirst(HEADER_LIMIT_INFO)));
    }

    BulkApiException translate(WebClientResponseException e, String operation, String jobId) {
        int status = e.getStatusCode().value();
        String responseBody = e.getResponseBodyAsString(StandardCharsets.UTF_8);
        String serverMessage = describeErrorBody(responseBody);
        String message = "HTTP " + status + (serverMessage == null ? "" : ": " + serverMessage);

        if (status == 401) {
            authenticator.invalidate();
            return new AuthenticationException(message, operation, jobId, status, responseBody, e);
        }
        if (status == 403) {
            if (responseBody != null && responseBody.contains("REQUEST_LIMIT_EXCEEDED")) {
                return new RateLimitException(message, operation, jobId, status, responseBody, e);
            }
            return new AuthenticationException(message, operation, jobId, status, responseBody, e);
        }
        if (status == 429) {
            return new RateLimitException(message, operation, jobId, status, responseBody, e);
        }
        if (status >= 500) {
            return new TransientServiceException(message, operation, jobId, status, responseBody, e);
        }
        log.error("Salesforce rejected {} (job {}): {}", operation, jobId, responseBody);
        return new BulkRequestException(message, operation, jobId, status, responseBody, e);
    }

    /**
     * Salesforce returns errors as {@code [{"errorCode": "...", "message": "..."}]}.
     */
    static String describeErrorBody(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            String trimmed = responseBody.trim();
            JSONArray errors = trimmed.startsWith("[") ? new JSONArray(trimmed) : new JSONArray().put(new JSONObject(trimmed));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < errors.length(); i++) {
                JSONObject error = errors.getJSONObject(i);
                if (sb.length() > 0) {
                    sb.append("; ");
                }
                sb.append(error.optString("errorCode", "UNKNOWN")).append(": ").append(error.optString("message", ""));
            }
            return sb.toString();
        } catch (JSONException e) {
            return responseBody.length() > 200 ? responseBody.substring(0, 200) : responseBody;
        }
    }

    private static String decode(byte[] body) {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }
}

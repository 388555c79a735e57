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

import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import se.devrandom.bulkbridge.bulk.exception.AuthenticationException;
import se.devrandom.bulkbridge.bulk.exception.TransientServiceException;
import se.devrandom.bulkbridge.config.SalesforceCredentials;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;
import java.util.Date;

/**
 * Obtains and caches the OAuth access token. Login happens on the first API call, not at startup,
 * so offline commands such as {@code convert} never need credentials.
 */
@Component
public class SalesforceAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(SalesforceAuthenticator.class);
    private static final String JWT_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";

    private final WebClient webClient;
    private final SalesforceCredentials salesforceCredentials;
    private volatile SalesforceAccessToken cachedToken;

    public SalesforceAuthenticator(WebClient webClient, SalesforceCredentials salesforceCredentials) {
        this.webClient = webClient;
        this.salesforceCredentials = salesforceCredentials;
    }

    public synchronized SalesforceAccessToken getAccessToken() {
        if (cachedToken == null) {
            cachedToken = loginToSalesforce();
        }
        return cachedToken;
    }

    /**
     * Drops the cached token after the service rejected it; the next call logs in again.
     */
    public synchronized void invalidate() {
        cachedToken = null;
    }

    /**
     * Base URL for API calls: the instance URL from the token response, else the configured base URL.
     */
    public String getInstanceUrl() {
        SalesforceAccessToken token = getAccessToken();
        String instanceUrl = token.instanceUrl;
        if (instanceUrl == null || instanceUrl.isBlank()) {
            instanceUrl = salesforceCredentials.getBaseUrl();
        }
        return instanceUrl.endsWith("/") ? instanceUrl.substring(0, instanceUrl.length() - 1) : instanceUrl;
    }

    private SalesforceAccessToken loginToSalesforce() {
        SalesforceAccessToken token;
        try {
            if (salesforceCredentials.isJwtFlow()) {
                log.info("Using JWT authentication");
                token = loginWithJWT();
            } else {
                log.info("Using OAuth2 client credentials authentication");
                token = loginWithClientCredentials();
            }
        } catch (WebClientResponseException e) {
            String clientIdPrefix = salesforceCredentials.getClientId() == null ? ""
                    : salesforceCredentials.getClientId().substring(0, Math.min(6, salesforceCredentials.getClientId().length()));
            log.error("Token request rejected (status {}, client_id prefix '{}'): {}",
                    e.getStatusCode().value(), clientIdPrefix, e.getResponseBodyAsString());
            throw new AuthenticationException("Salesforce rejected the token request", "login", null,
                    e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException e) {
            throw new TransientServiceException("Token endpoint unreachable: " + e.getMessage(), "login", null,
                    null, null, e);
        }
        if (token == null || token.accessToken == null || token.accessToken.isBlank()) {
            throw new AuthenticationException("Token response did not contain an access_token", "login", null,
                    null, null, null);
        }
        return token;
    }

    /**
     * JWT Bearer Token Flow authentication
     * Used for server-to-server integration (same as sf cli JWT auth)
     */
    private SalesforceAccessToken loginWithJWT() {
        PrivateKey privateKey = readPrivateKey(salesforceCredentials.getJwtKeyFile());

        long expMillis = System.currentTimeMillis() + (5 * 60 * 1000); // 5 minutes expiry

        String jwt = Jwts.builder()
                .issuer(salesforceCredentials.getClientId())           // iss = Connected App Client ID
                .subject(salesforceCredentials.getUsername())          // sub = Salesforce username
                .audience().add(salesforceCredentials.getAudienceUrl()).and()
                .expiration(new Date(expMillis))
                .signWith(privateKey)
                .compact();

        log.debug("Created JWT token for user: {}", salesforceCredentials.getUsername());

        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", JWT_GRANT_TYPE);
        formData.add("assertion", jwt);

        SalesforceAccessToken accessToken = requestToken(formData);
        log.info("Successfully authenticated with JWT for user: {}", salesforceCredentials.getUsername());
        return accessToken;
    }

    private SalesforceAccessToken loginWithClientCredentials() {
        if (isBlank(salesforceCredentials.getClientId()) || isBlank(salesforceCredentials.getClientSecret())) {
            throw new AuthenticationException(
                    "salesforce.client-id and salesforce.client-secret must be configured", "login", null,
                    null, null, null);
        }
        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", salesforceCredentials.getGrantType() == null ? "client_credentials"
                : salesforceCredentials.getGrantType());
        formData.add("client_id", salesforceCredentials.getClientId());
        formData.add("client_secret", salesforceCredentials.getClientSecret());
        SalesforceAccessToken accessToken = requestToken(formData);
        log.info("Successfully authenticated with client credentials");
        return accessToken;
    }

    private SalesforceAccessToken requestToken(LinkedMultiValueMap<String, String> formData) {
        return webClient
                .post()
                .uri("/services/oauth2/token")
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                .body(BodyInserters.fromFormData(formData))
                .accept(MediaType.APPLICATION_JSON)
                .acceptCharset(StandardCharsets.UTF_8)
                .retrieve()
                .bodyToMono(SalesforceAccessToken.class)
                .block();
    }

    /**
     * Read RSA private key from a PKCS#8 PEM file
     */
    private PrivateKey readPrivateKey(String keyFilePath) {
        if (isBlank(keyFilePath)) {
            throw new AuthenticationException("salesforce.jwt-key-file is not configured", "login", null,
                    null, null, null);
        }

        Path keyPath = Paths.get(keyFilePath);
        log.debug("Reading private key from: {}", keyFilePath);
        try {
            String keyContent = Files.readString(keyPath, StandardCharsets.UTF_8)
                    .replaceAll("-----BEGIN.*-----", "")
                    .replaceAll("-----END.*-----", "")
                    .replaceAll("\\s+", "");

            byte[] keyBytes = Base64.getDecoder().decode(keyContent);
            PKCS8EncodedKeySpec keySpec = new PKCS8EncodedKeySpec(keyBytes);
            return KeyFactory.getInstance("RSA").generatePrivate(keySpec);
        } catch (IOException e) {
            throw new AuthenticationException("JWT key file not readable: " + keyFilePath, "login", null,
                    null, null, e);
        } catch (Exception e) {
            log.error("Failed to read private key from {}: {}", keyFilePath, e.getMessage());
            throw new AuthenticationException("Invalid private key format. Ensure the file is in PKCS#8 PEM format.",
                    "login", null, null, null, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

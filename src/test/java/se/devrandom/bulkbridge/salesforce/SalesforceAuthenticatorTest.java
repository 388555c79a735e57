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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import se.devrandom.bulkbridge.bulk.exception.AuthenticationException;
import se.devrandom.bulkbridge.config.SalesforceCredentials;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SalesforceAuthenticatorTest {
    private static final String LOGIN_URL = "https://login.example.com";

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private SalesforceCredentials credentials;
    private SalesforceAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        credentials = new SalesforceCredentials();
        credentials.setBaseUrl(LOGIN_URL);
        credentials.setGrantType("client_credentials");
        credentials.setClientId("3MVG9client");
        credentials.setClientSecret("secret");
        WebClient webClient = WebClient.builder()
                .baseUrl(LOGIN_URL)
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(responses.remove());
                })
                .build();
        authenticator = new SalesforceAuthenticator(webClient, credentials);
    }

    private void respondToken(String json) {
        responses.add(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    @Test
    void getAccessToken_logsInOnceAndCaches() {
        respondToken("{\"access_token\":\"00Dxx!token\",\"instance_url\":\"https://acme.my.salesforce.com/\",\"token_type\":\"Bearer\"}");

        SalesforceAccessToken first = authenticator.getAccessToken();
        SalesforceAccessToken second = authenticator.getAccessToken();

        assertThat(first).isSameAs(second);
        assertThat(first.accessToken).isEqualTo("00Dxx!token");
        assertThat(authenticator.getInstanceUrl()).isEqualTo("https://acme.my.salesforce.com");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo(LOGIN_URL + "/services/oauth2/token");
        assertThat(requests.get(0).headers().getContentType()).isEqualTo(MediaType.APPLICATION_FORM_URLENCODED);
    }

    @Test
    void invalidate_forcesNewLogin() {
        respondToken("{\"access_token\":\"first\",\"instance_url\":\"https://acme.my.salesforce.com\"}");
        respondToken("{\"access_token\":\"second\",\"instance_url\":\"https://acme.my.salesforce.com\"}");

        authenticator.getAccessToken();
        authenticator.invalidate();

        assertThat(authenticator.getAccessToken().accessToken).isEqualTo("second");
        assertThat(requests).hasSize(2);
    }

    @Test
    void getInstanceUrl_withoutInstanceInResponse_usesBaseUrl() {
        respondToken("{\"access_token\":\"tok\"}");

        assertThat(authenticator.getInstanceUrl()).isEqualTo(LOGIN_URL);
    }

    @Test
    void rejectedLogin_isAuthenticationError() {
        responses.add(ClientResponse.create(HttpStatus.BAD_REQUEST)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"error\":\"invalid_client\",\"error_description\":\"invalid client credentials\"}")
                .build());

        assertThatThrownBy(() -> authenticator.getAccessToken())
                .isInstanceOfSatisfying(AuthenticationException.class, e -> {
                    assertThat(e.getHttpStatus()).isEqualTo(400);
                    assertThat(e.getResponseBody()).contains("invalid_client");
                });
    }

    @Test
    void missingSecret_failsWithoutRequest() {
        credentials.setClientSecret("");

        assertThatThrownBy(() -> authenticator.getAccessToken())
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("client-secret");
        assertThat(requests).isEmpty();
    }

    @Test
    void jwtFlowWithoutKeyFile_failsWithoutRequest() {
        credentials.setGrantType("urn:ietf:params:oauth:grant-type:jwt-bearer");

        assertThatThrownBy(() -> authenticator.getAccessToken())
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("jwt-key-file");
        assertThat(requests).isEmpty();
    }
}

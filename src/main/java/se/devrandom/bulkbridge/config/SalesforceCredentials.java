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
package se.devrandom.bulkbridge.config;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix="salesforce")
public class SalesforceCredentials {
    private String baseUrl;
    private String grantType;
    private String clientId;
    private String clientSecret;

    // JWT authentication fields
    private String username;
    private String jwtKeyFile;
    private String audienceUrl = "https://login.salesforce.com"; // Default for production

    private String apiVersion = "v60.0";
    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getGrantType() {
        return grantType;
    }

    public void setGrantType(String grantType) {
        this.grantType = grantType;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    /**
     * API version in path form, always prefixed with "v" (e.g. "v60.0").
     */
    public String getApiVersion() {
        return apiVersion;
    }

    // Accepts both "60.0" and "v60.0"
    public void setApiVersion(String apiVersion) {
        if (apiVersion == null || apiVersion.isBlank()) {
            throw new IllegalArgumentException("salesforce.api-version must not be empty");
        }
        String trimmed = apiVersion.trim();
        this.apiVersion = trimmed.toLowerCase().startsWith("v") ? "v" + trimmed.substring(1) : "v" + trimmed;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getJwtKeyFile() {
        return jwtKeyFile;
    }

    public void setJwtKeyFile(String jwtKeyFile) {
        this.jwtKeyFile = jwtKeyFile;
    }

    public String getAudienceUrl() {
        return audienceUrl;
    }

    public void setAudienceUrl(String audienceUrl) {
        this.audienceUrl = audienceUrl;
    }

    public boolean isJwtFlow() {
        return "urn:ietf:params:oauth:grant-type:jwt-bearer".equals(grantType);
    }
}

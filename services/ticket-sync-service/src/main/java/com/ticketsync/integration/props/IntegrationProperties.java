package com.ticketsync.integration.props;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties describing how the service talks to ServiceNow and how
 * the synchronization engine behaves.
 *
 * <p>The structure mirrors {@code application.yml}. Validation ensures missing critical
 * settings are caught at startup instead of failing during runtime calls.</p>
 */
@Validated
@ConfigurationProperties(prefix = "integration")
public class IntegrationProperties {

    @Valid
    @NestedConfigurationProperty
    private final ServiceNowProperties servicenow = new ServiceNowProperties();

    @Valid
    @NestedConfigurationProperty
    private final SyncProperties sync = new SyncProperties();

    public ServiceNowProperties getServicenow() {
        return servicenow;
    }

    public SyncProperties getSync() {
        return sync;
    }

    public static class ServiceNowProperties {

        @NotBlank
        private String baseUrl = "https://your-instance.service-now.com";

        @NotBlank
        private String username = "ticket-sync";

        @NotBlank
        private String password = "changeme";

        /**
         * Applied to every single remote call. The client never retries.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        @NotBlank
        private String tablePath = "/api/now/table/sc_req_item";

        @NotBlank
        private String batchPath = "/api/x_ticket_automation/multiple_ticket_creation";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getTablePath() {
            return tablePath;
        }

        public void setTablePath(String tablePath) {
            this.tablePath = tablePath;
        }

        public String getBatchPath() {
            return batchPath;
        }

        public void setBatchPath(String batchPath) {
            this.batchPath = batchPath;
        }
    }

    public static class SyncProperties {

        @Min(0)
        private int maxRetries = 3;

        /**
         * Tickets whose last sync is older than this are picked up by the stale sync.
         */
        @NotNull
        private Duration staleAfter = Duration.ofMinutes(5);

        /**
         * A request stuck in PROCESSING for longer than this is re-derived on sync.
         */
        @NotNull
        private Duration processingStaleAfter = Duration.ofMinutes(5);

        @Min(1)
        private int maxConcurrency = 4;

        private boolean cancelRemoteTickets = false;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public Duration getProcessingStaleAfter() {
            return processingStaleAfter;
        }

        public void setProcessingStaleAfter(Duration processingStaleAfter) {
            this.processingStaleAfter = processingStaleAfter;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public boolean isCancelRemoteTickets() {
            return cancelRemoteTickets;
        }

        public void setCancelRemoteTickets(boolean cancelRemoteTickets) {
            this.cancelRemoteTickets = cancelRemoteTickets;
        }
    }
}

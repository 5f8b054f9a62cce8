package me.golemcore.monitor.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the usage monitor, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code monitor.*} prefix:
 * <ul>
 * <li>{@link ApiProperties} - usage endpoint and protocol headers</li>
 * <li>{@link RefreshProperties} - polling interval and start-up behavior</li>
 * <li>{@link CredentialsProperties} - where credentials are read from</li>
 * <li>{@link StorageProperties} - local workspace for owned files</li>
 * <li>{@link HttpProperties} - HTTP client timeouts and pooling</li>
 * <li>{@link AlertsProperties} - utilization thresholds for alerts</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "monitor")
@Data
public class MonitorProperties {

    private ApiProperties api = new ApiProperties();
    private RefreshProperties refresh = new RefreshProperties();
    private CredentialsProperties credentials = new CredentialsProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private AlertsProperties alerts = new AlertsProperties();

    @Data
    public static class ApiProperties {
        private String baseUrl = "https://api.anthropic.com";
        private String usagePath = "/api/oauth/usage";
        private String betaHeader = "oauth-2025-04-20";
        private String userAgent = "claude-code/2.0.32";
    }

    @Data
    public static class RefreshProperties {
        private Duration interval = Duration.ofSeconds(60);

        /** Delay before the start-up sequence runs. */
        private Duration startupDelay = Duration.ZERO;

        /** Start polling as soon as the application is ready. */
        private boolean autoStart = true;

        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class CredentialsProperties {
        /** Credentials file maintained by the CLI. Never written here. */
        private String primaryPath = "${user.home}/.claude/.credentials.json";

        private String tokenPrefix = "sk-ant-";

        /** Workspace subdirectory holding the manually entered token. */
        private String manualDirectory = "credentials";

        /**
         * How long a cached "no credential" result is trusted before the store is
         * read again.
         */
        private Duration absentRetryInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.claude-monitor";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;

        /** Upper bound for a whole request, including redirects. */
        private long callTimeout = 45000;

        private int maxIdleConnections = 1;
        private long keepAliveDuration = 120000;

        /** Let OkHttp silently retry a failed connection attempt. */
        private boolean retryOnConnectionFailure = false;
    }

    @Data
    public static class AlertsProperties {
        private boolean enabled = true;

        /** Utilization ratios (0.0-1.0) that trigger an alert when crossed. */
        private List<Double> thresholds = new ArrayList<>(List.of(0.8, 0.95));
    }
}

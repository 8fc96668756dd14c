package me.golemcore.livebridge.infrastructure.config;

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

/**
 * Centralized configuration properties for the bridge, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link LiveProperties} - open platform credentials and session
 * tuning</li>
 * <li>{@link HttpProperties} - shared OkHttp client timeouts and pool</li>
 * </ul>
 *
 * <p>
 * Properties are read-only once bound; a running session keeps using the
 * values it started with.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private LiveProperties live = new LiveProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class LiveProperties {
        public static final String DEFAULT_HOST = "https://live-open.biliapi.com";
        public static final int MIN_HEARTBEAT_INTERVAL_SECONDS = 5;

        private String accessKey;
        private String accessSecret;
        private Long appId;
        private String identityCode;
        private String host;
        private int heartbeatIntervalSeconds = 20;
        private int packetHeartbeatIntervalSeconds = 20;
        private int connectTimeoutSeconds = 10;
        private int eventQueueCapacity = 256;
        private int maxInflatedBytes = 16 * 1024 * 1024;
        private int maxNestingDepth = 4;
        private String zone = "Asia/Shanghai";
        private boolean chatTriggerEnabled = true;

        public String resolveHost() {
            if (host == null || host.isBlank()) {
                return DEFAULT_HOST;
            }
            return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
        }

        public int resolveHeartbeatIntervalSeconds() {
            return Math.max(MIN_HEARTBEAT_INTERVAL_SECONDS, heartbeatIntervalSeconds);
        }

        public boolean hasCredentials() {
            return accessKey != null && !accessKey.isBlank()
                    && accessSecret != null && !accessSecret.isBlank()
                    && appId != null;
        }
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 10000;
        private long writeTimeout = 10000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}

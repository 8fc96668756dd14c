package me.golemcore.livebridge;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the live bridge.
 *
 * <p>
 * The bridge pairs with a streamer's room through the open platform REST API,
 * holds the push socket open and fans decoded room events out to in-process
 * consumers.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → LiveController (/api/live)
 * Domain Layer       → LiveManager, LiveSession loop, LiveEventDispatcher
 * Infrastructure     → OpenPlatformClient (Feign), OkHttp push socket, PacketCodec
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LiveBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveBridgeApplication.class, args);
    }

}

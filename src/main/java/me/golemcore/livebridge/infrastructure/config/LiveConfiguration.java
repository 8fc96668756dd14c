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

package me.golemcore.livebridge.infrastructure.config;

import me.golemcore.livebridge.protocol.PacketCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the protocol layer, which stays free of Spring annotations.
 */
@Configuration
public class LiveConfiguration {

    @Bean
    public PacketCodec packetCodec(BotProperties properties) {
        BotProperties.LiveProperties live = properties.getLive();
        return new PacketCodec(live.getMaxInflatedBytes(), live.getMaxNestingDepth());
    }
}

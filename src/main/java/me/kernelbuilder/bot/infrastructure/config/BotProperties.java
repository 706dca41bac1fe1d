package me.kernelbuilder.bot.infrastructure.config;

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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link ChannelProperties} - input channels (Telegram)</li>
 * <li>{@link GitHubProperties} - target repository, workflow and
 * credentials</li>
 * <li>{@link BuildProperties} - default build configuration offered to
 * users</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * </ul>
 *
 * <p>
 * Values are read once at startup; required ones are checked by
 * {@link RequiredConfigurationValidator}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "en";
    private Map<String, ChannelProperties> channels = new HashMap<>();
    private GitHubProperties github = new GitHubProperties();
    private BuildProperties build = new BuildProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    // ==================== GITHUB ====================

    @Data
    public static class GitHubProperties {
        private String apiUrl = "https://api.github.com";
        private String apiVersion = "2022-11-28";
        private String token;
        private String owner = "zyexro";
        private String repo = "kernel_builder";
        private String workflow = "main.yml";
        /** Branch the workflow is dispatched on, independent of the kernel branch. */
        private String dispatchRef = "enanan";
        /** Telegram chat that the workflow notifies; sent as TG_RECIPIENT when set. */
        private String notifyRecipient;
    }

    // ==================== BUILD DEFAULTS ====================

    @Data
    public static class BuildProperties {
        private BuildDefaults defaults = new BuildDefaults();
    }

    @Data
    public static class BuildDefaults {
        private String compiler = "Geopelia-Clang-20";
        private String kernelRepoUrl = "https://github.com/TelegramAt25/niigo_kernel_xiaomi_blossom";
        private String kernelBranch = "yoka";
        private String containerImage = "fedora:40";
        private String notes = "";
        private String suffix = "";
        private String zipRepoUrl = "";
        private String zipBranch = "";
        private String kernelSuMode = "";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}

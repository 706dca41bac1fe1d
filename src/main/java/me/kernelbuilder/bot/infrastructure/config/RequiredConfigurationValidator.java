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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks once at startup that credentials and build defaults are present.
 * Values are only tested for blankness, never logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequiredConfigurationValidator {

    private static final String TELEGRAM = "telegram";

    private final BotProperties properties;

    /**
     * @throws MissingConfigurationException
     *             listing every blank required property
     */
    public void validate() {
        List<String> missing = new ArrayList<>();

        BotProperties.ChannelProperties telegram = properties.getChannels().get(TELEGRAM);
        if (telegram != null && telegram.isEnabled()) {
            require(missing, "bot.channels.telegram.token", telegram.getToken());
        }

        BotProperties.GitHubProperties github = properties.getGithub();
        require(missing, "bot.github.token", github.getToken());
        require(missing, "bot.github.owner", github.getOwner());
        require(missing, "bot.github.repo", github.getRepo());
        require(missing, "bot.github.workflow", github.getWorkflow());
        require(missing, "bot.github.dispatch-ref", github.getDispatchRef());

        BotProperties.BuildDefaults defaults = properties.getBuild().getDefaults();
        require(missing, "bot.build.defaults.compiler", defaults.getCompiler());
        require(missing, "bot.build.defaults.kernel-repo-url", defaults.getKernelRepoUrl());
        require(missing, "bot.build.defaults.kernel-branch", defaults.getKernelBranch());
        require(missing, "bot.build.defaults.container-image", defaults.getContainerImage());

        if (!missing.isEmpty()) {
            log.error("[Config] Missing required configuration: {}", missing);
            throw new MissingConfigurationException(missing);
        }
        log.debug("[Config] Required configuration present");
    }

    private static void require(List<String> missing, String name, String value) {
        if (value == null || value.isBlank()) {
            missing.add(name);
        }
    }
}

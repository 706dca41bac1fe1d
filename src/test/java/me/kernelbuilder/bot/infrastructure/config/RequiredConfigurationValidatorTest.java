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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequiredConfigurationValidatorTest {

    private BotProperties properties;
    private RequiredConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        BotProperties.ChannelProperties telegram = new BotProperties.ChannelProperties();
        telegram.setEnabled(true);
        telegram.setToken("123:abc");
        properties.getChannels().put("telegram", telegram);
        properties.getGithub().setToken("ghp_secret");
        validator = new RequiredConfigurationValidator(properties);
    }

    @Test
    void shouldAcceptCompleteConfiguration() {
        assertDoesNotThrow(() -> validator.validate());
    }

    @Test
    void shouldFailWhenGitHubTokenBlank() {
        properties.getGithub().setToken("  ");

        MissingConfigurationException e = assertThrows(MissingConfigurationException.class,
                () -> validator.validate());

        assertEquals("Missing required configuration: bot.github.token", e.getMessage());
    }

    @Test
    void shouldFailWhenTelegramTokenMissingForEnabledChannel() {
        properties.getChannels().get("telegram").setToken(null);

        MissingConfigurationException e = assertThrows(MissingConfigurationException.class,
                () -> validator.validate());

        assertTrue(e.getMessage().contains("bot.channels.telegram.token"));
    }

    @Test
    void shouldIgnoreTelegramTokenWhenChannelDisabled() {
        properties.getChannels().get("telegram").setEnabled(false);
        properties.getChannels().get("telegram").setToken("");

        assertDoesNotThrow(() -> validator.validate());
    }

    @Test
    void shouldReportEveryMissingPropertyWithoutValues() {
        properties.getGithub().setToken(null);
        properties.getGithub().setOwner("");
        properties.getBuild().getDefaults().setCompiler(" ");

        MissingConfigurationException e = assertThrows(MissingConfigurationException.class,
                () -> validator.validate());

        assertEquals("Missing required configuration: bot.github.token, bot.github.owner, "
                + "bot.build.defaults.compiler", e.getMessage());
        assertFalse(e.getMessage().contains("123:abc"));
    }
}

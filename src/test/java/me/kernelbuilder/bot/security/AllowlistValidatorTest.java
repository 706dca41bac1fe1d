package me.kernelbuilder.bot.security;

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

import me.kernelbuilder.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AllowlistValidatorTest {

    private BotProperties properties;
    private AllowlistValidator validator;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getChannels().put("telegram", new BotProperties.ChannelProperties());
        validator = new AllowlistValidator(properties);
    }

    @Test
    void shouldAllowEveryoneWhenListEmpty() {
        assertTrue(validator.isAllowed("telegram", "123"));
    }

    @Test
    void shouldAllowOnlyListedUsers() {
        properties.getChannels().get("telegram").setAllowFrom(List.of("123", "456"));

        assertTrue(validator.isAllowed("telegram", "456"));
        assertFalse(validator.isAllowed("telegram", "789"));
    }

    @Test
    void shouldDenyUnknownChannel() {
        assertFalse(validator.isAllowed("discord", "123"));
    }
}

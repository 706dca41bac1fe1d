package me.kernelbuilder.bot.domain.model;

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

import java.util.Locale;

/**
 * What a single conversation answer does to a build field: keep the current
 * value, replace it, or clear it.
 *
 * <p>
 * The literal keywords {@code default} and {@code skip} are only recognised
 * here, in {@link #parse(BuildField, String)}.
 */
public record FieldOverride(Kind kind, String value) {

    public static final String KEEP_KEYWORD = "default";
    public static final String CLEAR_KEYWORD = "skip";

    private static final FieldOverride KEEP = new FieldOverride(Kind.KEEP, null);
    private static final FieldOverride CLEAR = new FieldOverride(Kind.CLEAR, null);

    public enum Kind {
        KEEP, SET, CLEAR
    }

    public static FieldOverride keep() {
        return KEEP;
    }

    public static FieldOverride clear() {
        return CLEAR;
    }

    public static FieldOverride set(String value) {
        return new FieldOverride(Kind.SET, value);
    }

    /**
     * Interprets a free-text answer for the given field. Surrounding whitespace
     * is trimmed; nothing is rejected.
     *
     * <ul>
     * <li>{@code default} (any case) keeps the current value, as does an empty
     * answer to a required field</li>
     * <li>{@code skip} (any case) or an empty answer clears an optional
     * field</li>
     * <li>anything else is stored as typed; {@code skip} on a required field is
     * a literal value</li>
     * </ul>
     */
    public static FieldOverride parse(BuildField field, String text) {
        String trimmed = text != null ? text.trim() : "";
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (KEEP_KEYWORD.equals(lower) || (trimmed.isEmpty() && field.isRequired())) {
            return keep();
        }
        if (!field.isRequired() && (CLEAR_KEYWORD.equals(lower) || trimmed.isEmpty())) {
            return clear();
        }
        return set(trimmed);
    }
}

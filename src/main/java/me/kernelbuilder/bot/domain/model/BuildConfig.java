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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Named set of build parameters collected from a user before dispatch.
 *
 * <p>
 * Values are never {@code null}: an unset field reads as the empty string.
 * Instances are mutable and owned by a single conversation; use {@link #copy()}
 * to hand a snapshot to another owner.
 */
public class BuildConfig {

    private final EnumMap<BuildField, String> values = new EnumMap<>(BuildField.class);

    public BuildConfig() {
        for (BuildField field : BuildField.values()) {
            values.put(field, "");
        }
    }

    public String get(BuildField field) {
        return values.get(field);
    }

    public void set(BuildField field, String value) {
        values.put(field, value != null ? value : "");
    }

    public boolean isPresent(BuildField field) {
        return !values.get(field).isEmpty();
    }

    /**
     * Applies a user override to the given field.
     *
     * @return the value held by the field afterwards
     */
    public String apply(BuildField field, FieldOverride override) {
        switch (override.kind()) {
        case SET -> set(field, override.value());
        case CLEAR -> set(field, "");
        case KEEP -> {
            // current value stays
        }
        }
        return get(field);
    }

    public BuildConfig copy() {
        BuildConfig copy = new BuildConfig();
        copy.values.putAll(values);
        return copy;
    }

    public Map<BuildField, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BuildConfig other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "BuildConfig" + values;
    }
}

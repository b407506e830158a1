package io.flaresignals.engine.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Selects which tags are candidates for a correlation pass.
///
/// | Category | Tags | Example |
/// |----------|------|---------|
/// | [#FOOD] | prefixed `food:` | `food:Dairy` |
/// | [#PRODUCT] | prefixed `product:` or `new_product:` | `product:Oat Lotion` |
/// | [#TRIGGER] | carrying none of the known prefixes | `heat` |
///
/// Prefixes match case-insensitively after trimming. The candidate key is
/// the remainder, trimmed and lower-cased.
public enum TagCategory {
    @SerializedName("food")
    FOOD("food", List.of("food:")),
    @SerializedName("product")
    PRODUCT("product", List.of("product:", "new_product:")),
    @SerializedName("trigger")
    TRIGGER("trigger", List.of());

    private final String id;
    private final List<String> prefixes;

    TagCategory(String id, List<String> prefixes) {
        this.id = id;
        this.prefixes = prefixes;
    }

    public String id() {
        return id;
    }

    /// Extracts the candidate key from a tag if the tag belongs to this category.
    ///
    /// @param tag a raw tag string
    /// @return the normalized key, or empty when the tag is not in this category or has no name
    public Optional<String> candidateKey(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String trimmed = tag.strip();
        if (this == TRIGGER) {
            if (knownPrefix(trimmed) != null) {
                return Optional.empty();
            }
            return normalize(trimmed);
        }
        for (String prefix : prefixes) {
            if (startsWithIgnoreCase(trimmed, prefix)) {
                return normalize(trimmed.substring(prefix.length()));
            }
        }
        return Optional.empty();
    }

    /// Looks a category up by its id, ignoring case.
    ///
    /// @throws IllegalArgumentException for an unknown id
    public static TagCategory fromId(String id) {
        for (TagCategory category : values()) {
            if (category.id.equalsIgnoreCase(id.strip())) {
                return category;
            }
        }
        throw new IllegalArgumentException("unknown tag category '" + id + "', expected one of food, product, trigger");
    }

    private static String knownPrefix(String tag) {
        for (TagCategory category : values()) {
            for (String prefix : category.prefixes) {
                if (startsWithIgnoreCase(tag, prefix)) {
                    return prefix;
                }
            }
        }
        return null;
    }

    private static boolean startsWithIgnoreCase(String value, String prefix) {
        return value.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    private static Optional<String> normalize(String name) {
        String key = name.strip().toLowerCase(Locale.ROOT);
        return key.isEmpty() ? Optional.empty() : Optional.of(key);
    }
}

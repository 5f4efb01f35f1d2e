/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.danielgmyers.mirror.routing;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;

/**
 * Maps choice page option labels such as "Spanish" or "Français" to locale codes.
 *
 * Lookup order: the explicit map (exact label), then the built-in table of language names and endonyms
 * (case-insensitive), then the first two characters of the lowercased label.
 */
public class LocaleResolver {

    @VisibleForTesting
    static final String LANGUAGE_NAMES_RESOURCE = "language-locales.json";

    private static final Map<String, String> LANGUAGE_NAMES = loadLanguageNames();

    private final Map<String, String> explicitLocales;

    public LocaleResolver(Map<String, String> explicitLocales) {
        if (explicitLocales == null) {
            throw new IllegalArgumentException("explicitLocales may not be null.");
        }
        this.explicitLocales = Collections.unmodifiableMap(new LinkedHashMap<>(explicitLocales));
    }

    /**
     * Returns the locale code for the label, or null if the label is null or shorter than two characters.
     */
    public String resolve(String label) {
        if (label == null) {
            return null;
        }
        String explicit = explicitLocales.get(label);
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        String known = LANGUAGE_NAMES.get(normalized);
        if (known != null) {
            return known;
        }
        if (normalized.codePointCount(0, normalized.length()) >= 2) {
            return normalized.substring(0, normalized.offsetByCodePoints(0, 2));
        }
        return null;
    }

    @VisibleForTesting
    static Map<String, String> getLanguageNames() {
        return LANGUAGE_NAMES;
    }

    private static Map<String, String> loadLanguageNames() {
        try (InputStream in = LocaleResolver.class.getResourceAsStream(LANGUAGE_NAMES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + LANGUAGE_NAMES_RESOURCE);
            }
            JsonNode tree = new ObjectMapper().readTree(in);
            Map<String, String> names = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                names.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue().asText());
            }
            return Collections.unmodifiableMap(names);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + LANGUAGE_NAMES_RESOURCE, e);
        }
    }
}

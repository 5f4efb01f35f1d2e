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

package com.danielgmyers.mirror.text;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.danielgmyers.mirror.document.WorkflowNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates the visitor-facing strings of a node in place.
 *
 * In labels, string values under a translatable key are transformed. In configuration, strings under a
 * translatable key or anywhere beneath one (list items included) are transformed, while data_name and name
 * are never touched. Auto-routing pages keep their admin-only titles but get their loading text translated.
 */
public class NodeTextTranslator {

    private static final Logger log = LoggerFactory.getLogger(NodeTextTranslator.class);

    public static final Set<String> TRANSLATABLE_KEYS = Set.of("title", "message", "back", "forward", "label",
                                                               "placeholder", "help", "description", "error",
                                                               "errors", "validation_message", "subtitle", "hint");

    public static final Set<String> AUTO_ROUTING_TEMPLATE_IDS = Set.of("invitecheck", "watchlistcheck", "hostcheck");

    private static final Set<String> IDENTIFIER_KEYS = Set.of("data_name", "name");
    private static final String TITLE = "title";
    private static final String LOADING = "loading";

    private final TextTransformer transformer;

    public NodeTextTranslator(TextTransformer transformer) {
        if (transformer == null) {
            throw new IllegalArgumentException("transformer may not be null.");
        }
        this.transformer = transformer;
    }

    /**
     * Translates the node's labels and configuration.
     * @return The number of strings whose text changed.
     */
    public int translate(WorkflowNode node, String targetLocale) {
        boolean autoRouting = AUTO_ROUTING_TEMPLATE_IDS.contains(node.getTemplateId());
        Set<String> configurationKeys = new HashSet<>(TRANSLATABLE_KEYS);
        Set<String> labelKeys = new HashSet<>(TRANSLATABLE_KEYS);
        if (autoRouting) {
            configurationKeys.remove(TITLE);
            labelKeys.remove(TITLE);
            labelKeys.add(LOADING);
        }

        int translated = 0;
        ObjectNode labels = node.getLabels();
        if (labels != null) {
            for (String key : fieldNames(labels)) {
                JsonNode value = labels.get(key);
                if (labelKeys.contains(key) && value.isTextual()) {
                    String output = translateString(value.asText(), targetLocale);
                    if (!output.equals(value.asText())) {
                        labels.set(key, TextNode.valueOf(output));
                        translated++;
                    }
                }
            }
        }

        JsonNode configuration = node.getConfiguration();
        if (configuration != null && configuration.isObject()) {
            translated += translateObject((ObjectNode) configuration, false, configurationKeys, targetLocale);
        }
        return translated;
    }

    private int translateObject(ObjectNode object, boolean ancestorTranslatable, Set<String> keys, String targetLocale) {
        int translated = 0;
        for (String key : fieldNames(object)) {
            if (IDENTIFIER_KEYS.contains(key)) {
                continue;
            }
            JsonNode value = object.get(key);
            boolean translatable = ancestorTranslatable || keys.contains(key);
            if (value.isTextual()) {
                if (translatable) {
                    String output = translateString(value.asText(), targetLocale);
                    if (!output.equals(value.asText())) {
                        object.set(key, TextNode.valueOf(output));
                        translated++;
                    }
                }
            } else if (value.isObject()) {
                translated += translateObject((ObjectNode) value, translatable, keys, targetLocale);
            } else if (value.isArray()) {
                translated += translateArray((ArrayNode) value, translatable, keys, targetLocale);
            }
        }
        return translated;
    }

    private int translateArray(ArrayNode array, boolean ancestorTranslatable, Set<String> keys, String targetLocale) {
        int translated = 0;
        for (int i = 0; i < array.size(); i++) {
            JsonNode item = array.get(i);
            if (item.isObject()) {
                translated += translateObject((ObjectNode) item, ancestorTranslatable, keys, targetLocale);
            } else if (item.isTextual() && ancestorTranslatable) {
                String output = translateString(item.asText(), targetLocale);
                if (!output.equals(item.asText())) {
                    array.set(i, TextNode.valueOf(output));
                    translated++;
                }
            }
        }
        return translated;
    }

    /**
     * Returns the transformed text, or the original text if it is ineligible or the transformer fails.
     */
    private String translateString(String text, String targetLocale) {
        if (!isEligible(text)) {
            return text;
        }
        String base = (transformer.isMarkingOnly() ? text : TokenProtector.stripLocaleMarker(text, targetLocale));
        TokenProtector.ProtectedText protectedText = TokenProtector.protect(base);

        String transformed;
        try {
            transformed = transformer.transform(protectedText.getText(), targetLocale);
        } catch (RuntimeException e) {
            log.warn("Failed to transform text into {}; keeping the original.", targetLocale, e);
            return text;
        }
        if (transformed == null) {
            log.warn("Transformer returned no text for locale {}; keeping the original.", targetLocale);
            return text;
        }
        return protectedText.restore(transformed);
    }

    /**
     * Returns false for text that must never be sent to a transformer: empty text, URLs, HTML,
     * and text made only of placeholder tokens.
     */
    public static boolean isEligible(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (text.contains("http://") || text.contains("https://")) {
            return false;
        }
        if (text.contains("<") && text.contains(">")) {
            return false;
        }
        return !TokenProtector.isOnlyTokensOrWhitespace(text);
    }

    private static List<String> fieldNames(ObjectNode object) {
        List<String> names = new ArrayList<>();
        object.fieldNames().forEachRemaining(names::add);
        return names;
    }
}

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

package com.danielgmyers.mirror;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.danielgmyers.mirror.graph.GraphConventions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Container for configuration data used by BranchMirror at runtime.
 */
public class MirrorConfig {

    public static final String DEFAULT_SOURCE_LANGUAGE_LABEL = "English";

    private static final Logger log = LoggerFactory.getLogger(MirrorConfig.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String sourceLanguageLabel = DEFAULT_SOURCE_LANGUAGE_LABEL;
    private Map<String, String> languageMap = Collections.emptyMap();
    private boolean dryRun = true;
    private String terminalTemplateId = GraphConventions.DEFAULT_TERMINAL_TEMPLATE_ID;
    private String subChoiceTemplateId = GraphConventions.DEFAULT_SUB_CHOICE_TEMPLATE_ID;
    private String choicePageType = GraphConventions.DEFAULT_CHOICE_PAGE_TYPE;
    private String choicePageDataName = GraphConventions.DEFAULT_CHOICE_PAGE_DATA_NAME;
    private String choiceFieldName = GraphConventions.DEFAULT_CHOICE_FIELD_NAME;

    public String getSourceLanguageLabel() {
        return sourceLanguageLabel;
    }

    /**
     * The label of the choice page option whose branch is the template, e.g. "English". Defaults to "English".
     */
    public void setSourceLanguageLabel(String sourceLanguageLabel) {
        if (sourceLanguageLabel == null || sourceLanguageLabel.isBlank()) {
            throw new IllegalArgumentException("sourceLanguageLabel may not be null or blank.");
        }
        this.sourceLanguageLabel = sourceLanguageLabel;
    }

    public Map<String, String> getLanguageMap() {
        return languageMap;
    }

    /**
     * Explicit option label to locale code mappings. These take precedence over the built-in language names.
     */
    public void setLanguageMap(Map<String, String> languageMap) {
        if (languageMap == null) {
            throw new IllegalArgumentException("languageMap may not be null.");
        }
        this.languageMap = Collections.unmodifiableMap(new LinkedHashMap<>(languageMap));
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * When true (the default), the mirrored document is validated and summarized but never saved.
     */
    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public String getTerminalTemplateId() {
        return terminalTemplateId;
    }

    public void setTerminalTemplateId(String terminalTemplateId) {
        this.terminalTemplateId = requireNonBlank(terminalTemplateId, "terminalTemplateId");
    }

    public String getSubChoiceTemplateId() {
        return subChoiceTemplateId;
    }

    public void setSubChoiceTemplateId(String subChoiceTemplateId) {
        this.subChoiceTemplateId = requireNonBlank(subChoiceTemplateId, "subChoiceTemplateId");
    }

    public String getChoicePageType() {
        return choicePageType;
    }

    public void setChoicePageType(String choicePageType) {
        this.choicePageType = requireNonBlank(choicePageType, "choicePageType");
    }

    public String getChoicePageDataName() {
        return choicePageDataName;
    }

    public void setChoicePageDataName(String choicePageDataName) {
        this.choicePageDataName = requireNonBlank(choicePageDataName, "choicePageDataName");
    }

    public String getChoiceFieldName() {
        return choiceFieldName;
    }

    /**
     * The condition lval the choice page routes on. Defaults to "reason_id".
     */
    public void setChoiceFieldName(String choiceFieldName) {
        this.choiceFieldName = requireNonBlank(choiceFieldName, "choiceFieldName");
    }

    public GraphConventions getGraphConventions() {
        return new GraphConventions(terminalTemplateId, subChoiceTemplateId, choicePageType, choicePageDataName,
                                    choiceFieldName);
    }

    /**
     * Parses a language map written either as a JSON object ({"Spanish": "es"}) or as
     * comma-separated pairs ("Spanish:es,French:fr"). Pairs without a colon are ignored.
     */
    public static Map<String, String> parseLanguageMap(String value) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return parsed;
        }

        JsonNode json = null;
        try {
            json = MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            log.debug("Language map is not JSON, reading it as label:code pairs.");
        }
        if (json != null && json.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                parsed.put(field.getKey(), field.getValue().asText());
            }
            return parsed;
        }

        for (String pair : value.split(",")) {
            int colon = pair.indexOf(':');
            if (colon >= 0) {
                parsed.put(pair.substring(0, colon).trim(), pair.substring(colon + 1).trim());
            }
        }
        return parsed;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " may not be null or blank.");
        }
        return value;
    }
}

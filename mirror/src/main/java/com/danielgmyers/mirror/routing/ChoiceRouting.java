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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.mirror.document.Reason;

/**
 * Where each option of the choice page leads.
 */
public final class ChoiceRouting {

    private final String choicePageId;
    private final List<Reason> options;
    private final Map<String, Integer> optionIdsByLabel;
    private final Map<String, String> explicitEntries;
    private final String pageDefault;

    ChoiceRouting(String choicePageId, List<Reason> options, Map<String, String> explicitEntries, String pageDefault) {
        this.choicePageId = choicePageId;
        this.options = List.copyOf(options);
        Map<String, Integer> ids = new LinkedHashMap<>();
        for (Reason option : options) {
            ids.put(option.getTitle(), option.getId());
        }
        this.optionIdsByLabel = Collections.unmodifiableMap(ids);
        this.explicitEntries = Collections.unmodifiableMap(new LinkedHashMap<>(explicitEntries));
        this.pageDefault = pageDefault;
    }

    public String getChoicePageId() {
        return choicePageId;
    }

    /**
     * The options in configuration order.
     */
    public List<Reason> getOptions() {
        return options;
    }

    public boolean hasOption(String label) {
        return optionIdsByLabel.containsKey(label);
    }

    public Integer getOptionId(String label) {
        return optionIdsByLabel.get(label);
    }

    /**
     * The choice page's default target, or null.
     */
    public String getPageDefault() {
        return pageDefault;
    }

    /**
     * Returns true if a routing condition exists for the option, even one whose result is null.
     */
    public boolean hasExplicitEntry(String label) {
        return explicitEntries.containsKey(label);
    }

    /**
     * The result of the routing condition for the option, or null if it has none (or routes nowhere).
     */
    public String getExplicitEntry(String label) {
        return explicitEntries.get(label);
    }

    /**
     * The node visitors land on after picking the option. Options without a routing condition
     * inherit the page default.
     */
    public String getEntry(String label) {
        if (explicitEntries.containsKey(label)) {
            return explicitEntries.get(label);
        }
        return (optionIdsByLabel.containsKey(label) ? pageDefault : null);
    }
}

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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.mirror.MirrorException;
import com.danielgmyers.mirror.document.Condition;
import com.danielgmyers.mirror.document.NextStep;
import com.danielgmyers.mirror.document.Reason;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowNode;
import com.danielgmyers.mirror.graph.GraphConventions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the choice page and reads its routing. Never modifies the document.
 */
public class ChoicePageRouter {

    private static final Logger log = LoggerFactory.getLogger(ChoicePageRouter.class);

    private final GraphConventions conventions;

    public ChoicePageRouter(GraphConventions conventions) {
        if (conventions == null) {
            throw new IllegalArgumentException("conventions may not be null.");
        }
        this.conventions = conventions;
    }

    /**
     * Returns the first choice page in document order, or null if the document has none.
     */
    public WorkflowNode findChoicePage(WorkflowDocument document) {
        for (WorkflowNode node : document.getNodes().values()) {
            if (conventions.isChoicePage(node)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Reads the choice page's options and routing.
     * @throws MirrorException if there is no choice page or it offers no options.
     */
    public ChoiceRouting route(WorkflowDocument document) {
        WorkflowNode choicePage = findChoicePage(document);
        if (choicePage == null) {
            throw new MirrorException(String.format("Choice page with type '%s' and configuration.data_name '%s' not found.",
                                                    conventions.getChoicePageType(), conventions.getChoicePageDataName()));
        }
        String choicePageId = choicePageKey(document, choicePage);

        List<Reason> options = choicePage.getReasons();
        if (options.isEmpty()) {
            throw new MirrorException("Choice page " + choicePageId + " has no options.");
        }
        Map<Integer, String> labelsById = new HashMap<>();
        for (Reason option : options) {
            labelsById.put(option.getId(), option.getTitle());
        }

        Map<String, String> explicitEntries = new LinkedHashMap<>();
        String pageDefault = null;
        NextStep next = choicePage.getNext();
        if (next != null) {
            pageDefault = next.getDefaultTarget();
            for (Condition condition : next.getConditions()) {
                if (!conventions.getChoiceFieldName().equals(condition.getLval())) {
                    continue;
                }
                String label = labelsById.get(condition.getRvalAsInt(Integer.MIN_VALUE));
                if (label != null) {
                    explicitEntries.put(label, condition.getResult());
                }
            }
        }

        ChoiceRouting routing = new ChoiceRouting(choicePageId, options, explicitEntries, pageDefault);
        log.debug("Choice page {} routes {} (default {}).", choicePageId, explicitEntries, pageDefault);
        return routing;
    }

    private static String choicePageKey(WorkflowDocument document, WorkflowNode choicePage) {
        for (Map.Entry<String, WorkflowNode> entry : document.getNodes().entrySet()) {
            if (entry.getValue() == choicePage) {
                return entry.getKey();
            }
        }
        return choicePage.getId();
    }
}

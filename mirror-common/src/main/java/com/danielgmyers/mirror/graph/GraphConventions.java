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

package com.danielgmyers.mirror.graph;

import java.util.Objects;

import com.danielgmyers.mirror.document.WorkflowNode;

/**
 * The reserved tags and field names that give a workflow document its meaning: which template ends a path,
 * which template branches on a nested choice, and how the top-level choice page is recognized and routed.
 *
 * Instances are immutable; pass one to every component that needs to interpret nodes.
 */
public final class GraphConventions {

    public static final String DEFAULT_TERMINAL_TEMPLATE_ID = "thanks";
    public static final String DEFAULT_SUB_CHOICE_TEMPLATE_ID = "visitreason";
    public static final String DEFAULT_CHOICE_PAGE_TYPE = "page";
    public static final String DEFAULT_CHOICE_PAGE_DATA_NAME = "language";
    public static final String DEFAULT_CHOICE_FIELD_NAME = "reason_id";

    public static final GraphConventions DEFAULTS = new GraphConventions(DEFAULT_TERMINAL_TEMPLATE_ID,
                                                                         DEFAULT_SUB_CHOICE_TEMPLATE_ID,
                                                                         DEFAULT_CHOICE_PAGE_TYPE,
                                                                         DEFAULT_CHOICE_PAGE_DATA_NAME,
                                                                         DEFAULT_CHOICE_FIELD_NAME);

    private final String terminalTemplateId;
    private final String subChoiceTemplateId;
    private final String choicePageType;
    private final String choicePageDataName;
    private final String choiceFieldName;

    public GraphConventions(String terminalTemplateId, String subChoiceTemplateId, String choicePageType,
                            String choicePageDataName, String choiceFieldName) {
        this.terminalTemplateId = requireNonBlank(terminalTemplateId, "terminalTemplateId");
        this.subChoiceTemplateId = requireNonBlank(subChoiceTemplateId, "subChoiceTemplateId");
        this.choicePageType = requireNonBlank(choicePageType, "choicePageType");
        this.choicePageDataName = requireNonBlank(choicePageDataName, "choicePageDataName");
        this.choiceFieldName = requireNonBlank(choiceFieldName, "choiceFieldName");
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " may not be blank.");
        }
        return value;
    }

    public String getTerminalTemplateId() {
        return terminalTemplateId;
    }

    public String getSubChoiceTemplateId() {
        return subChoiceTemplateId;
    }

    public String getChoicePageType() {
        return choicePageType;
    }

    public String getChoicePageDataName() {
        return choicePageDataName;
    }

    /**
     * The lval that the choice page's routing conditions compare against the selected option id.
     */
    public String getChoiceFieldName() {
        return choiceFieldName;
    }

    public boolean isTerminal(WorkflowNode node) {
        return terminalTemplateId.equals(node.getTemplateId());
    }

    public boolean isSubChoice(WorkflowNode node) {
        return subChoiceTemplateId.equals(node.getTemplateId());
    }

    public boolean isChoicePage(WorkflowNode node) {
        return choicePageType.equals(node.getType())
               && choicePageDataName.equals(node.getConfigurationText("data_name"));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        GraphConventions that = (GraphConventions) other;
        return terminalTemplateId.equals(that.terminalTemplateId) && subChoiceTemplateId.equals(that.subChoiceTemplateId)
               && choicePageType.equals(that.choicePageType) && choicePageDataName.equals(that.choicePageDataName)
               && choiceFieldName.equals(that.choiceFieldName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terminalTemplateId, subChoiceTemplateId, choicePageType, choicePageDataName, choiceFieldName);
    }
}

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

package com.danielgmyers.mirror.document;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Helper to build a WorkflowDocument in code without needing to assemble its JSON.
 *
 * Transitions may point at nodes that are added later, or never; the builder does not validate references.
 */
public class WorkflowDocumentBuilder {

    public static final String PAGE_TYPE = "page";
    public static final String EQUALS_OP = "==";

    private final WorkflowDocument document;

    public WorkflowDocumentBuilder() {
        this.document = new WorkflowDocument();
    }

    /**
     * Adds a page node with an empty next step. Add a default transition before building unless the node is terminal.
     */
    public WorkflowDocumentBuilder addNode(String id, String templateId) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Node ids must not be blank.");
        }
        if (document.containsNode(id)) {
            throw new IllegalArgumentException("Node " + id + " was already added.");
        }
        WorkflowNode node = new WorkflowNode(id, PAGE_TYPE, templateId);
        node.setNext(new NextStep());
        document.putNode(node);
        if (document.getStartingNodeId() == null) {
            document.setStartingNodeId(id);
        }
        return this;
    }

    /**
     * Adds a node that ends the workflow ("next": null).
     */
    public WorkflowDocumentBuilder addTerminalNode(String id, String templateId) {
        addNode(id, templateId);
        document.getNode(id).setNext(null);
        return this;
    }

    /**
     * Adds a choice page offering the given options, keyed by option id.
     * @param dataName The configuration.data_name identifying what the page asks for, e.g. "language".
     */
    public WorkflowDocumentBuilder addChoicePage(String id, String templateId, String dataName, Map<Integer, String> options) {
        addNode(id, templateId);
        configuration(id, "data_name", TextNode.valueOf(dataName));
        reasons(id, options);
        return this;
    }

    /**
     * Sets configuration.reasons on an existing node.
     */
    public WorkflowDocumentBuilder reasons(String id, Map<Integer, String> options) {
        ArrayNode reasons = JsonNodeFactory.instance.arrayNode();
        for (Map.Entry<Integer, String> option : options.entrySet()) {
            ObjectNode reason = reasons.addObject();
            reason.put("id", option.getKey());
            reason.put("title", option.getValue());
        }
        return configuration(id, "reasons", reasons);
    }

    public WorkflowDocumentBuilder startingNode(String id) {
        document.setStartingNodeId(id);
        return this;
    }

    public WorkflowDocumentBuilder defaultTransition(String fromId, String toId) {
        nextOf(fromId).setDefaultTarget(toId);
        return this;
    }

    /**
     * Appends a condition routing visitors who picked option rval (compared on field lval) to toId.
     */
    public WorkflowDocumentBuilder conditionTransition(String fromId, String lval, int rval, String toId) {
        nextOf(fromId).addCondition(new Condition(lval, EQUALS_OP, IntNode.valueOf(rval), toId));
        return this;
    }

    public WorkflowDocumentBuilder crumb(String id, String crumb) {
        nodeOrThrow(id).setCrumb(crumb);
        return this;
    }

    public WorkflowDocumentBuilder label(String id, String key, String value) {
        WorkflowNode node = nodeOrThrow(id);
        if (node.getLabels() == null) {
            node.setLabels(JsonNodeFactory.instance.objectNode());
        }
        node.getLabels().put(key, value);
        return this;
    }

    public WorkflowDocumentBuilder configuration(String id, String key, JsonNode value) {
        WorkflowNode node = nodeOrThrow(id);
        if (node.getConfiguration() == null || !node.getConfiguration().isObject()) {
            node.setConfiguration(JsonNodeFactory.instance.objectNode());
        }
        ((ObjectNode) node.getConfiguration()).set(key, value);
        return this;
    }

    public WorkflowDocumentBuilder configuration(String id, String key, String value) {
        return configuration(id, key, TextNode.valueOf(value));
    }

    /**
     * Returns a copy of the document built so far; the builder can keep being used afterwards.
     */
    public WorkflowDocument build() {
        return document.deepCopy();
    }

    private NextStep nextOf(String id) {
        WorkflowNode node = nodeOrThrow(id);
        if (node.getNext() == null) {
            throw new IllegalArgumentException("Node " + id + " is terminal and cannot have transitions.");
        }
        return node.getNext();
    }

    private WorkflowNode nodeOrThrow(String id) {
        WorkflowNode node = document.getNode(id);
        if (node == null) {
            throw new IllegalArgumentException("Please add node " + id + " with addNode before configuring it.");
        }
        return node;
    }
}

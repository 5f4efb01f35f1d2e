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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The inner body of a workflow: a set of nodes addressed by id, plus the id of the node visitors start on.
 *
 * Node ids are opaque strings, but new ids are allocated numerically above the highest numeric id present.
 */
public class WorkflowDocument {

    private final Map<String, WorkflowNode> nodes;
    private String startingNodeId;
    private ObjectNode extraFields;

    public WorkflowDocument() {
        this.nodes = new LinkedHashMap<>();
        this.extraFields = JsonNodeFactory.instance.objectNode();
    }

    public String getStartingNodeId() {
        return startingNodeId;
    }

    public void setStartingNodeId(String startingNodeId) {
        this.startingNodeId = startingNodeId;
    }

    /**
     * Read-only view of the nodes, keyed by the key they were stored under.
     */
    public Map<String, WorkflowNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public WorkflowNode getNode(String nodeId) {
        if (nodeId == null) {
            return null;
        }
        return nodes.get(nodeId);
    }

    public boolean containsNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /**
     * Stores the node under its own id, replacing any node previously stored under that key.
     */
    public void putNode(WorkflowNode node) {
        Objects.requireNonNull(node.getId(), "Nodes must have an id to be stored.");
        nodes.put(node.getId(), node);
    }

    /**
     * Stores the node under an explicit key. Only the codec should need this, since it must keep
     * documents whose keys disagree with their nodes' ids.
     */
    public void putNode(String key, WorkflowNode node) {
        nodes.put(key, node);
    }

    public WorkflowNode removeNode(String nodeId) {
        return nodes.remove(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * The largest key that parses as a non-negative integer, or 0 if there is none.
     */
    public long maxNumericNodeId() {
        long max = 0;
        for (String key : nodes.keySet()) {
            try {
                max = Math.max(max, Long.parseLong(key));
            } catch (NumberFormatException e) {
                // non-numeric ids never take part in allocation
                continue;
            }
        }
        return max;
    }

    public ObjectNode getExtraFields() {
        return extraFields;
    }

    public void setExtraFields(ObjectNode extraFields) {
        this.extraFields = (extraFields == null ? JsonNodeFactory.instance.objectNode() : extraFields);
    }

    public WorkflowDocument deepCopy() {
        WorkflowDocument copy = new WorkflowDocument();
        copy.startingNodeId = startingNodeId;
        copy.extraFields = extraFields.deepCopy();
        for (Map.Entry<String, WorkflowNode> entry : nodes.entrySet()) {
            copy.nodes.put(entry.getKey(), entry.getValue().deepCopy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        WorkflowDocument that = (WorkflowDocument) other;
        return nodes.equals(that.nodes) && Objects.equals(startingNodeId, that.startingNodeId)
               && Objects.equals(extraFields, that.extraFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, startingNodeId, extraFields);
    }
}

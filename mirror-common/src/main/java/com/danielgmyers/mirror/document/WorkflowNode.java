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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single page or routing step of a workflow document.
 *
 * The configuration payload is kept as an untyped JSON tree, since which of its keys hold visitor-facing text
 * is decided per template at runtime.
 *
 * A node distinguishes a "next": null entry (explicitly terminal) from a missing "next" key; see {@link #hasNextField()}.
 */
public class WorkflowNode {

    private String id;
    private String type;
    private String templateId;
    private String crumb;
    private ObjectNode labels;
    private JsonNode configuration;
    private NextStep next;
    private boolean nextField;
    private ObjectNode extraFields;

    public WorkflowNode() {
        this.extraFields = JsonNodeFactory.instance.objectNode();
    }

    public WorkflowNode(String id, String type, String templateId) {
        this();
        this.id = id;
        this.type = type;
        this.templateId = templateId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public String getCrumb() {
        return crumb;
    }

    public void setCrumb(String crumb) {
        this.crumb = crumb;
    }

    public boolean hasCrumb() {
        return crumb != null && !crumb.isEmpty();
    }

    public ObjectNode getLabels() {
        return labels;
    }

    public void setLabels(ObjectNode labels) {
        this.labels = labels;
    }

    public JsonNode getConfiguration() {
        return configuration;
    }

    public void setConfiguration(JsonNode configuration) {
        this.configuration = configuration;
    }

    /**
     * Returns the configuration value stored under the given key as text, or null if it is absent or not a scalar.
     */
    public String getConfigurationText(String key) {
        if (configuration == null || !configuration.isObject()) {
            return null;
        }
        JsonNode value = configuration.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Parses configuration.reasons. Entries without an integer id or without a non-blank title (or label) are skipped.
     */
    public List<Reason> getReasons() {
        if (configuration == null || !configuration.isObject()) {
            return Collections.emptyList();
        }
        JsonNode reasons = configuration.get("reasons");
        if (reasons == null || !reasons.isArray()) {
            return Collections.emptyList();
        }
        List<Reason> parsed = new ArrayList<>();
        for (JsonNode reason : reasons) {
            if (!reason.isObject()) {
                continue;
            }
            Integer reasonId = readReasonId(reason.get("id"));
            if (reasonId == null) {
                continue;
            }
            String title = readReasonTitle(reason);
            if (!title.isEmpty()) {
                parsed.add(new Reason(reasonId, title));
            }
        }
        return parsed;
    }

    /**
     * Maps reason ids to titles, in configuration order.
     */
    public Map<Integer, String> getReasonTitlesById() {
        Map<Integer, String> titles = new LinkedHashMap<>();
        for (Reason reason : getReasons()) {
            titles.put(reason.getId(), reason.getTitle());
        }
        return titles;
    }

    private static Integer readReasonId(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String readReasonTitle(JsonNode reason) {
        JsonNode title = reason.get("title");
        if (title == null || title.isNull() || title.asText().isEmpty()) {
            title = reason.get("label");
        }
        if (title == null || title.isNull()) {
            return "";
        }
        return title.asText().trim();
    }

    /**
     * The outgoing edges, or null if the node is terminal.
     */
    public NextStep getNext() {
        return next;
    }

    /**
     * Sets the outgoing edges. Passing null marks the node as explicitly terminal ("next": null).
     */
    public void setNext(NextStep next) {
        this.next = next;
        this.nextField = true;
    }

    /**
     * Removes the "next" key entirely, as opposed to setting it to null.
     */
    public void clearNextField() {
        this.next = null;
        this.nextField = false;
    }

    /**
     * True if the document carried a "next" key for this node, even if its value was null.
     */
    public boolean hasNextField() {
        return nextField;
    }

    public ObjectNode getExtraFields() {
        return extraFields;
    }

    public void setExtraFields(ObjectNode extraFields) {
        this.extraFields = (extraFields == null ? JsonNodeFactory.instance.objectNode() : extraFields);
    }

    /**
     * Replaces everything but the id with the content of the other node. The other node's state is shared, not copied.
     */
    public void replaceContentFrom(WorkflowNode other) {
        this.type = other.type;
        this.templateId = other.templateId;
        this.crumb = other.crumb;
        this.labels = other.labels;
        this.configuration = other.configuration;
        this.next = other.next;
        this.nextField = other.nextField;
        this.extraFields = other.extraFields;
    }

    public WorkflowNode deepCopy() {
        WorkflowNode copy = new WorkflowNode(id, type, templateId);
        copy.crumb = crumb;
        copy.labels = (labels == null ? null : labels.deepCopy());
        copy.configuration = (configuration == null ? null : configuration.deepCopy());
        copy.next = (next == null ? null : next.deepCopy());
        copy.nextField = nextField;
        copy.extraFields = extraFields.deepCopy();
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
        WorkflowNode that = (WorkflowNode) other;
        return nextField == that.nextField && Objects.equals(id, that.id) && Objects.equals(type, that.type)
               && Objects.equals(templateId, that.templateId) && Objects.equals(crumb, that.crumb)
               && Objects.equals(labels, that.labels) && Objects.equals(configuration, that.configuration)
               && Objects.equals(next, that.next) && Objects.equals(extraFields, that.extraFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, templateId, crumb, labels, configuration, next, nextField, extraFields);
    }

    @Override
    public String toString() {
        return "WorkflowNode[" + id + ", " + templateId + "]";
    }
}

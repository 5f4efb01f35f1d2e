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
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Converts workflow bodies between their JSON text form and {@link WorkflowDocument}.
 *
 * Node ids and edge targets are always written back as strings, even if the body stored them as numbers.
 * Fields the model does not interpret are carried along untouched.
 */
public final class WorkflowDocumentCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String NODES = "nodes";
    private static final String STARTING_NODE_ID = "starting_node_id";
    private static final String ID = "id";
    private static final String TYPE = "type";
    private static final String TEMPLATE_ID = "template_id";
    private static final String CRUMB = "crumb";
    private static final String LABELS = "labels";
    private static final String CONFIGURATION = "configuration";
    private static final String NEXT = "next";
    private static final String CONDITIONS = "conditions";
    private static final String DEFAULT = "default";
    private static final String LVAL = "lval";
    private static final String OP = "op";
    private static final String RVAL = "rval";
    private static final String RESULT = "result";

    private static final Set<String> NEXT_FIELDS = Set.of(CONDITIONS, DEFAULT);
    private static final Set<String> CONDITION_FIELDS = Set.of(LVAL, OP, RVAL, RESULT);

    private WorkflowDocumentCodec() {}

    /**
     * Parses a workflow body string.
     * @throws DocumentFormatException if the body is blank, is not JSON, or has no "nodes" object.
     */
    public static WorkflowDocument decode(String body) {
        if (body == null || body.isBlank()) {
            throw new DocumentFormatException("Workflow body is missing or blank.");
        }
        JsonNode tree;
        try {
            tree = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Failed to parse the workflow body as JSON.", e);
        }
        return decodeTree(tree);
    }

    /**
     * Converts an already-parsed workflow body.
     */
    public static WorkflowDocument decodeTree(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new DocumentFormatException("Workflow body must be a JSON object.");
        }
        JsonNode nodes = tree.get(NODES);
        if (nodes == null || !nodes.isObject()) {
            throw new DocumentFormatException("Workflow body is missing its 'nodes' object.");
        }

        WorkflowDocument document = new WorkflowDocument();
        document.setStartingNodeId(textOrNull(tree.get(STARTING_NODE_ID)));

        ObjectNode extras = ((ObjectNode) tree).deepCopy();
        extras.remove(NODES);
        if (tree.has(STARTING_NODE_ID) && document.getStartingNodeId() != null) {
            extras.remove(STARTING_NODE_ID);
        }
        document.setExtraFields(extras);

        Iterator<Map.Entry<String, JsonNode>> fields = nodes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isObject()) {
                throw new DocumentFormatException("Node " + entry.getKey() + " is not a JSON object.");
            }
            document.putNode(entry.getKey(), decodeNode(entry.getKey(), (ObjectNode) entry.getValue()));
        }
        return document;
    }

    private static WorkflowNode decodeNode(String key, ObjectNode json) {
        WorkflowNode node = new WorkflowNode();
        ObjectNode extras = json.deepCopy();

        if (isScalar(json.get(ID))) {
            node.setId(json.get(ID).asText());
            extras.remove(ID);
        }
        if (isScalar(json.get(TYPE))) {
            node.setType(json.get(TYPE).asText());
            extras.remove(TYPE);
        }
        if (isScalar(json.get(TEMPLATE_ID))) {
            node.setTemplateId(json.get(TEMPLATE_ID).asText());
            extras.remove(TEMPLATE_ID);
        }
        if (isScalar(json.get(CRUMB))) {
            node.setCrumb(json.get(CRUMB).asText());
            extras.remove(CRUMB);
        }
        if (json.has(LABELS) && json.get(LABELS).isObject()) {
            node.setLabels((ObjectNode) json.get(LABELS).deepCopy());
            extras.remove(LABELS);
        }
        if (json.has(CONFIGURATION) && !json.get(CONFIGURATION).isNull()) {
            node.setConfiguration(json.get(CONFIGURATION).deepCopy());
            extras.remove(CONFIGURATION);
        }
        if (json.has(NEXT)) {
            JsonNode next = json.get(NEXT);
            if (next.isNull()) {
                node.setNext(null);
            } else if (next.isObject()) {
                node.setNext(decodeNext(key, (ObjectNode) next));
            } else {
                throw new DocumentFormatException("Node " + key + " has a 'next' value that is neither null nor an object.");
            }
            extras.remove(NEXT);
        }
        node.setExtraFields(extras);
        return node;
    }

    private static NextStep decodeNext(String key, ObjectNode json) {
        List<Condition> conditions = new ArrayList<>();
        JsonNode rawConditions = json.get(CONDITIONS);
        if (rawConditions != null && !rawConditions.isNull()) {
            if (!rawConditions.isArray()) {
                throw new DocumentFormatException("Node " + key + " has a 'conditions' value that is not a list.");
            }
            for (JsonNode rawCondition : rawConditions) {
                if (!rawCondition.isObject()) {
                    throw new DocumentFormatException("Node " + key + " has a condition that is not an object.");
                }
                conditions.add(decodeCondition((ObjectNode) rawCondition));
            }
        }

        NextStep next = new NextStep(conditions, textOrNull(json.get(DEFAULT)));
        ObjectNode extras = json.deepCopy();
        extras.remove(NEXT_FIELDS);
        next.setExtraFields(extras);
        return next;
    }

    private static Condition decodeCondition(ObjectNode json) {
        JsonNode rval = json.get(RVAL);
        Condition condition = new Condition(textOrNull(json.get(LVAL)), textOrNull(json.get(OP)),
                                            (rval == null ? null : rval.deepCopy()), textOrNull(json.get(RESULT)));
        ObjectNode extras = json.deepCopy();
        extras.remove(CONDITION_FIELDS);
        condition.setExtraFields(extras);
        return condition;
    }

    /**
     * Serializes a document to compact JSON text.
     */
    public static String encode(WorkflowDocument document) {
        try {
            return MAPPER.writeValueAsString(encodeTree(document));
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Failed to serialize the workflow document.", e);
        }
    }

    /**
     * Converts a document to a JSON tree.
     */
    public static ObjectNode encodeTree(WorkflowDocument document) {
        ObjectNode tree = MAPPER.createObjectNode();
        if (document.getStartingNodeId() != null) {
            tree.put(STARTING_NODE_ID, document.getStartingNodeId());
        }
        ObjectNode nodes = tree.putObject(NODES);
        for (Map.Entry<String, WorkflowNode> entry : document.getNodes().entrySet()) {
            nodes.set(entry.getKey(), encodeNode(entry.getValue()));
        }
        copyMissing(document.getExtraFields(), tree);
        return tree;
    }

    private static ObjectNode encodeNode(WorkflowNode node) {
        ObjectNode json = MAPPER.createObjectNode();
        putIfNotNull(json, ID, node.getId());
        putIfNotNull(json, TYPE, node.getType());
        putIfNotNull(json, TEMPLATE_ID, node.getTemplateId());
        putIfNotNull(json, CRUMB, node.getCrumb());
        if (node.getLabels() != null) {
            json.set(LABELS, node.getLabels().deepCopy());
        }
        if (node.getConfiguration() != null) {
            json.set(CONFIGURATION, node.getConfiguration().deepCopy());
        }
        if (node.getNext() != null) {
            json.set(NEXT, encodeNext(node.getNext()));
        } else if (node.hasNextField()) {
            json.set(NEXT, NullNode.getInstance());
        }
        copyMissing(node.getExtraFields(), json);
        return json;
    }

    private static ObjectNode encodeNext(NextStep next) {
        ObjectNode json = MAPPER.createObjectNode();
        ArrayNode conditions = json.putArray(CONDITIONS);
        for (Condition condition : next.getConditions()) {
            conditions.add(encodeCondition(condition));
        }
        json.set(DEFAULT, next.getDefaultTarget() == null ? NullNode.getInstance() : TextNode.valueOf(next.getDefaultTarget()));
        copyMissing(next.getExtraFields(), json);
        return json;
    }

    private static ObjectNode encodeCondition(Condition condition) {
        ObjectNode json = MAPPER.createObjectNode();
        putIfNotNull(json, LVAL, condition.getLval());
        putIfNotNull(json, OP, condition.getOp());
        if (condition.getRval() != null) {
            json.set(RVAL, condition.getRval().deepCopy());
        }
        json.set(RESULT, condition.getResult() == null ? NullNode.getInstance() : TextNode.valueOf(condition.getResult()));
        copyMissing(condition.getExtraFields(), json);
        return json;
    }

    private static void copyMissing(ObjectNode from, ObjectNode to) {
        Iterator<Map.Entry<String, JsonNode>> fields = from.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!to.has(field.getKey())) {
                to.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    private static void putIfNotNull(ObjectNode json, String key, String value) {
        if (value != null) {
            json.put(key, value);
        }
    }

    private static boolean isScalar(JsonNode value) {
        return value != null && value.isValueNode() && !value.isNull();
    }

    private static String textOrNull(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}

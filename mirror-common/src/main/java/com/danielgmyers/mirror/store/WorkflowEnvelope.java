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

package com.danielgmyers.mirror.store;

import com.danielgmyers.mirror.document.DocumentFormatException;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowDocumentCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The outer workflow record as exchanged with a store. Its "body" field holds the workflow document
 * serialized as a JSON string; every other field is passed through untouched.
 */
public class WorkflowEnvelope {

    private static final String BODY = "body";

    private final ObjectNode fields;

    public WorkflowEnvelope(ObjectNode fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Envelope fields may not be null.");
        }
        this.fields = fields;
    }

    /**
     * The workflow's id, read from "id" or else "workflow_id". Returns an empty string if neither is set.
     */
    public String getWorkflowId() {
        JsonNode id = fields.get("id");
        if (id == null || id.isNull() || id.asText().isEmpty()) {
            id = fields.get("workflow_id");
        }
        return (id == null || id.isNull() ? "" : id.asText());
    }

    public String getBody() {
        JsonNode body = fields.get(BODY);
        return (body == null || !body.isTextual() ? null : body.asText());
    }

    /**
     * Parses the body into a document.
     * @throws DocumentFormatException if the body is missing or malformed.
     */
    public WorkflowDocument readDocument() {
        return WorkflowDocumentCodec.decode(getBody());
    }

    /**
     * Replaces the body with the compact serialization of the given document.
     */
    public void writeDocument(WorkflowDocument document) {
        fields.put(BODY, WorkflowDocumentCodec.encode(document));
    }

    public ObjectNode getFields() {
        return fields;
    }

    public WorkflowEnvelope deepCopy() {
        return new WorkflowEnvelope(fields.deepCopy());
    }
}

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

package com.danielgmyers.mirror.testutil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.store.DocumentStore;
import com.danielgmyers.mirror.store.DocumentStoreException;
import com.danielgmyers.mirror.store.WorkflowEnvelope;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * In-memory DocumentStore for unit tests. Loads hand out copies, and every save is recorded.
 */
public class StubDocumentStore implements DocumentStore {

    private final Map<String, WorkflowEnvelope> workflows = new LinkedHashMap<>();
    private final List<WorkflowEnvelope> saved = new ArrayList<>();

    /**
     * Stores an envelope {"id": workflowId, "body": <encoded document>}.
     */
    public WorkflowEnvelope put(String workflowId, WorkflowDocument document) {
        ObjectNode fields = JsonNodeFactory.instance.objectNode();
        fields.put("id", workflowId);
        WorkflowEnvelope envelope = new WorkflowEnvelope(fields);
        envelope.writeDocument(document);
        workflows.put(workflowId, envelope);
        return envelope;
    }

    public void put(WorkflowEnvelope envelope) {
        workflows.put(envelope.getWorkflowId(), envelope.deepCopy());
    }

    @Override
    public WorkflowEnvelope load(String workflowId) {
        WorkflowEnvelope envelope = workflows.get(workflowId);
        if (envelope == null) {
            throw new DocumentStoreException("Workflow " + workflowId + " not found.");
        }
        return envelope.deepCopy();
    }

    @Override
    public void save(WorkflowEnvelope envelope) {
        WorkflowEnvelope copy = envelope.deepCopy();
        saved.add(copy);
        workflows.put(copy.getWorkflowId(), copy);
    }

    public List<WorkflowEnvelope> getSaved() {
        return Collections.unmodifiableList(saved);
    }

    /**
     * The document currently stored under the id, or null.
     */
    public WorkflowDocument getDocument(String workflowId) {
        WorkflowEnvelope envelope = workflows.get(workflowId);
        return (envelope == null ? null : envelope.readDocument());
    }
}

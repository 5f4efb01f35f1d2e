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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps workflow envelopes as JSON files named {@code <workflowId>.json} in a directory.
 *
 * Files may hold the envelope itself or the service's response shape, {"workflow": {...envelope...}}.
 */
public class FileDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

    private static final String WORKFLOW_WRAPPER = "workflow";

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path directory;

    public FileDocumentStore(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory may not be null.");
        }
        this.directory = directory;
    }

    @Override
    public WorkflowEnvelope load(String workflowId) {
        Path file = fileFor(workflowId);
        if (!Files.isRegularFile(file)) {
            throw new DocumentStoreException("Workflow " + workflowId + " not found at " + file);
        }

        JsonNode tree;
        try {
            tree = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new DocumentStoreException("Unable to read workflow " + workflowId + " from " + file, e);
        }
        if (tree != null && tree.isObject() && !tree.has("body") && tree.path(WORKFLOW_WRAPPER).isObject()) {
            tree = tree.get(WORKFLOW_WRAPPER);
        }
        if (tree == null || !tree.isObject()) {
            throw new DocumentStoreException("Workflow file " + file + " does not contain a JSON object.");
        }
        log.debug("Loaded workflow {} from {}.", workflowId, file);
        return new WorkflowEnvelope((ObjectNode) tree);
    }

    @Override
    public void save(WorkflowEnvelope envelope) {
        String workflowId = envelope.getWorkflowId();
        if (workflowId.isEmpty()) {
            throw new DocumentStoreException("Cannot save a workflow envelope without an id.");
        }
        Path file = fileFor(workflowId);
        try {
            Files.createDirectories(directory);
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), envelope.getFields());
        } catch (IOException e) {
            throw new DocumentStoreException("Unable to write workflow " + workflowId + " to " + file, e);
        }
        log.info("Saved workflow {} to {}.", workflowId, file);
    }

    private Path fileFor(String workflowId) {
        if (workflowId == null || workflowId.isBlank() || workflowId.contains("/") || workflowId.contains("\\")
                || workflowId.contains("..")) {
            throw new DocumentStoreException("Invalid workflow id: " + workflowId);
        }
        return directory.resolve(workflowId + ".json");
    }
}

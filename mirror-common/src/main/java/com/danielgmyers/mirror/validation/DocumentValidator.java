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

package com.danielgmyers.mirror.validation;

import java.util.Map;

import com.danielgmyers.mirror.document.Condition;
import com.danielgmyers.mirror.document.NextStep;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowNode;
import com.danielgmyers.mirror.graph.GraphConventions;
import com.danielgmyers.mirror.graph.ShapeSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the referential and structural rules a workflow document must satisfy before it may be saved.
 */
public class DocumentValidator {

    private static final Logger log = LoggerFactory.getLogger(DocumentValidator.class);

    private final GraphConventions conventions;

    public DocumentValidator(GraphConventions conventions) {
        if (conventions == null) {
            throw new IllegalArgumentException("conventions may not be null.");
        }
        this.conventions = conventions;
    }

    /**
     * Validates the whole document.
     *
     * Errors: no nodes, unknown starting node, dangling condition or default references,
     * non-terminal nodes without a default.
     * Warnings: nodes whose id differs from their key, no choice page.
     */
    public ValidationReport validate(WorkflowDocument document) {
        ValidationReport report = new ValidationReport();
        if (document.size() == 0) {
            report.addError("Document has no nodes.");
            return report;
        }

        String startId = document.getStartingNodeId();
        if (startId != null && !startId.isEmpty() && !document.containsNode(startId)) {
            report.addError(String.format("starting_node_id %s not found in nodes.", startId));
        }

        for (Map.Entry<String, WorkflowNode> entry : document.getNodes().entrySet()) {
            String key = entry.getKey();
            WorkflowNode node = entry.getValue();
            if (!key.equals(node.getId())) {
                report.addWarning(String.format("Node key/id mismatch: key=%s id=%s.", key, node.getId()));
            }

            NextStep next = node.getNext();
            if (next != null) {
                for (Condition condition : next.getConditions()) {
                    String target = condition.getResult();
                    if (target != null && !document.containsNode(target)) {
                        report.addError(String.format("Dangling reference: node %s condition result -> %s not found.",
                                                      key, target));
                    }
                }
                if (next.getDefaultTarget() != null && !document.containsNode(next.getDefaultTarget())) {
                    report.addError(String.format("Dangling reference: node %s default -> %s not found.",
                                                  key, next.getDefaultTarget()));
                }
            }

            if (!conventions.isTerminal(node) && (next == null || next.getDefaultTarget() == null)) {
                report.addError(String.format("Missing default: node %s (template_id=%s) must have a non-null next.default.",
                                              key, node.getTemplateId()));
            }
        }

        if (!hasChoicePage(document)) {
            report.addWarning(String.format("No choice page with type '%s' and data_name '%s' was found.",
                                            conventions.getChoicePageType(), conventions.getChoicePageDataName()));
        }

        log.debug("Validated {} nodes: {} errors, {} warnings.", document.size(), report.getErrors().size(),
                  report.getWarnings().size());
        return report;
    }

    /**
     * Compares a branch's shape against the template's.
     * @return A warning message if the shapes differ, or null if they match.
     */
    public String checkShape(String branchLabel, ShapeSignature templateSignature,
                             WorkflowDocument document, String branchEntryId) {
        ShapeSignature branchSignature = ShapeSignature.of(document, branchEntryId);
        if (branchSignature.equals(templateSignature)) {
            return null;
        }
        return String.format("Topology mismatch for '%s': template %s vs target %s",
                             branchLabel, templateSignature.getTemplateIds(), branchSignature.getTemplateIds());
    }

    private boolean hasChoicePage(WorkflowDocument document) {
        for (WorkflowNode node : document.getNodes().values()) {
            if (conventions.isChoicePage(node)) {
                return true;
            }
        }
        return false;
    }
}

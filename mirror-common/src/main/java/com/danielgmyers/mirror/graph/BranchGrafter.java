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

import java.util.LinkedHashMap;
import java.util.Map;

import com.danielgmyers.mirror.document.NextStep;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes an existing branch a structural copy of the template branch without changing the branch's entry id,
 * so that every reference into the branch (most importantly the choice page's routing) stays valid.
 *
 * The template is cloned, the cloned entry's content is spliced onto the existing entry node, and the
 * redundant cloned entry is deleted. Every default edge is then recomputed from the template's own default edge,
 * overriding whatever the branch previously had wired. Nodes of the old branch that are no longer reachable
 * from its entry are left in the document.
 */
public class BranchGrafter {

    private static final Logger log = LoggerFactory.getLogger(BranchGrafter.class);

    private final GraphConventions conventions;

    public BranchGrafter(GraphConventions conventions) {
        if (conventions == null) {
            throw new IllegalArgumentException("conventions may not be null.");
        }
        this.conventions = conventions;
    }

    /**
     * Grafts the template branch onto the branch entered at branchEntryId.
     * @throws BranchGraftException if either entry doesn't exist, or the branch entry is itself part of the template branch.
     */
    public GraftResult graft(WorkflowDocument document, String templateEntryId, String branchEntryId) {
        if (!document.containsNode(templateEntryId)) {
            throw new BranchGraftException("Template entry node " + templateEntryId + " does not exist.");
        }
        if (!document.containsNode(branchEntryId)) {
            throw new BranchGraftException("Branch entry node " + branchEntryId + " does not exist.");
        }
        if (GraphWalker.walk(document, templateEntryId).getVisited().contains(branchEntryId)) {
            throw new BranchGraftException("Branch entry node " + branchEntryId
                                           + " is reachable from template entry " + templateEntryId
                                           + "; grafting would overwrite the template.");
        }

        CloneResult clone = SubgraphCloner.clone(document, templateEntryId);
        String clonedEntryId = clone.getNewStartId();

        // splice the cloned entry onto the existing entry node, then drop the cloned entry
        WorkflowNode branchEntry = document.getNode(branchEntryId);
        WorkflowNode clonedEntry = document.removeNode(clonedEntryId);
        branchEntry.replaceContentFrom(clonedEntry);

        Map<String, String> mapping = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : clone.getMapping().entrySet()) {
            mapping.put(entry.getKey(), entry.getValue().equals(clonedEntryId) ? branchEntryId : entry.getValue());
        }

        for (String nodeId : mapping.values()) {
            NextStep next = document.getNode(nodeId).getNext();
            if (next != null) {
                next.retarget(target -> target.equals(clonedEntryId) ? branchEntryId : target);
            }
        }

        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            WorkflowNode templateNode = document.getNode(entry.getKey());
            WorkflowNode node = document.getNode(entry.getValue());
            if (conventions.isTerminal(node)) {
                node.setNext(null);
            } else {
                mirrorDefault(templateNode, node, mapping, branchEntryId);
            }
        }

        log.debug("Grafted template {} onto branch {} ({} nodes, {} created).", templateEntryId, branchEntryId,
                  mapping.size(), mapping.size() - 1);
        return new GraftResult(branchEntryId, mapping);
    }

    private void mirrorDefault(WorkflowNode templateNode, WorkflowNode node, Map<String, String> mapping,
                               String branchEntryId) {
        NextStep next = node.getNext();
        if (next == null) {
            next = new NextStep();
            node.setNext(next);
        }

        String templateDefault = (templateNode.getNext() == null ? null : templateNode.getNext().getDefaultTarget());
        if (templateDefault != null && mapping.containsKey(templateDefault)) {
            next.setDefaultTarget(mapping.get(templateDefault));
        }

        // A default pointing back at the node itself or at the branch entry is only kept if it is the exact
        // image of the template's default; anything else is a leftover that would loop the visitor.
        String current = next.getDefaultTarget();
        if (templateDefault != null && current != null
                && (current.equals(node.getId()) || current.equals(branchEntryId))) {
            next.setDefaultTarget(mapping.getOrDefault(templateDefault, templateDefault));
        }
    }
}

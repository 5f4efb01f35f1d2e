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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.mirror.document.Condition;
import com.danielgmyers.mirror.document.NextStep;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels the nodes of a grafted branch with crumbs that show which choices led to them.
 *
 * The entry and every sub-choice node get the branch's selection label. Below a sub-choice node, each
 * option's title flows down its condition edge and the selection label flows down the default edge.
 * Flowing crumbs stay inside the branch and never replace a crumb a node already carries.
 */
public class CrumbPropagator {

    private static final Logger log = LoggerFactory.getLogger(CrumbPropagator.class);

    private final GraphConventions conventions;

    public CrumbPropagator(GraphConventions conventions) {
        if (conventions == null) {
            throw new IllegalArgumentException("conventions may not be null.");
        }
        this.conventions = conventions;
    }

    /**
     * Applies crumbs to the branch.
     * @param branchNodeIds  The nodes belonging to the branch; propagation never leaves this set.
     * @param entryId        The branch's entry node.
     * @param selectionLabel The label of the option that selects this branch, e.g. "French".
     * @return The number of nodes whose crumb was set.
     */
    public int propagate(WorkflowDocument document, Collection<String> branchNodeIds, String entryId,
                         String selectionLabel) {
        Set<String> branch = new LinkedHashSet<>(branchNodeIds);
        int labelled = 0;

        WorkflowNode entry = document.getNode(entryId);
        if (entry != null) {
            entry.setCrumb(selectionLabel);
            labelled++;
        }

        for (String nodeId : branch) {
            WorkflowNode node = document.getNode(nodeId);
            if (node == null || !conventions.isSubChoice(node)) {
                continue;
            }
            if (!nodeId.equals(entryId)) {
                node.setCrumb(selectionLabel);
                labelled++;
            }

            NextStep next = node.getNext();
            if (next == null) {
                continue;
            }
            Map<Integer, String> titles = node.getReasonTitlesById();
            for (Condition condition : next.getConditions()) {
                if (condition.getResult() != null) {
                    String crumb = titles.getOrDefault(condition.getRvalAsInt(-1), selectionLabel);
                    labelled += flow(document, branch, condition.getResult(), crumb);
                }
            }
            if (next.getDefaultTarget() != null) {
                labelled += flow(document, branch, next.getDefaultTarget(), selectionLabel);
            }
        }

        log.debug("Set {} crumbs on branch {} for '{}'.", labelled, entryId, selectionLabel);
        return labelled;
    }

    private int flow(WorkflowDocument document, Set<String> branch, String fromId, String crumb) {
        int labelled = 0;
        Deque<String> pending = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        pending.push(fromId);

        while (!pending.isEmpty()) {
            String nodeId = pending.pop();
            if (seen.contains(nodeId) || !branch.contains(nodeId)) {
                continue;
            }
            WorkflowNode node = document.getNode(nodeId);
            if (node == null) {
                continue;
            }
            seen.add(nodeId);

            if (!conventions.isSubChoice(node) && !node.hasCrumb()) {
                node.setCrumb(crumb);
                labelled++;
            }

            NextStep next = node.getNext();
            if (next != null) {
                for (String target : next.getTargets()) {
                    pending.push(target);
                }
            }
        }
        return labelled;
    }
}

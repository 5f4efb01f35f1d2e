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
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.danielgmyers.mirror.document.Condition;
import com.danielgmyers.mirror.document.NextStep;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowNode;

/**
 * Deterministic depth-first traversal of the nodes reachable from a start node.
 *
 * A node is visited, then each condition target is walked in list order, then the default target.
 * Each node appears once, at its first visit, so cycles and re-converging paths terminate.
 * Targets that don't exist in the document are skipped.
 *
 * This ordering decides cloned id allocation, so it must never change.
 */
public final class GraphWalker {

    private GraphWalker() {}

    /**
     * Walks the document from the given node. Returns an empty result if the start node doesn't exist.
     * The document is not modified.
     */
    public static WalkResult walk(WorkflowDocument document, String startId) {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        if (startId != null) {
            pending.push(startId);
        }

        while (!pending.isEmpty()) {
            String nodeId = pending.pop();
            if (visited.contains(nodeId)) {
                continue;
            }
            WorkflowNode node = document.getNode(nodeId);
            if (node == null) {
                continue;
            }
            visited.add(nodeId);
            order.add(nodeId);

            NextStep next = node.getNext();
            if (next == null) {
                continue;
            }
            // pushed in reverse so the first condition is popped (and fully explored) first, and the default last
            if (next.getDefaultTarget() != null) {
                pending.push(next.getDefaultTarget());
            }
            List<Condition> conditions = next.getConditions();
            for (int i = conditions.size() - 1; i >= 0; i--) {
                String target = conditions.get(i).getResult();
                if (target != null) {
                    pending.push(target);
                }
            }
        }
        return new WalkResult(order);
    }
}

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
 * Deep-copies the branch reachable from a node under freshly allocated ids.
 *
 * Ids are allocated from (highest numeric id in the document) + 1 upwards, one per node, in {@link GraphWalker} order.
 * Edges between cloned nodes are redirected to the copies; edges leaving the cloned set keep their targets.
 * Existing nodes are never modified.
 */
public final class SubgraphCloner {

    private static final Logger log = LoggerFactory.getLogger(SubgraphCloner.class);

    private SubgraphCloner() {}

    /**
     * Clones the branch starting at startId into the same document.
     * @throws IllegalArgumentException if the start node doesn't exist.
     */
    public static CloneResult clone(WorkflowDocument document, String startId) {
        WalkResult walk = GraphWalker.walk(document, startId);
        if (walk.isEmpty()) {
            throw new IllegalArgumentException("Cannot clone from node " + startId + " because it does not exist.");
        }

        long nextId = document.maxNumericNodeId() + 1;
        Map<String, String> oldToNew = new LinkedHashMap<>();
        for (String oldId : walk.getOrder()) {
            String newId = Long.toString(nextId);
            nextId++;
            oldToNew.put(oldId, newId);

            WorkflowNode copy = document.getNode(oldId).deepCopy();
            copy.setId(newId);
            document.putNode(copy);
        }

        for (String newId : oldToNew.values()) {
            NextStep next = document.getNode(newId).getNext();
            if (next != null) {
                next.retarget(target -> oldToNew.getOrDefault(target, target));
            }
        }

        String newStartId = oldToNew.get(startId);
        log.debug("Cloned {} nodes starting at {} into new nodes starting at {}.", oldToNew.size(), startId, newStartId);
        return new CloneResult(newStartId, oldToNew);
    }
}

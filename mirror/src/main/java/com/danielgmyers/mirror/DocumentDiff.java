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

package com.danielgmyers.mirror;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.danielgmyers.mirror.document.WorkflowDocument;

/**
 * Node-level difference between a document before and after a run.
 */
public final class DocumentDiff {

    private final int totalNodes;
    private final List<String> addedNodeIds;
    private final List<String> removedNodeIds;

    private DocumentDiff(int totalNodes, List<String> addedNodeIds, List<String> removedNodeIds) {
        this.totalNodes = totalNodes;
        this.addedNodeIds = Collections.unmodifiableList(addedNodeIds);
        this.removedNodeIds = Collections.unmodifiableList(removedNodeIds);
    }

    /**
     * Compares node keys. Added and removed ids are sorted.
     */
    public static DocumentDiff between(WorkflowDocument before, WorkflowDocument after) {
        Set<String> added = new TreeSet<>(after.getNodes().keySet());
        added.removeAll(before.getNodes().keySet());
        Set<String> removed = new TreeSet<>(before.getNodes().keySet());
        removed.removeAll(after.getNodes().keySet());
        return new DocumentDiff(after.size(), new ArrayList<>(added), new ArrayList<>(removed));
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public List<String> getAddedNodeIds() {
        return addedNodeIds;
    }

    public List<String> getRemovedNodeIds() {
        return removedNodeIds;
    }

    @Override
    public String toString() {
        return "added=" + addedNodeIds + " removed=" + removedNodeIds + " total_nodes=" + totalNodes;
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a graft: the template-to-branch id mapping (template entry maps to the preserved branch entry)
 * and the ids of the nodes that were newly created.
 */
public final class GraftResult {

    private final String entryId;
    private final Map<String, String> mapping;
    private final List<String> createdNodeIds;

    GraftResult(String entryId, Map<String, String> mapping) {
        this.entryId = entryId;
        this.mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
        List<String> created = new ArrayList<>();
        for (String nodeId : mapping.values()) {
            if (!nodeId.equals(entryId)) {
                created.add(nodeId);
            }
        }
        this.createdNodeIds = Collections.unmodifiableList(created);
    }

    public String getEntryId() {
        return entryId;
    }

    public Map<String, String> getMapping() {
        return mapping;
    }

    /**
     * Every node of the grafted branch, entry first, in template walk order.
     */
    public List<String> getBranchNodeIds() {
        return List.copyOf(mapping.values());
    }

    public List<String> getCreatedNodeIds() {
        return createdNodeIds;
    }
}

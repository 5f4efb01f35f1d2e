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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of cloning a branch: the id of the copied start node, and the original-to-copy id mapping
 * in walk order.
 */
public final class CloneResult {

    private final String newStartId;
    private final Map<String, String> mapping;

    CloneResult(String newStartId, Map<String, String> mapping) {
        this.newStartId = newStartId;
        this.mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }

    public String getNewStartId() {
        return newStartId;
    }

    public Map<String, String> getMapping() {
        return mapping;
    }
}

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
import java.util.List;
import java.util.Objects;

import com.danielgmyers.mirror.document.NextStep;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowNode;

/**
 * A structural fingerprint of a branch: the template id of each node in walk order, and each node's arity
 * (number of conditions, whether it has a default). Two branches with equal signatures are structurally isomorphic.
 */
public final class ShapeSignature {

    /**
     * The branching shape of a single node.
     */
    public static final class Arity {
        private final int conditionCount;
        private final boolean hasDefault;

        public Arity(int conditionCount, boolean hasDefault) {
            this.conditionCount = conditionCount;
            this.hasDefault = hasDefault;
        }

        public int getConditionCount() {
            return conditionCount;
        }

        public boolean hasDefault() {
            return hasDefault;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (other == null || getClass() != other.getClass()) {
                return false;
            }
            Arity that = (Arity) other;
            return conditionCount == that.conditionCount && hasDefault == that.hasDefault;
        }

        @Override
        public int hashCode() {
            return Objects.hash(conditionCount, hasDefault);
        }

        @Override
        public String toString() {
            return "(" + conditionCount + ", " + (hasDefault ? 1 : 0) + ")";
        }
    }

    private final List<String> templateIds;
    private final List<Arity> arities;

    public ShapeSignature(List<String> templateIds, List<Arity> arities) {
        if (templateIds.size() != arities.size()) {
            throw new IllegalArgumentException("A shape signature needs one arity per template id.");
        }
        this.templateIds = Collections.unmodifiableList(new ArrayList<>(templateIds));
        this.arities = Collections.unmodifiableList(new ArrayList<>(arities));
    }

    /**
     * Computes the signature of the branch starting at the given node. The document is not modified.
     */
    public static ShapeSignature of(WorkflowDocument document, String startId) {
        List<String> templateIds = new ArrayList<>();
        List<Arity> arities = new ArrayList<>();
        for (String nodeId : GraphWalker.walk(document, startId).getOrder()) {
            WorkflowNode node = document.getNode(nodeId);
            templateIds.add(String.valueOf(node.getTemplateId()));
            NextStep next = node.getNext();
            if (next == null) {
                arities.add(new Arity(0, false));
            } else {
                arities.add(new Arity(next.getConditions().size(), next.hasDefault()));
            }
        }
        return new ShapeSignature(templateIds, arities);
    }

    public List<String> getTemplateIds() {
        return templateIds;
    }

    public List<Arity> getArities() {
        return arities;
    }

    public int size() {
        return templateIds.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ShapeSignature that = (ShapeSignature) other;
        return templateIds.equals(that.templateIds) && arities.equals(that.arities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(templateIds, arities);
    }

    @Override
    public String toString() {
        return templateIds + " " + arities;
    }
}

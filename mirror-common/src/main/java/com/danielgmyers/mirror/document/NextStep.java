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

package com.danielgmyers.mirror.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The outgoing edges of a non-terminal node: an ordered list of conditions, then a default target.
 */
public class NextStep {

    private final List<Condition> conditions;
    private String defaultTarget;
    private ObjectNode extraFields;

    public NextStep() {
        this(Collections.emptyList(), null);
    }

    public NextStep(List<Condition> conditions, String defaultTarget) {
        this.conditions = new ArrayList<>(conditions);
        this.defaultTarget = defaultTarget;
        this.extraFields = JsonNodeFactory.instance.objectNode();
    }

    /**
     * The live, ordered condition list. Callers may mutate the returned conditions.
     */
    public List<Condition> getConditions() {
        return conditions;
    }

    public void addCondition(Condition condition) {
        conditions.add(condition);
    }

    public String getDefaultTarget() {
        return defaultTarget;
    }

    public void setDefaultTarget(String defaultTarget) {
        this.defaultTarget = defaultTarget;
    }

    public boolean hasDefault() {
        return defaultTarget != null;
    }

    public ObjectNode getExtraFields() {
        return extraFields;
    }

    public void setExtraFields(ObjectNode extraFields) {
        this.extraFields = (extraFields == null ? JsonNodeFactory.instance.objectNode() : extraFields);
    }

    /**
     * Lists every non-null target in traversal order: condition results first, then the default.
     */
    public List<String> getTargets() {
        List<String> targets = new ArrayList<>();
        for (Condition condition : conditions) {
            if (condition.getResult() != null) {
                targets.add(condition.getResult());
            }
        }
        if (defaultTarget != null) {
            targets.add(defaultTarget);
        }
        return targets;
    }

    /**
     * Applies the remapping function to every non-null target. The function returns the new target id.
     */
    public void retarget(UnaryOperator<String> remap) {
        for (Condition condition : conditions) {
            if (condition.getResult() != null) {
                condition.setResult(remap.apply(condition.getResult()));
            }
        }
        if (defaultTarget != null) {
            defaultTarget = remap.apply(defaultTarget);
        }
    }

    public NextStep deepCopy() {
        List<Condition> copiedConditions = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            copiedConditions.add(condition.deepCopy());
        }
        NextStep copy = new NextStep(copiedConditions, defaultTarget);
        copy.setExtraFields(extraFields.deepCopy());
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        NextStep that = (NextStep) other;
        return conditions.equals(that.conditions) && Objects.equals(defaultTarget, that.defaultTarget)
               && Objects.equals(extraFields, that.extraFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, defaultTarget, extraFields);
    }
}

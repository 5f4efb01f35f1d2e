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

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One routing rule of a node's next step: if lval op rval holds, the visitor continues at result.
 */
public class Condition {

    private String lval;
    private String op;
    private JsonNode rval;
    private String result;
    private ObjectNode extraFields;

    public Condition() {
        this.extraFields = JsonNodeFactory.instance.objectNode();
    }

    public Condition(String lval, String op, JsonNode rval, String result) {
        this();
        this.lval = lval;
        this.op = op;
        this.rval = rval;
        this.result = result;
    }

    public String getLval() {
        return lval;
    }

    public void setLval(String lval) {
        this.lval = lval;
    }

    public String getOp() {
        return op;
    }

    public void setOp(String op) {
        this.op = op;
    }

    public JsonNode getRval() {
        return rval;
    }

    public void setRval(JsonNode rval) {
        this.rval = rval;
    }

    /**
     * Reads rval as an option id. Numbers and numeric strings are accepted; anything else yields the fallback.
     */
    public int getRvalAsInt(int fallback) {
        if (rval == null || rval.isNull()) {
            return fallback;
        }
        if (rval.isNumber()) {
            return rval.asInt();
        }
        if (rval.isTextual()) {
            try {
                return Integer.parseInt(rval.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    /**
     * The target node id, or null if this condition ends the path.
     */
    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    /**
     * Fields the engine does not interpret (e.g. rval_type); kept so they round-trip unchanged.
     */
    public ObjectNode getExtraFields() {
        return extraFields;
    }

    public void setExtraFields(ObjectNode extraFields) {
        this.extraFields = (extraFields == null ? JsonNodeFactory.instance.objectNode() : extraFields);
    }

    public Condition deepCopy() {
        Condition copy = new Condition(lval, op, (rval == null ? null : rval.deepCopy()), result);
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
        Condition that = (Condition) other;
        return Objects.equals(lval, that.lval) && Objects.equals(op, that.op) && Objects.equals(rval, that.rval)
               && Objects.equals(result, that.result) && Objects.equals(extraFields, that.extraFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lval, op, rval, result, extraFields);
    }

    @Override
    public String toString() {
        return lval + " " + op + " " + rval + " -> " + result;
    }
}

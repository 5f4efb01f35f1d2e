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

/**
 * What happened to one language branch during a run.
 */
public class BranchReport {

    private final String label;
    private final String locale;
    private final String entryId;
    private final List<String> touchedNodeIds = new ArrayList<>();
    private final List<String> createdNodeIds = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private boolean grafted = false;
    private int stringsTranslated = 0;
    private int crumbsSet = 0;

    BranchReport(String label, String locale, String entryId) {
        this.label = label;
        this.locale = locale;
        this.entryId = entryId;
    }

    public String getLabel() {
        return label;
    }

    /**
     * The locale code the branch was translated into, or null if none could be resolved.
     */
    public String getLocale() {
        return locale;
    }

    /**
     * The branch's entry node as routed by the choice page, or null if the option has no route.
     */
    public String getEntryId() {
        return entryId;
    }

    public boolean isGrafted() {
        return grafted;
    }

    public List<String> getTouchedNodeIds() {
        return Collections.unmodifiableList(touchedNodeIds);
    }

    public List<String> getCreatedNodeIds() {
        return Collections.unmodifiableList(createdNodeIds);
    }

    public int getStringsTranslated() {
        return stringsTranslated;
    }

    public int getCrumbsSet() {
        return crumbsSet;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    void recordGraft(List<String> branchNodeIds, List<String> created) {
        grafted = true;
        touchedNodeIds.addAll(branchNodeIds);
        createdNodeIds.addAll(created);
    }

    void addStringsTranslated(int count) {
        stringsTranslated += count;
    }

    void setCrumbsSet(int crumbsSet) {
        this.crumbsSet = crumbsSet;
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    @Override
    public String toString() {
        return String.format("%s (%s): entry=%s grafted=%s created=%d translated=%d warnings=%d",
                             label, locale, entryId, grafted, createdNodeIds.size(), stringsTranslated,
                             warnings.size());
    }
}

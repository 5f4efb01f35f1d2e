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

import com.danielgmyers.mirror.validation.ValidationReport;

/**
 * Totals and per-branch details for one mirroring run.
 */
public class RunSummary {

    private final List<BranchReport> branches = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private int branchesProcessed = 0;
    private int nodesCreated = 0;
    private int nodesUpdated = 0;
    private int stringsTranslated = 0;
    private ValidationReport validationReport;
    private DocumentDiff diff;
    private boolean saved = false;

    public List<BranchReport> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    /**
     * Every non-fatal problem found during the run, in the order it was found.
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Branches that had a resolvable locale, whether or not they could be grafted.
     */
    public int getBranchesProcessed() {
        return branchesProcessed;
    }

    public int getNodesCreated() {
        return nodesCreated;
    }

    /**
     * Existing nodes overwritten in place; one per grafted branch entry.
     */
    public int getNodesUpdated() {
        return nodesUpdated;
    }

    public int getStringsTranslated() {
        return stringsTranslated;
    }

    /**
     * The report of the post-run validation, or null if the document was not validated.
     */
    public ValidationReport getValidationReport() {
        return validationReport;
    }

    /**
     * The node diff against the loaded document, or null if the run did not start from a stored workflow.
     */
    public DocumentDiff getDiff() {
        return diff;
    }

    public boolean isSaved() {
        return saved;
    }

    void addBranch(BranchReport branch) {
        branches.add(branch);
    }

    void addWarning(BranchReport branch, String warning) {
        warnings.add(warning);
        if (branch != null) {
            branch.addWarning(warning);
        }
    }

    void branchProcessed() {
        branchesProcessed++;
    }

    void addGraft(int created, int translated) {
        nodesCreated += created;
        nodesUpdated++;
        stringsTranslated += translated;
    }

    void setValidationReport(ValidationReport validationReport) {
        this.validationReport = validationReport;
    }

    void setDiff(DocumentDiff diff) {
        this.diff = diff;
    }

    void setSaved(boolean saved) {
        this.saved = saved;
    }

    @Override
    public String toString() {
        return String.format("Nodes created: %d, nodes updated: %d, strings translated: %d, languages processed: %d,"
                             + " warnings: %d", nodesCreated, nodesUpdated, stringsTranslated, branchesProcessed,
                             warnings.size());
    }
}

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

import java.util.HashMap;
import java.util.Map;

import com.danielgmyers.mirror.document.DocumentFormatException;
import com.danielgmyers.mirror.document.Reason;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowNode;
import com.danielgmyers.mirror.graph.BranchGraftException;
import com.danielgmyers.mirror.graph.BranchGrafter;
import com.danielgmyers.mirror.graph.CrumbPropagator;
import com.danielgmyers.mirror.graph.GraftResult;
import com.danielgmyers.mirror.graph.GraphConventions;
import com.danielgmyers.mirror.graph.ShapeSignature;
import com.danielgmyers.mirror.routing.ChoicePageRouter;
import com.danielgmyers.mirror.routing.ChoiceRouting;
import com.danielgmyers.mirror.routing.LocaleResolver;
import com.danielgmyers.mirror.store.DocumentStore;
import com.danielgmyers.mirror.store.WorkflowEnvelope;
import com.danielgmyers.mirror.text.NodeTextTranslator;
import com.danielgmyers.mirror.text.TextTransformer;
import com.danielgmyers.mirror.validation.DocumentValidator;
import com.danielgmyers.mirror.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes every language branch of a workflow mirror the source language's branch, then translates it.
 *
 * Branches are processed one at a time in the choice page's option order. The choice page's routing is
 * never edited: each branch is grafted in place at the node the page already routes to, so options
 * without a route are skipped with a warning.
 */
public class BranchMirror {

    private static final Logger log = LoggerFactory.getLogger(BranchMirror.class);

    private final MirrorConfig config;
    private final DocumentStore store;
    private final NodeTextTranslator translator;
    private final ChoicePageRouter router;
    private final LocaleResolver localeResolver;
    private final BranchGrafter grafter;
    private final CrumbPropagator crumbPropagator;
    private final DocumentValidator validator;

    public BranchMirror(MirrorConfig config, DocumentStore store, TextTransformer transformer) {
        if (config == null) {
            throw new IllegalArgumentException("config may not be null.");
        }
        if (store == null) {
            throw new IllegalArgumentException("store may not be null.");
        }
        this.config = config;
        this.store = store;
        this.translator = new NodeTextTranslator(transformer);

        GraphConventions conventions = config.getGraphConventions();
        this.router = new ChoicePageRouter(conventions);
        this.localeResolver = new LocaleResolver(config.getLanguageMap());
        this.grafter = new BranchGrafter(conventions);
        this.crumbPropagator = new CrumbPropagator(conventions);
        this.validator = new DocumentValidator(conventions);
    }

    /**
     * Loads the workflow, mirrors its branches, validates the result and, unless this is a dry run, saves it.
     * @throws MirrorException if the workflow can't be mirrored; nothing is saved in that case.
     * @throws DocumentValidationException if the mirrored document is invalid; it is not saved.
     */
    public RunSummary run(String workflowId) {
        log.info("Mirroring workflow {} ({}).", workflowId, (config.isDryRun() ? "dry run" : "write mode"));
        WorkflowEnvelope envelope = store.load(workflowId);
        WorkflowDocument document;
        try {
            document = envelope.readDocument();
        } catch (DocumentFormatException e) {
            throw new MirrorException("Workflow " + workflowId + " has an unreadable body.", e);
        }
        WorkflowDocument original = document.deepCopy();

        RunSummary summary = mirror(document);

        ValidationReport report = validator.validate(document);
        summary.setValidationReport(report);
        for (String warning : report.getWarnings()) {
            log.warn("Validation warning: {}", warning);
        }
        if (!report.isValid()) {
            for (String error : report.getErrors()) {
                log.error("Validation error: {}", error);
            }
            throw new DocumentValidationException("Mirrored workflow " + workflowId + " failed validation with "
                                                  + report.getErrors().size() + " error(s); not saving.", report);
        }

        DocumentDiff diff = DocumentDiff.between(original, document);
        summary.setDiff(diff);
        log.info("Diff summary: {}", diff);
        log.info("Summary: {}", summary);

        if (config.isDryRun()) {
            log.info("Dry run: workflow {} was not saved.", workflowId);
        } else {
            envelope.writeDocument(document);
            store.save(envelope);
            summary.setSaved(true);
            log.info("Saved workflow {}.", workflowId);
        }
        return summary;
    }

    /**
     * Mirrors the branches of the document in place. Does not validate or save.
     * @throws MirrorException if the choice page, the source option, or the template branch can't be found.
     */
    public RunSummary mirror(WorkflowDocument document) {
        ChoiceRouting routing = router.route(document);
        String sourceLabel = config.getSourceLanguageLabel();
        if (!routing.hasOption(sourceLabel)) {
            throw new MirrorException("Source language label '" + sourceLabel + "' not found among the options of"
                                      + " choice page " + routing.getChoicePageId() + ".");
        }

        String templateEntryId = findTemplateEntry(routing, sourceLabel);
        if (!document.containsNode(templateEntryId)) {
            throw new MirrorException("Template entry node " + templateEntryId + " for '" + sourceLabel
                                      + "' does not exist.");
        }
        ShapeSignature templateSignature = ShapeSignature.of(document, templateEntryId);
        log.info("Template branch for '{}' starts at node {} ({} nodes).", sourceLabel, templateEntryId,
                 templateSignature.size());

        RunSummary summary = new RunSummary();
        Map<String, String> labelsByGraftedEntry = new HashMap<>();
        for (Reason option : routing.getOptions()) {
            String label = option.getTitle();
            if (label.equals(sourceLabel)) {
                continue;
            }
            mirrorBranch(document, routing, label, templateEntryId, templateSignature, labelsByGraftedEntry, summary);
        }
        return summary;
    }

    private String findTemplateEntry(ChoiceRouting routing, String sourceLabel) {
        String explicit = routing.getExplicitEntry(sourceLabel);
        if (explicit != null) {
            return explicit;
        }
        if (routing.getPageDefault() != null) {
            log.warn("No explicit route for '{}'; using the choice page default {}.", sourceLabel,
                     routing.getPageDefault());
            return routing.getPageDefault();
        }
        throw new MirrorException("No entry node found for source language '" + sourceLabel + "'.");
    }

    private void mirrorBranch(WorkflowDocument document, ChoiceRouting routing, String label, String templateEntryId,
                              ShapeSignature templateSignature, Map<String, String> labelsByGraftedEntry,
                              RunSummary summary) {
        String locale = localeResolver.resolve(label);
        String entryId = routing.getEntry(label);
        BranchReport branch = new BranchReport(label, locale, entryId);
        summary.addBranch(branch);

        if (locale == null) {
            summary.addWarning(branch, String.format("Could not infer a locale for '%s', skipping.", label));
            return;
        }
        summary.branchProcessed();

        if (entryId == null || !document.containsNode(entryId)) {
            log.info("No existing path for '{}'; the choice page is left unchanged.", label);
            summary.addWarning(branch, String.format("Skipping '%s' because no start node is wired on the choice page.",
                                                     label));
            return;
        }
        if (entryId.equals(routing.getChoicePageId())) {
            log.warn("Option '{}' routes back to choice page {}; leaving it unchanged.", label, entryId);
            summary.addWarning(branch, String.format("Skipping '%s' because it routes back to the choice page %s.",
                                                     label, entryId));
            return;
        }
        if (labelsByGraftedEntry.containsKey(entryId)) {
            summary.addWarning(branch, String.format("Skipping '%s' because its start node %s was already mirrored for '%s'.",
                                                     label, entryId, labelsByGraftedEntry.get(entryId)));
            return;
        }

        GraftResult graft;
        try {
            log.info("Grafting the template for '{}' onto node {}.", label, entryId);
            graft = grafter.graft(document, templateEntryId, entryId);
        } catch (BranchGraftException e) {
            log.warn("Unable to graft '{}': {}", label, e.getMessage());
            summary.addWarning(branch, String.format("Skipping '%s': %s", label, e.getMessage()));
            return;
        }
        labelsByGraftedEntry.put(entryId, label);
        branch.recordGraft(graft.getBranchNodeIds(), graft.getCreatedNodeIds());

        branch.setCrumbsSet(crumbPropagator.propagate(document, graft.getBranchNodeIds(), entryId, label));

        int translated = 0;
        for (String nodeId : graft.getBranchNodeIds()) {
            WorkflowNode node = document.getNode(nodeId);
            if (node != null) {
                translated += translator.translate(node, locale);
            }
        }
        branch.addStringsTranslated(translated);
        summary.addGraft(graft.getCreatedNodeIds().size(), translated);

        String shapeWarning = validator.checkShape(label, templateSignature, document, entryId);
        if (shapeWarning != null) {
            summary.addWarning(branch, shapeWarning);
        }
        log.info("Mirrored '{}' into {}: {} nodes created, {} strings translated.", label, locale,
                 graft.getCreatedNodeIds().size(), translated);
    }
}

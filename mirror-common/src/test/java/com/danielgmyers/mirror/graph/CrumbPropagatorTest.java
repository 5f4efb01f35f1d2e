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

import java.util.List;

import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowDocumentBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CrumbPropagatorTest {

    private BranchGrafter grafter;
    private CrumbPropagator propagator;

    @BeforeEach
    public void setup() {
        grafter = new BranchGrafter(GraphConventions.DEFAULTS);
        propagator = new CrumbPropagator(GraphConventions.DEFAULTS);
    }

    @Test
    public void testPropagateLabelsSubChoiceOutcomesWithOptionTitles() {
        WorkflowDocument document = TestDocuments.withSubChoice().build();
        GraftResult graft = grafter.graft(document, "2", "10");
        String subChoice = graft.getMapping().get("3");
        String staffPage = graft.getMapping().get("4");
        String staffThanks = graft.getMapping().get("6");
        String visitorPage = graft.getMapping().get("5");
        String visitorThanks = graft.getMapping().get("7");

        int labelled = propagator.propagate(document, graft.getBranchNodeIds(), "10", "French");

        Assertions.assertEquals("French", document.getNode("10").getCrumb());
        Assertions.assertEquals("French", document.getNode(subChoice).getCrumb());
        Assertions.assertEquals("Staff", document.getNode(staffPage).getCrumb());
        Assertions.assertEquals("Staff", document.getNode(staffThanks).getCrumb());
        Assertions.assertEquals("French", document.getNode(visitorPage).getCrumb());
        Assertions.assertEquals("French", document.getNode(visitorThanks).getCrumb());
        Assertions.assertEquals(6, labelled);
    }

    @Test
    public void testPropagateKeepsExistingCrumbs() {
        WorkflowDocument document = TestDocuments.withSubChoice().crumb("5", "Visitors only").build();
        GraftResult graft = grafter.graft(document, "2", "10");

        int labelled = propagator.propagate(document, graft.getBranchNodeIds(), "10", "French");

        Assertions.assertEquals("Visitors only", document.getNode(graft.getMapping().get("5")).getCrumb());
        Assertions.assertEquals("French", document.getNode(graft.getMapping().get("7")).getCrumb());
        Assertions.assertEquals(5, labelled);
    }

    @Test
    public void testPropagateStaysInsideTheBranch() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addNode("1", "visitreason")
                .reasons("1", TestDocuments.options(1, "Staff"))
                .conditionTransition("1", TestDocuments.FIELD, 1, "2")
                .defaultTransition("1", "2")
                .addNode("2", "staffpage")
                .defaultTransition("2", "3")
                .addTerminalNode("3", "thanks")
                .build();

        propagator.propagate(document, List.of("1", "2"), "1", "German");

        Assertions.assertEquals("German", document.getNode("1").getCrumb());
        Assertions.assertEquals("Staff", document.getNode("2").getCrumb());
        Assertions.assertNull(document.getNode("3").getCrumb());
    }

    @Test
    public void testPropagateFallsBackToSelectionLabelForUnknownOptions() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addNode("1", "visitreason")
                .reasons("1", TestDocuments.options(1, "Staff"))
                .conditionTransition("1", TestDocuments.FIELD, 5, "2")
                .defaultTransition("1", "3")
                .addTerminalNode("2", "thanks")
                .addTerminalNode("3", "thanks")
                .build();

        propagator.propagate(document, List.of("1", "2", "3"), "1", "German");

        Assertions.assertEquals("German", document.getNode("2").getCrumb());
    }

    @Test
    public void testPropagateNoSubChoiceOnlyLabelsTheEntry() {
        WorkflowDocument document = TestDocuments.twoLanguages().build();
        GraftResult graft = grafter.graft(document, "2", "10");

        int labelled = propagator.propagate(document, graft.getBranchNodeIds(), "10", "French");

        Assertions.assertEquals(1, labelled);
        Assertions.assertEquals("French", document.getNode("10").getCrumb());
        Assertions.assertNull(document.getNode("13").getCrumb());
    }
}

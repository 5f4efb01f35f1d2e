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

import com.danielgmyers.mirror.document.NextStep;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowDocumentBuilder;
import com.danielgmyers.mirror.validation.DocumentValidator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BranchGrafterTest {

    private BranchGrafter grafter;

    @BeforeEach
    public void setup() {
        grafter = new BranchGrafter(GraphConventions.DEFAULTS);
    }

    @Test
    public void testGraftReplacesBranchContentAndKeepsEntryId() {
        WorkflowDocument document = TestDocuments.twoLanguages().label("2", "title", "Welcome").build();

        GraftResult result = grafter.graft(document, "2", "10");

        Assertions.assertEquals("10", result.getEntryId());
        Assertions.assertEquals("10", document.getNode("10").getId());
        Assertions.assertEquals("welcome", document.getNode("10").getTemplateId());
        Assertions.assertEquals("Welcome", document.getNode("10").getLabels().get("title").asText());
        Assertions.assertEquals("13", document.getNode("10").getNext().getDefaultTarget());
        Assertions.assertEquals("thanks", document.getNode("13").getTemplateId());
        Assertions.assertFalse(document.containsNode("12"));
        Assertions.assertEquals(List.of("13"), result.getCreatedNodeIds());
        Assertions.assertEquals(List.of("10", "13"), result.getBranchNodeIds());
    }

    @Test
    public void testGraftChoicePageStillRoutesToTheSameEntry() {
        WorkflowDocument document = TestDocuments.twoLanguages().build();

        grafter.graft(document, "2", "10");

        Assertions.assertEquals("10", document.getNode("1").getNext().getConditions().get(1).getResult());
    }

    @Test
    public void testGraftBranchShapeMatchesTemplate() {
        WorkflowDocument document = TestDocuments.withSubChoice().build();

        grafter.graft(document, "2", "10");

        Assertions.assertEquals(ShapeSignature.of(document, "2"), ShapeSignature.of(document, "10"));
    }

    @Test
    public void testGraftLeavesNoDanglingReferences() {
        WorkflowDocument document = TestDocuments.withSubChoice().build();

        grafter.graft(document, "2", "10");

        Assertions.assertTrue(new DocumentValidator(GraphConventions.DEFAULTS).validate(document).isValid());
    }

    @Test
    public void testGraftDoesNotModifyTheTemplateBranch() {
        WorkflowDocument document = TestDocuments.withSubChoice().build();
        WorkflowDocument before = document.deepCopy();

        grafter.graft(document, "2", "10");

        for (String nodeId : GraphWalker.walk(before, "2").getOrder()) {
            Assertions.assertEquals(before.getNode(nodeId), document.getNode(nodeId));
        }
    }

    @Test
    public void testGraftIsRepeatable() {
        WorkflowDocument document = TestDocuments.withSubChoice().build();

        grafter.graft(document, "2", "10");
        GraftResult second = grafter.graft(document, "2", "10");

        Assertions.assertEquals(ShapeSignature.of(document, "2"), ShapeSignature.of(document, "10"));
        Assertions.assertEquals(5, second.getCreatedNodeIds().size());
        Assertions.assertTrue(new DocumentValidator(GraphConventions.DEFAULTS).validate(document).isValid());
    }

    @Test
    public void testGraftSelfLoopingTemplateMapsOntoTheEntry() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", TestDocuments.options(1, "English", 2, "French"))
                .conditionTransition("1", TestDocuments.FIELD, 1, "2")
                .conditionTransition("1", TestDocuments.FIELD, 2, "10")
                .defaultTransition("1", "2")
                .addNode("2", "loop")
                .defaultTransition("2", "2")
                .addNode("10", "stale")
                .defaultTransition("10", "11")
                .addTerminalNode("11", "thanks")
                .build();
        int sizeBefore = document.size();

        GraftResult result = grafter.graft(document, "2", "10");

        Assertions.assertEquals("10", document.getNode("10").getNext().getDefaultTarget());
        Assertions.assertEquals("loop", document.getNode("10").getTemplateId());
        Assertions.assertTrue(result.getCreatedNodeIds().isEmpty());
        Assertions.assertEquals(sizeBefore, document.size());
        Assertions.assertEquals(List.of("10"), GraphWalker.walk(document, "10").getOrder());
    }

    @Test
    public void testGraftTerminalNodesEndWithNullNext() {
        WorkflowDocument document = TestDocuments.twoLanguages().build();
        document.getNode("3").setNext(new NextStep(List.of(), "2"));

        GraftResult result = grafter.graft(document, "2", "10");
        String clonedThanks = result.getMapping().get("3");

        Assertions.assertNull(document.getNode(clonedThanks).getNext());
        Assertions.assertTrue(document.getNode(clonedThanks).hasNextField());
    }

    @Test
    public void testGraftEntryThatLostItsNextGetsTheTemplateDefault() {
        WorkflowDocument document = TestDocuments.twoLanguages().build();
        document.getNode("2").getNext().setDefaultTarget("3");
        document.getNode("10").clearNextField();

        grafter.graft(document, "2", "10");

        Assertions.assertEquals("13", document.getNode("10").getNext().getDefaultTarget());
    }

    @Test
    public void testGraftRefusesBranchInsideTemplate() {
        WorkflowDocument document = TestDocuments.twoLanguages().build();
        WorkflowDocument before = document.deepCopy();

        Assertions.assertThrows(BranchGraftException.class, () -> grafter.graft(document, "2", "3"));
        Assertions.assertEquals(before, document);
    }

    @Test
    public void testGraftRefusesUnknownEntries() {
        WorkflowDocument document = TestDocuments.twoLanguages().build();

        Assertions.assertThrows(BranchGraftException.class, () -> grafter.graft(document, "404", "10"));
        Assertions.assertThrows(BranchGraftException.class, () -> grafter.graft(document, "2", "404"));
    }

    @Test
    public void testConstructorRejectsNullConventions() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BranchGrafter(null));
    }
}

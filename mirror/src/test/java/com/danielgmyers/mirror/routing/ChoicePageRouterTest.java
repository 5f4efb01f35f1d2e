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

package com.danielgmyers.mirror.routing;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.danielgmyers.mirror.MirrorException;
import com.danielgmyers.mirror.document.Condition;
import com.danielgmyers.mirror.document.Reason;
import com.danielgmyers.mirror.document.WorkflowDocument;
import com.danielgmyers.mirror.document.WorkflowDocumentBuilder;
import com.danielgmyers.mirror.graph.GraphConventions;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ChoicePageRouterTest {

    private ChoicePageRouter router;

    @BeforeEach
    public void setup() {
        router = new ChoicePageRouter(GraphConventions.DEFAULTS);
    }

    private static Map<Integer, String> languages() {
        Map<Integer, String> options = new TreeMap<>();
        options.put(1, "English");
        options.put(2, "Spanish");
        options.put(3, "French");
        return options;
    }

    @Test
    public void testRouteReadsOptionsAndConditions() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addNode("0", "intro")
                .defaultTransition("0", "7")
                .addChoicePage("7", "choice", "language", languages())
                .conditionTransition("7", "reason_id", 1, "2")
                .conditionTransition("7", "reason_id", 2, "10")
                .defaultTransition("7", "2")
                .build();

        ChoiceRouting routing = router.route(document);

        Assertions.assertEquals("7", routing.getChoicePageId());
        Assertions.assertEquals(List.of(new Reason(1, "English"), new Reason(2, "Spanish"), new Reason(3, "French")),
                                routing.getOptions());
        Assertions.assertEquals("2", routing.getEntry("English"));
        Assertions.assertEquals("10", routing.getEntry("Spanish"));
        Assertions.assertEquals(Integer.valueOf(2), routing.getOptionId("Spanish"));
        Assertions.assertEquals("2", routing.getPageDefault());
    }

    @Test
    public void testRouteOptionsWithoutConditionInheritPageDefault() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", languages())
                .conditionTransition("1", "reason_id", 1, "2")
                .defaultTransition("1", "2")
                .build();

        ChoiceRouting routing = router.route(document);

        Assertions.assertFalse(routing.hasExplicitEntry("French"));
        Assertions.assertNull(routing.getExplicitEntry("French"));
        Assertions.assertEquals("2", routing.getEntry("French"));
        Assertions.assertNull(routing.getEntry("Klingon"));
    }

    @Test
    public void testRouteIgnoresConditionsOnOtherFields() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", languages())
                .conditionTransition("1", "visitor_type", 2, "30")
                .build();

        ChoiceRouting routing = router.route(document);

        Assertions.assertFalse(routing.hasExplicitEntry("Spanish"));
        Assertions.assertNull(routing.getEntry("Spanish"));
    }

    @Test
    public void testRouteAcceptsStringRvalues() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", languages())
                .build();
        document.getNode("1").getNext().addCondition(new Condition("reason_id", "==", TextNode.valueOf("3"), "20"));

        Assertions.assertEquals("20", router.route(document).getEntry("French"));
    }

    @Test
    public void testRouteKeepsExplicitNullRoutes() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", languages())
                .conditionTransition("1", "reason_id", 3, "20")
                .defaultTransition("1", "2")
                .build();
        document.getNode("1").getNext().getConditions().get(0).setResult(null);

        ChoiceRouting routing = router.route(document);

        Assertions.assertTrue(routing.hasExplicitEntry("French"));
        Assertions.assertNull(routing.getEntry("French"));
    }

    @Test
    public void testRouteFailsWithoutChoicePage() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addNode("1", "welcome")
                .configuration("1", "data_name", "visitor_type")
                .build();

        Assertions.assertNull(router.findChoicePage(document));
        Assertions.assertThrows(MirrorException.class, () -> router.route(document));
    }

    @Test
    public void testRouteFailsWithoutOptions() {
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", Map.of())
                .build();

        Assertions.assertThrows(MirrorException.class, () -> router.route(document));
    }

    @Test
    public void testRouteHonoursConfiguredDataName() {
        ChoicePageRouter custom = new ChoicePageRouter(new GraphConventions("thanks", "visitreason", "page",
                                                                            "locale", "reason_id"));
        WorkflowDocument document = new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", languages())
                .addChoicePage("2", "choice", "locale", languages())
                .build();

        Assertions.assertEquals("2", custom.route(document).getChoicePageId());
    }
}

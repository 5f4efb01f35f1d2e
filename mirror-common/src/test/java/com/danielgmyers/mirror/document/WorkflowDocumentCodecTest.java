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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class WorkflowDocumentCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String body;

    @BeforeEach
    public void setup() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/sample-workflow-body.json")) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testDecodeReadsNodesInDocumentOrder() {
        WorkflowDocument document = WorkflowDocumentCodec.decode(body);

        Assertions.assertEquals("1", document.getStartingNodeId());
        Assertions.assertEquals(4, document.size());
        Assertions.assertEquals(List.of("1", "2", "3", "4"), new ArrayList<>(document.getNodes().keySet()));
    }

    @Test
    public void testDecodeCoercesNumericIdsAndTargetsToStrings() {
        WorkflowDocument document = WorkflowDocumentCodec.decode(body);
        WorkflowNode choice = document.getNode("1");

        Assertions.assertEquals("1", choice.getId());
        Assertions.assertEquals("2", choice.getNext().getConditions().get(0).getResult());
        Assertions.assertNull(choice.getNext().getConditions().get(1).getResult());
        Assertions.assertEquals("2", choice.getNext().getDefaultTarget());
        Assertions.assertEquals(1, choice.getNext().getConditions().get(0).getRvalAsInt(-1));
    }

    @Test
    public void testDecodeDistinguishesNullNextFromMissingNext() {
        WorkflowDocument document = WorkflowDocumentCodec.decode(body);

        WorkflowNode thanks = document.getNode("3");
        Assertions.assertNull(thanks.getNext());
        Assertions.assertTrue(thanks.hasNextField());

        WorkflowNode orphan = document.getNode("4");
        Assertions.assertNull(orphan.getNext());
        Assertions.assertFalse(orphan.hasNextField());
    }

    @Test
    public void testEncodePreservesNullVersusAbsentNext() throws IOException {
        JsonNode encoded = MAPPER.readTree(WorkflowDocumentCodec.encode(WorkflowDocumentCodec.decode(body)));

        Assertions.assertTrue(encoded.get("nodes").get("3").has("next"));
        Assertions.assertTrue(encoded.get("nodes").get("3").get("next").isNull());
        Assertions.assertFalse(encoded.get("nodes").get("4").has("next"));
    }

    @Test
    public void testEncodePreservesFieldsTheModelDoesNotInterpret() throws IOException {
        JsonNode encoded = MAPPER.readTree(WorkflowDocumentCodec.encode(WorkflowDocumentCodec.decode(body)));

        Assertions.assertEquals(7, encoded.get("version").asInt());
        Assertions.assertEquals(10, encoded.get("nodes").get("2").get("position").get("x").asInt());
        Assertions.assertTrue(encoded.get("nodes").get("2").has("crumb"));
        Assertions.assertTrue(encoded.get("nodes").get("2").get("crumb").isNull());
        JsonNode condition = encoded.get("nodes").get("1").get("next").get("conditions").get(0);
        Assertions.assertEquals("constant", condition.get("rval_type").asText());
        Assertions.assertEquals(1, condition.get("rval").asInt());
    }

    @Test
    public void testEncodeWritesIdsAndTargetsAsStrings() throws IOException {
        JsonNode encoded = MAPPER.readTree(WorkflowDocumentCodec.encode(WorkflowDocumentCodec.decode(body)));
        JsonNode choice = encoded.get("nodes").get("1");

        Assertions.assertTrue(choice.get("id").isTextual());
        Assertions.assertTrue(choice.get("next").get("conditions").get(0).get("result").isTextual());
        Assertions.assertTrue(choice.get("next").get("conditions").get(1).get("result").isNull());
    }

    @Test
    public void testEncodeThenDecodeYieldsAnEqualDocument() {
        WorkflowDocument document = WorkflowDocumentCodec.decode(body);
        WorkflowDocument reread = WorkflowDocumentCodec.decode(WorkflowDocumentCodec.encode(document));

        Assertions.assertEquals(document, reread);
    }

    @Test
    public void testDecodeRejectsBlankBody() {
        Assertions.assertThrows(DocumentFormatException.class, () -> WorkflowDocumentCodec.decode(" "));
        Assertions.assertThrows(DocumentFormatException.class, () -> WorkflowDocumentCodec.decode(null));
    }

    @Test
    public void testDecodeRejectsMalformedJson() {
        Assertions.assertThrows(DocumentFormatException.class, () -> WorkflowDocumentCodec.decode("{\"nodes\": "));
    }

    @Test
    public void testDecodeRejectsBodyWithoutNodes() {
        Assertions.assertThrows(DocumentFormatException.class, () -> WorkflowDocumentCodec.decode("{\"starting_node_id\": \"1\"}"));
        Assertions.assertThrows(DocumentFormatException.class, () -> WorkflowDocumentCodec.decode("[]"));
    }

    @Test
    public void testDecodeRejectsNextThatIsNotAnObject() {
        String bad = "{\"nodes\": {\"1\": {\"id\": \"1\", \"next\": [1, 2]}}}";
        Assertions.assertThrows(DocumentFormatException.class, () -> WorkflowDocumentCodec.decode(bad));
    }
}

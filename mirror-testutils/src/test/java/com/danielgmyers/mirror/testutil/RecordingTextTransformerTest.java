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

package com.danielgmyers.mirror.testutil;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RecordingTextTransformerTest {

    @Test
    public void testTransformPrefixesLocaleByDefault() {
        RecordingTextTransformer transformer = new RecordingTextTransformer();

        Assertions.assertEquals("es:Hello", transformer.transform("Hello", "es"));
        Assertions.assertFalse(transformer.isMarkingOnly());
    }

    @Test
    public void testTransformRecordsRequestsInOrder() {
        RecordingTextTransformer transformer = new RecordingTextTransformer((text, locale) -> text.toUpperCase());

        transformer.transform("one", "fr");
        transformer.transform("two", "de");

        Assertions.assertEquals(List.of("one", "two"), transformer.getRequestedTexts());
        Assertions.assertEquals("de", transformer.getRequests().get(1).getLocale());

        transformer.reset();
        Assertions.assertTrue(transformer.getRequests().isEmpty());
    }
}

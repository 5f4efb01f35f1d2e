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

package com.danielgmyers.mirror.guice;

import java.util.Map;

import com.danielgmyers.mirror.BranchMirror;
import com.danielgmyers.mirror.MirrorConfig;
import com.danielgmyers.mirror.RunSummary;
import com.danielgmyers.mirror.document.WorkflowDocumentBuilder;
import com.danielgmyers.mirror.store.DocumentStore;
import com.danielgmyers.mirror.testutil.RecordingTextTransformer;
import com.danielgmyers.mirror.testutil.StubDocumentStore;
import com.danielgmyers.mirror.text.TextTransformer;
import com.google.inject.AbstractModule;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class MirrorModuleTest {

    private StubDocumentStore store;

    @BeforeEach
    public void setup() {
        store = new StubDocumentStore();
    }

    private AbstractModule requiredBindings(String sourceLanguageLabel) {
        return new AbstractModule() {
            @Override
            protected void configure() {
                bind(DocumentStore.class).toInstance(store);
                bind(TextTransformer.class).toInstance(new RecordingTextTransformer());
                bind(String.class).annotatedWith(SourceLanguageLabel.class).toInstance(sourceLanguageLabel);
            }
        };
    }

    @Test
    public void testConfigDefaultsWhenOptionalValuesAreMissing() {
        Injector injector = Guice.createInjector(new MirrorModule(), requiredBindings("Englisch"));

        MirrorConfig config = injector.getInstance(MirrorConfig.class);

        Assertions.assertEquals("Englisch", config.getSourceLanguageLabel());
        Assertions.assertTrue(config.isDryRun());
        Assertions.assertTrue(config.getLanguageMap().isEmpty());
        Assertions.assertEquals("reason_id", config.getChoiceFieldName());
    }

    @Test
    public void testOptionalValuesAreApplied() {
        Injector injector = Guice.createInjector(new MirrorModule(), requiredBindings("English"), new AbstractModule() {
            @Override
            protected void configure() {
                bind(Boolean.class).annotatedWith(DryRun.class).toInstance(false);
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(LanguageMap.class)
                        .toInstance(Map.of("Spanish", "es-MX"));
                bind(String.class).annotatedWith(ChoiceFieldName.class).toInstance("choice_id");
                bind(String.class).annotatedWith(ChoicePageDataName.class).toInstance("locale");
                bind(String.class).annotatedWith(TerminalTemplateId.class).toInstance("done");
                bind(String.class).annotatedWith(SubChoiceTemplateId.class).toInstance("reason");
            }
        });

        MirrorConfig config = injector.getInstance(MirrorConfig.class);

        Assertions.assertFalse(config.isDryRun());
        Assertions.assertEquals(Map.of("Spanish", "es-MX"), config.getLanguageMap());
        Assertions.assertEquals("choice_id", config.getChoiceFieldName());
        Assertions.assertEquals("locale", config.getChoicePageDataName());
        Assertions.assertEquals("done", config.getTerminalTemplateId());
        Assertions.assertEquals("reason", config.getSubChoiceTemplateId());
    }

    @Test
    public void testBranchMirrorIsSingletonAndUsesBoundStore() {
        Injector injector = Guice.createInjector(new MirrorModule(), requiredBindings("English"));
        store.put("wf-1", new WorkflowDocumentBuilder()
                .addChoicePage("1", "choice", "language", Map.of(1, "English"))
                .conditionTransition("1", "reason_id", 1, "2")
                .defaultTransition("1", "2")
                .addTerminalNode("2", "thanks")
                .build());

        BranchMirror mirror = injector.getInstance(BranchMirror.class);
        RunSummary summary = mirror.run("wf-1");

        Assertions.assertSame(mirror, injector.getInstance(BranchMirror.class));
        Assertions.assertFalse(summary.isSaved());
        Assertions.assertTrue(store.getSaved().isEmpty());
    }

    @Test
    public void testSourceLanguageLabelIsRequired() {
        AbstractModule withoutLabel = new AbstractModule() {
            @Override
            protected void configure() {
                bind(DocumentStore.class).toInstance(store);
                bind(TextTransformer.class).toInstance(new RecordingTextTransformer());
            }
        };

        Assertions.assertThrows(CreationException.class, () -> Guice.createInjector(new MirrorModule(), withoutLabel));
    }
}

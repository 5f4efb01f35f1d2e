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

import com.danielgmyers.mirror.BranchMirror;
import com.danielgmyers.mirror.MirrorConfig;
import com.danielgmyers.mirror.store.DocumentStore;
import com.danielgmyers.mirror.text.TextTransformer;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * Usage: When setting up your Guice injection context,
 * create a MirrorModule object and pass it to either Guice.createInjector()
 * or to install() while creating another Module.
 *
 * The injection context must provide a DocumentStore, a TextTransformer and a @SourceLanguageLabel String.
 */
public class MirrorModule extends AbstractModule {

    /**
     * Creates a MirrorConfig from configuration in the Guice context.
     */
    @Provides
    @Singleton
    public MirrorConfig getMirrorConfig(@SourceLanguageLabel String sourceLanguageLabel,
                                        MirrorOptionalConfigHolder optionalConfigHolder) {
        MirrorConfig config = new MirrorConfig();
        config.setSourceLanguageLabel(sourceLanguageLabel);
        if (optionalConfigHolder.getLanguageMap() != null) {
            config.setLanguageMap(optionalConfigHolder.getLanguageMap());
        }
        if (optionalConfigHolder.getDryRun() != null) {
            config.setDryRun(optionalConfigHolder.getDryRun());
        }
        if (optionalConfigHolder.getChoiceFieldName() != null) {
            config.setChoiceFieldName(optionalConfigHolder.getChoiceFieldName());
        }
        if (optionalConfigHolder.getChoicePageDataName() != null) {
            config.setChoicePageDataName(optionalConfigHolder.getChoicePageDataName());
        }
        if (optionalConfigHolder.getTerminalTemplateId() != null) {
            config.setTerminalTemplateId(optionalConfigHolder.getTerminalTemplateId());
        }
        if (optionalConfigHolder.getSubChoiceTemplateId() != null) {
            config.setSubChoiceTemplateId(optionalConfigHolder.getSubChoiceTemplateId());
        }
        return config;
    }

    /**
     * Creates a BranchMirror.
     */
    @Provides
    @Singleton
    public BranchMirror getBranchMirror(MirrorConfig mirrorConfig, DocumentStore documentStore,
                                        TextTransformer textTransformer) {
        return new BranchMirror(mirrorConfig, documentStore, textTransformer);
    }
}

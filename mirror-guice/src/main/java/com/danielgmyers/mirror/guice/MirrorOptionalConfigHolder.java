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

import com.google.inject.Inject;

/**
 * For internal use only - allows certain configurations to be optionally provided by users,
 * with default behavior if they're not provided.
 */
public class MirrorOptionalConfigHolder {

    private Map<String, String> languageMap = null;
    private Boolean dryRun = null;
    private String choiceFieldName = null;
    private String choicePageDataName = null;
    private String terminalTemplateId = null;
    private String subChoiceTemplateId = null;

    public Map<String, String> getLanguageMap() {
        return languageMap;
    }

    @Inject(optional = true)
    public void setLanguageMap(@LanguageMap Map<String, String> languageMap) {
        this.languageMap = languageMap;
    }

    public Boolean getDryRun() {
        return dryRun;
    }

    @Inject(optional = true)
    public void setDryRun(@DryRun Boolean dryRun) {
        this.dryRun = dryRun;
    }

    public String getChoiceFieldName() {
        return choiceFieldName;
    }

    @Inject(optional = true)
    public void setChoiceFieldName(@ChoiceFieldName String choiceFieldName) {
        this.choiceFieldName = choiceFieldName;
    }

    public String getChoicePageDataName() {
        return choicePageDataName;
    }

    @Inject(optional = true)
    public void setChoicePageDataName(@ChoicePageDataName String choicePageDataName) {
        this.choicePageDataName = choicePageDataName;
    }

    public String getTerminalTemplateId() {
        return terminalTemplateId;
    }

    @Inject(optional = true)
    public void setTerminalTemplateId(@TerminalTemplateId String terminalTemplateId) {
        this.terminalTemplateId = terminalTemplateId;
    }

    public String getSubChoiceTemplateId() {
        return subChoiceTemplateId;
    }

    @Inject(optional = true)
    public void setSubChoiceTemplateId(@SubChoiceTemplateId String subChoiceTemplateId) {
        this.subChoiceTemplateId = subChoiceTemplateId;
    }
}

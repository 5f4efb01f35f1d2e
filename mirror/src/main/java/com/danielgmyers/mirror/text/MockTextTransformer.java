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

package com.danielgmyers.mirror.text;

/**
 * Marks text with its target locale ("[es] Hello") instead of translating it. Used for dry runs.
 */
public class MockTextTransformer implements TextTransformer {

    @Override
    public String transform(String text, String targetLocale) {
        return "[" + targetLocale + "] " + text;
    }

    @Override
    public boolean isMarkingOnly() {
        return true;
    }
}

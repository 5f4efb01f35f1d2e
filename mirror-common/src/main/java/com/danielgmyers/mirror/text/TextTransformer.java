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
 * Rewrites a piece of visitor-facing text for a target locale, typically by calling a translation service.
 */
public interface TextTransformer {

    /**
     * Transforms the text. Implementations may throw {@link TextTransformException} on failure;
     * callers keep the original text in that case.
     * @param text         Non-empty text, with placeholder tokens already swapped out.
     * @param targetLocale A locale code such as "es" or "pt-BR".
     */
    String transform(String text, String targetLocale);

    /**
     * True for transformers that only mark text instead of translating it. Real transformers strip such
     * markers from text left behind by earlier marking runs.
     */
    default boolean isMarkingOnly() {
        return false;
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

import com.danielgmyers.mirror.text.TextTransformer;

/**
 * TextTransformer for unit tests which records every request.
 *
 * By default it prefixes the text with the locale and a colon ("es:Hello").
 */
public class RecordingTextTransformer implements TextTransformer {

    /**
     * A single transform request.
     */
    public static final class Request {
        private final String text;
        private final String locale;

        Request(String text, String locale) {
            this.text = text;
            this.locale = locale;
        }

        public String getText() {
            return text;
        }

        public String getLocale() {
            return locale;
        }

        @Override
        public String toString() {
            return locale + ":" + text;
        }
    }

    private final List<Request> requests = new ArrayList<>();
    private final BiFunction<String, String, String> translation;

    public RecordingTextTransformer() {
        this((text, locale) -> locale + ":" + text);
    }

    public RecordingTextTransformer(BiFunction<String, String, String> translation) {
        this.translation = translation;
    }

    @Override
    public String transform(String text, String targetLocale) {
        requests.add(new Request(text, targetLocale));
        return translation.apply(text, targetLocale);
    }

    public List<Request> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    public List<String> getRequestedTexts() {
        List<String> texts = new ArrayList<>();
        for (Request request : requests) {
            texts.add(request.getText());
        }
        return texts;
    }

    public void reset() {
        requests.clear();
    }
}

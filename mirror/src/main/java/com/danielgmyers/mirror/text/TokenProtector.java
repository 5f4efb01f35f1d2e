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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps placeholder tokens ({{name}}, %NAME%, #name#) for numbered markers so a transformer can't alter them.
 */
public final class TokenProtector {

    private static final List<Pattern> TOKEN_PATTERNS = List.of(
            Pattern.compile("\\{\\{[^}]+\\}\\}"),
            Pattern.compile("%[A-Za-z0-9_]+%"),
            Pattern.compile("#[^#]+#"));

    private static final Pattern ONLY_MARKERS = Pattern.compile("(\\[\\[T\\d+\\]\\])+");

    private static final Pattern LEADING_LOCALE_MARKER = Pattern.compile("^\\[([A-Za-z]{2}(?:-[A-Za-z]{2})?)\\]\\s+");

    private TokenProtector() {}

    /**
     * Text with its tokens replaced by [[T0]], [[T1]], ... markers, numbered in replacement order.
     */
    public static final class ProtectedText {
        private final String text;
        private final Map<String, String> tokens;

        private ProtectedText(String text, Map<String, String> tokens) {
            this.text = text;
            this.tokens = Collections.unmodifiableMap(tokens);
        }

        public String getText() {
            return text;
        }

        public Map<String, String> getTokens() {
            return tokens;
        }

        /**
         * Puts the original tokens back into the (transformed) text.
         */
        public String restore(String transformed) {
            String restored = transformed;
            for (Map.Entry<String, String> token : tokens.entrySet()) {
                restored = restored.replace(token.getKey(), token.getValue());
            }
            return restored;
        }
    }

    public static ProtectedText protect(String text) {
        Map<String, String> tokens = new LinkedHashMap<>();
        String sanitized = text;
        for (Pattern pattern : TOKEN_PATTERNS) {
            Matcher matcher = pattern.matcher(sanitized);
            StringBuilder out = new StringBuilder();
            while (matcher.find()) {
                String marker = "[[T" + tokens.size() + "]]";
                tokens.put(marker, matcher.group());
                matcher.appendReplacement(out, Matcher.quoteReplacement(marker));
            }
            matcher.appendTail(out);
            sanitized = out.toString();
        }
        return new ProtectedText(sanitized, tokens);
    }

    /**
     * True if the text is blank, or holds nothing but tokens and whitespace.
     */
    public static boolean isOnlyTokensOrWhitespace(String text) {
        if (text.isBlank()) {
            return true;
        }
        String leftover = protect(text).getText().replace(" ", "").replace("\n", "");
        return ONLY_MARKERS.matcher(leftover).matches();
    }

    /**
     * Removes a leading "[xx] " or "[xx-YY] " marker left by a marking-only run, but only when it names
     * the target locale (case-insensitive).
     */
    public static String stripLocaleMarker(String text, String targetLocale) {
        Matcher matcher = LEADING_LOCALE_MARKER.matcher(text);
        if (matcher.find() && matcher.group(1).equalsIgnoreCase(targetLocale)) {
            return text.substring(matcher.end());
        }
        return text;
    }
}

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

import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TokenProtectorTest {

    @Test
    public void testProtectReplacesEachTokenKind() {
        TokenProtector.ProtectedText text = TokenProtector.protect("Hi {{first_name}}, host %HOST% at #site#");

        Assertions.assertEquals("Hi [[T0]], host [[T1]] at [[T2]]", text.getText());
        Assertions.assertEquals(Map.of("[[T0]]", "{{first_name}}", "[[T1]]", "%HOST%", "[[T2]]", "#site#"),
                                text.getTokens());
    }

    @Test
    public void testRestorePutsTokensBackAfterTransformation() {
        TokenProtector.ProtectedText text = TokenProtector.protect("Bonjour {{name}}");

        Assertions.assertEquals("Hola {{name}}", text.restore("Hola [[T0]]"));
    }

    @Test
    public void testProtectLeavesPlainTextAlone() {
        TokenProtector.ProtectedText text = TokenProtector.protect("50% off $5");

        Assertions.assertEquals("50% off $5", text.getText());
        Assertions.assertTrue(text.getTokens().isEmpty());
    }

    @Test
    public void testIsOnlyTokensOrWhitespace() {
        Assertions.assertTrue(TokenProtector.isOnlyTokensOrWhitespace("  "));
        Assertions.assertTrue(TokenProtector.isOnlyTokensOrWhitespace("{{a}} %B%\n#c#"));
        Assertions.assertFalse(TokenProtector.isOnlyTokensOrWhitespace("{{a}} and"));
    }

    @Test
    public void testStripLocaleMarkerOnlyStripsTheTargetLocale() {
        Assertions.assertEquals("Hello", TokenProtector.stripLocaleMarker("[es] Hello", "es"));
        Assertions.assertEquals("Hello", TokenProtector.stripLocaleMarker("[PT-br] Hello", "pt-BR"));
        Assertions.assertEquals("[fr] Hello", TokenProtector.stripLocaleMarker("[fr] Hello", "es"));
        Assertions.assertEquals("[es]Hello", TokenProtector.stripLocaleMarker("[es]Hello", "es"));
    }
}

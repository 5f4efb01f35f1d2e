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

package com.danielgmyers.mirror.routing;

import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LocaleResolverTest {

    @Test
    public void testResolvePrefersExplicitMapping() {
        LocaleResolver resolver = new LocaleResolver(Map.of("Spanish", "es-MX"));

        Assertions.assertEquals("es-MX", resolver.resolve("Spanish"));
    }

    @Test
    public void testResolveKnowsLanguageNamesAndEndonyms() {
        LocaleResolver resolver = new LocaleResolver(Map.of());

        Assertions.assertEquals("es", resolver.resolve("Español"));
        Assertions.assertEquals("fr-CA", resolver.resolve("Canadian French"));
        Assertions.assertEquals("pt-BR", resolver.resolve(" brazilian portuguese "));
        Assertions.assertEquals("de", resolver.resolve("Deutsch"));
        Assertions.assertEquals("ja", resolver.resolve("日本語"));
        Assertions.assertEquals("fil", resolver.resolve("Tagalog"));
    }

    @Test
    public void testResolveFallsBackToFirstTwoLetters() {
        LocaleResolver resolver = new LocaleResolver(Map.of());

        Assertions.assertEquals("kl", resolver.resolve("Klingon"));
    }

    @Test
    public void testResolveNullForShortOrBlankLabels() {
        LocaleResolver resolver = new LocaleResolver(Map.of());

        Assertions.assertNull(resolver.resolve("Z"));
        Assertions.assertNull(resolver.resolve("  "));
        Assertions.assertNull(resolver.resolve(null));
    }

    @Test
    public void testResolveCountsSupplementaryCharactersAsSingleLetters() {
        LocaleResolver resolver = new LocaleResolver(Map.of());

        Assertions.assertEquals("\uD835\uDD04\uD835\uDD05", resolver.resolve("\uD835\uDD04\uD835\uDD05\uD835\uDD06"));
        Assertions.assertEquals("\uD83D\uDE00x", resolver.resolve("\uD83D\uDE00xy"));
        Assertions.assertNull(resolver.resolve("\uD83D\uDE00"));
    }

    @Test
    public void testExplicitMappingIsCaseSensitive() {
        LocaleResolver resolver = new LocaleResolver(Map.of("spanish", "es-MX"));

        Assertions.assertEquals("es", resolver.resolve("Spanish"));
    }

    @Test
    public void testLanguageNamesAreLoaded() {
        Assertions.assertTrue(LocaleResolver.getLanguageNames().size() > 200);
        Assertions.assertEquals("en", LocaleResolver.getLanguageNames().get("english"));
    }
}

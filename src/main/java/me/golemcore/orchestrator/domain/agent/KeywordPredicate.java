/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.orchestrator.domain.agent;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive match against a fixed keyword list. A keyword must start at
 * a word boundary but may be followed by an inflection, so "stock" also
 * matches "stocks". Keywords may be phrases.
 */
final class KeywordPredicate {

    private final Pattern pattern;

    private KeywordPredicate(Pattern pattern) {
        this.pattern = pattern;
    }

    static KeywordPredicate of(List<String> keywords) {
        String alternatives = keywords.stream()
                .map(keyword -> Pattern.quote(keyword.toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining("|"));
        return new KeywordPredicate(Pattern.compile("\\b(?:" + alternatives + ")"));
    }

    boolean matches(String text) {
        return text != null && pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }
}

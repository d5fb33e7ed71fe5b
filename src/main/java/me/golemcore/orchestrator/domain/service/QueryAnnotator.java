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

package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.Sentiment;
import me.golemcore.orchestrator.domain.model.Topic;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword-based annotation of query text: topics, sentiment and a complexity
 * score.
 *
 * <p>
 * Single-word keywords match any word they prefix, so inflected forms count;
 * multi-word keywords match as phrases.
 */
@Component
public class QueryAnnotator {

    private static final Map<Topic, List<String>> TOPIC_KEYWORDS = new EnumMap<>(Topic.class);

    static {
        TOPIC_KEYWORDS.put(Topic.TECHNOLOGY,
                List.of("ai", "machine learning", "python", "data", "programming", "technology"));
        TOPIC_KEYWORDS.put(Topic.BUSINESS,
                List.of("market", "stock", "finance", "business", "economy", "investment"));
        TOPIC_KEYWORDS.put(Topic.CREATIVE,
                List.of("story", "creative", "write", "art", "design", "poem"));
    }

    private static final List<String> POSITIVE_WORDS = List.of(
            "good", "great", "excellent", "amazing", "love", "like", "awesome");
    private static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "terrible", "hate", "awful", "worst", "horrible");
    private static final List<String> TECHNICAL_TERMS = List.of(
            "analyze", "compare", "explain", "implement", "algorithm", "optimize");

    static final int MAX_COMPLEXITY = 10;
    private static final int LONG_QUERY_CHARS = 100;
    private static final int MEDIUM_QUERY_CHARS = 50;
    private static final int MAX_QUESTION_MARKS = 3;

    public Set<Topic> topics(String text) {
        String normalized = normalize(text);
        Set<String> words = words(normalized);
        Set<Topic> topics = EnumSet.noneOf(Topic.class);
        TOPIC_KEYWORDS.forEach((topic, keywords) -> {
            if (keywords.stream().anyMatch(keyword -> matches(keyword, normalized, words))) {
                topics.add(topic);
            }
        });
        if (topics.isEmpty()) {
            topics.add(Topic.GENERAL);
        }
        return topics;
    }

    public Sentiment sentiment(String text) {
        String normalized = normalize(text);
        Set<String> words = words(normalized);
        long positive = POSITIVE_WORDS.stream().filter(word -> matches(word, normalized, words)).count();
        long negative = NEGATIVE_WORDS.stream().filter(word -> matches(word, normalized, words)).count();
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }

    /**
     * Base 1, plus 2 for text over 100 characters (1 over 50), plus one per
     * technical term present, plus up to 3 for question marks; capped at 10.
     */
    public int complexity(String text) {
        if (text == null) {
            return 1;
        }
        int score = 1;
        if (text.length() > LONG_QUERY_CHARS) {
            score += 2;
        } else if (text.length() > MEDIUM_QUERY_CHARS) {
            score += 1;
        }
        String normalized = normalize(text);
        Set<String> words = words(normalized);
        score += (int) TECHNICAL_TERMS.stream().filter(term -> matches(term, normalized, words)).count();
        long questionMarks = text.chars().filter(ch -> ch == '?').count();
        score += (int) Math.min(MAX_QUESTION_MARKS, questionMarks);
        return Math.min(MAX_COMPLEXITY, score);
    }

    private static boolean matches(String keyword, String normalized, Set<String> words) {
        if (keyword.indexOf(' ') >= 0) {
            return normalized.contains(keyword);
        }
        return words.stream().anyMatch(word -> word.startsWith(keyword));
    }

    static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    static Set<String> words(String normalized) {
        return Arrays.stream(normalized.split("[^\\p{L}\\p{N}]+"))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toSet());
    }
}

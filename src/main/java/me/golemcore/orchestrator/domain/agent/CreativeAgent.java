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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.UserContext;
import me.golemcore.orchestrator.domain.service.LlmCompletionService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creative specialist: stories, poems, articles and idea lists.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CreativeAgent implements SpecialistAgent {

    static final String NAME = "CreativeAgent";
    static final String GENERATION_UNAVAILABLE = "I'm having trouble generating creative content right now. "
            + "Please try again in a moment.";

    private static final KeywordPredicate CAPABILITY = KeywordPredicate.of(List.of(
            "write", "create", "generate", "compose", "draft", "brainstorm", "ideas", "creative", "story", "poem",
            "article"));
    private static final KeywordPredicate STORY = KeywordPredicate.of(List.of("story"));
    private static final KeywordPredicate POETRY = KeywordPredicate.of(List.of("poem", "poetry"));
    private static final KeywordPredicate ARTICLE = KeywordPredicate.of(List.of("article", "blog"));
    private static final KeywordPredicate LIST = KeywordPredicate.of(List.of("ideas", "list", "brainstorm"));

    private final LlmCompletionService completionService;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean canHandle(String query) {
        return CAPABILITY.matches(query);
    }

    @Override
    public Map<String, Object> process(String query, UserContext context) {
        String contentType = contentType(query);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent", NAME);
        payload.put("content_type", contentType);
        payload.put("creative_content", generate(query, contentType));
        return payload;
    }

    static String contentType(String query) {
        if (STORY.matches(query)) {
            return "story";
        }
        if (POETRY.matches(query)) {
            return "poetry";
        }
        if (ARTICLE.matches(query)) {
            return "article";
        }
        if (LIST.matches(query)) {
            return "list";
        }
        return "general_creative";
    }

    private String generate(String query, String contentType) {
        try {
            String prompt = "Create " + contentType.replace('_', ' ') + " content for this request: " + query
                    + "\nBe original and engaging, and match the requested format.";
            String content = completionService.completeSmart(List.of(Message.user(prompt)), 0.8, 800);
            return content.isBlank() ? GENERATION_UNAVAILABLE : content;
        } catch (Exception e) { // NOSONAR
            log.warn("[Specialist] Creative generation failed: {}", e.getMessage());
            return GENERATION_UNAVAILABLE;
        }
    }
}

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ProactiveSuggestion;
import me.golemcore.orchestrator.domain.model.UserContext;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rewrites a draft answer for the user: tone and length follow their context,
 * and a proactive suggestion may be woven in. On any failure the draft is
 * returned unchanged and marked as not personalized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersonalizationService {

    private static final String SYSTEM_PROMPT = """
            You adapt answers to a specific user. Keep every fact of the original answer.
            Adjust tone, structure and length to the user's context. If a suggestion fits
            naturally, mention it briefly at the end. Return only the adapted answer.
            """;

    private final LlmCompletionService completionService;
    private final ObjectMapper objectMapper;

    public record PersonalizedResponse(String response, boolean applied) {
    }

    public PersonalizedResponse personalize(String draft, String query, UserContext context,
            List<ProactiveSuggestion> suggestions) {
        try {
            String contextJson = objectMapper.writeValueAsString(
                    context != null ? context.toPromptMap() : UserContext.forNewUser().toPromptMap());
            String suggestionsJson = objectMapper.writeValueAsString(suggestions != null ? suggestions : List.of());
            String prompt = "User query: " + query
                    + "\n\nUser context: " + contextJson
                    + "\n\nProactive suggestions: " + suggestionsJson
                    + "\n\nOriginal answer:\n" + draft;

            String adapted = completionService.completeSmart(
                    List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)), 0.7, 1200);
            if (adapted.isBlank()) {
                log.warn("[Personalization] Empty rewrite, keeping draft");
                return new PersonalizedResponse(draft, false);
            }
            return new PersonalizedResponse(adapted, true);
        } catch (Exception e) { // NOSONAR
            log.warn("[Personalization] Failed, keeping draft: {}", e.getMessage());
            return new PersonalizedResponse(draft, false);
        }
    }
}

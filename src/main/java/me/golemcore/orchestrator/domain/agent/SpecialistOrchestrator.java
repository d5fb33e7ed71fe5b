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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.SpecialistPathException;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.SpecialistResult;
import me.golemcore.orchestrator.domain.model.UserContext;
import me.golemcore.orchestrator.domain.service.LlmCompletionService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the first specialist whose capability predicate accepts the query,
 * runs it, and synthesizes its structured payload into prose.
 *
 * <p>
 * Agents are tried in a fixed priority order: research, analysis, creative. No
 * matching agent is a normal outcome and returns an empty result. Everything
 * else that goes wrong is raised as {@link SpecialistPathException}.
 */
@Service
@Slf4j
public class SpecialistOrchestrator {

    private static final String SYNTHESIS_SYSTEM_PROMPT = """
            You are the lead of a team of specialist agents. Turn the specialist's structured findings \
            into one clear, well-organized answer for the user. Use only the information provided, \
            do not include raw URLs, and say so plainly when the findings are incomplete.""";

    private final List<SpecialistAgent> agents;
    private final LlmCompletionService completionService;
    private final ObjectMapper objectMapper;

    public SpecialistOrchestrator(ResearchAgent researchAgent, AnalysisAgent analysisAgent,
            CreativeAgent creativeAgent, LlmCompletionService completionService, ObjectMapper objectMapper) {
        this(List.of(researchAgent, analysisAgent, creativeAgent), completionService, objectMapper);
    }

    SpecialistOrchestrator(List<SpecialistAgent> agents, LlmCompletionService completionService,
            ObjectMapper objectMapper) {
        this.agents = List.copyOf(agents);
        this.completionService = completionService;
        this.objectMapper = objectMapper;
    }

    public Optional<SpecialistAgent> select(String query) {
        return agents.stream()
                .filter(SpecialistAgent::isEnabled)
                .filter(agent -> agent.canHandle(query))
                .findFirst();
    }

    /**
     * Runs the specialist path end to end.
     *
     * @return the synthesized result, or empty when no agent accepts the query
     * @throws SpecialistPathException
     *             if the selected agent or the synthesis call fails
     */
    public Optional<SpecialistResult> process(String query, UserContext context) {
        Optional<SpecialistAgent> selected = select(query);
        if (selected.isEmpty()) {
            log.debug("[Specialist] No suitable specialist agent found");
            return Optional.empty();
        }
        SpecialistAgent agent = selected.get();
        log.info("[Specialist] Selected {}", agent.getName());
        try {
            Map<String, Object> payload = agent.process(query, context);
            String content = synthesize(query, agent.getName(), payload);
            return Optional.of(SpecialistResult.builder()
                    .agentName(agent.getName())
                    .structuredPayload(payload)
                    .content(content)
                    .build());
        } catch (SpecialistPathException e) {
            throw e;
        } catch (Exception e) { // NOSONAR - every failure here routes to the fallback path
            throw new SpecialistPathException(agent.getName() + " failed: " + e.getMessage(), e);
        }
    }

    private String synthesize(String query, String agentName, Map<String, Object> payload)
            throws JsonProcessingException {
        String userPrompt = "User query: " + query
                + "\nSpecialist: " + agentName
                + "\nFindings: " + objectMapper.writeValueAsString(payload);
        String content = completionService.completeSmart(
                List.of(Message.system(SYNTHESIS_SYSTEM_PROMPT), Message.user(userPrompt)), 0.7, 1000);
        if (content.isBlank()) {
            throw new SpecialistPathException("Specialist synthesis returned empty content");
        }
        return content;
    }
}

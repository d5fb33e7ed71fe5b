package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.exception.ExternalServiceException;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.UserContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PersonalizationServiceTest {

    private LlmCompletionService completionService;
    private PersonalizationService service;

    @BeforeEach
    void setUp() {
        completionService = mock(LlmCompletionService.class);
        service = new PersonalizationService(completionService, new ObjectMapper());
    }

    @Test
    void shouldApplyRewrite() {
        when(completionService.completeSmart(anyList(), anyDouble(), anyInt())).thenReturn("Friendly answer");

        PersonalizationService.PersonalizedResponse result = service.personalize("Draft", "what is AI?",
                UserContext.forNewUser(), List.of());

        assertEquals("Friendly answer", result.response());
        assertTrue(result.applied());
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldIncludeDraftAndQueryInPrompt() {
        when(completionService.completeSmart(anyList(), anyDouble(), anyInt())).thenReturn("ok");

        service.personalize("Draft text", "explain rust", null, null);

        ArgumentCaptor<List<Message>> captor = ArgumentCaptor.forClass(List.class);
        verify(completionService).completeSmart(captor.capture(), anyDouble(), anyInt());
        String prompt = captor.getValue().get(1).getContent();
        assertTrue(prompt.contains("explain rust"));
        assertTrue(prompt.contains("Draft text"));
        assertTrue(prompt.contains("new_user"));
    }

    @Test
    void shouldKeepDraftOnBlankRewrite() {
        when(completionService.completeSmart(anyList(), anyDouble(), anyInt())).thenReturn("  ");

        PersonalizationService.PersonalizedResponse result = service.personalize("Draft", "q",
                UserContext.forNewUser(), List.of());

        assertEquals("Draft", result.response());
        assertFalse(result.applied());
    }

    @Test
    void shouldKeepDraftOnFailure() {
        when(completionService.completeSmart(anyList(), anyDouble(), anyInt()))
                .thenThrow(new ExternalServiceException("LLM call timed out"));

        PersonalizationService.PersonalizedResponse result = service.personalize("Draft", "q",
                UserContext.forNewUser(), List.of());

        assertEquals("Draft", result.response());
        assertFalse(result.applied());
    }
}

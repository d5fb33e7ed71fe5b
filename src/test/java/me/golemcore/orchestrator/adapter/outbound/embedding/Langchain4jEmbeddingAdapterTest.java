package me.golemcore.orchestrator.adapter.outbound.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jEmbeddingAdapterTest {

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getEmbedding().setApiKey("");
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertFalse(adapter.isAvailable());
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> adapter.embed("hello").join());
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    void shouldBuildModelWhenKeyConfigured() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getEmbedding().setApiKey("test-key");
        properties.getEmbedding().setBaseUrl("http://embeddings.test/v1");

        assertTrue(new Langchain4jEmbeddingAdapter(properties).isAvailable());
    }

    @Test
    void shouldEmbedOnDedicatedThreads() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new OrchestratorProperties());
        EmbeddingModel model = mock(EmbeddingModel.class);
        AtomicReference<String> callingThread = new AtomicReference<>();
        when(model.embed("hello")).thenAnswer(invocation -> {
            callingThread.set(Thread.currentThread().getName());
            return Response.from(Embedding.from(new float[] { 0.5f, 0.25f }));
        });
        ReflectionTestUtils.setField(adapter, "model", Optional.of(model));

        float[] vector = adapter.embed("hello").join();

        assertEquals(2, vector.length);
        assertEquals("embedding-call", callingThread.get());
    }

    @Test
    void shouldFallBackToDefaultModelName() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getEmbedding().setModel(" ");

        assertEquals("text-embedding-3-small", new Langchain4jEmbeddingAdapter(properties).getModel());
    }
}

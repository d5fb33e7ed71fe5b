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

package me.golemcore.orchestrator.adapter.outbound.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.ExternalServiceException;
import me.golemcore.orchestrator.domain.service.ExternalCalls;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.EmbeddingPort;
import me.golemcore.orchestrator.port.outbound.MemoryStorePort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Durable conversation memory on a Chroma server, over its HTTP API.
 *
 * <p>
 * Vectors are computed client-side through {@link EmbeddingPort}. The
 * collection is resolved once by name (created when missing) and its id is
 * cached. Every operation runs asynchronously and fails its future on any HTTP
 * or parsing error; callers decide how to degrade.
 */
@Component
@Slf4j
public class ChromaMemoryAdapter implements MemoryStorePort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_PREFIX = "/api/v1/collections";
    private static final String META_USER_ID = "user_id";

    private static final ExecutorService MEMORY_EXECUTOR = Executors.newFixedThreadPool(4,
            r -> {
                Thread t = new Thread(r, "chroma-memory");
                t.setDaemon(true);
                return t;
            });

    private final OrchestratorProperties properties;
    private final EmbeddingPort embeddingPort;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    private volatile String collectionId;

    public ChromaMemoryAdapter(OrchestratorProperties properties, EmbeddingPort embeddingPort,
            OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.embeddingPort = embeddingPort;
        this.objectMapper = objectMapper;

        long timeoutMs = properties.getMemory().getDurable().getTimeoutMs();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return properties.getMemory().getDurable().isEnabled();
    }

    @Override
    public CompletableFuture<Void> add(String document, Map<String, Object> metadata, String id) {
        return CompletableFuture.runAsync(() -> {
            float[] embedding = embed(document);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("ids", List.of(id));
            body.put("embeddings", List.of(embedding));
            body.put("documents", List.of(document));
            body.put("metadatas", List.of(metadata));
            post(collectionPath() + "/add", body);
            log.debug("[Memory] Stored document {}", id);
        }, MEMORY_EXECUTOR);
    }

    @Override
    public CompletableFuture<List<String>> query(String text, int n, String userId) {
        return CompletableFuture.supplyAsync(() -> {
            float[] embedding = embed(text);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("query_embeddings", List.of(embedding));
            body.put("n_results", n);
            body.put("where", Map.of(META_USER_ID, userId));
            body.put("include", List.of("documents"));
            JsonNode response = post(collectionPath() + "/query", body);

            List<String> documents = new ArrayList<>();
            JsonNode batches = response.path("documents");
            if (batches.isArray() && !batches.isEmpty()) {
                for (JsonNode document : batches.get(0)) {
                    if (!document.isNull()) {
                        documents.add(document.asText());
                    }
                }
            }
            return documents;
        }, MEMORY_EXECUTOR);
    }

    @Override
    public CompletableFuture<List<StoredDocument>> get(String userId) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("where", Map.of(META_USER_ID, userId));
            body.put("include", List.of("documents", "metadatas"));
            JsonNode response = post(collectionPath() + "/get", body);
            return parseStoredDocuments(response);
        }, MEMORY_EXECUTOR);
    }

    List<StoredDocument> parseStoredDocuments(JsonNode response) {
        JsonNode documents = response.path("documents");
        JsonNode metadatas = response.path("metadatas");
        List<StoredDocument> result = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            JsonNode document = documents.get(i);
            if (document == null || document.isNull()) {
                continue;
            }
            JsonNode metadataNode = metadatas.path(i);
            Map<String, Object> metadata = metadataNode.isObject()
                    ? objectMapper.convertValue(metadataNode, new TypeReference<Map<String, Object>>() {
                    })
                    : Map.of();
            result.add(new StoredDocument(document.asText(), metadata));
        }
        return result;
    }

    private float[] embed(String text) {
        return ExternalCalls.await(embeddingPort.embed(text), properties.getMemory().getDurable().getTimeoutMs(),
                "Embedding");
    }

    private String collectionPath() {
        String id = collectionId;
        if (id == null) {
            synchronized (this) {
                if (collectionId == null) {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("name", properties.getMemory().getDurable().getCollection());
                    body.put("get_or_create", true);
                    JsonNode response = post(API_PREFIX, body);
                    String resolved = response.path("id").asText(null);
                    if (resolved == null || resolved.isBlank()) {
                        throw new ExternalServiceException("Chroma returned no collection id");
                    }
                    collectionId = resolved;
                    log.info("[Memory] Using Chroma collection {} ({})",
                            properties.getMemory().getDurable().getCollection(), resolved);
                }
                id = collectionId;
            }
        }
        return API_PREFIX + "/" + id;
    }

    private JsonNode post(String path, Map<String, Object> body) {
        try {
            String url = properties.getMemory().getDurable().getBaseUrl() + path;
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    throw new ExternalServiceException("Chroma request " + path + " failed: HTTP " + response.code());
                }
                return objectMapper.readTree(responseBody.string());
            }
        } catch (IOException e) {
            throw new ExternalServiceException("Chroma request " + path + " failed: " + e.getMessage(), e);
        }
    }
}

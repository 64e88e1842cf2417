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

package me.golemcore.memory.adapter.outbound.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.TripleExtractionException;
import me.golemcore.memory.domain.model.ExtractedTriple;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.TripleExtractionPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM-backed triple extraction using a langchain4j {@link ChatModel}.
 *
 * <p>
 * The model is asked for a JSON document of facts. Parsing accepts a fenced
 * {@code ```json} block, a bare JSON array or object, or the whole response.
 * Individual entries missing a subject, predicate or object are skipped; a
 * response with no parseable JSON at all fails with
 * {@link TripleExtractionException}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.extraction.api-key} - OpenAI API key
 * <li>{@code memory.extraction.model} - chat model name
 * <li>{@code memory.extraction.timeout-seconds} - request timeout
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jTripleExtractionAdapter implements TripleExtractionPort {

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*([\\[{].*?[]}])\\s*```",
            Pattern.DOTALL);
    private static final Pattern RAW_JSON_PATTERN = Pattern.compile("([\\[{].*[]}])", Pattern.DOTALL);

    private static final String SYSTEM_PROMPT = """
            You extract durable knowledge from text as subject-predicate-object triples.

            ## Rules:
            1. Subjects and objects are short entity names or values. Keep the original casing.
            2. Predicates are short snake_case verbs ("works_at", "prefers", "located_in").
            3. For how-to knowledge use these predicates:
               - accomplished_by, alternatively_by, is_method_for: how a goal is achieved
               - requires, requires_prior: prerequisites
               - has_step, followed_by: ordered steps
               - example_usage: a concrete example; copy code or commands EXACTLY as written
               - enables: what a capability makes possible
            4. Add 1-3 lowercase topics per triple.
            5. For how-to knowledge set abstraction_level: 1 = atomic command, 2 = basic procedure, 3 = high-level workflow.
            6. Respond ONLY with valid JSON:

            {"triples": [{"subject": "...", "predicate": "...", "object": "...", "topics": ["..."], "abstraction_level": 1}]}
            """;

    private final MemoryProperties properties;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        MemoryProperties.ExtractionProperties config = properties.getExtraction();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Extraction] OpenAI API key not configured, triple extraction unavailable");
            initialized = true;
            return;
        }

        try {
            chatModel = OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(config.getModel())
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .build();
            log.info("[Extraction] Chat model initialized: {}", config.getModel());
        } catch (RuntimeException e) {
            log.error("[Extraction] Failed to initialize chat model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<List<ExtractedTriple>> extract(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ChatModel model = chatModel;
            if (model == null) {
                log.debug("[Extraction] Skipping extraction, model not available");
                return List.of();
            }
            if (text == null || text.isBlank()) {
                return List.of();
            }

            List<ChatMessage> messages = List.of(
                    SystemMessage.from(SYSTEM_PROMPT),
                    UserMessage.from("## Text:\n" + text + "\n\nExtract triples and respond with JSON only."));

            long startMs = System.currentTimeMillis();
            ChatResponse response = model.chat(messages);
            String content = response.aiMessage() != null ? response.aiMessage().text() : null;
            log.debug("[Extraction] LLM responded in {}ms", System.currentTimeMillis() - startMs);

            List<ExtractedTriple> triples = parseTriples(content);
            log.info("[Extraction] Extracted {} triple(s) from {} chars", triples.size(), text.length());
            return triples;
        });
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    List<ExtractedTriple> parseTriples(String response) {
        if (response == null || response.isBlank()) {
            throw new TripleExtractionException("Empty extraction response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(response));
        } catch (JsonProcessingException e) {
            throw new TripleExtractionException("Malformed extraction response: " + e.getOriginalMessage(), e);
        }

        JsonNode entries = root.isArray() ? root : root.path("triples");
        if (!entries.isArray()) {
            throw new TripleExtractionException("Extraction response has no triples array");
        }

        List<ExtractedTriple> result = new ArrayList<>();
        for (JsonNode entry : entries) {
            String subject = textOrNull(entry, "subject");
            String predicate = textOrNull(entry, "predicate");
            String object = textOrNull(entry, "object");
            if (subject == null || predicate == null || object == null) {
                log.debug("[Extraction] Skipping incomplete entry: {}", entry);
                continue;
            }

            List<String> topics = new ArrayList<>();
            for (JsonNode topic : entry.path("topics")) {
                if (topic.isTextual() && !topic.asText().isBlank()) {
                    topics.add(topic.asText().trim());
                }
            }

            Integer level = null;
            JsonNode levelNode = entry.path("abstraction_level");
            if (levelNode.canConvertToInt()) {
                int value = levelNode.asInt();
                if (value >= 1 && value <= 3) {
                    level = value;
                }
            }

            result.add(new ExtractedTriple(subject, predicate, object, topics, level));
        }
        return result;
    }

    private String extractJson(String response) {
        Matcher blockMatcher = JSON_BLOCK_PATTERN.matcher(response);
        if (blockMatcher.find()) {
            return blockMatcher.group(1);
        }

        Matcher rawMatcher = RAW_JSON_PATTERN.matcher(response);
        if (rawMatcher.find()) {
            return rawMatcher.group(1);
        }

        return response.trim();
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}

package me.golemcore.memory;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore memory engine.
 *
 * <p>
 * A personal associative memory for a conversational agent: it stores facts,
 * procedures, conversation episodes and goals, and serves similarity and
 * graph-based recall of them.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Triple Store</b> - subject/predicate/object facts with content-hash
 * identity, confidence merge and vector similarity search</li>
 * <li><b>Associative Retrieval</b> - multi-hop expansion with per-hop
 * confidence decay</li>
 * <li><b>Episodes</b> - session-scoped conversation logs linked to the facts
 * extracted from them</li>
 * <li><b>Goals</b> - dependency-aware status transitions and next-goal
 * suggestion</li>
 * <li><b>Consolidation</b> - idle-triggered triple extraction from buffered
 * conversation turns</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → TripleStore, Retriever, Episodes, Goals
 * Ports              → Storage, Embedding, VectorIndex, TripleExtraction
 * Infrastructure     → Local storage, langchain4j adapters, in-process index
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code memory.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryEngineApplication.class, args);
    }

}

package me.golemcore.memory.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the memory engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code memory.*} prefix. This class
 * contains nested property classes for each subsystem:
 * <ul>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link TripleProperties} - confidence defaults and decay</li>
 * <li>{@link RetrievalProperties} - hop expansion defaults</li>
 * <li>{@link EpisodeProperties} - episode lifecycle</li>
 * <li>{@link ConsolidationProperties} - idle-triggered triple extraction</li>
 * <li>{@link GoalProperties} - goal prompt selection</li>
 * <li>{@link EmbeddingProperties} and {@link ExtractionProperties} - model
 * providers</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private StorageProperties storage = new StorageProperties();
    private TripleProperties triples = new TripleProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private EpisodeProperties episodes = new EpisodeProperties();
    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private GoalProperties goals = new GoalProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private ExtractionProperties extraction = new ExtractionProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/memory";
    }

    @Data
    public static class TripleProperties {
        private double defaultConfidence = 0.8;
        private double decayHalfLifeDays = 30;
        private int defaultQueryLimit = 10;
    }

    @Data
    public static class RetrievalProperties {
        private double hopDecay = 0.7;
        private int defaultMaxHops = 2;
        private int defaultBranchingLimit = 10;
        private double defaultMinConfidence = 0.0;
        private int recallSeedLimit = 5;

        /**
         * Per-hop confidence discount, strictly between 0 and 1 so that farther
         * hops always weigh less.
         */
        public void setHopDecay(double hopDecay) {
            if (!(hopDecay > 0.0 && hopDecay < 1.0)) {
                throw new IllegalArgumentException("memory.retrieval.hop-decay must be in (0, 1), got " + hopDecay);
            }
            this.hopDecay = hopDecay;
        }
    }

    @Data
    public static class EpisodeProperties {
        private int finalizeThreshold = 50;
    }

    @Data
    public static class ConsolidationProperties {
        private boolean enabled = true;
        private int idleSeconds = 30;
        private int workerThreads = 2;
        private int minTextLength = 10;
    }

    @Data
    public static class GoalProperties {
        private int promptLimit = 5;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String model = "text-embedding-3-small";
        private int timeoutSeconds = 30;
    }

    @Data
    public static class ExtractionProperties {
        private String apiKey;
        private String model = "gpt-4o-mini";
        private int timeoutSeconds = 60;
    }
}

package me.golemcore.memory.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A stored subject/predicate/object fact with its confidence and provenance.
 *
 * <p>
 * The {@code id} is the content fingerprint of the normalized triple plus its
 * source, so the same fact observed twice from the same source maps to the same
 * record. The object is kept verbatim (code examples included); only identity
 * computation sees the normalized form.
 *
 * <p>
 * Goals are triples too: a primary {@code (owner, has_goal, description)}
 * triple carries a {@link GoalMetadata} payload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class KnowledgeTriple {

    private String id;
    private String subject;
    private String predicate;
    private String object;
    private double confidence;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    private String source;
    private String episodeId;
    private Integer abstractionLevel;
    private GoalMetadata goal;
}

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
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Metadata filter applied by the vector index before ranking. Every populated
 * field narrows the result; an empty filter matches everything.
 *
 * <p>
 * {@code topics} matches when the triple carries at least one of them.
 * {@code entity} matches the subject or the object; {@code subject} and
 * {@code object} match one side only. Entity comparison is exact on the
 * {@link EntityNames#normalize normalized} string.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class VectorFilter {

    @Builder.Default
    private Set<String> topics = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> predicates = new LinkedHashSet<>();

    private Double minConfidence;
    private String episodeId;
    private Instant createdFrom;
    private Instant createdTo;
    private String entity;
    private String subject;
    private String object;

    public static VectorFilter none() {
        return VectorFilter.builder().build();
    }

    public boolean matches(KnowledgeTriple triple) {
        if (triple == null) {
            return false;
        }
        if (topics != null && !topics.isEmpty() && !containsAny(triple.getTopics(), topics)) {
            return false;
        }
        if (predicates != null && !predicates.isEmpty() && !predicates.contains(triple.getPredicate())) {
            return false;
        }
        if (minConfidence != null && triple.getConfidence() < minConfidence) {
            return false;
        }
        if (episodeId != null && !episodeId.equals(triple.getEpisodeId())) {
            return false;
        }
        if (createdFrom != null && (triple.getCreatedAt() == null || triple.getCreatedAt().isBefore(createdFrom))) {
            return false;
        }
        if (createdTo != null && (triple.getCreatedAt() == null || triple.getCreatedAt().isAfter(createdTo))) {
            return false;
        }
        String normalizedObject = EntityNames.normalize(triple.getObject());
        if (entity != null && !entity.equals(triple.getSubject()) && !entity.equals(normalizedObject)) {
            return false;
        }
        if (subject != null && !subject.equals(triple.getSubject())) {
            return false;
        }
        return object == null || object.equals(normalizedObject);
    }

    private static boolean containsAny(Collection<String> values, Set<String> wanted) {
        if (values == null) {
            return false;
        }
        for (String value : values) {
            if (wanted.contains(value)) {
                return true;
            }
        }
        return false;
    }
}

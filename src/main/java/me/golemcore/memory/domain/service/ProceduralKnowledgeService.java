package me.golemcore.memory.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.ProcedureResult;
import me.golemcore.memory.domain.model.ReservedPredicate;
import me.golemcore.memory.domain.model.ScoredTriple;
import me.golemcore.memory.domain.model.TriplePredicate;
import me.golemcore.memory.domain.model.VectorFilter;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Looks up how-to knowledge for a goal among procedural triples and groups it
 * by role.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProceduralKnowledgeService {

    private final TripleStoreService tripleStoreService;

    public ProcedureResult queryProcedure(String goal, int limit, boolean includeAlternatives,
            boolean includeExamples, boolean includeDependencies) {
        Set<String> predicates = new LinkedHashSet<>();
        for (ReservedPredicate predicate : ReservedPredicate.values()) {
            if (predicate.isProcedural()) {
                predicates.add(predicate.predicateName());
            }
        }

        List<ScoredTriple> hits = tripleStoreService.query(goal, limit, VectorFilter.builder()
                .predicates(predicates)
                .topics(Set.of(TriplePredicate.PROCEDURE_TOPIC))
                .build());

        ProcedureResult result = ProcedureResult.builder().goal(goal).build();
        for (ScoredTriple hit : hits) {
            TriplePredicate predicate = TriplePredicate.of(hit.triple().getPredicate());
            if (predicate.reserved() == null) {
                continue;
            }
            switch (predicate.reserved()) {
                case ACCOMPLISHED_BY, IS_METHOD_FOR -> result.getMethods().add(hit);
                case ALTERNATIVELY_BY -> {
                    if (includeAlternatives) {
                        result.getAlternatives().add(hit);
                    }
                }
                case REQUIRES, REQUIRES_PRIOR, ENABLES -> {
                    if (includeDependencies) {
                        result.getDependencies().add(hit);
                    }
                }
                case HAS_STEP, FOLLOWED_BY -> result.getSteps().add(hit);
                case EXAMPLE_USAGE -> {
                    if (includeExamples) {
                        result.getExamples().add(hit);
                    }
                }
                default -> {
                    // goal predicates never carry the procedure topic
                }
            }
        }

        result.setTotalFound(result.getMethods().size() + result.getAlternatives().size()
                + result.getDependencies().size() + result.getSteps().size() + result.getExamples().size());
        log.debug("[Procedures] '{}' -> {} procedural triple(s)", goal, result.getTotalFound());
        return result;
    }
}

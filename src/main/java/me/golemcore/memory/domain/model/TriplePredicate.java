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

import java.util.Optional;

/**
 * A predicate as seen by the engine: either one of the
 * {@link ReservedPredicate reserved predicates} or an open-vocabulary string.
 * Business logic asks this type about procedural status and ranking weight
 * instead of comparing strings.
 */
public record TriplePredicate(String name, ReservedPredicate reserved) {

    public static final String PROCEDURE_TOPIC = "procedure";
    private static final double OPEN_WEIGHT = 1.0;

    public static TriplePredicate of(String raw) {
        Optional<ReservedPredicate> reserved = ReservedPredicate.fromName(raw);
        if (reserved.isPresent()) {
            return new TriplePredicate(reserved.get().predicateName(), reserved.get());
        }
        return new TriplePredicate(raw != null ? raw.trim() : "", null);
    }

    public static TriplePredicate of(ReservedPredicate reserved) {
        return new TriplePredicate(reserved.predicateName(), reserved);
    }

    public boolean isProcedural() {
        return reserved != null && reserved.isProcedural();
    }

    public double weight() {
        return reserved != null ? reserved.weight() : OPEN_WEIGHT;
    }
}

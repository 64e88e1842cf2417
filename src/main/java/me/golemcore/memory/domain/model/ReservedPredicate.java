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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Predicates with engine-level meaning. Procedural predicates mark how-to
 * knowledge and carry a ranking weight; goal predicates link goal triples.
 */
public enum ReservedPredicate {

    ACCOMPLISHED_BY("accomplished_by", true, 2.0),
    ALTERNATIVELY_BY("alternatively_by", true, 1.5),
    IS_METHOD_FOR("is_method_for", true, 1.5),
    REQUIRES("requires", true, 1.3),
    REQUIRES_PRIOR("requires_prior", true, 1.3),
    HAS_STEP("has_step", true, 1.3),
    FOLLOWED_BY("followed_by", true, 1.3),
    EXAMPLE_USAGE("example_usage", true, 1.2),
    ENABLES("enables", true, 1.2),

    HAS_GOAL("has_goal", false, 1.0),
    SUBGOAL_OF("subgoal_of", false, 1.0),
    DERIVED_FROM("derived_from", false, 1.0);

    private static final Map<String, ReservedPredicate> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ReservedPredicate::predicateName, Function.identity()));

    private final String predicateName;
    private final boolean procedural;
    private final double weight;

    ReservedPredicate(String predicateName, boolean procedural, double weight) {
        this.predicateName = predicateName;
        this.procedural = procedural;
        this.weight = weight;
    }

    public String predicateName() {
        return predicateName;
    }

    public boolean isProcedural() {
        return procedural;
    }

    public double weight() {
        return weight;
    }

    public static Optional<ReservedPredicate> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}

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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of associative expansion: every visited triple once, ordered by hop
 * and then decayed confidence, plus the entities reached.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Subgraph {

    @Builder.Default
    private List<String> seeds = new ArrayList<>();

    @Builder.Default
    private List<SubgraphEdge> edges = new ArrayList<>();

    @Builder.Default
    private Set<String> entities = new LinkedHashSet<>();

    private int hopsTraversed;

    public boolean isEmpty() {
        return edges.isEmpty();
    }
}

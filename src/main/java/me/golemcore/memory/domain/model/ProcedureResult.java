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
import java.util.List;

/**
 * How-to knowledge found for a goal, grouped by the role each procedural
 * predicate plays.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcedureResult {

    private String goal;

    @Builder.Default
    private List<ScoredTriple> methods = new ArrayList<>();

    @Builder.Default
    private List<ScoredTriple> alternatives = new ArrayList<>();

    @Builder.Default
    private List<ScoredTriple> dependencies = new ArrayList<>();

    @Builder.Default
    private List<ScoredTriple> steps = new ArrayList<>();

    @Builder.Default
    private List<ScoredTriple> examples = new ArrayList<>();

    private int totalFound;
}

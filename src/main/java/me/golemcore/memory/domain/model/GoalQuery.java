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

/**
 * Filter for goal listing. {@code activeOnly} restricts to pending, in-progress
 * and ongoing goals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GoalQuery {

    private String owner;
    private Goal.GoalStatus status;

    @Builder.Default
    private int minPriority = 1;

    @Builder.Default
    private int maxPriority = 5;

    private boolean activeOnly;

    @Builder.Default
    private int limit = 20;
}

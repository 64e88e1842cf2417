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
 * Goal fields persisted in the payload of a goal's primary triple.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GoalMetadata {

    private String owner;
    private Goal.GoalStatus status;
    private int priority;
    private Goal.GoalType goalType;
    private boolean foreverGoal;

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    private String parentGoal;
    private Instant created;
    private Instant updated;
    private Instant completed;
    private Instant targetDate;
    private String blockerReason;
    private String completionNotes;
}

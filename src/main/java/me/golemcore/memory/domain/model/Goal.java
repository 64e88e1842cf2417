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
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A goal as read back from its primary triple. The {@code description} is the
 * goal's identity: two goals with the same description are the same goal.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Goal {

    private String id;
    private String description;
    private String owner;
    private GoalStatus status;
    private int priority;
    private GoalType goalType;
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

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    public enum GoalStatus {
        PENDING, IN_PROGRESS, COMPLETED, BLOCKED, CANCELLED, ONGOING;

        private static final Set<GoalStatus> ACTIVE = EnumSet.of(PENDING, IN_PROGRESS, ONGOING);
        private static final Set<GoalStatus> SETTLED = EnumSet.of(COMPLETED, CANCELLED);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }

        /**
         * Whether a goal in this status no longer holds back goals depending on
         * it.
         */
        public boolean isSettled() {
            return SETTLED.contains(this);
        }

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum GoalType {
        STANDARD, INSTRUMENTAL, DERIVED
    }
}

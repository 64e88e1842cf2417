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
 * A session-scoped, time-ordered log of conversation turns.
 *
 * <p>
 * An episode is open until it is finalized, either explicitly with a summary or
 * automatically once it reaches the configured turn threshold. A session has at
 * most one open episode at a time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Episode {

    private String id;
    private String sessionId;

    @Builder.Default
    private List<MessageTurn> turns = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
    private boolean finalized;
    private Instant finalizedAt;
    private String summary;

    @Builder.Default
    private List<String> topics = new ArrayList<>();
}

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
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.GoalQuery;
import me.golemcore.memory.domain.model.GoalRequest;
import me.golemcore.memory.domain.model.GoalSuggestion;
import me.golemcore.memory.domain.model.ProcedureResult;
import me.golemcore.memory.domain.model.ScoredTriple;
import me.golemcore.memory.domain.model.Subgraph;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the surrounding agent. Each method is one operation of the
 * engine's public surface; transports (HTTP, tools) call these and nothing
 * below.
 */
@Service
@RequiredArgsConstructor
public class MemoryEngineService {

    private final SemanticIngestionService semanticIngestionService;
    private final TripleStoreService tripleStoreService;
    private final AssociativeRetrievalService associativeRetrievalService;
    private final EpisodicMemoryService episodicMemoryService;
    private final GoalService goalService;
    private final ProceduralKnowledgeService proceduralKnowledgeService;
    private final MemoryProperties properties;

    public int ingestText(String text, String source, String episodeId) {
        return semanticIngestionService.ingestText(text, source, episodeId);
    }

    /**
     * Similarity query; a non-positive {@code limit} means
     * {@code memory.triples.default-query-limit}.
     */
    public List<ScoredTriple> query(String text, int limit, VectorFilter filter) {
        int effectiveLimit = limit > 0 ? limit : properties.getTriples().getDefaultQueryLimit();
        return tripleStoreService.query(text, effectiveLimit, filter != null ? filter : VectorFilter.none());
    }

    public Subgraph expand(List<String> seedEntities, int maxHops) {
        return associativeRetrievalService.expand(seedEntities, maxHops);
    }

    public Subgraph recall(String text) {
        return associativeRetrievalService.recall(text, properties.getRetrieval().getDefaultMaxHops());
    }

    public String addTurn(String sessionId, String role, String content) {
        return episodicMemoryService.addMessageToEpisode(sessionId, role, content);
    }

    public List<Episode> recentEpisodes(String sessionId, int hours, int limit) {
        return episodicMemoryService.getRecentEpisodes(sessionId, hours, limit);
    }

    public List<Episode> searchEpisodes(String sessionId, String query, int limit) {
        return episodicMemoryService.searchEpisodes(sessionId, query, limit);
    }

    public Map<LocalDate, List<Episode>> timeline(String sessionId, int days) {
        return episodicMemoryService.timeline(sessionId, days);
    }

    public String createGoal(GoalRequest request) {
        return goalService.createGoal(request);
    }

    public boolean updateGoal(String description, Goal.GoalStatus status, String completionNotes) {
        return goalService.updateGoal(description, status, null, null, completionNotes);
    }

    public List<Goal> queryGoals(GoalQuery query) {
        return goalService.queryGoals(query);
    }

    public Optional<GoalSuggestion> suggestNextGoal(String owner) {
        return goalService.suggestNextGoal(owner);
    }

    public List<Goal> goalsForPrompt(String owner) {
        return goalService.getActiveGoalsForPrompt(owner, properties.getGoals().getPromptLimit());
    }

    public ProcedureResult queryProcedure(String goal, int limit) {
        return proceduralKnowledgeService.queryProcedure(goal, limit, true, true, true);
    }
}

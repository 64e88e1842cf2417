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
import me.golemcore.memory.domain.model.EntityNames;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.GoalMetadata;
import me.golemcore.memory.domain.model.GoalProgress;
import me.golemcore.memory.domain.model.GoalQuery;
import me.golemcore.memory.domain.model.GoalRequest;
import me.golemcore.memory.domain.model.GoalSuggestion;
import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.ReservedPredicate;
import me.golemcore.memory.domain.model.TripleCandidate;
import me.golemcore.memory.domain.model.VectorFilter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Goals stored as triples, with a dependency-aware status state machine and
 * next-goal suggestion.
 *
 * <p>
 * A goal is the primary triple {@code (owner, has_goal, description)} whose
 * payload carries the goal fields, plus {@code subgoal_of} and
 * {@code derived_from} relationship triples. The description is the goal's
 * identity.
 *
 * <p>
 * Status rules:
 * <ul>
 * <li>A forever goal is always {@code ongoing}; a completion request leaves it
 * ongoing and records why.</li>
 * <li>A completion request with unmet dependencies becomes {@code blocked} with
 * the unmet descriptions as blocker reason. A dependency is met when its goal
 * is completed or cancelled; an unknown dependency is unmet.</li>
 * </ul>
 * Updates to one goal are serialized on a per-description lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoalService {

    static final String GOAL_TOPIC = "goal";
    static final String GOAL_SOURCE = "goal_system";
    static final String DEFAULT_OWNER = "assistant";
    static final String FOREVER_GOAL_REASON = "Cannot complete a forever goal: it stays ongoing";
    static final String BLOCKED_PREFIX = "Blocked by pending dependencies: ";

    private static final int MIN_PRIORITY = 1;
    private static final int MAX_PRIORITY = 5;
    private static final int RECENT_COMPLETIONS = 5;
    private static final Comparator<Goal> BY_PRIORITY_THEN_CREATED = Comparator
            .comparingInt(Goal::getPriority).reversed()
            .thenComparing(Goal::getCreated, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TripleStoreService tripleStoreService;
    private final Clock clock;

    private final Map<String, Object> goalLocks = new ConcurrentHashMap<>();

    /**
     * Create a goal. An existing goal with the same description and owner is
     * returned as is.
     *
     * @return id of the goal's primary triple
     * @throws IllegalArgumentException
     *             for a blank description, a priority outside 1-5, a cyclic
     *             dependency, or a description already used by another owner
     * @throws IllegalStateException
     *             if the goal could not be persisted
     */
    public String createGoal(GoalRequest request) {
        String description = EntityNames.normalize(request.getDescription());
        if (description.isEmpty()) {
            throw new IllegalArgumentException("Goal description must not be blank");
        }
        validatePriority(request.getPriority());
        String owner = request.getOwner() != null && !request.getOwner().isBlank()
                ? EntityNames.normalize(request.getOwner())
                : DEFAULT_OWNER;

        List<String> dependsOn = normalizeAll(request.getDependsOn());
        String parent = request.getParentGoal() != null && !request.getParentGoal().isBlank()
                ? EntityNames.normalize(request.getParentGoal())
                : null;

        synchronized (lockFor(description)) {
            Optional<KnowledgeTriple> existing = findGoalTriple(description);
            if (existing.isPresent()) {
                String existingOwner = existing.get().getGoal().getOwner();
                if (!owner.equals(existingOwner)) {
                    throw new IllegalArgumentException(
                            "Goal '" + description + "' already belongs to " + existingOwner);
                }
                log.info("[Goals] Goal already exists: '{}'", description);
                return existing.get().getId();
            }

            detectCycle(description, dependsOn);

            Instant now = clock.instant();
            GoalMetadata metadata = GoalMetadata.builder()
                    .owner(owner)
                    .status(request.isForeverGoal() ? Goal.GoalStatus.ONGOING : Goal.GoalStatus.PENDING)
                    .priority(request.getPriority())
                    .goalType(request.getGoalType() != null ? request.getGoalType() : Goal.GoalType.STANDARD)
                    .foreverGoal(request.isForeverGoal())
                    .dependsOn(dependsOn)
                    .parentGoal(parent)
                    .created(now)
                    .updated(now)
                    .targetDate(request.getTargetDate())
                    .build();

            List<String> topics = new ArrayList<>();
            topics.add(GOAL_TOPIC);
            topics.addAll(normalizeAll(request.getTopics()));

            KnowledgeTriple primary = tripleStoreService.store(TripleCandidate.builder()
                    .subject(owner)
                    .predicate(ReservedPredicate.HAS_GOAL.predicateName())
                    .object(description)
                    .topics(topics)
                    .confidence(1.0)
                    .source(GOAL_SOURCE)
                    .goal(metadata)
                    .build())
                    .orElseThrow(() -> new IllegalStateException("Failed to persist goal: " + description));

            if (parent != null) {
                storeRelation(description, ReservedPredicate.SUBGOAL_OF, parent);
                if (metadata.getGoalType() == Goal.GoalType.DERIVED) {
                    storeRelation(description, ReservedPredicate.DERIVED_FROM, parent);
                }
            }

            log.info("[Goals] Created goal '{}' for {} (priority {}, type {}{})", description, owner,
                    metadata.getPriority(), metadata.getGoalType(), metadata.isForeverGoal() ? ", forever" : "");
            return primary.getId();
        }
    }

    /**
     * Apply a status transition and optional field updates.
     *
     * @param status
     *            requested status, or null to keep the current one
     * @param priority
     *            new priority, or null to keep
     * @param blockerReason
     *            explicit blocker reason, or null
     * @param completionNotes
     *            notes to record, or null to keep
     * @return false if no goal has this description or it could not be saved
     */
    public boolean updateGoal(String description, Goal.GoalStatus status, Integer priority, String blockerReason,
            String completionNotes) {
        String key = EntityNames.normalize(description);
        if (priority != null) {
            validatePriority(priority);
        }

        synchronized (lockFor(key)) {
            Optional<KnowledgeTriple> found = findGoalTriple(key);
            if (found.isEmpty()) {
                log.debug("[Goals] Update for unknown goal '{}'", key);
                return false;
            }

            KnowledgeTriple triple = found.get().toBuilder().build();
            GoalMetadata metadata = copyOf(triple.getGoal());
            Goal.GoalStatus requested = status != null ? status : metadata.getStatus();
            Instant now = clock.instant();

            if (priority != null) {
                metadata.setPriority(priority);
            }
            if (completionNotes != null) {
                metadata.setCompletionNotes(completionNotes);
            }

            if (metadata.isForeverGoal()) {
                metadata.setStatus(Goal.GoalStatus.ONGOING);
                if (requested == Goal.GoalStatus.COMPLETED) {
                    metadata.setBlockerReason(FOREVER_GOAL_REASON);
                    log.info("[Goals] Refused to complete forever goal '{}'", key);
                } else if (blockerReason != null) {
                    metadata.setBlockerReason(blockerReason);
                }
            } else if (requested == Goal.GoalStatus.COMPLETED) {
                List<String> unmet = unmetDependencies(metadata.getDependsOn());
                if (unmet.isEmpty()) {
                    metadata.setStatus(Goal.GoalStatus.COMPLETED);
                    metadata.setCompleted(now);
                    metadata.setBlockerReason(null);
                } else {
                    metadata.setStatus(Goal.GoalStatus.BLOCKED);
                    metadata.setBlockerReason(BLOCKED_PREFIX + String.join(", ", unmet));
                    log.info("[Goals] Completion of '{}' blocked by {}", key, unmet);
                }
            } else {
                metadata.setStatus(requested);
                if (blockerReason != null) {
                    metadata.setBlockerReason(blockerReason);
                } else if (requested != Goal.GoalStatus.BLOCKED) {
                    metadata.setBlockerReason(null);
                }
            }

            metadata.setUpdated(now);
            triple.setGoal(metadata);
            boolean saved = tripleStoreService.replace(triple);
            if (saved) {
                log.info("[Goals] Goal '{}' is now {}", key, metadata.getStatus().value());
            }
            return saved;
        }
    }

    public Optional<Goal> getGoal(String description) {
        return findGoalTriple(EntityNames.normalize(description)).map(this::toGoal);
    }

    public List<Goal> queryGoals(GoalQuery query) {
        return goalsOf(query.getOwner()).stream()
                .filter(g -> query.getStatus() == null || g.getStatus() == query.getStatus())
                .filter(g -> g.getPriority() >= query.getMinPriority() && g.getPriority() <= query.getMaxPriority())
                .filter(g -> !query.isActiveOnly() || g.getStatus().isActive())
                .sorted(BY_PRIORITY_THEN_CREATED)
                .limit(Math.max(0, query.getLimit()))
                .toList();
    }

    /**
     * Highest-scoring active goal whose dependencies are all met. Score is
     * {@code priority * 10}, plus 20 for derived goals, plus 15 when the target
     * date is within 7 days or else 5 when within 30 days. Ties go to the
     * earliest created goal.
     */
    public Optional<GoalSuggestion> suggestNextGoal(String owner) {
        List<Goal> goals = goalsOf(owner);
        Map<String, Goal.GoalStatus> statuses = new HashMap<>();
        for (Goal goal : goals) {
            statuses.put(goal.getDescription(), goal.getStatus());
        }

        GoalSuggestion best = null;
        for (Goal goal : goals) {
            if (!goal.getStatus().isActive() || !unmetDependencies(goal.getDependsOn(), statuses).isEmpty()) {
                continue;
            }
            GoalSuggestion candidate = score(goal);
            if (best == null || candidate.score() > best.score()
                    || (candidate.score() == best.score() && createdBefore(goal, best.goal()))) {
                best = candidate;
            }
        }

        if (best != null) {
            log.debug("[Goals] Suggested '{}' (score {})", best.goal().getDescription(), best.score());
        }
        return Optional.ofNullable(best);
    }

    /**
     * Goals worth keeping in the agent's prompt: every forever goal plus every
     * active goal with priority 4 or 5, highest priority first.
     */
    public List<Goal> getActiveGoalsForPrompt(String owner, int limit) {
        return goalsOf(owner).stream()
                .filter(g -> g.isForeverGoal() || (g.getStatus().isActive() && g.getPriority() >= 4))
                .sorted(BY_PRIORITY_THEN_CREATED)
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Markdown rendering of {@link #getActiveGoalsForPrompt}. Empty when there
     * is nothing to show.
     */
    public String renderActiveGoalsPrompt(String owner, int limit) {
        List<Goal> goals = getActiveGoalsForPrompt(owner, limit);
        if (goals.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("## Active Goals\n\n");
        for (Goal goal : goals) {
            sb.append("- ").append("★".repeat(Math.max(0, goal.getPriority()))).append(' ')
                    .append(goal.getDescription());
            if (goal.getGoalType() == Goal.GoalType.INSTRUMENTAL) {
                sb.append(" [INSTRUMENTAL]");
            } else if (goal.getGoalType() == Goal.GoalType.DERIVED) {
                sb.append(" [DERIVED]");
            }
            if (goal.isForeverGoal()) {
                sb.append(" ONGOING");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public GoalProgress getGoalProgress(String owner) {
        List<Goal> goals = goalsOf(owner);
        Map<Goal.GoalStatus, Integer> byStatus = new EnumMap<>(Goal.GoalStatus.class);
        int active = 0;
        for (Goal goal : goals) {
            byStatus.merge(goal.getStatus(), 1, Integer::sum);
            if (goal.getStatus().isActive()) {
                active++;
            }
        }
        int completed = byStatus.getOrDefault(Goal.GoalStatus.COMPLETED, 0);
        double rate = goals.isEmpty() ? 0.0 : (double) completed / goals.size();

        List<Goal> recent = goals.stream()
                .filter(g -> g.getStatus() == Goal.GoalStatus.COMPLETED && g.getCompleted() != null)
                .sorted(Comparator.comparing(Goal::getCompleted).reversed())
                .limit(RECENT_COMPLETIONS)
                .toList();
        return new GoalProgress(goals.size(), byStatus, rate, active, recent);
    }

    private GoalSuggestion score(Goal goal) {
        double score = goal.getPriority() * 10.0;
        List<String> reasons = new ArrayList<>();
        reasons.add("priority " + goal.getPriority() + " (+" + goal.getPriority() * 10 + ")");

        if (goal.getGoalType() == Goal.GoalType.DERIVED) {
            score += 20;
            reasons.add("derived goal (+20)");
        }

        if (goal.getTargetDate() != null) {
            Duration remaining = Duration.between(clock.instant(), goal.getTargetDate());
            if (remaining.compareTo(Duration.ofDays(7)) <= 0) {
                score += 15;
                reasons.add(remaining.isNegative() ? "target date passed (+15)" : "due within 7 days (+15)");
            } else if (remaining.compareTo(Duration.ofDays(30)) <= 0) {
                score += 5;
                reasons.add("due within 30 days (+5)");
            }
        }

        String reasoning = "Suggested '" + goal.getDescription() + "': " + String.join(", ", reasons)
                + "; all dependencies met";
        return new GoalSuggestion(goal, score, reasoning);
    }

    private List<String> unmetDependencies(List<String> dependsOn) {
        List<String> unmet = new ArrayList<>();
        if (dependsOn == null) {
            return unmet;
        }
        for (String dependency : dependsOn) {
            Optional<Goal> goal = getGoal(dependency);
            if (goal.isEmpty() || !goal.get().getStatus().isSettled()) {
                unmet.add(dependency);
            }
        }
        return unmet;
    }

    private List<String> unmetDependencies(List<String> dependsOn, Map<String, Goal.GoalStatus> knownStatuses) {
        List<String> unmet = new ArrayList<>();
        if (dependsOn == null) {
            return unmet;
        }
        for (String dependency : dependsOn) {
            Goal.GoalStatus status = knownStatuses.get(dependency);
            if (status == null) {
                status = getGoal(dependency).map(Goal::getStatus).orElse(null);
            }
            if (status == null || !status.isSettled()) {
                unmet.add(dependency);
            }
        }
        return unmet;
    }

    /**
     * Depth-first search from the new goal through existing dependencies.
     * Reaching the new goal again means the dependency set would close a cycle.
     */
    private void detectCycle(String description, List<String> dependsOn) {
        if (dependsOn.contains(description)) {
            throw new IllegalArgumentException("Goal cannot depend on itself: " + description);
        }
        if (dependsOn.isEmpty()) {
            return;
        }

        Map<String, List<String>> graph = new HashMap<>();
        for (Goal goal : goalsOf(null)) {
            graph.put(goal.getDescription(), goal.getDependsOn() != null ? goal.getDependsOn() : List.of());
        }
        graph.put(description, dependsOn);

        Set<String> visited = new HashSet<>();
        List<String> stack = new ArrayList<>(dependsOn);
        while (!stack.isEmpty()) {
            String current = stack.remove(stack.size() - 1);
            if (current.equals(description)) {
                throw new IllegalArgumentException("Cyclic goal dependency through: " + description);
            }
            if (visited.add(current)) {
                stack.addAll(graph.getOrDefault(current, List.of()));
            }
        }
    }

    private void storeRelation(String description, ReservedPredicate predicate, String target) {
        tripleStoreService.store(TripleCandidate.builder()
                .subject(description)
                .predicate(predicate.predicateName())
                .object(target)
                .topics(List.of(GOAL_TOPIC))
                .confidence(1.0)
                .source(GOAL_SOURCE)
                .build());
    }

    private Optional<KnowledgeTriple> findGoalTriple(String description) {
        return tripleStoreService.queryByMetadata(VectorFilter.builder()
                .predicates(Set.of(ReservedPredicate.HAS_GOAL.predicateName()))
                .object(description)
                .build(), Integer.MAX_VALUE).stream()
                .filter(t -> t.getGoal() != null)
                .findFirst();
    }

    private List<Goal> goalsOf(String owner) {
        VectorFilter.VectorFilterBuilder filter = VectorFilter.builder()
                .predicates(Set.of(ReservedPredicate.HAS_GOAL.predicateName()));
        if (owner != null && !owner.isBlank()) {
            filter.subject(EntityNames.normalize(owner));
        }
        return tripleStoreService.queryByMetadata(filter.build(), Integer.MAX_VALUE).stream()
                .filter(t -> t.getGoal() != null)
                .map(this::toGoal)
                .toList();
    }

    private Goal toGoal(KnowledgeTriple triple) {
        GoalMetadata metadata = triple.getGoal();
        return Goal.builder()
                .id(triple.getId())
                .description(EntityNames.normalize(triple.getObject()))
                .owner(metadata.getOwner())
                .status(metadata.getStatus() != null ? metadata.getStatus() : Goal.GoalStatus.PENDING)
                .priority(metadata.getPriority())
                .goalType(metadata.getGoalType() != null ? metadata.getGoalType() : Goal.GoalType.STANDARD)
                .foreverGoal(metadata.isForeverGoal())
                .dependsOn(metadata.getDependsOn() != null ? new ArrayList<>(metadata.getDependsOn())
                        : new ArrayList<>())
                .parentGoal(metadata.getParentGoal())
                .created(metadata.getCreated())
                .updated(metadata.getUpdated())
                .completed(metadata.getCompleted())
                .targetDate(metadata.getTargetDate())
                .blockerReason(metadata.getBlockerReason())
                .completionNotes(metadata.getCompletionNotes())
                .topics(triple.getTopics() != null ? new ArrayList<>(triple.getTopics()) : new ArrayList<>())
                .build();
    }

    private GoalMetadata copyOf(GoalMetadata source) {
        return GoalMetadata.builder()
                .owner(source.getOwner())
                .status(source.getStatus())
                .priority(source.getPriority())
                .goalType(source.getGoalType())
                .foreverGoal(source.isForeverGoal())
                .dependsOn(source.getDependsOn() != null ? new ArrayList<>(source.getDependsOn()) : new ArrayList<>())
                .parentGoal(source.getParentGoal())
                .created(source.getCreated())
                .updated(source.getUpdated())
                .completed(source.getCompleted())
                .targetDate(source.getTargetDate())
                .blockerReason(source.getBlockerReason())
                .completionNotes(source.getCompletionNotes())
                .build();
    }

    private boolean createdBefore(Goal first, Goal second) {
        if (first.getCreated() == null) {
            return false;
        }
        return second.getCreated() == null || first.getCreated().isBefore(second.getCreated());
    }

    private void validatePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Goal priority must be between 1 and 5, got " + priority);
        }
    }

    private List<String> normalizeAll(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                String normalized = EntityNames.normalize(value);
                if (!normalized.isEmpty()) {
                    result.add(normalized);
                }
            }
        }
        return new ArrayList<>(result);
    }

    private Object lockFor(String description) {
        return goalLocks.computeIfAbsent(description, key -> new Object());
    }
}

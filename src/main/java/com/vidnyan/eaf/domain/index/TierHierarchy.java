package com.vidnyan.eaf.domain.index;

import com.vidnyan.eaf.domain.model.EafDocument;
import com.vidnyan.eaf.domain.model.Tier;

import java.util.*;

/**
 * Parent/child graph of a document's tiers.
 * Used for cycle detection, descendant lookup and tier depth.
 */
public final class TierHierarchy {

    private final Map<String, String> parents;         // tier → parent tier
    private final Map<String, List<String>> children;  // tier → child tiers, document order
    private final Set<String> tiers;

    private TierHierarchy(
            Map<String, String> parents,
            Map<String, List<String>> children,
            Set<String> tiers
    ) {
        this.parents = Collections.unmodifiableMap(parents);
        this.children = Collections.unmodifiableMap(children);
        this.tiers = Collections.unmodifiableSet(tiers);
    }

    /**
     * Build the hierarchy from a document. Parent references to unknown tiers
     * are kept, so they can be reported.
     */
    public static TierHierarchy build(EafDocument document) {
        Map<String, String> parents = new HashMap<>();
        Map<String, List<String>> children = new HashMap<>();
        Set<String> tierIds = new LinkedHashSet<>();

        for (Tier tier : document.tiers()) {
            tierIds.add(tier.id());
            if (tier.parentRef() != null) {
                parents.put(tier.id(), tier.parentRef());
                children.computeIfAbsent(tier.parentRef(), k -> new ArrayList<>()).add(tier.id());
            }
        }

        return new TierHierarchy(parents, children, tierIds);
    }

    public Optional<String> parentOf(String tierId) {
        return Optional.ofNullable(parents.get(tierId));
    }

    public List<String> childrenOf(String tierId) {
        return children.getOrDefault(tierId, List.of());
    }

    /**
     * Get all tiers below a tier, breadth first.
     */
    public List<String> descendants(String tierId) {
        List<String> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>(childrenOf(tierId));

        while (!queue.isEmpty()) {
            String tier = queue.poll();
            if (!visited.add(tier) || tier.equals(tierId)) {
                continue;
            }
            result.add(tier);
            queue.addAll(childrenOf(tier));
        }

        return result;
    }

    /**
     * Parent references that name no tier in the document.
     * Returns tier → missing parent.
     */
    public Map<String, String> missingParents() {
        Map<String, String> missing = new LinkedHashMap<>();
        for (String tier : tiers) {
            String parent = parents.get(tier);
            if (parent != null && !tiers.contains(parent)) {
                missing.put(tier, parent);
            }
        }
        return missing;
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    /**
     * Find all parent reference cycles.
     * Each cycle lists the tier IDs along the chain, ending with the first one.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();

        for (String tier : tiers) {
            if (!visited.contains(tier)) {
                findCyclesRecursive(tier, visited, inStack, new ArrayList<>(), cycles);
            }
        }

        return cycles;
    }

    private void findCyclesRecursive(
            String current,
            Set<String> visited,
            Set<String> inStack,
            List<String> path,
            List<List<String>> cycles
    ) {
        visited.add(current);
        inStack.add(current);
        path.add(current);

        String parent = parents.get(current);
        if (parent != null) {
            if (!visited.contains(parent)) {
                findCyclesRecursive(parent, visited, inStack, path, cycles);
            } else if (inStack.contains(parent)) {
                int cycleStart = path.indexOf(parent);
                List<String> cycle = new ArrayList<>(path.subList(cycleStart, path.size()));
                cycle.add(parent);
                cycles.add(cycle);
            }
        }

        path.remove(path.size() - 1);
        inStack.remove(current);
    }

    /**
     * Check if {@code ancestor} lies on the parent chain of {@code tierId}.
     */
    public boolean isAncestor(String ancestor, String tierId) {
        Set<String> visited = new HashSet<>();
        String current = parents.get(tierId);
        while (current != null && visited.add(current)) {
            if (current.equals(ancestor)) {
                return true;
            }
            current = parents.get(current);
        }
        return false;
    }

    /**
     * Number of parent references between a tier and its main tier.
     * Main tiers have depth 0. Stops counting at a cycle.
     */
    public int depth(String tierId) {
        Set<String> visited = new HashSet<>();
        visited.add(tierId);
        int depth = 0;
        String current = parents.get(tierId);
        while (current != null && visited.add(current)) {
            depth++;
            current = parents.get(current);
        }
        return depth;
    }

    public Stats stats() {
        return new Stats(
                tiers.size(),
                parents.size(),
                tiers.stream().mapToInt(this::depth).max().orElse(0)
        );
    }

    public record Stats(int tierCount, int referredTierCount, int maxDepth) {}
}

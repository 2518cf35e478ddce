package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.model.Artist;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one traversal: the visited set, admitted artists, adjacency and regions.
 * <p>
 * {@link #tryAdmit(Artist, String, int, int)} is the single admission gate. It checks the visited
 * set, the node budget and records the child in one synchronized step, so when two parents race
 * for the same candidate exactly one wins and the loser records nothing.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
final class DiscoveryState {
    private final Set<String> visited = new HashSet<>();
    private final Map<String, Artist> nodes = new LinkedHashMap<>();
    private final Set<String> transparentSeeds = new HashSet<>();
    private final Map<String, List<String>> tree = new LinkedHashMap<>();
    private final Set<String> countries = new LinkedHashSet<>();
    private final Map<String, Artist> filteredOut = new LinkedHashMap<>();

    /**
     * Registers a seed at depth 0.
     * @param seed resolved seed
     * @param included false when the seed is traversed but left out of the results
     * @return false if the seed was already registered
     */
    synchronized boolean addSeed(Artist seed, boolean included) {
        if (!visited.add(seed.id())) return false;
        nodes.put(seed.id(), seed.withDiscovery(0, null));
        if (included) {
            addCountry(seed);
        } else {
            transparentSeeds.add(seed.id());
        }
        return true;
    }

    synchronized boolean isVisited(String artistId) {
        return visited.contains(artistId);
    }

    /**
     * @return number of nodes counted against the total budget (seeds included)
     */
    synchronized int nodeCount() {
        return visited.size();
    }

    synchronized boolean atCapacity(int maxTotal) {
        return visited.size() >= maxTotal;
    }

    synchronized void openParent(String parentId) {
        tree.computeIfAbsent(parentId, k -> new ArrayList<>());
    }

    /**
     * Admits a candidate under a parent unless it was visited before or the budget is spent.
     * @return true if this call admitted the candidate
     */
    synchronized boolean tryAdmit(Artist candidate, String parentId, int depth, int maxTotal) {
        if (visited.contains(candidate.id()) || visited.size() >= maxTotal) {
            return false;
        }
        visited.add(candidate.id());
        nodes.put(candidate.id(), candidate.withDiscovery(depth, parentId));
        tree.computeIfAbsent(parentId, k -> new ArrayList<>()).add(candidate.id());
        filteredOut.remove(candidate.id());
        addCountry(candidate);
        return true;
    }

    synchronized void recordFilteredOut(Artist candidate, String parentId, int depth) {
        if (!visited.contains(candidate.id())) {
            filteredOut.putIfAbsent(candidate.id(), candidate.withDiscovery(depth, parentId));
        }
    }

    synchronized Artist node(String artistId) {
        return nodes.get(artistId);
    }

    /**
     * @return admitted artists in discovery order, transparent seeds left out
     */
    synchronized List<Artist> discoveredArtists() {
        List<Artist> result = new ArrayList<>();
        for (Artist artist : nodes.values()) {
            if (!transparentSeeds.contains(artist.id())) result.add(artist);
        }
        return result;
    }

    synchronized List<Artist> filteredOutArtists() {
        return new ArrayList<>(filteredOut.values());
    }

    synchronized Map<String, List<String>> tree() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        tree.forEach((parent, children) -> copy.put(parent, new ArrayList<>(children)));
        return copy;
    }

    synchronized Set<String> countries() {
        return new LinkedHashSet<>(countries);
    }

    synchronized int maxDepthReached() {
        int max = 0;
        for (Artist artist : nodes.values()) {
            max = Math.max(max, artist.depth());
        }
        return max;
    }

    private void addCountry(Artist artist) {
        if (artist.country() != null && !artist.country().isBlank()) {
            countries.add(artist.country());
        }
    }
}

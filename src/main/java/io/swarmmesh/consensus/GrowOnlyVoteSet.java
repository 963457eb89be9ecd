package io.swarmmesh.consensus;

import io.swarmmesh.model.Vote;

import java.util.Map;
import java.util.TreeMap;

/**
 * Grow-only map of agent votes. Merging is a union, so merges commute and repeat without effect; when two
 * replicas disagree on one agent the lower-ordinal vote wins on both sides.
 */
public final class GrowOnlyVoteSet {
    private final Map<String, Vote> entries = new TreeMap<>();

    public static GrowOnlyVoteSet of(String agentId, Vote vote) {
        GrowOnlyVoteSet set = new GrowOnlyVoteSet();
        set.add(agentId, vote);
        return set;
    }

    public boolean add(String agentId, Vote vote) {
        Vote existing = entries.get(agentId);
        if (existing == null || vote.ordinal() < existing.ordinal()) {
            entries.put(agentId, vote);
            return true;
        }
        return false;
    }

    /**
     * Folds {@code other} into this set. Returns true when this set changed.
     */
    public boolean merge(GrowOnlyVoteSet other) {
        boolean changed = false;
        for (Map.Entry<String, Vote> e : other.entries.entrySet()) {
            changed |= add(e.getKey(), e.getValue());
        }
        return changed;
    }

    public int count(Vote vote) {
        int n = 0;
        for (Vote v : entries.values()) {
            if (v == vote) {
                n++;
            }
        }
        return n;
    }

    public int size() {
        return entries.size();
    }

    public Map<String, Vote> asMap() {
        return Map.copyOf(entries);
    }

    public GrowOnlyVoteSet copy() {
        GrowOnlyVoteSet out = new GrowOnlyVoteSet();
        out.entries.putAll(entries);
        return out;
    }
}

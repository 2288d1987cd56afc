package com.delphine.script.types;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.delphine.debug.Debug;

/**
 * Implicit and explicit conversions between named types. Implicit conversions
 * chain: a value may pass through intermediate types, at most
 * {@link #MAX_CONVERSION_CHAIN_DEPTH} conversion steps in total.
 */
public final class ConversionRegistry {

    private static final String TAG = "Types";

    /** Longest accepted implicit chain, counted in conversion steps. */
    public static final int MAX_CONVERSION_CHAIN_DEPTH = 3;

    private final Map<String, ConversionEntry> implicitByKey = new LinkedHashMap<>();
    private final Map<String, ConversionEntry> explicitByKey = new LinkedHashMap<>();
    private final Map<String, List<ConversionEntry>> implicitBySource = new LinkedHashMap<>();

    public void register(ConversionEntry entry) {
        Map<String, ConversionEntry> table = entry.isImplicit() ? implicitByKey : explicitByKey;
        if (table.containsKey(entry.key())) {
            throw new TypeDeclarationException((entry.isImplicit() ? "implicit" : "explicit")
                    + " conversion already registered: " + entry.getFrom() + " -> " + entry.getTo());
        }
        table.put(entry.key(), entry);
        if (entry.isImplicit()) {
            implicitBySource.computeIfAbsent(entry.getFrom(), k -> new ArrayList<>()).add(entry);
        }
    }

    public ConversionEntry findImplicit(String from, String to) {
        return implicitByKey.get(ConversionEntry.key(from, to));
    }

    public ConversionEntry findExplicit(String from, String to) {
        return explicitByKey.get(ConversionEntry.key(from, to));
    }

    /**
     * Shortest chain of implicit conversions from -> to, breadth first.
     *
     * @return the steps in application order, or null when no chain of at most
     *         MAX_CONVERSION_CHAIN_DEPTH steps exists
     */
    public List<ConversionEntry> findImplicitChain(String from, String to) {
        String src = Names.normalize(from);
        String dst = Names.normalize(to);

        ConversionEntry direct = implicitByKey.get(ConversionEntry.key(src, dst));
        if (direct != null) return Collections.singletonList(direct);

        Deque<List<ConversionEntry>> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        visited.add(src);

        for (ConversionEntry e : implicitBySource.getOrDefault(src, Collections.emptyList())) {
            visited.add(e.getTo());
            List<ConversionEntry> path = new ArrayList<>();
            path.add(e);
            queue.add(path);
        }

        while (!queue.isEmpty()) {
            List<ConversionEntry> path = queue.poll();
            ConversionEntry last = path.get(path.size() - 1);
            if (last.getTo().equals(dst)) {
                Debug.get().t(TAG, "conversion chain " + src + " -> " + dst + " in " + path.size() + " steps");
                return path;
            }
            if (path.size() >= MAX_CONVERSION_CHAIN_DEPTH) continue;

            for (ConversionEntry next : implicitBySource.getOrDefault(last.getTo(), Collections.emptyList())) {
                if (visited.contains(next.getTo()) && !next.getTo().equals(dst)) continue;
                visited.add(next.getTo());
                List<ConversionEntry> extended = new ArrayList<>(path);
                extended.add(next);
                queue.add(extended);
            }
        }
        return null;
    }

    public boolean hasImplicitConversions() {
        return !implicitByKey.isEmpty();
    }
}

package com.example.bpmn_transformer.util;

import java.util.*;

/**
 * Array-backed union-find over {@code 0..n-1} with path compression.
 * {@link #union(int, int)} hangs the second root under the first.
 */
public final class DisjointSet {

    private final int[] parent;

    public DisjointSet(int n) {
        if (n < 0) throw new IllegalArgumentException("n < 0");
        parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;
    }

    public int size() { return parent.length; }

    public int find(int x) {
        int root = x;
        while (parent[root] != root) root = parent[root];
        // compress
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    public boolean union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) return false;
        parent[rb] = ra;
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    /** Classes in first-encountered root order, members ascending. */
    public List<List<Integer>> groups() {
        Map<Integer, List<Integer>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < parent.length; i++) {
            byRoot.computeIfAbsent(find(i), k -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(byRoot.values());
    }
}

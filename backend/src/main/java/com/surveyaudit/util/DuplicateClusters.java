package com.surveyaudit.util;

import java.util.*;

/**
 * 并查集聚类。簇的代表（canonical）固定为簇内最小的导入下标，
 * 与合并顺序无关。
 */
public final class DuplicateClusters {

    private final Map<Integer, Integer> parent = new HashMap<>();

    /**
     * 将两个记录合并到同一簇
     */
    public void union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return;
        }
        // 较小下标始终作为根
        if (ra < rb) {
            parent.put(rb, ra);
        } else {
            parent.put(ra, rb);
        }
    }

    public int find(int x) {
        Integer p = parent.get(x);
        if (p == null) {
            parent.put(x, x);
            return x;
        }
        if (p == x) {
            return x;
        }
        int root = find(p);
        parent.put(x, root);
        return root;
    }

    /**
     * 所有规模 ≥ 2 的簇，按代表下标排序；簇内成员升序
     */
    public List<Cluster> clusters() {
        SortedMap<Integer, SortedSet<Integer>> groups = new TreeMap<>();
        for (Integer x : new ArrayList<>(parent.keySet())) {
            groups.computeIfAbsent(find(x), k -> new TreeSet<>()).add(x);
        }
        List<Cluster> result = new ArrayList<>();
        for (Map.Entry<Integer, SortedSet<Integer>> e : groups.entrySet()) {
            if (e.getValue().size() >= 2) {
                result.add(new Cluster(e.getKey(), List.copyOf(e.getValue())));
            }
        }
        return result;
    }

    /**
     * 重复簇
     *
     * @param canonical 代表记录下标（簇内最先出现）
     * @param members   全部成员下标，升序
     */
    public record Cluster(int canonical, List<Integer> members) {

        public int size() {
            return members.size();
        }

        public List<Integer> duplicates() {
            return members.subList(1, members.size());
        }
    }
}

package com.surveyaudit.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateClustersTest {

    @Test
    void shouldUseSmallestIndexAsCanonicalRegardlessOfUnionOrder() {
        DuplicateClusters forward = new DuplicateClusters();
        forward.union(3, 47);
        forward.union(47, 81);

        DuplicateClusters backward = new DuplicateClusters();
        backward.union(81, 47);
        backward.union(81, 3);

        assertEquals(forward.clusters(), backward.clusters());
        DuplicateClusters.Cluster cluster = forward.clusters().get(0);
        assertEquals(3, cluster.canonical());
        assertEquals(List.of(47, 81), cluster.duplicates());
        assertEquals(3, cluster.size());
    }

    @Test
    void shouldKeepDisjointClustersOrderedByCanonical() {
        DuplicateClusters clusters = new DuplicateClusters();
        clusters.union(10, 12);
        clusters.union(2, 5);
        clusters.union(7, 7);

        List<DuplicateClusters.Cluster> result = clusters.clusters();

        assertEquals(2, result.size());
        assertEquals(2, result.get(0).canonical());
        assertEquals(10, result.get(1).canonical());
    }

    @Test
    void shouldMergeTwoExistingClusters() {
        DuplicateClusters clusters = new DuplicateClusters();
        clusters.union(4, 9);
        clusters.union(1, 6);
        clusters.union(9, 6);

        assertEquals(1, clusters.find(9));
        assertEquals(List.of(1, 4, 6, 9), clusters.clusters().get(0).members());
    }
}

package com.surveyaudit.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 孤立森林。固定随机种子时结果确定。异常分 s(x) = 2^(−E[h(x)] / c(ψ))。
 */
public final class IsolationForest {

    private final List<Node> trees;
    private final int subsampleSize;

    private IsolationForest(List<Node> trees, int subsampleSize) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
    }

    public static IsolationForest fit(double[][] data, int numTrees, int subsampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("训练数据为空");
        }
        Random random = new Random(seed);
        int psi = Math.min(subsampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        List<Node> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            double[][] sample = subsample(data, psi, random);
            trees.add(build(sample, 0, heightLimit, random));
        }
        return new IsolationForest(trees, psi);
    }

    public double score(double[] x) {
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(tree, x, 0);
        }
        double mean = total / trees.size();
        double c = averagePathLength(subsampleSize);
        return c == 0 ? 0.5 : Math.pow(2, -mean / c);
    }

    /**
     * 二叉搜索树中不成功查找的平均路径长度 c(n)
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        // 不放回抽样：部分 Fisher-Yates
        int[] idx = new int[data.length];
        for (int i = 0; i < idx.length; i++) {
            idx[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(idx.length - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
            sample[i] = data[idx[i]];
        }
        return sample;
    }

    private static Node build(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int dims = rows[0].length;
        List<Integer> candidates = new ArrayList<>();
        for (int d = 0; d < dims; d++) {
            double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
            for (double[] r : rows) {
                min = Math.min(min, r[d]);
                max = Math.max(max, r[d]);
            }
            if (max > min) {
                candidates.add(d);
            }
        }
        if (candidates.isEmpty()) {
            return Node.leaf(rows.length);
        }
        int feature = candidates.get(random.nextInt(candidates.size()));
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double[] r : rows) {
            min = Math.min(min, r[feature]);
            max = Math.max(max, r[feature]);
        }
        double split = min + random.nextDouble() * (max - min);

        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] r : rows) {
            if (r[feature] < split) {
                left.add(r);
            } else {
                right.add(r);
            }
        }
        return Node.split(feature, split,
                build(left.toArray(new double[0][]), depth + 1, heightLimit, random),
                build(right.toArray(new double[0][]), depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double[] x, int depth) {
        if (node.leaf) {
            return depth + averagePathLength(node.size);
        }
        Node next = x[node.feature] < node.split ? node.left : node.right;
        return pathLength(next, x, depth + 1);
    }

    private static final class Node {
        final boolean leaf;
        final int size;
        final int feature;
        final double split;
        final Node left;
        final Node right;

        private Node(boolean leaf, int size, int feature, double split, Node left, Node right) {
            this.leaf = leaf;
            this.size = size;
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
        }

        static Node leaf(int size) {
            return new Node(true, size, -1, 0.0, null, null);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(false, 0, feature, split, left, right);
        }
    }
}

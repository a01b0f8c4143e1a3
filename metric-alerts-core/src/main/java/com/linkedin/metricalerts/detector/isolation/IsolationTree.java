/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.isolation;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;


/**
 * A random binary tree that isolates points by recursive axis-parallel splits. Points that need fewer splits to be
 * isolated are more likely outliers.
 */
final class IsolationTree {
  private final Node _root;

  private IsolationTree(Node root) {
    _root = root;
  }

  /**
   * @param data All observations, one row per point.
   * @param sampleIndices Rows of the given data the tree is built on.
   * @param maxDepth Depth at which recursion stops.
   * @param random Source of randomness for dimension and split choices.
   * @return A tree built on the given sample.
   */
  static IsolationTree build(double[][] data, int[] sampleIndices, int maxDepth, Random random) {
    return new IsolationTree(grow(data, sampleIndices, 0, maxDepth, random));
  }

  private static Node grow(double[][] data, int[] indices, int depth, int maxDepth, Random random) {
    if (indices.length <= 1 || depth >= maxDepth) {
      return Node.leaf(indices.length);
    }
    int numDimensions = data[indices[0]].length;
    double[] min = new double[numDimensions];
    double[] max = new double[numDimensions];
    List<Integer> splittable = new ArrayList<>(numDimensions);
    for (int d = 0; d < numDimensions; d++) {
      min[d] = Double.POSITIVE_INFINITY;
      max[d] = Double.NEGATIVE_INFINITY;
      for (int index : indices) {
        min[d] = Math.min(min[d], data[index][d]);
        max[d] = Math.max(max[d], data[index][d]);
      }
      if (max[d] > min[d]) {
        splittable.add(d);
      }
    }
    // All points are identical.
    if (splittable.isEmpty()) {
      return Node.leaf(indices.length);
    }
    int dimension = splittable.get(random.nextInt(splittable.size()));
    double splitValue = min[dimension] + random.nextDouble() * (max[dimension] - min[dimension]);

    int numLeft = 0;
    for (int index : indices) {
      if (data[index][dimension] <= splitValue) {
        numLeft++;
      }
    }
    // Rounding may put the split on the maximum, which separates nothing.
    if (numLeft == 0 || numLeft == indices.length) {
      return Node.leaf(indices.length);
    }
    int[] left = new int[numLeft];
    int[] right = new int[indices.length - numLeft];
    int l = 0;
    int r = 0;
    for (int index : indices) {
      if (data[index][dimension] <= splitValue) {
        left[l++] = index;
      } else {
        right[r++] = index;
      }
    }
    return Node.split(dimension, splitValue,
                      grow(data, left, depth + 1, maxDepth, random),
                      grow(data, right, depth + 1, maxDepth, random));
  }

  /**
   * @param point A point with the dimensions the tree was built on.
   * @return The number of edges from the root to the terminal node of the point, plus the expected path length of an
   * unsuccessful search among the points left in that node.
   */
  double pathLength(double[] point) {
    Node node = _root;
    int depth = 0;
    while (!node.isLeaf()) {
      node = point[node._dimension] <= node._splitValue ? node._left : node._right;
      depth++;
    }
    return depth + IsolationForest.averagePathLength(node._size);
  }

  private static final class Node {
    private final int _dimension;
    private final double _splitValue;
    private final Node _left;
    private final Node _right;
    private final int _size;

    private Node(int dimension, double splitValue, Node left, Node right, int size) {
      _dimension = dimension;
      _splitValue = splitValue;
      _left = left;
      _right = right;
      _size = size;
    }

    static Node leaf(int size) {
      return new Node(-1, Double.NaN, null, null, size);
    }

    static Node split(int dimension, double splitValue, Node left, Node right) {
      return new Node(dimension, splitValue, left, right, left._size + right._size);
    }

    boolean isLeaf() {
      return _left == null;
    }
  }
}

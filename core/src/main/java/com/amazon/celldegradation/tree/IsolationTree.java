/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.celldegradation.tree;

import static com.amazon.celldegradation.CommonUtils.averagePathLength;
import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;
import static com.amazon.celldegradation.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A random partition tree over a sample of feature rows. Every internal node
 * chooses its cut dimension with probability proportional to the side length
 * of the node's bounding box and its cut value uniformly inside that side.
 * Growth stops at a height limit, at single points, and at boxes with zero
 * range. The path length of a point is the depth at which it lands plus the
 * expected depth of the unresolved points in that leaf.
 */
public class IsolationTree {

    private static final int NULL = -1;

    private final double[][] points;
    private final int heightLimit;

    // node arrays; a leaf has left == NULL
    private final List<Cut> cuts = new ArrayList<>();
    private final List<int[]> children = new ArrayList<>();
    private final List<Integer> leafSizes = new ArrayList<>();

    private final int root;

    private IsolationTree(double[][] points, int heightLimit, long seed) {
        this.points = points;
        this.heightLimit = heightLimit;
        List<Integer> all = new ArrayList<>();
        for (int i = 0; i < points.length; i++) {
            all.add(i);
        }
        root = makeTree(all, new Random(seed).nextInt(), 0);
    }

    /**
     * Build a tree over the given sample.
     *
     * @param sample      the rows the tree is grown on
     * @param heightLimit maximum depth of any node
     * @param seed        seed for the cut choices
     * @return the tree
     */
    public static IsolationTree build(double[][] sample, int heightLimit, long seed) {
        checkNotNull(sample, "sample cannot be null");
        checkArgument(sample.length > 0, "sample cannot be empty");
        checkArgument(heightLimit >= 0, "height limit cannot be negative");
        return new IsolationTree(sample, heightLimit, seed);
    }

    private int makeTree(List<Integer> pointList, int seed, int depth) {
        BoundingBox box = new BoundingBox(points[pointList.get(0)]);
        for (int i = 1; i < pointList.size(); i++) {
            box.addPoint(points[pointList.get(i)]);
        }
        if (pointList.size() == 1 || depth >= heightLimit || box.getRangeSum() <= 0) {
            return addLeaf(pointList.size());
        }

        Random ring = new Random(seed);
        int leftSeed = ring.nextInt();
        int rightSeed = ring.nextInt();
        Cut cut = getCut(box, ring);

        List<Integer> leftList = new ArrayList<>();
        List<Integer> rightList = new ArrayList<>();
        for (Integer index : pointList) {
            if (Cut.isLeftOf(points[index], cut)) {
                leftList.add(index);
            } else {
                rightList.add(index);
            }
        }
        checkState(!leftList.isEmpty() && !rightList.isEmpty(), "cut failed to separate points");

        int node = cuts.size();
        cuts.add(cut);
        children.add(new int[] { NULL, NULL });
        leafSizes.add(0);
        int left = makeTree(leftList, leftSeed, depth + 1);
        int right = makeTree(rightList, rightSeed, depth + 1);
        children.get(node)[0] = left;
        children.get(node)[1] = right;
        return node;
    }

    private int addLeaf(int size) {
        int node = cuts.size();
        cuts.add(null);
        children.add(new int[] { NULL, NULL });
        leafSizes.add(size);
        return node;
    }

    static Cut getCut(BoundingBox box, Random ring) {
        Random rng = new Random(ring.nextInt());
        double cutf = rng.nextDouble();
        double dimf = rng.nextDouble();
        double breakPoint = dimf * box.getRangeSum();

        int td = -1;
        for (int i = 0; i < box.getDimensions() && td == -1; i++) {
            double range = box.getRange(i);
            if (range > 0) {
                if (breakPoint <= range) {
                    td = i;
                } else {
                    breakPoint -= range;
                }
            }
        }
        if (td == -1) {
            // rounding left a residue past the last positive side
            for (int i = box.getDimensions() - 1; i >= 0 && td == -1; i--) {
                if (box.getRange(i) > 0) {
                    td = i;
                }
            }
        }
        checkArgument(td != -1, "Pivot selection failed.");
        double cutValue = box.getMinValue(td) + box.getRange(td) * cutf;
        if (cutValue >= box.getMaxValue(td)) {
            cutValue = box.getMinValue(td);
        }
        return new Cut(td, cutValue);
    }

    /**
     * @param point a point with the dimension of the sample
     * @return depth of the leaf the point falls into, adjusted by the average
     *         path length of the points that leaf could not separate
     */
    public double pathLength(double[] point) {
        int node = root;
        int depth = 0;
        while (cuts.get(node) != null) {
            node = Cut.isLeftOf(point, cuts.get(node)) ? children.get(node)[0] : children.get(node)[1];
            ++depth;
        }
        return depth + averagePathLength(leafSizes.get(node));
    }

    public int size() {
        return cuts.size();
    }
}

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

/**
 * A Cut divides feature space into two half-spaces along one coordinate. The
 * nodes of an {@link IsolationTree} are defined by their cuts.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * @param dimension the 0-based feature column the cut is made in
     * @param value     the cut value
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    /**
     * A point goes left when its coordinate in the cut dimension is less than or
     * equal to the cut value.
     *
     * @param point a point being routed through the tree
     * @param cut   a Cut instance
     * @return true if the point lies on the left side of the cut
     */
    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getDimension()] <= cut.getValue();
    }

    public int getDimension() {
        return dimension;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}

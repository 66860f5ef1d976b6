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

package com.amazon.celldegradation.features;

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Immutable, row aligned table of engineered features. Row r corresponds to the
 * sample with series index {@code getIndex(r)}. Once built it is only read, so
 * a single instance can be handed to all detectors at the same time.
 */
public class FeatureMatrix {

    /**
     * relative spread below which a column is treated as constant
     */
    public static final double CONSTANT_TOLERANCE = 1e-12;

    private final List<String> columnNames;
    private final long[] indices;
    private final double[][] values;
    private final boolean[] valid;

    public FeatureMatrix(List<String> columnNames, long[] indices, double[][] values, boolean[] valid) {
        checkNotNull(columnNames, "column names cannot be null");
        checkArgument(indices.length == values.length && indices.length == valid.length,
                "rows, indices and validity must have the same length");
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.indices = Arrays.copyOf(indices, indices.length);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            checkArgument(values[i].length == columnNames.size(), "incorrect number of columns in row " + i);
            this.values[i] = Arrays.copyOf(values[i], values[i].length);
        }
        this.valid = Arrays.copyOf(valid, valid.length);
    }

    public FeatureMatrix(List<String> columnNames, long[] indices, double[][] values) {
        this(columnNames, indices, values, allTrue(indices.length));
    }

    private static boolean[] allTrue(int length) {
        boolean[] answer = new boolean[length];
        Arrays.fill(answer, true);
        return answer;
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return columnNames.size();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int columnIndex(String name) {
        return columnNames.indexOf(name);
    }

    public long getIndex(int row) {
        return indices[row];
    }

    public long[] getIndices() {
        return Arrays.copyOf(indices, indices.length);
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    public double[] row(int row) {
        return Arrays.copyOf(values[row], values[row].length);
    }

    public double[] column(int column) {
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = values[i][column];
        }
        return answer;
    }

    public boolean isValid(int row) {
        return valid[row];
    }

    public int validCount() {
        int count = 0;
        for (boolean flag : valid) {
            if (flag) {
                ++count;
            }
        }
        return count;
    }

    /**
     * @return a deep copy of the values, rows first
     */
    public double[][] toArray() {
        double[][] answer = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            answer[i] = Arrays.copyOf(values[i], values[i].length);
        }
        return answer;
    }

    public List<FeatureRecord> records() {
        List<FeatureRecord> answer = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            answer.add(new FeatureRecord(i, indices[i], values[i], valid[i]));
        }
        return answer;
    }

    /**
     * the rows that can be handed to the detectors
     */
    public FeatureMatrix validRows() {
        int count = validCount();
        long[] keptIndices = new long[count];
        double[][] keptValues = new double[count][];
        int position = 0;
        for (int i = 0; i < values.length; i++) {
            if (valid[i]) {
                keptIndices[position] = indices[i];
                keptValues[position++] = values[i];
            }
        }
        return new FeatureMatrix(columnNames, keptIndices, keptValues);
    }

    /**
     * z-scores of every column over the valid rows; a constant column maps to 0
     * and invalid rows are carried through unchanged
     */
    public FeatureMatrix standardized() {
        int d = columns();
        double[] mean = new double[d];
        double[] deviation = new double[d];
        for (int j = 0; j < d; j++) {
            SummaryStatistics statistics = new SummaryStatistics();
            for (int i = 0; i < values.length; i++) {
                if (valid[i]) {
                    statistics.addValue(values[i][j]);
                }
            }
            if (statistics.getN() > 0) {
                mean[j] = statistics.getMean();
                double sd = Math.sqrt(statistics.getPopulationVariance());
                deviation[j] = (sd > CONSTANT_TOLERANCE * Math.max(1.0, Math.abs(mean[j]))) ? sd : 0;
            }
        }
        double[][] scaled = new double[values.length][d];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < d; j++) {
                if (!valid[i]) {
                    scaled[i][j] = values[i][j];
                } else {
                    scaled[i][j] = (deviation[j] > 0) ? (values[i][j] - mean[j]) / deviation[j] : 0;
                }
            }
        }
        return new FeatureMatrix(columnNames, indices, scaled, valid);
    }
}

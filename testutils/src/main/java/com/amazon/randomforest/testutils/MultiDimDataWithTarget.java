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

package com.amazon.randomforest.testutils;

/**
 * Rows of numeric features with a numeric target per row.
 */
public class MultiDimDataWithTarget {

    public final double[][] data;
    public final double[] targets;

    public MultiDimDataWithTarget(double[][] data, double[] targets) {
        this.data = data;
        this.targets = targets;
    }

    /**
     * @return one row of strings per instance, the target last
     */
    public String[][] toRows() {
        String[][] rows = new String[data.length][];
        for (int i = 0; i < data.length; i++) {
            String[] row = new String[data[i].length + 1];
            for (int j = 0; j < data[i].length; j++) {
                row[j] = Float.toString((float) data[i][j]);
            }
            row[data[i].length] = Float.toString((float) targets[i]);
            rows[i] = row;
        }
        return rows;
    }
}

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

package com.amazon.randomforest.data;

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.util.OnlineStatistics;

/**
 * Builds an {@link InstanceDefinition} and a {@link Dataset} from rows of
 * string values held in memory.
 * <p>
 * The values {@code ""}, {@code "?"} and {@code "NA"} mark a missing value.
 * Once all rows are added, {@link #build()} computes the mean and sample
 * standard deviation of every continuous feature, the category table and mode
 * of every discrete feature, and fills in missing values with the mean or the
 * mode. A feature declared with {@code preserveMissing} instead keeps missing
 * values as {@link FeatureDescriptor#MISSING_CONTINUOUS_VALUE} or as the
 * unknown category.
 *
 * <pre>
 * TabularData data = new DatasetBuilder().addFeature("x", FeatureType.CONTINUOUS)
 *         .addFeature("y", FeatureType.DISCRETE).addRow("1.5", "A").addRow("?", "B").build();
 * </pre>
 */
public class DatasetBuilder {

    private static final Logger log = LoggerFactory.getLogger(DatasetBuilder.class);

    private final List<String> names = new ArrayList<>();
    private final List<FeatureType> types = new ArrayList<>();
    private final List<Boolean> preserveMissing = new ArrayList<>();
    private final List<String[]> rows = new ArrayList<>();

    public static boolean isMissing(String value) {
        return value == null || value.isEmpty() || "?".equals(value) || "NA".equals(value);
    }

    public DatasetBuilder addFeature(String name, FeatureType type) {
        return addFeature(name, type, false);
    }

    public DatasetBuilder addFeature(String name, FeatureType type, boolean preserveMissing) {
        checkNotNull(name, "name must not be null");
        checkNotNull(type, "type must not be null");
        checkArgument(rows.isEmpty(), "features must be declared before rows are added");
        checkArgument(!names.contains(name), "duplicate feature " + name);
        names.add(name);
        types.add(type);
        this.preserveMissing.add(preserveMissing);
        return this;
    }

    public DatasetBuilder addRow(String... values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length == names.size(),
                "row has " + values.length + " values but " + names.size() + " features are declared");
        rows.add(Arrays.copyOf(values, values.length));
        return this;
    }

    public DatasetBuilder addRows(List<String[]> values) {
        for (String[] row : values) {
            addRow(row);
        }
        return this;
    }

    /**
     * @return the definition and the dataset built from the rows added so far
     * @throws IllegalArgumentException if a continuous value is not a number
     */
    public TabularData build() {
        int width = names.size();
        checkArgument(width > 0, "at least one feature must be declared");

        OnlineStatistics[] statistics = new OnlineStatistics[width];
        List<Map<String, Integer>> categoryTables = new ArrayList<>(width);
        List<List<Integer>> categoryCounts = new ArrayList<>(width);
        int[] missingCounts = new int[width];
        for (int j = 0; j < width; j++) {
            statistics[j] = new OnlineStatistics();
            Map<String, Integer> table = new LinkedHashMap<>();
            List<Integer> counts = new ArrayList<>();
            if (types.get(j) == FeatureType.DISCRETE) {
                table.put(FeatureDescriptor.UNKNOWN_CATEGORY, 0);
                counts.add(0);
            }
            categoryTables.add(table);
            categoryCounts.add(counts);
        }

        int[][] bits = new int[rows.size()][width];
        boolean[][] missing = new boolean[rows.size()][width];
        for (int i = 0; i < rows.size(); i++) {
            String[] row = rows.get(i);
            for (int j = 0; j < width; j++) {
                String value = row[j] == null ? null : row[j].trim();
                if (isMissing(value)) {
                    missing[i][j] = true;
                    missingCounts[j] += 1;
                } else if (types.get(j) == FeatureType.CONTINUOUS) {
                    float parsed = parseContinuous(value, names.get(j));
                    statistics[j].update(parsed);
                    bits[i][j] = Float.floatToRawIntBits(parsed);
                } else {
                    Map<String, Integer> table = categoryTables.get(j);
                    Integer index = table.get(value);
                    if (index == null) {
                        index = table.size();
                        table.put(value, index);
                        categoryCounts.get(j).add(0);
                    }
                    categoryCounts.get(j).set(index, categoryCounts.get(j).get(index) + 1);
                    bits[i][j] = index;
                }
            }
        }

        List<FeatureDescriptor> descriptors = new ArrayList<>(width);
        for (int j = 0; j < width; j++) {
            if (types.get(j) == FeatureType.CONTINUOUS) {
                descriptors.add(FeatureDescriptor.continuous(names.get(j), (float) statistics[j].getMean(),
                        (float) statistics[j].getStandardDeviation(), missingCounts[j], preserveMissing.get(j)));
            } else {
                int[] counts = categoryCounts.get(j).stream().mapToInt(Integer::intValue).toArray();
                descriptors.add(FeatureDescriptor.discrete(names.get(j),
                        new ArrayList<>(categoryTables.get(j).keySet()), counts, missingCounts[j],
                        preserveMissing.get(j)));
            }
            if (missingCounts[j] > 0) {
                log.debug("feature {} ({}) is missing {} values", j, names.get(j), missingCounts[j]);
            }
        }

        List<Instance> instances = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < width; j++) {
                if (missing[i][j]) {
                    bits[i][j] = fillValue(descriptors.get(j));
                }
            }
            instances.add(Instance.fromBits(bits[i]));
        }

        log.info("built dataset of {} instances with {} features", instances.size(), width);
        return new TabularData(new InstanceDefinition(descriptors), new Dataset(instances));
    }

    private static int fillValue(FeatureDescriptor descriptor) {
        if (descriptor.isDiscrete()) {
            return descriptor.isPreserveMissing() ? 0 : descriptor.getModeIndex();
        }
        float value = descriptor.isPreserveMissing() ? FeatureDescriptor.MISSING_CONTINUOUS_VALUE
                : descriptor.getMean();
        return Float.floatToRawIntBits(value);
    }

    private static float parseContinuous(String value, String featureName) {
        try {
            return Float.parseFloat(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "non-numeric value '" + value + "' given for continuous feature " + featureName, e);
        }
    }
}

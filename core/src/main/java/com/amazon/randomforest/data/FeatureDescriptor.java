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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.randomforest.config.FeatureType;

/**
 * Immutable per-feature metadata. A descriptor is created once when the data
 * is ingested and is shared read-only by every tree trained on it.
 * <p>
 * Discrete features always reserve index 0 of the category table for
 * {@link #UNKNOWN_CATEGORY}. Continuous features carry the mean and the sample
 * standard deviation of the ingested values.
 */
@Getter
public class FeatureDescriptor {

    public static final String UNKNOWN_CATEGORY = "<unknown>";

    /**
     * Value given to missing continuous values of a feature that preserves
     * missing values. It lies below every legitimate value so a {@code <=} split
     * always sends it left.
     */
    public static final float MISSING_CONTINUOUS_VALUE = -Float.MAX_VALUE;

    private final FeatureType featureType;
    private final String name;
    private final int missingCount;
    private final boolean preserveMissing;
    private final float mean;
    private final float standardDeviation;
    private final List<String> categories;
    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> categoryIndex;
    @Getter(AccessLevel.NONE)
    private final int[] categoryCounts;
    private final int modeIndex;

    private FeatureDescriptor(FeatureType featureType, String name, int missingCount, boolean preserveMissing,
            float mean, float standardDeviation, List<String> categories, int[] categoryCounts) {
        this.featureType = checkNotNull(featureType, "featureType must not be null");
        this.name = checkNotNull(name, "name must not be null");
        checkArgument(missingCount >= 0, "missingCount must be non-negative");
        this.missingCount = missingCount;
        this.preserveMissing = preserveMissing;
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.categories = Collections.unmodifiableList(new ArrayList<>(categories));
        this.categoryCounts = Arrays.copyOf(categoryCounts, categoryCounts.length);
        this.categoryIndex = new HashMap<>();
        for (int i = 0; i < this.categories.size(); i++) {
            checkArgument(this.categoryIndex.put(this.categories.get(i), i) == null,
                    "duplicate category " + this.categories.get(i) + " for feature " + name);
        }
        this.modeIndex = findModeIndex(this.categoryCounts);
    }

    /**
     * Creates a descriptor for a numeric feature.
     *
     * @param name              feature name
     * @param mean              mean of the non-missing values
     * @param standardDeviation sample standard deviation of the non-missing values
     * @param missingCount      number of instances missing a value
     * @param preserveMissing   if true, missing values are kept as
     *                          {@link #MISSING_CONTINUOUS_VALUE} instead of being
     *                          replaced by the mean
     * @return the descriptor
     */
    public static FeatureDescriptor continuous(String name, float mean, float standardDeviation, int missingCount,
            boolean preserveMissing) {
        checkArgument(standardDeviation >= 0, "standardDeviation must be non-negative");
        return new FeatureDescriptor(FeatureType.CONTINUOUS, name, missingCount, preserveMissing, mean,
                standardDeviation, Collections.emptyList(), new int[0]);
    }

    /**
     * Creates a descriptor for a categorical feature.
     *
     * @param name            feature name
     * @param categories      the category table; entry 0 must be
     *                        {@link #UNKNOWN_CATEGORY}
     * @param categoryCounts  number of instances per category, parallel to
     *                        {@code categories}
     * @param missingCount    number of instances missing a value
     * @param preserveMissing if true, missing values keep the unknown category
     *                        instead of being replaced by the mode, and the
     *                        unknown category may be used for splits
     * @return the descriptor
     */
    public static FeatureDescriptor discrete(String name, List<String> categories, int[] categoryCounts,
            int missingCount, boolean preserveMissing) {
        checkNotNull(categories, "categories must not be null");
        checkNotNull(categoryCounts, "categoryCounts must not be null");
        checkArgument(!categories.isEmpty() && UNKNOWN_CATEGORY.equals(categories.get(0)),
                "category 0 must be " + UNKNOWN_CATEGORY);
        checkArgument(categories.size() == categoryCounts.length, "categories and counts must have the same size");
        return new FeatureDescriptor(FeatureType.DISCRETE, name, missingCount, preserveMissing, 0f, 0f, categories,
                categoryCounts);
    }

    // the unknown category never wins, the first maximum does
    private static int findModeIndex(int[] counts) {
        int modeIndex = 0;
        int max = 0;
        for (int i = 1; i < counts.length; i++) {
            if (counts[i] > max) {
                max = counts[i];
                modeIndex = i;
            }
        }
        return modeIndex;
    }

    public boolean isDiscrete() {
        return featureType == FeatureType.DISCRETE;
    }

    public int getNumberOfCategories() {
        return categories.size();
    }

    /**
     * @param category a category name
     * @return the index of the category, or -1 if the feature has no such
     *         category
     */
    public int getCategoryIndex(String category) {
        Integer index = categoryIndex.get(category);
        return index == null ? -1 : index;
    }

    /**
     * @param index a category index
     * @return the name of the category
     * @throws IllegalStateException if the index is outside the category table
     */
    public String getCategoryName(int index) {
        if (index < 0 || index >= categories.size()) {
            throw new IllegalStateException(
                    "category index " + index + " is out of range for feature " + name + " with "
                            + categories.size() + " categories");
        }
        return categories.get(index);
    }

    public int[] getCategoryCounts() {
        return Arrays.copyOf(categoryCounts, categoryCounts.length);
    }

    /**
     * Renders a raw value of this feature for reports and logs.
     *
     * @param value a value read with this descriptor
     * @return the category name or the number
     */
    public String format(FeatureValue value) {
        if (isDiscrete()) {
            return getCategoryName(value.getCategoryIndex());
        }
        return Float.toString(value.getContinuousValue());
    }
}

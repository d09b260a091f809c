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

package com.amazon.randomforest.config;

/**
 * The kind of prediction a tree or forest makes. It is derived once from the
 * type of the predicted feature and never changes afterwards.
 */
public enum ModelType {
    /**
     * the predicted feature is discrete; leaves hold the mode category index and
     * the ensemble takes a majority vote
     */
    CLASSIFICATION,
    /**
     * the predicted feature is continuous; leaves hold the mean and the ensemble
     * averages
     */
    REGRESSION;

    public static ModelType forFeatureType(FeatureType featureType) {
        return featureType == FeatureType.DISCRETE ? CLASSIFICATION : REGRESSION;
    }
}

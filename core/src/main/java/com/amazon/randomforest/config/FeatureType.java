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
 * Determines how the 32 bits of a
 * {@link com.amazon.randomforest.data.FeatureValue} are read.
 */
public enum FeatureType {
    /**
     * numeric value stored as a float
     */
    CONTINUOUS,
    /**
     * index into the category table of the feature descriptor
     */
    DISCRETE;
}

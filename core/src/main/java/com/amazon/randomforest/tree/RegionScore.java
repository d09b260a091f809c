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

package com.amazon.randomforest.tree;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Score of an instance set under a split. Lower is better.
 */
@Getter
@ToString
@AllArgsConstructor
public class RegionScore {

    public static final RegionScore ZERO = new RegionScore(0.0, 0.0, 0.0);

    /**
     * the value compared between candidate splits
     */
    private final double combined;

    /**
     * score of the instances on the left side on their own
     */
    private final double left;

    /**
     * score of the instances on the right side on their own
     */
    private final double right;
}

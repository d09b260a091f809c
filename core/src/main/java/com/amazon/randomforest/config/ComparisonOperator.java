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

import static com.amazon.randomforest.CommonUtils.checkState;

/**
 * Operators used by split nodes. The left child of a split always uses the
 * inclusive or equal sense.
 */
public enum ComparisonOperator {

    LESS_THAN_OR_EQUAL("<=", FeatureType.CONTINUOUS),
    GREATER_THAN(">", FeatureType.CONTINUOUS),
    EQUAL("==", FeatureType.DISCRETE),
    NOT_EQUAL("!=", FeatureType.DISCRETE);

    private final String symbol;
    private final FeatureType featureType;

    ComparisonOperator(String symbol, FeatureType featureType) {
        this.symbol = symbol;
        this.featureType = featureType;
    }

    public String getSymbol() {
        return symbol;
    }

    public FeatureType getFeatureType() {
        return featureType;
    }

    /**
     * @return the operator for the complementary (right hand) side of a split
     */
    public ComparisonOperator complement() {
        switch (this) {
        case LESS_THAN_OR_EQUAL:
            return GREATER_THAN;
        case GREATER_THAN:
            return LESS_THAN_OR_EQUAL;
        case EQUAL:
            return NOT_EQUAL;
        default:
            return EQUAL;
        }
    }

    /**
     * @param featureType the type of feature a split is made on
     * @return the operator used on the left side of a split on that feature type
     */
    public static ComparisonOperator leftOperatorFor(FeatureType featureType) {
        return featureType == FeatureType.CONTINUOUS ? LESS_THAN_OR_EQUAL : EQUAL;
    }

    /**
     * Compares two raw values of the type this operator applies to.
     *
     * @param featureType   the type the caller reads the values as
     * @param valueBits     the raw bits of the value carried by the instance
     * @param thresholdBits the raw bits of the value stored in the split node
     * @return true if {@code value op threshold} holds
     * @throws IllegalStateException if the operator is not defined for the feature
     *                               type
     */
    public boolean test(FeatureType featureType, int valueBits, int thresholdBits) {
        checkState(this.featureType == featureType,
                "operator " + symbol + " cannot be applied to a " + featureType + " feature");
        switch (this) {
        case LESS_THAN_OR_EQUAL:
            return Float.intBitsToFloat(valueBits) <= Float.intBitsToFloat(thresholdBits);
        case GREATER_THAN:
            return Float.intBitsToFloat(valueBits) > Float.intBitsToFloat(thresholdBits);
        case EQUAL:
            return valueBits == thresholdBits;
        default:
            return valueBits != thresholdBits;
        }
    }

    /**
     * @param symbol the textual form used in persisted models
     * @return the matching operator
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("unknown comparison operator " + symbol);
    }
}

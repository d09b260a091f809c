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

package com.amazon.randomforest;

import java.util.Arrays;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.data.DatasetBuilder;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.TabularData;
import com.amazon.randomforest.returntypes.BuildResult;
import com.amazon.randomforest.returntypes.TrainingSummary;
import com.amazon.randomforest.testutils.NormalMixtureTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class RandomForestBenchmark {

    public final static int DATA_SIZE = 5_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "2", "16" })
        int dimensions;

        @Param({ "10", "50" })
        int numberOfTrees;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        TabularData data;
        RandomForest forest;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData testData = new NormalMixtureTestData();
            String[][] rows = testData.generateLabeledData(DATA_SIZE, dimensions, 17).toRows("base", "other");
            DatasetBuilder builder = new DatasetBuilder();
            for (int i = 0; i < dimensions; i++) {
                builder.addFeature("x" + i, FeatureType.CONTINUOUS);
            }
            builder.addFeature("label", FeatureType.DISCRETE);
            builder.addRows(Arrays.asList(rows));
            data = builder.build();
        }

        @Setup(Level.Invocation)
        public void setUpForest() {
            forest = RandomForest.builder().predictedFeatureIndex(dimensions).numberOfTrees(numberOfTrees)
                    .parallelExecutionEnabled(parallelExecutionEnabled).outOfBagEstimate(false).randomSeed(99)
                    .build();
        }
    }

    @Benchmark
    public BuildResult<TrainingSummary> trainOnly(BenchmarkState state) {
        return state.forest.train(state.data.getDefinition(), state.data.getDataset());
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public RandomForest trainAndEvaluate(BenchmarkState state, Blackhole blackhole) {
        RandomForest forest = state.forest;
        forest.train(state.data.getDefinition(), state.data.getDataset());

        for (Instance instance : state.data.getDataset()) {
            FeatureValue value = forest.evaluate(instance).orElse(FeatureValue.ZERO);
            blackhole.consume(value);
        }
        return forest;
    }
}

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

package com.amazon.randomforest.executor;

import static com.amazon.randomforest.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;

import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.tree.DecisionTreeBuilder;
import com.amazon.randomforest.tree.TreeBuildConfig;

/**
 * Splits the trees of a forest among workers, runs the workers and combines
 * their batches. Worker {@code i} builds its share of trees with the stream
 * seeded {@code seed + i}; the tree count is divided evenly and worker 0 also
 * builds the remainder. Batches are always combined in worker order, so a given
 * number of workers always yields the same forest.
 */
public abstract class AbstractForestBuildExecutor {

    protected final int numberOfWorkers;

    protected final DecisionTreeBuilder treeBuilder;

    protected AbstractForestBuildExecutor(int numberOfWorkers, DecisionTreeBuilder treeBuilder) {
        checkArgument(numberOfWorkers > 0, "numberOfWorkers must be greater than 0");
        this.numberOfWorkers = numberOfWorkers;
        this.treeBuilder = treeBuilder;
    }

    public int getNumberOfWorkers() {
        return numberOfWorkers;
    }

    /**
     * @param numberOfTrees   total number of trees, at least numberOfWorkers
     * @param numberOfWorkers number of workers
     * @return the number of trees each worker builds
     */
    public static int[] partition(int numberOfTrees, int numberOfWorkers) {
        checkArgument(numberOfWorkers > 0, "numberOfWorkers must be greater than 0");
        checkArgument(numberOfTrees >= numberOfWorkers, "numberOfTrees must be at least numberOfWorkers");
        int[] shares = new int[numberOfWorkers];
        for (int i = 0; i < numberOfWorkers; i++) {
            shares[i] = numberOfTrees / numberOfWorkers;
        }
        shares[0] += numberOfTrees % numberOfWorkers;
        return shares;
    }

    /**
     * Builds all trees of a forest.
     *
     * @param definition    the schema of the dataset
     * @param dataset       the training instances
     * @param config        the build parameters shared by all trees
     * @param numberOfTrees the number of trees
     * @param seed          the base seed of the worker streams
     * @return the combined batch, failed if any worker failed
     */
    public TreeBatch buildTrees(InstanceDefinition definition, Dataset dataset, TreeBuildConfig config,
            int numberOfTrees, long seed) {
        int[] shares = partition(numberOfTrees, numberOfWorkers);
        List<ForestWorker> workers = new ArrayList<>(numberOfWorkers);
        int firstTreeIndex = 0;
        for (int i = 0; i < numberOfWorkers; i++) {
            workers.add(new ForestWorker(i, firstTreeIndex, shares[i], seed, definition, dataset, config,
                    treeBuilder));
            firstTreeIndex += shares[i];
        }
        return TreeBatch.combine(execute(workers), definition.size());
    }

    /**
     * Runs every worker to completion and returns the batches in worker order.
     * If a worker throws, the exception is rethrown only after all workers have
     * finished.
     *
     * @param workers the workers, in worker order
     * @return one batch per worker
     */
    protected abstract List<TreeBatch> execute(List<ForestWorker> workers);
}

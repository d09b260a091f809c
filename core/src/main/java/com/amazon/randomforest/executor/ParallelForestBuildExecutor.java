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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;

import com.amazon.randomforest.tree.DecisionTreeBuilder;

/**
 * Runs one worker per thread of a private thread pool. Workers share only
 * read-only data (the definition and the dataset), so no locking is needed
 * until the single join.
 */
public class ParallelForestBuildExecutor extends AbstractForestBuildExecutor {

    private final ForkJoinPool forkJoinPool;

    public ParallelForestBuildExecutor(int threadPoolSize, DecisionTreeBuilder treeBuilder) {
        super(threadPoolSize, treeBuilder);
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    protected List<TreeBatch> execute(List<ForestWorker> workers) {
        List<ForkJoinTask<TreeBatch>> tasks = new ArrayList<>(workers.size());
        for (ForestWorker worker : workers) {
            tasks.add(forkJoinPool.submit(worker));
        }

        List<TreeBatch> batches = new ArrayList<>(workers.size());
        RuntimeException failure = null;
        for (ForkJoinTask<TreeBatch> task : tasks) {
            try {
                batches.add(task.join());
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return batches;
    }
}

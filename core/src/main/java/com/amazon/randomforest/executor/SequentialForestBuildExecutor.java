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

import com.amazon.randomforest.tree.DecisionTreeBuilder;

/**
 * Runs a single worker on the calling thread, so every tree is drawn from one
 * stream seeded with the forest seed.
 */
public class SequentialForestBuildExecutor extends AbstractForestBuildExecutor {

    public SequentialForestBuildExecutor(DecisionTreeBuilder treeBuilder) {
        super(1, treeBuilder);
    }

    @Override
    protected List<TreeBatch> execute(List<ForestWorker> workers) {
        List<TreeBatch> batches = new ArrayList<>(workers.size());
        for (ForestWorker worker : workers) {
            batches.add(worker.call());
        }
        return batches;
    }
}

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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.randomforest.util.RandomSource;

/**
 * An ordered, read-only collection of shared {@link Instance} references.
 * Bootstrap samples and split partitions are new datasets holding the same
 * references; instance contents are never copied.
 */
public class Dataset implements Iterable<Instance> {

    private final List<Instance> instances;

    public Dataset(List<Instance> instances) {
        this(checkNotNull(instances, "instances must not be null"), true);
    }

    private Dataset(List<Instance> instances, boolean copy) {
        this.instances = Collections.unmodifiableList(copy ? new ArrayList<>(instances) : instances);
    }

    // callers hand over a list nobody else holds
    private static Dataset wrap(List<Instance> owned) {
        return new Dataset(owned, false);
    }

    public int size() {
        return instances.size();
    }

    public boolean isEmpty() {
        return instances.isEmpty();
    }

    public Instance get(int index) {
        return instances.get(index);
    }

    public List<Instance> getInstances() {
        return instances;
    }

    public Stream<Instance> stream() {
        return instances.stream();
    }

    @Override
    public Iterator<Instance> iterator() {
        return instances.iterator();
    }

    /**
     * Creates a view holding the instances at the given positions, in the given
     * order; positions may repeat.
     *
     * @param indices positions in this dataset
     * @return the view
     */
    public Dataset select(int[] indices) {
        List<Instance> selected = new ArrayList<>(indices.length);
        for (int index : indices) {
            selected.add(instances.get(index));
        }
        return wrap(selected);
    }

    /**
     * Partitions the dataset into the instances accepted by {@code goesLeft} and
     * the rest, keeping the relative order on both sides.
     *
     * @param goesLeft the test applied to each instance
     * @return the two views
     */
    public Partition partition(Predicate<Instance> goesLeft) {
        List<Instance> left = new ArrayList<>();
        List<Instance> right = new ArrayList<>();
        for (Instance instance : instances) {
            if (goesLeft.test(instance)) {
                left.add(instance);
            } else {
                right.add(instance);
            }
        }
        return new Partition(wrap(left), wrap(right));
    }

    /**
     * @return the width of the narrowest instance, 0 for an empty dataset
     */
    public int getMinimumWidth() {
        int width = Integer.MAX_VALUE;
        for (Instance instance : instances) {
            width = Math.min(width, instance.getWidth());
        }
        return instances.isEmpty() ? 0 : width;
    }

    /**
     * Shuffles the instance order with a Fisher-Yates shuffle seeded with
     * {@code seed} and splits it into a training part holding
     * {@code round(trainingFraction * size)} instances and a test part holding
     * the rest.
     *
     * @param trainingFraction fraction of instances used for training, in (0, 1)
     * @param seed             seed of the shuffle
     * @return the two views
     */
    public DatasetSplit splitIntoTrainingAndTest(double trainingFraction, long seed) {
        checkArgument(trainingFraction > 0 && trainingFraction < 1, "trainingFraction must be in (0, 1)");
        int[] order = new int[instances.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        new RandomSource(seed).shuffle(order);
        int trainingSize = (int) (trainingFraction * order.length + 0.5);
        List<Instance> training = new ArrayList<>(trainingSize);
        List<Instance> test = new ArrayList<>(order.length - trainingSize);
        for (int i = 0; i < order.length; i++) {
            (i < trainingSize ? training : test).add(instances.get(order[i]));
        }
        return new DatasetSplit(wrap(training), wrap(test));
    }

    /**
     * The two sides of a binary split of a dataset.
     */
    @Getter
    @AllArgsConstructor
    public static class Partition {
        private final Dataset left;
        private final Dataset right;
    }
}

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

import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.returntypes.BuildResult;
import com.amazon.randomforest.util.RandomSource;

/**
 * Builds a {@link DecisionTree} by recursive binary partitioning.
 * <p>
 * At every node the builder scores each candidate split of each considered
 * feature and keeps the first one with the lowest score. The node becomes a
 * split only if that score is strictly lower than the score of the node's
 * instances undivided and both sides hold at least
 * {@link TreeBuildConfig#getMinLeafInstances()} instances; otherwise it becomes
 * a leaf. The depth limit, when set, also turns nodes into leaves. After both
 * children of a split are built, twin leaves are collapsed (see
 * {@link TwinLeafPruner}) and the node becomes a leaf computed from its own
 * instances.
 * <p>
 * Each split adds the drop from the node's score to the split's score to the
 * importance of the split feature.
 */
public class DecisionTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeBuilder.class);

    private final SplitCandidateGenerator candidateGenerator;

    public DecisionTreeBuilder() {
        this(new SplitCandidateGenerator());
    }

    public DecisionTreeBuilder(SplitCandidateGenerator candidateGenerator) {
        this.candidateGenerator = checkNotNull(candidateGenerator, "candidateGenerator must not be null");
    }

    /**
     * Builds a tree, drawing random feature subsets from a stream seeded with
     * {@link TreeBuildConfig#getRandomSeed()}.
     *
     * @param definition the schema of the dataset
     * @param dataset    the training instances
     * @param config     build parameters
     * @return the tree, or a failure describing the invalid input
     */
    public BuildResult<DecisionTree> build(InstanceDefinition definition, Dataset dataset, TreeBuildConfig config) {
        return build(definition, dataset, config, new RandomSource(config.getRandomSeed()));
    }

    /**
     * Builds a tree, drawing random feature subsets from the given stream.
     *
     * @param definition the schema of the dataset
     * @param dataset    the training instances
     * @param config     build parameters
     * @param random     the stream used when
     *                   {@link TreeBuildConfig#getFeaturesToConsiderPerNode()} is
     *                   positive
     * @return the tree, or a failure describing the invalid input
     */
    public BuildResult<DecisionTree> build(InstanceDefinition definition, Dataset dataset, TreeBuildConfig config,
            RandomSource random) {
        checkNotNull(config, "config must not be null");
        checkNotNull(random, "random must not be null");
        Optional<String> error = validate(definition, dataset, config);
        if (error.isPresent()) {
            log.error("cannot build tree {}: {}", config.getName(), error.get());
            return BuildResult.failure(error.get());
        }

        long start = System.currentTimeMillis();
        TreeState state = new TreeState(definition, config, random);
        double rootScore = state.scorer.score(dataset).getCombined();
        Node root = state.buildNode(dataset, 0, rootScore);
        DecisionTree tree = new DecisionTree(definition, config.getPredictedFeatureIndex(), config.getName(), root,
                state.nodeCount, state.leafCount, state.importance);
        log.info("built tree {} in {} seconds ({} leaves, {} nodes)", config.getName(),
                (System.currentTimeMillis() - start) / 1000.0, state.leafCount, state.nodeCount);
        return BuildResult.success(tree);
    }

    static Optional<String> validate(InstanceDefinition definition, Dataset dataset, TreeBuildConfig config) {
        if (definition == null || definition.isEmpty()) {
            return Optional.of("empty instance definition");
        }
        if (dataset == null || dataset.isEmpty()) {
            return Optional.of("empty dataset");
        }
        if (dataset.getMinimumWidth() < definition.size()) {
            return Optional.of("dataset has instances of width " + dataset.getMinimumWidth()
                    + " but the instance definition has " + definition.size() + " features");
        }
        if (config.getPredictedFeatureIndex() < 0 || config.getPredictedFeatureIndex() >= definition.size()) {
            return Optional.of("invalid index of feature to predict " + config.getPredictedFeatureIndex());
        }
        if (config.getMinLeafInstances() <= 0) {
            return Optional.of("minimum leaf instances must be greater than 0");
        }
        if (config.getMaxDepth() < 0) {
            return Optional.of("maximum depth must be non-negative");
        }
        return Optional.empty();
    }

    /**
     * Mutable state of one build.
     */
    private class TreeState {

        private final InstanceDefinition definition;
        private final TreeBuildConfig config;
        private final RandomSource random;
        private final RegionScorer scorer;
        private final ModelType modelType;
        private final int predictedFeatureIndex;
        private final FeatureDescriptor predicted;
        private final FeatureImportance[] importance;
        private final int featuresToConsider;
        private int nodeCount;
        private int leafCount;

        TreeState(InstanceDefinition definition, TreeBuildConfig config, RandomSource random) {
            this.definition = definition;
            this.config = config;
            this.random = random;
            this.predictedFeatureIndex = config.getPredictedFeatureIndex();
            this.predicted = definition.get(predictedFeatureIndex);
            this.modelType = ModelType.forFeatureType(predicted.getFeatureType());
            this.scorer = RegionScorer.forDefinition(definition, predictedFeatureIndex);
            this.importance = new FeatureImportance[definition.size()];
            for (int i = 0; i < importance.length; i++) {
                importance[i] = new FeatureImportance();
            }
            int requested = config.getFeaturesToConsiderPerNode();
            if (requested < 0 || requested > definition.size() - 1) {
                log.warn("invalid number of features to consider per node ({} of {}), considering all features",
                        requested, definition.size() - 1);
                requested = 0;
            }
            this.featuresToConsider = requested;
        }

        Node buildNode(Dataset instances, int depth, double score) {
            nodeCount += 1;

            if (config.getMaxDepth() > 0 && depth == config.getMaxDepth()) {
                return leaf(instances);
            }

            Split bestSplit = null;
            RegionScore bestScore = null;
            for (int featureIndex : featuresForNode()) {
                List<Split> candidates = candidateGenerator.generate(featureIndex, definition.get(featureIndex),
                        instances);
                for (Split candidate : candidates) {
                    RegionScore candidateScore = scorer.score(instances, candidate);
                    if (candidateScore.getCombined() < (bestScore == null ? score : bestScore.getCombined())) {
                        bestSplit = candidate;
                        bestScore = candidateScore;
                    }
                }
            }

            if (bestSplit == null) {
                return leaf(instances);
            }

            importance[bestSplit.getFeatureIndex()].add(score - bestScore.getCombined());

            Dataset.Partition partition = instances.partition(bestSplit::goesLeft);
            if (partition.getLeft().size() < config.getMinLeafInstances()
                    || partition.getRight().size() < config.getMinLeafInstances()) {
                return leaf(instances);
            }

            Node left = buildNode(partition.getLeft(), depth + 1, bestScore.getLeft());
            Node right = buildNode(partition.getRight(), depth + 1, bestScore.getRight());

            if (TwinLeafPruner.areTwins(modelType, left, right)) {
                nodeCount -= 2;
                leafCount -= 2;
                return leaf(instances);
            }
            return new SplitNode(bestSplit, left, right);
        }

        /**
         * @return the indices of the features considered at a node, ascending
         */
        int[] featuresForNode() {
            int[] candidates = new int[definition.size() - 1];
            for (int i = 0, j = 0; i < definition.size(); i++) {
                if (i != predictedFeatureIndex) {
                    candidates[j++] = i;
                }
            }
            if (featuresToConsider == 0) {
                return candidates;
            }
            // partial Fisher-Yates, the first featuresToConsider entries are the sample
            for (int i = 0; i < featuresToConsider; i++) {
                int j = i + random.nextIndex(candidates.length - i);
                int tmp = candidates[i];
                candidates[i] = candidates[j];
                candidates[j] = tmp;
            }
            int[] selected = Arrays.copyOf(candidates, featuresToConsider);
            Arrays.sort(selected);
            return selected;
        }

        LeafNode leaf(Dataset instances) {
            leafCount += 1;
            FeatureValue prediction = predicted.getFeatureType() == FeatureType.CONTINUOUS
                    ? FeatureValue.continuous(mean(instances))
                    : FeatureValue.discrete(mode(instances));
            return new LeafNode(predictedFeatureIndex, predicted.getFeatureType(), prediction,
                    config.isRetainLeafInstances() ? instances.getInstances() : null);
        }

        float mean(Dataset instances) {
            if (instances.isEmpty()) {
                return 0f;
            }
            double sum = 0.0;
            for (Instance instance : instances) {
                sum += instance.getContinuousValue(predictedFeatureIndex);
            }
            return (float) (sum / instances.size());
        }

        // ties go to the lowest category index
        int mode(Dataset instances) {
            int[] counts = new int[predicted.getNumberOfCategories()];
            for (Instance instance : instances) {
                int category = instance.getCategoryIndex(predictedFeatureIndex);
                if (category < 0 || category >= counts.length) {
                    throw new IllegalStateException("category index " + category
                            + " of the predicted feature is out of range");
                }
                counts[category] += 1;
            }
            int mode = 0;
            for (int i = 1; i < counts.length; i++) {
                if (counts[i] > counts[mode]) {
                    mode = i;
                }
            }
            return mode;
        }
    }
}

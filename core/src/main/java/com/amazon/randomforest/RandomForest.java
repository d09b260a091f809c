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

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkNotNull;
import static com.amazon.randomforest.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.executor.AbstractForestBuildExecutor;
import com.amazon.randomforest.executor.ParallelForestBuildExecutor;
import com.amazon.randomforest.executor.SequentialForestBuildExecutor;
import com.amazon.randomforest.executor.TreeBatch;
import com.amazon.randomforest.returntypes.BuildResult;
import com.amazon.randomforest.returntypes.FeatureImportanceEntry;
import com.amazon.randomforest.returntypes.OutOfBagPrediction;
import com.amazon.randomforest.returntypes.PredictionResults;
import com.amazon.randomforest.returntypes.TrainingSummary;
import com.amazon.randomforest.tree.DecisionTree;
import com.amazon.randomforest.tree.DecisionTreeBuilder;
import com.amazon.randomforest.tree.FeatureImportance;
import com.amazon.randomforest.tree.TreeBuildConfig;

/**
 * A random forest: an ensemble of decision trees, each trained on a bootstrap
 * sample of the training data.
 * <p>
 * Regression forests predict the mean of the tree predictions; classification
 * forests predict the category with the most votes, the lowest category index
 * winning ties. Training can fan out over a private thread pool. For a fixed
 * seed and thread count, training is reproducible; changing the thread count
 * changes which random stream each tree is drawn from.
 *
 * <pre>
 * RandomForest forest = RandomForest.builder().numberOfTrees(100).predictedFeatureIndex(4).build();
 * BuildResult&lt;TrainingSummary&gt; result = forest.train(definition, dataset);
 * </pre>
 */
public class RandomForest {

    private static final Logger log = LoggerFactory.getLogger(RandomForest.class);

    /**
     * Default number of trees.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 50;

    /**
     * Default base seed of the random streams.
     */
    public static final long DEFAULT_RANDOM_SEED = 42L;

    /**
     * Default maximum tree depth, 0 means unlimited.
     */
    public static final int DEFAULT_MAX_DEPTH = 0;

    /**
     * Default minimum number of instances on each side of a split.
     */
    public static final int DEFAULT_MIN_LEAF_INSTANCES = 2;

    /**
     * Default number of features drawn at each node, 0 means all.
     */
    public static final int DEFAULT_FEATURES_TO_CONSIDER_PER_NODE = 0;

    /**
     * Parallel execution is disabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    /**
     * The out-of-bag error estimate is computed by default.
     */
    public static final boolean DEFAULT_OUT_OF_BAG_ESTIMATE = true;

    private final int predictedFeatureIndex;
    private final int numberOfTrees;
    private final long randomSeed;
    private final int maxDepth;
    private final int minLeafInstances;
    private final int featuresToConsiderPerNode;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;
    private final boolean outOfBagEstimate;
    private final AbstractForestBuildExecutor buildExecutor;

    private InstanceDefinition definition;
    private List<DecisionTree> trees;
    private FeatureImportance[] featureImportance;

    public RandomForest(Builder<?> builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.predictedFeatureIndex >= 0, "predictedFeatureIndex must be non-negative");
        checkArgument(builder.maxDepth >= 0, "maxDepth must be non-negative");
        checkArgument(builder.featuresToConsiderPerNode >= 0, "featuresToConsiderPerNode must be non-negative");
        builder.threadPoolSize.ifPresent(size -> checkArgument(size > 0, "threadPoolSize must be greater than 0"));

        predictedFeatureIndex = builder.predictedFeatureIndex;
        numberOfTrees = builder.numberOfTrees;
        randomSeed = builder.randomSeed;
        maxDepth = builder.maxDepth;
        minLeafInstances = builder.minLeafInstances;
        featuresToConsiderPerNode = builder.featuresToConsiderPerNode;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        outOfBagEstimate = builder.outOfBagEstimate;

        DecisionTreeBuilder treeBuilder = new DecisionTreeBuilder();
        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.min(Runtime.getRuntime().availableProcessors(), numberOfTrees));
            buildExecutor = new ParallelForestBuildExecutor(threadPoolSize, treeBuilder);
        } else {
            threadPoolSize = 1;
            buildExecutor = new SequentialForestBuildExecutor(treeBuilder);
        }
        trees = Collections.emptyList();
    }

    /**
     * Creates a trained forest from existing trees, for example when restoring a
     * saved model.
     *
     * @param builder    the configuration the trees were trained with
     * @param definition the schema shared by the trees
     * @param trees      the trees, in forest order
     */
    public RandomForest(Builder<?> builder, InstanceDefinition definition, List<DecisionTree> trees) {
        this(builder);
        checkNotNull(definition, "definition must not be null");
        checkNotNull(trees, "trees must not be null");
        checkArgument(predictedFeatureIndex < definition.size(), "predictedFeatureIndex is out of range");
        for (DecisionTree tree : trees) {
            checkArgument(tree.getPredictedFeatureIndex() == predictedFeatureIndex,
                    "all trees must predict feature " + predictedFeatureIndex);
        }
        this.definition = definition;
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        this.featureImportance = sumImportance(this.trees, definition.size());
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Trains the forest, replacing any trees it already has. On failure the forest
     * is left without trees.
     *
     * @param definition the schema of the dataset
     * @param dataset    the training instances
     * @return the training summary, or a failure describing why no forest was
     *         built
     */
    public BuildResult<TrainingSummary> train(InstanceDefinition definition, Dataset dataset) {
        this.trees = Collections.emptyList();
        this.featureImportance = null;
        this.definition = null;

        Optional<String> error = validate(definition, dataset);
        if (error.isPresent()) {
            log.error("cannot train forest: {}", error.get());
            return BuildResult.failure(error.get());
        }

        long start = System.currentTimeMillis();
        log.info("training forest of {} trees using {} workers", numberOfTrees, buildExecutor.getNumberOfWorkers());
        TreeBatch batch = buildExecutor.buildTrees(definition, dataset, getTreeBuildConfig(), numberOfTrees,
                randomSeed);
        if (!batch.isSuccess()) {
            String message = batch.getFailure().get();
            log.error("forest training failed: {}", message);
            return BuildResult.failure(message);
        }

        this.definition = definition;
        this.trees = batch.getTrees();
        this.featureImportance = batch.getImportance();

        TrainingSummary.TrainingSummaryBuilder summary = TrainingSummary.builder().numberOfTrees(trees.size())
                .numberOfWorkers(buildExecutor.getNumberOfWorkers()).featureImportance(getFeatureImportance());
        if (outOfBagEstimate) {
            List<OutOfBagPrediction> predictions = estimateOutOfBag(dataset, batch.getOutOfBag());
            PredictionResults results = PredictionResults.forFeature(definition.get(predictedFeatureIndex));
            for (OutOfBagPrediction prediction : predictions) {
                results.add(prediction.getActual(), prediction.getPredicted());
            }
            log.info("out-of-bag estimate over {} instances: {}", predictions.size(), results);
            summary.outOfBagPredictions(predictions).outOfBagResults(results);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("trained forest of {} trees in {} seconds", trees.size(), elapsed / 1000.0);
        return BuildResult.success(summary.elapsedMillis(elapsed).build());
    }

    private Optional<String> validate(InstanceDefinition definition, Dataset dataset) {
        if (minLeafInstances <= 0) {
            return Optional.of("minimum instances per leaf must be greater than 0, was " + minLeafInstances);
        }
        if (threadPoolSize > numberOfTrees) {
            return Optional.of("cannot train " + numberOfTrees + " trees on " + threadPoolSize + " threads");
        }
        if (definition == null || definition.isEmpty()) {
            return Optional.of("empty instance definition");
        }
        if (dataset == null || dataset.isEmpty()) {
            return Optional.of("empty dataset");
        }
        if (predictedFeatureIndex >= definition.size()) {
            return Optional.of("invalid index of feature to predict " + predictedFeatureIndex);
        }
        if (dataset.getMinimumWidth() < definition.size()) {
            return Optional.of("dataset has instances of width " + dataset.getMinimumWidth()
                    + " but the instance definition has " + definition.size() + " features");
        }
        return Optional.empty();
    }

    /**
     * Predicts each training instance with the trees that did not see it. An
     * instance seen by every tree gets no prediction.
     */
    private List<OutOfBagPrediction> estimateOutOfBag(Dataset dataset, List<BitSet> outOfBag) {
        List<OutOfBagPrediction> predictions = new ArrayList<>();
        List<DecisionTree> voters = new ArrayList<>();
        for (int i = 0; i < dataset.size(); i++) {
            voters.clear();
            for (int t = 0; t < trees.size(); t++) {
                if (outOfBag.get(t).get(i)) {
                    voters.add(trees.get(t));
                }
            }
            if (voters.isEmpty()) {
                continue;
            }
            Instance instance = dataset.get(i);
            FeatureValue predicted = evaluate(voters, instance)
                    .orElseThrow(() -> new IllegalStateException("training instance could not be evaluated"));
            predictions.add(new OutOfBagPrediction(i, voters.size(), instance.getValue(predictedFeatureIndex),
                    predicted));
        }
        return predictions;
    }

    /**
     * @param instance the instance to predict
     * @return the ensemble prediction; a zero value with a warning if the forest
     *         has no trees; empty if the instance is narrower than the definition
     */
    public Optional<FeatureValue> evaluate(Instance instance) {
        return evaluate(trees, instance);
    }

    /**
     * @param instance the instance to predict
     * @return the prediction of each tree, in forest order
     */
    public List<FeatureValue> evaluateTrees(Instance instance) {
        List<FeatureValue> predictions = new ArrayList<>(trees.size());
        for (DecisionTree tree : trees) {
            tree.evaluate(instance).ifPresent(predictions::add);
        }
        return predictions;
    }

    /**
     * Predicts every instance of a dataset and compares the predictions with the
     * values of the predicted feature.
     *
     * @param dataset instances following the definition the forest was trained on
     * @return classification or regression results
     */
    public PredictionResults evaluate(Dataset dataset) {
        checkState(definition != null, "forest has not been trained");
        PredictionResults results = PredictionResults.forFeature(definition.get(predictedFeatureIndex));
        for (Instance instance : dataset) {
            FeatureValue actual = instance.getValue(predictedFeatureIndex);
            evaluate(instance).ifPresent(prediction -> results.add(actual, prediction));
        }
        return results;
    }

    private Optional<FeatureValue> evaluate(List<DecisionTree> members, Instance instance) {
        if (members.isEmpty()) {
            log.warn("evaluating a forest without trees");
            return Optional.of(FeatureValue.ZERO);
        }
        if (instance.getWidth() < definition.size()) {
            log.error("instance of width {} cannot be evaluated against a definition of {} features",
                    instance.getWidth(), definition.size());
            return Optional.empty();
        }

        if (getModelType() == ModelType.REGRESSION) {
            double sum = 0.0;
            for (DecisionTree tree : members) {
                sum += tree.findLeaf(instance).getPrediction().getContinuousValue();
            }
            return Optional.of(FeatureValue.continuous((float) (sum / members.size())));
        }

        int[] votes = new int[definition.get(predictedFeatureIndex).getNumberOfCategories()];
        for (DecisionTree tree : members) {
            int category = tree.findLeaf(instance).getPrediction().getCategoryIndex();
            checkState(category >= 0 && category < votes.length, "tree " + tree.getName()
                    + " predicted category " + category + " which is out of range");
            votes[category] += 1;
        }
        int winner = 0;
        for (int category = 1; category < votes.length; category++) {
            if (votes[category] > votes[winner]) {
                winner = category;
            }
        }
        return Optional.of(FeatureValue.discrete(winner));
    }

    /**
     * @return per-feature importance summed over all trees, excluding the
     *         predicted feature, ordered by label; empty for an untrained forest
     */
    public List<FeatureImportanceEntry> getFeatureImportance() {
        List<FeatureImportanceEntry> entries = new ArrayList<>();
        if (featureImportance == null) {
            return entries;
        }
        double maxScore = 0.0;
        for (int i = 0; i < featureImportance.length; i++) {
            if (i != predictedFeatureIndex && featureImportance[i].getCount() > 0) {
                maxScore = Math.max(maxScore, featureImportance[i].getSumScoreDelta());
            }
        }
        for (int i = 0; i < featureImportance.length; i++) {
            if (i == predictedFeatureIndex) {
                continue;
            }
            FeatureImportance importance = featureImportance[i];
            double score = importance.getCount() > 0 ? importance.getSumScoreDelta() : 0.0;
            double normalized = maxScore > 0 ? 100.0 * score / maxScore : 0.0;
            entries.add(new FeatureImportanceEntry(i, definition.get(i).getName(), score, importance.getCount(),
                    normalized));
        }
        entries.sort(Comparator.comparing(FeatureImportanceEntry::getLabel));
        return entries;
    }

    private static FeatureImportance[] sumImportance(List<DecisionTree> trees, int numberOfFeatures) {
        FeatureImportance[] sum = new FeatureImportance[numberOfFeatures];
        for (int i = 0; i < numberOfFeatures; i++) {
            sum[i] = new FeatureImportance();
        }
        for (DecisionTree tree : trees) {
            FeatureImportance[] importance = tree.getFeatureImportance();
            for (int i = 0; i < numberOfFeatures; i++) {
                sum[i].merge(importance[i]);
            }
        }
        return sum;
    }

    /**
     * @return the build configuration handed to every tree
     */
    public TreeBuildConfig getTreeBuildConfig() {
        return TreeBuildConfig.builder().predictedFeatureIndex(predictedFeatureIndex).maxDepth(maxDepth)
                .minLeafInstances(minLeafInstances).featuresToConsiderPerNode(featuresToConsiderPerNode)
                .randomSeed(randomSeed).build();
    }

    /**
     * @return the model type, or {@code null} before the forest is trained
     */
    public ModelType getModelType() {
        if (definition == null) {
            return null;
        }
        FeatureDescriptor predicted = definition.get(predictedFeatureIndex);
        return ModelType.forFeatureType(predicted.getFeatureType());
    }

    public boolean isTrained() {
        return !trees.isEmpty();
    }

    public List<DecisionTree> getTrees() {
        return trees;
    }

    public InstanceDefinition getDefinition() {
        return definition;
    }

    public int getPredictedFeatureIndex() {
        return predictedFeatureIndex;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMinLeafInstances() {
        return minLeafInstances;
    }

    public int getFeaturesToConsiderPerNode() {
        return featuresToConsiderPerNode;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    /**
     * @return the number of training workers, 1 when parallel execution is
     *         disabled
     */
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public boolean isOutOfBagEstimate() {
        return outOfBagEstimate;
    }

    public static class Builder<T extends Builder<T>> {

        private int predictedFeatureIndex;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int minLeafInstances = DEFAULT_MIN_LEAF_INSTANCES;
        private int featuresToConsiderPerNode = DEFAULT_FEATURES_TO_CONSIDER_PER_NODE;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private boolean outOfBagEstimate = DEFAULT_OUT_OF_BAG_ESTIMATE;

        public T predictedFeatureIndex(int predictedFeatureIndex) {
            this.predictedFeatureIndex = predictedFeatureIndex;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        public T maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return (T) this;
        }

        public T minLeafInstances(int minLeafInstances) {
            this.minLeafInstances = minLeafInstances;
            return (T) this;
        }

        public T featuresToConsiderPerNode(int featuresToConsiderPerNode) {
            this.featuresToConsiderPerNode = featuresToConsiderPerNode;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T outOfBagEstimate(boolean outOfBagEstimate) {
            this.outOfBagEstimate = outOfBagEstimate;
            return (T) this;
        }

        public RandomForest build() {
            return new RandomForest(this);
        }
    }
}

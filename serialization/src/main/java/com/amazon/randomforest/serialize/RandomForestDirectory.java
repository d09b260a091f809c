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

package com.amazon.randomforest.serialize;

import static com.amazon.randomforest.CommonUtils.checkArgument;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.randomforest.RandomForest;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.state.RandomForestMapper;
import com.amazon.randomforest.state.RandomForestState;
import com.amazon.randomforest.state.data.InstanceDefinitionMapper;
import com.amazon.randomforest.state.data.InstanceDefinitionState;
import com.amazon.randomforest.state.tree.DecisionTreeMapper;
import com.amazon.randomforest.state.tree.DecisionTreeState;
import com.amazon.randomforest.tree.DecisionTree;

/**
 * Stores a forest as a directory of JSON files: {@value #FOREST_FILE} holds the
 * forest configuration, {@value #DEFINITION_FILE} the instance definition, and
 * each tree is written to {@code tree<N>.<timestamp>.json} where N counts from
 * 1 and the timestamp is the write time in epoch seconds.
 * <p>
 * Reading picks up every tree file in the directory, so trees written by
 * separate runs over the same instance definition can be copied into one
 * directory and read back as a single forest.
 */
public class RandomForestDirectory {

    private static final Logger log = LoggerFactory.getLogger(RandomForestDirectory.class);

    public static final String FOREST_FILE = "rf.json";

    public static final String DEFINITION_FILE = "mlid.json";

    private static final Pattern TREE_FILE = Pattern.compile("tree(\\d{1,9})\\.(\\d{1,18})\\.json");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RandomForestDirectory() {
        this(RandomForestSerDe.defaultObjectMapper(), Clock.systemUTC());
    }

    /**
     * @param objectMapper the mapper used for every file
     * @param clock        the source of the timestamp in tree file names
     */
    public RandomForestDirectory(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static String treeFileName(int treeNumber, long timestamp) {
        return "tree" + treeNumber + "." + timestamp + ".json";
    }

    /**
     * Writes a trained forest into a directory, creating the directory if needed.
     *
     * @param forest    a trained forest
     * @param directory the target directory
     * @param overwrite if true, JSON files already in an existing directory are
     *                  removed first; if false, an existing directory is an error
     * @throws IOException if the directory exists and overwrite is false, or if
     *                     a file cannot be written
     */
    public void write(RandomForest forest, Path directory, boolean overwrite) throws IOException {
        checkArgument(forest.isTrained(), "only a trained forest can be saved");
        if (Files.isDirectory(directory)) {
            if (!overwrite) {
                throw new FileAlreadyExistsException(directory.toString(), null,
                        "model directory exists and overwrite is off");
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
                for (Path file : stream) {
                    Files.delete(file);
                }
            }
        } else {
            Files.createDirectories(directory);
        }

        objectMapper.writeValue(directory.resolve(DEFINITION_FILE).toFile(),
                new InstanceDefinitionMapper().toState(forest.getDefinition()));

        RandomForestMapper mapper = new RandomForestMapper();
        mapper.setSaveTreeState(false);
        mapper.setSaveInstanceDefinition(false);
        objectMapper.writeValue(directory.resolve(FOREST_FILE).toFile(), mapper.toState(forest));

        long timestamp = clock.instant().getEpochSecond();
        DecisionTreeMapper treeMapper = new DecisionTreeMapper();
        List<DecisionTree> trees = forest.getTrees();
        for (int i = 0; i < trees.size(); i++) {
            Path file = directory.resolve(treeFileName(i + 1, timestamp));
            objectMapper.writeValue(file.toFile(), treeMapper.toState(trees.get(i)));
        }
        log.info("wrote forest of {} trees to {}", trees.size(), directory);
    }

    /**
     * Reads a forest written by {@link #write}. Trees are ordered by the timestamp
     * in their file name and then by their number. Files that do not follow the
     * tree file naming are skipped.
     *
     * @param directory the model directory
     * @return the forest
     * @throws IOException if a required file is missing or cannot be parsed
     */
    public RandomForest read(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString());
        }
        InstanceDefinition definition = new InstanceDefinitionMapper().toModel(
                objectMapper.readValue(directory.resolve(DEFINITION_FILE).toFile(), InstanceDefinitionState.class));
        RandomForestState state = objectMapper.readValue(directory.resolve(FOREST_FILE).toFile(),
                RandomForestState.class);

        List<TreeFile> treeFiles = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (FOREST_FILE.equals(name) || DEFINITION_FILE.equals(name)) {
                    continue;
                }
                Matcher matcher = TREE_FILE.matcher(name);
                if (matcher.matches()) {
                    treeFiles.add(new TreeFile(Integer.parseInt(matcher.group(1)), Long.parseLong(matcher.group(2)),
                            file));
                } else {
                    log.warn("skipping {}, not a tree file", file);
                }
            }
        }
        treeFiles.sort(Comparator.comparingLong(TreeFile::getTimestamp).thenComparingInt(TreeFile::getNumber));
        checkArgument(!treeFiles.isEmpty(), "no tree files in " + directory);

        List<DecisionTreeState> treeStates = new ArrayList<>(treeFiles.size());
        for (TreeFile treeFile : treeFiles) {
            treeStates.add(objectMapper.readValue(treeFile.getPath().toFile(), DecisionTreeState.class));
        }
        if (treeStates.size() != state.getNumberOfTrees()) {
            log.info("forest in {} was saved with {} trees, read {}", directory, state.getNumberOfTrees(),
                    treeStates.size());
            state.setNumberOfTrees(treeStates.size());
            state.setThreadPoolSize(Math.min(state.getThreadPoolSize(), treeStates.size()));
        }
        RandomForest forest = new RandomForestMapper().toModel(state, definition, treeStates);
        log.info("read forest of {} trees from {}", forest.getTrees().size(), directory);
        return forest;
    }

    @Getter
    @AllArgsConstructor
    private static class TreeFile {
        private final int number;
        private final long timestamp;
        private final Path path;
    }
}

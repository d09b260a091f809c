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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

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
 * Serialize a Random Forest, or its parts, to and from JSON text. The
 * conversion goes through the state classes, so the JSON layout is the layout
 * of {@link RandomForestState}, {@link DecisionTreeState} and
 * {@link InstanceDefinitionState}.
 */
@Getter
public class RandomForestSerDe {

    private final RandomForestMapper mapper;
    private final ObjectMapper objectMapper;

    /**
     * Create a serializer with a default {@link RandomForestMapper} and a pretty
     * printing {@link ObjectMapper}.
     */
    public RandomForestSerDe() {
        this(new RandomForestMapper(), defaultObjectMapper());
    }

    public RandomForestSerDe(RandomForestMapper mapper, ObjectMapper objectMapper) {
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    /**
     * @param forest a trained forest
     * @return the JSON representation of the forest state
     * @throws JsonProcessingException if the state cannot be written
     */
    public String toJson(RandomForest forest) throws JsonProcessingException {
        return objectMapper.writeValueAsString(mapper.toState(forest));
    }

    /**
     * @param json the JSON representation of a forest state, holding its
     *             instance definition and trees
     * @return the forest
     * @throws JsonProcessingException if the text is not a forest state
     */
    public RandomForest fromJson(String json) throws JsonProcessingException {
        return mapper.toModel(objectMapper.readValue(json, RandomForestState.class));
    }

    public String treeToJson(DecisionTree tree) throws JsonProcessingException {
        return objectMapper.writeValueAsString(new DecisionTreeMapper().toState(tree));
    }

    public DecisionTree treeFromJson(String json, InstanceDefinition definition) throws JsonProcessingException {
        return new DecisionTreeMapper().toModel(objectMapper.readValue(json, DecisionTreeState.class), definition);
    }

    public String definitionToJson(InstanceDefinition definition) throws JsonProcessingException {
        return objectMapper.writeValueAsString(new InstanceDefinitionMapper().toState(definition));
    }

    public InstanceDefinition definitionFromJson(String json) throws JsonProcessingException {
        return new InstanceDefinitionMapper().toModel(objectMapper.readValue(json, InstanceDefinitionState.class));
    }
}

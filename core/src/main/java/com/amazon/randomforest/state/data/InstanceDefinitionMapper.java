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

package com.amazon.randomforest.state.data;

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.state.IStateMapper;
import com.amazon.randomforest.state.Version;

public class InstanceDefinitionMapper implements IStateMapper<InstanceDefinition, InstanceDefinitionState> {

    @Override
    public InstanceDefinitionState toState(InstanceDefinition model) {
        InstanceDefinitionState state = new InstanceDefinitionState();
        state.setVersion(Version.V1_0);
        List<FeatureDescriptorState> features = new ArrayList<>(model.size());
        for (FeatureDescriptor descriptor : model) {
            FeatureDescriptorState feature = new FeatureDescriptorState();
            feature.setFeatureType(descriptor.getFeatureType().name());
            feature.setName(descriptor.getName());
            feature.setMissingCount(descriptor.getMissingCount());
            feature.setPreserveMissing(descriptor.isPreserveMissing());
            feature.setMean(descriptor.getMean());
            feature.setStandardDeviation(descriptor.getStandardDeviation());
            feature.setModeIndex(descriptor.getModeIndex());
            if (descriptor.isDiscrete()) {
                feature.setCategories(new ArrayList<>(descriptor.getCategories()));
                feature.setCategoryCounts(descriptor.getCategoryCounts());
            }
            features.add(feature);
        }
        state.setFeatures(features);
        return state;
    }

    @Override
    public InstanceDefinition toModel(InstanceDefinitionState state) {
        checkNotNull(state.getFeatures(), "instance definition state has no features");
        List<FeatureDescriptor> descriptors = new ArrayList<>(state.getFeatures().size());
        for (FeatureDescriptorState feature : state.getFeatures()) {
            checkArgument(feature.getFeatureType() != null, "feature type is missing for " + feature.getName());
            FeatureType type = FeatureType.valueOf(feature.getFeatureType());
            FeatureDescriptor descriptor;
            if (type == FeatureType.DISCRETE) {
                List<String> categories = feature.getCategories() == null ? Collections.emptyList()
                        : feature.getCategories();
                int[] counts = feature.getCategoryCounts() == null ? new int[categories.size()]
                        : feature.getCategoryCounts();
                descriptor = FeatureDescriptor.discrete(feature.getName(), categories, counts,
                        feature.getMissingCount(), feature.isPreserveMissing());
                checkArgument(descriptor.getModeIndex() == feature.getModeIndex(),
                        "mode index of feature " + feature.getName() + " does not match its category counts");
            } else {
                descriptor = FeatureDescriptor.continuous(feature.getName(), feature.getMean(),
                        feature.getStandardDeviation(), feature.getMissingCount(), feature.isPreserveMissing());
            }
            descriptors.add(descriptor);
        }
        return new InstanceDefinition(descriptors);
    }
}

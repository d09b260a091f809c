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

import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The ordered schema shared by a dataset and every model trained on it: one
 * {@link FeatureDescriptor} per column.
 */
public class InstanceDefinition implements Iterable<FeatureDescriptor> {

    private final List<FeatureDescriptor> descriptors;

    public InstanceDefinition(List<FeatureDescriptor> descriptors) {
        checkNotNull(descriptors, "descriptors must not be null");
        this.descriptors = Collections.unmodifiableList(new ArrayList<>(descriptors));
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isEmpty() {
        return descriptors.isEmpty();
    }

    public FeatureDescriptor get(int featureIndex) {
        return descriptors.get(featureIndex);
    }

    public List<FeatureDescriptor> getDescriptors() {
        return descriptors;
    }

    /**
     * @param name a feature name
     * @return the position of the first feature with that name, or -1
     */
    public int indexOf(String name) {
        for (int i = 0; i < descriptors.size(); i++) {
            if (descriptors.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public Iterator<FeatureDescriptor> iterator() {
        return descriptors.iterator();
    }
}

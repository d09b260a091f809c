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

package com.amazon.randomforest.state;

/**
 * A state mapper whose models can only be rebuilt with information held
 * outside of their own state, such as the instance definition shared by the
 * trees of a forest.
 *
 * @param <Model>   the model type
 * @param <State>   the state type
 * @param <Context> the type of the shared information
 */
public interface IContextualStateMapper<Model, State, Context> {

    State toState(Model model);

    Model toModel(State state, Context context);
}

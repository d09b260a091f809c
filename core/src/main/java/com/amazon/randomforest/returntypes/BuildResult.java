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

package com.amazon.randomforest.returntypes;

import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Builder;

/**
 * The outcome of building a tree or training a forest. Configuration and data
 * problems detected before any work begins are reported through a failed
 * result carrying a diagnostic message rather than an exception.
 *
 * @param <T> the type of the built model
 */
@Builder
public class BuildResult<T> {

    private final T value;

    private final String message;

    public static <T> BuildResult<T> success(T value) {
        checkNotNull(value, "value must not be null");
        return BuildResult.<T>builder().value(value).message("ok").build();
    }

    public static <T> BuildResult<T> failure(String message) {
        checkNotNull(message, "message must not be null");
        return BuildResult.<T>builder().message(message).build();
    }

    /**
     * @return true if a model was built
     */
    public boolean isSuccess() {
        return value != null;
    }

    /**
     * @return the built model, or {@code Optional.empty()} if the build failed
     */
    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * @return {@code "ok"} for a successful build, otherwise a description of why
     *         the build failed
     */
    public String getMessage() {
        return message;
    }
}

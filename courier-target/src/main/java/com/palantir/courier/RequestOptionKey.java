/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.courier;

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;

/**
 * Identifies a kind of {@link RequestOption}. Keys are compared by identity, so each kind should be minted once and
 * held in a constant.
 */
public final class RequestOptionKey<T extends RequestOption> {

    private final String name;
    private final Class<T> optionClass;

    private RequestOptionKey(String name, Class<T> optionClass) {
        this.name = name;
        this.optionClass = optionClass;
    }

    public static <T extends RequestOption> RequestOptionKey<T> create(String name, Class<T> optionClass) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(optionClass, "optionClass");
        return new RequestOptionKey<>(name, optionClass);
    }

    public String name() {
        return name;
    }

    T cast(RequestOption option) {
        if (!optionClass.isInstance(option)) {
            throw new SafeIllegalArgumentException(
                    "Request option is not of the type declared by its key",
                    SafeArg.of("key", name),
                    SafeArg.of("expected", optionClass),
                    SafeArg.of("actualType", option.getClass()));
        }
        return optionClass.cast(option);
    }

    @Override
    public String toString() {
        return "RequestOptionKey{" + name + '}';
    }
}

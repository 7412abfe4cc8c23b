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
import java.util.Objects;
import javax.annotation.Nullable;

/** A named query parameter value emitted by {@link QueryParameters}. */
public final class QueryParameter {

    private final String name;

    @Nullable
    private final Object value;

    private QueryParameter(String name, @Nullable Object value) {
        this.name = name;
        this.value = value;
    }

    public static QueryParameter of(String name, @Nullable Object value) {
        Preconditions.checkArgumentNotNull(name, "Query parameter name must not be null");
        return new QueryParameter(name, value);
    }

    /** The name the value is sent under, which may differ from the name of the field holding it. */
    public String name() {
        return name;
    }

    @Nullable
    public Object value() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        QueryParameter that = (QueryParameter) other;
        return name.equals(that.name) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return "QueryParameter{name=" + name + ", value=" + value + '}';
    }
}

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

import java.util.List;

/**
 * A typed set of query options, typically generated alongside a request builder. Implementations list their own
 * fields, including those without a value, and choose the name each one is sent under.
 *
 * <pre>{@code
 * public List<QueryParameter> toQueryParameterEntries() {
 *     return ImmutableList.of(QueryParameter.of("%24top", top), QueryParameter.of("search", search));
 * }
 * }</pre>
 */
public interface QueryParameters {

    List<QueryParameter> toQueryParameterEntries();
}

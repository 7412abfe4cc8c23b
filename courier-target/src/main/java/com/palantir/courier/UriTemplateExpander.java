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

import java.util.Map;

/** A parsed <a href="https://tools.ietf.org/html/rfc6570">RFC 6570</a> URI template. */
public interface UriTemplateExpander {

    /**
     * Expands the template. Variables missing from {@code parameters} are undefined and expand to nothing.
     *
     * @throws UriResolutionException if a value cannot be expanded
     */
    String expand(Map<String, ?> parameters);
}

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

/**
 * Request-scoped configuration consumed by the transport, for example a handler or a redirect policy. At most one
 * option of each {@link #key() kind} is attached to a {@link RequestInformation}.
 */
public interface RequestOption {

    /** The kind of this option. Options sharing a key replace each other. */
    RequestOptionKey<?> key();
}

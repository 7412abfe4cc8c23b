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

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Serializes models into a request payload. A {@code null} key writes a bare value, either at the root or as an
 * element of a collection.
 */
public interface SerializationWriter {

    void writeStringValue(@Nullable String key, @Nullable String value) throws IOException;

    void writeBooleanValue(@Nullable String key, @Nullable Boolean value) throws IOException;

    void writeIntegerValue(@Nullable String key, @Nullable Integer value) throws IOException;

    void writeLongValue(@Nullable String key, @Nullable Long value) throws IOException;

    void writeDoubleValue(@Nullable String key, @Nullable Double value) throws IOException;

    void writeUuidValue(@Nullable String key, @Nullable UUID value) throws IOException;

    void writeOffsetDateTimeValue(@Nullable String key, @Nullable OffsetDateTime value) throws IOException;

    void writeLocalDateValue(@Nullable String key, @Nullable LocalDate value) throws IOException;

    void writeCollectionOfStringValues(@Nullable String key, @Nullable Iterable<String> values) throws IOException;

    void writeObjectValue(@Nullable String key, @Nullable Parsable value) throws IOException;

    void writeCollectionOfObjectValues(@Nullable String key, @Nullable Iterable<? extends Parsable> values)
            throws IOException;

    /** Completes serialization and returns the payload. No further values may be written afterwards. */
    InputStream getSerializedContent() throws IOException;
}

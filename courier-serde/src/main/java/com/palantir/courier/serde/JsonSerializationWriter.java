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

package com.palantir.courier.serde;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.palantir.courier.Parsable;
import com.palantir.courier.SerializationWriter;
import com.palantir.logsafe.Preconditions;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Writes JSON into an in-memory buffer. Values under a key are skipped when {@code null}, bare values (a {@code null}
 * key) are written as JSON {@code null}.
 */
@NotThreadSafe
public final class JsonSerializationWriter implements SerializationWriter {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final JsonGenerator generator;
    private boolean completed;

    JsonSerializationWriter(JsonFactory factory) throws IOException {
        this.generator = factory.createGenerator(buffer, JsonEncoding.UTF8);
    }

    @Override
    public void writeStringValue(@Nullable String key, @Nullable String value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeString(value);
        }
    }

    @Override
    public void writeBooleanValue(@Nullable String key, @Nullable Boolean value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeBoolean(value);
        }
    }

    @Override
    public void writeIntegerValue(@Nullable String key, @Nullable Integer value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeNumber(value);
        }
    }

    @Override
    public void writeLongValue(@Nullable String key, @Nullable Long value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeNumber(value);
        }
    }

    @Override
    public void writeDoubleValue(@Nullable String key, @Nullable Double value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeNumber(value);
        }
    }

    @Override
    public void writeUuidValue(@Nullable String key, @Nullable UUID value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeString(value.toString());
        }
    }

    @Override
    public void writeOffsetDateTimeValue(@Nullable String key, @Nullable OffsetDateTime value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeString(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value));
        }
    }

    @Override
    public void writeLocalDateValue(@Nullable String key, @Nullable LocalDate value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeString(DateTimeFormatter.ISO_LOCAL_DATE.format(value));
        }
    }

    @Override
    public void writeCollectionOfStringValues(@Nullable String key, @Nullable Iterable<String> values)
            throws IOException {
        if (writeKey(key, values)) {
            generator.writeStartArray();
            for (String value : values) {
                writeStringValue(null, value);
            }
            generator.writeEndArray();
        }
    }

    @Override
    public void writeObjectValue(@Nullable String key, @Nullable Parsable value) throws IOException {
        if (writeKey(key, value)) {
            generator.writeStartObject();
            value.serialize(this);
            generator.writeEndObject();
        }
    }

    @Override
    public void writeCollectionOfObjectValues(@Nullable String key, @Nullable Iterable<? extends Parsable> values)
            throws IOException {
        if (writeKey(key, values)) {
            generator.writeStartArray();
            for (Parsable value : values) {
                writeObjectValue(null, value);
            }
            generator.writeEndArray();
        }
    }

    @Override
    public InputStream getSerializedContent() throws IOException {
        if (!completed) {
            completed = true;
            generator.close();
        }
        return new ByteArrayInputStream(buffer.toByteArray());
    }

    /** Writes the field name if there is one, returning whether the value itself should be written. */
    private boolean writeKey(@Nullable String key, @Nullable Object value) throws IOException {
        Preconditions.checkState(!completed, "Serialized content has already been produced");
        if (key == null) {
            if (value == null) {
                generator.writeNull();
                return false;
            }
            return true;
        }
        if (value == null) {
            return false;
        }
        generator.writeFieldName(key);
        return true;
    }
}

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

import com.fasterxml.jackson.core.JsonFactory;
import com.google.common.annotations.VisibleForTesting;
import com.palantir.courier.SerializationWriter;
import com.palantir.courier.SerializationWriterFactory;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import java.io.IOException;
import javax.annotation.concurrent.ThreadSafe;

@ThreadSafe
public final class JsonSerializationWriterFactory implements SerializationWriterFactory {
    static final String CONTENT_TYPE = "application/json";

    private final JsonFactory jsonFactory;

    @VisibleForTesting
    JsonSerializationWriterFactory(JsonFactory jsonFactory) {
        this.jsonFactory = jsonFactory;
    }

    public static JsonSerializationWriterFactory create() {
        return new JsonSerializationWriterFactory(new JsonFactory());
    }

    @Override
    public String getValidContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public SerializationWriter getSerializationWriter(String contentType) {
        Preconditions.checkNotNull(contentType, "contentType");
        if (!ContentTypes.matches(CONTENT_TYPE, contentType)) {
            throw new SafeIllegalArgumentException(
                    "Content type is not supported by this factory",
                    SafeArg.of("contentType", contentType),
                    SafeArg.of("expected", CONTENT_TYPE));
        }
        try {
            return new JsonSerializationWriter(jsonFactory);
        } catch (IOException e) {
            throw new SafeRuntimeException("Failed to create JSON generator", e);
        }
    }

    @Override
    public String toString() {
        return "JsonSerializationWriterFactory{" + CONTENT_TYPE + '}';
    }
}

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

import com.google.common.collect.ImmutableMap;
import com.palantir.courier.SerializationWriter;
import com.palantir.courier.SerializationWriterFactory;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeUnsupportedOperationException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Dispatches to the {@link SerializationWriterFactory} registered for a content type. Parameters and vendor prefixes
 * are ignored when matching, so <pre>application/vnd.acme+json; charset=utf-8</pre> is served by the
 * <pre>application/json</pre> factory.
 *
 * <p>A registry has no single valid content type, so {@link #getValidContentType()} throws and a registry cannot be
 * registered into another registry's {@link Builder}.
 */
@ThreadSafe
public final class SerializationWriterFactoryRegistry implements SerializationWriterFactory {
    private static final SafeLogger log = SafeLoggerFactory.get(SerializationWriterFactoryRegistry.class);

    private final ImmutableMap<String, SerializationWriterFactory> factories;

    private SerializationWriterFactoryRegistry(ImmutableMap<String, SerializationWriterFactory> factories) {
        this.factories = factories;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A registry serving <pre>application/json</pre>. */
    public static SerializationWriterFactoryRegistry json() {
        return builder().register(JsonSerializationWriterFactory.create()).build();
    }

    /** Always throws: a registry serves several content types. */
    @Override
    public String getValidContentType() {
        throw new SafeUnsupportedOperationException("A registry does not have a single valid content type");
    }

    @Override
    public SerializationWriter getSerializationWriter(String contentType) {
        Preconditions.checkNotNull(contentType, "contentType");
        String mediaType = ContentTypes.normalize(contentType);
        SerializationWriterFactory factory = factories.get(mediaType);
        if (factory == null) {
            throw new SafeIllegalArgumentException(
                    "No serialization writer factory is registered for content type",
                    SafeArg.of("contentType", contentType),
                    SafeArg.of("registered", factories.keySet()));
        }
        if (!mediaType.equals(contentType)) {
            log.debug(
                    "Resolved serialization writer for vendor content type",
                    SafeArg.of("contentType", contentType),
                    SafeArg.of("mediaType", mediaType));
        }
        return factory.getSerializationWriter(mediaType);
    }

    @Override
    public String toString() {
        return "SerializationWriterFactoryRegistry{" + factories.keySet() + '}';
    }

    public static final class Builder {
        private final Map<String, SerializationWriterFactory> factories = new LinkedHashMap<>();

        private Builder() {}

        /** Registers a factory under its valid content type, replacing any factory registered for the same type. */
        public Builder register(SerializationWriterFactory factory) {
            Preconditions.checkNotNull(factory, "factory");
            if (factory instanceof SerializationWriterFactoryRegistry) {
                throw new SafeIllegalArgumentException("Registries cannot be registered into another registry");
            }
            String contentType = Preconditions.checkNotNull(factory.getValidContentType(), "contentType");
            factories.put(ContentTypes.normalize(contentType), factory);
            return this;
        }

        public SerializationWriterFactoryRegistry build() {
            return new SerializationWriterFactoryRegistry(ImmutableMap.copyOf(factories));
        }
    }
}

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

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Array;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.Collection;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/** Normalizes parameter values before they reach the URI template. */
final class ParameterValues {

    // RFC 3339, matching the ATOM format: no fractional seconds and a "+00:00" style offset
    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx", Locale.ROOT);
    private static final DateTimeFormatter LOCAL_DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss", Locale.ROOT);
    private static final DateTimeFormatter LOCAL_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT);
    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);
    private static final DateTimeFormatter OFFSET_TIME = DateTimeFormatter.ofPattern("HH:mm:ssxxx", Locale.ROOT);

    private ParameterValues() {}

    /** Renders date and time values as ISO-8601 strings. Collections are sanitized element-wise, other values are kept. */
    @Nullable
    static Object sanitize(@Nullable Object value) {
        if (value instanceof OffsetDateTime) {
            return DATE_TIME.format((OffsetDateTime) value);
        } else if (value instanceof ZonedDateTime) {
            return DATE_TIME.format((ZonedDateTime) value);
        } else if (value instanceof Instant) {
            return DATE_TIME.format(((Instant) value).atOffset(ZoneOffset.UTC));
        } else if (value instanceof Date) {
            return DATE_TIME.format(((Date) value).toInstant().atOffset(ZoneOffset.UTC));
        } else if (value instanceof LocalDateTime) {
            return LOCAL_DATE_TIME.format((LocalDateTime) value);
        } else if (value instanceof LocalDate) {
            return LOCAL_DATE.format((LocalDate) value);
        } else if (value instanceof LocalTime) {
            return LOCAL_TIME.format((LocalTime) value);
        } else if (value instanceof OffsetTime) {
            return OFFSET_TIME.format((OffsetTime) value);
        } else if (value instanceof UUID || value instanceof Enum) {
            return value.toString();
        } else if (value instanceof TemporalAccessor || value instanceof TemporalAmount) {
            // every other java.time type renders as ISO-8601, e.g. YearMonth "2021-01" or Duration "PT5S"
            return value.toString();
        } else if (value instanceof Collection) {
            ImmutableList.Builder<Object> elements = ImmutableList.builder();
            for (Object element : (Collection<?>) value) {
                if (element != null) {
                    elements.add(sanitize(element));
                }
            }
            return elements.build();
        }
        return value;
    }

    /** Unwraps optionals, returning {@code null} for an empty one. */
    @Nullable
    static Object unwrap(@Nullable Object value) {
        if (value instanceof Optional) {
            return ((Optional<?>) value).orElse(null);
        }
        return value;
    }

    /**
     * Whether a query value should be sent. Zero and {@code false} count as present, only missing and empty values
     * are dropped.
     */
    static boolean isPresent(@Nullable Object value) {
        if (value == null) {
            return false;
        } else if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        } else if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        } else if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        } else if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }
}

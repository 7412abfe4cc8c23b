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

import java.util.Locale;
import javax.annotation.Nullable;

final class ContentTypes {

    private static final String VENDOR_PREFIX = "vnd.";

    private ContentTypes() {}

    /**
     * Reduces a content type to its vendor-neutral media type, for example
     * <pre>application/vnd.acme.v2+json; charset=utf-8</pre> becomes <pre>application/json</pre>.
     */
    static String normalize(String contentType) {
        String mediaType = contentType;
        int parameters = mediaType.indexOf(';');
        if (parameters >= 0) {
            mediaType = mediaType.substring(0, parameters);
        }
        mediaType = mediaType.trim().toLowerCase(Locale.ROOT);
        int slash = mediaType.indexOf('/');
        int plus = mediaType.lastIndexOf('+');
        if (slash > 0 && plus > slash && mediaType.startsWith(VENDOR_PREFIX, slash + 1)) {
            return mediaType.substring(0, slash + 1) + mediaType.substring(plus + 1);
        }
        return mediaType;
    }

    static boolean matches(String contentType, @Nullable String typeToCheck) {
        return typeToCheck != null && normalize(typeToCheck).equals(contentType);
    }
}

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

import com.damnhandy.uri.template.MalformedUriTemplateException;
import com.damnhandy.uri.template.UriTemplate;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.UnsafeArg;
import java.util.LinkedHashMap;
import java.util.Map;

public final class UriTemplates {

    private UriTemplates() {}

    /** Returns a factory supporting all RFC 6570 expression levels, up to and including level 4. */
    public static UriTemplateExpanderFactory rfc6570() {
        return Rfc6570.INSTANCE;
    }

    private enum Rfc6570 implements UriTemplateExpanderFactory {
        INSTANCE;

        @Override
        public UriTemplateExpander create(String template) {
            Preconditions.checkNotNull(template, "template");
            try {
                return new Rfc6570Expander(UriTemplate.fromTemplate(template), template);
            } catch (MalformedUriTemplateException e) {
                throw new UriResolutionException("Malformed URI template", e, UnsafeArg.of("template", template));
            }
        }
    }

    private static final class Rfc6570Expander implements UriTemplateExpander {
        private final UriTemplate parsed;
        private final String template;

        private Rfc6570Expander(UriTemplate parsed, String template) {
            this.parsed = parsed;
            this.template = template;
        }

        @Override
        public String expand(Map<String, ?> parameters) {
            Preconditions.checkNotNull(parameters, "parameters");
            try {
                // UriTemplate retains the values it expands, so hand it a private copy
                return parsed.expand(new LinkedHashMap<String, Object>(parameters));
            } catch (RuntimeException e) {
                // VariableExpansionException, or a failure exploding a value the engine cannot render
                throw new UriResolutionException(
                        "Failed to expand URI template", e, UnsafeArg.of("template", template));
            }
        }

        @Override
        public String toString() {
            return "Rfc6570Expander{" + template + '}';
        }
    }
}

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
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Describes a single outgoing request before it is handed to a transport. Callers accumulate a
 * <a href="https://tools.ietf.org/html/rfc6570">URI template</a>, path and query parameters, headers, options and a
 * body, then call {@link #getUri()} to resolve the final URI.
 *
 * <p>The resolved URI is produced either by a raw URL override ({@link #setUri(String)} or the
 * {@link #RAW_URL_KEY} path parameter) or by expanding the template against the merged parameters, never both.
 */
@NotThreadSafe
public final class RequestInformation {
    private static final SafeLogger log = SafeLoggerFactory.get(RequestInformation.class);

    /** Path parameter holding a raw URL which replaces template expansion. */
    public static final String RAW_URL_KEY = "request-raw-url";

    /** Path parameter required by templates containing a <code>{+baseurl}</code> expression. */
    public static final String BASE_URL_KEY = "baseurl";

    public static final String CONTENT_TYPE_HEADER = "Content-Type";
    public static final String BINARY_CONTENT_TYPE = "application/octet-stream";

    private static final String BASE_URL_TOKEN = "{+baseurl}";

    private final UriTemplateExpanderFactory uriTemplates;

    @Nullable
    private String urlTemplate;

    private Map<String, Object> pathParameters = new LinkedHashMap<>();
    private Map<String, Object> queryParameters = new LinkedHashMap<>();

    @Nullable
    private String uri;

    @Nullable
    private HttpMethod httpMethod;

    private final Map<String, String> headers = new LinkedHashMap<>();

    @Nullable
    private InputStream content;

    @SuppressWarnings("DangerousIdentityKey")
    private final Map<RequestOptionKey<?>, RequestOption> requestOptions = new LinkedHashMap<>();

    public RequestInformation() {
        this(UriTemplates.rfc6570());
    }

    public RequestInformation(UriTemplateExpanderFactory uriTemplates) {
        this.uriTemplates = Preconditions.checkNotNull(uriTemplates, "uriTemplates");
    }

    /** Creates a request for the given method and URL template. */
    public static RequestInformation of(HttpMethod httpMethod, String urlTemplate) {
        RequestInformation request = new RequestInformation();
        request.setHttpMethod(httpMethod);
        request.setUrlTemplate(urlTemplate);
        return request;
    }

    @Nullable
    public String getUrlTemplate() {
        return urlTemplate;
    }

    public void setUrlTemplate(String urlTemplate) {
        this.urlTemplate = Preconditions.checkNotNull(urlTemplate, "urlTemplate");
    }

    @Nullable
    public HttpMethod getHttpMethod() {
        return httpMethod;
    }

    /** Sets the HTTP method. A request's method may be set once; setting the same method again is a no-op. */
    public void setHttpMethod(HttpMethod httpMethod) {
        Preconditions.checkNotNull(httpMethod, "httpMethod");
        if (this.httpMethod != null && this.httpMethod != httpMethod) {
            throw new SafeIllegalStateException(
                    "HTTP method has already been set",
                    SafeArg.of("existing", this.httpMethod),
                    SafeArg.of("requested", httpMethod));
        }
        this.httpMethod = httpMethod;
    }

    /**
     * Resolves the URI of this request.
     *
     * @throws SafeIllegalArgumentException if the template requires a {@value #BASE_URL_KEY} path parameter which is
     *     not present
     * @throws UriResolutionException if the template cannot be parsed or expanded
     */
    public String getUri() {
        if (uri != null) {
            return uri;
        }
        Object rawUrl = pathParameters.get(RAW_URL_KEY);
        if (rawUrl instanceof String) {
            log.debug("Resolving request URI from raw url path parameter");
            setUri((String) rawUrl);
            return (String) rawUrl;
        }

        String template = urlTemplate;
        if (template == null) {
            throw new SafeIllegalStateException("A URL template or raw URL is required to resolve the request URI");
        }
        UriTemplateExpander expander = uriTemplates.create(template);
        if (template.toLowerCase(Locale.ROOT).contains(BASE_URL_TOKEN) && pathParameters.get(BASE_URL_KEY) == null) {
            throw new SafeIllegalArgumentException(
                    "Path parameters must contain a value for the base url for the url to be built",
                    SafeArg.of("parameter", BASE_URL_KEY));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        pathParameters.forEach((name, value) -> parameters.put(name, ParameterValues.sanitize(value)));
        queryParameters.forEach((name, value) -> parameters.put(name, ParameterValues.sanitize(value)));
        return expander.expand(parameters);
    }

    /** Resolves the URI of this request as a {@link URI}. */
    public URI toUri() {
        String resolved = getUri();
        try {
            return new URI(resolved);
        } catch (URISyntaxException e) {
            throw new UriResolutionException("Resolved request URI is not valid", e, UnsafeArg.of("uri", resolved));
        }
    }

    /**
     * Sets the raw URI of this request, taking precedence over the URL template. Path and query parameters are
     * discarded.
     */
    public void setUri(String rawUri) {
        if (rawUri == null || rawUri.isEmpty()) {
            throw new SafeIllegalArgumentException("uri cannot be empty");
        }
        this.uri = rawUri;
        this.pathParameters = new LinkedHashMap<>();
        this.queryParameters = new LinkedHashMap<>();
    }

    public Map<String, Object> getPathParameters() {
        return Collections.unmodifiableMap(pathParameters);
    }

    /** Replaces all path parameters of this request. */
    public void setPathParameters(Map<String, ?> parameters) {
        Preconditions.checkNotNull(parameters, "parameters");
        this.pathParameters = new LinkedHashMap<>(parameters);
    }

    public Map<String, Object> getQueryParameters() {
        return Collections.unmodifiableMap(queryParameters);
    }

    /**
     * Adds the query parameters produced by the given options object. Parameters without a value are skipped, see
     * {@link #addQueryParameter(String, Object)}.
     */
    public void setQueryParameters(@Nullable QueryParameters parameters) {
        if (parameters == null) {
            return;
        }
        for (QueryParameter parameter : parameters.toQueryParameterEntries()) {
            addQueryParameter(parameter.name(), parameter.value());
        }
    }

    /**
     * Adds a single query parameter. Null values, empty strings, empty collections, maps and arrays, and empty
     * optionals are skipped rather than sent as empty parameters. Zero and {@code false} are kept.
     */
    public void addQueryParameter(String name, @Nullable Object value) {
        Preconditions.checkArgumentNotNull(name, "Query parameter name must not be null");
        Object unwrapped = ParameterValues.unwrap(value);
        if (ParameterValues.isPresent(unwrapped)) {
            queryParameters.put(name, unwrapped);
        }
    }

    /** Returns the headers of this request. Names are case-sensitive as stored. */
    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /** Merges the given headers into this request, replacing the values of headers that are already present. */
    public void setHeaders(Map<String, String> newHeaders) {
        Preconditions.checkNotNull(newHeaders, "headers");
        newHeaders.forEach((name, value) -> {
            Preconditions.checkArgumentNotNull(name, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            headers.put(name, value);
        });
    }

    /** The body of this request, or empty if no content has been set. */
    public Optional<InputStream> getContent() {
        return Optional.ofNullable(content);
    }

    /** Sets the body of this request to the given binary stream with content type {@value #BINARY_CONTENT_TYPE}. */
    public void setStreamContent(InputStream stream) {
        this.content = Preconditions.checkNotNull(stream, "stream");
        headers.put(CONTENT_TYPE_HEADER, BINARY_CONTENT_TYPE);
    }

    /**
     * Serializes the given models as the body of this request.
     *
     * @see #setContentFromParsable(SerializationWriterFactory, String, List)
     */
    public void setContentFromParsable(
            SerializationWriterFactory writerFactory, String contentType, Parsable... values) {
        Preconditions.checkNotNull(values, "values");
        setContentFromParsable(writerFactory, contentType, Arrays.asList(values));
    }

    /**
     * Serializes the given models as the body of this request. A single value is written as an object, several values
     * as a collection of objects.
     *
     * @throws SafeIllegalArgumentException if {@code values} is empty
     * @throws SerializationException if a writer cannot be obtained or serialization fails
     */
    public void setContentFromParsable(
            SerializationWriterFactory writerFactory, String contentType, List<? extends Parsable> values) {
        Preconditions.checkNotNull(writerFactory, "writerFactory");
        Preconditions.checkNotNull(contentType, "contentType");
        if (values == null || values.isEmpty()) {
            throw new SafeIllegalArgumentException("values cannot be empty");
        }
        try {
            SerializationWriter writer = writerFactory.getSerializationWriter(contentType);
            if (values.size() == 1) {
                writer.writeObjectValue(null, values.get(0));
            } else {
                writer.writeCollectionOfObjectValues(null, ImmutableList.copyOf(values));
            }
            this.content = writer.getSerializedContent();
            headers.put(CONTENT_TYPE_HEADER, contentType);
        } catch (IOException | RuntimeException e) {
            throw new SerializationException(
                    "Could not serialize payload",
                    e,
                    SafeArg.of("contentType", contentType),
                    SafeArg.of("valueCount", values.size()));
        }
    }

    /**
     * Returns the options of this request keyed by their kind. Options are unique by kind: when an option of the same
     * kind is added twice, the last one wins.
     */
    public Map<RequestOptionKey<?>, RequestOption> getRequestOptions() {
        return Collections.unmodifiableMap(requestOptions);
    }

    public <T extends RequestOption> Optional<T> getRequestOption(RequestOptionKey<T> key) {
        Preconditions.checkNotNull(key, "key");
        RequestOption option = requestOptions.get(key);
        return option == null ? Optional.empty() : Optional.of(key.cast(option));
    }

    public void addRequestOptions(RequestOption... options) {
        Preconditions.checkNotNull(options, "options");
        addRequestOptions(Arrays.asList(options));
    }

    public void addRequestOptions(Collection<? extends RequestOption> options) {
        Preconditions.checkNotNull(options, "options");
        for (RequestOption option : options) {
            Preconditions.checkNotNull(option, "option");
            RequestOptionKey<?> key = Preconditions.checkNotNull(option.key(), "option key");
            requestOptions.put(key, key.cast(option));
        }
    }

    /** Removes the options of the same kinds as the given options. Kinds which are not present are ignored. */
    public void removeRequestOptions(RequestOption... options) {
        Preconditions.checkNotNull(options, "options");
        for (RequestOption option : options) {
            Preconditions.checkNotNull(option, "option");
            requestOptions.remove(option.key());
        }
    }

    @Override
    public String toString() {
        return "RequestInformation{"
                + "httpMethod="
                + httpMethod
                + ", urlTemplate="
                + urlTemplate
                // Values are excluded to avoid the risk of logging credentials
                + ", headerKeys="
                + headers.keySet()
                + ", pathParameterKeys="
                + pathParameters.keySet()
                + ", queryParameterKeys="
                + queryParameters.keySet()
                + ", requestOptions="
                + requestOptions.keySet()
                + ", hasContent="
                + (content != null)
                + '}';
    }
}

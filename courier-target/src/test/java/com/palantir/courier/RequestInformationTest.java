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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public final class RequestInformationTest {

    private static final String BASE_URL = "https://api.example.com";

    private final RequestInformation request = new RequestInformation();

    @Test
    public void testSetUriIsReturnedVerbatim() {
        request.setUri("https://example.com/raw?x=1");
        assertThat(request.getUri()).isEqualTo("https://example.com/raw?x=1");
        assertThat(request.getUri()).isEqualTo("https://example.com/raw?x=1");
    }

    @Test
    public void testSetUriClearsParameters() {
        request.setUrlTemplate("{+baseurl}/users/{id}");
        request.setPathParameters(ImmutableMap.of("baseurl", BASE_URL, "id", "42"));
        request.addQueryParameter("q", "search");

        request.setUri("https://example.com/other");

        assertThat(request.getPathParameters()).isEmpty();
        assertThat(request.getQueryParameters()).isEmpty();
        assertThat(request.getUri()).isEqualTo("https://example.com/other");
    }

    @Test
    public void testSetUriRejectsEmpty() {
        assertThatLoggableExceptionThrownBy(() -> request.setUri(""))
                .isExactlyInstanceOf(SafeIllegalArgumentException.class)
                .hasLogMessage("uri cannot be empty")
                .hasExactlyArgs();
    }

    @Test
    public void testUriIsExpandedFromTemplate() {
        request.setUrlTemplate("{+baseurl}/users/{id}");
        request.setPathParameters(ImmutableMap.of("baseurl", BASE_URL, "id", "42"));
        assertThat(request.getUri()).isEqualTo("https://api.example.com/users/42");
    }

    @Test
    public void testResolutionDoesNotConsumeParameters() {
        request.setUrlTemplate("{+baseurl}/users/{id}");
        request.setPathParameters(ImmutableMap.of("baseurl", BASE_URL, "id", "42"));
        assertThat(request.getUri()).isEqualTo(request.getUri());
        assertThat(request.getPathParameters()).containsOnlyKeys("baseurl", "id");
    }

    @Test
    public void testMissingBaseUrlFails() {
        request.setUrlTemplate("{+baseurl}/users/{id}");
        request.setPathParameters(ImmutableMap.of("id", "42"));
        assertThatLoggableExceptionThrownBy(request::getUri)
                .isExactlyInstanceOf(SafeIllegalArgumentException.class)
                .hasExactlyArgs(SafeArg.of("parameter", "baseurl"));
    }

    @Test
    public void testBaseUrlTokenIsMatchedCaseInsensitively() {
        request.setUrlTemplate("{+BaseUrl}/users");
        assertThatThrownBy(request::getUri).isInstanceOf(SafeIllegalArgumentException.class);
    }

    @Test
    public void testTemplateWithoutBaseUrlDoesNotRequireIt() {
        request.setUrlTemplate("/users/{id}");
        request.setPathParameters(ImmutableMap.of("id", "42"));
        assertThat(request.getUri()).isEqualTo("/users/42");
    }

    @Test
    public void testQueryParametersWinOverPathParameters() {
        request.setUrlTemplate("/search{?q,limit}");
        request.setPathParameters(ImmutableMap.of("limit", 10));
        request.addQueryParameter("limit", 20);
        assertThat(request.getUri()).isEqualTo("/search?limit=20");
    }

    @Test
    public void testDateTimeParametersAreRenderedAsRfc3339() {
        request.setUrlTemplate("/events/{+since}");
        request.setPathParameters(
                ImmutableMap.of("since", OffsetDateTime.of(2021, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC)));
        assertThat(request.getUri()).isEqualTo("/events/2021-01-02T03:04:05+00:00");
    }

    @Test
    public void testDateParametersInQuery() {
        request.setUrlTemplate("/events{?day}");
        request.addQueryParameter("day", LocalDate.of(2021, 1, 2));
        assertThat(request.getUri()).isEqualTo("/events?day=2021-01-02");
    }

    @Test
    public void testTemporalQueryValuesExpand() {
        request.setUrlTemplate("/reports{?month,at}");
        request.addQueryParameter("month", YearMonth.of(2021, 1));
        request.addQueryParameter("at", OffsetTime.of(3, 4, 5, 0, ZoneOffset.UTC));
        assertThat(request.getUri()).isEqualTo("/reports?month=2021-01&at=03%3A04%3A05%2B00%3A00");
    }

    @Test
    public void testUnrenderableValueFailsResolution() {
        request.setUrlTemplate("/n{?v}");
        request.addQueryParameter("v", new Object());
        assertThatThrownBy(request::getUri).isExactlyInstanceOf(UriResolutionException.class);
    }

    @Test
    public void testRawUrlPathParameterOverridesTemplate() {
        request.setUrlTemplate("{+baseurl}/users/{id}");
        request.setPathParameters(ImmutableMap.of(RequestInformation.RAW_URL_KEY, "https://example.com/next?page=2"));
        request.addQueryParameter("q", "ignored");

        assertThat(request.getUri()).isEqualTo("https://example.com/next?page=2");
        assertThat(request.getPathParameters()).isEmpty();
        assertThat(request.getQueryParameters()).isEmpty();
        assertThat(request.getUri()).isEqualTo("https://example.com/next?page=2");
    }

    @Test
    public void testNonStringRawUrlPathParameterIsIgnored() {
        request.setUrlTemplate("/users");
        request.setPathParameters(ImmutableMap.of(RequestInformation.RAW_URL_KEY, 7));
        assertThat(request.getUri()).isEqualTo("/users");
    }

    @Test
    public void testMissingTemplateFails() {
        assertThatThrownBy(request::getUri).isInstanceOf(SafeIllegalStateException.class);
    }

    @Test
    public void testMalformedTemplateFails() {
        request.setUrlTemplate("/users/{id");
        assertThatThrownBy(request::getUri)
                .isInstanceOf(UriResolutionException.class)
                .hasCauseInstanceOf(RuntimeException.class);
    }

    @Test
    public void testToUri() {
        request.setUrlTemplate("{+baseurl}/users/{id}{?q}");
        request.setPathParameters(ImmutableMap.of("baseurl", BASE_URL, "id", "42"));
        request.addQueryParameter("q", "a b");
        URI uri = request.toUri();
        assertThat(uri.getHost()).isEqualTo("api.example.com");
        assertThat(uri.getPath()).isEqualTo("/users/42");
        assertThat(uri.getQuery()).isEqualTo("q=a b");
    }

    @Test
    public void testToUriRejectsInvalidRawUri() {
        request.setUri("https://example.com/a b");
        assertThatThrownBy(request::toUri)
                .isInstanceOf(UriResolutionException.class)
                .hasCauseInstanceOf(URISyntaxException.class);
    }

    @Test
    public void testSetPathParametersReplaces() {
        request.setPathParameters(ImmutableMap.of("a", "1"));
        request.setPathParameters(ImmutableMap.of("b", "2"));
        assertThat(request.getPathParameters()).containsExactly(entry("b", "2"));
    }

    @Test
    public void testSetQueryParametersUsesEmittedNames() {
        request.setQueryParameters(new ListOptions(5, "term", null));
        assertThat(request.getQueryParameters()).containsOnlyKeys("max", "search");
        assertThat(request.getQueryParameters()).containsEntry("max", 5);
    }

    @Test
    public void testSetQueryParametersSkipsEmptyValues() {
        request.setQueryParameters(() -> ImmutableList.of(
                QueryParameter.of("none", null),
                QueryParameter.of("blank", ""),
                QueryParameter.of("emptyList", ImmutableList.of()),
                QueryParameter.of("emptyOptional", Optional.empty()),
                QueryParameter.of("emptyArray", new String[0]),
                QueryParameter.of("zero", 0),
                QueryParameter.of("no", false),
                QueryParameter.of("present", Optional.of("x"))));
        assertThat(request.getQueryParameters())
                .containsOnlyKeys("zero", "no", "present")
                .containsEntry("zero", 0)
                .containsEntry("no", false)
                .containsEntry("present", "x");
    }

    @Test
    public void testSetQueryParametersIgnoresNull() {
        request.addQueryParameter("a", "1");
        request.setQueryParameters(null);
        assertThat(request.getQueryParameters()).containsOnlyKeys("a");
    }

    @Test
    public void testQueryOptionsExpandIntoTemplate() {
        request.setUrlTemplate("/users{?max,search,orderby}");
        request.setQueryParameters(new ListOptions(5, "term", ImmutableList.of("name", "id")));
        assertThat(request.getUri()).isEqualTo("/users?max=5&search=term&orderby=name,id");
    }

    @Test
    public void testSetHeadersMerges() {
        request.setHeaders(ImmutableMap.of("X", "1"));
        request.setHeaders(ImmutableMap.of("Y", "2"));
        assertThat(request.getHeaders()).isEqualTo(ImmutableMap.of("X", "1", "Y", "2"));

        request.setHeaders(ImmutableMap.of("X", "3"));
        assertThat(request.getHeaders()).isEqualTo(ImmutableMap.of("X", "3", "Y", "2"));
    }

    @Test
    public void testHeaderNamesAreCaseSensitive() {
        request.setHeaders(ImmutableMap.of("Accept", "a"));
        request.setHeaders(ImmutableMap.of("accept", "b"));
        assertThat(request.getHeaders()).containsOnlyKeys("Accept", "accept");
    }

    @Test
    public void testSetStreamContent() {
        InputStream stream = new ByteArrayInputStream("data".getBytes(StandardCharsets.UTF_8));
        request.setHeaders(ImmutableMap.of(RequestInformation.CONTENT_TYPE_HEADER, "application/json"));

        request.setStreamContent(stream);

        assertThat(request.getContent()).containsSame(stream);
        assertThat(request.getHeaders())
                .containsEntry(RequestInformation.CONTENT_TYPE_HEADER, RequestInformation.BINARY_CONTENT_TYPE);
    }

    @Test
    public void testContentIsInitiallyEmpty() {
        assertThat(request.getContent()).isEmpty();
    }

    @Test
    public void testHttpMethodIsSetOnce() {
        RequestInformation get = RequestInformation.of(HttpMethod.GET, "/users");
        get.setHttpMethod(HttpMethod.GET);
        assertThat(get.getHttpMethod()).isEqualTo(HttpMethod.GET);
        assertThatLoggableExceptionThrownBy(() -> get.setHttpMethod(HttpMethod.POST))
                .isExactlyInstanceOf(SafeIllegalStateException.class)
                .hasExactlyArgs(SafeArg.of("existing", HttpMethod.GET), SafeArg.of("requested", HttpMethod.POST));
    }

    @Test
    public void testToStringExcludesHeaderValues() {
        request.setHeaders(ImmutableMap.of("Authorization", "Bearer secret"));
        assertThat(request.toString()).contains("Authorization").doesNotContain("secret");
    }

    @Test
    public void testCustomTemplateFactoryIsUsed() {
        RequestInformation custom = new RequestInformation(template -> parameters -> template + parameters);
        custom.setUrlTemplate("/t");
        custom.setPathParameters(ImmutableMap.of("a", "1"));
        assertThat(custom.getUri()).isEqualTo("/t{a=1}");
    }

    private static final class ListOptions implements QueryParameters {
        private final Integer top;
        private final String search;
        private final List<String> orderBy;

        ListOptions(Integer top, String search, List<String> orderBy) {
            this.top = top;
            this.search = search;
            this.orderBy = orderBy;
        }

        @Override
        public List<QueryParameter> toQueryParameterEntries() {
            return ImmutableList.of(
                    QueryParameter.of("max", top),
                    QueryParameter.of("search", search),
                    QueryParameter.of("orderby", orderBy));
        }
    }
}

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

package com.palantir.billing;

import com.google.common.base.Strings;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.lang.reflect.Array;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands path templates such as {@code bank-accounts/{bankAccountId}} into {@link URI}s.
 *
 * <p>Parameters named by a placeholder are substituted into the template, in its path or its query; all other
 * parameters are appended to the query string in iteration order. A placeholder without a matching parameter is
 * kept as literal text.
 *
 * <p>Substituted values are percent-encoded as a single path segment or query value, so a {@code /} inside an id
 * is sent as {@code %2F} and cannot address another resource. Query values are rendered with
 * {@link String#valueOf(Object)}, so booleans are sent as {@code true} and {@code false}.
 */
public final class UriTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private UriTemplates() {}

    /** Expands {@code template} against {@code params}. The given map is not modified. */
    public static URI build(String template, Map<String, ?> params) {
        Preconditions.checkNotNull(template, "template");
        Preconditions.checkNotNull(params, "params");
        Map<String, Object> remaining = new LinkedHashMap<>(params);

        int queryStart = template.indexOf('?');
        String pathTemplate = queryStart < 0 ? template : template.substring(0, queryStart);
        String queryTemplate = queryStart < 0 ? "" : template.substring(queryStart + 1);

        Set<String> substituted = new HashSet<>();
        StringBuilder uri = new StringBuilder(template.length());
        expand(pathTemplate, params, substituted, UrlEncoder::encodePathSegment, UrlEncoder::encodeTemplateText, uri);
        StringBuilder templateQuery = new StringBuilder(queryTemplate.length());
        expand(
                queryTemplate,
                params,
                substituted,
                UrlEncoder::encodeQueryNameOrValue,
                UrlEncoder::encodeQueryTemplateText,
                templateQuery);
        remaining.keySet().removeAll(substituted);

        String query = joinQuery(templateQuery.toString(), encodeQuery(remaining));
        if (!query.isEmpty()) {
            uri.append('?').append(query);
        }
        return parse(uri.toString());
    }

    /**
     * Appends {@code text} to {@code out}, replacing each placeholder that has a non-null parameter with the
     * encoded value and recording its name in {@code substituted}. Everything else is encoded as literal text.
     */
    private static void expand(
            String text,
            Map<String, ?> params,
            Set<String> substituted,
            UnaryOperator<String> valueEncoder,
            UnaryOperator<String> literalEncoder,
            StringBuilder out) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        int position = 0;
        while (matcher.find()) {
            out.append(literalEncoder.apply(text.substring(position, matcher.start())));
            String name = matcher.group(1);
            Object value = params.get(name);
            if (value == null) {
                out.append(literalEncoder.apply(matcher.group()));
            } else {
                out.append(valueEncoder.apply(String.valueOf(value)));
                substituted.add(name);
            }
            position = matcher.end();
        }
        out.append(literalEncoder.apply(text.substring(position)));
    }

    /**
     * Replaces the query of an already built {@link URI} with the given parameters. The URI is returned unchanged
     * when there are no parameters.
     */
    public static URI withQuery(URI uri, Map<String, ?> params) {
        Preconditions.checkNotNull(uri, "uri");
        Preconditions.checkNotNull(params, "params");
        if (params.isEmpty()) {
            return uri;
        }
        StringBuilder result = new StringBuilder();
        if (uri.getScheme() != null) {
            result.append(uri.getScheme()).append(':');
        }
        if (uri.getRawAuthority() != null) {
            result.append("//").append(uri.getRawAuthority());
        }
        result.append(Strings.nullToEmpty(uri.getRawPath()));
        String query = encodeQuery(params);
        if (!query.isEmpty()) {
            result.append('?').append(query);
        }
        if (uri.getRawFragment() != null) {
            result.append('#').append(uri.getRawFragment());
        }
        return parse(result.toString());
    }

    /**
     * Encodes parameters as {@code key=value} pairs joined by {@code &}. Null values are skipped, lists and arrays
     * expand to indexed keys ({@code key[0]=a}) and nested maps to named keys ({@code key[name]=b}).
     */
    public static String encodeQuery(Map<String, ?> params) {
        List<String> pairs = new ArrayList<>(params.size() * 2);
        params.forEach((name, value) -> flatten(name, value, pairs));
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < pairs.size(); i += 2) {
            if (i > 0) {
                result.append('&');
            }
            result.append(UrlEncoder.encodeQueryNameOrValue(pairs.get(i)))
                    .append('=')
                    .append(UrlEncoder.encodeQueryNameOrValue(pairs.get(i + 1)));
        }
        return result.toString();
    }

    private static void flatten(String name, Object value, List<String> pairs) {
        if (value == null) {
            return;
        }
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((key, nested) -> flatten(name + '[' + key + ']', nested, pairs));
        } else if (value instanceof Iterable) {
            int index = 0;
            for (Object nested : (Iterable<?>) value) {
                flatten(name + '[' + index++ + ']', nested, pairs);
            }
        } else if (value.getClass().isArray()) {
            for (int index = 0; index < Array.getLength(value); index++) {
                flatten(name + '[' + index + ']', Array.get(value, index), pairs);
            }
        } else {
            pairs.add(name);
            pairs.add(String.valueOf(value));
        }
    }

    private static String joinQuery(String first, String second) {
        if (first.isEmpty()) {
            return second;
        }
        return second.isEmpty() ? first : first + '&' + second;
    }

    private static URI parse(String uri) {
        try {
            return URI.create(uri);
        } catch (IllegalArgumentException e) {
            throw new SafeIllegalArgumentException("Failed to build URI", e, UnsafeArg.of("uri", uri));
        }
    }
}

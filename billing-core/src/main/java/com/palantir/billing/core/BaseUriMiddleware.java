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

package com.palantir.billing.core;

import com.google.common.base.CharMatcher;
import com.palantir.billing.ConfigurationException;
import com.palantir.billing.Middleware;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import java.net.URI;

/** Resolves relative request URIs against the versioned API root, e.g. {@code https://api.rebilly.com/v2.1/}. */
final class BaseUriMiddleware implements Middleware {

    private static final CharMatcher SLASH = CharMatcher.is('/');

    private final URI baseUri;

    private BaseUriMiddleware(URI baseUri) {
        this.baseUri = baseUri;
    }

    static BaseUriMiddleware of(String baseUrl, String version) {
        URI base;
        try {
            base = URI.create(SLASH.trimTrailingFrom(baseUrl) + '/' + version + '/');
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Base URL is not a valid URI", UnsafeArg.of("baseUrl", baseUrl));
        }
        String scheme = base.getScheme();
        if (!("https".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme)) || base.getHost() == null) {
            throw new ConfigurationException(
                    "Base URL must be an absolute http(s) URL",
                    SafeArg.of("scheme", scheme),
                    UnsafeArg.of("baseUrl", baseUrl));
        }
        return new BaseUriMiddleware(base);
    }

    URI baseUri() {
        return baseUri;
    }

    @Override
    public Response handle(Request request, Next next) {
        URI uri = request.uri();
        if (uri.isAbsolute()) {
            return next.proceed(request);
        }
        // relative paths stay below the versioned root even with a leading slash
        URI relative = URI.create(SLASH.trimLeadingFrom(uri.toString()));
        return next.proceed(Request.builder().from(request).uri(baseUri.resolve(relative)).build());
    }

    @Override
    public String toString() {
        return "BaseUriMiddleware{" + baseUri + '}';
    }
}

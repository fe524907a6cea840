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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.palantir.billing.Middleware;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.concurrent.TimeUnit;

/**
 * Logs each call with its method, path, status and duration. Attach it through
 * {@link ClientConfiguration#middleware()}; it sees requests after the base URI and credentials were applied.
 */
public final class RequestLoggingMiddleware implements Middleware {

    private static final SafeLogger log = SafeLoggerFactory.get(RequestLoggingMiddleware.class);

    private final Ticker ticker;

    public RequestLoggingMiddleware() {
        this(Ticker.systemTicker());
    }

    @VisibleForTesting
    RequestLoggingMiddleware(Ticker ticker) {
        this.ticker = ticker;
    }

    @Override
    public Response handle(Request request, Next next) {
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        Response response;
        try {
            response = next.proceed(request);
        } catch (RuntimeException e) {
            log.info(
                    "Billing API call failed",
                    SafeArg.of("method", request.method()),
                    UnsafeArg.of("path", request.uri().getPath()),
                    SafeArg.of("durationMillis", stopwatch.elapsed(TimeUnit.MILLISECONDS)),
                    e);
            throw e;
        }
        log.info(
                "Billing API call",
                SafeArg.of("method", request.method()),
                UnsafeArg.of("path", request.uri().getPath()),
                SafeArg.of("status", response.code()),
                SafeArg.of("durationMillis", stopwatch.elapsed(TimeUnit.MILLISECONDS)));
        return response;
    }
}

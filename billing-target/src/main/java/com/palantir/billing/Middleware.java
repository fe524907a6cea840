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

/**
 * A request/response interceptor. Implementations may rewrite the request before calling {@link Next#proceed},
 * inspect or replace the response it returns, or return a response without proceeding at all.
 */
@FunctionalInterface
public interface Middleware {

    Response handle(Request request, Next next);

    /** The remainder of a middleware chain, ending in a {@link Transport}. */
    @FunctionalInterface
    interface Next {
        Response proceed(Request request);
    }
}

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

/** HTTP methods supported by the billing API. */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE;

    /** Returns true if requests using this method may carry a body. */
    public boolean permitsRequestBody() {
        return this != GET && this != HEAD;
    }

    /** Returns true if requests using this method always carry a body, {@code {}} when there is no payload. */
    public boolean requiresRequestBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    /** Returns true if responses to this method are never resolved into a resource. */
    public boolean discardsResponseBody() {
        return this == HEAD || this == DELETE;
    }
}

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

import com.google.common.collect.ImmutableMap;

final class ReasonPhrases {

    private static final ImmutableMap<Integer, String> PHRASES = ImmutableMap.<Integer, String>builder()
            .put(200, "OK")
            .put(201, "Created")
            .put(202, "Accepted")
            .put(204, "No Content")
            .put(301, "Moved Permanently")
            .put(302, "Found")
            .put(303, "See Other")
            .put(304, "Not Modified")
            .put(307, "Temporary Redirect")
            .put(308, "Permanent Redirect")
            .put(400, "Bad Request")
            .put(401, "Unauthorized")
            .put(402, "Payment Required")
            .put(403, "Forbidden")
            .put(404, "Not Found")
            .put(405, "Method Not Allowed")
            .put(406, "Not Acceptable")
            .put(409, "Conflict")
            .put(410, "Gone")
            .put(412, "Precondition Failed")
            .put(413, "Payload Too Large")
            .put(415, "Unsupported Media Type")
            .put(422, "Unprocessable Entity")
            .put(429, "Too Many Requests")
            .put(500, "Internal Server Error")
            .put(501, "Not Implemented")
            .put(502, "Bad Gateway")
            .put(503, "Service Unavailable")
            .put(504, "Gateway Timeout")
            .buildOrThrow();

    private ReasonPhrases() {}

    static String forCode(int code) {
        return PHRASES.getOrDefault(code, "");
    }
}

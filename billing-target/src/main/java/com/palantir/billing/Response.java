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

import com.google.common.collect.ListMultimap;
import java.io.Closeable;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/** A status line, headers and a body stream received from the billing API. */
public interface Response extends Closeable {

    InputStream body();

    int code();

    /** Falls back to the registered phrase for {@link #code()}, since HTTP/2 carries no reason phrase. */
    default String reasonPhrase() {
        return ReasonPhrases.forCode(code());
    }

    /** Header names compare case-insensitively. */
    ListMultimap<String, String> headers();

    default Optional<String> getFirstHeader(String header) {
        List<String> values = headers().get(header);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /** Closes the body stream if still open. Must not throw. */
    @Override
    void close();
}

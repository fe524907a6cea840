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

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.OptionalLong;

/** Payload of a {@link Request}, streamed by the transport. */
public interface RequestBody extends Closeable {

    void writeTo(OutputStream output) throws IOException;

    /** Media type sent as {@code Content-Type} unless the request already carries one. */
    String contentType();

    /** Whether {@link #writeTo} can be called again, e.g. when a middleware inspects the payload. */
    boolean repeatable();

    default OptionalLong contentLength() {
        return OptionalLong.empty();
    }

    /** Must not throw. */
    @Override
    void close();
}

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

import com.google.common.collect.ImmutableList;

/** The requested resource does not exist ({@code 404}). */
public final class NotFoundException extends ClientException {
    private static final String MESSAGE = "Resource not found";
    private static final int STATUS = 404;

    public NotFoundException() {
        this("Not Found");
    }

    public NotFoundException(String reason) {
        super(MESSAGE, STATUS, reason, ImmutableList.of());
    }
}

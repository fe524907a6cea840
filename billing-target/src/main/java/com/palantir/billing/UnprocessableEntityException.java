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
import com.palantir.logsafe.Arg;
import com.palantir.logsafe.UnsafeArg;
import java.util.List;

/** The submitted data failed validation ({@code 422}). */
public final class UnprocessableEntityException extends ClientException {
    private static final String MESSAGE = "Unprocessable entity";
    private static final int STATUS = 422;

    private final ImmutableList<FieldError> details;

    public UnprocessableEntityException(List<FieldError> details) {
        this("Unprocessable Entity", details);
    }

    public UnprocessableEntityException(String reason, List<FieldError> details) {
        // field values may echo customer input
        super(MESSAGE, STATUS, reason, ImmutableList.<Arg<?>>of(UnsafeArg.of("details", details)));
        this.details = ImmutableList.copyOf(details);
    }

    /** The validation failures reported by the API, empty if none were reported. */
    public List<FieldError> getDetails() {
        return details;
    }
}

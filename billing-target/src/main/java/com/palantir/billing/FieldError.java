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

import com.google.errorprone.annotations.Immutable;
import com.palantir.logsafe.Preconditions;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/** One validation failure carried by an {@link UnprocessableEntityException}. */
@Immutable
public final class FieldError {

    @Nullable
    private final String field;

    private final String error;

    private FieldError(@Nullable String field, String error) {
        this.field = field;
        this.error = Preconditions.checkNotNull(error, "error");
    }

    public static FieldError of(String field, String error) {
        return new FieldError(Preconditions.checkNotNull(field, "field"), error);
    }

    /** A failure which does not name a field, as reported by plain string details. */
    public static FieldError of(String error) {
        return new FieldError(null, error);
    }

    public Optional<String> field() {
        return Optional.ofNullable(field);
    }

    public String error() {
        return error;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        FieldError that = (FieldError) other;
        return Objects.equals(field, that.field) && error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, error);
    }

    @Override
    public String toString() {
        return field == null ? error : field + ": " + error;
    }
}

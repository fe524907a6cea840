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

import com.google.common.collect.ImmutableList;
import com.palantir.billing.ClientException;
import com.palantir.billing.FieldError;
import com.palantir.billing.NotFoundException;
import com.palantir.billing.RemoteException;
import com.palantir.billing.Response;
import com.palantir.billing.ServerException;
import com.palantir.billing.UnprocessableEntityException;
import com.palantir.billing.serde.Encodings;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Maps error responses to {@link RemoteException}s. The exception is returned rather than thrown; exactly one type
 * applies to each status code.
 */
enum ErrorDecoder {
    INSTANCE;

    private static final SafeLogger log = SafeLoggerFactory.get(ErrorDecoder.class);

    boolean isError(Response response) {
        return response.code() >= 400;
    }

    RemoteException decode(Response response) {
        int code = response.code();
        String reason = response.reasonPhrase();
        if (code == 404) {
            return new NotFoundException(reason);
        }
        if (code == 422) {
            return new UnprocessableEntityException(reason, details(response));
        }
        if (code >= 500) {
            return new ServerException(code, reason);
        }
        return new ClientException(code, reason);
    }

    private static List<FieldError> details(Response response) {
        Object body;
        try {
            body = Encodings.decode(response.body());
        } catch (IOException | RuntimeException e) {
            log.info("Failed to read validation details", SafeArg.of("status", response.code()), e);
            return ImmutableList.of();
        }
        if (!(body instanceof Map)) {
            return ImmutableList.of();
        }
        Object details = ((Map<?, ?>) body).get("details");
        if (!(details instanceof List)) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<FieldError> errors = ImmutableList.builder();
        for (Object detail : (List<?>) details) {
            if (detail instanceof String) {
                errors.add(FieldError.of((String) detail));
            } else if (detail instanceof Map) {
                Map<?, ?> entry = (Map<?, ?>) detail;
                Object message = entry.containsKey("error") ? entry.get("error") : entry.get("message");
                Object field = entry.get("field");
                if (message != null) {
                    errors.add(
                            field == null
                                    ? FieldError.of(String.valueOf(message))
                                    : FieldError.of(String.valueOf(field), String.valueOf(message)));
                }
            }
        }
        return errors.build();
    }

    @Override
    public String toString() {
        return "ErrorDecoder{}";
    }
}

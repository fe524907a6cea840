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

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class RemoteExceptionTest {

    @Test
    public void clientExceptionCarriesStatusAndReason() {
        ClientException exception = new ClientException(403, "Forbidden");
        assertThat(exception.getStatus()).isEqualTo(403);
        assertThat(exception.getReason()).isEqualTo("Forbidden");
        assertThat(exception.getLogMessage()).isEqualTo("Client error");
        assertThat(exception.getArgs()).containsExactly(SafeArg.of("status", 403), SafeArg.of("reason", "Forbidden"));
        assertThat(exception).hasMessage("Client error: {status=403, reason=Forbidden}");
    }

    @Test
    public void notFoundIsClientException() {
        NotFoundException exception = new NotFoundException();
        assertThat(exception).isInstanceOf(ClientException.class);
        assertThat(exception.getStatus()).isEqualTo(404);
        assertThat(exception.getReason()).isEqualTo("Not Found");
    }

    @Test
    public void unprocessableEntityKeepsDetailsUnsafe() {
        List<FieldError> details = List.of(FieldError.of("email", "is invalid"), FieldError.of("bad request"));
        UnprocessableEntityException exception = new UnprocessableEntityException(details);
        assertThat(exception.getStatus()).isEqualTo(422);
        assertThat(exception.getDetails()).containsExactlyElementsOf(details);
        assertThat(exception.getArgs()).contains(UnsafeArg.of("details", details));
        assertThat(exception.getDetails().get(0).field()).hasValue("email");
        assertThat(exception.getDetails().get(1).field()).isEmpty();
    }

    @Test
    public void serverException() {
        ServerException exception = new ServerException(503, "Service Unavailable");
        assertThat(exception).isNotInstanceOf(ClientException.class);
        assertThat(exception.getStatus()).isEqualTo(503);
        assertThat(exception.getLogMessage()).isEqualTo("Server error");
    }

    @Test
    public void reasonPhraseFallsBackToStandardTable() {
        assertThat(ReasonPhrases.forCode(404)).isEqualTo("Not Found");
        assertThat(ReasonPhrases.forCode(422)).isEqualTo("Unprocessable Entity");
        assertThat(ReasonPhrases.forCode(599)).isEmpty();
    }
}

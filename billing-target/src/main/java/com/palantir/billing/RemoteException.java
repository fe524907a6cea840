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
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.SafeLoggable;
import com.palantir.logsafe.exceptions.SafeExceptions;
import java.util.List;

/** An error response received from the billing API. */
public abstract class RemoteException extends RuntimeException implements SafeLoggable {

    private final String logMessage;
    private final int status;
    private final String reason;
    private final ImmutableList<Arg<?>> args;

    RemoteException(String logMessage, int status, String reason) {
        this(logMessage, status, reason, ImmutableList.of());
    }

    RemoteException(String logMessage, int status, String reason, List<Arg<?>> extraArgs) {
        super(SafeExceptions.renderMessage(logMessage, buildArgs(status, reason, extraArgs).toArray(new Arg<?>[0])));
        this.logMessage = logMessage;
        this.status = status;
        this.reason = reason;
        this.args = buildArgs(status, reason, extraArgs);
    }

    /** The HTTP status code of the response. */
    public final int getStatus() {
        return status;
    }

    /** The HTTP reason phrase of the response, possibly empty. */
    public final String getReason() {
        return reason;
    }

    @Override
    public final String getLogMessage() {
        return logMessage;
    }

    @Override
    public final List<Arg<?>> getArgs() {
        return args;
    }

    private static ImmutableList<Arg<?>> buildArgs(int status, String reason, List<Arg<?>> extraArgs) {
        return ImmutableList.<Arg<?>>builder()
                .add(SafeArg.of("status", status))
                .add(SafeArg.of("reason", reason))
                .addAll(extraArgs)
                .build();
    }
}

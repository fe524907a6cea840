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

import com.palantir.logsafe.Arg;
import java.util.List;

/** A {@code 4xx} response other than those with a dedicated exception type. */
public class ClientException extends RemoteException {
    private static final String MESSAGE = "Client error";

    public ClientException(int status, String reason) {
        super(MESSAGE, status, reason);
    }

    ClientException(String logMessage, int status, String reason, List<Arg<?>> extraArgs) {
        super(logMessage, status, reason, extraArgs);
    }
}

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

/**
 * Sends a fully-formed {@link Request} over the network and returns the raw {@link Response}.
 *
 * <h4>Threading Model</h4>
 * Calls block until the response status and headers have been received. Implementations used by a client shared
 * between threads must be safe for concurrent use.
 *
 * <h4>Behavior</h4>
 * Any status code is a successful send: mapping statuses to errors is the caller's concern. Network level failures
 * are reported as {@link TransportException}.
 */
public interface Transport {
    Response send(Request request);
}

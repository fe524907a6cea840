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
import com.palantir.billing.Middleware;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.billing.Transport;
import com.palantir.logsafe.Preconditions;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An ordered list of {@link Middleware} links. The first attached link runs first and sees the response last.
 *
 * <p>The chain is itself a {@link Middleware}, so chains nest. {@link #bind(Transport)} composes the current links
 * into a single immutable {@link Middleware.Next} ending at the transport; later calls to {@link #attach} do not
 * affect a previously bound pipeline.
 */
@NotThreadSafe
public final class MiddlewareChain implements Middleware {

    private final List<Middleware> links = new ArrayList<>();

    public MiddlewareChain attach(Middleware link) {
        links.add(Preconditions.checkNotNull(link, "link"));
        return this;
    }

    public List<Middleware> links() {
        return ImmutableList.copyOf(links);
    }

    @Override
    public Response handle(Request request, Next next) {
        return compose(ImmutableList.copyOf(links), next).proceed(request);
    }

    /** Composes the links attached so far into a pipeline whose last step is {@code transport}. */
    public Next bind(Transport transport) {
        Preconditions.checkNotNull(transport, "transport");
        return compose(ImmutableList.copyOf(links), transport::send);
    }

    private static Next compose(ImmutableList<Middleware> links, Next terminal) {
        Next current = terminal;
        for (Middleware link : links.reverse()) {
            Next next = current;
            current = request -> link.handle(request, next);
        }
        return current;
    }

    @Override
    public String toString() {
        return "MiddlewareChain{" + links + '}';
    }
}

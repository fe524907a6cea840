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

package com.palantir.billing.resources;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A resource path such as {@code bank-accounts/*}, made of literal segments and {@code *} wildcards which match
 * any single identifier.
 */
@Immutable
public final class PathPattern {

    private static final String WILDCARD = "*";
    private static final Splitter SLASH = Splitter.on('/').omitEmptyStrings();
    private static final Pattern VERSION = Pattern.compile("v\\d+(\\.\\d+)*");

    private final String pattern;
    private final ImmutableList<String> segments;
    private final int literalCount;

    private PathPattern(String pattern, ImmutableList<String> segments) {
        this.pattern = pattern;
        this.segments = segments;
        this.literalCount = (int) segments.stream().filter(s -> !WILDCARD.equals(s)).count();
    }

    public static PathPattern of(String pattern) {
        ImmutableList<String> segments = ImmutableList.copyOf(SLASH.split(pattern));
        Preconditions.checkArgument(!segments.isEmpty(), "Path pattern must not be empty", SafeArg.of("pattern", pattern));
        return new PathPattern(pattern, segments);
    }

    /**
     * Splits a request or response path into segments, dropping empty segments and a leading API version segment
     * such as {@code v2.1}.
     */
    public static ImmutableList<String> segments(String path) {
        List<String> segments = SLASH.splitToList(path);
        if (!segments.isEmpty() && VERSION.matcher(segments.get(0)).matches()) {
            segments = segments.subList(1, segments.size());
        }
        return ImmutableList.copyOf(segments);
    }

    public boolean matches(List<String> pathSegments) {
        if (pathSegments.size() != segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (!WILDCARD.equals(segment) && !segment.equals(pathSegments.get(i))) {
                return false;
            }
        }
        return true;
    }

    int literalCount() {
        return literalCount;
    }

    int size() {
        return segments.size();
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof PathPattern && segments.equals(((PathPattern) other).segments));
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}

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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import java.nio.charset.StandardCharsets;

/** Encodes URL components per https://tools.ietf.org/html/rfc3986 . */
final class UrlEncoder {
    private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
    private static final CharMatcher ALPHA = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));
    private static final CharMatcher UNRESERVED = DIGIT.or(ALPHA).or(CharMatcher.anyOf("-._~"));
    private static final CharMatcher SUB_DELIMS = CharMatcher.anyOf("!$&'()*+,;=");
    private static final CharMatcher IS_P_CHAR = UNRESERVED.or(CharMatcher.anyOf(":@"));
    // Literal template text may already be percent-encoded and may span several segments
    private static final CharMatcher IS_TEMPLATE_CHAR =
            UNRESERVED.or(SUB_DELIMS).or(CharMatcher.anyOf(":@/%"));
    // Sub-delimiters are percent-encoded to keep values from being read as separators by the server, see
    // https://tools.ietf.org/html/rfc3986#section-3.3
    private static final CharMatcher IS_QUERY_CHAR = IS_P_CHAR.or(CharMatcher.anyOf("/?"));
    // Literal query text keeps its own separators and escapes
    private static final CharMatcher IS_QUERY_TEMPLATE_CHAR = IS_QUERY_CHAR.or(CharMatcher.anyOf("=&%"));

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UrlEncoder() {}

    static String encodePathSegment(String pathComponent) {
        return encode(pathComponent, IS_P_CHAR);
    }

    static String encodeTemplateText(String templateText) {
        return encode(templateText, IS_TEMPLATE_CHAR);
    }

    static String encodeQueryNameOrValue(String nameOrValue) {
        return encode(nameOrValue, IS_QUERY_CHAR);
    }

    static String encodeQueryTemplateText(String templateText) {
        return encode(templateText, IS_QUERY_TEMPLATE_CHAR);
    }

    /** Percent-encodes each UTF-8 byte of {@code source} that {@code charactersToKeep} does not match. */
    @VisibleForTesting
    static String encode(String source, CharMatcher charactersToKeep) {
        if (charactersToKeep.matchesAllOf(source)) {
            return source;
        }
        StringBuilder encoded = new StringBuilder(source.length() * 3);
        for (byte value : source.getBytes(StandardCharsets.UTF_8)) {
            char unsigned = (char) (value & 0xFF);
            if (charactersToKeep.matches(unsigned)) {
                encoded.append(unsigned);
            } else {
                encoded.append('%').append(HEX[unsigned >> 4]).append(HEX[unsigned & 0xF]);
            }
        }
        return encoded.toString();
    }
}

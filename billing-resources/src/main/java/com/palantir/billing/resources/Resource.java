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

/**
 * A value produced from a billing API response: a typed {@link Entity}, a {@link ResourceCollection} of them, or a
 * {@link GenericResource} when the response path is not known. Resources are created fresh for every response.
 */
public interface Resource {

    /** The decoded JSON document backing this resource. */
    Object data();
}

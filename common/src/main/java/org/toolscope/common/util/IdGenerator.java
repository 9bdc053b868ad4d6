/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.toolscope.common.util;

import java.util.UUID;

// source of trace and span identifiers, abstract (like Clock) so that tests can make ids
// predictable
public abstract class IdGenerator {

    private static final IdGenerator RANDOM_ID_GENERATOR = new IdGenerator() {
        @Override
        protected String randomHex() {
            return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }
    };

    protected abstract String randomHex();

    public String newTraceId() {
        return "trace_" + randomHex();
    }

    public String newSpanId() {
        return "span_" + randomHex();
    }

    public static IdGenerator randomIdGenerator() {
        return RANDOM_ID_GENERATOR;
    }
}

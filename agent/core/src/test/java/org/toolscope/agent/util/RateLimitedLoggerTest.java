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
package org.toolscope.agent.util;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RateLimitedLoggerTest {

    @Test
    public void shouldAppendSuppressedCount() {
        Object[] args = RateLimitedLogger.appendArg(new Object[] {"trace_1", 1000}, 7);
        assertThat(args).containsExactly("trace_1", 1000, 7);
    }

    @Test
    public void shouldKeepThrowableLast() {
        Exception e = new Exception();
        Object[] args = RateLimitedLogger.appendArg(new Object[] {"trace_1", e}, 7);
        assertThat(args).containsExactly("trace_1", 7, e);
    }

    @Test
    public void shouldNotFailWhenWarningRepeatedly() {
        RateLimitedLogger logger = new RateLimitedLogger(RateLimitedLoggerTest.class);
        for (int i = 0; i < 5; i++) {
            logger.warn("repeated warning {}", i);
        }
    }
}

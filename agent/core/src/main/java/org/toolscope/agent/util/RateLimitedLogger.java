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

import javax.annotation.concurrent.GuardedBy;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.RateLimiter;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// logs a warning at most once a minute, and reports how many were dropped in between
//
// used for conditions that can repeat on every ingestion call, e.g. an active trace being evicted
// while the tracer is at capacity
public class RateLimitedLogger {

    private final Logger logger;

    private final RateLimiter warningRateLimiter = RateLimiter.create(1.0 / 60);

    @GuardedBy("warningRateLimiter")
    private int suppressedCount;

    public RateLimitedLogger(Class<?> clazz) {
        logger = LoggerFactory.getLogger(clazz);
    }

    public void warn(String format, @Nullable Object... args) {
        int suppressedSinceLastWarning;
        synchronized (warningRateLimiter) {
            if (!warningRateLimiter.tryAcquire()) {
                suppressedCount++;
                return;
            }
            suppressedSinceLastWarning = suppressedCount;
            suppressedCount = 0;
        }
        // not logging under the lock above, slf4j appenders may block
        if (suppressedSinceLastWarning == 0) {
            logger.warn(format + " (logged at most once a minute)", args);
        } else {
            logger.warn(format + " (logged at most once a minute, {} similar warnings were"
                    + " suppressed)", appendArg(args, suppressedSinceLastWarning));
        }
    }

    @VisibleForTesting
    static @Nullable Object[] appendArg(@Nullable Object[] args, int suppressedCount) {
        @Nullable
        Object[] argsPlus = new Object[args.length + 1];
        // slf4j only treats a throwable as such when it is the last argument
        if (args.length > 0 && args[args.length - 1] instanceof Throwable) {
            System.arraycopy(args, 0, argsPlus, 0, args.length - 1);
            argsPlus[args.length - 1] = suppressedCount;
            argsPlus[args.length] = args[args.length - 1];
        } else {
            System.arraycopy(args, 0, argsPlus, 0, args.length);
            argsPlus[args.length] = suppressedCount;
        }
        return argsPlus;
    }
}

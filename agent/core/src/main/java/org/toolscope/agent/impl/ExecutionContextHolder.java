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
package org.toolscope.agent.impl;

import org.checkerframework.checker.nullness.qual.Nullable;

// one holder per instrumentation, so separate agents in the same process do not see each other's
// traces
public class ExecutionContextHolder {

    private final ThreadLocal<Holder> threadLocal = new ThreadLocal<Holder>() {
        @Override
        protected Holder initialValue() {
            return new Holder();
        }
    };

    public @Nullable ExecutionContext get() {
        return threadLocal.get().get();
    }

    public void set(@Nullable ExecutionContext context) {
        threadLocal.get().set(context);
    }

    public Holder getHolder() {
        return threadLocal.get();
    }

    public static class Holder {

        private @Nullable ExecutionContext value;

        private Holder() {}

        public @Nullable ExecutionContext get() {
            return value;
        }

        public void set(@Nullable ExecutionContext value) {
            this.value = value;
        }
    }
}

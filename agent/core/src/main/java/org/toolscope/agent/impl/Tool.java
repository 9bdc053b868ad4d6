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

/**
 * A named unit of work that can be instrumented. An instrumented tool keeps the calling convention
 * of the tool it wraps: same input, same output and the same exceptions.
 */
public interface Tool<I, O> {

    O call(@Nullable I input) throws Exception;
}

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

import org.toolscope.common.model.LogEntry;

// called on the logging thread while the logger still holds its buffer lock, so entries arrive in
// buffer order; must not block or log back into the same logger
public interface LogListener {

    void onLog(LogEntry entry);
}

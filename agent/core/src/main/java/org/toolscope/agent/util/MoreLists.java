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

import java.util.List;

import com.google.common.collect.ImmutableList;

public class MoreLists {

    private MoreLists() {}

    // the last (most recent) limit elements, in their original order
    public static <T> ImmutableList<T> last(List<T> list, int limit) {
        if (limit <= 0) {
            return ImmutableList.of();
        }
        int size = list.size();
        return ImmutableList.copyOf(list.subList(Math.max(0, size - limit), size));
    }
}

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

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class MoreListsTest {

    @Test
    public void shouldReturnLastElementsInOrder() {
        ImmutableList<Integer> list = ImmutableList.of(1, 2, 3, 4);
        assertThat(MoreLists.last(list, 2)).containsExactly(3, 4);
        assertThat(MoreLists.last(list, 10)).containsExactly(1, 2, 3, 4);
        assertThat(MoreLists.last(list, 0)).isEmpty();
        assertThat(MoreLists.last(list, -1)).isEmpty();
    }
}

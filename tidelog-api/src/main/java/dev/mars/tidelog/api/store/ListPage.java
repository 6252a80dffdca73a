/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.tidelog.api.store;

import java.util.List;

/**
 * One page of a prefix listing.
 *
 * @param keys keys in ascending lexicographic order
 * @param nextStartAfter key to pass as {@code startAfter} for the next page,
 *                       or {@code null} when the listing is exhausted
 */
public record ListPage(List<String> keys, String nextStartAfter) {

    public ListPage {
        keys = List.copyOf(keys);
    }

    public static ListPage last(List<String> keys) {
        return new ListPage(keys, null);
    }

    public boolean hasMore() {
        return nextStartAfter != null;
    }
}

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
package dev.mars.tidelog.core.replay;

import dev.mars.tidelog.api.EventKey;
import dev.mars.tidelog.api.TemporalRange;
import dev.mars.tidelog.core.index.JournalRef;
import dev.mars.tidelog.core.overlay.OverlaySnapshot;

import java.util.List;
import java.util.Set;

/**
 * Everything a replay lists up front: the journals overlapping the window,
 * the loose event keys inside it, which of those carry a metadata document,
 * and the overlay state. Payloads are fetched
 * later, while the result is consumed.
 */
record ReplayPlan(TemporalRange range, List<JournalRef> journals, List<EventKey> looseKeys,
                  Set<EventKey> looseMetadata, OverlaySnapshot overlays) {
}

/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
/**
 * Record exchange between nodes, ordered by vector clocks.
 * <p>
 * A record from origin {@code o} is delivered once it is the next record of
 * {@code o}'s chain and every other entry of its clock is already covered by the
 * receiver's frontier. Records are deduplicated by position and hash; a position
 * held with two different hashes is a fork and is never merged.
 */
package dev.mars.decisionlog.sync;

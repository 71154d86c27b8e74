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
 * Agreement on segment membership and order across nodes.
 * <p>
 * The ordering strategy is chosen once per deployment:
 * <ul>
 *   <li>{@link dev.mars.decisionlog.consensus.MajorityOrdering} - default, canonical order, {@code n/2+1}</li>
 *   <li>{@link dev.mars.decisionlog.consensus.LeaderReplicatedOrdering} - elected leader per epoch</li>
 *   <li>{@link dev.mars.decisionlog.consensus.ByzantineOrdering} - {@code 3f+1} nodes, two phases</li>
 * </ul>
 * Nodes running different strategies are not expected to interoperate.
 */
package dev.mars.decisionlog.consensus;

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
 * Record model: the immutable, hash-sealed decision entry.
 * <ul>
 *   <li>{@link dev.mars.decisionlog.record.AuditRecord} - sealed ledger entry</li>
 *   <li>{@link dev.mars.decisionlog.record.RecordDraft} - unsealed entry from a decision producer</li>
 *   <li>{@link dev.mars.decisionlog.record.VectorClock} - causal history</li>
 *   <li>{@link dev.mars.decisionlog.record.RecordCodec} - canonical encoding, hashed and persisted</li>
 * </ul>
 * <p>
 * <b>Invariants:</b>
 * <ul>
 *   <li>Chain link: {@code r.prevHash == predecessor(r).recordHash} on the authoring node</li>
 *   <li>Immutability: a sealed record never changes; corrections are new records</li>
 *   <li>Causal step: {@code r.vectorClock[r.nodeId]} is the predecessor's value plus one</li>
 *   <li>Density: local sequences are dense from 0</li>
 * </ul>
 */
package dev.mars.decisionlog.record;

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
 * Persistence port of the decision ledger.
 * <ul>
 *   <li>{@link dev.mars.decisionlog.storage.LedgerStorage} - the contract the ledger depends on</li>
 *   <li>{@link dev.mars.decisionlog.storage.FileLedgerStorage} - crash-safe append-only WAL</li>
 *   <li>{@link dev.mars.decisionlog.storage.InMemoryLedgerStorage} - heap store for replicas and tests</li>
 * </ul>
 * <p>
 * <b>Crash Safety Guarantees:</b>
 * <ul>
 *   <li>Append is durable before its Future completes (fsync when enabled)</li>
 *   <li>A torn write at the tail is truncated on open; it was never acknowledged</li>
 *   <li>Damaged frames are never dropped or rewritten; they are reported by sequence</li>
 * </ul>
 */
package dev.mars.decisionlog.storage;

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
package dev.mars.decisionlog.sync;

import dev.mars.decisionlog.error.CausalOrderViolationException;
import dev.mars.decisionlog.record.RecordSlot;

/**
 * An incoming record that cannot be delivered without breaking causal order.
 */
public record CausalViolation(RecordSlot slot, String reason) {

    public CausalOrderViolationException toException() {
        return new CausalOrderViolationException("Rejected " + slot + ": " + reason);
    }
}

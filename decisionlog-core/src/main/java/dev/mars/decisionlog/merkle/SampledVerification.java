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
package dev.mars.decisionlog.merkle;

import dev.mars.decisionlog.ledger.VerificationResult;

/**
 * Result of a probabilistic segment check.
 *
 * @param result          verdict over the sampled records only
 * @param checked         records whose hash and chain link were checked
 * @param total           records in the segment
 * @param missProbability chance that a single corrupted record was not sampled
 */
public record SampledVerification(VerificationResult result, int checked, int total, double missProbability) {

    public boolean isOk() {
        return result.isOk();
    }
}

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
package dev.mars.decisionlog.notary;

import dev.mars.decisionlog.record.HashValue;

import java.time.Instant;
import java.util.Objects;

/**
 * A third party's statement about a segment root: a timestamp, a signature, an
 * anchoring receipt. The ledger stores it beside the segment and never interprets it.
 *
 * @param witness      who issued it
 * @param issuedAt     when, as stated by the witness
 * @param attestedRoot the root the witness saw
 * @param proof        opaque witness payload
 */
public record Attestation(String witness, Instant issuedAt, HashValue attestedRoot, byte[] proof) {

    public Attestation {
        Objects.requireNonNull(witness, "witness");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(attestedRoot, "attestedRoot");
        proof = proof == null ? new byte[0] : proof.clone();
    }

    @Override
    public byte[] proof() {
        return proof.clone();
    }
}

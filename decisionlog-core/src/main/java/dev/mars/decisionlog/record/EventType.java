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
package dev.mars.decisionlog.record;

/**
 * Kind of decision event recorded in the ledger.
 * <p>
 * Each constant carries a fixed wire code. Codes are part of the hashed
 * encoding and must never be renumbered.
 */
public enum EventType {

    /** Decision taken by the rules engine without human involvement. */
    AUTOMATIC_DECISION((byte) 1),

    /** Decision that required a human to exercise discretion. */
    DISCRETIONARY_REVIEW((byte) 2),

    /** A human replaced an automatic outcome. */
    HUMAN_OVERRIDE((byte) 3),

    /** Appeal or review request against an earlier decision. */
    APPEAL((byte) 4),

    /** The statute backing future decisions changed. */
    STATUTE_MODIFIED((byte) 5),

    /** Outcome of a simulation run. */
    SIMULATION_RUN((byte) 6);

    private final byte code;

    EventType(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    /**
     * @throws MalformedRecordException if the code is unknown
     */
    public static EventType fromCode(byte code) {
        for (EventType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new MalformedRecordException("Unknown event type code: " + code);
    }
}

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
package dev.mars.decisionlog.error;

/**
 * Two different records claim the same {@code (nodeId, localSequence)} slot.
 * <p>
 * Never resolved automatically: no winner is picked, an operator must decide.
 */
public class ForkDetectedException extends LedgerException {

    private final String nodeId;
    private final long localSequence;

    public ForkDetectedException(String nodeId, long localSequence, String message) {
        super("Fork detected at " + nodeId + "#" + localSequence + ": " + message);
        this.nodeId = nodeId;
        this.localSequence = localSequence;
    }

    public String nodeId() {
        return nodeId;
    }

    public long localSequence() {
        return localSequence;
    }
}

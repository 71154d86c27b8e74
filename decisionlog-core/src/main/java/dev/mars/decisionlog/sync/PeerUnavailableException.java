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

import dev.mars.decisionlog.error.LedgerException;

/**
 * A peer could not be reached or did not answer. Retried with backoff.
 */
public class PeerUnavailableException extends LedgerException {

    private final String peerId;

    public PeerUnavailableException(String peerId, String message) {
        super("Peer " + peerId + " unavailable: " + message);
        this.peerId = peerId;
    }

    public PeerUnavailableException(String peerId, String message, Throwable cause) {
        super("Peer " + peerId + " unavailable: " + message, cause);
        this.peerId = peerId;
    }

    public String peerId() {
        return peerId;
    }
}

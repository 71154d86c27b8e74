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
package dev.mars.decisionlog.consensus;

import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.sync.ForkEvidence;

import java.util.ArrayList;
import java.util.List;

/**
 * One attempt to seal a segment, as tracked by its proposer.
 * <p>
 * Holds the ordered records and walks the {@link SegmentState} machine; a terminal
 * state is never left.
 */
public final class SegmentRound {

    private final Proposal proposal;
    private final List<AuditRecord> records;
    private final List<Vote> votes = new ArrayList<>();
    private SegmentState state = SegmentState.OPEN;
    private int attempts;
    private int acknowledgedPhases;
    private ForkEvidence fork;

    SegmentRound(Proposal proposal, List<AuditRecord> records) {
        this.proposal = proposal;
        this.records = List.copyOf(records);
    }

    public long number() {
        return proposal.segmentNumber();
    }

    public Proposal proposal() {
        return proposal;
    }

    public List<AuditRecord> records() {
        return records;
    }

    public synchronized SegmentState state() {
        return state;
    }

    public synchronized int attempts() {
        return attempts;
    }

    /** Votes of the latest attempt. */
    public synchronized List<Vote> votes() {
        return List.copyOf(votes);
    }

    public synchronized ForkEvidence fork() {
        return fork;
    }

    /** True once every phase of the latest attempt reached quorum. */
    public synchronized boolean quorumReached(int phases) {
        return acknowledgedPhases >= phases;
    }

    synchronized void transition(SegmentState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Segment " + number() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    synchronized void startAttempt() {
        attempts++;
        acknowledgedPhases = 0;
        votes.clear();
    }

    synchronized void recordVotes(List<Vote> phaseVotes) {
        votes.addAll(phaseVotes);
    }

    synchronized void phaseAcknowledged() {
        acknowledgedPhases++;
    }

    synchronized void forkDetected(ForkEvidence evidence) {
        this.fork = evidence;
        transition(SegmentState.FORK_DETECTED);
    }

    @Override
    public synchronized String toString() {
        return "SegmentRound{segment=" + number() + ", state=" + state + ", attempts=" + attempts +
                ", records=" + records.size() + '}';
    }
}

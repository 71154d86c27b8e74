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
package dev.mars.decisionlog.query;

import dev.mars.decisionlog.DecisionLogConfig.ConsensusKind;
import dev.mars.decisionlog.TestCluster;
import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.node.LedgerNode;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.EventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LedgerQuery}.
 */
class LedgerQueryTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private TestCluster cluster;
    private LedgerNode node;

    @BeforeEach
    void setUp() {
        cluster = TestCluster.of(ConsensusKind.MAJORITY, "solo");
        node = cluster.node(0);
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    private AuditRecord log(EventType type, String statute, String subject, int minutes) {
        return node.recordDecision(TestRecords.draft(type, statute, subject, T0.plusSeconds(60L * minutes)));
    }

    @Test
    void testEmptyLedger() {
        ComplianceSummary summary = node.query().summary();

        assertEquals(0, summary.segments());
        assertEquals(0, summary.records());
        assertTrue(summary.integrityVerified());
        assertNull(summary.earliest());
        assertEquals(0, summary.count(EventType.APPEAL));
    }

    @Test
    void testOnlySealedRecordsVisible() {
        log(EventType.AUTOMATIC_DECISION, "housing-benefit", "citizen-1", 0);
        node.closeSegment();
        log(EventType.AUTOMATIC_DECISION, "housing-benefit", "citizen-2", 1);

        assertEquals(1, node.query().records().count());
        assertEquals(1, node.query().bySubject("citizen-1").size());
        assertTrue(node.query().bySubject("citizen-2").isEmpty());
    }

    @Test
    void testFilters() {
        AuditRecord first = log(EventType.AUTOMATIC_DECISION, "housing-benefit", "citizen-1", 0);
        AuditRecord review = log(EventType.DISCRETIONARY_REVIEW, "housing-benefit", "citizen-1", 10);
        AuditRecord override = log(EventType.HUMAN_OVERRIDE, "child-allowance", "citizen-2", 20);
        AuditRecord appeal = log(EventType.APPEAL, "child-allowance", "citizen-1", 30);
        node.closeSegment();

        assertEquals(List.of(first, review, appeal), node.query().bySubject("citizen-1"));
        assertEquals(List.of(override, appeal), node.query().byStatute("child-allowance"));
        assertEquals(List.of(override), node.query().byEventType(EventType.HUMAN_OVERRIDE));
        assertEquals(List.of(review, override), node.query().inTimeRange(T0.plusSeconds(600), T0.plusSeconds(1800)));
        assertTrue(node.query().byStatute(TestRecords.utf8("unknown")).isEmpty());
    }

    @Test
    void testSummary_AcrossSegments() {
        log(EventType.AUTOMATIC_DECISION, "housing-benefit", "citizen-1", 5);
        log(EventType.AUTOMATIC_DECISION, "housing-benefit", "citizen-2", 0);
        node.closeSegment();
        log(EventType.STATUTE_MODIFIED, "housing-benefit", "statute-editor", 40);
        log(EventType.SIMULATION_RUN, "housing-benefit", "what-if-1", 45);
        node.closeSegment();

        ComplianceSummary summary = node.query().summary();

        assertEquals(2, summary.segments());
        assertEquals(4, summary.records());
        assertEquals(2, summary.count(EventType.AUTOMATIC_DECISION));
        assertEquals(1, summary.count(EventType.STATUTE_MODIFIED));
        assertEquals(0, summary.count(EventType.HUMAN_OVERRIDE));
        assertTrue(summary.integrityVerified());
        assertEquals(T0, summary.earliest());
        assertEquals(T0.plusSeconds(45 * 60), summary.latest());
        assertEquals(2, node.query().segments().size());
    }
}

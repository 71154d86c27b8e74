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
package dev.mars.decisionlog.demo;

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.consensus.ClusterMembership;
import dev.mars.decisionlog.merkle.MerkleProof;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.node.LedgerNode;
import dev.mars.decisionlog.notary.Attestation;
import dev.mars.decisionlog.query.ComplianceSummary;
import dev.mars.decisionlog.record.Actor;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.DecisionRecords;
import dev.mars.decisionlog.record.EventType;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.sync.SyncReport;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Three-node decision ledger cluster, in process.
 * <p>
 * This demonstrates the full path of a decision:
 * <ul>
 *   <li>Each node logs decisions on its own hash chain</li>
 *   <li>Pairwise vector-clock sync replicates every chain to every node</li>
 *   <li>One node proposes a segment; the cluster votes and seals it</li>
 *   <li>All nodes hold the same Merkle root</li>
 *   <li>The root is exported to a notary and the attestation imported back</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Settings are resolved by {@link DecisionLogConfig}: system properties
 * ({@code -Ddecisionlog.consensusStrategy=LEADER ...}), environment variables
 * ({@code DECISIONLOG_CONSENSUS_STRATEGY, ...}), {@code decisionlog.properties}, then defaults.
 * The first argument, if given, is the number of decisions per node.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl decisionlog-demo -am
 *
 * # Run with default configuration
 * java -jar decisionlog-demo/target/decisionlog-demo-1.0-SNAPSHOT.jar
 *
 * # 500 decisions per node, leader-replicated ordering
 * java -Ddecisionlog.consensusStrategy=LEADER -jar decisionlog-demo/target/decisionlog-demo-1.0-SNAPSHOT.jar 500
 * </pre>
 *
 * @see TamperDemo
 */
public class ClusterDemo {

    private static final String[] NODES = {"registry-east", "registry-north", "registry-west"};

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|      Decision Ledger Cluster Demo     |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        int perNode = args.length > 0 && !args[0].isBlank() ? Integer.parseInt(args[0].trim()) : 100;
        DecisionLogConfig base = DecisionLogConfig.load();
        System.out.println("Configuration: " + base);
        System.out.println();

        ClusterMembership membership = ClusterMembership.of(NODES);
        LedgerNode east = LedgerNode.inMemory(base.toBuilder().nodeId(NODES[0]).build(), membership).open();
        LedgerNode north = LedgerNode.inMemory(base.toBuilder().nodeId(NODES[1]).build(), membership).open();
        LedgerNode west = LedgerNode.inMemory(base.toBuilder().nodeId(NODES[2]).build(), membership).open();
        List<LedgerNode> cluster = List.of(east, north, west);
        east.connect(north, west);
        north.connect(east, west);
        west.connect(east, north);

        try {
            // Decisions, with a sync in the middle so later records depend on other nodes
            logDecisions(cluster, 0, perNode / 2);
            syncAll(cluster);
            logDecisions(cluster, perNode / 2, perNode);
            System.out.println("[OK] Logged " + perNode + " decisions on each of " + cluster.size() + " nodes");

            syncAll(cluster);
            for (LedgerNode node : cluster) {
                System.out.printf("    %-15s frontier=%s%n", node.nodeId(), node.frontier());
            }

            // Whoever may propose under the configured strategy closes the segment
            Segment segment = null;
            for (LedgerNode node : cluster) {
                Optional<Segment> sealed = node.closeSegment();
                if (sealed.isPresent()) {
                    segment = sealed.get();
                    System.out.println("\n[OK] " + node.nodeId() + " sealed segment " + segment.number() +
                            " with " + segment.size() + " records (" + node.coordinator().strategy().name() + ")");
                    break;
                }
            }
            if (segment == null) {
                throw new IllegalStateException("No node sealed a segment");
            }

            for (LedgerNode node : cluster) {
                HashValue root = node.coordinator().segment(segment.number())
                        .map(Segment::root)
                        .orElseThrow(() -> new IllegalStateException(node.nodeId() + " has no sealed segment"));
                System.out.printf("    %-15s root=%s%n", node.nodeId(), root.toHex());
                if (!root.equals(segment.root())) {
                    throw new IllegalStateException("Roots diverge on " + node.nodeId());
                }
            }
            System.out.println("[OK] All nodes agree on the segment root");

            // Inclusion proof for one record, checked against the exported root only
            AuditRecord sample = segment.record(segment.size() / 2);
            HashValue exported = west.notary().exportRoot(segment.number());
            MerkleProof proof = west.notary().proveRecord(segment.number(), sample.slot());
            System.out.println("[OK] Proof for " + sample.slot() + " (" + proof.steps().size() + " steps) valid: " +
                    MerkleVerifier.verifyProof(sample.recordHash(), proof, exported));

            Attestation attestation = new Attestation("national-archive", Instant.now(), exported,
                    ("timestamp-token:" + exported.toHex()).getBytes(StandardCharsets.UTF_8));
            for (LedgerNode node : cluster) {
                node.notary().importAttestation(segment.number(), attestation);
            }
            System.out.println("[OK] Attestation from " + attestation.witness() + " imported on all nodes");

            ComplianceSummary summary = north.query().summary();
            System.out.println("\n  Compliance summary on " + north.nodeId() + ":");
            System.out.println("    segments=" + summary.segments() + ", records=" + summary.records() +
                    ", verified=" + summary.integrityVerified());
            summary.byEventType().forEach((type, count) -> System.out.printf("    %-22s %d%n", type, count));

            System.out.println("\n[OK] Cluster demo complete!");
        } finally {
            cluster.forEach(LedgerNode::close);
        }
    }

    private static void logDecisions(List<LedgerNode> cluster, int from, int to) {
        EventType[] types = EventType.values();
        for (int i = from; i < to; i++) {
            for (LedgerNode node : cluster) {
                EventType type = types[i % types.length];
                Actor actor = type == EventType.HUMAN_OVERRIDE
                        ? new Actor.User("caseworker-" + (i % 7), "SUPERVISOR")
                        : new Actor.System(node.nodeId() + "-rules");
                node.recordDecision(DecisionRecords.draft(type, actor,
                        "statute-" + (i % 5), "subject-" + node.nodeId() + "-" + i,
                        "{\"case\":" + i + "}", "{\"eligible\":" + (i % 3 != 0) + "}"));
            }
        }
    }

    private static void syncAll(List<LedgerNode> cluster) {
        for (int i = 0; i < cluster.size(); i++) {
            for (int j = i + 1; j < cluster.size(); j++) {
                SyncReport report = cluster.get(i).syncWith(cluster.get(j));
                System.out.printf("    sync %s <-> %s: received=%d sent=%d%n",
                        cluster.get(i).nodeId(), report.peer(), report.received(), report.sent());
            }
        }
        // One more pass so records that travelled through a third node reach everyone
        for (int i = 0; i < cluster.size(); i++) {
            for (int j = i + 1; j < cluster.size(); j++) {
                cluster.get(i).syncWith(cluster.get(j));
            }
        }
    }
}

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
package dev.mars.decisionlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for a decision ledger node.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Ddecisionlog.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code DECISIONLOG_DATA_DIR})</li>
 *   <li>Properties file ({@code decisionlog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>nodeId</td><td>decisionlog.nodeId</td><td>DECISIONLOG_NODE_ID</td><td>node-1</td></tr>
 *   <tr><td>dataDir</td><td>decisionlog.dataDir</td><td>DECISIONLOG_DATA_DIR</td><td>~/.decisionlog/data</td></tr>
 *   <tr><td>syncEnabled</td><td>decisionlog.syncEnabled</td><td>DECISIONLOG_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>decisionlog.verifyWrites</td><td>DECISIONLOG_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>decisionlog.minFreeSpaceMb</td><td>DECISIONLOG_MIN_FREE_SPACE_MB</td><td>64</td></tr>
 *   <tr><td>maxPayloadSizeMb</td><td>decisionlog.maxPayloadSizeMb</td><td>DECISIONLOG_MAX_PAYLOAD_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>ioTimeoutMs</td><td>decisionlog.ioTimeoutMs</td><td>DECISIONLOG_IO_TIMEOUT_MS</td><td>10000</td></tr>
 *   <tr><td>syncIntervalMs</td><td>decisionlog.syncIntervalMs</td><td>DECISIONLOG_SYNC_INTERVAL_MS</td><td>1000</td></tr>
 *   <tr><td>maxBatchSize</td><td>decisionlog.maxBatchSize</td><td>DECISIONLOG_MAX_BATCH_SIZE</td><td>100</td></tr>
 *   <tr><td>gossipFanout</td><td>decisionlog.gossipFanout</td><td>DECISIONLOG_GOSSIP_FANOUT</td><td>2</td></tr>
 *   <tr><td>quorumTimeoutMs</td><td>decisionlog.quorumTimeoutMs</td><td>DECISIONLOG_QUORUM_TIMEOUT_MS</td><td>5000</td></tr>
 *   <tr><td>maxQuorumAttempts</td><td>decisionlog.maxQuorumAttempts</td><td>DECISIONLOG_MAX_QUORUM_ATTEMPTS</td><td>3</td></tr>
 *   <tr><td>segmentSize</td><td>decisionlog.segmentSize</td><td>DECISIONLOG_SEGMENT_SIZE</td><td>1024</td></tr>
 *   <tr><td>sealIntervalMs</td><td>decisionlog.sealIntervalMs</td><td>DECISIONLOG_SEAL_INTERVAL_MS</td><td>60000</td></tr>
 *   <tr><td>consensusStrategy</td><td>decisionlog.consensusStrategy</td><td>DECISIONLOG_CONSENSUS_STRATEGY</td><td>MAJORITY</td></tr>
 *   <tr><td>sampleSeed</td><td>decisionlog.sampleSeed</td><td>DECISIONLOG_SAMPLE_SEED</td><td>0 (derive from segment root)</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # decisionlog.properties
 * decisionlog.nodeId=registry-east
 * decisionlog.dataDir=/var/lib/decisionlog/data
 * decisionlog.syncEnabled=true
 * decisionlog.consensusStrategy=MAJORITY
 * decisionlog.quorumTimeoutMs=5000
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * DecisionLogConfig config = DecisionLogConfig.builder()
 *     .nodeId("registry-east")
 *     .dataDir(Path.of("/var/lib/decisionlog"))
 *     .consensusStrategy(ConsensusKind.LEADER)
 *     .build();
 * </pre>
 */
public final class DecisionLogConfig {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionLogConfig.class);

    private static final String PROPERTIES_FILE = "decisionlog.properties";

    /**
     * Consensus ordering strategy, chosen once per deployment.
     */
    public enum ConsensusKind {
        /** Deterministic tie-break ratified by a majority. The default. */
        MAJORITY,
        /** Single elected leader per epoch assigns the order. */
        LEADER,
        /** 3f+1 nodes tolerate f faulty ones; two-phase quorum of 2f+1. */
        BYZANTINE
    }

    // Defaults
    private static final String DEFAULT_NODE_ID = "node-1";
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".decisionlog", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;
    private static final int DEFAULT_MAX_PAYLOAD_SIZE_MB = 16;
    private static final long DEFAULT_IO_TIMEOUT_MS = 10_000;
    private static final long DEFAULT_SYNC_INTERVAL_MS = 1_000;
    private static final int DEFAULT_MAX_BATCH_SIZE = 100;
    private static final int DEFAULT_GOSSIP_FANOUT = 2;
    private static final long DEFAULT_QUORUM_TIMEOUT_MS = 5_000;
    private static final int DEFAULT_MAX_QUORUM_ATTEMPTS = 3;
    private static final int DEFAULT_SEGMENT_SIZE = 1024;
    private static final long DEFAULT_SEAL_INTERVAL_MS = 60_000;
    private static final ConsensusKind DEFAULT_CONSENSUS = ConsensusKind.MAJORITY;
    private static final long DEFAULT_SAMPLE_SEED = 0L;

    private final String nodeId;
    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;
    private final int maxPayloadSizeMb;
    private final long ioTimeoutMs;
    private final long syncIntervalMs;
    private final int maxBatchSize;
    private final int gossipFanout;
    private final long quorumTimeoutMs;
    private final int maxQuorumAttempts;
    private final int segmentSize;
    private final long sealIntervalMs;
    private final ConsensusKind consensusStrategy;
    private final long sampleSeed;

    private DecisionLogConfig(Builder b) {
        this.nodeId = b.nodeId;
        this.dataDir = b.dataDir;
        this.syncEnabled = b.syncEnabled;
        this.verifyWrites = b.verifyWrites;
        this.minFreeSpaceMb = b.minFreeSpaceMb;
        this.maxPayloadSizeMb = b.maxPayloadSizeMb;
        this.ioTimeoutMs = b.ioTimeoutMs;
        this.syncIntervalMs = b.syncIntervalMs;
        this.maxBatchSize = b.maxBatchSize;
        this.gossipFanout = b.gossipFanout;
        this.quorumTimeoutMs = b.quorumTimeoutMs;
        this.maxQuorumAttempts = b.maxQuorumAttempts;
        this.segmentSize = b.segmentSize;
        this.sealIntervalMs = b.sealIntervalMs;
        this.consensusStrategy = b.consensusStrategy;
        this.sampleSeed = b.sampleSeed;
    }

    /** Identifier of this writer node. */
    public String nodeId() {
        return nodeId;
    }

    /** Data directory for the ledger WAL and replica files. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether to verify writes by reading back and checking CRC. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum encoded record size in MB. */
    public int maxPayloadSizeMb() {
        return maxPayloadSizeMb;
    }

    /** Upper bound on waiting for one storage operation. */
    public long ioTimeoutMs() {
        return ioTimeoutMs;
    }

    /** Period of background synchronization with peers. */
    public long syncIntervalMs() {
        return syncIntervalMs;
    }

    /** Records per sync transfer. */
    public int maxBatchSize() {
        return maxBatchSize;
    }

    /** Peers contacted per background sync round. */
    public int gossipFanout() {
        return gossipFanout;
    }

    /** Time allowed for one consensus voting phase. */
    public long quorumTimeoutMs() {
        return quorumTimeoutMs;
    }

    /** Voting attempts before a segment close gives up for this cycle. */
    public int maxQuorumAttempts() {
        return maxQuorumAttempts;
    }

    /** Unsealed records that trigger a segment close. */
    public int segmentSize() {
        return segmentSize;
    }

    /** Period after which waiting records are sealed even below segmentSize. */
    public long sealIntervalMs() {
        return sealIntervalMs;
    }

    /** Ordering strategy for segment consensus. */
    public ConsensusKind consensusStrategy() {
        return consensusStrategy;
    }

    /** Fixed seed for sampled verification; 0 derives the seed from the segment root. */
    public long sampleSeed() {
        return sampleSeed;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum encoded record size in bytes. */
    public int maxPayloadSizeBytes() {
        return maxPayloadSizeMb * 1024 * 1024;
    }

    /** A copy of this configuration for another node id and data directory. */
    public DecisionLogConfig forNode(String otherNodeId, Path otherDataDir) {
        return toBuilder().nodeId(otherNodeId).dataDir(otherDataDir).build();
    }

    /** A builder pre-filled with every value of this configuration. */
    public Builder toBuilder() {
        return builder()
                .nodeId(nodeId)
                .dataDir(dataDir)
                .syncEnabled(syncEnabled)
                .verifyWrites(verifyWrites)
                .minFreeSpaceMb(minFreeSpaceMb)
                .maxPayloadSizeMb(maxPayloadSizeMb)
                .ioTimeoutMs(ioTimeoutMs)
                .syncIntervalMs(syncIntervalMs)
                .maxBatchSize(maxBatchSize)
                .gossipFanout(gossipFanout)
                .quorumTimeoutMs(quorumTimeoutMs)
                .maxQuorumAttempts(maxQuorumAttempts)
                .segmentSize(segmentSize)
                .sealIntervalMs(sealIntervalMs)
                .consensusStrategy(consensusStrategy)
                .sampleSeed(sampleSeed);
    }

    @Override
    public String toString() {
        return "DecisionLogConfig{" +
                "nodeId=" + nodeId +
                ", dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxPayloadSizeMb=" + maxPayloadSizeMb +
                ", ioTimeoutMs=" + ioTimeoutMs +
                ", syncIntervalMs=" + syncIntervalMs +
                ", maxBatchSize=" + maxBatchSize +
                ", gossipFanout=" + gossipFanout +
                ", quorumTimeoutMs=" + quorumTimeoutMs +
                ", maxQuorumAttempts=" + maxQuorumAttempts +
                ", segmentSize=" + segmentSize +
                ", sealIntervalMs=" + sealIntervalMs +
                ", consensusStrategy=" + consensusStrategy +
                ", sampleSeed=" + sampleSeed +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code DecisionLogConfig.builder().build()}.
     */
    public static DecisionLogConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link DecisionLogConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private String nodeId;
        private Path dataDir;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;
        private Integer maxPayloadSizeMb;
        private Long ioTimeoutMs;
        private Long syncIntervalMs;
        private Integer maxBatchSize;
        private Integer gossipFanout;
        private Long quorumTimeoutMs;
        private Integer maxQuorumAttempts;
        private Integer segmentSize;
        private Long sealIntervalMs;
        private ConsensusKind consensusStrategy;
        private Long sampleSeed;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        public Builder maxPayloadSizeMb(int maxPayloadSizeMb) {
            this.maxPayloadSizeMb = maxPayloadSizeMb;
            return this;
        }

        public Builder ioTimeoutMs(long ioTimeoutMs) {
            this.ioTimeoutMs = ioTimeoutMs;
            return this;
        }

        public Builder syncIntervalMs(long syncIntervalMs) {
            this.syncIntervalMs = syncIntervalMs;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder gossipFanout(int gossipFanout) {
            this.gossipFanout = gossipFanout;
            return this;
        }

        public Builder quorumTimeoutMs(long quorumTimeoutMs) {
            this.quorumTimeoutMs = quorumTimeoutMs;
            return this;
        }

        public Builder maxQuorumAttempts(int maxQuorumAttempts) {
            this.maxQuorumAttempts = maxQuorumAttempts;
            return this;
        }

        public Builder segmentSize(int segmentSize) {
            this.segmentSize = segmentSize;
            return this;
        }

        public Builder sealIntervalMs(long sealIntervalMs) {
            this.sealIntervalMs = sealIntervalMs;
            return this;
        }

        public Builder consensusStrategy(ConsensusKind consensusStrategy) {
            this.consensusStrategy = consensusStrategy;
            return this;
        }

        public Builder sampleSeed(long sampleSeed) {
            this.sampleSeed = sampleSeed;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public DecisionLogConfig build() {
            // programmatic > sysprop > env > file > default
            if (nodeId == null) {
                nodeId = resolve("decisionlog.nodeId", "DECISIONLOG_NODE_ID", Function.identity(), DEFAULT_NODE_ID);
            }
            if (dataDir == null) {
                dataDir = resolve("decisionlog.dataDir", "DECISIONLOG_DATA_DIR", Path::of, DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve("decisionlog.syncEnabled", "DECISIONLOG_SYNC_ENABLED",
                        Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolve("decisionlog.verifyWrites", "DECISIONLOG_VERIFY_WRITES",
                        Boolean::parseBoolean, DEFAULT_VERIFY_WRITES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolve("decisionlog.minFreeSpaceMb", "DECISIONLOG_MIN_FREE_SPACE_MB",
                        Integer::parseInt, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxPayloadSizeMb == null) {
                maxPayloadSizeMb = resolve("decisionlog.maxPayloadSizeMb", "DECISIONLOG_MAX_PAYLOAD_SIZE_MB",
                        Integer::parseInt, DEFAULT_MAX_PAYLOAD_SIZE_MB);
            }
            if (ioTimeoutMs == null) {
                ioTimeoutMs = resolve("decisionlog.ioTimeoutMs", "DECISIONLOG_IO_TIMEOUT_MS",
                        Long::parseLong, DEFAULT_IO_TIMEOUT_MS);
            }
            if (syncIntervalMs == null) {
                syncIntervalMs = resolve("decisionlog.syncIntervalMs", "DECISIONLOG_SYNC_INTERVAL_MS",
                        Long::parseLong, DEFAULT_SYNC_INTERVAL_MS);
            }
            if (maxBatchSize == null) {
                maxBatchSize = resolve("decisionlog.maxBatchSize", "DECISIONLOG_MAX_BATCH_SIZE",
                        Integer::parseInt, DEFAULT_MAX_BATCH_SIZE);
            }
            if (gossipFanout == null) {
                gossipFanout = resolve("decisionlog.gossipFanout", "DECISIONLOG_GOSSIP_FANOUT",
                        Integer::parseInt, DEFAULT_GOSSIP_FANOUT);
            }
            if (quorumTimeoutMs == null) {
                quorumTimeoutMs = resolve("decisionlog.quorumTimeoutMs", "DECISIONLOG_QUORUM_TIMEOUT_MS",
                        Long::parseLong, DEFAULT_QUORUM_TIMEOUT_MS);
            }
            if (maxQuorumAttempts == null) {
                maxQuorumAttempts = resolve("decisionlog.maxQuorumAttempts", "DECISIONLOG_MAX_QUORUM_ATTEMPTS",
                        Integer::parseInt, DEFAULT_MAX_QUORUM_ATTEMPTS);
            }
            if (segmentSize == null) {
                segmentSize = resolve("decisionlog.segmentSize", "DECISIONLOG_SEGMENT_SIZE",
                        Integer::parseInt, DEFAULT_SEGMENT_SIZE);
            }
            if (sealIntervalMs == null) {
                sealIntervalMs = resolve("decisionlog.sealIntervalMs", "DECISIONLOG_SEAL_INTERVAL_MS",
                        Long::parseLong, DEFAULT_SEAL_INTERVAL_MS);
            }
            if (consensusStrategy == null) {
                consensusStrategy = resolve("decisionlog.consensusStrategy", "DECISIONLOG_CONSENSUS_STRATEGY",
                        s -> ConsensusKind.valueOf(s.trim().toUpperCase(Locale.ROOT)), DEFAULT_CONSENSUS);
            }
            if (sampleSeed == null) {
                sampleSeed = resolve("decisionlog.sampleSeed", "DECISIONLOG_SAMPLE_SEED",
                        Long::parseLong, DEFAULT_SAMPLE_SEED);
            }

            if (nodeId.isBlank()) {
                throw new IllegalArgumentException("nodeId must not be blank");
            }
            requirePositive("maxBatchSize", maxBatchSize);
            requirePositive("gossipFanout", gossipFanout);
            requirePositive("maxQuorumAttempts", maxQuorumAttempts);
            requirePositive("segmentSize", segmentSize);
            requirePositive("maxPayloadSizeMb", maxPayloadSizeMb);
            requirePositive("ioTimeoutMs", ioTimeoutMs);
            requirePositive("quorumTimeoutMs", quorumTimeoutMs);

            return new DecisionLogConfig(this);
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
        }

        /**
         * Resolves one value: system property, then environment variable, then
         * properties file. Unparseable values are logged and skipped.
         */
        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            String[] sources = {"system property", "environment variable", PROPERTIES_FILE};
            String[] values = {System.getProperty(sysProp), System.getenv(envVar), fileProperties.getProperty(sysProp)};
            for (int i = 0; i < values.length; i++) {
                String value = values[i];
                if (value == null || value.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(value.trim());
                } catch (IllegalArgumentException e) {
                    LOG.warn("Ignoring invalid {} value for {}: '{}' ({})", sources[i], sysProp, value, e.getMessage());
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = DecisionLogConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default operator channel: logs every alert at ERROR and keeps it for inspection.
 */
public final class LoggingAlertSink implements IntegrityAlertSink {

    private static final Logger LOG = LoggerFactory.getLogger("dev.mars.decisionlog.ALERT");

    private final List<IntegrityAlert> raised = new CopyOnWriteArrayList<>();

    @Override
    public void raise(IntegrityAlert alert) {
        raised.add(alert);
        LOG.error("[{}] node={} index={} {}", alert.kind(), alert.nodeId(), alert.index(), alert.detail());
    }

    /** Alerts raised so far, oldest first. */
    public List<IntegrityAlert> raised() {
        return List.copyOf(raised);
    }
}

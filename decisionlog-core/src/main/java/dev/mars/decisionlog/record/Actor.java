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

import java.util.Objects;

/**
 * Who triggered a decision event.
 */
public sealed interface Actor permits Actor.System, Actor.User, Actor.External {

    /** Wire tag of this variant in the canonical encoding. */
    byte tag();

    /**
     * An automated component of the deciding system.
     *
     * @param component name of the component, e.g. {@code "eligibility-engine"}
     */
    record System(String component) implements Actor {
        public static final byte TAG = 1;

        public System {
            Objects.requireNonNull(component, "component");
        }

        @Override
        public byte tag() {
            return TAG;
        }
    }

    /**
     * A human operator.
     *
     * @param id   user identifier
     * @param role role under which the user acted
     */
    record User(String id, String role) implements Actor {
        public static final byte TAG = 2;

        public User {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(role, "role");
        }

        @Override
        public byte tag() {
            return TAG;
        }
    }

    /**
     * A third-party system calling in.
     *
     * @param system external system identifier
     */
    record External(String system) implements Actor {
        public static final byte TAG = 3;

        public External {
            Objects.requireNonNull(system, "system");
        }

        @Override
        public byte tag() {
            return TAG;
        }
    }
}

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.orchestrator.domain.stream;

import me.golemcore.orchestrator.domain.model.StreamType;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Data source behind one kind of background stream.
 */
public interface StreamPoller {

    StreamType getType();

    /**
     * Delay between polls after a successful cycle.
     */
    Duration getInterval();

    /**
     * Delay before the next poll after a failed cycle.
     */
    Duration getErrorInterval();

    /**
     * Opens a stateful task for one stream instance.
     */
    Task open(Map<String, Object> config);

    /**
     * One stream's polling step. Tasks are only ever invoked from one thread at
     * a time.
     */
    @FunctionalInterface
    interface Task {

        /**
         * @return the new snapshot, or empty when nothing changed
         * @throws Exception
         *             on any source failure; the registry backs off and retries
         */
        Optional<Object> poll() throws Exception;
    }
}

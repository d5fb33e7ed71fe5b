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

package me.golemcore.orchestrator.domain.agent;

import me.golemcore.orchestrator.domain.component.Component;
import me.golemcore.orchestrator.domain.model.UserContext;

import java.util.Map;

/**
 * A strategy that resolves a query on its own, using its bundled tools, and
 * returns a structured payload for synthesis.
 */
public interface SpecialistAgent extends Component {

    @Override
    default String getComponentType() {
        return "specialist";
    }

    /**
     * Returns the agent name used in payload metadata and progress messages.
     */
    String getName();

    /**
     * Capability predicate over the raw query text.
     */
    boolean canHandle(String query);

    /**
     * Resolves the query. Collaborator failures that cannot be degraded are
     * thrown.
     *
     * @return structured payload; always contains {@code agent}
     */
    Map<String, Object> process(String query, UserContext context);
}

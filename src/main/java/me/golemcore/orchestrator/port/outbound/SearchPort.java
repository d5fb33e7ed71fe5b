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

package me.golemcore.orchestrator.port.outbound;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the web/news/social search backend.
 *
 * <p>
 * Results are lists of flat maps. A backend failure or an empty result set is
 * reported as a single-item list whose item carries an {@code error} key, so
 * callers never see an exception for an ordinary "nothing found".
 */
public interface SearchPort {

    /**
     * @return items with {@code title}, {@code snippet}, {@code url}
     */
    CompletableFuture<List<Map<String, Object>>> webSearch(String query, int maxResults);

    /**
     * @return items with {@code title}, {@code source}, {@code date},
     *         {@code url}, {@code snippet}
     */
    CompletableFuture<List<Map<String, Object>>> newsSearch(String query, int maxResults);

    /**
     * Searches a single social platform, or all of them when {@code platform} is
     * {@code all}. Items additionally carry {@code platform}.
     */
    CompletableFuture<List<Map<String, Object>>> socialMediaSearch(String query, String platform, int maxResults);
}

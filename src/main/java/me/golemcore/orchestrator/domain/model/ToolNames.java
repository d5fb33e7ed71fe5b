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

package me.golemcore.orchestrator.domain.model;

/**
 * Names of the built-in tools, shared by the planner, the tools and source
 * attribution.
 */
public final class ToolNames {

    public static final String WEB_SEARCH = "web_search";
    public static final String NEWS_SEARCH = "news_search";
    public static final String SOCIAL_MEDIA_SEARCH = "social_media_search";
    public static final String GET_STOCK_INFO = "get_stock_info";

    /** Pseudo-tool under which stream snapshots join the tool outputs. */
    public static final String REAL_TIME_STREAMS = "real_time_streams";

    private ToolNames() {
    }
}

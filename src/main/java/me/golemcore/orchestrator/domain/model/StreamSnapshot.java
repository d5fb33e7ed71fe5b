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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Latest data published by a background stream.
 */
@Data
@Builder
public class StreamSnapshot {

    private String streamId;
    private Object data;
    private Instant lastUpdate;
    private StreamStatus status;

    public static StreamSnapshot notFound(String streamId) {
        return StreamSnapshot.builder()
                .streamId(streamId)
                .status(StreamStatus.NOT_FOUND)
                .build();
    }

    public boolean hasData() {
        return status != StreamStatus.NOT_FOUND && data != null;
    }
}

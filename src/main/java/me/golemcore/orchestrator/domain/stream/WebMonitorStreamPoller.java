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

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.StreamType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Change detection over configured URLs. The page fingerprint is derived from
 * the URL and the current minute rather than from fetched content, so a change
 * is reported whenever the minute rolls over between polls.
 */
@Component
@RequiredArgsConstructor
public class WebMonitorStreamPoller implements StreamPoller {

    private final Clock clock;

    @Override
    public StreamType getType() {
        return StreamType.WEB_MONITOR;
    }

    @Override
    public Duration getInterval() {
        return Duration.ofMinutes(10);
    }

    @Override
    public Duration getErrorInterval() {
        return Duration.ofMinutes(20);
    }

    @Override
    public Task open(Map<String, Object> config) {
        List<String> urls = StreamConfig.stringList(config, "urls", List.of());
        Map<String, String> previousFingerprints = new HashMap<>();
        return () -> {
            Instant now = clock.instant();
            List<Map<String, Object>> changes = new ArrayList<>();
            for (String url : urls) {
                String fingerprint = fingerprint(url, now);
                String previous = previousFingerprints.put(url, fingerprint);
                if (previous != null && !previous.equals(fingerprint)) {
                    Map<String, Object> change = new LinkedHashMap<>();
                    change.put("url", url);
                    change.put("change_detected", true);
                    change.put("timestamp", now.toString());
                    change.put("change_type", "content_update");
                    changes.add(change);
                }
            }
            return changes.isEmpty() ? Optional.empty() : Optional.of(changes);
        };
    }

    static String fingerprint(String url, Instant now) throws NoSuchAlgorithmException {
        int minute = now.atZone(ZoneOffset.UTC).getMinute();
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return HexFormat.of().formatHex(digest.digest((url + "_" + minute).getBytes(StandardCharsets.UTF_8)));
    }
}

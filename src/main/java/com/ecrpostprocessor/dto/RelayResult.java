/*
 * Copyright 2026 EPAM Systems, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.ecrpostprocessor.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one successfully relayed image push.
 */
public record RelayResult(
        String status,
        String imageTag,
        String repository,
        String timestamp,
        String messageId
) {

    public static final String STATUS_OK = "ok";

    public static RelayResult ok(ImagePushLogRecord logRecord, String messageId) {
        return new RelayResult(STATUS_OK, logRecord.imageTag(), logRecord.repository(), logRecord.timestamp(),
                messageId);
    }

    public Map<String, String> toMap() {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("status", status);
        result.put("imageTag", imageTag);
        result.put("repository", repository);
        result.put("timestamp", timestamp);
        if (messageId != null) {
            result.put("messageId", messageId);
        }
        return result;
    }

}

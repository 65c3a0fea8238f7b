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

public record ImagePushNotification(
        String subject,
        String message
) {

    public static final String SUBJECT = "ECR Image Push Notification";

    public static ImagePushNotification of(ImagePushLogRecord logRecord) {
        return new ImagePushNotification(SUBJECT, String.format("Image pushed: %s:%s at %s",
                logRecord.repository(), logRecord.imageTag(), logRecord.timestamp()));
    }

}

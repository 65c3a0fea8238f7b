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
package com.ecrpostprocessor.service;

import com.ecrpostprocessor.dto.ImagePushEvent;
import com.ecrpostprocessor.dto.ImagePushLogRecord;
import com.ecrpostprocessor.dto.ImagePushNotification;
import com.ecrpostprocessor.dto.RelayResult;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns one image push event into one log record and one notification.
 * <p>
 * The record is written before the notification is published. If the write fails nothing is published;
 * if publishing fails the record stays in place. Neither step is retried here, redelivery is up to the
 * trigger that invoked the function.
 */
public class ImagePushRelay {

    private final ImagePushLogService imagePushLogService;
    private final NotificationService notificationService;
    private final Clock clock;

    public ImagePushRelay(ImagePushLogService imagePushLogService, NotificationService notificationService,
                          Clock clock) {
        this.imagePushLogService = imagePushLogService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public RelayResult process(ImagePushEvent event) {
        // processing time, not the time the image was pushed
        String timestamp = Instant.now(clock).toString();

        ImagePushLogRecord logRecord = new ImagePushLogRecord(event.imageTag(), event.repository(), timestamp);
        imagePushLogService.save(logRecord);

        String messageId = notificationService.publish(ImagePushNotification.of(logRecord));

        return RelayResult.ok(logRecord, messageId);
    }

}

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
package com.ecrpostprocessor.service.impl;

import com.ecrpostprocessor.dto.ImagePushNotification;
import com.ecrpostprocessor.exception.NotificationException;
import com.ecrpostprocessor.service.NotificationService;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;

/**
 * Publishes notifications to a single SNS topic, delivered to all of its current subscribers.
 */
public class NotificationServiceSnsImpl implements NotificationService {

    private final SnsClient snsClient;
    private final String topicArn;

    public NotificationServiceSnsImpl(SnsClient snsClient, String topicArn) {
        this.snsClient = snsClient;
        this.topicArn = topicArn;
    }

    @Override
    public String publish(ImagePushNotification notification) {
        PublishRequest publishRequest = PublishRequest.builder()
                .topicArn(topicArn)
                .subject(notification.subject())
                .message(notification.message())
                .build();
        try {
            return snsClient.publish(publishRequest).messageId();
        } catch (SdkException e) {
            throw new NotificationException(String.format("Failed to publish to topic '%s'. Reason: %s",
                    topicArn, e.getMessage()), e);
        }
    }

}

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
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;
import software.amazon.awssdk.services.sns.model.SnsException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class NotificationServiceSnsImplTest {

    private static final String TOPIC_ARN = "arn:aws:sns:eu-west-1:123456789012:ecr-image-push";

    private SnsClient snsClient;
    private NotificationServiceSnsImpl service;

    @Before
    public void setUp() {
        snsClient = mock(SnsClient.class);
        service = new NotificationServiceSnsImpl(snsClient, TOPIC_ARN);
    }

    @Test
    public void testPublishSendsSubjectAndMessage() {
        when(snsClient.publish(any(PublishRequest.class)))
                .thenReturn(PublishResponse.builder().messageId("b1946ac9").build());

        String messageId = service.publish(new ImagePushNotification(ImagePushNotification.SUBJECT,
                "Image pushed: sample-app-repo:v1 at 2025-01-01T12:00:00Z"));

        assertEquals("b1946ac9", messageId);
        ArgumentCaptor<PublishRequest> captor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(snsClient).publish(captor.capture());
        assertEquals(TOPIC_ARN, captor.getValue().topicArn());
        assertEquals("ECR Image Push Notification", captor.getValue().subject());
        assertEquals("Image pushed: sample-app-repo:v1 at 2025-01-01T12:00:00Z", captor.getValue().message());
    }

    @Test
    public void testPublishWrapsFailure() {
        SnsException cause = (SnsException) SnsException.builder().message("Topic does not exist").build();
        when(snsClient.publish(any(PublishRequest.class))).thenThrow(cause);

        try {
            service.publish(new ImagePushNotification(ImagePushNotification.SUBJECT, "message"));
            fail("NotificationException expected");
        } catch (NotificationException e) {
            assertSame(cause, e.getCause());
            assertTrue(e.getMessage().contains(TOPIC_ARN));
        }
    }

}

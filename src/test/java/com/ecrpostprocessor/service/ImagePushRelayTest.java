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
import com.ecrpostprocessor.exception.NotificationException;
import com.ecrpostprocessor.exception.PersistenceException;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ImagePushRelayTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    private InMemoryImagePushLogService logService;
    private RecordingNotificationService notificationService;
    private ImagePushRelay relay;

    @Before
    public void setUp() {
        logService = new InMemoryImagePushLogService();
        notificationService = new RecordingNotificationService();
        relay = new ImagePushRelay(logService, notificationService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void testRecordAndNotificationCarryEventFields() {
        RelayResult result = relay.process(
                new ImagePushEvent("custom.build", "sample-app-repo", "20250101-1200-abc123"));

        assertEquals(RelayResult.STATUS_OK, result.status());
        assertEquals("2025-01-01T12:00:00Z", result.timestamp());
        assertEquals("message-1", result.messageId());

        ImagePushLogRecord logRecord = logService.findByImageTag("20250101-1200-abc123").orElseThrow();
        assertEquals(new ImagePushLogRecord("20250101-1200-abc123", "sample-app-repo", "2025-01-01T12:00:00Z"),
                logRecord);

        assertEquals(1, notificationService.getPublished().size());
        ImagePushNotification notification = notificationService.getPublished().get(0);
        assertEquals("ECR Image Push Notification", notification.subject());
        assertEquals("Image pushed: sample-app-repo:20250101-1200-abc123 at 2025-01-01T12:00:00Z",
                notification.message());
    }

    @Test
    public void testUnknownFieldsStillRelayed() {
        RelayResult result = relay.process(
                new ImagePushEvent(null, ImagePushEvent.UNKNOWN, ImagePushEvent.UNKNOWN));

        assertEquals(RelayResult.STATUS_OK, result.status());
        ImagePushLogRecord logRecord = logService.findByImageTag("unknown").orElseThrow();
        assertEquals("unknown", logRecord.repository());
        assertTrue(notificationService.getPublished().get(0).message().contains("unknown:unknown"));
    }

    @Test
    public void testSameEventTwiceOverwritesRecord() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW, NOW.plusSeconds(5));
        relay = new ImagePushRelay(logService, notificationService, clock);
        ImagePushEvent event = new ImagePushEvent("custom.build", "sample-app-repo", "v1");

        relay.process(event);
        relay.process(event);

        assertEquals(2, logService.getWrites().size());
        assertEquals("v1", logService.getWrites().get(0).imageTag());
        assertEquals("v1", logService.getWrites().get(1).imageTag());
        assertNotEquals(logService.getWrites().get(0).timestamp(), logService.getWrites().get(1).timestamp());
        assertEquals("2025-01-01T12:00:05Z", logService.findByImageTag("v1").orElseThrow().timestamp());
        assertEquals(2, notificationService.getPublished().size());
    }

    @Test
    public void testStoreFailureSkipsNotification() {
        logService.failWrites();
        try {
            relay.process(new ImagePushEvent("custom.build", "sample-app-repo", "v1"));
            fail("PersistenceException expected");
        } catch (PersistenceException e) {
            assertEquals("table unavailable", e.getMessage());
        }
        assertTrue(notificationService.getPublished().isEmpty());
    }

    @Test
    public void testRecordSurvivesNotificationFailure() {
        notificationService.failPublishes();
        try {
            relay.process(new ImagePushEvent("custom.build", "sample-app-repo", "v1"));
            fail("NotificationException expected");
        } catch (NotificationException e) {
            assertEquals("topic unavailable", e.getMessage());
        }
        Optional<ImagePushLogRecord> logRecord = logService.findByImageTag("v1");
        assertTrue(logRecord.isPresent());
        assertEquals("sample-app-repo", logRecord.get().repository());
    }

}

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
package com.ecrpostprocessor.utils;

import com.amazonaws.services.lambda.runtime.events.ScheduledEvent;
import com.ecrpostprocessor.dto.ImagePushEvent;
import com.ecrpostprocessor.exception.MalformedEventException;

import java.util.Collection;
import java.util.Map;

import static com.ecrpostprocessor.dto.ImagePushEvent.UNKNOWN;

public class ImagePushEventMapper {

    static final String REPOSITORY = "repository";
    static final String IMAGE_TAG = "imageTag";

    private ImagePushEventMapper() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static ImagePushEvent fromScheduledEvent(ScheduledEvent event) {
        if (event == null) {
            throw new MalformedEventException("Event is missing");
        }
        return fromDetail(event.getSource(), event.getDetail());
    }

    private static ImagePushEvent fromDetail(String source, Map<?, ?> detail) {
        if (detail == null) {
            return new ImagePushEvent(source, UNKNOWN, UNKNOWN);
        }
        return new ImagePushEvent(source, stringOrUnknown(detail.get(REPOSITORY)),
                stringOrUnknown(detail.get(IMAGE_TAG)));
    }

    private static String stringOrUnknown(Object value) {
        if (value == null || value instanceof Map || value instanceof Collection) {
            return UNKNOWN;
        }
        return String.valueOf(value);
    }

}

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

/**
 * Image push reported by the registry through an EventBridge rule.
 * Repository and tag are never null, a missing value is replaced with {@link #UNKNOWN}.
 */
public record ImagePushEvent(
        String source,
        String repository,
        String imageTag
) {

    public static final String UNKNOWN = "unknown";

}

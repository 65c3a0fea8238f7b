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

import com.ecrpostprocessor.dto.ImagePushLogRecord;

import java.util.Optional;

public interface ImagePushLogService {

    // unconditional upsert, an existing record with the same image tag is replaced
    void save(ImagePushLogRecord logRecord);

    Optional<ImagePushLogRecord> findByImageTag(String imageTag);
}

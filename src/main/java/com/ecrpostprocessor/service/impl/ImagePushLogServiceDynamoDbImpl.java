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

import com.ecrpostprocessor.dto.ImagePushLogRecord;
import com.ecrpostprocessor.exception.PersistenceException;
import com.ecrpostprocessor.service.ImagePushLogService;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.Map;
import java.util.Optional;

public class ImagePushLogServiceDynamoDbImpl implements ImagePushLogService {

    static final String IMAGE_TAG = "imageTag";
    static final String REPOSITORY = "repository";
    static final String TIMESTAMP = "timestamp";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    public ImagePushLogServiceDynamoDbImpl(DynamoDbClient dynamoDbClient, String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
    }

    @Override
    public void save(ImagePushLogRecord logRecord) {
        PutItemRequest putItemRequest = PutItemRequest.builder()
                .tableName(tableName)
                .item(Map.of(
                        IMAGE_TAG, AttributeValue.builder().s(logRecord.imageTag()).build(),
                        REPOSITORY, AttributeValue.builder().s(logRecord.repository()).build(),
                        TIMESTAMP, AttributeValue.builder().s(logRecord.timestamp()).build()
                ))
                .build();
        try {
            dynamoDbClient.putItem(putItemRequest);
        } catch (SdkException e) {
            throw new PersistenceException(String.format("Failed to write image tag '%s' to table '%s'. Reason: %s",
                    logRecord.imageTag(), tableName, e.getMessage()), e);
        }
    }

    @Override
    public Optional<ImagePushLogRecord> findByImageTag(String imageTag) {
        GetItemRequest getItemRequest = GetItemRequest.builder()
                .tableName(tableName)
                .key(Map.of(IMAGE_TAG, AttributeValue.builder().s(imageTag).build()))
                .consistentRead(true)
                .build();
        GetItemResponse response;
        try {
            response = dynamoDbClient.getItem(getItemRequest);
        } catch (SdkException e) {
            throw new PersistenceException(String.format("Failed to read image tag '%s' from table '%s'. Reason: %s",
                    imageTag, tableName, e.getMessage()), e);
        }
        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        Map<String, AttributeValue> item = response.item();
        return Optional.of(new ImagePushLogRecord(
                stringAttribute(item, IMAGE_TAG),
                stringAttribute(item, REPOSITORY),
                stringAttribute(item, TIMESTAMP)
        ));
    }

    private static String stringAttribute(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        return value == null ? null : value.s();
    }

}

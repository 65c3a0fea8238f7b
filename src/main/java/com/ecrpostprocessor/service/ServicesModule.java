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

import com.ecrpostprocessor.config.RelayConfiguration;
import com.ecrpostprocessor.service.impl.ImagePushLogServiceDynamoDbImpl;
import com.ecrpostprocessor.service.impl.NotificationServiceSnsImpl;
import dagger.Module;
import dagger.Provides;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.sns.SnsClient;

import javax.inject.Singleton;
import java.time.Clock;

/**
 * Module that provides services for the Dagger dependency injection.
 */
@Module
public class ServicesModule {

    @Singleton
    @Provides
    ImagePushLogService provideImagePushLogService(DynamoDbClient dynamoDbClient, RelayConfiguration configuration) {
        return new ImagePushLogServiceDynamoDbImpl(dynamoDbClient, configuration.tableName());
    }

    @Singleton
    @Provides
    NotificationService provideNotificationService(SnsClient snsClient, RelayConfiguration configuration) {
        return new NotificationServiceSnsImpl(snsClient, configuration.topicArn());
    }

    @Singleton
    @Provides
    ImagePushRelay provideImagePushRelay(ImagePushLogService imagePushLogService,
                                         NotificationService notificationService,
                                         Clock clock) {
        return new ImagePushRelay(imagePushLogService, notificationService, clock);
    }

}

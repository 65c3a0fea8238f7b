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
package com.ecrpostprocessor.config;

import dagger.Module;
import dagger.Provides;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.sns.SnsClient;

import javax.inject.Singleton;

/**
 * Module that provides AWS SDK clients. They are created once per Lambda container and reused
 * by every invocation it serves.
 */
@Module
public class ClientsModule {

    @Singleton
    @Provides
    DynamoDbClient provideDynamoDbClient(RelayConfiguration configuration) {
        return DynamoDbClient.builder()
                .region(Region.of(configuration.region()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Singleton
    @Provides
    SnsClient provideSnsClient(RelayConfiguration configuration) {
        return SnsClient.builder()
                .region(Region.of(configuration.region()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

}

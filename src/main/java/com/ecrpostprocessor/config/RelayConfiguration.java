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

import com.ecrpostprocessor.exception.ConfigurationException;

import java.util.Map;

/**
 * Resource identifiers the relay is deployed against, read from the Lambda environment.
 */
public record RelayConfiguration(
        String region,
        String tableName,
        String topicArn
) {

    public static final String REGION = "REGION";
    public static final String AWS_REGION = "AWS_REGION";
    public static final String DDB_TABLE = "DDB_TABLE";
    public static final String SNS_ARN = "SNS_ARN";

    public static RelayConfiguration fromEnvironment(Map<String, String> environment) {
        String region = environment.get(REGION);
        if (isBlank(region)) {
            // always set by the Lambda runtime
            region = environment.get(AWS_REGION);
        }
        return new RelayConfiguration(
                require(REGION, region),
                require(DDB_TABLE, environment.get(DDB_TABLE)),
                require(SNS_ARN, environment.get(SNS_ARN))
        );
    }

    private static String require(String name, String value) {
        if (isBlank(value)) {
            throw new ConfigurationException("Environment variable '" + name + "' is not set");
        }
        return value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}

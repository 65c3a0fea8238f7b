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

import com.google.gson.Gson;
import dagger.Module;
import dagger.Provides;

import javax.inject.Singleton;
import java.time.Clock;

/**
 * Module that provides configuration and shared utilities for the Dagger dependency injection framework.
 */
@Module
public class ConfigurationModule {

    @Singleton
    @Provides
    RelayConfiguration provideRelayConfiguration() {
        return RelayConfiguration.fromEnvironment(System.getenv());
    }

    // Record timestamps are taken in UTC
    @Singleton
    @Provides
    Clock provideClock() {
        return Clock.systemUTC();
    }

    @Singleton
    @Provides
    Gson provideGson() {
        return new Gson();
    }

}

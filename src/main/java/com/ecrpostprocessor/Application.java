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
package com.ecrpostprocessor;

import com.ecrpostprocessor.config.ClientsModule;
import com.ecrpostprocessor.config.ConfigurationModule;
import com.ecrpostprocessor.service.ImagePushRelay;
import com.ecrpostprocessor.service.ServicesModule;
import com.google.gson.Gson;
import dagger.Component;

import javax.inject.Singleton;

/**
 * Application component. Assembly of all modules for the Dagger dependency injection framework.
 */
@Singleton
@Component(modules = {ConfigurationModule.class, ClientsModule.class, ServicesModule.class})
public interface Application {

    ImagePushRelay getImagePushRelay();

    Gson getGson();
}

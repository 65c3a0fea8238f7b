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
package com.ecrpostprocessor.handler;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.ScheduledEvent;
import com.ecrpostprocessor.Application;
import com.ecrpostprocessor.DaggerApplication;
import com.ecrpostprocessor.dto.ImagePushEvent;
import com.ecrpostprocessor.dto.RelayResult;
import com.ecrpostprocessor.exception.RelayException;
import com.ecrpostprocessor.service.ImagePushRelay;
import com.ecrpostprocessor.utils.ImagePushEventMapper;
import com.google.gson.Gson;
import com.syndicate.deployment.annotations.environment.EnvironmentVariable;
import com.syndicate.deployment.annotations.environment.EnvironmentVariables;
import com.syndicate.deployment.annotations.events.RuleEventSource;
import com.syndicate.deployment.annotations.lambda.LambdaHandler;
import com.syndicate.deployment.annotations.resources.DependsOn;
import com.syndicate.deployment.model.DeploymentRuntime;
import com.syndicate.deployment.model.ResourceType;

import java.util.Map;

/**
 * Entry point for image push events routed from the container registry by an EventBridge rule.
 * Every event is logged to the image push table and announced on the notification topic.
 */
@LambdaHandler(lambdaName = "ecr_postprocessor",
        roleName = "ecr_postprocessor-role",
        runtime = DeploymentRuntime.JAVA17,
        isPublishVersion = true,
        aliasName = "${lambdas_alias_name}")
@RuleEventSource(targetRule = "ecr_image_push_rule")
@DependsOn(name = "${image_push_table}", resourceType = ResourceType.DYNAMODB_TABLE)
@DependsOn(name = "${image_push_topic}", resourceType = ResourceType.SNS_TOPIC)
@EnvironmentVariables(value = {
        @EnvironmentVariable(key = "REGION", value = "${region}"),
        @EnvironmentVariable(key = "DDB_TABLE", value = "${image_push_table}"),
        @EnvironmentVariable(key = "SNS_ARN", value = "${image_push_topic_arn}")
})
public class EcrImagePushHandler implements RequestHandler<ScheduledEvent, Map<String, String>> {

    private final ImagePushRelay imagePushRelay;
    private final Gson gson;

    public EcrImagePushHandler() {
        this(DaggerApplication.create());
    }

    private EcrImagePushHandler(Application application) {
        this(application.getImagePushRelay(), application.getGson());
    }

    EcrImagePushHandler(ImagePushRelay imagePushRelay, Gson gson) {
        this.imagePushRelay = imagePushRelay;
        this.gson = gson;
    }

    @Override
    public Map<String, String> handleRequest(ScheduledEvent scheduledEvent, Context context) {
        LambdaLogger logger = context.getLogger();
        if (scheduledEvent != null) {
            logger.log(String.format("Event received: source=%s, detailType=%s, detail=%s",
                    scheduledEvent.getSource(), scheduledEvent.getDetailType(), gson.toJson(scheduledEvent.getDetail())));
        }

        ImagePushEvent event = null;
        try {
            event = ImagePushEventMapper.fromScheduledEvent(scheduledEvent);
            RelayResult result = imagePushRelay.process(event);
            logger.log(String.format("Image push %s:%s logged at %s, notification %s",
                    result.repository(), result.imageTag(), result.timestamp(), result.messageId()));
            return result.toMap();
        } catch (RelayException e) {
            logger.log(String.format("%s while relaying image push %s: %s", e.getClass().getSimpleName(),
                    event == null ? "<none>" : event.repository() + ":" + event.imageTag(), e.getMessage()));
            throw e;
        }
    }

}

/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.eventbridge.bridge.engine;

import java.util.Map;

/**
 * Snapshot of an engine-owned process instance.
 *
 * @param id               engine-assigned identifier
 * @param definitionKey    key of the process definition
 * @param businessKey      external identifier, often the id of the aggregate the process drives
 * @param tenantId         the engine's tenant for this instance, may be null
 * @param status           execution status
 * @param variables        process variables at the time of the snapshot
 * @param awaitingMessage  message the instance is subscribed to, null unless WAITING
 * @param errorCode        code of the last error raised by a task, null if none
 */
public record ProcessInstance(
        String id,
        String definitionKey,
        String businessKey,
        String tenantId,
        ProcessStatus status,
        Map<String, Object> variables,
        String awaitingMessage,
        String errorCode
) {

    public boolean isWaitingFor(String messageName) {
        return status == ProcessStatus.WAITING && messageName.equals(awaitingMessage);
    }

    public Object getVariable(String name) {
        return variables.get(name);
    }
}

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

package org.fireflyframework.eventbridge.bridge.engine.inmemory;

import org.fireflyframework.eventbridge.bridge.engine.ProcessInstance;
import org.fireflyframework.eventbridge.bridge.engine.ProcessStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one in-memory process instance. All access is synchronized on the instance.
 */
final class InstanceState {

    /**
     * Position to resume at once the awaited message arrives.
     */
    record Continuation(List<ProcessNode> path, int index) {
    }

    private final String id;
    private final String definitionKey;
    private final String businessKey;
    private final String tenantId;
    private final Map<String, Object> variables = new LinkedHashMap<>();

    private ProcessStatus status = ProcessStatus.RUNNING;
    private String awaitingMessage;
    private Continuation continuation;
    private String errorCode;

    InstanceState(String id, String definitionKey, String businessKey, String tenantId,
                  Map<String, Object> initialVariables) {
        this.id = id;
        this.definitionKey = definitionKey;
        this.businessKey = businessKey;
        this.tenantId = tenantId;
        if (initialVariables != null) {
            this.variables.putAll(initialVariables);
        }
    }

    String id() {
        return id;
    }

    String definitionKey() {
        return definitionKey;
    }

    String businessKey() {
        return businessKey;
    }

    String tenantId() {
        return tenantId;
    }

    synchronized Object getVariable(String name) {
        return variables.get(name);
    }

    synchronized void setVariable(String name, Object value) {
        variables.put(name, value);
    }

    synchronized void putVariables(Map<String, Object> values) {
        if (values != null) {
            variables.putAll(values);
        }
    }

    synchronized boolean isWaitingFor(String messageName, String correlationKey) {
        return status == ProcessStatus.WAITING
                && messageName.equals(awaitingMessage)
                && correlationKey.equals(businessKey);
    }

    synchronized void await(String messageName, List<ProcessNode> path, int index) {
        this.status = ProcessStatus.WAITING;
        this.awaitingMessage = messageName;
        this.continuation = new Continuation(path, index);
    }

    /**
     * Consumes the message subscription.
     *
     * @return where to resume, or null if the instance does not wait for the message
     */
    synchronized Continuation claim(String messageName) {
        if (status != ProcessStatus.WAITING || !messageName.equals(awaitingMessage)) {
            return null;
        }
        Continuation claimed = continuation;
        this.status = ProcessStatus.RUNNING;
        this.awaitingMessage = null;
        this.continuation = null;
        return claimed;
    }

    synchronized void recordError(String code) {
        this.errorCode = code;
    }

    synchronized void complete() {
        if (status == ProcessStatus.RUNNING) {
            this.status = ProcessStatus.COMPLETED;
        }
    }

    synchronized void fail(String code) {
        this.status = ProcessStatus.FAILED;
        this.errorCode = code;
    }

    synchronized void terminate() {
        if (!status.isTerminal()) {
            this.status = ProcessStatus.TERMINATED;
            this.awaitingMessage = null;
            this.continuation = null;
        }
    }

    synchronized ProcessInstance snapshot() {
        return new ProcessInstance(id, definitionKey, businessKey, tenantId, status,
                Collections.unmodifiableMap(new LinkedHashMap<>(variables)), awaitingMessage, errorCode);
    }
}

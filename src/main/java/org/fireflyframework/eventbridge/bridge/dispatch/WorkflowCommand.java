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

package org.fireflyframework.eventbridge.bridge.dispatch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a command record as dispatchable from workflow tasks.
 * <p>
 * Example:
 * <pre>
 * {@literal @}WorkflowCommand(name = "request.cancel", compensating = true)
 * public record CancelResourceRequestCommand(TenantId tenantId, UUID requestId, ...) implements Command {}
 * </pre>
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface WorkflowCommand {

    /**
     * Stable key used in the {@code commandClassName} process variable.
     * Defaults to the fully-qualified class name.
     */
    String name() default "";

    /**
     * Whether the command semantically undoes another command. Only used for metrics.
     */
    boolean compensating() default false;
}

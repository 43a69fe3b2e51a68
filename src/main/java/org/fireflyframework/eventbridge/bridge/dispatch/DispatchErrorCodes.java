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

import org.fireflyframework.eventbridge.exception.AggregateNotFoundException;
import org.fireflyframework.eventbridge.exception.ConcurrencyConflictException;
import org.fireflyframework.eventbridge.exception.InvalidInputException;
import org.fireflyframework.eventbridge.exception.InvalidStateTransitionException;
import org.fireflyframework.eventbridge.exception.SeparationOfDutiesException;
import org.fireflyframework.eventbridge.exception.TenantIsolationException;

import java.util.Set;

/**
 * Values written to the {@code commandResult} variable and raised as workflow error codes.
 * Each failure cause has its own code so error boundaries can be attached precisely.
 */
public final class DispatchErrorCodes {

    public static final String SUCCESS = "SUCCESS";

    public static final String UNKNOWN_COMMAND = "UNKNOWN_COMMAND";
    public static final String MISSING_VARIABLE = "MISSING_VARIABLE";
    public static final String PARAMETER_MISMATCH = "PARAMETER_MISMATCH";
    public static final String PARAMETER_TYPE_MISMATCH = "PARAMETER_TYPE_MISMATCH";
    public static final String TENANT_ISOLATION_VIOLATION = TenantIsolationException.ERROR_CODE;
    public static final String DISPATCH_TIMEOUT = "DISPATCH_TIMEOUT";
    public static final String COMMAND_DISPATCH_FAILED = "COMMAND_DISPATCH_FAILED";

    /**
     * Domain error codes passed through unchanged from the command handler.
     */
    static final Set<String> DOMAIN_CODES = Set.of(
            ConcurrencyConflictException.ERROR_CODE,
            InvalidStateTransitionException.ERROR_CODE,
            SeparationOfDutiesException.ERROR_CODE,
            InvalidInputException.ERROR_CODE,
            AggregateNotFoundException.ERROR_CODE,
            TenantIsolationException.ERROR_CODE,
            UNKNOWN_COMMAND);

    private DispatchErrorCodes() {
    }
}

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

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import org.fireflyframework.eventbridge.bridge.engine.WorkflowTaskError;
import org.fireflyframework.eventbridge.command.Command;
import org.fireflyframework.eventbridge.command.CommandGateway;
import org.fireflyframework.eventbridge.command.CommandResult;
import org.fireflyframework.eventbridge.exception.ConcurrencyConflictException;
import org.fireflyframework.eventbridge.exception.InvalidInputException;
import org.fireflyframework.eventbridge.exception.SeparationOfDutiesException;
import org.fireflyframework.eventbridge.metrics.BridgeMetrics;
import org.fireflyframework.eventbridge.request.command.ApproveResourceRequestCommand;
import org.fireflyframework.eventbridge.request.command.CancelResourceRequestCommand;
import org.fireflyframework.eventbridge.support.TestTaskExecution;
import org.fireflyframework.eventbridge.tenant.TenantId;
import org.fireflyframework.eventbridge.tracing.BridgeTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.eventbridge.support.EventBridgeTestFixtures.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CommandDispatchTask}.
 */
@ExtendWith(MockitoExtension.class)
class CommandDispatchTaskTest {

    @WorkflowCommand(name = "test.quota")
    record SetQuotaCommand(TenantId tenantId, UUID projectId, int quota) implements Command {
        SetQuotaCommand {
            if (quota < 0) {
                throw new InvalidInputException("quota", "quota must not be negative");
            }
            if (quota > 1000) {
                throw new IllegalArgumentException("quota too large");
            }
        }

        @Override
        public UUID aggregateId() {
            return projectId;
        }

        @Override
        public String actorId() {
            return SYSTEM_ACTOR;
        }
    }

    @Mock
    private CommandGateway gateway;

    private SimpleMeterRegistry meterRegistry;
    private CommandDispatchTask task;
    private UUID requestId;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        CommandRegistry registry = new CommandRegistry(List.of(
                ApproveResourceRequestCommand.class,
                CancelResourceRequestCommand.class,
                SetQuotaCommand.class));
        task = new CommandDispatchTask(registry, gateway, objectMapper(),
                TimeLimiter.of(Duration.ofMillis(200)),
                new BridgeMetrics(meterRegistry),
                new BridgeTracer(ObservationRegistry.create()));
        requestId = UUID.randomUUID();
    }

    private TestTaskExecution approveExecution() {
        return new TestTaskExecution(TENANT_A.value())
                .with(CommandDispatchTask.COMMAND_CLASS_NAME, "request.approve")
                .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS, List.of("tenantId", "requestId", "adminId"))
                .with("tenantId", TENANT_A.value())
                .with("requestId", requestId.toString())
                .with("adminId", ADMIN);
    }

    private void expectTaskError(TestTaskExecution execution, String errorCode) {
        StepVerifier.create(task.execute(execution))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(WorkflowTaskError.class);
                    assertThat(((WorkflowTaskError) error).getErrorCode()).isEqualTo(errorCode);
                })
                .verify();
        assertThat(execution.getVariable(CommandDispatchTask.COMMAND_RESULT)).isEqualTo(errorCode);
    }

    private double dispatchCount(String command, String outcome) {
        var counter = meterRegistry.find("firefly.eventbridge.dispatch.commands")
                .tag("command", command)
                .tag("outcome", outcome)
                .counter();
        return counter == null ? 0 : counter.count();
    }

    // ========================================================================
    // Success Tests
    // ========================================================================

    @Nested
    @DisplayName("successful dispatch")
    class SuccessTests {

        @Test
        @DisplayName("should build the command from variables and send it with the instance id as correlation")
        void shouldDispatchCommand() {
            ApproveResourceRequestCommand expected = new ApproveResourceRequestCommand(TENANT_A, requestId, ADMIN);
            when(gateway.send(expected, "instance-1"))
                    .thenReturn(Mono.just(new CommandResult(requestId, 2, 1)));
            TestTaskExecution execution = approveExecution();

            StepVerifier.create(task.execute(execution)).verifyComplete();

            assertThat(execution.getVariable(CommandDispatchTask.COMMAND_RESULT)).isEqualTo("SUCCESS");
            assertThat(dispatchCount("request.approve", "SUCCESS")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should accept typed variables and resolve by class name")
        void shouldAcceptTypedVariables() {
            ApproveResourceRequestCommand expected = new ApproveResourceRequestCommand(TENANT_A, requestId, ADMIN);
            when(gateway.send(expected, "instance-1"))
                    .thenReturn(Mono.just(new CommandResult(requestId, 2, 1)));
            TestTaskExecution execution = approveExecution()
                    .with(CommandDispatchTask.COMMAND_CLASS_NAME, ApproveResourceRequestCommand.class.getName())
                    .with("tenantId", TENANT_A)
                    .with("requestId", requestId);

            StepVerifier.create(task.execute(execution)).verifyComplete();
        }

        @Test
        @DisplayName("should count compensating commands")
        void shouldRecordCompensation() {
            when(gateway.send(any(CancelResourceRequestCommand.class), eq("instance-1")))
                    .thenReturn(Mono.just(new CommandResult(requestId, 2, 1)));
            TestTaskExecution execution = new TestTaskExecution(TENANT_A.value())
                    .with(CommandDispatchTask.COMMAND_CLASS_NAME, "request.cancel")
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS,
                            List.of("tenantId", "requestId", "userId", "reason"))
                    .with("tenantId", TENANT_A.value())
                    .with("requestId", requestId.toString())
                    .with("userId", REQUESTER)
                    .with("reason", "Provisioning rolled back");

            StepVerifier.create(task.execute(execution)).verifyComplete();

            assertThat(meterRegistry.get("firefly.eventbridge.compensation.commands")
                    .tag("command", "request.cancel").counter().count()).isEqualTo(1.0);
        }
    }

    // ========================================================================
    // Validation Tests
    // ========================================================================

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should fail with UNKNOWN_COMMAND for an unregistered key")
        void shouldRejectUnknownCommand() {
            TestTaskExecution execution = approveExecution()
                    .with(CommandDispatchTask.COMMAND_CLASS_NAME, "com.example.DropDatabase");

            expectTaskError(execution, DispatchErrorCodes.UNKNOWN_COMMAND);

            verify(gateway, never()).send(any(), anyString());
            assertThat(dispatchCount("unknown", "UNKNOWN_COMMAND")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail with MISSING_VARIABLE before constructing anything")
        void shouldRejectMissingVariable() {
            TestTaskExecution execution = approveExecution();
            execution.getVariables().remove("adminId");

            StepVerifier.create(task.execute(execution))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(WorkflowTaskError.class)
                            .hasMessage("Missing process variable: adminId"))
                    .verify();
            assertThat(execution.getVariable(CommandDispatchTask.COMMAND_RESULT))
                    .isEqualTo(DispatchErrorCodes.MISSING_VARIABLE);
            verify(gateway, never()).send(any(), anyString());
        }

        @Test
        @DisplayName("should fail with MISSING_VARIABLE without a parameter list")
        void shouldRejectMissingParameterList() {
            TestTaskExecution execution = approveExecution();
            execution.getVariables().remove(CommandDispatchTask.CONSTRUCTOR_PARAMETERS);

            expectTaskError(execution, DispatchErrorCodes.MISSING_VARIABLE);
        }

        @Test
        @DisplayName("should fail with PARAMETER_MISMATCH when a listed name is not a constructor parameter")
        void shouldRejectParameterMismatch() {
            TestTaskExecution execution = approveExecution()
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS,
                            List.of("tenantId", "requestId", "adminId", "comment"))
                    .with("comment", "looks fine");

            expectTaskError(execution, DispatchErrorCodes.PARAMETER_MISMATCH);
            verify(gateway, never()).send(any(), anyString());
        }

        @Test
        @DisplayName("should fail with PARAMETER_MISMATCH when a name is listed twice")
        void shouldRejectDuplicateParameter() {
            TestTaskExecution execution = approveExecution()
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS,
                            List.of("tenantId", "requestId", "adminId", "adminId"));

            expectTaskError(execution, DispatchErrorCodes.PARAMETER_MISMATCH);
        }

        @Test
        @DisplayName("should fail with MISSING_VARIABLE naming a constructor parameter left out of the list")
        void shouldRejectOmittedParameter() {
            TestTaskExecution execution = approveExecution()
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS, List.of("tenantId", "requestId"));

            StepVerifier.create(task.execute(execution))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(WorkflowTaskError.class).hasMessageContaining("adminId");
                        assertThat(((WorkflowTaskError) error).getErrorCode())
                                .isEqualTo(DispatchErrorCodes.MISSING_VARIABLE);
                    })
                    .verify();
            assertThat(execution.getVariable(CommandDispatchTask.COMMAND_RESULT))
                    .isEqualTo(DispatchErrorCodes.MISSING_VARIABLE);
            verify(gateway, never()).send(any(), anyString());
        }

        @Test
        @DisplayName("should bind parameters by name whatever order they are listed in")
        void shouldAcceptReorderedParameters() {
            ApproveResourceRequestCommand expected = new ApproveResourceRequestCommand(TENANT_A, requestId, ADMIN);
            when(gateway.send(expected, "instance-1"))
                    .thenReturn(Mono.just(new CommandResult(requestId, 2, 1)));
            TestTaskExecution execution = approveExecution()
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS, List.of("adminId", "requestId", "tenantId"));

            StepVerifier.create(task.execute(execution)).verifyComplete();

            assertThat(execution.getVariable(CommandDispatchTask.COMMAND_RESULT)).isEqualTo("SUCCESS");
        }

        @Test
        @DisplayName("should fail with PARAMETER_MISMATCH when the parameter list is malformed")
        void shouldRejectMalformedParameterList() {
            TestTaskExecution execution = approveExecution()
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS, "tenantId,requestId,adminId");

            expectTaskError(execution, DispatchErrorCodes.PARAMETER_MISMATCH);
        }

        @Test
        @DisplayName("should fail with PARAMETER_TYPE_MISMATCH for an unconvertible value")
        void shouldRejectTypeMismatch() {
            TestTaskExecution execution = approveExecution().with("requestId", "not-a-uuid");

            expectTaskError(execution, DispatchErrorCodes.PARAMETER_TYPE_MISMATCH);
        }

        @Test
        @DisplayName("should keep the code of a domain exception thrown by the constructor")
        void shouldKeepConstructorDomainCode() {
            TestTaskExecution execution = new TestTaskExecution(TENANT_A.value())
                    .with(CommandDispatchTask.COMMAND_CLASS_NAME, "test.quota")
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS, List.of("tenantId", "projectId", "quota"))
                    .with("tenantId", TENANT_A.value())
                    .with("projectId", UUID.randomUUID())
                    .with("quota", -1);

            expectTaskError(execution, InvalidInputException.ERROR_CODE);
        }

        @Test
        @DisplayName("should report other constructor failures as INVALID_INPUT")
        void shouldMapConstructorFailure() {
            TestTaskExecution execution = new TestTaskExecution(TENANT_A.value())
                    .with(CommandDispatchTask.COMMAND_CLASS_NAME, "test.quota")
                    .with(CommandDispatchTask.CONSTRUCTOR_PARAMETERS, List.of("tenantId", "projectId", "quota"))
                    .with("tenantId", TENANT_A.value())
                    .with("projectId", UUID.randomUUID())
                    .with("quota", "5000");

            expectTaskError(execution, InvalidInputException.ERROR_CODE);
        }
    }

    // ========================================================================
    // Tenant Isolation Tests
    // ========================================================================

    @Nested
    @DisplayName("tenant isolation")
    class TenantIsolationTests {

        @Test
        @DisplayName("should refuse a tenant variable that differs from the instance tenant")
        void shouldRejectForeignTenant() {
            TestTaskExecution execution = approveExecution().with("tenantId", TENANT_B.value());

            StepVerifier.create(task.execute(execution))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(WorkflowTaskError.class)
                            .hasMessage("Access denied"))
                    .verify();

            assertThat(execution.getVariable(CommandDispatchTask.COMMAND_RESULT))
                    .isEqualTo(DispatchErrorCodes.TENANT_ISOLATION_VIOLATION);
            assertThat(meterRegistry.get("firefly.eventbridge.tenant.violations")
                    .tag("source", "dispatch").counter().count()).isEqualTo(1.0);
            verify(gateway, never()).send(any(), anyString());
        }

        @Test
        @DisplayName("should fail closed when the engine has no tenant for the instance")
        void shouldRejectMissingEngineTenant() {
            TestTaskExecution execution = new TestTaskExecution(null);
            execution.getVariables().putAll(approveExecution().getVariables());

            expectTaskError(execution, DispatchErrorCodes.TENANT_ISOLATION_VIOLATION);
            verify(gateway, never()).send(any(), anyString());
        }
    }

    // ========================================================================
    // Failure Mapping Tests
    // ========================================================================

    @Nested
    @DisplayName("failure mapping")
    class FailureMappingTests {

        @Test
        @DisplayName("should pass concurrency conflicts through with their own code")
        void shouldMapConcurrencyConflict() {
            when(gateway.send(any(), eq("instance-1")))
                    .thenReturn(Mono.error(new ConcurrencyConflictException(requestId, 1, 2)));

            expectTaskError(approveExecution(), ConcurrencyConflictException.ERROR_CODE);
        }

        @Test
        @DisplayName("should pass separation of duties violations through")
        void shouldMapSeparationOfDuties() {
            when(gateway.send(any(), eq("instance-1")))
                    .thenReturn(Mono.error(new SeparationOfDutiesException(ADMIN, "approve")));

            expectTaskError(approveExecution(), SeparationOfDutiesException.ERROR_CODE);
        }

        @Test
        @DisplayName("should report unexpected failures as COMMAND_DISPATCH_FAILED")
        void shouldMapUnexpectedFailure() {
            when(gateway.send(any(), eq("instance-1")))
                    .thenReturn(Mono.error(new IllegalStateException("connection reset")));

            expectTaskError(approveExecution(), DispatchErrorCodes.COMMAND_DISPATCH_FAILED);
        }

        @Test
        @DisplayName("should report a gateway that throws instead of returning an error as COMMAND_DISPATCH_FAILED")
        void shouldMapSynchronousGatewayThrow() {
            when(gateway.send(any(), eq("instance-1"))).thenThrow(new IllegalStateException("handler bug"));
            TestTaskExecution execution = approveExecution();

            expectTaskError(execution, DispatchErrorCodes.COMMAND_DISPATCH_FAILED);
            assertThat(dispatchCount("request.approve", DispatchErrorCodes.COMMAND_DISPATCH_FAILED)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep the domain code of an exception the gateway throws synchronously")
        void shouldMapSynchronousDomainThrow() {
            when(gateway.send(any(), eq("instance-1")))
                    .thenThrow(new ConcurrencyConflictException(requestId, 1, 2));

            expectTaskError(approveExecution(), ConcurrencyConflictException.ERROR_CODE);
        }

        @Test
        @DisplayName("should fail with DISPATCH_TIMEOUT when the command outlives the time limit")
        void shouldTimeOut() {
            when(gateway.send(any(), eq("instance-1"))).thenReturn(Mono.never());

            expectTaskError(approveExecution(), DispatchErrorCodes.DISPATCH_TIMEOUT);
            assertThat(dispatchCount("request.approve", "DISPATCH_TIMEOUT")).isEqualTo(1.0);
        }
    }
}

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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.command.Command;
import org.fireflyframework.eventbridge.tenant.TenantId;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of commands that workflow tasks may construct.
 * <p>
 * Only registered commands can be built from process variables. Each command must be a
 * record with a {@code tenantId} component of type {@link TenantId}; its canonical
 * constructor is resolved here once, so dispatch never looks up classes by name.
 * A command is registered under the {@link WorkflowCommand#name()} key when present and
 * is also reachable by its fully-qualified class name.
 */
@Slf4j
public class CommandRegistry {

    public static final String TENANT_PARAMETER = "tenantId";

    private final Map<String, CommandDescriptor> descriptors = new ConcurrentHashMap<>();

    public CommandRegistry() {
    }

    public CommandRegistry(Collection<Class<? extends Command>> commandTypes) {
        commandTypes.forEach(this::register);
        log.info("CommandRegistry initialized with {} workflow commands", getKeys().size());
    }

    /**
     * Registers a command record.
     *
     * @throws IllegalArgumentException if the type is not a record, has no {@code tenantId}
     *                                  component, or its key is already taken
     */
    public CommandDescriptor register(Class<? extends Command> commandType) {
        if (!commandType.isRecord()) {
            throw new IllegalArgumentException("Workflow command must be a record: " + commandType.getName());
        }

        RecordComponent[] components = commandType.getRecordComponents();
        boolean hasTenant = Arrays.stream(components)
                .anyMatch(c -> c.getName().equals(TENANT_PARAMETER) && c.getType() == TenantId.class);
        if (!hasTenant) {
            throw new IllegalArgumentException("Workflow command " + commandType.getName()
                    + " must declare a '" + TENANT_PARAMETER + "' component of type " + TenantId.class.getSimpleName());
        }

        List<CommandParameter> parameters = new ArrayList<>(components.length);
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            parameters.add(new CommandParameter(component.getName(), component.getType(), component.getGenericType()));
            parameterTypes[i] = component.getType();
        }

        Constructor<? extends Command> constructor;
        try {
            constructor = commandType.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No canonical constructor on " + commandType.getName(), e);
        }

        WorkflowCommand annotation = commandType.getAnnotation(WorkflowCommand.class);
        String key = annotation != null && !annotation.name().isBlank() ? annotation.name() : commandType.getName();
        boolean compensating = annotation != null && annotation.compensating();

        CommandDescriptor descriptor = new CommandDescriptor(key, commandType, parameters, compensating,
                arguments -> instantiate(constructor, arguments));

        putUnique(key, descriptor);
        if (!key.equals(commandType.getName())) {
            putUnique(commandType.getName(), descriptor);
        }
        log.debug("Registered workflow command: key={}, type={}, parameters={}, compensating={}",
                key, commandType.getSimpleName(), descriptor.parameterNames(), compensating);
        return descriptor;
    }

    public Optional<CommandDescriptor> resolve(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(descriptors.get(key));
    }

    /**
     * Returns the primary keys of all registered commands.
     */
    public Set<String> getKeys() {
        Set<String> keys = new TreeSet<>();
        descriptors.values().forEach(descriptor -> keys.add(descriptor.key()));
        return keys;
    }

    private void putUnique(String key, CommandDescriptor descriptor) {
        CommandDescriptor existing = descriptors.putIfAbsent(key, descriptor);
        if (existing != null && existing.commandType() != descriptor.commandType()) {
            throw new IllegalArgumentException("Workflow command key '" + key + "' is already used by "
                    + existing.commandType().getName());
        }
    }

    private static Command instantiate(Constructor<? extends Command> constructor, Object[] arguments) {
        try {
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Command constructor failed: " + constructor.getDeclaringClass().getName(),
                    e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + constructor.getDeclaringClass().getName(), e);
        }
    }
}

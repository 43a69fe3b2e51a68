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

import org.fireflyframework.eventbridge.command.Command;

import java.util.List;
import java.util.function.Function;

/**
 * Everything needed to build a command from process variables, resolved once at startup.
 *
 * @param key          stable key referenced by workflow definitions
 * @param commandType  the command class
 * @param parameters   constructor parameters in declaration order
 * @param compensating whether the command undoes another one
 * @param factory      builds the command from arguments ordered as {@code parameters}
 */
public record CommandDescriptor(
        String key,
        Class<? extends Command> commandType,
        List<CommandParameter> parameters,
        boolean compensating,
        Function<Object[], Command> factory
) {

    public CommandDescriptor {
        parameters = List.copyOf(parameters);
    }

    public List<String> parameterNames() {
        return parameters.stream().map(CommandParameter::name).toList();
    }

    public Command newInstance(Object[] arguments) {
        return factory.apply(arguments);
    }
}

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

import java.lang.reflect.Type;

/**
 * A constructor parameter of a dispatchable command.
 *
 * @param name        the record component name
 * @param type        the raw parameter type
 * @param genericType the full generic type, used for value conversion
 */
public record CommandParameter(String name, Class<?> type, Type genericType) {
}

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


package org.fireflyframework.scheduler.core.execution;

import java.util.Map;

/**
 * Renders {@code {{.name}}} placeholders in a single command argument.
 *
 * <p>Rendering is a single pass: substituted values are inserted as-is and never
 * rendered again. It never fails either. When an argument references an unknown
 * binding, uses a placeholder without the leading dot, or has an unbalanced
 * {@code {{} or {@code }}}, it is returned unchanged.
 */
public final class ArgumentRenderer {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private ArgumentRenderer() {}

    public static String render(String argument, Map<String, String> bindings) {
        if (argument == null || (!argument.contains(OPEN) && !argument.contains(CLOSE))) {
            return argument;
        }
        StringBuilder out = new StringBuilder(argument.length());
        int pos = 0;
        while (pos < argument.length()) {
            int open = argument.indexOf(OPEN, pos);
            int strayClose = argument.indexOf(CLOSE, pos);
            if (open < 0) {
                if (strayClose >= 0) {
                    return argument;
                }
                out.append(argument, pos, argument.length());
                break;
            }
            if (strayClose >= 0 && strayClose < open) {
                return argument;
            }
            int close = argument.indexOf(CLOSE, open + OPEN.length());
            int nested = argument.indexOf(OPEN, open + OPEN.length());
            if (close < 0 || (nested >= 0 && nested < close)) {
                return argument;
            }
            String value = lookup(argument.substring(open + OPEN.length(), close), bindings);
            if (value == null) {
                return argument;
            }
            out.append(argument, pos, open).append(value);
            pos = close + CLOSE.length();
        }
        return out.toString();
    }

    private static String lookup(String placeholder, Map<String, String> bindings) {
        String key = placeholder.strip();
        if (!key.startsWith(".") || key.length() == 1) {
            return null;
        }
        return bindings.get(key.substring(1).strip());
    }
}

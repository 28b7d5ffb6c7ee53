/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.orchestrator.domain.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the natural-language tool requests a reasoning model embedded in its
 * answer, delimited as:
 *
 * <pre>
 * TOOL_INSTRUCTION
 * fetch the weather for Paris
 * END_INSTRUCTION
 * </pre>
 */
public class ToolRequestExtractor {

    public static final String START_MARKER = "TOOL_INSTRUCTION";
    public static final String END_MARKER = "END_INSTRUCTION";

    private static final Pattern SPAN = Pattern.compile(
            START_MARKER + "\\r?\\n(.*?)\\r?\\n" + END_MARKER, Pattern.DOTALL);

    /**
     * Every span in order of appearance, trimmed; blank spans are dropped.
     */
    public List<String> extract(String content) {
        List<String> requests = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return requests;
        }
        Matcher matcher = SPAN.matcher(content);
        while (matcher.find()) {
            String request = matcher.group(1).trim();
            if (!request.isEmpty()) {
                requests.add(request);
            }
        }
        return requests;
    }
}

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

package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Normalized provider response. {@code choices} is the number of completion
 * choices the provider returned; zero means there is no usable answer.
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private String reasoningContent;
    private String model;
    private String finishReason;
    private LlmUsage usage;

    @Builder.Default
    private int choices = 1;

    public boolean hasChoices() {
        return choices > 0;
    }

    public boolean hasReasoning() {
        return reasoningContent != null && !reasoningContent.isBlank();
    }
}

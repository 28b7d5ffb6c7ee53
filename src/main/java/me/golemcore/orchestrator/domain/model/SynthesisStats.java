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

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call record of a tool-call synthesis. Used only for logging; discarded
 * after each synthesis.
 */
@Data
public class SynthesisStats {

    private int attempts;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private int validCalls;
    private int invalidCalls;
    private int totalCalls;
    private final List<String> errors = new ArrayList<>();

    public void recordError(String error) {
        errors.add(error);
    }

    public String lastError() {
        return errors.isEmpty() ? null : errors.get(errors.size() - 1);
    }
}

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


package me.golemcore.orchestrator.adapter.inbound.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.service.Agent;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Answers a single query given on the command line:
 *
 * <pre>
 * java -jar golemcore-orchestrator.jar --query="What's the weather in Paris?"
 * </pre>
 *
 * The answer goes to stdout and the agent is shut down afterwards. Without
 * {@code --query} nothing happens.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryCommandLineRunner implements ApplicationRunner {

    static final String QUERY_OPTION = "query";

    private final Agent agent;
    private PrintStream out = System.out;

    @Override
    public void run(ApplicationArguments args) {
        List<String> values = args.getOptionValues(QUERY_OPTION);
        if (values == null || values.isEmpty()) {
            log.debug("No --{} argument, nothing to do", QUERY_OPTION);
            return;
        }
        String query = String.join(" ", values).trim();
        if (query.isEmpty()) {
            log.warn("Empty --{} argument", QUERY_OPTION);
            return;
        }

        try {
            out.println(agent.processQuery(query));
        } finally {
            agent.shutdown();
        }
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}

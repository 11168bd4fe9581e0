package me.golemcore.argon;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the Argon core: modular prompt assembly, per-service LLM
 * configuration, session branching and variant context lifecycle.
 *
 * <ul>
 * <li><b>Prompt assembly</b> - presets of modules placed by position, depth and
 * order, selected per service</li>
 * <li><b>LLM configuration</b> - generation, analysis, maintenance and
 * embedding resolved independently per user</li>
 * <li><b>Branching</b> - prefix copy of a session plus derived state restored
 * from an analysis snapshot</li>
 * <li><b>Variants</b> - retrieval memory and analysis owned by a regenerated
 * response</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ArgonApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArgonApplication.class, args);
    }
}

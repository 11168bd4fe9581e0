package me.golemcore.argon.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{var}}} placeholders in module content, e.g.
 * {@code {{char}}}, {@code {{user}}} or {@code {{rag_context}}}. Placeholders
 * without a value stay in the text untouched so a later pass can fill them.
 */
@Component
public class PromptTemplateEngine {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");

    public String render(String content, Map<String, String> variables) {
        if (content == null || variables == null || variables.isEmpty() || content.indexOf("{{") < 0) {
            return content;
        }
        Matcher matcher = PLACEHOLDER.matcher(content);
        return matcher.replaceAll(match -> {
            String value = variables.get(match.group(1));
            return Matcher.quoteReplacement(value != null ? value : match.group());
        });
    }
}

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


package org.fireflyframework.scheduler.unit.execution;

import org.fireflyframework.scheduler.core.execution.ArgumentRenderer;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ArgumentRendererTest {

    private final Map<String, String> bindings = Map.of("msg", "hello", "who", "world");

    @Test
    void render_substitutesBinding() {
        assertThat(ArgumentRenderer.render("{{.msg}}", bindings)).isEqualTo("hello");
        assertThat(ArgumentRenderer.render("say {{.msg}} to {{.who}}!", bindings)).isEqualTo("say hello to world!");
    }

    @Test
    void render_toleratesWhitespaceInsidePlaceholder() {
        assertThat(ArgumentRenderer.render("{{ .msg }}", bindings)).isEqualTo("hello");
    }

    @Test
    void render_unknownBinding_returnsArgumentUnchanged() {
        assertThat(ArgumentRenderer.render("{{.missing}}", bindings)).isEqualTo("{{.missing}}");
        assertThat(ArgumentRenderer.render("{{.msg}} {{.missing}}", bindings)).isEqualTo("{{.msg}} {{.missing}}");
    }

    @Test
    void render_placeholderWithoutDot_returnsArgumentUnchanged() {
        assertThat(ArgumentRenderer.render("{{msg}}", bindings)).isEqualTo("{{msg}}");
    }

    @Test
    void render_unterminatedPlaceholder_staysLiteral() {
        assertThat(ArgumentRenderer.render("{{.msg", bindings)).isEqualTo("{{.msg");
    }

    @Test
    void render_strayDelimiterNextToValidPlaceholder_staysLiteral() {
        assertThat(ArgumentRenderer.render("{{.msg}} {{", bindings)).isEqualTo("{{.msg}} {{");
        assertThat(ArgumentRenderer.render("{{.msg}} }}", bindings)).isEqualTo("{{.msg}} }}");
        assertThat(ArgumentRenderer.render("{{ {{.msg}}", bindings)).isEqualTo("{{ {{.msg}}");
    }

    @Test
    void render_valueContainingTemplateText_isInsertedVerbatim() {
        assertThat(ArgumentRenderer.render("{{.msg}}", Map.of("msg", "{{.other}}"))).isEqualTo("{{.other}}");
        assertThat(ArgumentRenderer.render("{{.msg}}", Map.of("msg", "{{.x}}", "x", "secret"))).isEqualTo("{{.x}}");
        assertThat(ArgumentRenderer.render("{{.a}}-{{.b}}", Map.of("a", "{{.b}}", "b", "two"))).isEqualTo("{{.b}}-two");
    }

    @Test
    void render_plainArgument_untouched() {
        assertThat(ArgumentRenderer.render("--verbose", bindings)).isEqualTo("--verbose");
        assertThat(ArgumentRenderer.render("", bindings)).isEmpty();
    }
}

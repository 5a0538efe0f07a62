/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.runbook.plugin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryPluginHostTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void invokesRegisteredAction() throws Exception {
        InMemoryPluginHost host = new InMemoryPluginHost()
                .register("git", "branch", args -> "on " + args.path("name").asText());
        ObjectNode args = mapper.createObjectNode().put("name", "main");

        assertThat(host.hasAction("git", "branch")).isTrue();
        assertThat(host.invoke("git", "branch", args)).isEqualTo("on main");
    }

    @Test
    void nullResultBecomesEmptyText() throws Exception {
        InMemoryPluginHost host = new InMemoryPluginHost().register("p", "a", args -> null);

        assertThat(host.invoke("p", "a", mapper.createObjectNode())).isEmpty();
    }

    @Test
    void unknownPluginAndActionFail() {
        InMemoryPluginHost host = new InMemoryPluginHost().register("p", "a", args -> "ok");

        assertThatThrownBy(() -> host.invoke("q", "a", mapper.createObjectNode()))
                .isInstanceOf(PluginException.class)
                .hasMessageContaining("Unknown plugin");
        assertThatThrownBy(() -> host.invoke("p", "b", mapper.createObjectNode()))
                .isInstanceOf(PluginException.class)
                .hasMessageContaining("Unknown action");
    }

    @Test
    void handlerFailureIsWrapped() {
        InMemoryPluginHost host = new InMemoryPluginHost().register("p", "a", args -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> host.invoke("p", "a", mapper.createObjectNode()))
                .isInstanceOf(PluginException.class)
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> {
                    PluginException pe = (PluginException) e;
                    assertThat(pe.getPluginName()).isEqualTo("p");
                    assertThat(pe.getActionName()).isEqualTo("a");
                });
    }
}

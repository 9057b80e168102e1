package com.tableflow.tableflow_automation.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer(new ObjectMapper());

    @Test
    void rendersDottedReferences() {
        Map<String, Object> payload = Map.of("rows", List.of(Map.of("id", 7, "title", "Ship it")));

        assertThat(renderer.render("Task {{ rows.0.title }} (#{{rows.0.id}})", payload)).isEqualTo("Task Ship it (#7)");
    }

    @Test
    void missingReferencesRenderEmpty() {
        assertThat(renderer.render("[{{ nope }}]", Map.of())).isEqualTo("[]");
        assertThat(renderer.render(null, Map.of())).isEmpty();
    }

    @Test
    void collectionsRenderAsJson() {
        assertThat(renderer.render("{{ tags }}", Map.of("tags", List.of("a", "b")))).isEqualTo("[\"a\",\"b\"]");
    }

    @Test
    void replacementTextIsNotInterpreted() {
        assertThat(renderer.render("{{ price }}", Map.of("price", "$5 \\ each"))).isEqualTo("$5 \\ each");
    }

    @Test
    void renderMapOnlyTouchesStrings() {
        Map<String, Object> rendered = renderer.renderMap(Map.of("status", "{{ s }}", "count", 3), Map.of("s", "Done"));

        assertThat(rendered).containsEntry("status", "Done").containsEntry("count", 3);
    }
}

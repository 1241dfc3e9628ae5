package dev.autoresume.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResumeContentTest {

    @Test
    @DisplayName("Should not share skill lists with the caller")
    void shouldCopySkillLists() {
        List<String> languages = new ArrayList<>(List.of("Go"));
        Map<String, List<String>> skills = new LinkedHashMap<>();
        skills.put("Languages", languages);
        skills.put("Tools", null);

        ResumeContent content = new ResumeContent(skills, null, null, null);
        languages.add("Rust");

        assertThat(content.skills()).hasSize(2)
                .containsEntry("Languages", List.of("Go"))
                .containsEntry("Tools", List.of());
        assertThatThrownBy(() -> content.skills().get("Languages").add("Java"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> content.skills().put("Data", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should default missing sections to empty lists")
    void shouldDefaultMissingSections() {
        ResumeContent content = new ResumeContent(null, null, null, null);

        assertThat(content.skills()).isEmpty();
        assertThat(content.projects()).isEmpty();
        assertThat(content.experience()).isEmpty();
        assertThat(content.education()).isEmpty();
    }
}

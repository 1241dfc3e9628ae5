package dev.autoresume.model;

import lombok.Builder;

import java.util.List;

/**
 * Normalized job posting, extracted once per run from the raw posting text.
 */
@Builder
public record JobDescription(
        String title,
        String company,
        String summary,
        List<String> requiredSkills,
        List<String> niceToHave,
        String rawText) {

    public JobDescription {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        niceToHave = niceToHave == null ? List.of() : List.copyOf(niceToHave);
        summary = summary == null ? "" : summary;
    }

    public String companyOrDefault() {
        return company == null || company.isBlank() ? "the target company" : company;
    }
}

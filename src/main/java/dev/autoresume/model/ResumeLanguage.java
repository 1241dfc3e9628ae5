package dev.autoresume.model;

import java.util.Locale;
import java.util.Map;

/**
 * Output language of the resume. Controls the section headers and the
 * language the generator writes in.
 */
public enum ResumeLanguage {
    ENGLISH("English", Map.of(
            "EDUCATION_HEADER", "Education",
            "SKILLS_HEADER", "Technical Skills",
            "EXPERIENCE_HEADER", "Professional Experience",
            "PROJECTS_HEADER", "Key Projects")),
    PORTUGUESE("Portuguese", Map.of(
            "EDUCATION_HEADER", "Educação",
            "SKILLS_HEADER", "Habilidades Técnicas",
            "EXPERIENCE_HEADER", "Experiência Profissional",
            "PROJECTS_HEADER", "Projetos e Performance"));

    private final String displayName;
    private final Map<String, String> headers;

    ResumeLanguage(String displayName, Map<String, String> headers) {
        this.displayName = displayName;
        this.headers = headers;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Parses a language code. Unknown codes fall back to Portuguese.
     */
    public static ResumeLanguage fromCode(String code) {
        if (code == null) {
            return PORTUGUESE;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "en", "en-us", "english" -> ENGLISH;
            default -> PORTUGUESE;
        };
    }
}

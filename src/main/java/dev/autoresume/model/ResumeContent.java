package dev.autoresume.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generated resume sections. Projects only ever reference entries of the
 * selection they were generated from.
 */
public record ResumeContent(
        Map<String, List<String>> skills,
        List<ProjectEntry> projects,
        List<ExperienceEntry> experience,
        List<EducationEntry> education) {

    public ResumeContent {
        skills = skills == null ? Map.of() : copyOf(skills);
        projects = projects == null ? List.of() : List.copyOf(projects);
        experience = experience == null ? List.of() : List.copyOf(experience);
        education = education == null ? List.of() : List.copyOf(education);
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> skills) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        skills.forEach((category, names) -> copy.put(category, names == null ? List.of() : List.copyOf(names)));
        return Collections.unmodifiableMap(copy);
    }

    public record ProjectEntry(ProjectReference project, String title, List<String> highlights) {
        public ProjectEntry {
            highlights = highlights == null ? List.of() : List.copyOf(highlights);
        }
    }

    public record ExperienceEntry(String company, String position, String location, String date,
                                  List<String> accomplishments) {
        public ExperienceEntry {
            accomplishments = accomplishments == null ? List.of() : List.copyOf(accomplishments);
        }
    }

    public record EducationEntry(String institution, String degree, String location, String date,
                                 List<String> accomplishments) {
        public EducationEntry {
            accomplishments = accomplishments == null ? List.of() : List.copyOf(accomplishments);
        }
    }
}

package dev.autoresume.ai.schema;

import com.fasterxml.jackson.databind.JsonNode;
import dev.autoresume.model.ProjectReference;
import dev.autoresume.model.ResumeContent;
import dev.autoresume.model.ResumeContent.EducationEntry;
import dev.autoresume.model.ResumeContent.ExperienceEntry;
import dev.autoresume.model.ResumeContent.ProjectEntry;
import dev.autoresume.model.SelectionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generated resume sections. Projects are resolved against the approved
 * selection; entries that match nothing in it are dropped.
 */
@Slf4j
public class ResumeContentSchema implements OutputSchema<ResumeContent> {

    private static final JsonNode SCHEMA = SchemaSupport.parse("""
            {
              "type": "object",
              "properties": {
                "skills_by_category": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "category": { "type": "string", "description": "Technical skill category (e.g., Back-end, Front-end)" },
                      "items": { "type": "array", "items": { "type": "string" } }
                    },
                    "required": ["category", "items"]
                  }
                },
                "projects": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "title": { "type": "string", "description": "Project name in format: 'Project Name (Technology/Language)'" },
                      "link": { "type": "string", "description": "Repository URL exactly as given" },
                      "items": {
                        "type": "array",
                        "items": { "type": "string" },
                        "description": "Brief lines (max 15 words each) describing purpose and key features"
                      }
                    },
                    "required": ["title", "link", "items"]
                  }
                },
                "education": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "institution": { "type": "string" },
                      "degree": { "type": "string" },
                      "location": { "type": "string" },
                      "date": { "type": "string" },
                      "accomplishments": { "type": "array", "items": { "type": "string" } }
                    },
                    "required": ["institution", "degree", "location", "date", "accomplishments"]
                  }
                },
                "experience": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "company": { "type": "string" },
                      "position": { "type": "string" },
                      "location": { "type": "string" },
                      "date": { "type": "string" },
                      "accomplishments": { "type": "array", "items": { "type": "string" } }
                    },
                    "required": ["company", "position", "location", "date", "accomplishments"]
                  }
                }
              },
              "required": ["skills_by_category", "projects", "education", "experience"]
            }
            """);

    private final SelectionResult selection;

    public ResumeContentSchema(SelectionResult selection) {
        this.selection = selection;
    }

    @Override
    public String name() {
        return "resume content";
    }

    @Override
    public JsonNode jsonSchema() {
        return SCHEMA;
    }

    @Override
    public ResumeContent validate(JsonNode answer) {
        SchemaSupport.requireObject(answer, "answer");
        return new ResumeContent(
                skills(SchemaSupport.requireArray(answer, "skills_by_category", "resume content")),
                projects(SchemaSupport.requireArray(answer, "projects", "resume content")),
                experience(SchemaSupport.requireArray(answer, "experience", "resume content")),
                education(SchemaSupport.requireArray(answer, "education", "resume content")));
    }

    private Map<String, List<String>> skills(JsonNode categories) {
        Map<String, List<String>> skills = new LinkedHashMap<>();
        int position = 0;
        for (JsonNode node : categories) {
            String where = "skill category " + (++position);
            SchemaSupport.requireObject(node, where);
            String category = SchemaSupport.requireText(node, "category", where);
            List<String> items = SchemaSupport.stringList(node, "items", where);
            if (!items.isEmpty()) {
                skills.computeIfAbsent(category, c -> new ArrayList<>()).addAll(items);
            }
        }
        return skills;
    }

    private List<ProjectEntry> projects(JsonNode nodes) {
        List<ProjectEntry> projects = new ArrayList<>();
        Set<ProjectReference> used = new HashSet<>();
        int position = 0;
        for (JsonNode node : nodes) {
            String where = "project " + (++position);
            SchemaSupport.requireObject(node, where);
            String title = SchemaSupport.requireText(node, "title", where);
            String link = SchemaSupport.text(node, "link", where);
            List<String> items = SchemaSupport.stringList(node, "items", where);

            Optional<ProjectReference> project = resolve(link, title);
            if (project.isEmpty()) {
                log.warn("Dropping generated project '{}' ({}): not part of the selection", title, link);
                continue;
            }
            if (!used.add(project.get())) {
                log.warn("Dropping duplicate generated entry for project '{}'", project.get().name());
                continue;
            }
            projects.add(new ProjectEntry(project.get(), title, items));
        }
        return projects;
    }

    private List<ExperienceEntry> experience(JsonNode nodes) {
        List<ExperienceEntry> entries = new ArrayList<>();
        int position = 0;
        for (JsonNode node : nodes) {
            String where = "experience " + (++position);
            SchemaSupport.requireObject(node, where);
            entries.add(new ExperienceEntry(
                    SchemaSupport.requireText(node, "company", where),
                    SchemaSupport.text(node, "position", where),
                    SchemaSupport.text(node, "location", where),
                    SchemaSupport.text(node, "date", where),
                    SchemaSupport.optionalStringList(node, "accomplishments", where)));
        }
        return entries;
    }

    private List<EducationEntry> education(JsonNode nodes) {
        List<EducationEntry> entries = new ArrayList<>();
        int position = 0;
        for (JsonNode node : nodes) {
            String where = "education " + (++position);
            SchemaSupport.requireObject(node, where);
            entries.add(new EducationEntry(
                    SchemaSupport.requireText(node, "institution", where),
                    SchemaSupport.text(node, "degree", where),
                    SchemaSupport.text(node, "location", where),
                    SchemaSupport.text(node, "date", where),
                    SchemaSupport.optionalStringList(node, "accomplishments", where)));
        }
        return entries;
    }

    /**
     * Match by URL first, then by the last path segment of the link, then by
     * the title without its "(Technology)" suffix.
     */
    Optional<ProjectReference> resolve(String link, String title) {
        List<ProjectReference> projects = selection.allProjects();
        String normalizedLink = normalizeUrl(link);
        if (!normalizedLink.isEmpty()) {
            for (ProjectReference project : projects) {
                if (normalizedLink.equals(normalizeUrl(project.url()))) {
                    return Optional.of(project);
                }
            }
            String lastSegment = normalizedLink.substring(normalizedLink.lastIndexOf('/') + 1);
            Optional<ProjectReference> bySegment = byName(projects, lastSegment);
            if (bySegment.isPresent()) {
                return bySegment;
            }
        }
        int suffix = title.lastIndexOf('(');
        return byName(projects, suffix > 0 ? title.substring(0, suffix) : title);
    }

    private static Optional<ProjectReference> byName(List<ProjectReference> projects, String candidate) {
        String key = normalizeName(candidate);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return projects.stream()
                .filter(project -> key.equals(normalizeName(project.name())))
                .findFirst();
    }

    static String normalizeUrl(String url) {
        if (url == null) {
            return "";
        }
        String normalized = url.trim().toLowerCase(Locale.ROOT)
                .replaceFirst("^https?://", "")
                .replaceFirst("^www\\.", "");
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith(".git")) {
            normalized = normalized.substring(0, normalized.length() - 4);
        }
        return normalized;
    }

    private static String normalizeName(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }
}

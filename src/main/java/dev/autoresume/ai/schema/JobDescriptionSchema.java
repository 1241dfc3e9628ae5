package dev.autoresume.ai.schema;

import com.fasterxml.jackson.databind.JsonNode;
import dev.autoresume.model.JobDescription;

/**
 * Normalized job posting. The raw text is carried through unchanged.
 */
public class JobDescriptionSchema implements OutputSchema<JobDescription> {

    private static final JsonNode SCHEMA = SchemaSupport.parse("""
            {
              "type": "object",
              "properties": {
                "title": { "type": "string", "description": "Job title/position name" },
                "company": { "type": "string", "description": "Company name, empty if not found" },
                "summary": { "type": "string", "description": "Clean job description with key responsibilities" },
                "required_skills": {
                  "type": "array",
                  "items": { "type": "string" },
                  "description": "Required technologies and qualifications, most important first"
                },
                "nice_to_have": {
                  "type": "array",
                  "items": { "type": "string" },
                  "description": "Optional or preferred skills"
                }
              },
              "required": ["title", "summary", "required_skills", "nice_to_have"]
            }
            """);

    private final String rawText;

    public JobDescriptionSchema(String rawText) {
        this.rawText = rawText;
    }

    @Override
    public String name() {
        return "job description";
    }

    @Override
    public JsonNode jsonSchema() {
        return SCHEMA;
    }

    @Override
    public JobDescription validate(JsonNode answer) {
        SchemaSupport.requireObject(answer, "answer");
        String where = "job description";
        String company = SchemaSupport.text(answer, "company", where);
        return JobDescription.builder()
                .title(SchemaSupport.requireText(answer, "title", where))
                .company(company.isBlank() ? null : company)
                .summary(SchemaSupport.text(answer, "summary", where))
                .requiredSkills(SchemaSupport.stringList(answer, "required_skills", where))
                .niceToHave(SchemaSupport.optionalStringList(answer, "nice_to_have", where))
                .rawText(rawText)
                .build();
    }
}

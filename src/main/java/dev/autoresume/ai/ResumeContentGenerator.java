package dev.autoresume.ai;

import dev.autoresume.ai.schema.ResumeContentSchema;
import dev.autoresume.config.ResumeProfile;
import dev.autoresume.model.JobDescription;
import dev.autoresume.model.ManualEntry;
import dev.autoresume.model.Repository;
import dev.autoresume.model.ResumeContent;
import dev.autoresume.model.ResumeLanguage;
import dev.autoresume.model.SelectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the tailored resume sections from the approved selection only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeContentGenerator {

    private static final String SYSTEM_INSTRUCTIONS = """
            You are an expert resume writer for software engineers. You write concise, \
            ATS-friendly content: plain text, strong action verbs, concrete technologies and \
            measurable outcomes. Do not use markdown. Never invent employers, degrees or \
            projects; only use the facts you are given.""";

    private static final String NO_CONTEXT = "The candidate has not provided specific %s details.";

    private final StructuredInvoker invoker;

    public Mono<ResumeContent> generate(JobDescription job, SelectionResult selection, ResumeProfile profile,
                                        ResumeLanguage language) {
        log.info("Generating {} resume content from {} selected projects", language.getDisplayName(), selection.size());
        return invoker.invoke(SYSTEM_INSTRUCTIONS, buildPrompt(job, selection, profile, language),
                        new ResumeContentSchema(selection))
                .doOnNext(content -> log.info("Generated {} skill categories, {} projects, {} experience and {} education entries",
                        content.skills().size(), content.projects().size(),
                        content.experience().size(), content.education().size()));
    }

    String buildPrompt(JobDescription job, SelectionResult selection, ResumeProfile profile, ResumeLanguage language) {
        List<String> projects = new ArrayList<>();
        for (Repository repo : selection.chosen()) {
            projects.add(describe(repo));
        }
        for (ManualEntry entry : selection.manuallyAdded()) {
            projects.add(String.format("- %s%s%s", entry.name(),
                    entry.url().isBlank() ? "" : " - " + entry.url(),
                    entry.description().isBlank() ? "" : "\n  Description: " + entry.description()));
        }

        return """
                Write the resume of %s for the position of %s at %s. Write everything in %s.

                JOB DESCRIPTION:
                %s

                Required skills: %s
                Nice to have: %s

                PROJECTS (use only these, in this order, with their link exactly as given):
                %s

                EDUCATION CONTEXT:
                %s

                EXPERIENCE CONTEXT:
                %s

                SKILLS CONTEXT:
                %s

                Group skills by category, most relevant to the job first. Leave education or \
                experience empty when no context is given for them.
                """.formatted(
                profile.getFullName(),
                job.title(),
                job.companyOrDefault(),
                language.getDisplayName(),
                job.summary().isBlank() ? job.rawText() : job.summary(),
                String.join(", ", job.requiredSkills()),
                String.join(", ", job.niceToHave()),
                String.join("\n", projects),
                orNoContext(profile.getEducationContext(), "education"),
                orNoContext(profile.getExperienceContext(), "experience"),
                orNoContext(profile.getSkillsContext(), "skill"));
    }

    private static String describe(Repository repo) {
        StringBuilder line = new StringBuilder()
                .append("- ").append(repo.name())
                .append(" [").append(repo.languageSummary()).append("]")
                .append(" (stars: ").append(repo.stars()).append(", commits: ").append(repo.commitCount()).append(")")
                .append(" - ").append(repo.url());
        if (!repo.description().isBlank()) {
            line.append("\n  Description: ").append(repo.description());
        }
        if (repo.hasReadme()) {
            line.append("\n  README:\n```\n").append(repo.readmeExcerpt()).append("\n```");
        }
        return line.toString();
    }

    private static String orNoContext(String context, String what) {
        return context == null || context.isBlank() ? NO_CONTEXT.formatted(what) : context;
    }
}

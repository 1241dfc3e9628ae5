package dev.autoresume.ai;

import dev.autoresume.ai.schema.JobDescriptionSchema;
import dev.autoresume.model.JobDescription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Turns raw posting text into a normalized {@link JobDescription}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDescriptionExtractor {

    private static final int MAX_INPUT_LENGTH = 20_000;

    private static final String SYSTEM_INSTRUCTIONS = """
            You are a technical recruiter. You read job postings, which may be noisy text \
            scraped from a web page, and extract the facts a candidate needs to tailor a resume. \
            Never invent requirements that are not in the posting.""";

    private final StructuredInvoker invoker;

    public Mono<JobDescription> extract(String rawText) {
        log.info("Extracting job description ({} characters)", rawText.length());
        String content = rawText.length() > MAX_INPUT_LENGTH ? rawText.substring(0, MAX_INPUT_LENGTH) : rawText;
        String prompt = """
                Extract and clean the job description from the content below. Ignore navigation, \
                cookie banners and other page boilerplate.

                - title: the position name
                - company: the hiring company, empty if not stated
                - summary: a clean description of the role and its key responsibilities
                - required_skills: required technologies and qualifications, most important first
                - nice_to_have: preferred or optional skills

                Content to process:
                %s
                """.formatted(content);

        return invoker.invoke(SYSTEM_INSTRUCTIONS, prompt, new JobDescriptionSchema(rawText))
                .doOnNext(job -> log.info("Target job: {} at {} ({} required skills)",
                        job.title(), job.companyOrDefault(), job.requiredSkills().size()));
    }
}

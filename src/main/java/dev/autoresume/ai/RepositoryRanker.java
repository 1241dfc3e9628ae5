package dev.autoresume.ai;

import dev.autoresume.ai.schema.RankingSchema;
import dev.autoresume.model.JobDescription;
import dev.autoresume.model.RankedRepository;
import dev.autoresume.model.Repository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Orders every collected repository by relevance to the target job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryRanker {

    private static final String SYSTEM_INSTRUCTIONS = """
            You are a senior engineering hiring manager reviewing a candidate's public \
            repositories. You rank projects by how strongly they support an application to a \
            specific job, and you explain each decision in one or two sentences.""";

    private final StructuredInvoker invoker;

    public Mono<List<RankedRepository>> rank(List<Repository> repositories, JobDescription job) {
        if (repositories.isEmpty()) {
            log.info("No repositories to rank");
            return Mono.just(List.of());
        }
        log.info("Ranking {} repositories for {} at {}", repositories.size(), job.title(), job.companyOrDefault());

        return invoker.invoke(SYSTEM_INSTRUCTIONS, buildPrompt(repositories, job), new RankingSchema(repositories))
                .doOnNext(ranked -> log.info("Ranked {} repositories, top pick: {}", ranked.size(),
                        ranked.get(0).repository().name()));
    }

    String buildPrompt(List<Repository> repositories, JobDescription job) {
        String repoList = repositories.stream()
                .map(RepositoryRanker::describe)
                .collect(Collectors.joining("\n"));

        return """
                Rank ALL %d repositories below for a resume targeting a %s role at %s.

                CRITERIA:
                - Relevance to the required skills: %s
                - Relevance to the nice-to-have skills: %s
                - Recent activity (prefer repositories updated in the last 2 years)
                - Maintenance status (avoid abandoned or archived projects)
                - Project maturity (complete, not WIP) and community engagement (stars, forks)

                Role summary:
                %s

                REPOSITORIES:
                %s

                Every repository must appear exactly once, using its name exactly as listed. \
                Rank 1 is the most relevant. Give a non-empty rationale for each entry.
                """.formatted(
                repositories.size(),
                job.title(),
                job.companyOrDefault(),
                job.requiredSkills().isEmpty() ? "not specified" : String.join(", ", job.requiredSkills()),
                job.niceToHave().isEmpty() ? "not specified" : String.join(", ", job.niceToHave()),
                job.summary(),
                repoList);
    }

    private static String describe(Repository repo) {
        return String.format("- %s [%s] (created: %s, last updated: %s, stars: %d, forks: %d, commits: %d, importance: %d%s%s)%s",
                repo.name(),
                repo.languageSummary(),
                repo.createdAt() == null ? "unknown" : repo.createdAt(),
                repo.lastActivity() == null ? "unknown" : repo.lastActivity(),
                repo.stars(),
                repo.forks(),
                repo.commitCount(),
                repo.importanceScore(),
                repo.hasReadme() ? ", has README" : "",
                repo.archived() ? ", archived" : "",
                repo.description().isBlank() ? "" : " - " + repo.description());
    }
}

package dev.autoresume.service;

import dev.autoresume.ai.JobDescriptionExtractor;
import dev.autoresume.ai.RepositoryRanker;
import dev.autoresume.ai.ResumeContentGenerator;
import dev.autoresume.config.GithubConfig;
import dev.autoresume.config.ResumeConfig;
import dev.autoresume.config.ResumeProfile;
import dev.autoresume.exception.CompilationException;
import dev.autoresume.exception.PipelineException;
import dev.autoresume.latex.DocumentAssembler;
import dev.autoresume.latex.DocumentCompiler;
import dev.autoresume.latex.SourceEditor;
import dev.autoresume.metrics.PipelineMetrics;
import dev.autoresume.model.AssembledDocument;
import dev.autoresume.model.JobDescription;
import dev.autoresume.model.PipelineOutcome;
import dev.autoresume.model.PipelineStage;
import dev.autoresume.model.Repository;
import dev.autoresume.model.ResumeLanguage;
import dev.autoresume.model.SelectionResult;
import dev.autoresume.selection.SelectionController;
import dev.autoresume.source.JobSourceResolver;
import dev.autoresume.source.github.GithubCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Main orchestration service for the resume pipeline.
 * Collection and job resolution run concurrently; every later stage waits
 * for the one before it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumePipelineService {

    private static final String SEPARATOR = "========================================";

    private final GithubCollector githubCollector;
    private final JobSourceResolver jobSourceResolver;
    private final JobDescriptionExtractor extractor;
    private final RepositoryRanker ranker;
    private final SelectionController selectionController;
    private final ResumeContentGenerator generator;
    private final DocumentAssembler assembler;
    private final SourceEditor sourceEditor;
    private final DocumentCompiler compiler;
    private final ResumeProfile profile;
    private final GithubConfig githubConfig;
    private final ResumeConfig resumeConfig;
    private final PipelineMetrics metrics;

    /**
     * Execute the full resume pipeline.
     *
     * @return how the run ended; failures surface as {@link PipelineException}
     */
    public Mono<PipelineOutcome> runPipeline() {
        String compileOnly = resumeConfig.getCompileOnly();
        if (compileOnly != null && !compileOnly.isBlank()) {
            return recompile(Path.of(compileOnly))
                    .doFinally(signal -> log.info("Run stats: {}", metrics.summary()));
        }

        ResumeLanguage language = ResumeLanguage.fromCode(resumeConfig.getLanguage());
        log.info(SEPARATOR);
        log.info("Resume Pipeline Starting");
        log.info(SEPARATOR);
        log.info("GitHub user: {}", githubConfig.getUsername());
        log.info("Language: {}", language.getDisplayName());
        log.info("Output: {}", resumeConfig.getOutput());

        Mono<List<Repository>> repositories = stage(PipelineStage.COLLECTION,
                () -> githubCollector.collect(githubConfig.getUsername(), githubConfig.getToken()));
        Mono<String> jobText = stage(PipelineStage.JOB_RESOLUTION,
                () -> jobSourceResolver.resolve(resumeConfig.getJobUrl(), resumeConfig.getJobFile()));

        return Mono.zip(repositories, jobText)
                .flatMap(collected -> stage(PipelineStage.EXTRACTION, () -> extractor.extract(collected.getT2()))
                        .flatMap(job -> stage(PipelineStage.RANKING, () -> ranker.rank(collected.getT1(), job))
                                .flatMap(ranked -> stage(PipelineStage.SELECTION,
                                        () -> Mono.fromCallable(() -> selectionController.select(ranked))
                                                .subscribeOn(Schedulers.boundedElastic())))
                                .flatMap(outcome -> outcome.selection()
                                        .map(selection -> render(job, selection, language))
                                        .orElseGet(() -> {
                                            log.info("Selection aborted, no resume generated");
                                            return Mono.just(PipelineOutcome.aborted());
                                        }))))
                .doFinally(signal -> log.info("Run stats: {}", metrics.summary()));
    }

    private Mono<PipelineOutcome> render(JobDescription job, SelectionResult selection, ResumeLanguage language) {
        return stage(PipelineStage.GENERATION, () -> generator.generate(job, selection, profile, language))
                .flatMap(content -> stage(PipelineStage.ASSEMBLY,
                        () -> Mono.fromCallable(() -> assembler.assemble(profile, job, content, language))))
                .flatMap(document -> stage(PipelineStage.EDITING,
                        () -> Mono.fromCallable(() -> sourceEditor.review(document))
                                .subscribeOn(Schedulers.boundedElastic())))
                .flatMap(document -> stage(PipelineStage.COMPILATION,
                        () -> Mono.fromCallable(() -> compileAndWrite(document))
                                .subscribeOn(Schedulers.boundedElastic())));
    }

    /**
     * Compile a LaTeX file written by an earlier run, typically after editing it by hand.
     */
    Mono<PipelineOutcome> recompile(Path source) {
        log.info(SEPARATOR);
        log.info("Recompiling {}", source.toAbsolutePath());
        log.info("Output: {}", resumeConfig.getOutput());
        log.info(SEPARATOR);
        return stage(PipelineStage.COMPILATION, () -> Mono.fromCallable(() -> {
                    if (!Files.isRegularFile(source)) {
                        throw new CompilationException("LaTeX source not found: " + source.toAbsolutePath(), "");
                    }
                    return compileAndWrite(new AssembledDocument(Files.readString(source, StandardCharsets.UTF_8)));
                })
                .subscribeOn(Schedulers.boundedElastic()));
    }

    PipelineOutcome compileAndWrite(AssembledDocument document) throws IOException {
        Path output = Path.of(resumeConfig.getOutput()).toAbsolutePath();
        Path source = sourcePathFor(output);
        if (resumeConfig.isKeepSource()) {
            write(source, document.source().getBytes(StandardCharsets.UTF_8));
            log.info("LaTeX source written to {}", source);
        }

        byte[] pdf;
        try {
            pdf = compiler.compile(document);
        } catch (CompilationException e) {
            write(source, document.source().getBytes(StandardCharsets.UTF_8));
            throw e.withPreservedSource(source);
        }

        write(output, pdf);
        log.info("Resume written to {} ({} bytes)", output, pdf.length);
        return PipelineOutcome.completed(output, resumeConfig.isKeepSource() ? source : null);
    }

    /**
     * Run one stage: time it and tag any failure with the stage.
     */
    private <T> Mono<T> stage(PipelineStage stage, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
                    long start = System.currentTimeMillis();
                    log.info(">> {}", stage.getLabel());
                    return work.get()
                            .doOnSuccess(result -> {
                                long elapsed = System.currentTimeMillis() - start;
                                metrics.recordStageLatency(stage, elapsed);
                                log.debug("{} took {} ms", stage.getLabel(), elapsed);
                            });
                })
                .onErrorMap(e -> !(e instanceof PipelineException), e -> new PipelineException(stage, e));
    }

    static Path sourcePathFor(Path output) {
        String fileName = output.getFileName().toString();
        String base = fileName.toLowerCase().endsWith(".pdf") ? fileName.substring(0, fileName.length() - 4) : fileName;
        return output.resolveSibling(base + ".tex");
    }

    private static void write(Path path, byte[] content) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, content);
    }
}

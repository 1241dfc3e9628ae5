package dev.autoresume.service;

import dev.autoresume.ai.JobDescriptionExtractor;
import dev.autoresume.ai.RepositoryRanker;
import dev.autoresume.ai.ResumeContentGenerator;
import dev.autoresume.config.GithubConfig;
import dev.autoresume.config.ResumeConfig;
import dev.autoresume.config.ResumeProfile;
import dev.autoresume.exception.CollectionException;
import dev.autoresume.exception.CompilationException;
import dev.autoresume.exception.GenerationException;
import dev.autoresume.exception.PipelineException;
import dev.autoresume.latex.DocumentAssembler;
import dev.autoresume.latex.DocumentCompiler;
import dev.autoresume.latex.SourceEditor;
import dev.autoresume.metrics.PipelineMetrics;
import dev.autoresume.model.AssembledDocument;
import dev.autoresume.model.JobDescription;
import dev.autoresume.model.PipelineOutcome;
import dev.autoresume.model.PipelineStage;
import dev.autoresume.model.RankedRepository;
import dev.autoresume.model.Repository;
import dev.autoresume.model.ResumeContent;
import dev.autoresume.model.ResumeLanguage;
import dev.autoresume.model.SelectionOutcome;
import dev.autoresume.model.SelectionResult;
import dev.autoresume.selection.SelectionController;
import dev.autoresume.source.JobSourceResolver;
import dev.autoresume.source.github.GithubCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumePipelineServiceTest {

    private static final Repository REPO = Repository.builder()
            .name("api").url("https://github.com/octocat/api").build();
    private static final JobDescription JOB = JobDescription.builder()
            .title("Backend Engineer").requiredSkills(List.of("Go")).rawText("posting").build();
    private static final List<RankedRepository> RANKED = List.of(new RankedRepository(REPO, 1, "Go API"));
    private static final SelectionResult SELECTION = new SelectionResult(List.of(REPO), List.of());
    private static final ResumeContent CONTENT = new ResumeContent(Map.of("Languages", List.of("Go")),
            List.of(), List.of(), List.of());
    private static final AssembledDocument DOCUMENT = new AssembledDocument("\\documentclass{article}");

    @Mock
    private GithubCollector githubCollector;

    @Mock
    private JobSourceResolver jobSourceResolver;

    @Mock
    private JobDescriptionExtractor extractor;

    @Mock
    private RepositoryRanker ranker;

    @Mock
    private SelectionController selectionController;

    @Mock
    private ResumeContentGenerator generator;

    @Mock
    private DocumentAssembler assembler;

    @Mock
    private SourceEditor sourceEditor;

    @Mock
    private DocumentCompiler compiler;

    @TempDir
    Path tempDir;

    private ResumeProfile profile;
    private ResumeConfig resumeConfig;
    private SimpleMeterRegistry registry;
    private ResumePipelineService service;

    @BeforeEach
    void setUp() {
        GithubConfig githubConfig = new GithubConfig();
        githubConfig.setUsername("octocat");
        githubConfig.setToken("token");

        resumeConfig = new ResumeConfig();
        resumeConfig.setJobFile("job.txt");
        resumeConfig.setLanguage("en");
        resumeConfig.setOutput(tempDir.resolve("out/resume.pdf").toString());

        profile = new ResumeProfile();
        profile.setFullName("Ada Lovelace");
        registry = new SimpleMeterRegistry();

        service = new ResumePipelineService(githubCollector, jobSourceResolver, extractor, ranker,
                selectionController, generator, assembler, sourceEditor, compiler, profile, githubConfig, resumeConfig,
                new PipelineMetrics(registry));
    }

    private void stubUntilSelection() {
        when(githubCollector.collect("octocat", "token")).thenReturn(Mono.just(List.of(REPO)));
        when(jobSourceResolver.resolve(null, "job.txt")).thenReturn(Mono.just("posting"));
        when(extractor.extract("posting")).thenReturn(Mono.just(JOB));
        when(ranker.rank(List.of(REPO), JOB)).thenReturn(Mono.just(RANKED));
    }

    private void stubUntilCompilation() {
        stubUntilSelection();
        when(selectionController.select(RANKED)).thenReturn(SelectionOutcome.frozen(SELECTION));
        when(generator.generate(JOB, SELECTION, profile, ResumeLanguage.ENGLISH)).thenReturn(Mono.just(CONTENT));
        when(assembler.assemble(profile, JOB, CONTENT, ResumeLanguage.ENGLISH)).thenReturn(DOCUMENT);
        when(sourceEditor.review(DOCUMENT)).thenReturn(DOCUMENT);
    }

    @Nested
    @DisplayName("Pipeline execution")
    class PipelineTests {

        @Test
        @DisplayName("Should run every stage and write the PDF")
        void shouldProduceResume() throws IOException {
            stubUntilCompilation();
            when(compiler.compile(DOCUMENT)).thenReturn("%PDF-1.5".getBytes(StandardCharsets.UTF_8));

            StepVerifier.create(service.runPipeline())
                    .assertNext(outcome -> {
                        assertThat(outcome.isCompleted()).isTrue();
                        assertThat(outcome.artifact()).isEqualTo(tempDir.resolve("out/resume.pdf").toAbsolutePath());
                        assertThat(outcome.source()).isNull();
                    })
                    .verifyComplete();

            assertThat(Files.readString(tempDir.resolve("out/resume.pdf"))).isEqualTo("%PDF-1.5");
            assertThat(tempDir.resolve("out/resume.tex")).doesNotExist();
            assertThat(registry.get("auto_resume_stage_duration").tag("stage", "compilation").timer().count())
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("Should keep the LaTeX source when asked to")
        void shouldKeepSource() throws IOException {
            resumeConfig.setKeepSource(true);
            stubUntilCompilation();
            when(compiler.compile(DOCUMENT)).thenReturn(new byte[]{1});

            PipelineOutcome outcome = service.runPipeline().block();

            assertThat(outcome).isNotNull();
            assertThat(outcome.source()).isEqualTo(tempDir.resolve("out/resume.tex").toAbsolutePath());
            assertThat(Files.readString(outcome.source())).isEqualTo("\\documentclass{article}");
        }

        @Test
        @DisplayName("Should compile the source returned by the editor")
        void shouldCompileEditedSource() throws IOException {
            resumeConfig.setKeepSource(true);
            AssembledDocument edited = new AssembledDocument("\\documentclass{article} % edited");
            stubUntilCompilation();
            when(sourceEditor.review(DOCUMENT)).thenReturn(edited);
            when(compiler.compile(edited)).thenReturn(new byte[]{1});

            PipelineOutcome outcome = service.runPipeline().block();

            assertThat(outcome).isNotNull();
            assertThat(Files.readString(outcome.source())).isEqualTo("\\documentclass{article} % edited");
            verify(compiler, never()).compile(DOCUMENT);
        }

        @Test
        @DisplayName("Should stop without generating when the user aborts")
        void shouldStopOnAbort() {
            stubUntilSelection();
            when(selectionController.select(RANKED)).thenReturn(SelectionOutcome.aborted());

            StepVerifier.create(service.runPipeline())
                    .assertNext(outcome -> assertThat(outcome.isCompleted()).isFalse())
                    .verifyComplete();

            verify(generator, never()).generate(any(), any(), any(), any());
            verify(compiler, never()).compile(any());
            assertThat(tempDir.resolve("out")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should tag a collection failure with its stage")
        void shouldTagCollectionFailure() {
            when(githubCollector.collect("octocat", "token"))
                    .thenReturn(Mono.error(new CollectionException("GitHub user not found: octocat")));
            lenient().when(jobSourceResolver.resolve(null, "job.txt")).thenReturn(Mono.just("posting"));

            StepVerifier.create(service.runPipeline())
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(PipelineException.class);
                        assertThat(((PipelineException) e).getStage()).isEqualTo(PipelineStage.COLLECTION);
                        assertThat(e.getCause()).isInstanceOf(CollectionException.class);
                    })
                    .verify();

            verify(extractor, never()).extract(any());
        }

        @Test
        @DisplayName("Should tag a generation failure with its stage and emit nothing")
        void shouldTagGenerationFailure() {
            stubUntilSelection();
            when(selectionController.select(RANKED)).thenReturn(SelectionOutcome.frozen(SELECTION));
            when(generator.generate(eq(JOB), eq(SELECTION), eq(profile), any()))
                    .thenReturn(Mono.error(GenerationException.invalidOutput("Invalid resume content after 4 attempts")));

            StepVerifier.create(service.runPipeline())
                    .expectErrorSatisfies(e -> assertThat(((PipelineException) e).getStage())
                            .isEqualTo(PipelineStage.GENERATION))
                    .verify();

            assertThat(tempDir.resolve("out/resume.pdf")).doesNotExist();
        }

        @Test
        @DisplayName("Should preserve the source when compilation fails")
        void shouldPreserveSourceOnCompilationFailure() throws IOException {
            stubUntilCompilation();
            when(compiler.compile(DOCUMENT))
                    .thenThrow(new CompilationException("Compiler exited with status 1", "! Undefined control sequence."));

            StepVerifier.create(service.runPipeline())
                    .expectErrorSatisfies(e -> {
                        PipelineException pipelineException = (PipelineException) e;
                        assertThat(pipelineException.getStage()).isEqualTo(PipelineStage.COMPILATION);
                        CompilationException cause = (CompilationException) pipelineException.getCause();
                        assertThat(cause.getDiagnostic()).isEqualTo("! Undefined control sequence.");
                        assertThat(cause.getPreservedSource()).isEqualTo(tempDir.resolve("out/resume.tex").toAbsolutePath());
                    })
                    .verify();

            assertThat(Files.readString(tempDir.resolve("out/resume.tex"))).isEqualTo("\\documentclass{article}");
            assertThat(tempDir.resolve("out/resume.pdf")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("Compile-only mode")
    class CompileOnlyTests {

        @Test
        @DisplayName("Should compile an existing LaTeX file without running the pipeline")
        void shouldRecompileExistingSource() throws IOException {
            Path source = tempDir.resolve("edited.tex");
            Files.writeString(source, "\\documentclass{article} % by hand");
            resumeConfig.setCompileOnly(source.toString());
            when(compiler.compile(new AssembledDocument("\\documentclass{article} % by hand")))
                    .thenReturn("%PDF-1.5".getBytes(StandardCharsets.UTF_8));

            StepVerifier.create(service.runPipeline())
                    .assertNext(outcome -> assertThat(outcome.isCompleted()).isTrue())
                    .verifyComplete();

            assertThat(Files.readString(tempDir.resolve("out/resume.pdf"))).isEqualTo("%PDF-1.5");
            verify(githubCollector, never()).collect(any(), any());
            verify(jobSourceResolver, never()).resolve(any(), any());
            verify(sourceEditor, never()).review(any());
        }

        @Test
        @DisplayName("Should fail at compilation when the LaTeX file is missing")
        void shouldFailForMissingSource() {
            resumeConfig.setCompileOnly(tempDir.resolve("missing.tex").toString());

            StepVerifier.create(service.runPipeline())
                    .expectErrorSatisfies(e -> {
                        assertThat(((PipelineException) e).getStage()).isEqualTo(PipelineStage.COMPILATION);
                        assertThat(e.getCause()).isInstanceOf(CompilationException.class)
                                .hasMessageContaining("LaTeX source not found");
                    })
                    .verify();

            verify(compiler, never()).compile(any());
        }
    }

    @Test
    @DisplayName("Should derive the source path from the output path")
    void shouldDeriveSourcePath() {
        assertThat(ResumePipelineService.sourcePathFor(Path.of("/tmp/cv.PDF"))).isEqualTo(Path.of("/tmp/cv.tex"));
        assertThat(ResumePipelineService.sourcePathFor(Path.of("/tmp/cv"))).isEqualTo(Path.of("/tmp/cv.tex"));
    }
}

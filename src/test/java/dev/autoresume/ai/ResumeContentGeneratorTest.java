package dev.autoresume.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.autoresume.config.LlmConfig;
import dev.autoresume.config.ResumeProfile;
import dev.autoresume.metrics.PipelineMetrics;
import dev.autoresume.model.JobDescription;
import dev.autoresume.model.ManualEntry;
import dev.autoresume.model.Repository;
import dev.autoresume.model.ResumeContent.ProjectEntry;
import dev.autoresume.model.ResumeLanguage;
import dev.autoresume.model.SelectionResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumeContentGeneratorTest {

    private static final JobDescription JOB = JobDescription.builder()
            .title("Platform Engineer")
            .company("Acme")
            .summary("Run our Kubernetes platform")
            .requiredSkills(List.of("Go", "Kubernetes"))
            .niceToHave(List.of("Terraform"))
            .rawText("raw")
            .build();

    private static final Repository OPERATOR = Repository.builder()
            .name("k8s-operator")
            .url("https://github.com/octocat/k8s-operator")
            .description("Operator for databases")
            .languageBreakdown(Map.of("Go", 900L, "Makefile", 100L))
            .readmeExcerpt("# k8s-operator\nReconciles clusters.")
            .build();

    private static final ManualEntry THESIS = new ManualEntry("Thesis Simulator", "", "Traffic simulation in C++");

    @Mock
    private GenerativeClient client;

    private ResumeContentGenerator generator;
    private ResumeProfile profile;

    @BeforeEach
    void setUp() {
        LlmConfig config = new LlmConfig();
        config.setMaxRetries(1);
        StructuredInvoker invoker = new StructuredInvoker(client, new ObjectMapper(), config,
                new PipelineMetrics(new SimpleMeterRegistry()));
        generator = new ResumeContentGenerator(invoker);

        profile = new ResumeProfile();
        profile.setFullName("Ada Lovelace");
        profile.setExperienceContext("Five years building payment systems at Initech.");
    }

    @Test
    @DisplayName("Should build content that only references the selection")
    void shouldGenerateFromSelection() {
        when(client.generate(any())).thenReturn(Mono.just("""
                {
                  "skills_by_category": [
                    {"category": "Back-end", "items": ["Go", "gRPC"]},
                    {"category": "Infrastructure", "items": ["Kubernetes"]},
                    {"category": "Back-end", "items": ["PostgreSQL"]}
                  ],
                  "projects": [
                    {"title": "K8s Operator (Go)", "link": "https://github.com/octocat/k8s-operator/",
                     "items": ["Reconciles database clusters"]},
                    {"title": "Thesis Simulator (C++)", "link": "", "items": ["Traffic simulation"]},
                    {"title": "Invented Project (Rust)", "link": "https://github.com/octocat/invented",
                     "items": ["Not real"]}
                  ],
                  "experience": [
                    {"company": "Initech", "position": "Backend Engineer", "location": "Remote",
                     "date": "2019 - 2024", "accomplishments": ["Cut payment latency by 40%"]}
                  ],
                  "education": []
                }
                """));

        SelectionResult selection = new SelectionResult(List.of(OPERATOR), List.of(THESIS));

        StepVerifier.create(generator.generate(JOB, selection, profile, ResumeLanguage.ENGLISH))
                .assertNext(content -> {
                    assertThat(content.skills()).containsOnlyKeys("Back-end", "Infrastructure");
                    assertThat(content.skills().get("Back-end")).containsExactly("Go", "gRPC", "PostgreSQL");
                    assertThat(content.projects()).extracting(ProjectEntry::project)
                            .containsExactly(OPERATOR, THESIS);
                    assertThat(content.experience()).hasSize(1);
                    assertThat(content.education()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should give the provider the selection, README excerpts and profile context")
    void shouldIncludeSelectionInPrompt() {
        when(client.generate(any())).thenReturn(Mono.just(
                "{\"skills_by_category\": [], \"projects\": [], \"experience\": [], \"education\": []}"));

        SelectionResult selection = new SelectionResult(List.of(OPERATOR), List.of(THESIS));
        StepVerifier.create(generator.generate(JOB, selection, profile, ResumeLanguage.PORTUGUESE))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<GenerationPrompt> prompt = ArgumentCaptor.forClass(GenerationPrompt.class);
        verify(client).generate(prompt.capture());
        String content = prompt.getValue().userContent();
        assertThat(content).contains(
                "Write the resume of Ada Lovelace for the position of Platform Engineer at Acme",
                "Write everything in Portuguese",
                "- k8s-operator [Go (90.0%), Makefile (10.0%)]",
                "Reconciles clusters.",
                "- Thesis Simulator\n  Description: Traffic simulation in C++",
                "Five years building payment systems at Initech.",
                "The candidate has not provided specific education details.");
        assertThat(prompt.getValue().schema().path("required").toString()).contains("projects");
    }
}

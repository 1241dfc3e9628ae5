package dev.autoresume.latex;

import dev.autoresume.config.ResumeConfig;
import dev.autoresume.exception.CompilationException;
import dev.autoresume.model.AssembledDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class TectonicDocumentCompilerTest {

    private static final AssembledDocument DOCUMENT = new AssembledDocument("\\documentclass{article}");

    @TempDir
    Path tempDir;

    private ResumeConfig config;
    private TectonicDocumentCompiler compiler;

    @BeforeEach
    void setUp() {
        config = new ResumeConfig();
        compiler = new TectonicDocumentCompiler(config);
    }

    private void useScript(String body) throws IOException {
        Path script = tempDir.resolve("fake-latex.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        assertThat(script.toFile().setExecutable(true)).isTrue();
        config.getCompiler().setCommand(script.toString());
    }

    @Test
    @DisplayName("Should return the PDF the compiler wrote")
    void shouldReturnPdf() throws IOException {
        useScript("cp \"$1\" resume.pdf");

        byte[] pdf = compiler.compile(DOCUMENT);

        assertThat(new String(pdf, StandardCharsets.UTF_8)).isEqualTo("\\documentclass{article}");
    }

    @Test
    @DisplayName("Should surface the compiler output verbatim on failure")
    void shouldSurfaceDiagnostic() throws IOException {
        useScript("echo '! Undefined control sequence.'\necho 'l.12 \\foo' >&2\nexit 1");

        assertThatThrownBy(() -> compiler.compile(DOCUMENT))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Compiler exited with status 1")
                .satisfies(e -> assertThat(((CompilationException) e).getDiagnostic())
                        .contains("! Undefined control sequence.", "l.12 \\foo"));
    }

    @Test
    @DisplayName("Should fail when no PDF is produced")
    void shouldFailWithoutPdf() throws IOException {
        useScript("exit 0");

        assertThatThrownBy(() -> compiler.compile(DOCUMENT))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("without producing resume.pdf");
    }

    @Test
    @DisplayName("Should fail when the compiler is not installed")
    void shouldFailForMissingCommand() {
        config.getCompiler().setCommand("auto-resume-no-such-compiler --keep-logs");

        assertThatThrownBy(() -> compiler.compile(DOCUMENT))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("auto-resume-no-such-compiler")
                .hasMessageContaining("installed");
    }

    @Test
    @DisplayName("Should stop a compiler that runs too long")
    void shouldTimeOut() throws IOException {
        useScript("sleep 10");
        config.getCompiler().setTimeout(Duration.ofMillis(300));

        assertThatThrownBy(() -> compiler.compile(DOCUMENT))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("timed out");
    }
}

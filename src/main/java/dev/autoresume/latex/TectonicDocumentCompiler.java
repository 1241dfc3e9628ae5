package dev.autoresume.latex;

import dev.autoresume.config.ResumeConfig;
import dev.autoresume.exception.CompilationException;
import dev.autoresume.model.AssembledDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external LaTeX engine (tectonic by default) in a scratch directory.
 */
@Slf4j
@Component
public class TectonicDocumentCompiler implements DocumentCompiler {

    private static final String SOURCE_NAME = "resume.tex";
    private static final String OUTPUT_NAME = "resume.pdf";

    private final ResumeConfig resumeConfig;

    public TectonicDocumentCompiler(ResumeConfig resumeConfig) {
        this.resumeConfig = resumeConfig;
    }

    @Override
    public byte[] compile(AssembledDocument document) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("auto-resume-");
            Files.writeString(workDir.resolve(SOURCE_NAME), document.source(), StandardCharsets.UTF_8);
            return run(workDir);
        } catch (IOException e) {
            throw new CompilationException("Could not prepare the compiler workspace: " + e.getMessage(), "", e);
        } finally {
            if (workDir != null) {
                deleteQuietly(workDir);
            }
        }
    }

    private byte[] run(Path workDir) throws IOException {
        List<String> command = new ArrayList<>(Arrays.asList(resumeConfig.getCompiler().getCommand().trim().split("\\s+")));
        command.add(SOURCE_NAME);
        log.info("Compiling document with: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new CompilationException("Could not start '" + command.get(0) + "'. Is it installed and on the PATH?",
                    e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(resumeConfig.getCompiler().getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CompilationException("Compiler timed out after " + resumeConfig.getCompiler().getTimeout(),
                        output.getNow(""));
            }
            String diagnostic = output.get();
            if (process.exitValue() != 0) {
                throw new CompilationException("Compiler exited with status " + process.exitValue(), diagnostic);
            }
            Path pdf = workDir.resolve(OUTPUT_NAME);
            if (!Files.exists(pdf)) {
                throw new CompilationException("Compiler finished without producing " + OUTPUT_NAME, diagnostic);
            }
            log.debug("Compiler output:\n{}", diagnostic);
            return Files.readAllBytes(pdf);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CompilationException("Interrupted while compiling", "", e);
        } catch (ExecutionException e) {
            throw new CompilationException("Could not read compiler output", e.getCause().getMessage(), e.getCause());
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "(compiler output unavailable: " + e.getMessage() + ")";
        }
    }

    private static void deleteQuietly(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not delete compiler workspace {}: {}", dir, e.getMessage());
        }
    }
}

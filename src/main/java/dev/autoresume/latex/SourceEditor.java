package dev.autoresume.latex;

import dev.autoresume.config.ResumeConfig;
import dev.autoresume.exception.AssemblyException;
import dev.autoresume.model.AssembledDocument;
import dev.autoresume.selection.SelectionConsole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Checkpoint between assembly and compilation: offers to open the assembled
 * LaTeX in the user's editor and compiles whatever the editor leaves behind.
 */
@Slf4j
@Component
public class SourceEditor {

    static final String PROMPT = "Edit the LaTeX source before compiling? (y/N): ";

    private final SelectionConsole console;
    private final ResumeConfig resumeConfig;

    public SourceEditor(SelectionConsole console, ResumeConfig resumeConfig) {
        this.console = console;
        this.resumeConfig = resumeConfig;
    }

    /**
     * Ask whether to edit and return the document to compile. End of input
     * counts as "no".
     */
    public AssembledDocument review(AssembledDocument document) {
        if (!resumeConfig.getEditor().isPrompt()) {
            return document;
        }
        while (true) {
            String answer = console.readLine(PROMPT);
            if (answer == null) {
                return document;
            }
            switch (answer.trim().toLowerCase(Locale.ROOT)) {
                case "y", "yes" -> {
                    return edit(document);
                }
                case "", "n", "no" -> {
                    return document;
                }
                default -> console.println("Please answer 'y' or 'n'.");
            }
        }
    }

    AssembledDocument edit(AssembledDocument document) {
        Path file = null;
        try {
            file = Files.createTempFile("auto-resume-", ".tex");
            Files.writeString(file, document.source(), StandardCharsets.UTF_8);
            if (!runEditor(file)) {
                return document;
            }
            String edited = Files.readString(file, StandardCharsets.UTF_8);
            if (edited.isBlank()) {
                throw new AssemblyException("The edited LaTeX source is empty");
            }
            log.info("Using edited LaTeX source ({} characters)", edited.length());
            return new AssembledDocument(edited);
        } catch (IOException e) {
            throw new AssemblyException("Could not edit the LaTeX source: " + e.getMessage(), e);
        } finally {
            if (file != null) {
                deleteQuietly(file);
            }
        }
    }

    /**
     * @return false when the editor exits non-zero, which discards the edit
     */
    private boolean runEditor(Path file) throws IOException {
        List<String> command = new ArrayList<>(Arrays.asList(editorCommand().trim().split("\\s+")));
        command.add(file.toString());
        log.info("Opening {} with: {}", file, String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command).inheritIO().start();
        } catch (IOException e) {
            throw new AssemblyException("Could not start editor '" + command.get(0)
                    + "'. Set resume.editor.command or $EDITOR", e);
        }
        try {
            int status = process.waitFor();
            if (status != 0) {
                log.warn("Editor exited with status {}, compiling the unedited source", status);
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new AssemblyException("Interrupted while waiting for the editor", e);
        }
    }

    String editorCommand() {
        String configured = resumeConfig.getEditor().getCommand();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnvironment = System.getenv("EDITOR");
        return fromEnvironment != null && !fromEnvironment.isBlank() ? fromEnvironment : "vi";
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary source {}: {}", file, e.getMessage());
        }
    }
}

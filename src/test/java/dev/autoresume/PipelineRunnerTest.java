package dev.autoresume;

import dev.autoresume.exception.CompilationException;
import dev.autoresume.exception.PipelineException;
import dev.autoresume.model.PipelineOutcome;
import dev.autoresume.model.PipelineStage;
import dev.autoresume.service.ResumePipelineService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    @Mock
    private ResumePipelineService resumePipelineService;

    @InjectMocks
    private PipelineRunner pipelineRunner;

    @Test
    void execute_completedRun_returnsOutcome() {
        // Arrange
        PipelineOutcome completed = PipelineOutcome.completed(Path.of("resume.pdf"), null);
        when(resumePipelineService.runPipeline()).thenReturn(Mono.just(completed));

        // Act
        PipelineOutcome result = pipelineRunner.execute();

        // Assert
        assertTrue(result.isCompleted());
        assertEquals(Path.of("resume.pdf"), result.artifact());
        verify(resumePipelineService).runPipeline();
    }

    @Test
    void execute_userAborted_returnsAbortedOutcome() {
        // Arrange
        when(resumePipelineService.runPipeline()).thenReturn(Mono.just(PipelineOutcome.aborted()));

        // Act
        PipelineOutcome result = pipelineRunner.execute();

        // Assert
        assertFalse(result.isCompleted());
    }

    @Test
    void execute_stageFails_throwsIllegalStateException() {
        // Arrange
        CompilationException compilation = new CompilationException("Compiler exited with status 1", "! LaTeX Error")
                .withPreservedSource(Path.of("resume.tex"));
        when(resumePipelineService.runPipeline())
                .thenReturn(Mono.error(new PipelineException(PipelineStage.COMPILATION, compilation)));

        // Act & Assert
        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
        assertEquals("Pipeline execution failed", exception.getMessage());
        assertInstanceOf(PipelineException.class, exception.getCause());
    }

    @Test
    void execute_emptyPipeline_throwsIllegalStateException() {
        // Arrange
        when(resumePipelineService.runPipeline()).thenReturn(Mono.empty());

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
    }
}

package dev.autoresume;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Command-line entry point. Exit status is 0 when the resume was produced or
 * the user aborted the selection, 1 when any stage failed.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class ResumeApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(ResumeApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            pipelineRunner.execute();
            log.info("Auto Resume exiting...");
            exitManager.exit(ExitManager.SUCCESS);
        } catch (Exception e) {
            log.error("Auto Resume failed: {}", e.getMessage());
            exitManager.exit(ExitManager.FAILURE);
        }
    }
}

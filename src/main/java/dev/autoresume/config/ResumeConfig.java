package dev.autoresume.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Run-level options: job source, output, language and document limits.
 * Loaded from application.yml under 'resume' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "resume")
public class ResumeConfig {

    private String jobUrl;
    private String jobFile;
    private String language = "pt";
    private String output = "resume.pdf";
    private boolean keepSource = false;
    private String compileOnly;
    private String profilePath = "profile.json";
    private int maxFieldLength = 600;
    private int maxItemsPerSection = 12;
    private Selection selection = new Selection();
    private Compiler compiler = new Compiler();
    private Editor editor = new Editor();

    @Data
    public static class Selection {
        private int defaultCount = 5;
    }

    @Data
    public static class Compiler {
        private String command = "tectonic";
        private Duration timeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Editor {
        private boolean prompt = true;
        // falls back to $EDITOR, then vi
        private String command;
    }
}

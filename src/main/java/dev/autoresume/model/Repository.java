package dev.autoresume.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A public repository as collected from the GitHub profile. Identity is the URL.
 */
@Builder(toBuilder = true)
public record Repository(
        String name,
        String url,
        String description,
        long stars,
        long forks,
        String primaryLanguage,
        Map<String, Long> languageBreakdown,
        String readmeExcerpt,
        Instant lastActivity,
        Instant createdAt,
        long commitCount,
        long sizeKb,
        boolean fork,
        boolean archived) implements ProjectReference {

    public Repository {
        languageBreakdown = languageBreakdown == null ? Map.of() : Map.copyOf(languageBreakdown);
        readmeExcerpt = readmeExcerpt == null ? "" : readmeExcerpt;
        description = description == null ? "" : description;
    }

    /**
     * Heuristic weight used to order the profile before ranking. Forks and
     * archived repositories score zero.
     */
    public long importanceScore() {
        if (archived || fork) {
            return 0;
        }
        long cappedStars = Math.min(stars, 1000);
        long cappedForks = Math.min(forks, 100);
        long size = Math.min(sizeKb, 10000) / 100;
        return cappedStars * 3 + cappedForks * 2 + size;
    }

    public boolean hasReadme() {
        return !readmeExcerpt.isBlank();
    }

    /**
     * Language shares formatted as "Java (72.5%), Shell (27.5%)", or "Unknown".
     */
    public String languageSummary() {
        long total = languageBreakdown.values().stream().mapToLong(Long::longValue).sum();
        if (total == 0) {
            return primaryLanguage != null ? primaryLanguage : "Unknown";
        }
        StringBuilder sb = new StringBuilder();
        languageBreakdown.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(entry -> {
                    if (!sb.isEmpty()) {
                        sb.append(", ");
                    }
                    double share = Math.round(entry.getValue() * 10000.0 / total) / 100.0;
                    sb.append(entry.getKey()).append(" (").append(share).append("%)");
                });
        return sb.toString();
    }
}

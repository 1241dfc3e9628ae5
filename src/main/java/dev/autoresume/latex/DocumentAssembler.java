package dev.autoresume.latex;

import dev.autoresume.config.ResumeConfig;
import dev.autoresume.config.ResumeProfile;
import dev.autoresume.exception.AssemblyException;
import dev.autoresume.model.AssembledDocument;
import dev.autoresume.model.JobDescription;
import dev.autoresume.model.ProjectReference;
import dev.autoresume.model.Repository;
import dev.autoresume.model.ResumeContent;
import dev.autoresume.model.ResumeContent.EducationEntry;
import dev.autoresume.model.ResumeContent.ExperienceEntry;
import dev.autoresume.model.ResumeContent.ProjectEntry;
import dev.autoresume.model.ResumeItem;
import dev.autoresume.model.ResumeLanguage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes the profile and generated sections into the LaTeX template.
 * Every dynamic string is whitespace-normalized, length-capped and escaped;
 * substitution is a single pass so inserted text is never re-scanned.
 */
@Slf4j
@Component
public class DocumentAssembler {

    static final String TEMPLATE = "templates/resume.tex";
    private static final Pattern PLACEHOLDER = Pattern.compile("<<([A-Z_]+)>>");
    private static final String SEPARATOR = "\\ $|$ \\ ";

    private final ResumeConfig resumeConfig;
    private final String template;

    public DocumentAssembler(ResumeConfig resumeConfig) {
        this.resumeConfig = resumeConfig;
        this.template = loadTemplate();
    }

    public AssembledDocument assemble(ResumeProfile profile, JobDescription job, ResumeContent content,
                                      ResumeLanguage language) {
        Map<String, String> values = new HashMap<>(language.getHeaders());
        values.put("TARGET", text(job.title() + " at " + job.companyOrDefault()));
        values.put("NAME", text(profile.getFullName()));
        values.put("CITY", text(profile.getCity()));
        values.put("COUNTRY", text(profile.getCountry()));
        values.put("HEADER", header(profile));
        values.put("SKILLS", content.skills().isEmpty()
                ? fallback("skills", profile.getSkills())
                : skills(content.skills()));
        values.put("EXPERIENCE", content.experience().isEmpty()
                ? fallback("experience", profile.getExperience())
                : items(content.experience().stream().map(DocumentAssembler::toItem).toList()));
        values.put("PROJECTS", content.projects().isEmpty()
                ? fallback("projects", profile.getProjects())
                : items(content.projects().stream().map(DocumentAssembler::toItem).toList()));
        values.put("EDUCATION", content.education().isEmpty()
                ? fallback("education", profile.getEducation())
                : items(content.education().stream().map(DocumentAssembler::toItem).toList()));

        String source = substitute(template, values);
        log.info("Assembled {} resume ({} characters)", language.getDisplayName(), source.length());
        return new AssembledDocument(source);
    }

    String substitute(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() * 2);
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            if (value == null) {
                throw new AssemblyException("Template placeholder <<" + matcher.group(1) + ">> has no value");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String header(ResumeProfile profile) {
        StringBuilder header = new StringBuilder();
        if (present(profile.getEmail())) {
            header.append(SEPARATOR).append(link("mailto:" + profile.getEmail().trim(), profile.getEmail())).append(' ');
        }
        if (present(profile.getPhone())) {
            header.append(SEPARATOR).append(text(profile.getPhone())).append(' ');
        }
        for (String url : new String[]{profile.getLinkedin(), profile.getGithub(), profile.getSite()}) {
            if (present(url)) {
                header.append(SEPARATOR).append(link(url, LatexEscaper.displayUrl(url))).append(' ');
            }
        }
        return header.toString().stripTrailing();
    }

    private String skills(Map<String, List<String>> skills) {
        StringBuilder out = new StringBuilder("\\begin{itemize}[noitemsep,topsep=0pt,leftmargin=*]\n");
        skills.entrySet().stream()
                .limit(resumeConfig.getMaxItemsPerSection())
                .forEach(category -> out.append("    \\item \\textbf{")
                        .append(text(category.getKey()))
                        .append("}: ")
                        .append(text(String.join(", ", category.getValue())))
                        .append('\n'));
        return out.append("\\end{itemize}\n").toString();
    }

    private String fallback(String section, List<ResumeItem> profileItems) {
        log.debug("Generated {} section is empty, using the profile's", section);
        return items(profileItems);
    }

    private String items(List<ResumeItem> items) {
        StringBuilder out = new StringBuilder();
        items.stream().limit(resumeConfig.getMaxItemsPerSection()).forEach(item -> {
            if (!out.isEmpty()) {
                out.append('\n');
            }
            out.append(item(item));
        });
        return out.toString();
    }

    private String item(ResumeItem item) {
        StringBuilder out = new StringBuilder();
        if (present(item.title())) {
            out.append("\\noindent \\textbf{").append(text(item.title())).append('}');
            if (present(item.location())) {
                out.append(" \\hfill ").append(present(item.link())
                        ? link(item.link(), item.location())
                        : text(item.location()));
            }
            if (present(item.description())) {
                out.append(" \\\\");
            }
            out.append('\n');
        }
        if (present(item.description())) {
            out.append("\\textit{").append(text(item.description())).append('}');
            if (present(item.date())) {
                out.append(" \\hfill ").append(text(item.date())).append(' ');
            }
            out.append('\n');
        }
        List<String> bullets = item.items().stream()
                .filter(DocumentAssembler::present)
                .limit(resumeConfig.getMaxItemsPerSection())
                .toList();
        if (!bullets.isEmpty()) {
            out.append("\\begin{itemize}[noitemsep,topsep=0pt,leftmargin=*]\n");
            // the empty group keeps a leading [ from being read as the optional label of \item
            bullets.forEach(bullet -> out.append("    \\item{}").append(text(bullet)).append('\n'));
            out.append("\\end{itemize}\n");
        }
        return out.toString();
    }

    private String link(String url, String label) {
        return "\\href{" + LatexEscaper.escapeUrl(url) + "}{" + text(label) + "}";
    }

    /**
     * Collapse whitespace (a blank line would end the paragraph inside a
     * command argument), cap the length, then escape.
     */
    String text(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.replaceAll("\\s+", " ").trim();
        return LatexEscaper.escape(LatexEscaper.truncate(normalized, resumeConfig.getMaxFieldLength()));
    }

    static ResumeItem toItem(ProjectEntry entry) {
        ProjectReference project = entry.project();
        if (!present(project.url())) {
            return new ResumeItem(entry.title(), null, null, null, null, entry.highlights());
        }
        String location = project instanceof Repository || project.url().contains("github.com")
                ? "GitHub"
                : LatexEscaper.displayUrl(project.url());
        return new ResumeItem(entry.title(), null, location, null, project.url(), entry.highlights());
    }

    static ResumeItem toItem(ExperienceEntry entry) {
        return new ResumeItem(entry.company(), entry.date(), entry.location(), entry.position(), null,
                entry.accomplishments());
    }

    static ResumeItem toItem(EducationEntry entry) {
        return new ResumeItem(entry.institution(), entry.date(), entry.location(), entry.degree(), null,
                entry.accomplishments());
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource(TEMPLATE).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing resume template " + TEMPLATE, e);
        }
    }
}

package dev.autoresume.latex;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Literal-text escaping for LaTeX. {@link #unescape(String)} reverses
 * {@link #escape(String)} exactly.
 */
public final class LatexEscaper {

    private static final Map<Character, String> WORD_ESCAPES = Map.of(
            '~', "\\textasciitilde{}",
            '^', "\\textasciicircum{}",
            '\\', "\\textbackslash{}");

    private static final String SYMBOL_ESCAPES = "&%$#_{}";
    private static final String ELLIPSIS = "...";

    private LatexEscaper() {
    }

    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String word = WORD_ESCAPES.get(c);
            if (word != null) {
                out.append(word);
            } else if (SYMBOL_ESCAPES.indexOf(c) >= 0) {
                out.append('\\').append(c);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Read escaped text back the way LaTeX typesets it.
     */
    public static String unescape(String escaped) {
        if (escaped == null || escaped.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(escaped.length());
        int i = 0;
        outer:
        while (i < escaped.length()) {
            char c = escaped.charAt(i);
            if (c == '\\') {
                for (Map.Entry<Character, String> entry : WORD_ESCAPES.entrySet()) {
                    if (escaped.startsWith(entry.getValue(), i)) {
                        out.append(entry.getKey());
                        i += entry.getValue().length();
                        continue outer;
                    }
                }
                if (i + 1 < escaped.length() && SYMBOL_ESCAPES.indexOf(escaped.charAt(i + 1)) >= 0) {
                    out.append(escaped.charAt(i + 1));
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("Unexpected control sequence at offset " + i + ": " + escaped);
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Make a URL safe as the first argument of {@code \href}. Characters that
     * would end or escape the argument are percent-encoded.
     */
    public static String escapeUrl(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String trimmed = url.trim();
        if (!trimmed.matches("(?i)^(https?|mailto):.*")) {
            trimmed = "https://" + trimmed;
        }
        StringBuilder out = new StringBuilder(trimmed.length());
        for (char c : trimmed.toCharArray()) {
            switch (c) {
                case '%' -> out.append("\\%");
                case '#' -> out.append("\\#");
                case '{', '}', '\\', '^', '`', '"', '<', '>', '|', ' ' -> out.append(percentEncode(c));
                default -> {
                    if (!Character.isISOControl(c)) {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }

    /**
     * Display form of a link: no scheme, no "www.", no trailing slash.
     */
    public static String displayUrl(String url) {
        if (url == null) {
            return "";
        }
        String display = url.trim().replaceFirst("(?i)^(https?://|mailto:)", "").replaceFirst("(?i)^www\\.", "");
        while (display.endsWith("/")) {
            display = display.substring(0, display.length() - 1);
        }
        return display;
    }

    /**
     * Cut text longer than {@code maxLength} characters, marking the cut with "...".
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        int cut = Math.max(0, maxLength - ELLIPSIS.length());
        if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut).stripTrailing() + ELLIPSIS;
    }

    private static String percentEncode(char c) {
        StringBuilder encoded = new StringBuilder();
        for (byte b : String.valueOf(c).getBytes(StandardCharsets.UTF_8)) {
            encoded.append("\\%").append(String.format(Locale.ROOT, "%02X", b));
        }
        return encoded.toString();
    }
}

package dev.autoresume.latex;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LatexEscaperTest {

    @Nested
    @DisplayName("Text escaping")
    class EscapeTests {

        @Test
        @DisplayName("Should escape every reserved character")
        void shouldEscapeReservedCharacters() {
            assertThat(LatexEscaper.escape("R&D 100% $5 #1 a_b {x} ~ ^ \\"))
                    .isEqualTo("R\\&D 100\\% \\$5 \\#1 a\\_b \\{x\\} \\textasciitilde{} \\textasciicircum{} \\textbackslash{}");
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "C# & C++ at 50% off",
                "\\textbf{not a command}",
                "~/.config/app_name {draft} ^_^",
                "Visão geral: integração contínua 🚀",
                "\\\\&&%%"
        })
        @DisplayName("Should read back exactly what was escaped")
        void shouldRoundTrip(String text) {
            String escaped = LatexEscaper.escape(text);

            assertThat(LatexEscaper.unescape(escaped)).isEqualTo(text);
            assertThat(escaped).doesNotContain("\\textbf{not");
        }

        @Test
        @DisplayName("Should leave plain text and accents alone")
        void shouldLeavePlainText() {
            assertThat(LatexEscaper.escape("Engenharia de Computação")).isEqualTo("Engenharia de Computação");
            assertThat(LatexEscaper.escape(null)).isEmpty();
        }

        @Test
        @DisplayName("Should refuse to unescape unknown control sequences")
        void shouldRejectUnknownSequence() {
            assertThatThrownBy(() -> LatexEscaper.unescape("\\input{secrets}"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("URLs")
    class UrlTests {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
                "github.com/octocat|https://github.com/octocat",
                "https://example.com/a%20b#top|https://example.com/a\\%20b\\#top",
                "https://example.com/{x}|https://example.com/\\%7Bx\\%7D",
                "mailto:ada@example.com|mailto:ada@example.com",
                "HTTP://Example.com/path with space|HTTP://Example.com/path\\%20with\\%20space"
        })
        @DisplayName("Should make URLs safe inside \\href")
        void shouldEscapeUrl(String url, String expected) {
            assertThat(LatexEscaper.escapeUrl(url)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should drop control characters from URLs")
        void shouldDropControlCharacters() {
            assertThat(LatexEscaper.escapeUrl("https://a.dev/\nx")).isEqualTo("https://a.dev/x");
            assertThat(LatexEscaper.escapeUrl(" ")).isEmpty();
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource({
                "https://www.linkedin.com/in/ada/, linkedin.com/in/ada",
                "http://github.com/ada, github.com/ada",
                "mailto:ada@example.com, ada@example.com",
                "ada.dev//, ada.dev"
        })
        @DisplayName("Should shorten URLs for display")
        void shouldShortenForDisplay(String url, String expected) {
            assertThat(LatexEscaper.displayUrl(url)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Truncation")
    class TruncateTests {

        @Test
        @DisplayName("Should keep text within the limit untouched")
        void shouldKeepShortText() {
            assertThat(LatexEscaper.truncate("short", 5)).isEqualTo("short");
        }

        @Test
        @DisplayName("Should cut long text and mark the cut")
        void shouldCutLongText() {
            String truncated = LatexEscaper.truncate("Built a distributed cache in Go", 11);

            assertThat(truncated).isEqualTo("Built a...").hasSizeLessThanOrEqualTo(11);
        }

        @Test
        @DisplayName("Should not split a surrogate pair")
        void shouldNotSplitSurrogatePair() {
            String truncated = LatexEscaper.truncate("abcd🚀efgh", 8);

            assertThat(truncated).isEqualTo("abcd...");
        }
    }
}

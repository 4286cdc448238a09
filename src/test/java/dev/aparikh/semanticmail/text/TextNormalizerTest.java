package dev.aparikh.semanticmail.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void nullAndBlankBecomeEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("")).isEmpty();
        assertThat(normalizer.normalize(" \t\r\n ")).isEmpty();
    }

    @Test
    void unifiesLineEndings() {
        assertThat(normalizer.normalize("a\r\nb\rc\nd")).isEqualTo("a\nb\nc\nd");
    }

    @Test
    void collapsesHorizontalWhitespace() {
        assertThat(normalizer.normalize("Hello   \t  world")).isEqualTo("Hello world");
    }

    @Test
    void trimsSpacesAroundNewlines() {
        assertThat(normalizer.normalize("line one   \n   line two")).isEqualTo("line one\nline two");
    }

    @Test
    void limitsBlankLinesToOne() {
        assertThat(normalizer.normalize("para one\n\n\n\n\npara two")).isEqualTo("para one\n\npara two");
    }

    @Test
    void removesControlCharactersButKeepsNewlines() {
        assertThat(normalizer.normalize("a\u0000b\u0007c\u001Fd\u007Fe\nf")).isEqualTo("abcde\nf");
    }

    @Test
    void keepsNonAsciiText() {
        assertThat(normalizer.normalize("  Привет, мир! 你好 ")).isEqualTo("Привет, мир! 你好");
    }

    @Test
    void isIdempotent() {
        String raw = "  Hi team,\r\n\r\n\r\n\tplease  review   the\u0000 attached.\n \n \nThanks ";
        String once = normalizer.normalize(raw);

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }
}

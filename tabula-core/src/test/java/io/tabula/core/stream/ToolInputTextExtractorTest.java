package io.tabula.core.stream;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ToolInputTextExtractorTest {

    @Test
    void shouldDecodeTextAcrossFragments() {
        ToolInputTextExtractor extractor = new ToolInputTextExtractor();

        assertThat(extractor.feed("{\"te")).isEmpty();
        assertThat(extractor.feed("xt\": \"The av")).isEqualTo("The av");
        assertThat(extractor.feed("erage is 87.7\"}")).isEqualTo("erage is 87.7");
        assertThat(extractor.complete()).isTrue();
        assertThat(extractor.text()).isEqualTo("The average is 87.7");
        assertThat(extractor.feed("more")).isEmpty();
    }

    @Test
    void shouldDecodeEscapesSplitAcrossFragments() {
        ToolInputTextExtractor extractor = new ToolInputTextExtractor();

        StringBuilder out = new StringBuilder();
        out.append(extractor.feed("{\"text\": \"line\\"));
        out.append(extractor.feed("nnext \\\"quoted\\\" caf\\u00"));
        out.append(extractor.feed("e9\"}"));

        assertThat(out.toString()).isEqualTo("line\nnext \"quoted\" café");
    }

    @Test
    void shouldSkipOtherFieldsIncludingNestedValues() {
        ToolInputTextExtractor extractor = new ToolInputTextExtractor();

        String delta = extractor.feed("{\"meta\": {\"text\": \"no\", \"list\": [1, \"]\"]}, \"n\": 3, \"text\": \"yes\"}");

        assertThat(delta).isEqualTo("yes");
    }

    @Test
    void shouldHoldBackHighSurrogateUntilPairArrives() {
        ToolInputTextExtractor extractor = new ToolInputTextExtractor();
        String emoji = "😀";

        String first = extractor.feed("{\"text\": \"ok " + emoji.charAt(0));
        String second = extractor.feed(emoji.charAt(1) + "\"}");

        assertThat(first).isEqualTo("ok ");
        assertThat(second).isEqualTo(emoji);
    }

    @Test
    void shouldReplaceInvalidUnicodeEscape() {
        ToolInputTextExtractor extractor = new ToolInputTextExtractor("body");

        assertThat(extractor.feed("{\"body\": \"a\\uZZZZb\"}")).isEqualTo("a�b");
    }
}

package ai.docsite.plaintext.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LanguageDirectionalityTest {

    @Test
    void looksUpFullTagThenPrimarySubtag() {
        assertThat(LanguageDirectionality.lookup("he")).isEqualTo(Direction.RTL);
        assertThat(LanguageDirectionality.lookup("ar-EG")).isEqualTo(Direction.RTL);
        assertThat(LanguageDirectionality.lookup("en")).isEqualTo(Direction.LTR);
        assertThat(LanguageDirectionality.lookup("")).isEqualTo(Direction.LTR);
    }

    @Test
    void parsesDirAttribute() {
        assertThat(Direction.fromAttribute("RTL")).contains(Direction.RTL);
        assertThat(Direction.fromAttribute("auto")).isEmpty();
        assertThat(Direction.fromAttribute("sideways")).isEmpty();
    }
}

package ai.docsite.plaintext.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class LayoutOptionsTest {

    @Test
    void defaultsMatchClassicTerminalWidth() {
        LayoutOptions options = LayoutOptions.defaults();

        assertThat(options.columns()).isEqualTo(75);
        assertThat(options.tabWidth()).isEqualTo(2);
        assertThat(options.noWrap()).isFalse();
    }

    @Test
    void requiresRoomForText() {
        assertThatThrownBy(() -> new LayoutOptions(20, 2, false)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LayoutOptions(40, 0, false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deepIndentationStopsBeforeTheTextColumnLimit() {
        Wrapper wrapper = Wrapper.create(new LayoutOptions(30, 2, false), 28, false);

        assertThat(wrapper.wrap("word")).isEqualTo(" ".repeat(10) + "word");
    }
}

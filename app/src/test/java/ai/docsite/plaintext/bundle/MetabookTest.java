package ai.docsite.plaintext.bundle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.plaintext.convert.ConversionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetabookTest {

    @TempDir
    Path tempDir;

    @Test
    void readsCollectionManifest() throws IOException {
        Path file = Files.writeString(tempDir.resolve("metabook.json"), BundleFixtures.METABOOK);

        Metabook metabook = Metabook.read(file);

        assertThat(metabook.title()).isEqualTo("Sample");
        assertThat(metabook.lang()).isEqualTo("en");
        assertThat(metabook.items()).extracting(MetabookItem::title).containsExactly("First", "Second");
        assertThat(metabook.items().get(1).revision()).isEqualTo("202");
        assertThat(metabook.wikis()).extracting(Wiki::baseUrl).containsExactly("https://en.wikipedia.org/w");
        assertThat(metabook.hasChapters()).isFalse();
        assertThat(metabook.isSingleItem()).isFalse();
        assertThat(metabook.countItems()).isEqualTo(3);
    }

    @Test
    void singleUntitledArticleBorrowsItsTitle() {
        Metabook metabook = new Metabook(null, null, null, null,
                List.of(MetabookItem.article("Only", "1", 0)), List.of());

        assertThat(metabook.isSingleItem()).isTrue();
        assertThat(metabook.effectiveTitle()).isEqualTo("Only");
    }

    @Test
    void chaptersCountNestedItems() {
        Metabook metabook = new Metabook("Book", null, null, null, List.of(
                MetabookItem.chapter("One", List.of(MetabookItem.article("A", "1", 0), MetabookItem.article("B", "2", 0)))),
                List.of());

        assertThat(metabook.hasChapters()).isTrue();
        assertThat(metabook.isSingleItem()).isFalse();
        assertThat(metabook.countItems()).isEqualTo(4);
    }

    @Test
    void malformedManifestIsAnInputFailure() throws IOException {
        Path file = Files.writeString(tempDir.resolve("metabook.json"), "{ not json");

        assertThatThrownBy(() -> Metabook.read(file)).isInstanceOf(ConversionException.class);
    }
}

package com.launcher.linkbase.index;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.launcher.linkbase.link.Link;
import com.launcher.linkbase.link.LinkType;

/**
 * Unit tests for CategoryIndex.
 */
class CategoryIndexTest {

    private final CategoryIndex index = new CategoryIndex();

    private static Link app(String name) {
        return Link.builder()
                .sourcePath(Path.of("/usr/share/applications/" + name + ".desktop"))
                .type(LinkType.APPLICATION)
                .name(name)
                .exec(name)
                .build();
    }

    @Test
    void testLookupKeepsInsertionOrder() {
        Link editor = app("editor");
        Link calc = app("calc");

        index.add("Utility", editor);
        index.add("Utility", calc);
        index.add("Utility", editor);

        assertThat(index.lookup("Utility")).containsExactly(editor, calc);
        assertThat(index.contains("Utility", calc)).isTrue();
        assertThat(index.lookup("Office")).isEmpty();
    }

    @Test
    void testRemoveDropsEmptyCategory() {
        Link calc = app("calc");
        index.add("Office", calc);
        index.add("Utility", calc);

        assertThat(index.remove("Office", calc)).isTrue();
        assertThat(index.remove("Office", calc)).isFalse();
        assertThat(index.categories()).containsExactly("Utility");
    }

    @Test
    void testSameNameDifferentLinksAreDistinct() {
        Link first = app("calc");
        Link second = app("calc");
        index.add("Utility", first);
        index.add("Utility", second);

        index.remove("Utility", first);

        assertThat(index.lookup("Utility")).singleElement().isSameAs(second);
    }

    @Test
    void testClearKeepsReferences() {
        Link calc = app("calc");
        index.add("Utility", calc);

        index.clear();

        assertThat(index.categories()).isEmpty();
        assertThat(calc.getReferenceCount()).isEqualTo(1);
    }
}

package com.launcher.linkbase.link;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for DesktopEntryReader.
 */
class DesktopEntryReaderTest {

    private static final Path FILE = Path.of("test.desktop");

    private final DesktopEntryReader reader = new DesktopEntryReader();

    @Test
    void testGroupsAndKeys() throws LinkParseException {
        Map<String, Map<String, String>> groups = reader.read(FILE, List.of(
                "# leading comment",
                "[Desktop Entry]",
                "Name = Spaced",
                "Name[de]=Lokal",
                "Name=Duplicate ignored",
                "",
                "[Desktop Action x]",
                "Exec=x"));

        assertThat(groups).containsOnlyKeys("Desktop Entry", "Desktop Action x");
        assertThat(groups.get("Desktop Entry"))
                .containsEntry("Name", "Spaced")
                .containsEntry("Name[de]", "Lokal")
                .hasSize(2);
    }

    @Test
    void testMalformedLinesRejected() {
        assertThatThrownBy(() -> reader.read(FILE, List.of("Name=Before group")))
                .isInstanceOf(LinkParseException.class)
                .hasMessageContaining("outside of any group");
        assertThatThrownBy(() -> reader.read(FILE, List.of("[Desktop Entry]", "garbage")))
                .hasMessageContaining("line 2");
        assertThatThrownBy(() -> reader.read(FILE, List.of("[A]", "[A]")))
                .hasMessageContaining("duplicate group");
    }

    @Test
    void testSplitList() {
        assertThat(DesktopEntryReader.splitList("a;b;c;")).containsExactly("a", "b", "c");
        assertThat(DesktopEntryReader.splitList("a;b")).containsExactly("a", "b");
        assertThat(DesktopEntryReader.splitList("a\\;b;c")).containsExactly("a;b", "c");
        assertThat(DesktopEntryReader.splitList("")).isEmpty();
        assertThat(DesktopEntryReader.splitList(null)).isEmpty();
    }

    @Test
    void testUnescape() {
        assertThat(DesktopEntryReader.unescape("a\\sb\\tc\\\\d")).isEqualTo("a b\tc\\d");
        assertThat(DesktopEntryReader.unescape("trailing\\")).isEqualTo("trailing\\");
        assertThat(DesktopEntryReader.unescape("\\q")).isEqualTo("\\q");
        assertThat(DesktopEntryReader.unescape(null)).isNull();
    }
}

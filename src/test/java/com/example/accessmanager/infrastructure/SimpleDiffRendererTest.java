package com.example.accessmanager.infrastructure;

import com.example.accessmanager.application.DiffHeaders;
import com.example.accessmanager.domain.DiffEntry;
import com.example.accessmanager.domain.DiffResult;
import com.example.accessmanager.domain.bitwarden.Group;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleDiffRendererTest {

    private static final DiffHeaders HEADERS = new DiffHeaders("ADD:", "REMOVE:", "CHANGE:");

    private final SimpleDiffRenderer renderer = new SimpleDiffRenderer();

    @Test
    void emptyDiffRendersNothing() {
        assertThat(renderer.render(new DiffResult<Group>(List.of(), List.of(), List.of()), HEADERS))
                .isEmpty();
    }

    @Test
    void additionsAreIndentedUnderTheirHeader() {
        DiffResult<Group> diff =
                new DiffResult<>(
                        List.of(new Group("g1", "one", false), new Group("g2", "two", true)),
                        List.of(),
                        List.of());

        assertThat(renderer.render(diff, HEADERS))
                .containsExactly(
                        "ADD:",
                        "",
                        "  [[group]]",
                        "  group_id = \"g1\"",
                        "  group_name = \"one\"",
                        "  access_all = false",
                        "",
                        "  [[group]]",
                        "  group_id = \"g2\"",
                        "  group_name = \"two\"",
                        "  access_all = true",
                        "");
    }

    @Test
    void sectionsWithoutEntriesHaveNoHeader() {
        DiffResult<Group> diff =
                new DiffResult<>(List.of(), List.of(new Group("g1", "one", false)), List.of());

        List<String> lines = renderer.render(diff, HEADERS);

        assertThat(lines).startsWith("REMOVE:").doesNotContain("ADD:", "CHANGE:");
    }

    @Test
    void changesAreRenderedAsFullLineDiff() {
        Group actual = new Group("g1", "one", false);
        Group target = new Group("g1", "one", true);
        DiffResult<Group> diff = new DiffResult<>(List.of(), List.of(), List.of(new DiffEntry<>(actual, target)));

        assertThat(renderer.render(diff, HEADERS))
                .containsExactly(
                        "CHANGE:",
                        "",
                        "  [[group]]",
                        "  group_id = \"g1\"",
                        "  group_name = \"one\"",
                        "- access_all = false",
                        "+ access_all = true",
                        "");
    }

    @Test
    void replacedRunListsDeletionsBeforeInsertions() {
        List<String> lines = renderer.renderLineDiff("a\nb\nc\nd", "a\nx\ny\nd");

        assertThat(lines).containsExactly("  a", "- b", "- c", "+ x", "+ y", "  d");
    }

    @Test
    void longRunsOfEqualLinesAreNotAbbreviated() {
        StringBuilder actual = new StringBuilder();
        StringBuilder target = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            actual.append("line ").append(i).append('\n');
            target.append("line ").append(i).append('\n');
        }
        actual.append("old");
        target.append("new");

        List<String> lines = renderer.renderLineDiff(actual.toString(), target.toString());

        assertThat(lines).hasSize(52);
        assertThat(lines.get(0)).isEqualTo("  line 0");
        assertThat(lines.subList(50, 52)).containsExactly("- old", "+ new");
    }

    @Test
    void pureInsertionsAndDeletions() {
        assertThat(renderer.renderLineDiff("", "a\nb")).containsExactly("+ a", "+ b");
        assertThat(renderer.renderLineDiff("a\nb", "")).containsExactly("- a", "- b");
        assertThat(renderer.renderLineDiff("a\nc", "a\nb\nc")).containsExactly("  a", "+ b", "  c");
    }

    @Test
    void lineDiffReconstructsBothSides() {
        String actual = "[[team]]\nname = \"x\"\ndescription = \"\"\nparent = \"p\"\nkeep\nend";
        String target = "[[team]]\nname = \"y\"\nslug = \"x\"\ndescription = \"\"\nkeep\nextra\nend";

        List<String> lines = renderer.renderLineDiff(actual, target);

        assertThat(String.join("\n", strip(lines, "- "))).isEqualTo(actual);
        assertThat(String.join("\n", strip(lines, "+ "))).isEqualTo(target);
    }

    @Test
    void nullRenderingFailsFast() {
        assertThatThrownBy(() -> renderer.renderLineDiff(null, "a"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("actual");
        assertThatThrownBy(() -> renderer.renderLineDiff("a", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("target");
    }

    @Test
    void namesAreListedUnderHeader() {
        assertThat(renderer.renderNames("Members:", List.of("alice", "bob")))
                .containsExactly("Members:", "", "  alice", "  bob", "");
        assertThat(renderer.renderNames("Members:", List.of())).isEmpty();
    }

    private static List<String> strip(List<String> lines, String sidePrefix) {
        List<String> result = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("  ") || line.startsWith(sidePrefix)) {
                result.add(line.substring(2));
            }
        }
        return result;
    }
}

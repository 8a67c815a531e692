package com.example.accessmanager.infrastructure;

import com.example.accessmanager.application.DiffHeaders;
import com.example.accessmanager.application.DiffRenderer;
import com.example.accessmanager.domain.DiffEntry;
import com.example.accessmanager.domain.DiffResult;
import com.example.accessmanager.domain.Diffable;
import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders diffs as plain text. Changed entries are shown as a full line diff
 * with {@code "  "}, {@code "- "} and {@code "+ "} prefixes instead of a
 * unified diff with context windows.
 */
@Component
public class SimpleDiffRenderer implements DiffRenderer {
    private static final String INDENT = "  ";
    private static final String REMOVED = "- ";
    private static final String ADDED = "+ ";

    @Override
    public <T extends Diffable<T, ?>> List<String> render(DiffResult<T> diff, DiffHeaders headers) {
        List<String> out = new ArrayList<>();
        appendEntries(out, headers.toAdd(), diff.toAdd());
        appendEntries(out, headers.toRemove(), diff.toRemove());
        if (!diff.toChange().isEmpty()) {
            out.add(headers.toChange());
            for (DiffEntry<T> change : diff.toChange()) {
                out.add("");
                out.addAll(renderLineDiff(change.actual().render(), change.target().render()));
            }
            out.add("");
        }
        return out;
    }

    @Override
    public List<String> renderLineDiff(String actual, String target) {
        Objects.requireNonNull(actual, "actual rendering must not be null");
        Objects.requireNonNull(target, "target rendering must not be null");
        List<String> actualLines = splitLines(actual);
        List<String> targetLines = splitLines(target);
        Patch<String> patch = DiffUtils.diff(actualLines, targetLines, true);

        List<String> out = new ArrayList<>(actualLines.size() + targetLines.size());
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            List<String> source = delta.getSource().getLines();
            List<String> revised = delta.getTarget().getLines();
            switch (delta.getType()) {
                case EQUAL:
                    prefix(out, INDENT, source);
                    break;
                case DELETE:
                    prefix(out, REMOVED, source);
                    break;
                case INSERT:
                    prefix(out, ADDED, revised);
                    break;
                case CHANGE:
                    prefix(out, REMOVED, source);
                    prefix(out, ADDED, revised);
                    break;
                default:
                    throw new IllegalStateException("Invalid diff operation " + delta.getType());
            }
        }
        return out;
    }

    @Override
    public List<String> renderNames(String header, List<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>(names.size() + 3);
        out.add(header);
        out.add("");
        prefix(out, INDENT, names);
        out.add("");
        return out;
    }

    private <T extends Diffable<T, ?>> void appendEntries(List<String> out, String header, List<T> entries) {
        if (entries.isEmpty()) {
            return;
        }
        out.add(header);
        for (T entry : entries) {
            out.add("");
            prefix(out, INDENT, splitLines(entry.render()));
        }
        out.add("");
    }

    private static void prefix(List<String> out, String prefix, List<String> lines) {
        for (String line : lines) {
            out.add(prefix + line);
        }
    }

    static List<String> splitLines(String text) {
        return text.lines().collect(Collectors.toList());
    }
}

package fr.imt.scanzilla.scanzilla.business.model;

import java.util.List;

/**
 * Line diff between a workflow and its enhanced version. There is always exactly one
 * contiguous block of added lines.
 *
 * @param insertionStart 0-based index in the merged file of the first added line
 */
public record WorkflowDiff(List<DiffLine> lines, int insertionStart, int insertionLength) {

    public WorkflowDiff {
        lines = List.copyOf(lines);
    }

    public List<DiffLine> addedLines() {
        return lines.stream().filter(line -> line.type() == DiffLine.Type.ADDED).toList();
    }
}

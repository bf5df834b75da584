package fr.imt.scanzilla.scanzilla.business.model;

/**
 * One physical line of a workflow file: its content and the terminator that ended it
 * ({@code "\n"}, {@code "\r\n"}, {@code "\r"}, or empty for an unterminated last line).
 */
public record SourceLine(String content, String terminator) {

    public String raw() {
        return content + terminator;
    }

    public boolean isTerminated() {
        return !terminator.isEmpty();
    }
}

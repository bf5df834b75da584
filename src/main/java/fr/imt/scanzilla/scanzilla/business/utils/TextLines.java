package fr.imt.scanzilla.scanzilla.business.utils;

import fr.imt.scanzilla.scanzilla.business.model.SourceLine;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class TextLines {

    /**
     * Splits text on the line breaks YAML recognises: {@code \n}, {@code \r\n}, {@code \r},
     * U+0085, U+2028 and U+2029. Each terminator stays with its line, so joining the
     * {@link SourceLine#raw() raw} lines gives back the input exactly, and line numbers agree
     * with the marks of the YAML parser.
     */
    public static List<SourceLine> split(String text) {
        List<SourceLine> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (isLineBreak(c)) {
                int terminatorLength = c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n' ? 2 : 1;
                lines.add(new SourceLine(text.substring(start, i), text.substring(i, i + terminatorLength)));
                i += terminatorLength;
                start = i;
            } else {
                i++;
            }
        }
        if (start < text.length()) {
            lines.add(new SourceLine(text.substring(start), ""));
        }
        return lines;
    }

    /**
     * Whether {@code terminator} is one of {@code \n}, {@code \r\n} or {@code \r}.
     */
    public static boolean isCommonTerminator(String terminator) {
        return "\n".equals(terminator) || "\r\n".equals(terminator) || "\r".equals(terminator);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r' || c == '\u0085' || c == '\u2028' || c == '\u2029';
    }

    public static int leadingSpaces(String content) {
        int count = 0;
        while (count < content.length() && content.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    public static boolean isBlank(String content) {
        return content.isBlank();
    }

    public static boolean isComment(String content) {
        return content.stripLeading().startsWith("#");
    }
}

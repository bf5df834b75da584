package fr.imt.scanzilla.scanzilla.business.utils;

import java.util.regex.Pattern;

/**
 * A command pattern and the tool it identifies.
 */
public record ToolPattern(Pattern pattern, String tool) {

    static ToolPattern of(String regex, String tool) {
        return new ToolPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE), tool);
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}

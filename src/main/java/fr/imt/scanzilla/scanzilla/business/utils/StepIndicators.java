package fr.imt.scanzilla.scanzilla.business.utils;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed lookup tables used to classify workflow steps. All matching is case-insensitive.
 */
@UtilityClass
public class StepIndicators {

    public static final List<ToolPattern> BUILD_COMMANDS = List.of(
            ToolPattern.of("\\bmvnw?\\b.*\\b(compile|package|install|verify)\\b", "maven"),
            ToolPattern.of("\\bgradlew?\\b.*\\b(build|assemble)\\b", "gradle"),
            ToolPattern.of("\\bnpm\\s+(run\\s+build|build|install|ci)\\b", "npm"),
            ToolPattern.of("\\byarn(\\s+(install|build|run\\s+build))?\\s*$", "yarn"),
            ToolPattern.of("\\bdotnet\\s+build\\b", "dotnet"),
            ToolPattern.of("\\bgo\\s+build\\b", "go"),
            ToolPattern.of("\\bcargo\\s+build\\b", "cargo"),
            ToolPattern.of("\\bpip3?\\s+install\\b", "pip"),
            ToolPattern.of("(^|\\s)make(\\s|$)", "make")
    );

    public static final List<ToolPattern> TEST_COMMANDS = List.of(
            ToolPattern.of("\\bmvnw?\\b.*\\btest\\b", "maven"),
            ToolPattern.of("\\bgradlew?\\b.*\\btest\\b", "gradle"),
            ToolPattern.of("\\bnpm\\s+(run\\s+)?test\\b", "npm"),
            ToolPattern.of("\\byarn\\s+(run\\s+)?test\\b", "yarn"),
            ToolPattern.of("\\bpytest\\b", "pytest"),
            ToolPattern.of("\\bgo\\s+test\\b", "go"),
            ToolPattern.of("\\bcargo\\s+test\\b", "cargo"),
            ToolPattern.of("\\bdotnet\\s+test\\b", "dotnet"),
            ToolPattern.of("\\bjest\\b", "jest")
    );

    /**
     * Setup actions by action prefix, with the language they set up.
     */
    public static final Map<String, String> SETUP_ACTIONS = Map.of(
            "actions/setup-java", "java",
            "actions/setup-node", "javascript",
            "actions/setup-python", "python",
            "actions/setup-dotnet", "csharp",
            "actions/setup-go", "go",
            "ruby/setup-ruby", "ruby"
    );

    /**
     * Ordered: the first keyword found names the tool.
     */
    public static final List<ToolPattern> SECURITY_TOOLS = List.of(
            ToolPattern.of("polaris", "polaris"),
            ToolPattern.of("coverity", "coverity"),
            ToolPattern.of("black[-_ ]?duck", "blackduck"),
            ToolPattern.of("\\bsrm\\b|software[-_ ]risk[-_ ]manager", "srm"),
            ToolPattern.of("codeql", "codeql"),
            ToolPattern.of("snyk", "snyk"),
            ToolPattern.of("sonarqube|sonarsource|sonar-scanner", "sonarqube"),
            ToolPattern.of("owasp|dependency-check", "owasp")
    );

    /**
     * Input prefixes of the Black Duck security scan action. The action is shared by several
     * tools, so its inputs tell which one a step runs.
     */
    public static final Map<String, String> SCAN_INPUT_PREFIXES = Map.of(
            "polaris_", "polaris",
            "coverity_", "coverity",
            "blackducksca_", "blackduck",
            "srm_", "srm"
    );

    public static Optional<String> buildTool(String run) {
        return firstMatch(BUILD_COMMANDS, run);
    }

    public static boolean isTestCommand(String run) {
        return firstMatch(TEST_COMMANDS, run).isPresent();
    }

    public static Optional<String> setupLanguage(String uses) {
        if (uses == null) {
            return Optional.empty();
        }
        String action = uses.toLowerCase(Locale.ROOT);
        return SETUP_ACTIONS.entrySet().stream()
                .filter(entry -> action.startsWith(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * Also used on fragment categories, so {@code blackduck_sca} maps to the same tool as a
     * {@code blackduck-inc/...} action.
     */
    public static Optional<String> securityTool(String text) {
        return firstMatch(SECURITY_TOOLS, text);
    }

    /**
     * Tool named by the first {@code with:} input that carries a known prefix.
     */
    public static Optional<String> securityToolFromInputs(List<String> inputNames) {
        for (String input : inputNames) {
            String name = input.toLowerCase(Locale.ROOT);
            Optional<String> tool = SCAN_INPUT_PREFIXES.entrySet().stream()
                    .filter(entry -> name.startsWith(entry.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst();
            if (tool.isPresent()) {
                return tool;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstMatch(List<ToolPattern> patterns, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return patterns.stream()
                .filter(pattern -> pattern.matches(text))
                .map(ToolPattern::tool)
                .findFirst();
    }
}

package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AssessmentDecision;
import fr.imt.scanzilla.scanzilla.business.model.AssessmentResult;
import fr.imt.scanzilla.scanzilla.business.model.Confidence;
import fr.imt.scanzilla.scanzilla.business.model.PackageManagerSignal;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Decides which kinds of security analysis a repository needs.
 * Composition analysis follows dependency manifests, static analysis follows source languages;
 * when unsure the broader decision wins.
 */
@Service
public class AssessmentPolicy {

    public AssessmentResult decide(Collection<PackageManagerSignal> signals) {
        return decide(signals, List.of());
    }

    /**
     * @param languageHints languages seen elsewhere (workflow setup actions), used for the
     *                      primary language when no manifest names one
     */
    public AssessmentResult decide(Collection<PackageManagerSignal> signals, Collection<String> languageHints) {
        List<PackageManagerSignal> ordered = List.copyOf(signals);
        String primaryLanguage = primaryLanguage(ordered, languageHints);

        if (ordered.isEmpty()) {
            String reasoning = AssessmentResult.UNKNOWN_LANGUAGE.equals(primaryLanguage)
                    ? "No package manager or specific language detected. "
                    + "Recommend SAST for general source code security analysis."
                    : "No package manager detected, but " + primaryLanguage + " code identified. "
                    + "Recommend SAST only for source code analysis.";
            return new AssessmentResult(AssessmentDecision.SAST, Confidence.LOW, primaryLanguage, ordered, reasoning);
        }

        boolean composition = ordered.stream().anyMatch(PackageManagerSignal::managesDependencies);
        boolean staticAnalysis = ordered.stream().anyMatch(signal -> !signal.languages().isEmpty());
        AssessmentDecision decision = composition && !staticAnalysis ? AssessmentDecision.SCA : AssessmentDecision.SAST_SCA;

        String managers = ordered.stream().map(PackageManagerSignal::ecosystem).collect(Collectors.joining(", "));
        String files = ordered.stream().map(PackageManagerSignal::fileName).collect(Collectors.joining(", "));
        String reasoning = decision == AssessmentDecision.SAST_SCA
                ? "Package manager(s) detected (" + managers + "): " + files + ". "
                + "Recommend both SAST (for source code analysis) and SCA (for dependency vulnerability scanning)."
                : "Package manager(s) detected (" + managers + "): " + files + ". "
                + "Recommend SCA for dependency vulnerability scanning.";
        return new AssessmentResult(decision, Confidence.HIGH, primaryLanguage, ordered, reasoning);
    }

    private static String primaryLanguage(List<PackageManagerSignal> signals, Collection<String> languageHints) {
        return signals.stream()
                .flatMap(signal -> signal.languages().stream())
                .findFirst()
                .or(() -> languageHints.stream().findFirst().map(language -> language.toLowerCase(Locale.ROOT)))
                .orElse(AssessmentResult.UNKNOWN_LANGUAGE);
    }
}

package fr.imt.scanzilla.scanzilla.business.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record AssessmentResult(
        AssessmentDecision decision,
        Confidence confidence,
        String primaryLanguage,
        List<PackageManagerSignal> signals,
        String reasoning
) {

    public static final String UNKNOWN_LANGUAGE = "unknown";

    public AssessmentResult {
        signals = List.copyOf(signals);
    }

    public boolean isLowConfidence() {
        return confidence == Confidence.LOW;
    }

    public Set<String> languages() {
        Set<String> languages = new LinkedHashSet<>();
        signals.forEach(signal -> languages.addAll(signal.languages()));
        return languages;
    }

    public List<String> ecosystems() {
        return signals.stream().map(PackageManagerSignal::ecosystem).toList();
    }
}

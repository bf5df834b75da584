package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.PackageManagerSignal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SignalDetectorTest {

    private final SignalDetector detector = new SignalDetector();

    @Test
    void detect_JavaAndNodeManifests_RecordsBothEcosystems() {
        Set<PackageManagerSignal> signals = detector.detect(List.of(
                "README.md",
                "src/main/java/App.java",
                "pom.xml",
                "frontend/package.json",
                "frontend/package-lock.json"));

        assertThat(signals).extracting(PackageManagerSignal::ecosystem).containsExactly("maven", "npm");
        assertThat(signals).extracting(PackageManagerSignal::path).containsExactly("pom.xml", "frontend/package.json");
        assertThat(signals.iterator().next().languages()).containsExactly("java");
    }

    @Test
    void detect_SameEcosystemTwice_KeepsFirstPath() {
        Set<PackageManagerSignal> signals = detector.detect(List.of("module-a/pom.xml", "pom.xml", "settings.gradle"));

        assertThat(signals).extracting(PackageManagerSignal::path).containsExactly("module-a/pom.xml", "settings.gradle");
    }

    @Test
    void detect_ProjectFileExtension_MatchesNuget() {
        Set<PackageManagerSignal> signals = detector.detect(List.of("src/Api/Api.csproj"));

        assertThat(signals).singleElement().satisfies(signal -> {
            assertThat(signal.ecosystem()).isEqualTo("nuget");
            assertThat(signal.languages()).contains("csharp");
            assertThat(signal.fileName()).isEqualTo("Api.csproj");
        });
    }

    @Test
    void detect_MatchesBasenameOnly() {
        assertThat(detector.detect(List.of("docs/pom.xml.bak", "go.mod.txt", "notes/Gemfile"))).extracting(PackageManagerSignal::ecosystem)
                .containsExactly("bundler");
    }

    @Test
    void detect_NoManifest_ReturnsEmptySet() {
        assertThat(detector.detect(List.of("main.py", "README.md"))).isEmpty();
        assertThat(detector.detect(List.of())).isEmpty();
    }
}

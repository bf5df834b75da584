package fr.imt.scanzilla.scanzilla.business.utils;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@UtilityClass
public class ManifestCatalog {

    public static final List<ManifestRule> RULES = List.of(
            new ManifestRule("maven", Set.of("pom.xml"), Set.of(), List.of("java"), true),
            new ManifestRule("gradle",
                    Set.of("build.gradle", "build.gradle.kts", "settings.gradle", "settings.gradle.kts"),
                    Set.of(), List.of("java", "kotlin"), true),
            new ManifestRule("npm", Set.of("package.json", "package-lock.json"), Set.of(),
                    List.of("javascript", "typescript"), true),
            new ManifestRule("yarn", Set.of("yarn.lock"), Set.of(), List.of("javascript", "typescript"), true),
            new ManifestRule("pip",
                    Set.of("requirements.txt", "requirements-dev.txt", "setup.py", "pyproject.toml", "Pipfile"),
                    Set.of(), List.of("python"), true),
            new ManifestRule("nuget", Set.of("packages.config", "nuget.config"), Set.of(".csproj", ".sln"),
                    List.of("csharp", "dotnet"), true),
            new ManifestRule("composer", Set.of("composer.json", "composer.lock"), Set.of(), List.of("php"), true),
            new ManifestRule("cargo", Set.of("Cargo.toml", "Cargo.lock"), Set.of(), List.of("rust"), true),
            new ManifestRule("go_modules", Set.of("go.mod", "go.sum"), Set.of(), List.of("go"), true),
            new ManifestRule("bundler", Set.of("Gemfile", "Gemfile.lock"), Set.of(), List.of("ruby"), true)
    );

    public static Optional<ManifestRule> match(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        return RULES.stream().filter(rule -> rule.matches(fileName)).findFirst();
    }
}

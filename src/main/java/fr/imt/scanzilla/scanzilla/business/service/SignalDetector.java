package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.PackageManagerSignal;
import fr.imt.scanzilla.scanzilla.business.utils.ManifestCatalog;
import fr.imt.scanzilla.scanzilla.business.utils.ManifestRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
@Slf4j
public class SignalDetector {

    /**
     * Detect package ecosystems from repository file paths.
     * One signal per ecosystem: the first matching path, in the given order.
     */
    public Set<PackageManagerSignal> detect(Collection<String> filePaths) {
        Map<String, PackageManagerSignal> byEcosystem = new LinkedHashMap<>();
        for (String path : filePaths) {
            Optional<ManifestRule> rule = ManifestCatalog.match(path);
            if (rule.isEmpty() || byEcosystem.containsKey(rule.get().ecosystem())) {
                continue;
            }
            ManifestRule match = rule.get();
            byEcosystem.put(match.ecosystem(),
                    new PackageManagerSignal(path, match.ecosystem(), match.languages(), match.managesDependencies()));
        }
        log.debug("Detected ecosystems {} in {} path(s)", byEcosystem.keySet(), filePaths.size());
        return new LinkedHashSet<>(byEcosystem.values());
    }
}

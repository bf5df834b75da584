package fr.imt.scanzilla.scanzilla.business.port;

import fr.imt.scanzilla.scanzilla.business.model.RepositorySources;

public interface RepositorySourcePort {
    /**
     * @param repository {@code owner/name}
     * @throws fr.imt.scanzilla.scanzilla.exception.RepositoryFetchException when the repository cannot be read
     */
    RepositorySources fetch(String repository);
}

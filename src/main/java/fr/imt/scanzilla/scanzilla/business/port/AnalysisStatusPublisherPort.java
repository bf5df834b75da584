package fr.imt.scanzilla.scanzilla.business.port;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisStatus;

public interface AnalysisStatusPublisherPort {
    void publish(String batchId, String repository, AnalysisStatus status);
}

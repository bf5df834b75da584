package fr.imt.scanzilla.scanzilla.infrastructure.persistence.repository;

import fr.imt.scanzilla.scanzilla.infrastructure.persistence.TemplateFragmentDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TemplateFragmentRepository extends MongoRepository<TemplateFragmentDocument, String> {
}

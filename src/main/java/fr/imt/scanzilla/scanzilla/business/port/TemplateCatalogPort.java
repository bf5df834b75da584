package fr.imt.scanzilla.scanzilla.business.port;

import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;

import java.util.List;

public interface TemplateCatalogPort {
    List<TemplateFragment> findAll();
}

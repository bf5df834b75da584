package fr.imt.scanzilla.scanzilla.business.model;

public enum ScanCategory {
    SAST,
    SCA
}

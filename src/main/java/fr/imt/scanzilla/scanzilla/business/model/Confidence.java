package fr.imt.scanzilla.scanzilla.business.model;

public enum Confidence {
    HIGH,
    LOW
}

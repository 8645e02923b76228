package org.arcx.model;

public enum DdlObjectKind {
    FOREIGN_KEY,
    INDEX,
    TRIGGER,
    FUNCTION
}

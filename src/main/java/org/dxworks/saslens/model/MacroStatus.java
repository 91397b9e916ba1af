package org.dxworks.saslens.model;

public enum MacroStatus {
    INTERNAL_USED,
    INTERNAL_UNUSED
}

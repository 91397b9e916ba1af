package org.dxworks.saslens.model;

public enum CallKind {
    INTERNAL,  // callee defined in the same unit
    EXTERNAL
}

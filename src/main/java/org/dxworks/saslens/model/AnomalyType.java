package org.dxworks.saslens.model;

public enum AnomalyType {
    UNTERMINATED_COMMENT,
    UNTERMINATED_LITERAL,
    UNTERMINATED_STATEMENT,
    UNTERMINATED_MACRO,
    UNMATCHED_MACRO_END,
    MISMATCHED_MACRO_END,
    UNTERMINATED_QUERY_BLOCK,
    UNKNOWN_LIBRARY_ALIAS
}

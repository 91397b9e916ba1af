package org.dxworks.saslens.analyzer.segment;

public enum SegmentType {
    MACRO_DEFINITION,
    QUERY,  // PROC SQL ... QUIT
    TOP_LEVEL
}

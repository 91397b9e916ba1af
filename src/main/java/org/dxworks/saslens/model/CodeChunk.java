package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"index", "startOffset", "endOffset", "estimatedTokens", "oversized", "code"})
public class CodeChunk {
    public int index;
    public int startOffset;
    public int endOffset;
    public int estimatedTokens;
    public boolean oversized;  // a single statement or query block larger than the budget
    public String code;
}

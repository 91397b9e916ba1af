package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"index", "name", "placeholder", "startOffset", "endOffset", "estimatedTokens", "code"})
public class MacroChunk {
    public int index;
    public String name;
    public String placeholder;
    public int startOffset;
    public int endOffset;
    public int estimatedTokens;
    public String code;
}

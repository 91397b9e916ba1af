package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"maxTokenSize", "macros", "mainBodyChunks"})
public class ChunkedSource {
    public int maxTokenSize;
    public List<MacroChunk> macros = new ArrayList<>();
    public List<CodeChunk> mainBodyChunks = new ArrayList<>();
}

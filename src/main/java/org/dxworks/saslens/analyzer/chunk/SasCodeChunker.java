package org.dxworks.saslens.analyzer.chunk;

import org.dxworks.saslens.analyzer.segment.Segment;
import org.dxworks.saslens.analyzer.segment.SegmentType;
import org.dxworks.saslens.analyzer.segment.SegmentedSource;
import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.model.ChunkedSource;
import org.dxworks.saslens.model.CodeChunk;
import org.dxworks.saslens.model.MacroChunk;
import org.dxworks.saslens.model.MacroDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a unit into pieces that fit a token budget.
 *
 * Top-level macro definitions are lifted out whole and replaced in the main body by a placeholder
 * comment of the form {@code MACRO_<index>_<name>_<source>}. The main body is packed greedily
 * from atoms that are never split: single top-level statements and whole PROC SQL blocks.
 * An atom larger than the budget becomes a chunk of its own, flagged as oversized.
 */
public class SasCodeChunker {

    public static final int DEFAULT_MAX_TOKEN_SIZE = 4000;
    static final int CHARS_PER_TOKEN = 4;

    private final int maxTokenSize;
    private final String sourceName;

    public SasCodeChunker(int maxTokenSize, String sourceName) {
        if (maxTokenSize <= 0) {
            throw new IllegalArgumentException("maxTokenSize must be positive, got " + maxTokenSize);
        }
        this.maxTokenSize = maxTokenSize;
        this.sourceName = sourceName == null || sourceName.isBlank() ? "source" : sourceName;
    }

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public ChunkedSource chunk(SegmentedSource segmented) {
        String source = segmented.getSource();
        ChunkedSource out = new ChunkedSource();
        out.maxTokenSize = maxTokenSize;

        List<Atom> atoms = new ArrayList<>();
        for (Segment segment : segmented.getSegments()) {
            if (segment.getType() == SegmentType.MACRO_DEFINITION) {
                MacroChunk macro = macroChunk(source, segment.getMacro(), out.macros.size());
                out.macros.add(macro);
                String leading = source.substring(segment.getStart(), Math.max(segment.getStart(), macro.startOffset));
                atoms.add(new Atom(segment.getStart(), segment.getEnd(), leading + macro.placeholder));
            } else if (segment.getType() == SegmentType.QUERY) {
                atoms.add(new Atom(segment.getStart(), segment.getEnd(), segment.text(source)));
            } else {
                for (SasStatement statement : segment.getStatements()) {
                    atoms.add(new Atom(statement.getStart(), statement.getEnd(), statement.getText()));
                }
            }
        }

        pack(atoms, out.mainBodyChunks);
        return out;
    }

    private MacroChunk macroChunk(String source, MacroDefinition macro, int index) {
        MacroChunk chunk = new MacroChunk();
        chunk.index = index;
        chunk.name = macro.name;
        chunk.placeholder = placeholder(index, macro.name);
        chunk.startOffset = macro.startOffset;
        chunk.endOffset = macro.endOffset;
        chunk.code = source.substring(macro.startOffset, macro.endOffset);
        chunk.estimatedTokens = estimateTokens(chunk.code);
        return chunk;
    }

    String placeholder(int index, String macroName) {
        return "/* MACRO_" + index + "_" + macroName + "_" + sourceName + " */";
    }

    private void pack(List<Atom> atoms, List<CodeChunk> chunks) {
        StringBuilder current = new StringBuilder();
        int currentStart = -1;
        int currentEnd = -1;

        for (Atom atom : atoms) {
            int alone = estimateTokens(atom.text);
            if (alone > maxTokenSize) {
                emit(chunks, current, currentStart, currentEnd, false);
                current.setLength(0);
                currentStart = -1;
                StringBuilder single = new StringBuilder(atom.text);
                emit(chunks, single, atom.start, atom.end, true);
                continue;
            }
            if (current.length() > 0 && estimateTokens(current + atom.text) > maxTokenSize) {
                emit(chunks, current, currentStart, currentEnd, false);
                current.setLength(0);
                currentStart = -1;
            }
            if (currentStart < 0) currentStart = atom.start;
            current.append(atom.text);
            currentEnd = atom.end;
        }
        emit(chunks, current, currentStart, currentEnd, false);
    }

    private static void emit(List<CodeChunk> chunks, CharSequence code, int start, int end, boolean oversized) {
        String text = code.toString();
        if (text.isBlank()) return;
        CodeChunk chunk = new CodeChunk();
        chunk.index = chunks.size();
        chunk.startOffset = start;
        chunk.endOffset = end;
        chunk.code = text;
        chunk.estimatedTokens = estimateTokens(text);
        chunk.oversized = oversized;
        chunks.add(chunk);
    }

    private static final class Atom {
        final int start;
        final int end;
        final String text;

        Atom(int start, int end, String text) {
            this.start = start;
            this.end = end;
            this.text = text;
        }
    }
}

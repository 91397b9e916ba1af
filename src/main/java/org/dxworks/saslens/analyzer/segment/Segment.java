package org.dxworks.saslens.analyzer.segment;

import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.model.MacroDefinition;

import java.util.Collections;
import java.util.List;

/**
 * A run of consecutive top-level statements of one type. Segments tile the source in order.
 */
public final class Segment {

    private final SegmentType type;
    private final List<SasStatement> statements;
    private final MacroDefinition macro;
    private final QueryBlock queryBlock;

    Segment(SegmentType type, List<SasStatement> statements, MacroDefinition macro, QueryBlock queryBlock) {
        this.type = type;
        this.statements = Collections.unmodifiableList(statements);
        this.macro = macro;
        this.queryBlock = queryBlock;
    }

    public SegmentType getType() {
        return type;
    }

    public List<SasStatement> getStatements() {
        return statements;
    }

    public MacroDefinition getMacro() {
        return macro;
    }

    public QueryBlock getQueryBlock() {
        return queryBlock;
    }

    public int getStart() {
        return statements.get(0).getStart();
    }

    public int getEnd() {
        return statements.get(statements.size() - 1).getEnd();
    }

    public String text(String source) {
        return source.substring(getStart(), getEnd());
    }

    @Override
    public String toString() {
        String name = macro != null ? " " + macro.name : "";
        return type + name + "[" + getStart() + "," + getEnd() + ")";
    }
}

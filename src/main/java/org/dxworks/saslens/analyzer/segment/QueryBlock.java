package org.dxworks.saslens.analyzer.segment;

import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.model.MacroDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A PROC SQL block. {@link #getStatements()} holds the statements between the
 * {@code proc sql} header and the closing {@code quit}, both excluded.
 */
public final class QueryBlock {

    private final SasStatement header;
    private final MacroDefinition owner;
    private final List<SasStatement> statements = new ArrayList<>();
    private SasStatement closing;
    private int end;
    private int lastIndex;
    private boolean terminated;

    QueryBlock(SasStatement header, MacroDefinition owner) {
        this.header = header;
        this.owner = owner;
        this.end = header.getEnd();
        this.lastIndex = header.getIndex();
    }

    void add(SasStatement statement) {
        statements.add(statement);
        end = statement.getEnd();
        lastIndex = statement.getIndex();
    }

    void close(SasStatement quit) {
        closing = quit;
        end = quit.getEnd();
        lastIndex = quit.getIndex();
        terminated = true;
    }

    void cutOff(int offset) {
        end = Math.max(offset, header.getEnd());
        terminated = false;
    }

    public SasStatement getHeader() {
        return header;
    }

    /**
     * Enclosing macro definition, or null for a block at the top level.
     */
    public MacroDefinition getOwner() {
        return owner;
    }

    public List<SasStatement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public SasStatement getClosing() {
        return closing;
    }

    public int getStart() {
        return header.getCodeStart();
    }

    public int getEnd() {
        return end;
    }

    public int getFirstIndex() {
        return header.getIndex();
    }

    public int getLastIndex() {
        return lastIndex;
    }

    public boolean isTerminated() {
        return terminated;
    }
}

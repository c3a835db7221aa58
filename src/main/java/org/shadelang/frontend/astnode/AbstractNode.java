package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.PrintVisitor;

/**
 * Abstract base class for AST nodes that includes a tokenIndex pointing
 * back to the token list. This tokenIndex is used for providing better
 * error messages by pointing to the exact location in the source code.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor.
 */
public abstract class AbstractNode implements Node {
    public int tokenIndex;

    protected AbstractNode(int tokenIndex) {
        this.tokenIndex = tokenIndex;
    }

    @Override
    public int getIndex() {
        return tokenIndex;
    }

    /**
     * Returns an indented dump of the syntax tree below this node.
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}

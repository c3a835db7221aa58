package org.shadelang.frontend.astnode;

public enum LiteralKind {
    DECIMAL,
    INTEGER,
    BOOLEAN
}

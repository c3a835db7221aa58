package org.shadelang.runtime.runtimetypes;

/**
 * Kinds of failure that abort a compilation.
 */
public enum ErrorKind {
    /** Constant folding could not reduce a constant subexpression safely. */
    FOLDING,
    /** A symbol matches neither a local nor a global. */
    UNRESOLVED_SYMBOL,
    /** A call names neither a compiled function nor a builtin. */
    UNRESOLVED_FUNCTION,
    /** An expression or operator form the code generator does not lower. */
    UNSUPPORTED_EXPRESSION,
    /** A call whose arguments do not match the callee's parameters. */
    ARGUMENT_MISMATCH,
    /** A stored or returned value whose type differs from the target's declared type. */
    TYPE_MISMATCH,
    /** An offset or address that does not fit a 16-bit immediate. */
    OPERAND_OVERFLOW
}

package org.shadelang.backend.bytecode;

import org.shadelang.frontend.astnode.TypeKind;

/**
 * Storage assigned to one name.
 *
 * @param offset   byte offset in the static section or the function frame
 * @param isStatic true for globals (static section), false for frame locals
 * @param typeKind declared or inferred type
 */
public record SymbolMeta(int offset, boolean isStatic, TypeKind typeKind) {
}

package org.shadelang.frontend.astnode;

/**
 * Declared type of a parameter, local or expression.
 */
public enum TypeKind {
    F32("float"),
    I32("int"),
    BOOL("bool"),
    VEC3("vec3");

    private final String keyword;

    TypeKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The source keyword that names this type.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a type by its source keyword.
     *
     * @return the type, or null if the keyword names no type
     */
    public static TypeKind fromKeyword(String keyword) {
        for (TypeKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}

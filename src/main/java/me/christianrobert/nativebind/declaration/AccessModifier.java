package me.christianrobert.nativebind.declaration;

/**
 * Visibility level of a translated declaration.
 */
public enum AccessModifier {
    PUBLIC("public"),
    INTERNAL("internal"),
    PROTECTED("protected"),
    PROTECTED_AND_INTERNAL("private protected"),
    PROTECTED_OR_INTERNAL("protected internal"),
    PRIVATE("private");

    private final String keyword;

    AccessModifier(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Whether a declaration with this accessibility may appear directly at file/namespace scope.
     */
    public boolean isAllowedInNamespaceScope() {
        return this == PUBLIC || this == INTERNAL;
    }

    /**
     * Whether this accessibility relies on the protected scope construct.
     */
    public boolean isProtected() {
        return switch (this) {
            case PROTECTED, PROTECTED_AND_INTERNAL, PROTECTED_OR_INTERNAL -> true;
            case PUBLIC, INTERNAL, PRIVATE -> false;
        };
    }
}

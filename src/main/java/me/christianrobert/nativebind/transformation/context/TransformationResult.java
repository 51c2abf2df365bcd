package me.christianrobert.nativebind.transformation.context;

import me.christianrobert.nativebind.declaration.TranslatedDeclaration;

import java.util.List;

/**
 * Result of transforming one declaration: the ordered declarations that take its place in the parent's
 * child list.
 *
 * <ul>
 *   <li>one declaration, the same object as the input: unchanged</li>
 *   <li>one declaration: replaced (possibly by a different kind)</li>
 *   <li>zero or more declarations: spliced into the parent at the original position, zero meaning deletion</li>
 * </ul>
 */
public final class TransformationResult {

    private static final TransformationResult DELETE = new TransformationResult(List.of());

    private final List<TranslatedDeclaration> declarations;

    private TransformationResult(List<TranslatedDeclaration> declarations) {
        this.declarations = declarations;
    }

    public static TransformationResult of(TranslatedDeclaration declaration) {
        if (declaration == null) {
            throw new IllegalArgumentException("Declaration cannot be null, use delete() to remove a declaration");
        }
        return new TransformationResult(List.of(declaration));
    }

    public static TransformationResult ofAll(List<? extends TranslatedDeclaration> declarations) {
        if (declarations == null) {
            throw new IllegalArgumentException("Declarations cannot be null");
        }
        if (declarations.isEmpty()) {
            return DELETE;
        }
        // List.copyOf rejects null elements
        return new TransformationResult(List.copyOf(declarations));
    }

    public static TransformationResult delete() {
        return DELETE;
    }

    public List<TranslatedDeclaration> getDeclarations() {
        return declarations;
    }

    public int getCount() {
        return declarations.size();
    }

    public boolean isDelete() {
        return declarations.isEmpty();
    }

    public boolean isSingle() {
        return declarations.size() == 1;
    }

    /**
     * Gets the single replacement declaration.
     *
     * @throws IllegalStateException if the result does not hold exactly one declaration
     */
    public TranslatedDeclaration getSingle() {
        if (declarations.size() != 1) {
            throw new IllegalStateException("Result holds " + declarations.size() + " declarations, not exactly one");
        }
        return declarations.get(0);
    }

    /**
     * Whether this result keeps {@code original} exactly as it was.
     */
    public boolean isUnchanged(TranslatedDeclaration original) {
        return declarations.size() == 1 && declarations.get(0) == original;
    }

    @Override
    public String toString() {
        return "TransformationResult" + declarations;
    }
}

package me.christianrobert.nativebind.declaration.type;

import me.christianrobert.nativebind.declaration.DeclarationId;
import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;

/**
 * Reference to a declaration of the library (a record, an enum, a typedef, ...) by handle.
 *
 * <p>The reference survives rewrites of the target declaration because rewrites keep the handle.
 * Resolution always goes through a library snapshot, never through a cached declaration object.</p>
 */
public final class TranslatedTypeReference extends TypeReference {

    private final DeclarationId target;
    private final String displayName;

    public TranslatedTypeReference(DeclarationId target, String displayName) {
        if (target == null) {
            throw new IllegalArgumentException("Target declaration cannot be null");
        }
        this.target = target;
        this.displayName = displayName;
    }

    public static TranslatedTypeReference to(TranslatedDeclaration declaration) {
        return new TranslatedTypeReference(declaration.getId(), declaration.getName());
    }

    public DeclarationId getTarget() {
        return target;
    }

    /**
     * Resolves this reference against the given library.
     *
     * @return the current revision of the referenced declaration, or null when it is not part of the library
     */
    public TranslatedDeclaration tryResolve(TranslatedLibrary library) {
        return library.tryFind(target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return target == ((TranslatedTypeReference) o).target;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(target);
    }

    @Override
    public String toString() {
        return displayName == null || displayName.isEmpty() ? "`" + target + "`" : "`" + displayName + "`";
    }
}

package me.christianrobert.nativebind.transformation.context;

import me.christianrobert.nativebind.declaration.DeclarationKind;
import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only context handed to every rule invocation of a transformation.
 *
 * <p>Contains:
 * <ul>
 *   <li>The library snapshot the pass started from, for cross-tree lookups such as resolving a
 *       {@code TranslatedTypeReference}</li>
 *   <li>The ancestor chain from the root down to (not including) the declaration being transformed</li>
 * </ul>
 *
 * <p>Ancestors are the declarations as they were before the current pass rewrote them, so a child rule
 * sees its parent's original kind even when the parent's own rule later changes shape.</p>
 *
 * <p>Instances are immutable; {@link #add} returns a new context one level deeper.</p>
 */
public class TransformationContext {

    private final TranslatedLibrary library;
    private final List<TranslatedDeclaration> parents;

    /**
     * Creates a root-level context.
     *
     * @param library Library snapshot the transformation works on
     */
    public TransformationContext(TranslatedLibrary library) {
        this(library, Collections.emptyList());
    }

    private TransformationContext(TranslatedLibrary library, List<TranslatedDeclaration> parents) {
        if (library == null) {
            throw new IllegalArgumentException("Library cannot be null");
        }
        this.library = library;
        this.parents = parents;
    }

    public TranslatedLibrary getLibrary() {
        return library;
    }

    /**
     * Ancestors from the root (index 0) down to the immediate parent.
     */
    public List<TranslatedDeclaration> getParents() {
        return parents;
    }

    /**
     * Immediate parent, or null for root-level declarations.
     */
    public TranslatedDeclaration getParentDeclaration() {
        return parents.isEmpty() ? null : parents.get(parents.size() - 1);
    }

    public boolean isRoot() {
        return parents.isEmpty();
    }

    /**
     * Creates the context for the children of {@code parent}.
     */
    public TransformationContext add(TranslatedDeclaration parent) {
        if (parent == null) {
            throw new IllegalArgumentException("Parent cannot be null");
        }
        List<TranslatedDeclaration> newParents = new ArrayList<>(parents.size() + 1);
        newParents.addAll(parents);
        newParents.add(parent);
        return new TransformationContext(library, Collections.unmodifiableList(newParents));
    }

    /**
     * Whether the nearest enclosing declaration can host loose fields and methods.
     *
     * <p>Records are emitted as structs and synthesized containers as static types, both of which can hold
     * fields and methods. The file/namespace scope and every other parent kind cannot.</p>
     */
    public boolean isValidFieldOrMethodContext() {
        TranslatedDeclaration parent = getParentDeclaration();
        if (parent == null) {
            return false;
        }
        return parent.getKind() == DeclarationKind.RECORD
                || parent.getKind() == DeclarationKind.SYNTHESIZED_LOOSE_DECLARATIONS;
    }

    /**
     * Builds a readable path for a declaration in this context, e.g. {@code physics::Body.mass}.
     */
    public String describe(TranslatedDeclaration declaration) {
        StringBuilder path = new StringBuilder();
        TranslatedDeclaration outermost = parents.isEmpty() ? declaration : parents.get(0);
        if (outermost.getNamespace() != null && !outermost.getNamespace().isEmpty()) {
            path.append(outermost.getNamespace()).append("::");
        }
        for (TranslatedDeclaration parent : parents) {
            path.append(displayName(parent)).append('.');
        }
        path.append(displayName(declaration));
        return path.toString();
    }

    private static String displayName(TranslatedDeclaration declaration) {
        return declaration.getName().isEmpty() ? "<anonymous>" : declaration.getName();
    }

    @Override
    public String toString() {
        return "TransformationContext{depth=" + parents.size() + ", parent=" + getParentDeclaration() + "}";
    }
}

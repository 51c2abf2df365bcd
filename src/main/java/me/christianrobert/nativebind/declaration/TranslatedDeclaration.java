package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.metadata.DeclarationMetadata;
import me.christianrobert.nativebind.declaration.metadata.DeclarationMetadataItem;
import me.christianrobert.nativebind.diagnostic.Severity;
import me.christianrobert.nativebind.diagnostic.TranslationDiagnostic;

import java.util.Collections;
import java.util.List;

/**
 * Base class for every node of the translated declaration tree.
 *
 * <p><strong>Immutability:</strong> declarations are values with final fields. Every {@code with...}
 * method returns a new declaration that shares all untouched parts (children, diagnostics, metadata)
 * with the original. Called through a concrete kind, the {@code with...} methods return that kind
 * (see {@link AbstractTranslatedDeclaration}); called through this class they return a
 * {@code TranslatedDeclaration}.</p>
 *
 * <p><strong>Identity:</strong> the {@link DeclarationId} handle is carried over by every copy.
 * {@link #isSameDeclaration} compares handles, which is how rules ask "is this the record's designated
 * vtable" regardless of how many revisions either side went through.</p>
 *
 * <p><strong>Diagnostics:</strong> append-only. Entries are never removed or reordered.</p>
 */
public abstract class TranslatedDeclaration {

    private final DeclarationInfo info;

    TranslatedDeclaration(DeclarationInfo info) {
        this.info = info;
    }

    final DeclarationInfo getInfo() {
        return info;
    }

    public abstract DeclarationKind getKind();

    /**
     * Child declarations in order. Leaf declarations have none.
     */
    public List<TranslatedDeclaration> getChildren() {
        return Collections.emptyList();
    }

    public DeclarationId getId() {
        return info.getId();
    }

    public TranslatedFile getFile() {
        return info.getFile();
    }

    public String getName() {
        return info.getName();
    }

    /**
     * Namespace path (e.g. {@code "physics::collision"}), or null for the global namespace.
     * Independent of the parent chain.
     */
    public String getNamespace() {
        return info.getNamespace();
    }

    public AccessModifier getAccessibility() {
        return info.getAccessibility();
    }

    public List<TranslationDiagnostic> getDiagnostics() {
        return info.getDiagnostics();
    }

    public DeclarationMetadata getMetadata() {
        return info.getMetadata();
    }

    public boolean isSameDeclaration(TranslatedDeclaration other) {
        return other != null && other.getId() == getId();
    }

    public boolean hasErrors() {
        for (TranslationDiagnostic diagnostic : getDiagnostics()) {
            if (diagnostic.isError()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A declaration without Error diagnostics may be emitted; one with any Error must not be.
     */
    public boolean isEmittable() {
        return !hasErrors();
    }

    public boolean hasDiagnostic(Severity severity, String message) {
        return getDiagnostics().contains(new TranslationDiagnostic(severity, message));
    }

    // ========== Copy-on-write updates ==========

    public abstract TranslatedDeclaration withName(String newName);

    public abstract TranslatedDeclaration withNamespace(String newNamespace);

    public abstract TranslatedDeclaration withAccessibility(AccessModifier newAccessibility);

    public abstract TranslatedDeclaration withMetadata(DeclarationMetadataItem item);

    public abstract TranslatedDeclaration withDiagnostic(TranslationDiagnostic diagnostic);

    public abstract TranslatedDeclaration withDiagnostic(Severity severity, String message);

    public abstract TranslatedDeclaration withWarning(String message);

    public abstract TranslatedDeclaration withError(String message);

    /**
     * Same as {@link #withWarning} unless an equal warning is already attached, in which case this
     * declaration is returned.
     */
    public abstract TranslatedDeclaration withWarningOnce(String message);

    /**
     * Same as {@link #withError} unless an equal error is already attached, in which case this
     * declaration is returned.
     */
    public abstract TranslatedDeclaration withErrorOnce(String message);

    @Override
    public String toString() {
        String name = getName();
        String namespace = getNamespace();
        String displayName = name.isEmpty() ? "<anonymous>" : name;
        return getKind() + " " + (namespace == null ? displayName : namespace + "::" + displayName) + " " + getId();
    }
}

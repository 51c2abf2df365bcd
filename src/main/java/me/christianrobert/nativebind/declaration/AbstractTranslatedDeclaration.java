package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.metadata.DeclarationMetadataItem;
import me.christianrobert.nativebind.diagnostic.Severity;
import me.christianrobert.nativebind.diagnostic.TranslationDiagnostic;

/**
 * Implements the shared {@code with...} methods once for every declaration kind, returning the kind
 * itself ({@code SELF}) so that {@code record.withError(...)} is still a {@link TranslatedRecord}.
 *
 * @param <SELF> the concrete declaration class
 */
public abstract class AbstractTranslatedDeclaration<SELF extends AbstractTranslatedDeclaration<SELF>> extends TranslatedDeclaration {

    AbstractTranslatedDeclaration(DeclarationInfo info) {
        super(info);
    }

    /**
     * This declaration, typed as its own kind.
     */
    abstract SELF self();

    /**
     * Rebuilds this declaration with other shared properties, keeping every kind-specific one.
     */
    abstract SELF withInfo(DeclarationInfo newInfo);

    @Override
    public final SELF withName(String newName) {
        return withInfo(getInfo().withName(newName));
    }

    @Override
    public final SELF withNamespace(String newNamespace) {
        return withInfo(getInfo().withNamespace(newNamespace));
    }

    @Override
    public final SELF withAccessibility(AccessModifier newAccessibility) {
        return withInfo(getInfo().withAccessibility(newAccessibility));
    }

    @Override
    public final SELF withMetadata(DeclarationMetadataItem item) {
        return withInfo(getInfo().withMetadata(item));
    }

    @Override
    public final SELF withDiagnostic(TranslationDiagnostic diagnostic) {
        return withInfo(getInfo().withDiagnostic(diagnostic));
    }

    @Override
    public final SELF withDiagnostic(Severity severity, String message) {
        return withDiagnostic(new TranslationDiagnostic(severity, message));
    }

    @Override
    public final SELF withWarning(String message) {
        return withDiagnostic(Severity.WARNING, message);
    }

    @Override
    public final SELF withError(String message) {
        return withDiagnostic(Severity.ERROR, message);
    }

    @Override
    public final SELF withWarningOnce(String message) {
        return hasDiagnostic(Severity.WARNING, message) ? self() : withWarning(message);
    }

    @Override
    public final SELF withErrorOnce(String message) {
        return hasDiagnostic(Severity.ERROR, message) ? self() : withError(message);
    }
}

package me.christianrobert.nativebind.emission;

import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.transformation.context.TransformationContext;

/**
 * Code generation backend for verified declarations.
 *
 * <p>Implementations may rely on every invariant the verifier enforces and do not re-validate.</p>
 */
public interface DeclarationEmitter {

    /**
     * Emits one declaration. Called parent first; the context holds the emitted ancestors.
     */
    void emit(TranslatedDeclaration declaration, TransformationContext context);
}

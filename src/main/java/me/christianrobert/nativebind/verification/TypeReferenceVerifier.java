package me.christianrobert.nativebind.verification;

import me.christianrobert.nativebind.declaration.TranslatedBaseField;
import me.christianrobert.nativebind.declaration.TranslatedBitField;
import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedEnum;
import me.christianrobert.nativebind.declaration.TranslatedFunction;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.declaration.TranslatedNormalField;
import me.christianrobert.nativebind.declaration.TranslatedParameter;
import me.christianrobert.nativebind.declaration.TranslatedStaticField;
import me.christianrobert.nativebind.declaration.TranslatedTypedef;
import me.christianrobert.nativebind.declaration.type.FunctionPointerTypeReference;
import me.christianrobert.nativebind.declaration.type.PointerTypeReference;
import me.christianrobert.nativebind.declaration.type.TranslatedTypeReference;
import me.christianrobert.nativebind.declaration.type.TypeReference;
import me.christianrobert.nativebind.declaration.type.UnsupportedTypeReference;
import me.christianrobert.nativebind.transformation.TransformationBase;
import me.christianrobert.nativebind.transformation.context.TransformationContext;
import me.christianrobert.nativebind.transformation.context.TransformationResult;

/**
 * Second verification phase: checks every type reference against the fully rewritten library.
 *
 * <p>Runs after all per-declaration rules so that declarations deleted or extracted by earlier passes
 * are already gone. References are followed through pointers and function pointers.</p>
 */
public class TypeReferenceVerifier extends TransformationBase {

    @Override
    protected TransformationResult transformFunction(TransformationContext context, TranslatedFunction declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getReturnType()));
    }

    @Override
    protected TransformationResult transformParameter(TransformationContext context, TranslatedParameter declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getType()));
    }

    @Override
    protected TransformationResult transformNormalField(TransformationContext context, TranslatedNormalField declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getType()));
    }

    @Override
    protected TransformationResult transformBaseField(TransformationContext context, TranslatedBaseField declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getType()));
    }

    @Override
    protected TransformationResult transformBitField(TransformationContext context, TranslatedBitField declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getType()));
    }

    @Override
    protected TransformationResult transformStaticField(TransformationContext context, TranslatedStaticField declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getType()));
    }

    @Override
    protected TransformationResult transformTypedef(TransformationContext context, TranslatedTypedef declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getUnderlyingType()));
    }

    @Override
    protected TransformationResult transformEnum(TransformationContext context, TranslatedEnum declaration) {
        return TransformationResult.of(verify(context.getLibrary(), declaration, declaration.getUnderlyingType()));
    }

    private static TranslatedDeclaration verify(TranslatedLibrary library, TranslatedDeclaration declaration, TypeReference type) {
        if (type instanceof PointerTypeReference) {
            return verify(library, declaration, ((PointerTypeReference) type).getInner());
        }

        if (type instanceof FunctionPointerTypeReference) {
            FunctionPointerTypeReference functionPointer = (FunctionPointerTypeReference) type;
            TranslatedDeclaration result = verify(library, declaration, functionPointer.getReturnType());
            for (TypeReference parameterType : functionPointer.getParameterTypes()) {
                result = verify(library, result, parameterType);
            }
            return result;
        }

        if (type instanceof TranslatedTypeReference) {
            if (((TranslatedTypeReference) type).tryResolve(library) == null) {
                return declaration.withErrorOnce("Type reference " + type + " could not be resolved.");
            }
            return declaration;
        }

        if (type instanceof UnsupportedTypeReference) {
            return declaration.withErrorOnce("Type " + type + " is not supported.");
        }

        return declaration;
    }
}

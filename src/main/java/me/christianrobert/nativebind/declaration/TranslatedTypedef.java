package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.type.TypeReference;

/**
 * Type alias. Has no effect on emitted shape; rules resolve through it.
 */
public final class TranslatedTypedef extends AbstractTranslatedDeclaration<TranslatedTypedef> {

    private final TypeReference underlyingType;

    public TranslatedTypedef(TranslatedFile file, String name, TypeReference underlyingType) {
        this(new DeclarationInfo(file, name), underlyingType);
    }

    private TranslatedTypedef(DeclarationInfo info, TypeReference underlyingType) {
        super(info);
        if (underlyingType == null) {
            throw new IllegalArgumentException("Underlying type cannot be null");
        }
        this.underlyingType = underlyingType;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.TYPEDEF;
    }

    public TypeReference getUnderlyingType() {
        return underlyingType;
    }

    public TranslatedTypedef withUnderlyingType(TypeReference newUnderlyingType) {
        return new TranslatedTypedef(getInfo(), newUnderlyingType);
    }

    @Override
    TranslatedTypedef withInfo(DeclarationInfo newInfo) {
        return new TranslatedTypedef(newInfo, underlyingType);
    }

    @Override
    TranslatedTypedef self() {
        return this;
    }
}

package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.constant.ConstantValue;
import me.christianrobert.nativebind.declaration.type.TypeReference;

/**
 * A function parameter. Only valid as a direct child of a {@link TranslatedFunction}.
 */
public final class TranslatedParameter extends AbstractTranslatedDeclaration<TranslatedParameter> {

    private final TypeReference type;
    private final ConstantValue defaultValue;

    public TranslatedParameter(TranslatedFile file, String name, TypeReference type) {
        this(new DeclarationInfo(file, name), type, null);
    }

    private TranslatedParameter(DeclarationInfo info, TypeReference type, ConstantValue defaultValue) {
        super(info);
        if (type == null) {
            throw new IllegalArgumentException("Parameter type cannot be null");
        }
        this.type = type;
        this.defaultValue = defaultValue;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.PARAMETER;
    }

    public TypeReference getType() {
        return type;
    }

    /**
     * Default value from the native signature, or null when there is none.
     */
    public ConstantValue getDefaultValue() {
        return defaultValue;
    }

    public TranslatedParameter withType(TypeReference newType) {
        return new TranslatedParameter(getInfo(), newType, defaultValue);
    }

    public TranslatedParameter withDefaultValue(ConstantValue newDefaultValue) {
        return new TranslatedParameter(getInfo(), type, newDefaultValue);
    }

    @Override
    TranslatedParameter withInfo(DeclarationInfo newInfo) {
        return new TranslatedParameter(newInfo, type, defaultValue);
    }

    @Override
    TranslatedParameter self() {
        return this;
    }
}

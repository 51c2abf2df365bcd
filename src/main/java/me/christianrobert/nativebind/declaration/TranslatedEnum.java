package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.type.TypeReference;

import java.util.List;

/**
 * A native enum. Emitted either as a real target enum or, when {@link #isTranslateAsLooseConstants()}
 * is set, as a set of constant fields in the enclosing type.
 */
public final class TranslatedEnum extends AbstractTranslatedDeclaration<TranslatedEnum> {

    private final TypeReference underlyingType;
    private final List<TranslatedEnumConstant> values;
    private final boolean translateAsLooseConstants;

    public TranslatedEnum(TranslatedFile file, String name, TypeReference underlyingType) {
        this(new DeclarationInfo(file, name), underlyingType, List.of(), false);
    }

    private TranslatedEnum(DeclarationInfo info,
                           TypeReference underlyingType,
                           List<TranslatedEnumConstant> values,
                           boolean translateAsLooseConstants) {
        super(info);
        if (underlyingType == null) {
            throw new IllegalArgumentException("Underlying type cannot be null");
        }
        this.underlyingType = underlyingType;
        this.values = List.copyOf(values);
        this.translateAsLooseConstants = translateAsLooseConstants;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.ENUM;
    }

    @Override
    public List<TranslatedDeclaration> getChildren() {
        return List.copyOf(values);
    }

    public TypeReference getUnderlyingType() {
        return underlyingType;
    }

    public List<TranslatedEnumConstant> getValues() {
        return values;
    }

    public boolean isTranslateAsLooseConstants() {
        return translateAsLooseConstants;
    }

    public TranslatedEnum withValues(List<TranslatedEnumConstant> newValues) {
        return new TranslatedEnum(getInfo(), underlyingType, newValues, translateAsLooseConstants);
    }

    public TranslatedEnum withUnderlyingType(TypeReference newUnderlyingType) {
        return new TranslatedEnum(getInfo(), newUnderlyingType, values, translateAsLooseConstants);
    }

    public TranslatedEnum withTranslateAsLooseConstants(boolean newTranslateAsLooseConstants) {
        return new TranslatedEnum(getInfo(), underlyingType, values, newTranslateAsLooseConstants);
    }

    @Override
    TranslatedEnum withInfo(DeclarationInfo newInfo) {
        return new TranslatedEnum(newInfo, underlyingType, values, translateAsLooseConstants);
    }

    @Override
    TranslatedEnum self() {
        return this;
    }
}

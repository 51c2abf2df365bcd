package me.christianrobert.nativebind.declaration;

/**
 * One enumerator of a {@link TranslatedEnum}. Only valid as a direct child of an enum.
 */
public final class TranslatedEnumConstant extends AbstractTranslatedDeclaration<TranslatedEnumConstant> {

    private final long value;
    private final boolean hasExplicitValue;

    public TranslatedEnumConstant(TranslatedFile file, String name, long value, boolean hasExplicitValue) {
        this(new DeclarationInfo(file, name), value, hasExplicitValue);
    }

    public TranslatedEnumConstant(TranslatedFile file, String name, long value) {
        this(file, name, value, true);
    }

    private TranslatedEnumConstant(DeclarationInfo info, long value, boolean hasExplicitValue) {
        super(info);
        this.value = value;
        this.hasExplicitValue = hasExplicitValue;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.ENUM_CONSTANT;
    }

    public long getValue() {
        return value;
    }

    public boolean hasExplicitValue() {
        return hasExplicitValue;
    }

    public TranslatedEnumConstant withValue(long newValue) {
        return new TranslatedEnumConstant(getInfo(), newValue, true);
    }

    @Override
    TranslatedEnumConstant withInfo(DeclarationInfo newInfo) {
        return new TranslatedEnumConstant(newInfo, value, hasExplicitValue);
    }

    @Override
    TranslatedEnumConstant self() {
        return this;
    }
}

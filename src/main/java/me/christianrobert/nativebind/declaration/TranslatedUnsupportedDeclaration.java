package me.christianrobert.nativebind.declaration;

/**
 * Placeholder for a native construct the model cannot represent at all.
 *
 * <p>Must carry at least one Error diagnostic once verified.</p>
 */
public final class TranslatedUnsupportedDeclaration extends AbstractTranslatedDeclaration<TranslatedUnsupportedDeclaration> {

    private final String nativeKind;

    public TranslatedUnsupportedDeclaration(TranslatedFile file, String name, String nativeKind) {
        this(new DeclarationInfo(file, name), nativeKind);
    }

    private TranslatedUnsupportedDeclaration(DeclarationInfo info, String nativeKind) {
        super(info);
        this.nativeKind = nativeKind == null ? "unknown" : nativeKind;
    }

    /**
     * Front-end spelling of the unsupported construct (e.g. {@code "ClassTemplate"}).
     */
    public String getNativeKind() {
        return nativeKind;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.UNSUPPORTED_DECLARATION;
    }

    @Override
    TranslatedUnsupportedDeclaration withInfo(DeclarationInfo newInfo) {
        return new TranslatedUnsupportedDeclaration(newInfo, nativeKind);
    }

    @Override
    TranslatedUnsupportedDeclaration self() {
        return this;
    }
}

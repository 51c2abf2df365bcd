package me.christianrobert.nativebind.declaration;

import java.util.List;

/**
 * Container synthesized by a pass to give loose members (constants, functions, static fields) a type to
 * live in when their native scope has none. Emitted as a static container type.
 */
public final class SynthesizedLooseDeclarationsTypeDeclaration extends AbstractTranslatedDeclaration<SynthesizedLooseDeclarationsTypeDeclaration> {

    private final List<TranslatedDeclaration> members;

    public SynthesizedLooseDeclarationsTypeDeclaration(TranslatedFile file, String name, List<? extends TranslatedDeclaration> members) {
        this(new DeclarationInfo(file, name), members == null ? List.of() : members);
    }

    private SynthesizedLooseDeclarationsTypeDeclaration(DeclarationInfo info, List<? extends TranslatedDeclaration> members) {
        super(info);
        this.members = List.copyOf(members);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.SYNTHESIZED_LOOSE_DECLARATIONS;
    }

    @Override
    public List<TranslatedDeclaration> getChildren() {
        return members;
    }

    public List<TranslatedDeclaration> getMembers() {
        return members;
    }

    public SynthesizedLooseDeclarationsTypeDeclaration withMembers(List<? extends TranslatedDeclaration> newMembers) {
        return new SynthesizedLooseDeclarationsTypeDeclaration(getInfo(), newMembers);
    }

    @Override
    SynthesizedLooseDeclarationsTypeDeclaration withInfo(DeclarationInfo newInfo) {
        return new SynthesizedLooseDeclarationsTypeDeclaration(newInfo, members);
    }

    @Override
    SynthesizedLooseDeclarationsTypeDeclaration self() {
        return this;
    }
}

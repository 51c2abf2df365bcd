package me.christianrobert.nativebind.transformation.common;

import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.transformation.TransformationBase;
import me.christianrobert.nativebind.transformation.context.TransformationContext;
import me.christianrobert.nativebind.transformation.context.TransformationResult;

import java.util.function.BiPredicate;

/**
 * Deletes every declaration matching a predicate, together with its subtree.
 *
 * <p>The predicate sees declarations after their children were rewritten, so removing a child never
 * prevents the parent from being matched.</p>
 */
public class RemoveDeclarationsPass extends TransformationBase {

    private final String name;
    private final BiPredicate<TransformationContext, TranslatedDeclaration> predicate;

    public RemoveDeclarationsPass(String name, BiPredicate<TransformationContext, TranslatedDeclaration> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("Predicate cannot be null");
        }
        this.name = name;
        this.predicate = predicate;
    }

    @Override
    public String getName() {
        return name == null ? super.getName() : name;
    }

    @Override
    protected TransformationResult transformDeclaration(TransformationContext context, TranslatedDeclaration declaration) {
        if (predicate.test(context, declaration)) {
            return TransformationResult.delete();
        }
        return super.transformDeclaration(context, declaration);
    }
}

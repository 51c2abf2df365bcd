package me.christianrobert.nativebind.transformation;

import me.christianrobert.nativebind.declaration.DeclarationId;
import me.christianrobert.nativebind.declaration.SynthesizedLooseDeclarationsTypeDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedBaseField;
import me.christianrobert.nativebind.declaration.TranslatedBitField;
import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedEnum;
import me.christianrobert.nativebind.declaration.TranslatedEnumConstant;
import me.christianrobert.nativebind.declaration.TranslatedField;
import me.christianrobert.nativebind.declaration.TranslatedFunction;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.declaration.TranslatedNormalField;
import me.christianrobert.nativebind.declaration.TranslatedParameter;
import me.christianrobert.nativebind.declaration.TranslatedRecord;
import me.christianrobert.nativebind.declaration.TranslatedStaticField;
import me.christianrobert.nativebind.declaration.TranslatedTypedef;
import me.christianrobert.nativebind.declaration.TranslatedUndefinedRecord;
import me.christianrobert.nativebind.declaration.TranslatedUnimplementedField;
import me.christianrobert.nativebind.declaration.TranslatedUnsupportedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedVTable;
import me.christianrobert.nativebind.declaration.TranslatedVTableField;
import me.christianrobert.nativebind.transformation.context.TransformationContext;
import me.christianrobert.nativebind.transformation.context.TransformationException;
import me.christianrobert.nativebind.transformation.context.TransformationResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Generic rewriting engine over the translated declaration tree.
 *
 * <p>A pass extends this class and overrides the {@code transformXxx} hooks for the kinds it cares about.
 * Every hook defaults to keeping the declaration as it is, so a pass only spells out its own rules.</p>
 *
 * <h3>Traversal</h3>
 * <pre>
 * transform(library)
 *   preTransformLibrary(library)
 *   for each root declaration, recursively:
 *     1. rewrite every child with the ORIGINAL declaration pushed onto the context
 *     2. splice each child's result (0..n declarations) into the new child list
 *     3. transformDeclaration(context, declarationWithRewrittenChildren)
 *          → transformRecord / transformEnum / ... / transformField → transformNormalField / ...
 *   postTransformLibrary(rewrittenLibrary)      (whole-library phase)
 * </pre>
 *
 * <p>Children are rewritten before their parent's own rule runs, so a parent rule sees final child names
 * while a child rule still sees the parent's original kind in its context.</p>
 *
 * <p>Nothing is modified in place. When no rule replaces anything the exact same library instance is
 * returned.</p>
 *
 * <p>A handle appears at most once per child list. A rule that returns several copies of the same
 * declaration fails the pass, since copies share the handle that designated slots are matched by.</p>
 */
public abstract class TransformationBase {

    /**
     * Name used in logs and error messages.
     */
    public String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Runs the per-declaration phase over the whole tree, then the whole-library phase.
     */
    public final TranslatedLibrary transform(TranslatedLibrary library) {
        if (library == null) {
            throw new IllegalArgumentException("Library cannot be null");
        }
        TranslatedLibrary prepared = preTransformLibrary(library);
        TranslatedLibrary rewritten = transformRootDeclarations(prepared);
        return postTransformLibrary(rewritten);
    }

    /**
     * Hook running before any declaration is visited.
     */
    protected TranslatedLibrary preTransformLibrary(TranslatedLibrary library) {
        return library;
    }

    /**
     * Whole-library phase. Receives the complete output of the per-declaration phase as a read-only
     * snapshot; overriding passes typically run a second transformation over it.
     */
    protected TranslatedLibrary postTransformLibrary(TranslatedLibrary library) {
        return library;
    }

    private TranslatedLibrary transformRootDeclarations(TranslatedLibrary library) {
        TransformationContext context = new TransformationContext(library);
        List<TranslatedDeclaration> rewritten = transformList(context, library.getDeclarations());
        return rewritten == null ? library : library.withDeclarations(rewritten);
    }

    // ==================== RECURSION ====================

    /**
     * Rewrites the children of {@code declaration}, then applies this pass's rules to it.
     */
    protected final TransformationResult transformRecursively(TransformationContext context, TranslatedDeclaration declaration) {
        TranslatedDeclaration withChildren = transformChildren(context, declaration);
        TransformationResult result = transformDeclaration(context, withChildren);
        if (result == null) {
            throw new TransformationException("Transformation returned no result", getName(), context.describe(declaration));
        }
        return result;
    }

    /**
     * @return the rewritten list, or null when every declaration was kept as is
     */
    private List<TranslatedDeclaration> transformList(TransformationContext context, List<TranslatedDeclaration> declarations) {
        List<TranslatedDeclaration> rewritten = new ArrayList<>(declarations.size());
        Set<DeclarationId> handles = new HashSet<>();
        boolean changed = false;

        for (TranslatedDeclaration declaration : declarations) {
            TransformationResult result = transformRecursively(context, declaration);
            changed |= !result.isUnchanged(declaration);
            for (TranslatedDeclaration replacement : result.getDeclarations()) {
                requireUniqueHandle(handles, replacement, context, declaration);
                rewritten.add(replacement);
            }
        }

        return changed ? rewritten : null;
    }

    private TranslatedDeclaration transformChildren(TransformationContext context, TranslatedDeclaration declaration) {
        return switch (declaration.getKind()) {
            case RECORD -> transformRecordChildren(context.add(declaration), (TranslatedRecord) declaration);
            case ENUM -> transformEnumChildren(context.add(declaration), (TranslatedEnum) declaration);
            case FUNCTION -> transformFunctionChildren(context.add(declaration), (TranslatedFunction) declaration);
            case SYNTHESIZED_LOOSE_DECLARATIONS -> transformSynthesizedChildren(context.add(declaration), (SynthesizedLooseDeclarationsTypeDeclaration) declaration);
            case ENUM_CONSTANT, PARAMETER, NORMAL_FIELD, BASE_FIELD, VTABLE_FIELD, BIT_FIELD, UNIMPLEMENTED_FIELD,
                 STATIC_FIELD, VTABLE, TYPEDEF, UNDEFINED_RECORD, UNSUPPORTED_DECLARATION -> declaration;
        };
    }

    /**
     * Rewrites record members and keeps the designated vtable, vtable field and non-virtual base field
     * pointing at the current revision of their member. A designated member that was deleted (or replaced
     * by nothing of its kind) leaves its slot empty; one replaced by several declarations designates the
     * first declaration of the slot's kind.
     */
    private TranslatedDeclaration transformRecordChildren(TransformationContext childContext, TranslatedRecord record) {
        List<TranslatedDeclaration> newMembers = new ArrayList<>(record.getMembers().size());
        Set<DeclarationId> handles = new HashSet<>();
        boolean changed = false;

        TranslatedVTable vTable = record.getVTable();
        TranslatedVTableField vTableField = record.getVTableField();
        TranslatedBaseField nonVirtualBaseField = record.getNonVirtualBaseField();

        for (TranslatedDeclaration member : record.getMembers()) {
            TransformationResult result = transformRecursively(childContext, member);
            changed |= !result.isUnchanged(member);
            for (TranslatedDeclaration replacement : result.getDeclarations()) {
                requireUniqueHandle(handles, replacement, childContext, member);
                newMembers.add(replacement);
            }

            if (member.isSameDeclaration(record.getVTable())) {
                vTable = firstOfType(result, TranslatedVTable.class);
            }
            if (member.isSameDeclaration(record.getVTableField())) {
                vTableField = firstOfType(result, TranslatedVTableField.class);
            }
            if (member.isSameDeclaration(record.getNonVirtualBaseField())) {
                nonVirtualBaseField = firstOfType(result, TranslatedBaseField.class);
            }
        }

        if (!changed) {
            return record;
        }

        return record.withMembers(newMembers)
                .withVTable(vTable)
                .withVTableField(vTableField)
                .withNonVirtualBaseField(nonVirtualBaseField);
    }

    private TranslatedDeclaration transformEnumChildren(TransformationContext childContext, TranslatedEnum declaration) {
        List<TranslatedEnumConstant> values = transformTypedChildren(childContext, declaration, declaration.getValues(), TranslatedEnumConstant.class);
        return values == null ? declaration : declaration.withValues(values);
    }

    private TranslatedDeclaration transformFunctionChildren(TransformationContext childContext, TranslatedFunction declaration) {
        List<TranslatedParameter> parameters = transformTypedChildren(childContext, declaration, declaration.getParameters(), TranslatedParameter.class);
        return parameters == null ? declaration : declaration.withParameters(parameters);
    }

    private TranslatedDeclaration transformSynthesizedChildren(TransformationContext childContext, SynthesizedLooseDeclarationsTypeDeclaration declaration) {
        List<TranslatedDeclaration> members = transformList(childContext, declaration.getMembers());
        return members == null ? declaration : declaration.withMembers(members);
    }

    /**
     * Rewrites children of a parent that only accepts one child type.
     *
     * @return the rewritten children, or null when every child was kept as is
     */
    private <T extends TranslatedDeclaration> List<T> transformTypedChildren(TransformationContext childContext,
                                                                             TranslatedDeclaration parent,
                                                                             List<T> children,
                                                                             Class<T> childType) {
        List<T> rewritten = new ArrayList<>(children.size());
        Set<DeclarationId> handles = new HashSet<>();
        boolean changed = false;

        for (T child : children) {
            TransformationResult result = transformRecursively(childContext, child);
            changed |= !result.isUnchanged(child);

            for (TranslatedDeclaration replacement : result.getDeclarations()) {
                if (!childType.isInstance(replacement)) {
                    throw new TransformationException(
                            "Children of " + parent.getKind() + " declarations must be " + childType.getSimpleName()
                                    + ", but the transformation produced " + replacement.getKind(),
                            getName(), childContext.describe(child));
                }
                requireUniqueHandle(handles, replacement, childContext, child);
                rewritten.add(childType.cast(replacement));
            }
        }

        return changed ? rewritten : null;
    }

    private void requireUniqueHandle(Set<DeclarationId> handles,
                                     TranslatedDeclaration replacement,
                                     TransformationContext context,
                                     TranslatedDeclaration source) {
        if (!handles.add(replacement.getId())) {
            throw new TransformationException(
                    "Transformation produced " + replacement.getKind() + " " + replacement.getId()
                            + " more than once in the same declaration list",
                    getName(), context.describe(source));
        }
    }

    private static <T extends TranslatedDeclaration> T firstOfType(TransformationResult result, Class<T> type) {
        for (TranslatedDeclaration declaration : result.getDeclarations()) {
            if (type.isInstance(declaration)) {
                return type.cast(declaration);
            }
        }
        return null;
    }

    // ==================== DISPATCH ====================

    /**
     * Entry hook for every declaration, called after its children were rewritten. Overrides typically
     * apply kind-independent rules and then delegate to {@code super} for the per-kind dispatch.
     */
    protected TransformationResult transformDeclaration(TransformationContext context, TranslatedDeclaration declaration) {
        return switch (declaration.getKind()) {
            case RECORD -> transformRecord(context, (TranslatedRecord) declaration);
            case ENUM -> transformEnum(context, (TranslatedEnum) declaration);
            case ENUM_CONSTANT -> transformEnumConstant(context, (TranslatedEnumConstant) declaration);
            case FUNCTION -> transformFunction(context, (TranslatedFunction) declaration);
            case PARAMETER -> transformParameter(context, (TranslatedParameter) declaration);
            case NORMAL_FIELD, BASE_FIELD, VTABLE_FIELD, BIT_FIELD, UNIMPLEMENTED_FIELD -> transformField(context, (TranslatedField<?>) declaration);
            case STATIC_FIELD -> transformStaticField(context, (TranslatedStaticField) declaration);
            case VTABLE -> transformVTable(context, (TranslatedVTable) declaration);
            case TYPEDEF -> transformTypedef(context, (TranslatedTypedef) declaration);
            case UNDEFINED_RECORD -> transformUndefinedRecord(context, (TranslatedUndefinedRecord) declaration);
            case UNSUPPORTED_DECLARATION -> transformUnsupportedDeclaration(context, (TranslatedUnsupportedDeclaration) declaration);
            case SYNTHESIZED_LOOSE_DECLARATIONS -> transformSynthesizedLooseDeclarations(context, (SynthesizedLooseDeclarationsTypeDeclaration) declaration);
        };
    }

    /**
     * Hook shared by all instance field kinds; dispatches to the specific field hook.
     */
    protected TransformationResult transformField(TransformationContext context, TranslatedField<?> declaration) {
        return switch (declaration.getKind()) {
            case NORMAL_FIELD -> transformNormalField(context, (TranslatedNormalField) declaration);
            case BASE_FIELD -> transformBaseField(context, (TranslatedBaseField) declaration);
            case VTABLE_FIELD -> transformVTableField(context, (TranslatedVTableField) declaration);
            case BIT_FIELD -> transformBitField(context, (TranslatedBitField) declaration);
            case UNIMPLEMENTED_FIELD -> transformUnimplementedField(context, (TranslatedUnimplementedField) declaration);
            case RECORD, ENUM, ENUM_CONSTANT, FUNCTION, PARAMETER, STATIC_FIELD, VTABLE, TYPEDEF, UNDEFINED_RECORD,
                 UNSUPPORTED_DECLARATION, SYNTHESIZED_LOOSE_DECLARATIONS ->
                    throw new TransformationException(declaration.getKind() + " is not an instance field kind",
                            getName(), context.describe(declaration));
        };
    }

    protected TransformationResult transformRecord(TransformationContext context, TranslatedRecord declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformEnum(TransformationContext context, TranslatedEnum declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformEnumConstant(TransformationContext context, TranslatedEnumConstant declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformFunction(TransformationContext context, TranslatedFunction declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformParameter(TransformationContext context, TranslatedParameter declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformNormalField(TransformationContext context, TranslatedNormalField declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformBaseField(TransformationContext context, TranslatedBaseField declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformVTableField(TransformationContext context, TranslatedVTableField declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformBitField(TransformationContext context, TranslatedBitField declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformUnimplementedField(TransformationContext context, TranslatedUnimplementedField declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformStaticField(TransformationContext context, TranslatedStaticField declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformVTable(TransformationContext context, TranslatedVTable declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformTypedef(TransformationContext context, TranslatedTypedef declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformUndefinedRecord(TransformationContext context, TranslatedUndefinedRecord declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformUnsupportedDeclaration(TransformationContext context, TranslatedUnsupportedDeclaration declaration) {
        return TransformationResult.of(declaration);
    }

    protected TransformationResult transformSynthesizedLooseDeclarations(TransformationContext context, SynthesizedLooseDeclarationsTypeDeclaration declaration) {
        return TransformationResult.of(declaration);
    }
}

package me.christianrobert.nativebind.verification;

import me.christianrobert.nativebind.declaration.AccessModifier;
import me.christianrobert.nativebind.declaration.DeclarationKind;
import me.christianrobert.nativebind.declaration.SynthesizedLooseDeclarationsTypeDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedBaseField;
import me.christianrobert.nativebind.declaration.TranslatedBitField;
import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedEnum;
import me.christianrobert.nativebind.declaration.TranslatedEnumConstant;
import me.christianrobert.nativebind.declaration.TranslatedField;
import me.christianrobert.nativebind.declaration.TranslatedFunction;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.declaration.TranslatedParameter;
import me.christianrobert.nativebind.declaration.TranslatedRecord;
import me.christianrobert.nativebind.declaration.TranslatedStaticField;
import me.christianrobert.nativebind.declaration.TranslatedTypedef;
import me.christianrobert.nativebind.declaration.TranslatedUnimplementedField;
import me.christianrobert.nativebind.declaration.TranslatedUnsupportedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedVTable;
import me.christianrobert.nativebind.declaration.abi.ArgumentInfo;
import me.christianrobert.nativebind.declaration.abi.ArrangedFunctionFlag;
import me.christianrobert.nativebind.declaration.abi.FunctionAbi;
import me.christianrobert.nativebind.declaration.abi.LlvmCallingConvention;
import me.christianrobert.nativebind.declaration.constant.StringConstant;
import me.christianrobert.nativebind.declaration.constant.UnsupportedConstantExpression;
import me.christianrobert.nativebind.declaration.metadata.ProjectedAsBuiltinType;
import me.christianrobert.nativebind.declaration.metadata.SetLastErrorFunction;
import me.christianrobert.nativebind.declaration.type.BuiltinTypeReference;
import me.christianrobert.nativebind.declaration.type.FunctionPointerTypeReference;
import me.christianrobert.nativebind.declaration.type.PointerTypeReference;
import me.christianrobert.nativebind.declaration.type.TargetBuiltinType;
import me.christianrobert.nativebind.declaration.type.TranslatedTypeReference;
import me.christianrobert.nativebind.declaration.type.TypeReference;
import me.christianrobert.nativebind.transformation.TransformationBase;
import me.christianrobert.nativebind.transformation.context.TransformationContext;
import me.christianrobert.nativebind.transformation.context.TransformationResult;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Final pass before emission: enforces that every declaration can be represented in the target language.
 *
 * <p>Declarations that cannot be represented are tagged with an Error diagnostic and left in the tree so the
 * rest of the library is still checked. Constructs that only have an approximate representation are
 * rewritten to the fallback and tagged with a Warning.</p>
 *
 * <p>Each diagnostic is added at most once per declaration, so running the verifier over its own output
 * changes nothing. The whole-library phase checks type references with {@link TypeReferenceVerifier}.</p>
 */
public class TranslationVerifier extends TransformationBase {

    private final TypeReferenceVerifier typeReferenceVerifier = new TypeReferenceVerifier();

    @Override
    protected TranslatedLibrary postTransformLibrary(TranslatedLibrary library) {
        return typeReferenceVerifier.transform(library);
    }

    // ==================== ACCESSIBILITY ====================

    @Override
    protected TransformationResult transformDeclaration(TransformationContext context, TranslatedDeclaration declaration) {
        // Root declarations end up in a file/namespace scope
        if (context.isRoot() && !declaration.getAccessibility().isAllowedInNamespaceScope()) {
            String message = "Declaration translated as " + declaration.getAccessibility().getKeyword()
                    + ", but it will be translated into a file/namespace scope. Accessibility forced to internal.";
            declaration = declaration.withAccessibility(AccessModifier.INTERNAL);
            declaration = declaration.withWarning(message);
        }

        // Everything is emitted as structs and static containers, neither of which supports protected
        if (declaration.getAccessibility().isProtected()) {
            String message = "Declaration translated as " + declaration.getAccessibility().getKeyword()
                    + ", but protected isn't supported yet. Accessibility forced to internal.";
            declaration = declaration.withAccessibility(AccessModifier.INTERNAL);
            declaration = declaration.withWarning(message);
        }

        return super.transformDeclaration(context, declaration);
    }

    // ==================== ENUMS ====================

    @Override
    protected TransformationResult transformEnum(TransformationContext context, TranslatedEnum declaration) {
        boolean canBeFields = context.isValidFieldOrMethodContext();
        boolean canBeEnum = declaration.getUnderlyingType() instanceof BuiltinTypeReference
                && ((BuiltinTypeReference) declaration.getUnderlyingType()).getType().isValidUnderlyingEnumType();

        if (!canBeFields && !canBeEnum) {
            TranslatedEnum looseEnum = declaration.withTranslateAsLooseConstants(true);
            looseEnum = looseEnum.withWarning("Enum can't be translated as a target enum or as loose constants, "
                    + "and was wrapped in a loose declaration container.");

            SynthesizedLooseDeclarationsTypeDeclaration wrapper =
                    new SynthesizedLooseDeclarationsTypeDeclaration(declaration.getFile(), declaration.getName(), List.of(looseEnum));
            wrapper = wrapper.withNamespace(declaration.getNamespace());
            wrapper = wrapper.withAccessibility(declaration.getAccessibility());
            return TransformationResult.of(wrapper);
        } else if (declaration.isTranslateAsLooseConstants() && !canBeFields) {
            TranslatedEnum result = declaration.withTranslateAsLooseConstants(false);
            result = result.withWarning("Enums outside of a field declaration context cannot be translated as loose constants.");
            return TransformationResult.of(result);
        } else if (!declaration.isTranslateAsLooseConstants() && !canBeEnum) {
            TranslatedEnum result = declaration.withTranslateAsLooseConstants(true);
            result = result.withWarning("Enum declaration had an underlying type of '" + declaration.getUnderlyingType()
                    + "', which is not supported by the target language.");
            return TransformationResult.of(result);
        }

        return super.transformEnum(context, declaration);
    }

    @Override
    protected TransformationResult transformEnumConstant(TransformationContext context, TranslatedEnumConstant declaration) {
        if (!isParentOfKind(context, DeclarationKind.ENUM)) {
            declaration = declaration.withErrorOnce("Enum constants are not valid outside of an enum context.");
        }
        return super.transformEnumConstant(context, declaration);
    }

    // ==================== FUNCTIONS ====================

    @Override
    protected TransformationResult transformFunction(TransformationContext context, TranslatedFunction declaration) {
        if (!context.isValidFieldOrMethodContext()) {
            declaration = declaration.withErrorOnce("Loose functions are not supported in the target language.");
        }

        if (declaration.isVirtual() && declaration.getMetadata().has(SetLastErrorFunction.class)) {
            declaration = declaration.withWarningOnce("SetLastError is not supported on virtual methods and will be ignored.");
        }

        FunctionAbi abi = declaration.getFunctionAbi();

        // An uncallable function gets no further ABI checks
        if (abi == null) {
            if (!declaration.hasErrors()) {
                declaration = declaration.withError("Function is missing ABI information and as such is not callable.");
            }
            return TransformationResult.of(declaration);
        }

        if (abi.getCallingConvention() != LlvmCallingConvention.C) {
            declaration = declaration.withWarningOnce("ABI: LLVM calling convention " + abi.getCallingConvention()
                    + " may not be handled correctly.");
        } else if (abi.getEffectiveCallingConvention() != LlvmCallingConvention.C) {
            declaration = declaration.withWarningOnce("ABI: Effective LLVM calling convention " + abi.getEffectiveCallingConvention()
                    + " may not be handled correctly.");
        }

        switch (abi.getAstCallingConvention()) {
            case C, X86_STD_CALL, X86_FAST_CALL, X86_THIS_CALL, WIN64 -> {
                // Known to work
            }
            default -> declaration = declaration.withWarningOnce("ABI: AST calling convention " + abi.getAstCallingConvention()
                    + " may not be handled correctly.");
        }

        if (abi.hasFlag(ArrangedFunctionFlag.USES_IN_ALLOCA)) {
            declaration = declaration.withWarningOnce("ABI: Function uses inalloca, which might not be handled correctly.");
        }

        if (abi.hasFlag(ArrangedFunctionFlag.HAS_EXTENDED_PARAMETER_INFO)) {
            declaration = declaration.withWarningOnce("ABI: Function has extended parameter info, which might not be handled correctly.");
        }

        if (abi.getReturnInfo().getKind().isExpanded()) {
            declaration = declaration.withWarningOnce("ABI: Function return value passing kind is " + abi.getReturnInfo().getKind()
                    + ", which might not be handled correctly.");
        }

        for (int i = 0; i < abi.getArgumentCount(); i++) {
            ArgumentInfo argument = abi.getArguments().get(i);
            if (argument.getKind().isExpanded()) {
                declaration = declaration.withWarningOnce("ABI: Function " + describeArgumentSlot(declaration, i)
                        + " passing kind is " + argument.getKind() + ", which might not be handled correctly.");
            }
        }

        return super.transformFunction(context, declaration);
    }

    /**
     * Instance methods receive {@code this} in argument slot 0, shifting every declared parameter by one.
     */
    private static String describeArgumentSlot(TranslatedFunction function, int slot) {
        if (function.isInstanceMethod()) {
            return slot == 0 ? "this pointer parameter" : "parameter #" + (slot - 1);
        }
        return "parameter #" + slot;
    }

    @Override
    protected TransformationResult transformParameter(TransformationContext context, TranslatedParameter declaration) {
        if (!isParentOfKind(context, DeclarationKind.FUNCTION)) {
            declaration = declaration.withErrorOnce("Function parameters are not valid outside of a function context.");
        }

        if (declaration.getDefaultValue() instanceof StringConstant) {
            TranslatedParameter result = declaration.withDefaultValue(null);
            result = result.withWarning("String constants are not supported as default parameter values.");
            return TransformationResult.of(result);
        }

        // Already reported when the constant was translated
        if (declaration.getDefaultValue() instanceof UnsupportedConstantExpression) {
            return TransformationResult.of(declaration.withDefaultValue(null));
        }

        // Happens when a pass replaced a builtin type with a type that cannot carry a constant
        if (declaration.getDefaultValue() != null && !canHaveDefaultValue(context.getLibrary(), declaration.getType(), new HashSet<>())) {
            TranslatedParameter result = declaration.withDefaultValue(null);
            result = result.withWarning("Default parameter values are not supported for this parameter's type.");
            return TransformationResult.of(result);
        }

        return super.transformParameter(context, declaration);
    }

    private static boolean canHaveDefaultValue(TranslatedLibrary library, TypeReference type, Set<TranslatedDeclaration> visitedTypedefs) {
        if (type instanceof PointerTypeReference
                || type instanceof BuiltinTypeReference
                || type instanceof FunctionPointerTypeReference) {
            return true;
        }

        if (type instanceof TranslatedTypeReference) {
            TranslatedDeclaration resolved = ((TranslatedTypeReference) type).tryResolve(library);
            if (resolved == null) {
                return false;
            }
            if (resolved.getMetadata().has(ProjectedAsBuiltinType.class)) {
                return true;
            }
            return switch (resolved.getKind()) {
                case ENUM -> true;
                case TYPEDEF -> visitedTypedefs.add(resolved)
                        && canHaveDefaultValue(library, ((TranslatedTypedef) resolved).getUnderlyingType(), visitedTypedefs);
                default -> false;
            };
        }

        return false;
    }

    // ==================== RECORDS ====================

    @Override
    protected TransformationResult transformRecord(TransformationContext context, TranslatedRecord declaration) {
        if (!declaration.getUnsupportedMembers().isEmpty()) {
            declaration = declaration.withWarningOnce("Records with unsupported members may not be translated correctly.");
        }

        if (declaration.getVTable() == null && declaration.getVTableField() != null) {
            declaration = declaration.withErrorOnce("Records should not have a VTable field without a VTable.");
        } else if (declaration.getVTable() != null && declaration.getVTableField() == null) {
            declaration = declaration.withErrorOnce("Records should not have a VTable without a VTable field.");
        }

        return super.transformRecord(context, declaration);
    }

    @Override
    protected TransformationResult transformVTable(TransformationContext context, TranslatedVTable declaration) {
        TranslatedDeclaration parent = context.getParentDeclaration();

        if (parent == null || parent.getKind() != DeclarationKind.RECORD) {
            declaration = declaration.withErrorOnce("VTables must be the child of a record.");
        } else {
            TranslatedRecord record = (TranslatedRecord) parent;
            if (!declaration.isSameDeclaration(record.getVTable())) {
                if (record.getVTable() == null) {
                    declaration = declaration.withErrorOnce("VTables must be associated with the record as VTables.");
                } else {
                    declaration = declaration.withErrorOnce("Multiple VTables are not yet supported.");
                }
            }
        }

        return super.transformVTable(context, declaration);
    }

    // ==================== FIELDS ====================

    @Override
    protected TransformationResult transformField(TransformationContext context, TranslatedField<?> declaration) {
        if (!context.isValidFieldOrMethodContext()) {
            declaration = declaration.withErrorOnce("Loose fields are not supported in the target language.");
        }

        // The target does not allow a member named like its enclosing type
        TranslatedDeclaration parent = context.getParentDeclaration();
        if (parent != null && !declaration.getName().isEmpty() && parent.getName().equals(declaration.getName())) {
            String newName = declaration.getName();
            do {
                newName += "_";
            } while (hasChildNamed(parent, newName));

            declaration = declaration.withName(newName);
            declaration = declaration.withWarning("Field has the same name as its enclosing type, renamed to '" + newName
                    + "' to avoid conflict.");
        }

        return super.transformField(context, declaration);
    }

    private static boolean hasChildNamed(TranslatedDeclaration parent, String name) {
        for (TranslatedDeclaration child : parent.getChildren()) {
            if (child.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected TransformationResult transformBaseField(TransformationContext context, TranslatedBaseField declaration) {
        // A base field outside of a record was already flagged by transformField
        TranslatedDeclaration parent = context.getParentDeclaration();
        if (parent != null && parent.getKind() == DeclarationKind.RECORD) {
            TranslatedRecord record = (TranslatedRecord) parent;
            if (record.getNonVirtualBaseField() == null) {
                declaration = declaration.withErrorOnce("Base fields must be associated with the record as the non-virtual base field.");
            } else if (!declaration.isSameDeclaration(record.getNonVirtualBaseField())) {
                declaration = declaration.withErrorOnce("Multiple bases are not yet supported.");
            }
        }

        return super.transformBaseField(context, declaration);
    }

    @Override
    protected TransformationResult transformBitField(TransformationContext context, TranslatedBitField declaration) {
        if (!canBeBitFieldType(context.getLibrary(), declaration.getType(), new HashSet<>())) {
            declaration = declaration.withErrorOnce("Bit fields must be typed by an integral built-in type or an enum "
                    + "with an integral underlying type. " + declaration.getType() + " is neither.");
        }
        return super.transformBitField(context, declaration);
    }

    private static boolean canBeBitFieldType(TranslatedLibrary library, TypeReference type, Set<TranslatedDeclaration> visitedTypedefs) {
        if (type instanceof BuiltinTypeReference) {
            TargetBuiltinType builtin = ((BuiltinTypeReference) type).getType();
            return builtin.isIntegral() || builtin == TargetBuiltinType.BOOL;
        }

        if (type instanceof TranslatedTypeReference) {
            TranslatedDeclaration resolved = ((TranslatedTypeReference) type).tryResolve(library);
            if (resolved == null) {
                return false;
            }
            return switch (resolved.getKind()) {
                case ENUM -> isIntegralBuiltin(((TranslatedEnum) resolved).getUnderlyingType());
                case TYPEDEF -> visitedTypedefs.add(resolved)
                        && canBeBitFieldType(library, ((TranslatedTypedef) resolved).getUnderlyingType(), visitedTypedefs);
                default -> false;
            };
        }

        return false;
    }

    private static boolean isIntegralBuiltin(TypeReference type) {
        return type instanceof BuiltinTypeReference && ((BuiltinTypeReference) type).getType().isIntegral();
    }

    @Override
    protected TransformationResult transformUnimplementedField(TransformationContext context, TranslatedUnimplementedField declaration) {
        declaration = declaration.withWarningOnce(declaration.getFieldKind().getDescription() + " fields are not yet supported.");
        return super.transformUnimplementedField(context, declaration);
    }

    @Override
    protected TransformationResult transformStaticField(TransformationContext context, TranslatedStaticField declaration) {
        if (!context.isValidFieldOrMethodContext()) {
            declaration = declaration.withErrorOnce("Loose fields are not supported in the target language.");
        }
        return super.transformStaticField(context, declaration);
    }

    // ==================== UNSUPPORTED ====================

    @Override
    protected TransformationResult transformUnsupportedDeclaration(TransformationContext context, TranslatedUnsupportedDeclaration declaration) {
        if (!declaration.hasErrors()) {
            declaration = declaration.withError("Declarations of kind '" + declaration.getNativeKind()
                    + "' are not supported and cannot be translated.");
        }
        return super.transformUnsupportedDeclaration(context, declaration);
    }

    // ==================== HELPERS ====================

    private static boolean isParentOfKind(TransformationContext context, DeclarationKind kind) {
        TranslatedDeclaration parent = context.getParentDeclaration();
        return parent != null && parent.getKind() == kind;
    }
}

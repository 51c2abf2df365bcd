package me.christianrobert.nativebind.verification;

import me.christianrobert.nativebind.declaration.AccessModifier;
import me.christianrobert.nativebind.declaration.DeclarationKind;
import me.christianrobert.nativebind.declaration.RecordKind;
import me.christianrobert.nativebind.declaration.SynthesizedLooseDeclarationsTypeDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedBaseField;
import me.christianrobert.nativebind.declaration.TranslatedBitField;
import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedEnum;
import me.christianrobert.nativebind.declaration.TranslatedEnumConstant;
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
import me.christianrobert.nativebind.declaration.UnimplementedFieldKind;
import me.christianrobert.nativebind.declaration.abi.ArgumentInfo;
import me.christianrobert.nativebind.declaration.abi.ArgumentKind;
import me.christianrobert.nativebind.declaration.abi.ArrangedFunctionFlag;
import me.christianrobert.nativebind.declaration.abi.AstCallingConvention;
import me.christianrobert.nativebind.declaration.abi.FunctionAbi;
import me.christianrobert.nativebind.declaration.abi.LlvmCallingConvention;
import me.christianrobert.nativebind.declaration.constant.IntegerConstant;
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
import me.christianrobert.nativebind.diagnostic.Severity;
import me.christianrobert.nativebind.diagnostic.TranslationDiagnostic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static me.christianrobert.nativebind.DeclarationTestFactory.FILE;
import static me.christianrobert.nativebind.DeclarationTestFactory.FLOAT;
import static me.christianrobert.nativebind.DeclarationTestFactory.INT;
import static me.christianrobert.nativebind.DeclarationTestFactory.VOID;
import static me.christianrobert.nativebind.DeclarationTestFactory.field;
import static me.christianrobert.nativebind.DeclarationTestFactory.function;
import static me.christianrobert.nativebind.DeclarationTestFactory.intEnum;
import static me.christianrobert.nativebind.DeclarationTestFactory.library;
import static me.christianrobert.nativebind.DeclarationTestFactory.parameter;
import static me.christianrobert.nativebind.DeclarationTestFactory.record;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TranslationVerifier}, grouped by the kind of declaration a rule applies to.
 */
class TranslationVerifierTest {

    private TranslationVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new TranslationVerifier();
    }

    private TranslatedDeclaration root(TranslatedLibrary library) {
        assertEquals(1, library.getDeclarations().size());
        return library.getDeclarations().get(0);
    }

    private TranslatedDeclaration firstMember(TranslatedLibrary library) {
        return root(library).getChildren().get(0);
    }

    private static List<TranslationDiagnostic> ofSeverity(TranslatedDeclaration declaration, Severity severity) {
        return declaration.getDiagnostics().stream()
                .filter(d -> d.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    // ==================== ACCESSIBILITY ====================

    @Test
    void protectedMethodIsForcedInternal() {
        // Given: a record with a protected method
        TranslatedFunction update = function("update").withAccessibility(AccessModifier.PROTECTED);
        TranslatedLibrary library = library(record("Body", update));

        // When
        TranslatedLibrary result = verifier.transform(library);

        // Then: the method stays a member, is internal and carries exactly one warning
        TranslatedDeclaration method = firstMember(result);
        assertTrue(method.isSameDeclaration(update));
        assertEquals(AccessModifier.INTERNAL, method.getAccessibility());
        assertEquals(1, method.getDiagnostics().size());
        assertEquals(Severity.WARNING, method.getDiagnostics().get(0).getSeverity());
        assertEquals("Declaration translated as protected, but protected isn't supported yet. Accessibility forced to internal.",
                method.getDiagnostics().get(0).getMessage());
    }

    @Test
    void protectedOrInternalIsForcedInternal() {
        TranslatedFunction update = function("update").withAccessibility(AccessModifier.PROTECTED_OR_INTERNAL);

        TranslatedDeclaration method = firstMember(verifier.transform(library(record("Body", update))));

        assertEquals(AccessModifier.INTERNAL, method.getAccessibility());
        assertEquals(1, ofSeverity(method, Severity.WARNING).size());
    }

    @Test
    void privateRootDeclarationIsForcedInternal() {
        // Given
        TranslatedRecord body = record("Body").withAccessibility(AccessModifier.PRIVATE);

        // When
        TranslatedDeclaration result = root(verifier.transform(library(body)));

        // Then
        assertEquals(AccessModifier.INTERNAL, result.getAccessibility());
        assertEquals(List.of(TranslationDiagnostic.warning(
                        "Declaration translated as private, but it will be translated into a file/namespace scope. Accessibility forced to internal.")),
                result.getDiagnostics());
    }

    @Test
    void privateMemberIsKept() {
        TranslatedNormalField mass = field("mass", 0).withAccessibility(AccessModifier.PRIVATE);

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", mass))));

        assertEquals(AccessModifier.PRIVATE, result.getAccessibility());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void protectedRootDeclarationGetsSingleAdjustment() {
        // Protected is not allowed at the root either; the root rule already forces internal
        TranslatedRecord body = record("Body").withAccessibility(AccessModifier.PROTECTED);

        TranslatedDeclaration result = root(verifier.transform(library(body)));

        assertEquals(AccessModifier.INTERNAL, result.getAccessibility());
        assertEquals(1, result.getDiagnostics().size());
    }

    // ==================== ENUMS ====================

    @Test
    void enumWithUnsupportedTypeAtRootIsWrapped() {
        // Given: a float-backed enum at namespace scope (neither an enum nor loose fields are possible)
        TranslatedEnum shape = new TranslatedEnum(FILE, "Shape", FLOAT)
                .withValues(List.of(new TranslatedEnumConstant(FILE, "Sphere", 0)))
                .withNamespace("physics");

        // When
        TranslatedLibrary result = verifier.transform(library(shape));

        // Then
        TranslatedDeclaration wrapper = root(result);
        assertEquals(DeclarationKind.SYNTHESIZED_LOOSE_DECLARATIONS, wrapper.getKind());
        assertEquals("Shape", wrapper.getName());
        assertEquals("physics", wrapper.getNamespace());
        assertTrue(wrapper.getDiagnostics().isEmpty());

        TranslatedEnum inner = (TranslatedEnum) wrapper.getChildren().get(0);
        assertTrue(inner.isTranslateAsLooseConstants());
        assertTrue(inner.isSameDeclaration(shape));
        assertEquals(1, inner.getDiagnostics().size());
        assertEquals(Severity.WARNING, inner.getDiagnostics().get(0).getSeverity());
        assertEquals(1, inner.getValues().size());
    }

    @Test
    void looseConstantsEnumOutsideFieldContextBecomesRealEnum() {
        TranslatedEnum shape = intEnum("Shape", "Sphere").withTranslateAsLooseConstants(true);

        TranslatedEnum result = (TranslatedEnum) root(verifier.transform(library(shape)));

        assertFalse(result.isTranslateAsLooseConstants());
        assertEquals(List.of(TranslationDiagnostic.warning("Enums outside of a field declaration context cannot be translated as loose constants.")),
                result.getDiagnostics());
    }

    @Test
    void enumWithUnsupportedTypeInRecordBecomesLooseConstants() {
        TranslatedEnum shape = new TranslatedEnum(FILE, "Shape", FLOAT);

        TranslatedEnum result = (TranslatedEnum) firstMember(verifier.transform(library(record("Body", shape))));

        assertTrue(result.isTranslateAsLooseConstants());
        assertEquals(1, ofSeverity(result, Severity.WARNING).size());
        assertTrue(result.getDiagnostics().get(0).getMessage().contains("'float'"));
    }

    @Test
    void representableEnumIsUnchanged() {
        TranslatedLibrary library = library(intEnum("Shape", "Sphere", "Box"), record("Body", intEnum("Kind", "Static")));

        assertSame(library, verifier.transform(library));
    }

    @Test
    void enumConstantOutsideEnumIsError() {
        TranslatedEnumConstant stray = new TranslatedEnumConstant(FILE, "Sphere", 0);

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", stray))));

        assertEquals(List.of(TranslationDiagnostic.error("Enum constants are not valid outside of an enum context.")), result.getDiagnostics());
    }

    // ==================== FUNCTIONS ====================

    @Test
    void looseFunctionIsError() {
        TranslatedDeclaration result = root(verifier.transform(library(function("step"))));

        assertTrue(result.hasErrors());
        assertEquals("Loose functions are not supported in the target language.", result.getDiagnostics().get(0).getMessage());
    }

    @Test
    void functionInSynthesizedContainerIsAllowed() {
        SynthesizedLooseDeclarationsTypeDeclaration globals = new SynthesizedLooseDeclarationsTypeDeclaration(FILE, "Globals", List.of(function("step")));
        TranslatedLibrary library = library(globals);

        assertSame(library, verifier.transform(library));
    }

    @Test
    void virtualSetLastErrorIsWarning() {
        TranslatedFunction update = function("update").withVirtual(true);
        update = update.withMetadata(SetLastErrorFunction.INSTANCE);

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", update))));

        assertEquals(List.of(TranslationDiagnostic.warning("SetLastError is not supported on virtual methods and will be ignored.")),
                result.getDiagnostics());
    }

    @Test
    void missingAbiIsErrorAndSkipsAbiChecks() {
        // Given: no ABI, and a parameter that still needs its own checks
        TranslatedParameter name = parameter("name").withDefaultValue(new StringConstant("body"));
        TranslatedFunction rename = function("rename", name).withFunctionAbi(null);

        // When
        TranslatedFunction result = (TranslatedFunction) firstMember(verifier.transform(library(record("Body", rename))));

        // Then
        assertEquals(List.of(TranslationDiagnostic.error("Function is missing ABI information and as such is not callable.")), result.getDiagnostics());
        assertNull(result.getParameters().get(0).getDefaultValue(), "Parameters are verified even when the function has no ABI");
    }

    @Test
    void missingAbiWithExistingErrorAddsNothing() {
        TranslatedFunction rename = function("rename").withFunctionAbi(null);
        rename = rename.withError("Could not resolve overload.");

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", rename))));

        assertEquals(1, result.getDiagnostics().size());
    }

    @Test
    void unusualCallingConventionsAreWarnings() {
        // Given
        FunctionAbi abi = new FunctionAbi(LlvmCallingConvention.X86_STD_CALL, LlvmCallingConvention.X86_STD_CALL,
                AstCallingConvention.X86_VECTOR_CALL, null, ArgumentInfo.of(ArgumentKind.DIRECT), List.of());
        TranslatedFunction step = function("step").withFunctionAbi(abi);

        // When
        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", step))));

        // Then: the effective convention is only checked when the declared one is C
        assertEquals(List.of(
                TranslationDiagnostic.warning("ABI: LLVM calling convention X86_STD_CALL may not be handled correctly."),
                TranslationDiagnostic.warning("ABI: AST calling convention X86_VECTOR_CALL may not be handled correctly.")),
                result.getDiagnostics());
    }

    @Test
    void effectiveCallingConventionIsCheckedWhenDeclaredIsC() {
        FunctionAbi abi = new FunctionAbi(LlvmCallingConvention.C, LlvmCallingConvention.WIN64,
                AstCallingConvention.WIN64, null, ArgumentInfo.of(ArgumentKind.DIRECT), List.of());

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", function("step").withFunctionAbi(abi)))));

        assertEquals(List.of(TranslationDiagnostic.warning("ABI: Effective LLVM calling convention WIN64 may not be handled correctly.")),
                result.getDiagnostics());
    }

    @Test
    void abiFlagsAndExpandedReturnAreWarnings() {
        Set<ArrangedFunctionFlag> flags = EnumSet.of(ArrangedFunctionFlag.USES_IN_ALLOCA, ArrangedFunctionFlag.HAS_EXTENDED_PARAMETER_INFO);
        FunctionAbi abi = new FunctionAbi(LlvmCallingConvention.C, LlvmCallingConvention.C, AstCallingConvention.C,
                flags, ArgumentInfo.of(ArgumentKind.COERCE_AND_EXPAND), List.of());

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", function("step").withFunctionAbi(abi)))));

        assertEquals(List.of(
                TranslationDiagnostic.warning("ABI: Function uses inalloca, which might not be handled correctly."),
                TranslationDiagnostic.warning("ABI: Function has extended parameter info, which might not be handled correctly."),
                TranslationDiagnostic.warning("ABI: Function return value passing kind is COERCE_AND_EXPAND, which might not be handled correctly.")),
                result.getDiagnostics());
    }

    @Test
    void expandedReceiverIsNamedThisPointerParameter() {
        // Given: an instance method whose slot 0 is the receiver
        FunctionAbi abi = new FunctionAbi(LlvmCallingConvention.C, LlvmCallingConvention.C, AstCallingConvention.X86_THIS_CALL,
                null, ArgumentInfo.of(ArgumentKind.DIRECT),
                List.of(ArgumentInfo.of(ArgumentKind.EXPAND), ArgumentInfo.of(ArgumentKind.DIRECT), ArgumentInfo.of(ArgumentKind.COERCE_AND_EXPAND)));
        TranslatedFunction update = function("update", parameter("dt"), parameter("steps"))
                .withInstanceMethod(true)
                .withFunctionAbi(abi);

        // When
        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", update))));

        // Then
        assertEquals(List.of(
                TranslationDiagnostic.warning("ABI: Function this pointer parameter passing kind is EXPAND, which might not be handled correctly."),
                TranslationDiagnostic.warning("ABI: Function parameter #1 passing kind is COERCE_AND_EXPAND, which might not be handled correctly.")),
                result.getDiagnostics());
    }

    @Test
    void expandedArgumentOfStaticFunctionUsesSlotIndex() {
        FunctionAbi abi = new FunctionAbi(LlvmCallingConvention.C, LlvmCallingConvention.C, AstCallingConvention.C,
                null, ArgumentInfo.of(ArgumentKind.DIRECT), List.of(ArgumentInfo.of(ArgumentKind.EXPAND)));
        TranslatedFunction step = function("step", parameter("dt")).withFunctionAbi(abi);

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", step))));

        assertEquals("ABI: Function parameter #0 passing kind is EXPAND, which might not be handled correctly.",
                result.getDiagnostics().get(0).getMessage());
    }

    // ==================== PARAMETERS ====================

    @Test
    void parameterOutsideFunctionIsError() {
        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Body", parameter("dt")))));

        assertEquals(List.of(TranslationDiagnostic.error("Function parameters are not valid outside of a function context.")), result.getDiagnostics());
    }

    @Test
    void stringDefaultValueIsCleared() {
        // Given
        TranslatedParameter name = new TranslatedParameter(FILE, "name", new PointerTypeReference(BuiltinTypeReference.of(TargetBuiltinType.SBYTE)))
                .withDefaultValue(new StringConstant("body"));
        TranslatedFunction rename = function("rename", name);

        // When
        TranslatedFunction result = (TranslatedFunction) firstMember(verifier.transform(library(record("Body", rename))));

        // Then
        TranslatedParameter parameter = result.getParameters().get(0);
        assertNull(parameter.getDefaultValue());
        assertEquals(List.of(TranslationDiagnostic.warning("String constants are not supported as default parameter values.")), parameter.getDiagnostics());
        assertEquals(name.getType(), parameter.getType());
        assertEquals("name", parameter.getName());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void unsupportedConstantDefaultIsClearedSilently() {
        TranslatedParameter dt = parameter("dt").withDefaultValue(new UnsupportedConstantExpression("sizeof(T) * 2"));

        TranslatedFunction result = (TranslatedFunction) firstMember(verifier.transform(library(record("Body", function("step", dt)))));

        assertNull(result.getParameters().get(0).getDefaultValue());
        assertTrue(result.getParameters().get(0).getDiagnostics().isEmpty());
    }

    @Test
    void defaultValueOnRecordTypedParameterIsCleared() {
        // Given
        TranslatedRecord vector = record("Vector3");
        TranslatedParameter origin = new TranslatedParameter(FILE, "origin", TranslatedTypeReference.to(vector))
                .withDefaultValue(IntegerConstant.ofInt(0));

        // When
        TranslatedLibrary result = verifier.transform(library(vector, record("Body", function("move", origin))));

        // Then
        TranslatedFunction move = (TranslatedFunction) result.getDeclarations().get(1).getChildren().get(0);
        TranslatedParameter parameter = move.getParameters().get(0);
        assertNull(parameter.getDefaultValue());
        assertEquals(List.of(TranslationDiagnostic.warning("Default parameter values are not supported for this parameter's type.")),
                parameter.getDiagnostics());
    }

    @Test
    void defaultValueIsKeptForEligibleTypes() {
        // Given: typedef to int, enum, and a declaration projected as a builtin
        TranslatedTypedef count = new TranslatedTypedef(FILE, "count_t", INT);
        TranslatedEnum shape = intEnum("Shape", "Sphere");
        TranslatedRecord nativeBool = record("NativeBool").withMetadata(new ProjectedAsBuiltinType(TargetBuiltinType.BOOL));

        TranslatedFunction create = function("create",
                new TranslatedParameter(FILE, "count", TranslatedTypeReference.to(count)).withDefaultValue(IntegerConstant.ofInt(1)),
                new TranslatedParameter(FILE, "shape", TranslatedTypeReference.to(shape)).withDefaultValue(IntegerConstant.ofInt(0)),
                new TranslatedParameter(FILE, "enabled", TranslatedTypeReference.to(nativeBool)).withDefaultValue(IntegerConstant.ofInt(1)),
                parameter("flags").withDefaultValue(IntegerConstant.ofInt(0)));

        TranslatedLibrary library = library(count, shape, nativeBool, record("World", create));

        // When / Then
        assertSame(library, verifier.transform(library));
    }

    @Test
    void typedefCycleDoesNotLoop() {
        // Given: a typedef whose underlying type refers to itself
        TranslatedTypedef self = new TranslatedTypedef(FILE, "self_t", INT);
        self = self.withUnderlyingType(TranslatedTypeReference.to(self));
        TranslatedParameter value = new TranslatedParameter(FILE, "value", TranslatedTypeReference.to(self))
                .withDefaultValue(IntegerConstant.ofInt(0));

        // When
        TranslatedLibrary result = verifier.transform(library(self, record("Body", function("set", value))));

        // Then
        TranslatedFunction set = (TranslatedFunction) result.getDeclarations().get(1).getChildren().get(0);
        assertNull(set.getParameters().get(0).getDefaultValue());
    }

    // ==================== RECORDS ====================

    @Test
    void recordWithUnsupportedMembersIsWarning() {
        TranslatedRecord body = record("Body").withUnsupportedMembers(List.of(new TranslatedUnsupportedDeclaration(FILE, "operator new", "CXXMethod")));

        TranslatedDeclaration result = root(verifier.transform(library(body)));

        assertEquals(List.of(TranslationDiagnostic.warning("Records with unsupported members may not be translated correctly.")), result.getDiagnostics());
    }

    @Test
    void vTableWithoutVTableFieldIsError() {
        TranslatedVTable vTable = new TranslatedVTable(FILE);
        TranslatedRecord shape = record("Shape", vTable).withVTable(vTable);

        TranslatedDeclaration result = root(verifier.transform(library(shape)));

        assertEquals(List.of(TranslationDiagnostic.error("Records should not have a VTable without a VTable field.")), result.getDiagnostics());
    }

    @Test
    void vTableFieldWithoutVTableIsError() {
        TranslatedVTableField vTableField = new TranslatedVTableField(FILE);
        TranslatedRecord shape = record("Shape", vTableField).withVTableField(vTableField);

        TranslatedDeclaration result = root(verifier.transform(library(shape)));

        assertEquals(List.of(TranslationDiagnostic.error("Records should not have a VTable field without a VTable.")), result.getDiagnostics());
    }

    @Test
    void completePolymorphicRecordIsUnchanged() {
        TranslatedVTable vTable = new TranslatedVTable(FILE);
        TranslatedVTableField vTableField = new TranslatedVTableField(FILE);
        TranslatedLibrary library = library(record("Shape", vTableField, field("radius", 8), vTable).withVTable(vTable).withVTableField(vTableField));

        assertSame(library, verifier.transform(library));
    }

    @Test
    void vTableOutsideRecordIsError() {
        TranslatedDeclaration result = root(verifier.transform(library(new TranslatedVTable(FILE))));

        assertEquals(List.of(TranslationDiagnostic.error("VTables must be the child of a record.")), result.getDiagnostics());
    }

    @Test
    void undesignatedVTableIsError() {
        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Shape", new TranslatedVTable(FILE)))));

        assertEquals(List.of(TranslationDiagnostic.error("VTables must be associated with the record as VTables.")), result.getDiagnostics());
    }

    @Test
    void secondVTableIsError() {
        // Given
        TranslatedVTable primary = new TranslatedVTable(FILE);
        TranslatedVTable secondary = new TranslatedVTable(FILE, "SecondaryVTable", List.of());
        TranslatedVTableField vTableField = new TranslatedVTableField(FILE);
        TranslatedRecord shape = record("Shape", vTableField, primary, secondary).withVTable(primary).withVTableField(vTableField);

        // When
        TranslatedDeclaration result = root(verifier.transform(library(shape)));

        // Then
        assertTrue(result.getChildren().get(1).getDiagnostics().isEmpty());
        assertEquals(List.of(TranslationDiagnostic.error("Multiple VTables are not yet supported.")), result.getChildren().get(2).getDiagnostics());
    }

    // ==================== FIELDS ====================

    @Test
    void fieldNamedLikeRecordIsRenamed() {
        // Given
        TranslatedRecord foo = record("Foo", field("Foo", 0), field("bar", 4));

        // When
        TranslatedDeclaration result = firstMember(verifier.transform(library(foo)));

        // Then
        assertEquals("Foo_", result.getName());
        assertEquals(List.of(TranslationDiagnostic.warning("Field has the same name as its enclosing type, renamed to 'Foo_' to avoid conflict.")),
                result.getDiagnostics());
    }

    @Test
    void renamedFieldSkipsNamesTakenBySiblings() {
        TranslatedRecord foo = record("Foo", field("Foo", 0), field("Foo_", 4));

        TranslatedLibrary result = verifier.transform(library(foo));

        TranslatedDeclaration renamed = firstMember(result);
        assertEquals("Foo__", renamed.getName());
        assertEquals(1, renamed.getDiagnostics().size());
        assertTrue(renamed.getDiagnostics().get(0).getMessage().contains("'Foo__'"));
        assertEquals("Foo_", root(result).getChildren().get(1).getName());
    }

    @Test
    void looseFieldsAreErrors() {
        TranslatedStaticField gravity = new TranslatedStaticField(FILE, "gravity", FLOAT, "gravity");

        TranslatedLibrary result = verifier.transform(library(gravity, field("mass", 0)));

        for (TranslatedDeclaration declaration : result.getDeclarations()) {
            assertEquals(List.of(TranslationDiagnostic.error("Loose fields are not supported in the target language.")),
                    declaration.getDiagnostics(), declaration.toString());
        }
    }

    @Test
    void undesignatedBaseFieldIsError() {
        TranslatedBaseField base = new TranslatedBaseField(FILE, "Base", 0, INT);

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Derived", base))));

        assertEquals(List.of(TranslationDiagnostic.error("Base fields must be associated with the record as the non-virtual base field.")),
                result.getDiagnostics());
    }

    @Test
    void secondBaseFieldIsError() {
        TranslatedBaseField first = new TranslatedBaseField(FILE, "First", 0, INT);
        TranslatedBaseField second = new TranslatedBaseField(FILE, "Second", 4, INT);
        TranslatedRecord derived = record("Derived", first, second).withNonVirtualBaseField(first);

        TranslatedDeclaration result = root(verifier.transform(library(derived)));

        assertTrue(result.getChildren().get(0).getDiagnostics().isEmpty());
        assertEquals(List.of(TranslationDiagnostic.error("Multiple bases are not yet supported.")), result.getChildren().get(1).getDiagnostics());
    }

    @Test
    void bitFieldTypedByTypedefToFloatIsError() {
        // Given
        TranslatedTypedef real = new TranslatedTypedef(FILE, "real_t", FLOAT);
        TranslatedBitField flags = new TranslatedBitField(FILE, "flags", 0, TranslatedTypeReference.to(real), 0, 3);

        // When
        TranslatedLibrary result = verifier.transform(library(real, record("Body", flags)));

        // Then
        TranslatedBitField verified = (TranslatedBitField) result.getDeclarations().get(1).getChildren().get(0);
        assertEquals(List.of(TranslationDiagnostic.error("Bit fields must be typed by an integral built-in type or an enum "
                + "with an integral underlying type. `real_t` is neither.")), verified.getDiagnostics());
        assertEquals(flags.getType(), verified.getType());
        assertEquals(3, verified.getBitWidth());
        assertEquals("flags", verified.getName());
    }

    @Test
    void bitFieldsWithIntegralTypesAreValid() {
        TranslatedEnum mode = intEnum("Mode", "Off", "On");
        TranslatedTypedef bits = new TranslatedTypedef(FILE, "bits_t", TranslatedTypeReference.to(mode));
        TranslatedRecord body = record("Body",
                new TranslatedBitField(FILE, "a", 0, BuiltinTypeReference.of(TargetBuiltinType.UINT), 0, 1),
                new TranslatedBitField(FILE, "b", 0, BuiltinTypeReference.of(TargetBuiltinType.BOOL), 1, 1),
                new TranslatedBitField(FILE, "c", 0, TranslatedTypeReference.to(mode), 2, 1),
                new TranslatedBitField(FILE, "d", 0, TranslatedTypeReference.to(bits), 3, 1));
        TranslatedLibrary library = library(mode, bits, body);

        assertSame(library, verifier.transform(library));
    }

    @Test
    void unimplementedFieldIsWarning() {
        TranslatedUnimplementedField virtualBase = new TranslatedUnimplementedField(FILE, "Base", 0, UnimplementedFieldKind.VIRTUAL_BASE);

        TranslatedDeclaration result = firstMember(verifier.transform(library(record("Derived", virtualBase))));

        assertEquals(List.of(TranslationDiagnostic.warning("Virtual base fields are not yet supported.")), result.getDiagnostics());
    }

    @Test
    void kindsWithoutRulesAreUnchanged() {
        TranslatedVTable vTable = new TranslatedVTable(FILE);
        TranslatedVTableField vTableField = new TranslatedVTableField(FILE);
        TranslatedLibrary library = library(
                new TranslatedTypedef(FILE, "real_t", FLOAT),
                new TranslatedUndefinedRecord(FILE, "Opaque", RecordKind.CLASS),
                record("Shape", vTableField, field("radius", 8), vTable).withVTable(vTable).withVTableField(vTableField));

        assertSame(library, verifier.transform(library));
    }

    // ==================== UNSUPPORTED ====================

    @Test
    void unsupportedDeclarationGetsError() {
        TranslatedDeclaration result = root(verifier.transform(library(new TranslatedUnsupportedDeclaration(FILE, "Concept", "Concept"))));

        assertTrue(result.hasErrors());
        assertEquals(1, result.getDiagnostics().size());
    }

    @Test
    void unsupportedDeclarationWithErrorIsUnchanged() {
        TranslatedUnsupportedDeclaration concept = new TranslatedUnsupportedDeclaration(FILE, "Concept", "Concept");
        concept = concept.withError("Concepts cannot be translated.");
        TranslatedLibrary library = library(concept);

        assertSame(library, verifier.transform(library));
    }

    // ==================== PROPERTIES ====================

    private TranslatedLibrary messyLibrary() {
        TranslatedVTable vTable = new TranslatedVTable(FILE);
        TranslatedRecord foo = record("Foo",
                field("Foo", 0),
                field("Foo_", 4),
                function("update").withAccessibility(AccessModifier.PROTECTED),
                new TranslatedEnum(FILE, "Mode", FLOAT),
                new TranslatedEnumConstant(FILE, "Stray", 1),
                parameter("stray"),
                new TranslatedBaseField(FILE, "Base", 0, INT),
                new TranslatedUnimplementedField(FILE, "VBase", 8, UnimplementedFieldKind.VIRTUAL_BASE),
                vTable).withVTable(vTable);

        TranslatedParameter name = parameter("name").withDefaultValue(new StringConstant("x"));
        FunctionAbi expandedAbi = new FunctionAbi(LlvmCallingConvention.FAST, LlvmCallingConvention.FAST, AstCallingConvention.SWIFT,
                EnumSet.of(ArrangedFunctionFlag.USES_IN_ALLOCA), ArgumentInfo.of(ArgumentKind.EXPAND), List.of(ArgumentInfo.of(ArgumentKind.EXPAND)));

        return library(
                foo,
                new TranslatedEnum(FILE, "Shape", FLOAT).withAccessibility(AccessModifier.PRIVATE),
                intEnum("Loose", "A").withTranslateAsLooseConstants(true),
                function("loose"),
                record("World", function("rename", name).withFunctionAbi(expandedAbi), function("broken").withFunctionAbi(null)),
                new TranslatedUnsupportedDeclaration(FILE, "Concept", "Concept"),
                new TranslatedStaticField(FILE, "gravity", FLOAT, "gravity"));
    }

    @Test
    void verificationIsIdempotent() {
        // Given
        TranslatedLibrary once = verifier.transform(messyLibrary());

        // When
        TranslatedLibrary twice = new TranslationVerifier().transform(once);

        // Then: nothing fires again, not even the field rename
        assertSame(once, twice);
    }

    @Test
    void diagnosticsNeverShrink() {
        // Given
        TranslatedLibrary input = messyLibrary();

        // When
        TranslatedLibrary output = verifier.transform(input);

        // Then: every surviving declaration keeps its earlier diagnostics as a prefix
        for (TranslatedDeclaration before : input.allDeclarations()) {
            TranslatedDeclaration after = output.tryFind(before.getId());
            assertNotNull(after, "Verification never removes declarations: " + before);
            assertTrue(after.getDiagnostics().size() >= before.getDiagnostics().size());
            assertEquals(before.getDiagnostics(), after.getDiagnostics().subList(0, before.getDiagnostics().size()));
        }
    }

    @Test
    void recordsWithBrokenVTableInvariantAreNotEmittable() {
        TranslatedLibrary output = verifier.transform(messyLibrary());

        for (TranslatedDeclaration declaration : output.allDeclarations()) {
            if (declaration.getKind() != DeclarationKind.RECORD) {
                continue;
            }
            TranslatedRecord record = (TranslatedRecord) declaration;
            if ((record.getVTable() == null) != (record.getVTableField() == null)) {
                assertFalse(record.isEmittable(), record.toString());
            }

            long designatedVTables = record.getMembers().stream().filter(m -> m.isSameDeclaration(record.getVTable())).count();
            long designatedBases = record.getMembers().stream().filter(m -> m.isSameDeclaration(record.getNonVirtualBaseField())).count();
            assertTrue(designatedVTables <= 1);
            assertTrue(designatedBases <= 1);
        }
    }

    @Test
    void pointerAndFunctionTypesNeedNoDeclarations() {
        TypeReference callback = new FunctionPointerTypeReference(VOID, List.of(INT));
        TranslatedParameter onStep = new TranslatedParameter(FILE, "onStep", callback).withDefaultValue(IntegerConstant.ofInt(0));
        TranslatedLibrary library = library(record("World", function("setCallback", onStep)));

        assertSame(library, verifier.transform(library));
    }
}

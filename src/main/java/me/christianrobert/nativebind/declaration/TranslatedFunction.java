package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.abi.FunctionAbi;
import me.christianrobert.nativebind.declaration.type.TypeReference;

import java.util.List;

/**
 * A free function or a method. Parameters are its only children.
 *
 * <p>{@link #getFunctionAbi()} is null when the front end could not arrange the function, in which case
 * the function cannot be called through a foreign call.</p>
 */
public final class TranslatedFunction extends AbstractTranslatedDeclaration<TranslatedFunction> {

    private final TypeReference returnType;
    private final List<TranslatedParameter> parameters;
    private final boolean isVirtual;
    private final boolean isInstanceMethod;
    private final boolean isConst;
    private final FunctionAbi functionAbi;

    public TranslatedFunction(TranslatedFile file, String name, TypeReference returnType) {
        this(new DeclarationInfo(file, name), returnType, List.of(), false, false, false, null);
    }

    private TranslatedFunction(DeclarationInfo info,
                               TypeReference returnType,
                               List<TranslatedParameter> parameters,
                               boolean isVirtual,
                               boolean isInstanceMethod,
                               boolean isConst,
                               FunctionAbi functionAbi) {
        super(info);
        if (returnType == null) {
            throw new IllegalArgumentException("Return type cannot be null");
        }
        this.returnType = returnType;
        this.parameters = List.copyOf(parameters);
        this.isVirtual = isVirtual;
        this.isInstanceMethod = isInstanceMethod;
        this.isConst = isConst;
        this.functionAbi = functionAbi;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.FUNCTION;
    }

    @Override
    public List<TranslatedDeclaration> getChildren() {
        return List.copyOf(parameters);
    }

    public TypeReference getReturnType() {
        return returnType;
    }

    public List<TranslatedParameter> getParameters() {
        return parameters;
    }

    public boolean isVirtual() {
        return isVirtual;
    }

    public boolean isInstanceMethod() {
        return isInstanceMethod;
    }

    public boolean isConst() {
        return isConst;
    }

    public FunctionAbi getFunctionAbi() {
        return functionAbi;
    }

    public TranslatedFunction withParameters(List<TranslatedParameter> newParameters) {
        return new TranslatedFunction(getInfo(), returnType, newParameters, isVirtual, isInstanceMethod, isConst, functionAbi);
    }

    public TranslatedFunction withReturnType(TypeReference newReturnType) {
        return new TranslatedFunction(getInfo(), newReturnType, parameters, isVirtual, isInstanceMethod, isConst, functionAbi);
    }

    public TranslatedFunction withVirtual(boolean newIsVirtual) {
        return new TranslatedFunction(getInfo(), returnType, parameters, newIsVirtual, isInstanceMethod, isConst, functionAbi);
    }

    public TranslatedFunction withInstanceMethod(boolean newIsInstanceMethod) {
        return new TranslatedFunction(getInfo(), returnType, parameters, isVirtual, newIsInstanceMethod, isConst, functionAbi);
    }

    public TranslatedFunction withConst(boolean newIsConst) {
        return new TranslatedFunction(getInfo(), returnType, parameters, isVirtual, isInstanceMethod, newIsConst, functionAbi);
    }

    public TranslatedFunction withFunctionAbi(FunctionAbi newFunctionAbi) {
        return new TranslatedFunction(getInfo(), returnType, parameters, isVirtual, isInstanceMethod, isConst, newFunctionAbi);
    }

    @Override
    TranslatedFunction withInfo(DeclarationInfo newInfo) {
        return new TranslatedFunction(newInfo, returnType, parameters, isVirtual, isInstanceMethod, isConst, functionAbi);
    }

    @Override
    TranslatedFunction self() {
        return this;
    }
}

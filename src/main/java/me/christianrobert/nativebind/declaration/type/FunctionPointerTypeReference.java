package me.christianrobert.nativebind.declaration.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Pointer to a native function with the given signature.
 */
public final class FunctionPointerTypeReference extends TypeReference {

    private final TypeReference returnType;
    private final List<TypeReference> parameterTypes;

    public FunctionPointerTypeReference(TypeReference returnType, List<TypeReference> parameterTypes) {
        if (returnType == null) {
            throw new IllegalArgumentException("Return type cannot be null");
        }
        this.returnType = returnType;
        this.parameterTypes = parameterTypes == null ? List.of() : List.copyOf(parameterTypes);
    }

    public TypeReference getReturnType() {
        return returnType;
    }

    public List<TypeReference> getParameterTypes() {
        return parameterTypes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionPointerTypeReference that = (FunctionPointerTypeReference) o;
        return returnType.equals(that.returnType) && parameterTypes.equals(that.parameterTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(returnType, parameterTypes);
    }

    @Override
    public String toString() {
        return parameterTypes.stream()
                .map(TypeReference::toString)
                .collect(Collectors.joining(", ", "delegate*<", ", " + returnType + ">"));
    }
}

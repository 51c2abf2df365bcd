package me.christianrobert.nativebind.declaration.abi;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * ABI arrangement computed by the front end for a function: the calling conventions involved and how
 * each argument slot and the return value are passed.
 *
 * <p>For instance methods the first argument slot is the implicit receiver ({@code this}).</p>
 */
public final class FunctionAbi {

    private final LlvmCallingConvention callingConvention;
    private final LlvmCallingConvention effectiveCallingConvention;
    private final AstCallingConvention astCallingConvention;
    private final Set<ArrangedFunctionFlag> flags;
    private final ArgumentInfo returnInfo;
    private final List<ArgumentInfo> arguments;

    public FunctionAbi(LlvmCallingConvention callingConvention,
                       LlvmCallingConvention effectiveCallingConvention,
                       AstCallingConvention astCallingConvention,
                       Set<ArrangedFunctionFlag> flags,
                       ArgumentInfo returnInfo,
                       List<ArgumentInfo> arguments) {
        if (callingConvention == null || effectiveCallingConvention == null || astCallingConvention == null) {
            throw new IllegalArgumentException("Calling conventions cannot be null");
        }
        if (returnInfo == null) {
            throw new IllegalArgumentException("Return info cannot be null");
        }
        this.callingConvention = callingConvention;
        this.effectiveCallingConvention = effectiveCallingConvention;
        this.astCallingConvention = astCallingConvention;
        this.flags = flags == null || flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        this.returnInfo = returnInfo;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * Creates the arrangement of a plain C function whose arguments are all passed directly.
     */
    public static FunctionAbi simpleC(int argumentCount) {
        ArgumentInfo[] arguments = new ArgumentInfo[argumentCount];
        Arrays.fill(arguments, ArgumentInfo.of(ArgumentKind.DIRECT));
        return new FunctionAbi(LlvmCallingConvention.C, LlvmCallingConvention.C, AstCallingConvention.C,
                null, ArgumentInfo.of(ArgumentKind.DIRECT), List.of(arguments));
    }

    public LlvmCallingConvention getCallingConvention() {
        return callingConvention;
    }

    public LlvmCallingConvention getEffectiveCallingConvention() {
        return effectiveCallingConvention;
    }

    public AstCallingConvention getAstCallingConvention() {
        return astCallingConvention;
    }

    public Set<ArrangedFunctionFlag> getFlags() {
        return flags;
    }

    public boolean hasFlag(ArrangedFunctionFlag flag) {
        return flags.contains(flag);
    }

    public ArgumentInfo getReturnInfo() {
        return returnInfo;
    }

    public List<ArgumentInfo> getArguments() {
        return arguments;
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    public FunctionAbi withArguments(List<ArgumentInfo> newArguments) {
        return new FunctionAbi(callingConvention, effectiveCallingConvention, astCallingConvention, flags, returnInfo, newArguments);
    }

    public FunctionAbi withReturnInfo(ArgumentInfo newReturnInfo) {
        return new FunctionAbi(callingConvention, effectiveCallingConvention, astCallingConvention, flags, newReturnInfo, arguments);
    }

    public FunctionAbi withFlags(Set<ArrangedFunctionFlag> newFlags) {
        return new FunctionAbi(callingConvention, effectiveCallingConvention, astCallingConvention, newFlags, returnInfo, arguments);
    }

    public FunctionAbi withCallingConventions(LlvmCallingConvention newCallingConvention,
                                              LlvmCallingConvention newEffectiveCallingConvention,
                                              AstCallingConvention newAstCallingConvention) {
        return new FunctionAbi(newCallingConvention, newEffectiveCallingConvention, newAstCallingConvention, flags, returnInfo, arguments);
    }

    @Override
    public String toString() {
        return "FunctionAbi{" +
                "callingConvention=" + callingConvention +
                ", effective=" + effectiveCallingConvention +
                ", ast=" + astCallingConvention +
                ", flags=" + flags +
                ", return=" + returnInfo +
                ", arguments=" + arguments +
                '}';
    }
}

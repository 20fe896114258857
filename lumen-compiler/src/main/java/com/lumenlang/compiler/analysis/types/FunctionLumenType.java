package com.lumenlang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 内置函数类型: (P1, P2) -> R, T.() -> R, suspend (P) -> R
 */
public final class FunctionLumenType extends LumenType {

    private final LumenType receiverType;     // 可选，扩展函数类型
    private final List<LumenType> paramTypes;
    private final LumenType returnType;
    private final boolean suspend;

    public FunctionLumenType(LumenType receiverType, List<LumenType> paramTypes,
                             LumenType returnType, boolean suspend, boolean nullable) {
        super(nullable);
        this.receiverType = receiverType;
        this.paramTypes = paramTypes != null ? paramTypes : Collections.<LumenType>emptyList();
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.suspend = suspend;
    }

    public FunctionLumenType(List<LumenType> paramTypes, LumenType returnType, boolean suspend) {
        this(null, paramTypes, returnType, suspend, false);
    }

    public LumenType getReceiverType() {
        return receiverType;
    }

    public boolean hasReceiverType() {
        return receiverType != null;
    }

    public List<LumenType> getParamTypes() {
        return paramTypes;
    }

    public LumenType getReturnType() {
        return returnType;
    }

    public boolean isSuspend() {
        return suspend;
    }

    /** 接收者按第一个参数计入的参数类型列表 */
    public List<LumenType> getParamTypesWithReceiver() {
        if (receiverType == null) return paramTypes;
        List<LumenType> result = new ArrayList<>(paramTypes.size() + 1);
        result.add(receiverType);
        result.addAll(paramTypes);
        return result;
    }

    /** 参数个数（含接收者） */
    public int getArity() {
        return paramTypes.size() + (receiverType != null ? 1 : 0);
    }

    public FunctionLumenType withSuspend(boolean suspend) {
        if (this.suspend == suspend) return this;
        return new FunctionLumenType(receiverType, paramTypes, returnType, suspend, nullable);
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        if (this.nullable == nullable) return this;
        return new FunctionLumenType(receiverType, paramTypes, returnType, suspend, nullable);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        if (suspend) sb.append("suspend ");
        if (receiverType != null) {
            sb.append(receiverType.toDisplayString()).append('.');
        }
        sb.append('(');
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toDisplayString());
        }
        sb.append(") -> ");
        sb.append(returnType.toDisplayString());
        if (nullable) {
            return "(" + sb.toString() + ")?";
        }
        return sb.toString();
    }

    @Override
    public <R> R accept(LumenTypeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionLumenType)) return false;
        FunctionLumenType that = (FunctionLumenType) o;
        return nullable == that.nullable
                && suspend == that.suspend
                && Objects.equals(receiverType, that.receiverType)
                && paramTypes.equals(that.paramTypes)
                && returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(receiverType, paramTypes, returnType, suspend, nullable);
    }
}

package com.lumenlang.compiler.analysis.types;

/**
 * 前端已解析类型的基类。
 * 类型检查器产出，lowering 阶段只读消费，再经 TypeConverter 转换为 IR 类型。
 */
public abstract class LumenType {

    protected final boolean nullable;

    protected LumenType(boolean nullable) {
        this.nullable = nullable;
    }

    public boolean isNullable() {
        return nullable;
    }

    /** 返回一个相同类型但可空性不同的副本 */
    public abstract LumenType withNullable(boolean nullable);

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    /** 接受 LumenTypeVisitor 进行类型分派 */
    public abstract <R> R accept(LumenTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}

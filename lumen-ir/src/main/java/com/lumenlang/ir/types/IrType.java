package com.lumenlang.ir.types;

/**
 * IR 类型基类。相等性是结构化的：分类器符号 + 类型实参 + 可空性。
 */
public abstract class IrType {

    protected final boolean nullable;

    protected IrType(boolean nullable) {
        this.nullable = nullable;
    }

    public boolean isNullable() {
        return nullable;
    }

    public abstract IrType withNullable(boolean nullable);

    /** 类型的规范文本形式 */
    public abstract String render();

    @Override
    public String toString() {
        return render();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}

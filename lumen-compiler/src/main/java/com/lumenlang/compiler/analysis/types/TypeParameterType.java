package com.lumenlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 泛型体内引用未替换的类型参数 T。
 */
public final class TypeParameterType extends LumenType {

    private final String name;
    private final LumenType upperBound;  // 默认 Any

    public TypeParameterType(String name, LumenType upperBound, boolean nullable) {
        super(nullable);
        this.name = name;
        this.upperBound = upperBound != null ? upperBound : LumenTypes.ANY;
    }

    public TypeParameterType(String name) {
        this(name, null, false);
    }

    public String getName() {
        return name;
    }

    public LumenType getUpperBound() {
        return upperBound;
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        if (this.nullable == nullable) return this;
        return new TypeParameterType(name, upperBound, nullable);
    }

    @Override
    public String toDisplayString() {
        return nullable ? name + "?" : name;
    }

    @Override
    public <R> R accept(LumenTypeVisitor<R> visitor) {
        return visitor.visitTypeParameter(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeParameterType)) return false;
        TypeParameterType that = (TypeParameterType) o;
        return nullable == that.nullable && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nullable);
    }
}

package com.lumenlang.compiler.analysis.types;

import java.util.List;

/**
 * 交集类型 A &amp; B，只在推断结果中出现，不是 class-like 类型。
 */
public final class IntersectionLumenType extends LumenType {

    private final List<LumenType> components;

    public IntersectionLumenType(List<LumenType> components) {
        super(false);
        if (components == null || components.size() < 2) {
            throw new IllegalArgumentException("Intersection type needs at least two components");
        }
        this.components = components;
    }

    public List<LumenType> getComponents() {
        return components;
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        return this;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("it(");
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) sb.append(" & ");
            sb.append(components.get(i).toDisplayString());
        }
        return sb.append(')').toString();
    }

    @Override
    public <R> R accept(LumenTypeVisitor<R> visitor) {
        return visitor.visitIntersection(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntersectionLumenType)) return false;
        return components.equals(((IntersectionLumenType) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }
}

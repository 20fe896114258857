package com.lumenlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类/接口类型，可含泛型参数: Int, CharArray, List&lt;out String&gt;
 */
public final class ClassLumenType extends LumenType {

    private final String name;
    private final List<LumenTypeArgument> typeArgs;

    public ClassLumenType(String name, boolean nullable) {
        this(name, Collections.<LumenTypeArgument>emptyList(), nullable);
    }

    public ClassLumenType(String name, List<LumenTypeArgument> typeArgs, boolean nullable) {
        super(nullable);
        this.name = Objects.requireNonNull(name, "name");
        this.typeArgs = typeArgs != null ? typeArgs : Collections.<LumenTypeArgument>emptyList();
    }

    public String getName() {
        return name;
    }

    public List<LumenTypeArgument> getTypeArgs() {
        return typeArgs;
    }

    public boolean hasTypeArgs() {
        return !typeArgs.isEmpty();
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        if (this.nullable == nullable) return this;
        return new ClassLumenType(name, typeArgs, nullable);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder(name);
        if (hasTypeArgs()) {
            sb.append('<');
            for (int i = 0; i < typeArgs.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeArgs.get(i).toDisplayString());
            }
            sb.append('>');
        }
        if (nullable) sb.append('?');
        return sb.toString();
    }

    @Override
    public <R> R accept(LumenTypeVisitor<R> visitor) {
        return visitor.visitClass(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassLumenType)) return false;
        ClassLumenType that = (ClassLumenType) o;
        return nullable == that.nullable && name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeArgs, nullable);
    }
}

package lumen.runtime.interpreter.proxy.reflection;

import com.lumenlang.compiler.analysis.types.Variance;

import java.util.Objects;

/**
 * 类型投影：带型变的类型，或星投影（variance 与 type 均为 null）。
 */
public final class TypeProjection {

    public static final TypeProjection STAR = new TypeProjection(null, null);

    private final Variance variance;
    private final TypeProxy type;

    private TypeProjection(Variance variance, TypeProxy type) {
        this.variance = variance;
        this.type = type;
    }

    public static TypeProjection invariant(TypeProxy type) {
        return new TypeProjection(Variance.INVARIANT, Objects.requireNonNull(type, "type"));
    }

    public static TypeProjection contravariant(TypeProxy type) {
        return new TypeProjection(Variance.IN, Objects.requireNonNull(type, "type"));
    }

    public static TypeProjection covariant(TypeProxy type) {
        return new TypeProjection(Variance.OUT, Objects.requireNonNull(type, "type"));
    }

    /** 星投影时为 null */
    public Variance getVariance() {
        return variance;
    }

    /** 星投影时为 null */
    public TypeProxy getType() {
        return type;
    }

    public boolean isStar() {
        return this == STAR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeProjection)) return false;
        TypeProjection that = (TypeProjection) o;
        return variance == that.variance && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variance, type);
    }

    @Override
    public String toString() {
        if (isStar()) return "*";
        switch (variance) {
            case IN: return "in " + type;
            case OUT: return "out " + type;
            default: return type.toString();
        }
    }
}

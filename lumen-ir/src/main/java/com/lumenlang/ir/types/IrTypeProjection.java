package com.lumenlang.ir.types;

import com.lumenlang.compiler.analysis.types.Variance;

import java.util.Objects;

/**
 * 显式型变投影：in T / out T。
 */
public final class IrTypeProjection implements IrTypeArgument {

    private final Variance variance;
    private final IrType type;

    public IrTypeProjection(Variance variance, IrType type) {
        this.variance = Objects.requireNonNull(variance, "variance");
        this.type = Objects.requireNonNull(type, "type");
    }

    public Variance getVariance() {
        return variance;
    }

    public IrType getType() {
        return type;
    }

    @Override
    public IrType typeOrNull() {
        return type;
    }

    @Override
    public <R> R accept(IrTypeArgumentVisitor<R> visitor) {
        return visitor.visitTypeProjection(this);
    }

    @Override
    public String render() {
        switch (variance) {
            case IN:
                return "in " + type.render();
            case OUT:
                return "out " + type.render();
            default:
                return type.render();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTypeProjection)) return false;
        IrTypeProjection that = (IrTypeProjection) o;
        return variance == that.variance && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variance, type);
    }

    @Override
    public String toString() {
        return render();
    }
}

package com.lumenlang.ir.types;

/**
 * 星投影 *。
 */
public final class IrStarProjection implements IrTypeArgument {

    public static final IrStarProjection INSTANCE = new IrStarProjection();

    private IrStarProjection() {
    }

    @Override
    public IrType typeOrNull() {
        return null;
    }

    @Override
    public <R> R accept(IrTypeArgumentVisitor<R> visitor) {
        return visitor.visitStarProjection(this);
    }

    @Override
    public String render() {
        return "*";
    }

    @Override
    public String toString() {
        return "*";
    }
}

package com.lumenlang.ir.types;

/**
 * 类型实参访问者，覆盖全部三种实参形态。
 */
public interface IrTypeArgumentVisitor<R> {
    R visitSimpleType(IrSimpleType argument);
    R visitTypeProjection(IrTypeProjection argument);
    R visitStarProjection(IrStarProjection argument);
}

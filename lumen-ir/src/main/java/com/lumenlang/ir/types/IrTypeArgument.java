package com.lumenlang.ir.types;

/**
 * 类型实参：裸类型（不变）、带型变的投影、或 * 星投影。
 */
public interface IrTypeArgument {

    /** 实参携带的具体类型，星投影返回 null */
    IrType typeOrNull();

    <R> R accept(IrTypeArgumentVisitor<R> visitor);

    String render();
}

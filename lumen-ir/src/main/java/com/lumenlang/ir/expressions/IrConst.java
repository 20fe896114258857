package com.lumenlang.ir.expressions;

import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 常量表达式（Int / Char / String / Boolean / null）。
 */
public class IrConst extends IrExpression {

    private final Object value;

    public IrConst(int startOffset, int endOffset, IrType type, Object value) {
        super(startOffset, endOffset, type);
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitConst(this, data);
    }
}

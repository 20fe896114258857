package com.lumenlang.ir.expressions;

import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 展开元素 *array。
 */
public class IrSpreadElement implements IrVarargElement {

    private final int startOffset;
    private final int endOffset;
    private final IrExpression expression;

    public IrSpreadElement(int startOffset, int endOffset, IrExpression expression) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.expression = expression;
    }

    @Override
    public int getStartOffset() {
        return startOffset;
    }

    @Override
    public int getEndOffset() {
        return endOffset;
    }

    public IrExpression getExpression() {
        return expression;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitSpreadElement(this, data);
    }
}

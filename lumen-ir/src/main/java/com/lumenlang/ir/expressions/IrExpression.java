package com.lumenlang.ir.expressions;

import com.lumenlang.ir.IrStatement;
import com.lumenlang.ir.types.IrType;

/**
 * IR 表达式基类。所有表达式节点都携带类型信息。
 */
public abstract class IrExpression implements IrStatement, IrVarargElement {

    protected final int startOffset;
    protected final int endOffset;
    protected final IrType type;

    protected IrExpression(int startOffset, int endOffset, IrType type) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.type = type;
    }

    @Override
    public int getStartOffset() {
        return startOffset;
    }

    @Override
    public int getEndOffset() {
        return endOffset;
    }

    public IrType getType() {
        return type;
    }
}

package com.lumenlang.ir.expressions;

import com.lumenlang.ir.symbols.IrFunctionSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * return 表达式，类型为 Nothing。
 */
public class IrReturn extends IrExpression {

    private final IrFunctionSymbol<?> returnTargetSymbol;
    private final IrExpression value;

    public IrReturn(int startOffset, int endOffset, IrType nothingType,
                    IrFunctionSymbol<?> returnTargetSymbol, IrExpression value) {
        super(startOffset, endOffset, nothingType);
        this.returnTargetSymbol = returnTargetSymbol;
        this.value = value;
    }

    public IrFunctionSymbol<?> getReturnTargetSymbol() {
        return returnTargetSymbol;
    }

    public IrExpression getValue() {
        return value;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitReturn(this, data);
    }
}

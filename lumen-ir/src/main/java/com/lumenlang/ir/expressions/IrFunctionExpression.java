package com.lumenlang.ir.expressions;

import com.lumenlang.ir.declarations.IrSimpleFunction;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 函数字面量：直接包裹一个局部函数声明。
 */
public class IrFunctionExpression extends IrExpression {

    private final IrSimpleFunction function;
    private final IrStatementOrigin origin;

    public IrFunctionExpression(int startOffset, int endOffset, IrType type,
                                IrSimpleFunction function, IrStatementOrigin origin) {
        super(startOffset, endOffset, type);
        this.function = function;
        this.origin = origin;
    }

    public IrSimpleFunction getFunction() {
        return function;
    }

    public IrStatementOrigin getOrigin() {
        return origin;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitFunctionExpression(this, data);
    }
}

package com.lumenlang.ir.expressions;

import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 函数调用表达式。
 */
public class IrCall extends IrMemberAccessExpression<IrSimpleFunctionSymbol> {

    public IrCall(int startOffset, int endOffset, IrType type, IrSimpleFunctionSymbol symbol,
                  int typeArgumentsCount, int valueArgumentsCount, IrStatementOrigin origin) {
        super(startOffset, endOffset, type, symbol, typeArgumentsCount, valueArgumentsCount, origin);
    }

    public IrCall(int startOffset, int endOffset, IrType type, IrSimpleFunctionSymbol symbol,
                  int typeArgumentsCount, int valueArgumentsCount) {
        this(startOffset, endOffset, type, symbol, typeArgumentsCount, valueArgumentsCount, null);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitCall(this, data);
    }
}

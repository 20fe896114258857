package com.lumenlang.ir.expressions;

import com.lumenlang.ir.symbols.IrFunctionSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 可调用引用表达式 ::foo / receiver::foo。
 * 绑定接收者放在 dispatchReceiver 或 extensionReceiver 槽位。
 */
public class IrFunctionReference extends IrMemberAccessExpression<IrFunctionSymbol<?>> {

    public IrFunctionReference(int startOffset, int endOffset, IrType type, IrFunctionSymbol<?> symbol,
                               int typeArgumentsCount, int valueArgumentsCount, IrStatementOrigin origin) {
        super(startOffset, endOffset, type, symbol, typeArgumentsCount, valueArgumentsCount, origin);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitFunctionReference(this, data);
    }
}

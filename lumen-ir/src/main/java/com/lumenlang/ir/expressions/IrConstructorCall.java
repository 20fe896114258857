package com.lumenlang.ir.expressions;

import com.lumenlang.ir.declarations.IrConstructor;
import com.lumenlang.ir.symbols.IrConstructorSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 构造器调用。类型实参槽位对应所属类的类型参数。
 */
public class IrConstructorCall extends IrMemberAccessExpression<IrConstructorSymbol> {

    public IrConstructorCall(int startOffset, int endOffset, IrType type, IrConstructorSymbol symbol,
                             int typeArgumentsCount, int valueArgumentsCount, IrStatementOrigin origin) {
        super(startOffset, endOffset, type, symbol, typeArgumentsCount, valueArgumentsCount, origin);
    }

    /**
     * 按构造器声明确定槽位数。
     */
    public static IrConstructorCall fromSymbolOwner(int startOffset, int endOffset, IrType type,
                                                    IrConstructorSymbol symbol) {
        IrConstructor constructor = symbol.getOwner();
        int typeArgumentsCount = constructor.getConstructedClass().getTypeParameters().size()
                + constructor.getTypeParameters().size();
        return new IrConstructorCall(startOffset, endOffset, type, symbol,
                typeArgumentsCount, constructor.getValueParameters().size(), null);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitConstructorCall(this, data);
    }
}

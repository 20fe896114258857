package com.lumenlang.ir.expressions;

import com.lumenlang.ir.declarations.IrValueParameter;
import com.lumenlang.ir.symbols.IrValueParameterSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 读取参数值。
 */
public class IrGetValue extends IrExpression {

    private final IrValueParameterSymbol symbol;
    private final IrStatementOrigin origin;

    public IrGetValue(int startOffset, int endOffset, IrType type,
                      IrValueParameterSymbol symbol, IrStatementOrigin origin) {
        super(startOffset, endOffset, type);
        this.symbol = symbol;
        this.origin = origin;
    }

    /** 类型取自参数声明 */
    public static IrGetValue of(int startOffset, int endOffset, IrValueParameter parameter) {
        return new IrGetValue(startOffset, endOffset, parameter.getType(), parameter.getSymbol(), null);
    }

    public IrValueParameterSymbol getSymbol() {
        return symbol;
    }

    public IrStatementOrigin getOrigin() {
        return origin;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitGetValue(this, data);
    }
}

package com.lumenlang.ir.declarations;

import com.lumenlang.ir.expressions.IrExpression;
import com.lumenlang.ir.symbols.IrSymbolOwner;
import com.lumenlang.ir.symbols.IrValueParameterSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 函数参数。接收者参数的 index 为 -1。
 * vararg 参数的 type 是数组类型，varargElementType 是元素类型。
 */
public class IrValueParameter extends IrDeclaration implements IrSymbolOwner {

    private final IrValueParameterSymbol symbol;
    private final String name;
    private final int index;
    private final IrType type;
    private final IrType varargElementType;
    private final IrExpression defaultValue;

    public IrValueParameter(int startOffset, int endOffset, IrDeclarationOrigin origin,
                            IrValueParameterSymbol symbol, String name, int index, IrType type,
                            IrType varargElementType, IrExpression defaultValue) {
        super(startOffset, endOffset, origin);
        this.symbol = symbol;
        this.name = name;
        this.index = index;
        this.type = type;
        this.varargElementType = varargElementType;
        this.defaultValue = defaultValue;
        symbol.bind(this);
    }

    @Override
    public IrValueParameterSymbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    public IrType getType() {
        return type;
    }

    public IrType getVarargElementType() {
        return varargElementType;
    }

    public boolean isVararg() {
        return varargElementType != null;
    }

    public IrExpression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitValueParameter(this, data);
    }
}

package com.lumenlang.ir.declarations;

import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.Set;

/**
 * 普通函数（含成员函数、扩展函数、局部函数）。
 */
public class IrSimpleFunction extends IrFunction {

    private final IrSimpleFunctionSymbol symbol;
    private final IrModality modality;

    public IrSimpleFunction(int startOffset, int endOffset, IrDeclarationOrigin origin,
                            IrSimpleFunctionSymbol symbol, String name,
                            IrVisibility visibility, IrModality modality,
                            IrType returnType, Set<IrModifier> modifiers) {
        super(startOffset, endOffset, origin, name, visibility, modifiers, returnType);
        this.symbol = symbol;
        this.modality = modality != null ? modality : IrModality.FINAL;
        symbol.bind(this);
    }

    @Override
    public IrSimpleFunctionSymbol getSymbol() {
        return symbol;
    }

    public IrModality getModality() {
        return modality;
    }

    public boolean isTailrec() {
        return hasModifier(IrModifier.TAILREC);
    }

    public boolean isOperator() {
        return hasModifier(IrModifier.OPERATOR);
    }

    public boolean isInfix() {
        return hasModifier(IrModifier.INFIX);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitSimpleFunction(this, data);
    }
}

package com.lumenlang.ir.declarations;

import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.symbols.IrConstructorSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.Set;

/**
 * 构造器。返回类型为所属类的默认类型。
 */
public class IrConstructor extends IrFunction {

    private final IrConstructorSymbol symbol;
    private final boolean isPrimary;

    public IrConstructor(int startOffset, int endOffset, IrDeclarationOrigin origin,
                         IrConstructorSymbol symbol, IrVisibility visibility,
                         IrType returnType, Set<IrModifier> modifiers, boolean isPrimary) {
        super(startOffset, endOffset, origin, "<init>", visibility, modifiers, returnType);
        this.symbol = symbol;
        this.isPrimary = isPrimary;
        symbol.bind(this);
    }

    @Override
    public IrConstructorSymbol getSymbol() {
        return symbol;
    }

    public boolean isPrimary() {
        return isPrimary;
    }

    public IrClass getConstructedClass() {
        IrDeclarationParent parent = getParent();
        if (!(parent instanceof IrClass)) {
            throw new IrInternalError("Constructor parent is not a class: " + parent.getName());
        }
        return (IrClass) parent;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitConstructor(this, data);
    }
}

package com.lumenlang.ir.declarations;

import com.lumenlang.compiler.analysis.types.Variance;
import com.lumenlang.ir.symbols.IrSymbolOwner;
import com.lumenlang.ir.symbols.IrTypeParameterSymbol;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类或函数的类型参数声明。
 */
public class IrTypeParameter extends IrDeclaration implements IrSymbolOwner {

    private final IrTypeParameterSymbol symbol;
    private final String name;
    private final int index;
    private final Variance variance;
    private final List<IrType> superTypes = new ArrayList<>();

    public IrTypeParameter(int startOffset, int endOffset, IrDeclarationOrigin origin,
                           IrTypeParameterSymbol symbol, String name, int index, Variance variance) {
        super(startOffset, endOffset, origin);
        this.symbol = symbol;
        this.name = name;
        this.index = index;
        this.variance = variance != null ? variance : Variance.INVARIANT;
        symbol.bind(this);
    }

    @Override
    public IrTypeParameterSymbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    public Variance getVariance() {
        return variance;
    }

    public List<IrType> getSuperTypes() {
        return Collections.unmodifiableList(superTypes);
    }

    public void addSuperType(IrType superType) {
        superTypes.add(superType);
    }

    public IrSimpleType getDefaultType() {
        return new IrSimpleType(symbol);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitTypeParameter(this, data);
    }
}

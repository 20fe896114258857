package com.lumenlang.ir.symbols;

import com.lumenlang.ir.declarations.IrTypeParameter;

public final class IrTypeParameterSymbol extends IrClassifierSymbol<IrTypeParameter> {

    @Override
    public Kind getKind() {
        return Kind.TYPE_PARAMETER;
    }

    @Override
    protected String ownerName() {
        return getOwner().getName();
    }
}

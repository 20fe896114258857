package com.lumenlang.ir.symbols;

import com.lumenlang.ir.declarations.IrClass;

public final class IrClassSymbol extends IrClassifierSymbol<IrClass> {

    @Override
    public Kind getKind() {
        return Kind.CLASS;
    }

    @Override
    protected String ownerName() {
        return getOwner().getName();
    }
}

package com.lumenlang.ir.symbols;

import com.lumenlang.ir.declarations.IrValueParameter;

public final class IrValueParameterSymbol extends IrSymbol<IrValueParameter> {

    @Override
    protected String ownerName() {
        return getOwner().getName();
    }
}

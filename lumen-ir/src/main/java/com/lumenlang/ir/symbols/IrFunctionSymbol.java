package com.lumenlang.ir.symbols;

import com.lumenlang.ir.declarations.IrFunction;

/**
 * 函数符号基类：普通函数或构造器。
 */
public abstract class IrFunctionSymbol<D extends IrFunction> extends IrSymbol<D> {

    @Override
    protected String ownerName() {
        return getOwner().getName();
    }
}

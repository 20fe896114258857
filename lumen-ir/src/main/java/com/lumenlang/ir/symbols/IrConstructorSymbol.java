package com.lumenlang.ir.symbols;

import com.lumenlang.ir.declarations.IrConstructor;

public final class IrConstructorSymbol extends IrFunctionSymbol<IrConstructor> {
}

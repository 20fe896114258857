package com.lumenlang.ir.symbols;

import com.lumenlang.ir.declarations.IrSimpleFunction;

public final class IrSimpleFunctionSymbol extends IrFunctionSymbol<IrSimpleFunction> {
}

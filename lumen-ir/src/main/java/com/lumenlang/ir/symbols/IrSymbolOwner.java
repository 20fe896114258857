package com.lumenlang.ir.symbols;

/**
 * 持有符号的声明。
 */
public interface IrSymbolOwner {

    IrSymbol<?> getSymbol();
}

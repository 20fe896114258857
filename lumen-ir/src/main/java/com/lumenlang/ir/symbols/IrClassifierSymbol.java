package com.lumenlang.ir.symbols;

/**
 * 类型的分类器符号：类或类型参数。
 */
public abstract class IrClassifierSymbol<D extends IrSymbolOwner> extends IrSymbol<D> {

    /**
     * 分类器种类，供穷举分派使用。
     */
    public enum Kind {
        CLASS,
        TYPE_PARAMETER
    }

    public abstract Kind getKind();
}

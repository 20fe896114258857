package com.lumenlang.ir.symbols;

import com.lumenlang.ir.IrInternalError;

/**
 * IR 符号：先分配，后与声明绑定，且只能绑定一次。
 *
 * @param <D> 所有者声明类型
 */
public abstract class IrSymbol<D extends IrSymbolOwner> {

    private D owner;

    public boolean isBound() {
        return owner != null;
    }

    public D getOwner() {
        if (owner == null) {
            throw new IrInternalError("Symbol is not bound: " + getClass().getSimpleName());
        }
        return owner;
    }

    public void bind(D owner) {
        if (this.owner != null) {
            throw new IrInternalError("Symbol is already bound: " + describe());
        }
        this.owner = owner;
    }

    /** 所有者的名称，未绑定时返回 null */
    protected abstract String ownerName();

    private String describe() {
        return getClass().getSimpleName() + "(" + (isBound() ? ownerName() : "unbound") + ")";
    }

    @Override
    public String toString() {
        return describe();
    }
}

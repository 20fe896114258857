package com.lumenlang.ir.declarations;

import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.IrStatement;

/**
 * IR 声明基类。
 */
public abstract class IrDeclaration implements IrStatement {

    protected final int startOffset;
    protected final int endOffset;
    protected final IrDeclarationOrigin origin;
    private IrDeclarationParent parent;

    protected IrDeclaration(int startOffset, int endOffset, IrDeclarationOrigin origin) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.origin = origin != null ? origin : IrDeclarationOrigin.DEFINED;
    }

    @Override
    public int getStartOffset() {
        return startOffset;
    }

    @Override
    public int getEndOffset() {
        return endOffset;
    }

    public IrDeclarationOrigin getOrigin() {
        return origin;
    }

    public boolean hasParent() {
        return parent != null;
    }

    public IrDeclarationParent getParent() {
        if (parent == null) {
            throw new IrInternalError("Parent is not initialized for " + getClass().getSimpleName());
        }
        return parent;
    }

    public void setParent(IrDeclarationParent parent) {
        this.parent = parent;
    }
}

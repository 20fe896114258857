package com.lumenlang.ir.declarations;

import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * 类成员属性（只记录名称与类型）。
 */
public class IrProperty extends IrDeclaration {

    private final String name;
    private final IrType type;
    private final boolean isVar;

    public IrProperty(int startOffset, int endOffset, IrDeclarationOrigin origin,
                      String name, IrType type, boolean isVar) {
        super(startOffset, endOffset, origin);
        this.name = name;
        this.type = type;
        this.isVar = isVar;
    }

    public String getName() {
        return name;
    }

    public IrType getType() {
        return type;
    }

    public boolean isVar() {
        return isVar;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitProperty(this, data);
    }
}

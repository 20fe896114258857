package com.lumenlang.ir.expressions;

import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * vararg 实参：把若干元素打包为数组类型的值。
 */
public class IrVararg extends IrExpression {

    private final IrType varargElementType;
    private final List<IrVarargElement> elements = new ArrayList<>();

    public IrVararg(int startOffset, int endOffset, IrType arrayType, IrType varargElementType) {
        super(startOffset, endOffset, arrayType);
        this.varargElementType = varargElementType;
    }

    public IrType getVarargElementType() {
        return varargElementType;
    }

    public List<IrVarargElement> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public void addElement(IrVarargElement element) {
        elements.add(element);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitVararg(this, data);
    }
}

package com.lumenlang.ir.expressions;

import com.lumenlang.ir.IrElement;
import com.lumenlang.ir.IrStatement;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数体：语句列表。
 */
public class IrBlockBody implements IrElement {

    private final int startOffset;
    private final int endOffset;
    private final List<IrStatement> statements;

    public IrBlockBody(int startOffset, int endOffset, List<? extends IrStatement> statements) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    @Override
    public int getStartOffset() {
        return startOffset;
    }

    @Override
    public int getEndOffset() {
        return endOffset;
    }

    public List<IrStatement> getStatements() {
        return statements;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitBlockBody(this, data);
    }
}

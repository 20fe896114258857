package com.lumenlang.ir.expressions;

import com.lumenlang.ir.IrStatement;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 块表达式，值为最后一条语句。
 */
public class IrBlock extends IrExpression {

    private final IrStatementOrigin origin;
    private final List<IrStatement> statements = new ArrayList<>();

    public IrBlock(int startOffset, int endOffset, IrType type, IrStatementOrigin origin) {
        super(startOffset, endOffset, type);
        this.origin = origin;
    }

    public IrStatementOrigin getOrigin() {
        return origin;
    }

    public List<IrStatement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public void addStatement(IrStatement statement) {
        statements.add(statement);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitBlock(this, data);
    }
}

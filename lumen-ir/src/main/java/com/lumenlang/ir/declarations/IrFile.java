package com.lumenlang.ir.declarations;

import com.lumenlang.ir.IrElement;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译单元，顶层声明的父节点。
 */
public class IrFile implements IrElement, IrDeclarationParent {

    private final String name;
    private final List<IrDeclaration> declarations = new ArrayList<>();

    public IrFile(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<IrDeclaration> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    public void addDeclaration(IrDeclaration declaration) {
        declaration.setParent(this);
        declarations.add(declaration);
    }

    @Override
    public int getStartOffset() {
        return 0;
    }

    @Override
    public int getEndOffset() {
        return 0;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitFile(this, data);
    }
}

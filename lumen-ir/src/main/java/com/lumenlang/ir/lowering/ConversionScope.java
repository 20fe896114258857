package com.lumenlang.ir.lowering;

import com.lumenlang.ir.declarations.IrDeclarationParent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * 当前转换位置的声明父节点栈，生成的适配器挂到栈顶。
 */
public final class ConversionScope {

    private final Deque<IrDeclarationParent> parents = new ArrayDeque<>();

    /** 栈顶父节点，栈空时为 null */
    public IrDeclarationParent parent() {
        return parents.peek();
    }

    public <T> T withParent(IrDeclarationParent parent, Supplier<T> action) {
        parents.push(parent);
        try {
            return action.get();
        } finally {
            parents.pop();
        }
    }

    public void pushParent(IrDeclarationParent parent) {
        parents.push(parent);
    }

    public void popParent() {
        parents.pop();
    }
}

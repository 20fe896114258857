package com.lumenlang.ir.util;

import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.declarations.IrDeclaration;
import com.lumenlang.ir.declarations.IrSimpleFunction;
import com.lumenlang.ir.declarations.IrValueParameter;
import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.symbols.IrValueParameterSymbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * 符号表：分配新符号，并维护严格嵌套的声明作用域栈。
 * <p>
 * 值参数只能在某个作用域打开期间声明，记入当前栈顶帧。
 */
public final class SymbolTable {

    private final Deque<ScopeFrame> scopes = new ArrayDeque<>();
    private int declaredFunctionCount = 0;

    /** 进入 owner 的作用域 */
    public void enterScope(IrDeclaration owner) {
        if (owner == null) {
            throw new IrInternalError("Cannot enter a scope without owner");
        }
        scopes.push(new ScopeFrame(owner));
    }

    /**
     * 离开 owner 的作用域，必须与最近一次 enterScope 配对。
     */
    public void leaveScope(IrDeclaration owner) {
        ScopeFrame top = scopes.peek();
        if (top == null) {
            throw new IrInternalError("Leaving scope of " + describe(owner) + " but no scope is open");
        }
        if (top.owner != owner) {
            throw new IrInternalError("Unbalanced scopes: leaving " + describe(owner)
                    + " while " + describe(top.owner) + " is open");
        }
        scopes.pop();
    }

    public int getScopeDepth() {
        return scopes.size();
    }

    /** 当前作用域中已声明的值参数 */
    public List<IrValueParameterSymbol> getCurrentScopeParameters() {
        ScopeFrame top = scopes.peek();
        if (top == null) return Collections.emptyList();
        return Collections.unmodifiableList(top.parameters);
    }

    public int getDeclaredFunctionCount() {
        return declaredFunctionCount;
    }

    public IrSimpleFunction declareSimpleFunction(Function<IrSimpleFunctionSymbol, IrSimpleFunction> factory) {
        IrSimpleFunction function = factory.apply(new IrSimpleFunctionSymbol());
        declaredFunctionCount++;
        return function;
    }

    public IrValueParameter declareValueParameter(Function<IrValueParameterSymbol, IrValueParameter> factory) {
        ScopeFrame top = scopes.peek();
        if (top == null) {
            throw new IrInternalError("Value parameter declared outside of any scope");
        }
        IrValueParameterSymbol symbol = new IrValueParameterSymbol();
        IrValueParameter parameter = factory.apply(symbol);
        top.parameters.add(symbol);
        return parameter;
    }

    private static String describe(IrDeclaration declaration) {
        return declaration == null ? "<null>" : IrRenderer.renderHeader(declaration);
    }

    private static final class ScopeFrame {
        final IrDeclaration owner;
        final List<IrValueParameterSymbol> parameters = new ArrayList<>();

        ScopeFrame(IrDeclaration owner) {
            this.owner = owner;
        }
    }
}

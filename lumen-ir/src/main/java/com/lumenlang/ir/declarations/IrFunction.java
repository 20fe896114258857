package com.lumenlang.ir.declarations;

import com.lumenlang.ir.expressions.IrBlockBody;
import com.lumenlang.ir.symbols.IrFunctionSymbol;
import com.lumenlang.ir.symbols.IrSymbolOwner;
import com.lumenlang.ir.types.IrType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 函数声明基类，普通函数与构造器共用。
 */
public abstract class IrFunction extends IrDeclaration implements IrSymbolOwner, IrDeclarationParent {

    private final String name;
    private final IrVisibility visibility;
    private final Set<IrModifier> modifiers;
    private final IrType returnType;
    private final List<IrTypeParameter> typeParameters = new ArrayList<>();
    private final List<IrValueParameter> valueParameters = new ArrayList<>();
    private IrValueParameter dispatchReceiverParameter;
    private IrValueParameter extensionReceiverParameter;
    private IrBlockBody body;

    protected IrFunction(int startOffset, int endOffset, IrDeclarationOrigin origin,
                         String name, IrVisibility visibility, Set<IrModifier> modifiers, IrType returnType) {
        super(startOffset, endOffset, origin);
        this.name = name;
        this.visibility = visibility != null ? visibility : IrVisibility.PUBLIC;
        this.modifiers = modifiers == null || modifiers.isEmpty()
                ? EnumSet.noneOf(IrModifier.class) : EnumSet.copyOf(modifiers);
        this.returnType = returnType;
    }

    @Override
    public abstract IrFunctionSymbol<?> getSymbol();

    @Override
    public String getName() {
        return name;
    }

    public IrVisibility getVisibility() {
        return visibility;
    }

    public Set<IrModifier> getModifiers() {
        return Collections.unmodifiableSet(modifiers);
    }

    public boolean hasModifier(IrModifier modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isSuspend() {
        return hasModifier(IrModifier.SUSPEND);
    }

    public boolean isInline() {
        return hasModifier(IrModifier.INLINE);
    }

    public boolean isExternal() {
        return hasModifier(IrModifier.EXTERNAL);
    }

    public boolean isExpect() {
        return hasModifier(IrModifier.EXPECT);
    }

    public IrType getReturnType() {
        return returnType;
    }

    public List<IrTypeParameter> getTypeParameters() {
        return Collections.unmodifiableList(typeParameters);
    }

    public void addTypeParameter(IrTypeParameter typeParameter) {
        typeParameter.setParent(this);
        typeParameters.add(typeParameter);
    }

    public List<IrValueParameter> getValueParameters() {
        return Collections.unmodifiableList(valueParameters);
    }

    public void addValueParameter(IrValueParameter parameter) {
        parameter.setParent(this);
        valueParameters.add(parameter);
    }

    public IrValueParameter getDispatchReceiverParameter() {
        return dispatchReceiverParameter;
    }

    public void setDispatchReceiverParameter(IrValueParameter parameter) {
        if (parameter != null) parameter.setParent(this);
        this.dispatchReceiverParameter = parameter;
    }

    public IrValueParameter getExtensionReceiverParameter() {
        return extensionReceiverParameter;
    }

    public void setExtensionReceiverParameter(IrValueParameter parameter) {
        if (parameter != null) parameter.setParent(this);
        this.extensionReceiverParameter = parameter;
    }

    public IrBlockBody getBody() {
        return body;
    }

    public void setBody(IrBlockBody body) {
        this.body = body;
    }
}

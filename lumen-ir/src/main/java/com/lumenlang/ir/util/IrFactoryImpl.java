package com.lumenlang.ir.util;

import com.lumenlang.ir.IrStatement;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.IrBlockBody;
import com.lumenlang.ir.expressions.IrExpression;
import com.lumenlang.ir.symbols.IrConstructorSymbol;
import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.symbols.IrValueParameterSymbol;
import com.lumenlang.ir.types.IrType;

import java.util.List;
import java.util.Set;

/**
 * 默认工厂，直接构造节点。
 */
public class IrFactoryImpl implements IrFactory {

    public static final IrFactoryImpl INSTANCE = new IrFactoryImpl();

    @Override
    public IrSimpleFunction createFunction(int startOffset, int endOffset, IrDeclarationOrigin origin,
                                           IrSimpleFunctionSymbol symbol, String name,
                                           IrVisibility visibility, IrModality modality,
                                           IrType returnType, Set<IrModifier> modifiers) {
        return new IrSimpleFunction(startOffset, endOffset, origin, symbol, name,
                visibility, modality, returnType, modifiers);
    }

    @Override
    public IrConstructor createConstructor(int startOffset, int endOffset, IrDeclarationOrigin origin,
                                           IrConstructorSymbol symbol, IrVisibility visibility,
                                           IrType returnType, Set<IrModifier> modifiers, boolean isPrimary) {
        return new IrConstructor(startOffset, endOffset, origin, symbol, visibility,
                returnType, modifiers, isPrimary);
    }

    @Override
    public IrValueParameter createValueParameter(int startOffset, int endOffset, IrDeclarationOrigin origin,
                                                 IrValueParameterSymbol symbol, String name, int index,
                                                 IrType type, IrType varargElementType,
                                                 IrExpression defaultValue) {
        return new IrValueParameter(startOffset, endOffset, origin, symbol, name, index,
                type, varargElementType, defaultValue);
    }

    @Override
    public IrBlockBody createBlockBody(int startOffset, int endOffset, List<? extends IrStatement> statements) {
        return new IrBlockBody(startOffset, endOffset, statements);
    }
}

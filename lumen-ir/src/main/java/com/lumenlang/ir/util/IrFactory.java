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
 * IR 声明工厂。
 */
public interface IrFactory {

    IrSimpleFunction createFunction(int startOffset, int endOffset, IrDeclarationOrigin origin,
                                    IrSimpleFunctionSymbol symbol, String name,
                                    IrVisibility visibility, IrModality modality,
                                    IrType returnType, Set<IrModifier> modifiers);

    IrConstructor createConstructor(int startOffset, int endOffset, IrDeclarationOrigin origin,
                                    IrConstructorSymbol symbol, IrVisibility visibility,
                                    IrType returnType, Set<IrModifier> modifiers, boolean isPrimary);

    IrValueParameter createValueParameter(int startOffset, int endOffset, IrDeclarationOrigin origin,
                                          IrValueParameterSymbol symbol, String name, int index,
                                          IrType type, IrType varargElementType, IrExpression defaultValue);

    IrBlockBody createBlockBody(int startOffset, int endOffset, List<? extends IrStatement> statements);
}

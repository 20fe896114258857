package com.lumenlang.ir.visitors;

import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.*;

/**
 * IR 访问者接口，18 个 visit 方法。
 *
 * @param <R> 返回类型
 * @param <D> 上下文类型
 */
public interface IrElementVisitor<R, D> {

    // ===== 声明 (8) =====
    R visitFile(IrFile file, D data);
    R visitClass(IrClass declaration, D data);
    R visitTypeParameter(IrTypeParameter declaration, D data);
    R visitProperty(IrProperty declaration, D data);
    R visitSimpleFunction(IrSimpleFunction declaration, D data);
    R visitConstructor(IrConstructor declaration, D data);
    R visitValueParameter(IrValueParameter declaration, D data);
    R visitBlockBody(IrBlockBody body, D data);

    // ===== 表达式 (10) =====
    R visitCall(IrCall expression, D data);
    R visitConstructorCall(IrConstructorCall expression, D data);
    R visitFunctionReference(IrFunctionReference expression, D data);
    R visitFunctionExpression(IrFunctionExpression expression, D data);
    R visitBlock(IrBlock expression, D data);
    R visitReturn(IrReturn expression, D data);
    R visitGetValue(IrGetValue expression, D data);
    R visitVararg(IrVararg expression, D data);
    R visitSpreadElement(IrSpreadElement element, D data);
    R visitConst(IrConst expression, D data);
}

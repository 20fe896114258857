package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.ClassLumenType;
import com.lumenlang.compiler.analysis.types.FunctionLumenType;
import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;

/**
 * 查找函数值的 invoke 成员。
 */
public interface InvokeMemberResolver {

    /** 内置函数类型 FunctionN 的 invoke */
    IrSimpleFunctionSymbol findBaseInvokeSymbol(FunctionLumenType functionType);

    /**
     * 类自身或其超类型中声明的 operator fun invoke，参数类型与返回类型和 expected 一致。
     * 找不到时返回 null。
     */
    IrSimpleFunctionSymbol findContributedInvokeSymbol(ClassLumenType argumentType, FunctionLumenType expected);
}

package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.ClassLumenType;
import com.lumenlang.compiler.analysis.types.FunctionLumenType;
import com.lumenlang.compiler.analysis.types.LumenType;
import com.lumenlang.ir.IrBuiltIns;
import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrSimpleFunction;
import com.lumenlang.ir.declarations.IrValueParameter;
import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypePredicates.FunctionKind;
import com.lumenlang.ir.util.DeclarationStorage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 在 IR 声明上查找 invoke：内置函数类直接取其 invoke，
 * 用户类按广度优先遍历自身与超类型，取签名与期望函数类型一致的 operator fun invoke。
 */
public class DefaultInvokeMemberResolver implements InvokeMemberResolver {

    private final DeclarationStorage declarationStorage;
    private final TypeConverter typeConverter;
    private final IrBuiltIns builtIns;

    public DefaultInvokeMemberResolver(DeclarationStorage declarationStorage, TypeConverter typeConverter) {
        this.declarationStorage = declarationStorage;
        this.typeConverter = typeConverter;
        this.builtIns = declarationStorage.getBuiltIns();
    }

    @Override
    public IrSimpleFunctionSymbol findBaseInvokeSymbol(FunctionLumenType functionType) {
        IrClass functionClass = builtIns.getFunctionClass(FunctionKind.FUNCTION, functionType.getArity());
        return builtIns.getInvokeFunction(functionClass).getSymbol();
    }

    @Override
    public IrSimpleFunctionSymbol findContributedInvokeSymbol(ClassLumenType argumentType, FunctionLumenType expected) {
        IrClass start = declarationStorage.findClass(argumentType.getName());
        if (start == null) return null;

        List<IrType> parameterTypes = new ArrayList<>();
        for (LumenType parameterType : expected.getParamTypesWithReceiver()) {
            parameterTypes.add(typeConverter.toIrType(parameterType));
        }
        IrType returnType = typeConverter.toIrType(expected.getReturnType());

        Set<IrClass> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<IrClass> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            IrClass current = queue.poll();
            if (!visited.add(current)) continue;
            for (IrSimpleFunction function : current.getFunctions()) {
                if (isInvokeOperator(function) && hasSignature(function, parameterTypes, returnType)) {
                    return function.getSymbol();
                }
            }
            for (IrType superType : current.getSuperTypes()) {
                if (superType instanceof IrSimpleType) {
                    IrClass superClass = ((IrSimpleType) superType).getClassOrNull();
                    if (superClass != null) queue.add(superClass);
                }
            }
        }
        return null;
    }

    private static boolean isInvokeOperator(IrSimpleFunction function) {
        return "invoke".equals(function.getName())
                && function.isOperator()
                && function.getExtensionReceiverParameter() == null;
    }

    private static boolean hasSignature(IrSimpleFunction function, List<IrType> parameterTypes, IrType returnType) {
        List<IrValueParameter> valueParameters = function.getValueParameters();
        if (valueParameters.size() != parameterTypes.size()) return false;
        for (int i = 0; i < valueParameters.size(); i++) {
            if (!valueParameters.get(i).getType().equals(parameterTypes.get(i))) return false;
        }
        return function.getReturnType().equals(returnType);
    }
}

package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.*;
import com.lumenlang.ir.IrBuiltIns;
import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrTypeParameter;
import com.lumenlang.ir.types.IrErrorType;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrStarProjection;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypeArgument;
import com.lumenlang.ir.types.IrTypePredicates.FunctionKind;
import com.lumenlang.ir.types.IrTypeProjection;
import com.lumenlang.ir.util.DeclarationStorage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 通过 DeclarationStorage 解析类名的类型转换器。
 * <ul>
 *   <li>函数类型 → FunctionN / SuspendFunctionN，实参为 [接收者?, 参数..., 返回类型]</li>
 *   <li>类型参数按名称查找已注册的 IrTypeParameter，找不到时退化为其上界</li>
 *   <li>交集类型近似为 Any</li>
 *   <li>未知类名 → IrErrorType</li>
 * </ul>
 */
public class DefaultTypeConverter implements TypeConverter, LumenTypeVisitor<IrType> {

    private final DeclarationStorage declarationStorage;
    private final IrBuiltIns builtIns;
    private final Map<String, IrTypeParameter> typeParameters = new HashMap<>();

    public DefaultTypeConverter(DeclarationStorage declarationStorage) {
        this.declarationStorage = declarationStorage;
        this.builtIns = declarationStorage.getBuiltIns();
    }

    /** 使类型参数名在后续转换中可见 */
    public void registerTypeParameter(IrTypeParameter typeParameter) {
        typeParameters.put(typeParameter.getName(), typeParameter);
    }

    @Override
    public IrType toIrType(LumenType type) {
        return type.accept(this);
    }

    @Override
    public IrType visitClass(ClassLumenType type) {
        IrClass irClass = declarationStorage.findClass(type.getName());
        if (irClass == null) {
            return new IrErrorType("Unresolved class " + type.getName(), type.isNullable());
        }
        List<IrTypeArgument> arguments = new ArrayList<>(type.getTypeArgs().size());
        for (LumenTypeArgument argument : type.getTypeArgs()) {
            arguments.add(toIrTypeArgument(argument));
        }
        return new IrSimpleType(irClass.getSymbol(), arguments, type.isNullable());
    }

    @Override
    public IrType visitFunction(FunctionLumenType type) {
        List<IrType> parameterTypes = new ArrayList<>();
        for (LumenType parameterType : type.getParamTypesWithReceiver()) {
            parameterTypes.add(toIrType(parameterType));
        }
        IrSimpleType functionType = builtIns.functionType(FunctionKind.of(type.isSuspend(), false),
                parameterTypes, toIrType(type.getReturnType()));
        return type.isNullable() ? functionType.withNullable(true) : functionType;
    }

    @Override
    public IrType visitTypeParameter(TypeParameterType type) {
        IrTypeParameter typeParameter = typeParameters.get(type.getName());
        if (typeParameter == null) {
            IrType upperBound = toIrType(type.getUpperBound());
            return type.isNullable() ? upperBound.withNullable(true) : upperBound;
        }
        return typeParameter.getDefaultType().withNullable(type.isNullable());
    }

    @Override
    public IrType visitUnit(UnitType type) {
        return builtIns.unitType().withNullable(type.isNullable());
    }

    @Override
    public IrType visitIntersection(IntersectionLumenType type) {
        return builtIns.anyType().withNullable(type.isNullable());
    }

    private IrTypeArgument toIrTypeArgument(LumenTypeArgument argument) {
        if (argument.isWildcard()) {
            return IrStarProjection.INSTANCE;
        }
        IrType type = toIrType(argument.getType());
        if (argument.getVariance() == Variance.INVARIANT && type instanceof IrSimpleType) {
            return (IrSimpleType) type;
        }
        return new IrTypeProjection(argument.getVariance(), type);
    }
}

package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.ClassLumenType;
import com.lumenlang.compiler.analysis.types.FunctionLumenType;
import com.lumenlang.compiler.analysis.types.FunctionalTypes;
import com.lumenlang.compiler.analysis.types.LumenType;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.resolve.CallableReferenceAccess;
import com.lumenlang.compiler.resolve.ResolvedArgument;
import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.*;
import com.lumenlang.ir.symbols.IrConstructorSymbol;
import com.lumenlang.ir.symbols.IrFunctionSymbol;
import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypeArgument;
import com.lumenlang.ir.types.IrTypePredicates;
import com.lumenlang.ir.types.IrTypePredicates.FunctionKind;
import com.lumenlang.ir.util.IrJsonDumper;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 为可调用引用或函数类型实参生成适配函数。覆盖三种情况：
 * <ol>
 *   <li>挂起转换：期望类型是挂起函数类型，而被引用的函数不是 suspend</li>
 *   <li>Unit 强转：期望返回 Unit，而被引用函数的返回类型不是 Unit</li>
 *   <li>vararg 展开：期望类型按单个元素传递被引用函数的 vararg 参数</li>
 * </ol>
 * 例如 {@code fun consumer(f: (Char, Char) -> String)} 与 {@code fun referenced(vararg xs: Char)}，
 * 在 {@code consumer(::referenced)} 处生成 {@code { p0, p1 -> referenced(p0, p1) }}。
 * <p>
 * 除符号表作用域外不保存跨调用状态。
 */
public class AdapterSynthesizer {

    private static final String RECEIVER_PARAMETER_NAME = "receiver";
    private static final String CALLEE_PARAMETER_NAME = "callee";
    private static final String SUSPEND_CONVERSION_NAME = "suspendConversion";

    /** 从被引用函数复制到适配函数的修饰符 */
    private static final Set<IrModifier> COPIED_MODIFIERS = EnumSet.of(
            IrModifier.INLINE, IrModifier.EXTERNAL, IrModifier.TAILREC,
            IrModifier.SUSPEND, IrModifier.OPERATOR, IrModifier.INFIX, IrModifier.EXPECT);

    private final LoweringContext context;
    private final IrJsonDumper dumper = new IrJsonDumper();

    public AdapterSynthesizer(LoweringContext context) {
        this.context = context;
    }

    // ============ 判定 ============

    /**
     * 可调用引用是否需要适配函数。
     *
     * @param type     引用的期望函数类型（FunctionN / SuspendFunctionN 或其 K 变体）
     * @param function 被引用的函数
     */
    public boolean needsAdapter(CallableReferenceAccess reference, IrSimpleType type, IrFunction function) {
        return needsSuspendConversion(type, function)
                || needsCoercionToUnit(type, function)
                || needsVarargSpread(reference, type, function);
    }

    boolean needsSuspendConversion(IrSimpleType type, IrFunction function) {
        if (!context.getSettings().isSuspendConversionEnabled()) return false;
        return IrTypePredicates.isSuspendFunctionOrKFunction(type) && !function.isSuspend();
    }

    boolean needsCoercionToUnit(IrSimpleType type, IrFunction function) {
        IrType expectedReturnType = expectedReturnTypeOrNull(type);
        return expectedReturnType != null && IrTypePredicates.isUnit(expectedReturnType)
                && !IrTypePredicates.isUnit(function.getReturnType());
    }

    /**
     * 期望类型中 vararg 参数位置上的实参等于其元素类型时，调用方是逐个传元素，需要展开。
     */
    boolean needsVarargSpread(CallableReferenceAccess reference, IrSimpleType type, IrFunction function) {
        // A::foo 的第一个期望参数是接收者
        int shift = reference.hasQualifierReceiver() ? 1 : 0;
        List<IrTypeArgument> arguments = type.getArguments();
        int expectedParameterSize = arguments.size() - 1 - shift;
        List<IrValueParameter> parameters = function.getValueParameters();
        if (expectedParameterSize < parameters.size()) {
            return false;
        }
        for (int i = 0; i < parameters.size(); i++) {
            IrValueParameter parameter = parameters.get(i);
            if (!parameter.isVararg()) continue;
            IrType expected = IrTypePredicates.typeOrNull(arguments.get(shift + i));
            if (expected != null && expected.equals(parameter.getVarargElementType())) {
                return true;
            }
        }
        return false;
    }

    /**
     * KFunctionN / KSuspendFunctionN → FunctionN / SuspendFunctionN，类型实参不变。
     * 适配函数不是反射对象，生成的表达式使用非反射函数类型。
     */
    public IrSimpleType kFunctionTypeToFunctionType(IrSimpleType type) {
        FunctionKind kind = IrTypePredicates.functionKindOf(type);
        if (kind == null) {
            throw new IllegalArgumentException("Not a function type: " + type.render());
        }
        if (!kind.isReflect()) return type;
        return context.getBuiltIns().withFunctionKind(type, kind.nonReflect());
    }

    // ============ 可调用引用适配 ============

    /**
     * 为可调用引用生成适配器。调用方需先确认 {@link #needsAdapter} 为 true。
     *
     * @return 未绑定时为函数表达式；绑定时为 { 适配函数声明; 带接收者的适配函数引用 } 两语句块
     */
    public IrExpression synthesizeForCallableReference(CallableReferenceAccess reference,
                                                       IrExpression explicitReceiverExpression,
                                                       IrFunctionSymbol<?> adapteeSymbol,
                                                       IrSimpleType type) {
        IrFunction adaptee = adapteeSymbol.getOwner();
        IrType expectedReturnType = expectedReturnTypeOrNull(type);
        int startOffset = reference.getLocation().getStartOffset();
        int endOffset = reference.getLocation().getEndOffset();

        ReceiverResolver receiverResolver = context.getReceiverResolver();
        IrExpression boundDispatchReceiver =
                receiverResolver.findBoundReceiver(reference, explicitReceiverExpression, true);
        IrExpression boundExtensionReceiver =
                receiverResolver.findBoundReceiver(reference, explicitReceiverExpression, false);
        if (boundDispatchReceiver != null && boundExtensionReceiver != null) {
            throw new IrInternalError("Bound callable references can't have both receivers: " + reference.render());
        }
        IrExpression boundReceiver = boundDispatchReceiver != null ? boundDispatchReceiver : boundExtensionReceiver;

        IrSimpleFunction adapter = createAdapterFunctionForCallableReference(
                startOffset, endOffset, adaptee, type, boundReceiver);
        IrExpression call = createAdapteeCallForCallableReference(
                reference, adapteeSymbol, adapter, boundDispatchReceiver != null, boundExtensionReceiver != null);
        adapter.setBody(singleStatementBody(startOffset, endOffset, adapter, call,
                expectedReturnType != null && IrTypePredicates.isUnit(expectedReturnType)));

        IrExpression result;
        if (boundReceiver == null) {
            result = new IrFunctionExpression(startOffset, endOffset, type, adapter,
                    IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);
        } else {
            result = boundAdapterReference(startOffset, endOffset, type, adapter, boundReceiver,
                    IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);
        }
        dump(result);
        return result;
    }

    private IrSimpleFunction createAdapterFunctionForCallableReference(int startOffset, int endOffset,
                                                                      IrFunction adaptee, IrSimpleType type,
                                                                      IrExpression boundReceiver) {
        IrType returnType = requireType(expectedReturnTypeOrNull(type), type);
        List<IrType> parameterTypes = expectedParameterTypes(type);

        Set<IrModifier> modifiers = EnumSet.noneOf(IrModifier.class);
        for (IrModifier modifier : adaptee.getModifiers()) {
            if (COPIED_MODIFIERS.contains(modifier)) modifiers.add(modifier);
        }
        if (IrTypePredicates.isSuspendFunctionOrKFunction(type)) {
            modifiers.add(IrModifier.SUSPEND);
        }

        final Set<IrModifier> adapterModifiers = modifiers;
        IrSimpleFunction adapter = context.getSymbolTable().declareSimpleFunction(symbol ->
                context.getIrFactory().createFunction(startOffset, endOffset,
                        IrDeclarationOrigin.ADAPTER_FOR_CALLABLE_REFERENCE, symbol, adaptee.getName(),
                        IrVisibility.LOCAL, IrModality.FINAL, returnType, adapterModifiers));

        context.getSymbolTable().enterScope(adapter);
        try {
            if (boundReceiver != null) {
                adapter.setExtensionReceiverParameter(createAdapterParameter(adapter, RECEIVER_PARAMETER_NAME, -1,
                        boundReceiver.getType(), IrDeclarationOrigin.ADAPTER_PARAMETER_FOR_CALLABLE_REFERENCE));
            }
            for (int i = 0; i < parameterTypes.size(); i++) {
                adapter.addValueParameter(createAdapterParameter(adapter, "p" + i, i,
                        parameterTypes.get(i), IrDeclarationOrigin.ADAPTER_PARAMETER_FOR_CALLABLE_REFERENCE));
            }
        } finally {
            context.getSymbolTable().leaveScope(adapter);
        }

        adapter.setParent(requireConversionParent(adapter));
        return adapter;
    }

    private IrExpression createAdapteeCallForCallableReference(CallableReferenceAccess reference,
                                                               IrFunctionSymbol<?> adapteeSymbol,
                                                               IrFunction adapter,
                                                               boolean dispatchBound, boolean extensionBound) {
        IrFunction adaptee = adapteeSymbol.getOwner();
        int startOffset = adaptee.getStartOffset();
        int endOffset = adaptee.getEndOffset();
        IrType type = adaptee.getReturnType();

        IrMemberAccessExpression<?> call;
        if (adapteeSymbol instanceof IrConstructorSymbol) {
            call = IrConstructorCall.fromSymbolOwner(startOffset, endOffset, type, (IrConstructorSymbol) adapteeSymbol);
        } else if (adapteeSymbol instanceof IrSimpleFunctionSymbol) {
            call = new IrCall(startOffset, endOffset, type, (IrSimpleFunctionSymbol) adapteeSymbol,
                    reference.getTypeArguments().size(), adaptee.getValueParameters().size());
        } else {
            throw IrInternalError.withElement("Unknown callee kind", adaptee);
        }

        ParameterCursor cursor = new ParameterCursor(adapter.getValueParameters());
        if (dispatchBound || extensionBound) {
            IrValueParameter receiverParameter = adapter.getExtensionReceiverParameter();
            IrGetValue receiverValue = new IrGetValue(startOffset, endOffset, receiverParameter.getType(),
                    receiverParameter.getSymbol(), IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);
            if (dispatchBound) {
                call.setDispatchReceiver(receiverValue);
            } else {
                call.setExtensionReceiver(receiverValue);
            }
        } else if (reference.hasQualifierReceiver()) {
            // A::foo：第一个适配参数充当接收者
            if (!cursor.hasNext()) {
                throw IrInternalError.withElement("Unbound reference " + reference.render()
                        + " has no parameter for its receiver", adapter);
            }
            IrGetValue receiverValue = cursor.next(startOffset, endOffset);
            if (adaptee.getExtensionReceiverParameter() != null) {
                call.setExtensionReceiver(receiverValue);
            } else {
                call.setDispatchReceiver(receiverValue);
            }
        }

        List<IrValueParameter> adapteeParameters = adaptee.getValueParameters();
        for (int index = 0; index < adapteeParameters.size(); index++) {
            IrValueParameter parameter = adapteeParameters.get(index);
            if (parameter.isVararg()) {
                call.putValueArgument(index, adaptVarargArgument(parameter, cursor, startOffset, endOffset));
            } else if (parameter.hasDefaultValue()) {
                call.putValueArgument(index, null);
            } else {
                if (!cursor.hasNext()) {
                    throw IrInternalError.withElement("Adapter has too few parameters for "
                            + reference.render(), adapter);
                }
                call.putValueArgument(index, cursor.next(startOffset, endOffset));
            }
        }

        applyTypeArguments(call, reference);
        return call;
    }

    /** vararg 展开的状态 */
    private enum VarargState {
        CONSUMING_ELEMENTS,
        FOUND_WHOLE_ARRAY,
        EXHAUSTED,
        NEITHER_ARRAY_NOR_ELEMENT
    }

    /**
     * 从游标处贪心消费适配参数：类型等于数组类型时作为单个展开元素并结束；
     * 等于元素类型时作为单个元素并继续；都不匹配时放弃，返回 null（不传实参）。
     * 已消费的适配参数不回退。
     */
    private IrExpression adaptVarargArgument(IrValueParameter parameter, ParameterCursor cursor,
                                             int startOffset, int endOffset) {
        if (!cursor.hasNext()) {
            return null;
        }
        IrVararg vararg = new IrVararg(startOffset, endOffset, parameter.getType(), parameter.getVarargElementType());
        VarargState state = VarargState.CONSUMING_ELEMENTS;
        while (state == VarargState.CONSUMING_ELEMENTS) {
            if (!cursor.hasNext()) {
                state = VarargState.EXHAUSTED;
                continue;
            }
            IrType candidateType = cursor.peek().getType();
            if (candidateType.equals(parameter.getType())) {
                vararg.addElement(new IrSpreadElement(startOffset, endOffset, cursor.next(startOffset, endOffset)));
                state = VarargState.FOUND_WHOLE_ARRAY;
            } else if (candidateType.equals(parameter.getVarargElementType())) {
                vararg.addElement(cursor.next(startOffset, endOffset));
            } else {
                state = VarargState.NEITHER_ARRAY_NOR_ELEMENT;
            }
        }
        return state == VarargState.NEITHER_ARRAY_NOR_ELEMENT ? null : vararg;
    }

    /** 引用的类型实参按顺序填入调用的类型实参槽位，多余的忽略 */
    private void applyTypeArguments(IrMemberAccessExpression<?> call, CallableReferenceAccess reference) {
        List<LumenType> typeArguments = reference.getTypeArguments();
        int count = Math.min(typeArguments.size(), call.getTypeArgumentsCount());
        for (int i = 0; i < count; i++) {
            call.putTypeArgument(i, context.getTypeConverter().toIrType(typeArguments.get(i)));
        }
    }

    // ============ 实参挂起转换 ============

    /**
     * 期望参数类型为挂起函数类型、实参静态类型不是时，用挂起适配函数包装实参：
     * <pre>
     * { suspend fun ArgType.suspendConversion(p0, ...) = callee.invoke(p0, ...); argument::suspendConversion }
     * </pre>
     * 其余情况（含已经是适配结果的块）原样返回；找不到兼容的 invoke 成员时也原样返回。
     */
    public IrExpression synthesizeForArgument(IrExpression argument, ResolvedArgument resolvedArgument,
                                              LumenType expectedParameterType) {
        if (!context.getSettings().isSuspendConversionEnabled()) {
            return argument;
        }
        if (isAdapterBlock(argument)) {
            return argument;
        }
        if (expectedParameterType == null) {
            return argument;
        }
        if (!FunctionalTypes.isSuspendFunctionType(expectedParameterType)
                || FunctionalTypes.isSuspendFunctionType(resolvedArgument.getType())) {
            return argument;
        }
        FunctionLumenType expectedFunctionalType =
                FunctionalTypes.suspendFunctionTypeToFunctionType(expectedParameterType);

        IrSimpleFunctionSymbol invokeSymbol = findInvokeSymbol(expectedFunctionalType, resolvedArgument.getType());
        if (invokeSymbol == null) {
            return argument;
        }
        IrType converted = context.getTypeConverter().toIrType(expectedParameterType);
        if (!(converted instanceof IrSimpleType)) {
            throw new IrInternalError("Suspend function type converted to non-simple type: " + converted.render());
        }
        IrSimpleType suspendConvertedType = (IrSimpleType) converted;

        SourceLocation location = resolvedArgument.getLocation();
        int startOffset = location.getStartOffset();
        int endOffset = location.getEndOffset();
        IrSimpleFunction adapter = createAdapterFunctionForArgument(startOffset, endOffset,
                suspendConvertedType, argument.getType(), invokeSymbol);
        IrExpression result = boundAdapterReference(startOffset, endOffset, suspendConvertedType, adapter, argument,
                IrStatementOrigin.SUSPEND_CONVERSION);
        dump(result);
        return result;
    }

    private static boolean isAdapterBlock(IrExpression expression) {
        if (!(expression instanceof IrBlock)) return false;
        IrStatementOrigin origin = ((IrBlock) expression).getOrigin();
        return origin == IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE || origin == IrStatementOrigin.SUSPEND_CONVERSION;
    }

    /**
     * 交集等非类类型直接放弃；内置函数类型取 FunctionN.invoke，
     * 实现了函数类型的类取其 operator fun invoke。
     */
    private IrSimpleFunctionSymbol findInvokeSymbol(FunctionLumenType expectedFunctionalType, LumenType argumentType) {
        if (!FunctionalTypes.isClassLike(argumentType)) {
            return null;
        }
        if (!FunctionalTypes.isSubtypeOfFunctionalType(argumentType, expectedFunctionalType,
                context.getSuperTypeRegistry())) {
            return null;
        }
        InvokeMemberResolver resolver = context.getInvokeMemberResolver();
        if (FunctionalTypes.isBuiltinFunctionalType(argumentType)) {
            return resolver.findBaseInvokeSymbol(expectedFunctionalType);
        }
        return resolver.findContributedInvokeSymbol((ClassLumenType) argumentType, expectedFunctionalType);
    }

    private IrSimpleFunction createAdapterFunctionForArgument(int startOffset, int endOffset, IrSimpleType type,
                                                             IrType argumentType,
                                                             IrSimpleFunctionSymbol invokeSymbol) {
        IrType returnType = requireType(expectedReturnTypeOrNull(type), type);
        List<IrType> parameterTypes = expectedParameterTypes(type);

        IrSimpleFunction adapter = context.getSymbolTable().declareSimpleFunction(symbol ->
                context.getIrFactory().createFunction(startOffset, endOffset,
                        IrDeclarationOrigin.ADAPTER_FOR_SUSPEND_CONVERSION, symbol, SUSPEND_CONVERSION_NAME,
                        IrVisibility.LOCAL, IrModality.FINAL, returnType, EnumSet.of(IrModifier.SUSPEND)));

        context.getSymbolTable().enterScope(adapter);
        try {
            adapter.setExtensionReceiverParameter(createAdapterParameter(adapter, CALLEE_PARAMETER_NAME, -1,
                    argumentType, IrDeclarationOrigin.ADAPTER_PARAMETER_FOR_SUSPEND_CONVERSION));
            for (int i = 0; i < parameterTypes.size(); i++) {
                adapter.addValueParameter(createAdapterParameter(adapter, "p" + i, i,
                        parameterTypes.get(i), IrDeclarationOrigin.ADAPTER_PARAMETER_FOR_SUSPEND_CONVERSION));
            }
            IrCall call = createAdapteeCallForArgument(startOffset, endOffset, adapter, invokeSymbol);
            adapter.setBody(singleStatementBody(startOffset, endOffset, adapter, call,
                    IrTypePredicates.isUnit(returnType)));
        } finally {
            context.getSymbolTable().leaveScope(adapter);
        }

        adapter.setParent(requireConversionParent(adapter));
        return adapter;
    }

    private static IrCall createAdapteeCallForArgument(int startOffset, int endOffset, IrFunction adapter,
                                                       IrSimpleFunctionSymbol invokeSymbol) {
        IrCall call = new IrCall(startOffset, endOffset, adapter.getReturnType(), invokeSymbol,
                0, adapter.getValueParameters().size());
        call.setDispatchReceiver(IrGetValue.of(startOffset, endOffset, adapter.getExtensionReceiverParameter()));
        for (IrValueParameter parameter : adapter.getValueParameters()) {
            call.putValueArgument(parameter.getIndex(), IrGetValue.of(startOffset, endOffset, parameter));
        }
        return call;
    }

    // ============ 公共构造 ============

    private IrValueParameter createAdapterParameter(IrFunction adapter, String name, int index, IrType type,
                                                    IrDeclarationOrigin origin) {
        int startOffset = adapter.getStartOffset();
        int endOffset = adapter.getEndOffset();
        IrValueParameter parameter = context.getSymbolTable().declareValueParameter(symbol ->
                context.getIrFactory().createValueParameter(startOffset, endOffset, origin, symbol,
                        name, index, type, null, null));
        parameter.setParent(adapter);
        return parameter;
    }

    /** 期望返回 Unit 时为裸调用，否则为 return 调用 */
    private IrBlockBody singleStatementBody(int startOffset, int endOffset, IrSimpleFunction adapter,
                                           IrExpression call, boolean returnsUnit) {
        IrExpression statement = returnsUnit
                ? call
                : new IrReturn(startOffset, endOffset, context.getBuiltIns().nothingType(), adapter.getSymbol(), call);
        List<IrExpression> statements = new ArrayList<>(1);
        statements.add(statement);
        return context.getIrFactory().createBlockBody(startOffset, endOffset, statements);
    }

    private static IrBlock boundAdapterReference(int startOffset, int endOffset, IrSimpleType type,
                                                 IrSimpleFunction adapter, IrExpression boundReceiver,
                                                 IrStatementOrigin origin) {
        IrFunctionReference adapterReference = new IrFunctionReference(startOffset, endOffset, type,
                adapter.getSymbol(), adapter.getTypeParameters().size(), adapter.getValueParameters().size(), origin);
        adapterReference.setExtensionReceiver(boundReceiver);
        IrBlock block = new IrBlock(startOffset, endOffset, type, origin);
        block.addStatement(adapter);
        block.addStatement(adapterReference);
        return block;
    }

    private IrDeclarationParent requireConversionParent(IrFunction adapter) {
        IrDeclarationParent parent = context.getConversionScope().parent();
        if (parent == null) {
            throw IrInternalError.withElement("No declaration parent for adapter", adapter);
        }
        return parent;
    }

    private static IrType expectedReturnTypeOrNull(IrSimpleType type) {
        List<IrTypeArgument> arguments = type.getArguments();
        if (arguments.isEmpty()) return null;
        return IrTypePredicates.typeOrNull(arguments.get(arguments.size() - 1));
    }

    /** 除最后一个（返回类型）之外的全部类型实参 */
    private static List<IrType> expectedParameterTypes(IrSimpleType type) {
        List<IrTypeArgument> arguments = type.getArguments();
        List<IrType> result = new ArrayList<>(Math.max(arguments.size() - 1, 0));
        for (int i = 0; i < arguments.size() - 1; i++) {
            result.add(requireType(IrTypePredicates.typeOrNull(arguments.get(i)), type));
        }
        return result;
    }

    private static IrType requireType(IrType type, IrSimpleType functionType) {
        if (type == null) {
            throw new IrInternalError("Star projection in functional type " + functionType.render());
        }
        return type;
    }

    private void dump(IrExpression adapterExpression) {
        LoweringSettings settings = context.getSettings();
        if (settings.isDumpAdapters()) {
            settings.getDumpStream().println(dumper.toJson(adapterExpression));
        }
    }

    /**
     * 适配参数游标，与被引用函数的参数下标独立推进。
     */
    private static final class ParameterCursor {
        private final List<IrValueParameter> parameters;
        private int position;

        ParameterCursor(List<IrValueParameter> parameters) {
            this.parameters = parameters;
        }

        boolean hasNext() {
            return position < parameters.size();
        }

        IrValueParameter peek() {
            return parameters.get(position);
        }

        IrGetValue next(int startOffset, int endOffset) {
            return IrGetValue.of(startOffset, endOffset, parameters.get(position++));
        }
    }
}

package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.LumenType;
import com.lumenlang.compiler.resolve.CallableReferenceAccess;
import com.lumenlang.compiler.resolve.ResolvedArgument;
import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.declarations.IrFunction;
import com.lumenlang.ir.expressions.IrExpression;
import com.lumenlang.ir.expressions.IrFunctionReference;
import com.lumenlang.ir.symbols.IrFunctionSymbol;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypePredicates;
import com.lumenlang.ir.types.IrTypePredicates.FunctionKind;

import java.util.List;

/**
 * 可调用引用与函数类型实参的转换入口。
 * <p>
 * 引用本身的类型是反射函数类型（KFunctionN / KSuspendFunctionN）；需要适配时改用非反射函数类型生成适配器，
 * 否则产出普通的函数引用并接上绑定接收者。
 */
public class CallableReferenceConverter {

    private final LoweringContext context;
    private final AdapterSynthesizer adapterSynthesizer;

    public CallableReferenceConverter(LoweringContext context) {
        this(context, new AdapterSynthesizer(context));
    }

    public CallableReferenceConverter(LoweringContext context, AdapterSynthesizer adapterSynthesizer) {
        this.context = context;
        this.adapterSynthesizer = adapterSynthesizer;
    }

    public AdapterSynthesizer getAdapterSynthesizer() {
        return adapterSynthesizer;
    }

    /**
     * @param expectedType 引用位置的期望函数类型
     */
    public IrExpression convertCallableReference(CallableReferenceAccess reference,
                                                 IrExpression explicitReceiverExpression,
                                                 IrFunctionSymbol<?> adapteeSymbol,
                                                 LumenType expectedType) {
        IrSimpleType referenceType = toReflectFunctionType(expectedType);
        IrFunction adaptee = adapteeSymbol.getOwner();
        if (adapterSynthesizer.needsAdapter(reference, referenceType, adaptee)) {
            return adapterSynthesizer.synthesizeForCallableReference(reference, explicitReceiverExpression,
                    adapteeSymbol, adapterSynthesizer.kFunctionTypeToFunctionType(referenceType));
        }

        int startOffset = reference.getLocation().getStartOffset();
        int endOffset = reference.getLocation().getEndOffset();
        List<LumenType> typeArguments = reference.getTypeArguments();
        IrFunctionReference irReference = new IrFunctionReference(startOffset, endOffset, referenceType,
                adapteeSymbol, typeArguments.size(), adaptee.getValueParameters().size(), null);
        for (int i = 0; i < typeArguments.size(); i++) {
            irReference.putTypeArgument(i, context.getTypeConverter().toIrType(typeArguments.get(i)));
        }

        ReceiverResolver receiverResolver = context.getReceiverResolver();
        IrExpression dispatchReceiver = receiverResolver.findBoundReceiver(reference, explicitReceiverExpression, true);
        IrExpression extensionReceiver = receiverResolver.findBoundReceiver(reference, explicitReceiverExpression, false);
        if (dispatchReceiver != null && extensionReceiver != null) {
            throw new IrInternalError("Bound callable references can't have both receivers: " + reference.render());
        }
        irReference.setDispatchReceiver(dispatchReceiver);
        irReference.setExtensionReceiver(extensionReceiver);
        return irReference;
    }

    /**
     * 函数类型形参位置上的实参：必要时做挂起转换。
     */
    public IrExpression convertArgument(IrExpression argument, ResolvedArgument resolvedArgument,
                                        LumenType expectedParameterType) {
        return adapterSynthesizer.synthesizeForArgument(argument, resolvedArgument, expectedParameterType);
    }

    private IrSimpleType toReflectFunctionType(LumenType expectedType) {
        IrType converted = context.getTypeConverter().toIrType(expectedType);
        FunctionKind kind = IrTypePredicates.functionKindOf(converted);
        if (kind == null) {
            throw new IrInternalError("Callable reference expected type is not functional: " + converted.render());
        }
        return context.getBuiltIns().withFunctionKind((IrSimpleType) converted, FunctionKind.of(kind.isSuspend(), true));
    }
}

package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.resolve.CallableReferenceAccess;
import com.lumenlang.compiler.resolve.ExplicitReceiverKind;
import com.lumenlang.ir.expressions.IrExpression;

/**
 * 只有 a::foo 形式的显式表达式接收者才算绑定；A::foo 与 ::foo 均视为未绑定。
 */
public class ExplicitReceiverResolver implements ReceiverResolver {

    @Override
    public IrExpression findBoundReceiver(CallableReferenceAccess reference, IrExpression explicitReceiverExpression,
                                          boolean isDispatch) {
        boolean present = isDispatch ? reference.hasDispatchReceiver() : reference.hasExtensionReceiver();
        if (!present) {
            return null;
        }
        if (reference.getExplicitReceiverKind() != ExplicitReceiverKind.EXPRESSION) {
            return null;
        }
        return explicitReceiverExpression;
    }
}

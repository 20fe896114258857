package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.resolve.CallableReferenceAccess;
import com.lumenlang.ir.expressions.IrExpression;

/**
 * 查找可调用引用的绑定接收者。
 */
public interface ReceiverResolver {

    /**
     * @param isDispatch true 查找分派接收者，false 查找扩展接收者
     * @return 绑定的接收者表达式；对应槽位不存在或未绑定时为 null
     */
    IrExpression findBoundReceiver(CallableReferenceAccess reference, IrExpression explicitReceiverExpression,
                                   boolean isDispatch);
}

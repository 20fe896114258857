package com.lumenlang.ir;

import com.lumenlang.ir.util.IrRenderer;

/**
 * 编译器内部一致性错误。
 * <p>
 * 表示上游解析或 lowering 自身的缺陷，而非用户代码错误；不做恢复，直接中止当前编译单元。
 */
public class IrInternalError extends RuntimeException {

    public IrInternalError(String message) {
        super(message);
    }

    public IrInternalError(String message, Throwable cause) {
        super(message, cause);
    }

    /** 消息后附带出错节点的渲染文本 */
    public static IrInternalError withElement(String message, IrElement element) {
        return new IrInternalError(message + ": " + IrRenderer.render(element));
    }
}

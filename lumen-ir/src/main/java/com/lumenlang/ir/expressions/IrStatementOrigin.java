package com.lumenlang.ir.expressions;

/**
 * 表达式的合成来源标记。
 */
public enum IrStatementOrigin {
    /** 可调用引用适配器（挂起转换 / Unit 强转 / vararg 展开） */
    ADAPTED_FUNCTION_REFERENCE,
    /** 实参挂起转换 */
    SUSPEND_CONVERSION
}

package com.lumenlang.compiler.resolve;

/**
 * 可调用引用的显式接收者种类。
 */
public enum ExplicitReceiverKind {
    /** ::foo */
    NONE,
    /** A::foo，接收者是类型限定符，不是值（未绑定引用） */
    RESOLVED_QUALIFIER,
    /** a::foo，接收者是表达式值（绑定引用） */
    EXPRESSION
}

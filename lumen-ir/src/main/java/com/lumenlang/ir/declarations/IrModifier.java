package com.lumenlang.ir.declarations;

/**
 * 函数修饰符标记。
 */
public enum IrModifier {
    INLINE,
    EXTERNAL,
    TAILREC,
    SUSPEND,
    OPERATOR,
    INFIX,
    EXPECT
}

package com.lumenlang.ir.expressions;

import com.lumenlang.ir.IrElement;

/**
 * vararg 实参的元素：单个表达式或展开元素 *array。
 */
public interface IrVarargElement extends IrElement {
}

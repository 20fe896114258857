package com.lumenlang.ir;

/**
 * 可出现在语句位置的节点：声明或表达式。
 */
public interface IrStatement extends IrElement {
}

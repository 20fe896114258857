package com.lumenlang.ir;

import com.lumenlang.ir.visitors.IrElementVisitor;

/**
 * IR 节点接口。
 * 所有节点携带源码偏移区间 [startOffset, endOffset)，合成节点沿用被适配节点的偏移。
 */
public interface IrElement {

    int getStartOffset();

    int getEndOffset();

    <R, D> R accept(IrElementVisitor<R, D> visitor, D data);
}

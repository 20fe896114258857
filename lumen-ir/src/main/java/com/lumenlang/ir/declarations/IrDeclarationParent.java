package com.lumenlang.ir.declarations;

/**
 * 可作为声明父节点的元素：文件、类、函数。
 */
public interface IrDeclarationParent {

    /** 父节点的名称（诊断用） */
    String getName();
}

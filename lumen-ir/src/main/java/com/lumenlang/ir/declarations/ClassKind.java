package com.lumenlang.ir.declarations;

/**
 * IR 类的种类：普通类、接口、枚举、单例对象、注解。
 */
public enum ClassKind {
    CLASS,
    INTERFACE,
    ENUM,
    OBJECT,
    ANNOTATION
}

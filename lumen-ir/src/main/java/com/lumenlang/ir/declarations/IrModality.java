package com.lumenlang.ir.declarations;

public enum IrModality {
    FINAL,
    OPEN,
    ABSTRACT
}

package com.lumenlang.ir.declarations;

public enum IrVisibility {
    PUBLIC,
    INTERNAL,
    PROTECTED,
    PRIVATE,
    LOCAL
}

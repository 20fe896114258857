package com.lumenlang.ir.declarations;

/**
 * 声明的来源。
 */
public enum IrDeclarationOrigin {
    DEFINED,
    IR_BUILTIN,
    ADAPTER_FOR_CALLABLE_REFERENCE,
    ADAPTER_PARAMETER_FOR_CALLABLE_REFERENCE,
    ADAPTER_FOR_SUSPEND_CONVERSION,
    ADAPTER_PARAMETER_FOR_SUSPEND_CONVERSION
}

package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.LumenType;
import com.lumenlang.ir.types.IrType;

/**
 * 前端类型 → IR 类型。
 */
public interface TypeConverter {

    IrType toIrType(LumenType type);
}

package com.lumenlang.compiler.analysis.types;

/**
 * use-site 型变标记
 */
public enum Variance {
    INVARIANT,  // 不变
    IN,         // 逆变
    OUT         // 协变
}

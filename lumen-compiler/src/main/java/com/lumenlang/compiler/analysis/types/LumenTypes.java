package com.lumenlang.compiler.analysis.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 预定义类型常量和工厂方法。
 */
public final class LumenTypes {

    private LumenTypes() {}

    public static final ClassLumenType ANY = new ClassLumenType("Any", false);
    public static final ClassLumenType NOTHING = new ClassLumenType("Nothing", false);
    public static final ClassLumenType INT = new ClassLumenType("Int", false);
    public static final ClassLumenType LONG = new ClassLumenType("Long", false);
    public static final ClassLumenType BOOLEAN = new ClassLumenType("Boolean", false);
    public static final ClassLumenType CHAR = new ClassLumenType("Char", false);
    public static final ClassLumenType STRING = new ClassLumenType("String", false);
    public static final ClassLumenType CHAR_ARRAY = new ClassLumenType("CharArray", false);
    public static final ClassLumenType INT_ARRAY = new ClassLumenType("IntArray", false);
    public static final UnitType UNIT = UnitType.INSTANCE;

    /** 创建 List&lt;elem&gt; 类型 */
    public static ClassLumenType listOf(LumenType elem) {
        return new ClassLumenType("List",
                Collections.singletonList(LumenTypeArgument.invariant(elem)), false);
    }

    /** 创建 Array&lt;out elem&gt; 类型（非原始元素的 vararg 参数类型） */
    public static ClassLumenType arrayOf(LumenType elem) {
        return new ClassLumenType("Array",
                Collections.singletonList(LumenTypeArgument.of(Variance.OUT, elem)), false);
    }

    /** 创建普通函数类型 (params) -> ret */
    public static FunctionLumenType function(LumenType ret, LumenType... params) {
        return new FunctionLumenType(Arrays.asList(params), ret, false);
    }

    /** 创建挂起函数类型 suspend (params) -> ret */
    public static FunctionLumenType suspendFunction(LumenType ret, LumenType... params) {
        return new FunctionLumenType(Arrays.asList(params), ret, true);
    }

    /** 按参数列表创建函数类型 */
    public static FunctionLumenType function(List<LumenType> params, LumenType ret, boolean suspend) {
        return new FunctionLumenType(params, ret, suspend);
    }

    /** 包装为可空类型 */
    public static LumenType nullable(LumenType type) {
        if (type == null) return null;
        return type.withNullable(true);
    }
}

package com.lumenlang.compiler.analysis.types;

/**
 * 前端函数类型判定。
 */
public final class FunctionalTypes {

    private FunctionalTypes() {}

    public static boolean isSuspendFunctionType(LumenType type) {
        return type instanceof FunctionLumenType && ((FunctionLumenType) type).isSuspend();
    }

    /** 内置（非挂起）函数类型 (P) -> R */
    public static boolean isBuiltinFunctionalType(LumenType type) {
        return type instanceof FunctionLumenType && !((FunctionLumenType) type).isSuspend();
    }

    /** 类或内置函数类型；交集、类型参数等不算 */
    public static boolean isClassLike(LumenType type) {
        return type instanceof ClassLumenType || type instanceof FunctionLumenType;
    }

    /**
     * suspend (P) -> R 转换为对应的非挂起函数超类型 (P) -> R。
     */
    public static FunctionLumenType suspendFunctionTypeToFunctionType(LumenType type) {
        if (!isSuspendFunctionType(type)) {
            throw new IllegalArgumentException("Not a suspend function type: " + type);
        }
        return ((FunctionLumenType) type).withSuspend(false);
    }

    /**
     * 判断 type 是否为函数接口 expected 的子类型（内置函数类型或实现了该函数类型的类）。
     */
    public static boolean isSubtypeOfFunctionalType(LumenType type, FunctionLumenType expected,
                                                    SuperTypeRegistry registry) {
        return registry.isSubtype(type, expected);
    }
}

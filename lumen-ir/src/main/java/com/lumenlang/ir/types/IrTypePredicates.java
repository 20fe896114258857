package com.lumenlang.ir.types;

import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrDeclarationOrigin;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IR 类型判定工具：Unit、函数类型族（FunctionN / SuspendFunctionN / KFunctionN / KSuspendFunctionN）。
 */
public final class IrTypePredicates {

    private static final Pattern FUNCTION_CLASS = Pattern.compile("(K?)(Suspend)?Function(\\d+)");

    private IrTypePredicates() {}

    /**
     * 函数类型族的种类。
     */
    public enum FunctionKind {
        FUNCTION("Function", false, false),
        SUSPEND_FUNCTION("SuspendFunction", true, false),
        K_FUNCTION("KFunction", false, true),
        K_SUSPEND_FUNCTION("KSuspendFunction", true, true);

        private final String classNamePrefix;
        private final boolean suspend;
        private final boolean reflect;

        FunctionKind(String classNamePrefix, boolean suspend, boolean reflect) {
            this.classNamePrefix = classNamePrefix;
            this.suspend = suspend;
            this.reflect = reflect;
        }

        public String className(int arity) {
            return classNamePrefix + arity;
        }

        public boolean isSuspend() {
            return suspend;
        }

        public boolean isReflect() {
            return reflect;
        }

        /** 去掉反射标记后的种类：KFunction → Function，KSuspendFunction → SuspendFunction */
        public FunctionKind nonReflect() {
            return suspend ? SUSPEND_FUNCTION : FUNCTION;
        }

        public static FunctionKind of(boolean suspend, boolean reflect) {
            if (reflect) return suspend ? K_SUSPEND_FUNCTION : K_FUNCTION;
            return suspend ? SUSPEND_FUNCTION : FUNCTION;
        }
    }

    /** 内置函数类的种类，非函数类返回 null */
    public static FunctionKind functionKindOf(IrClass irClass) {
        if (irClass == null || irClass.getOrigin() != IrDeclarationOrigin.IR_BUILTIN) return null;
        Matcher m = FUNCTION_CLASS.matcher(irClass.getName());
        if (!m.matches()) return null;
        return FunctionKind.of(m.group(2) != null, !m.group(1).isEmpty());
    }

    /** 内置函数类的元数（参数个数），非函数类返回 -1 */
    public static int functionArityOf(IrClass irClass) {
        if (functionKindOf(irClass) == null) return -1;
        Matcher m = FUNCTION_CLASS.matcher(irClass.getName());
        return m.matches() ? Integer.parseInt(m.group(3)) : -1;
    }

    public static FunctionKind functionKindOf(IrType type) {
        if (!(type instanceof IrSimpleType)) return null;
        return functionKindOf(((IrSimpleType) type).getClassOrNull());
    }

    public static boolean isUnit(IrType type) {
        return isBuiltinClass(type, "Unit") && !type.isNullable();
    }

    public static boolean isNothing(IrType type) {
        return isBuiltinClass(type, "Nothing") && !type.isNullable();
    }

    private static boolean isBuiltinClass(IrType type, String name) {
        if (!(type instanceof IrSimpleType)) return false;
        IrClass irClass = ((IrSimpleType) type).getClassOrNull();
        return irClass != null && irClass.getOrigin() == IrDeclarationOrigin.IR_BUILTIN
                && name.equals(irClass.getName());
    }

    public static boolean isFunction(IrType type) {
        return functionKindOf(type) == FunctionKind.FUNCTION;
    }

    public static boolean isSuspendFunction(IrType type) {
        return functionKindOf(type) == FunctionKind.SUSPEND_FUNCTION;
    }

    public static boolean isKFunction(IrType type) {
        return functionKindOf(type) == FunctionKind.K_FUNCTION;
    }

    public static boolean isKSuspendFunction(IrType type) {
        return functionKindOf(type) == FunctionKind.K_SUSPEND_FUNCTION;
    }

    /** SuspendFunctionN 或 KSuspendFunctionN */
    public static boolean isSuspendFunctionOrKFunction(IrType type) {
        FunctionKind kind = functionKindOf(type);
        return kind != null && kind.isSuspend();
    }

    public static boolean isFunctionOrKFunction(IrType type) {
        FunctionKind kind = functionKindOf(type);
        return kind == FunctionKind.FUNCTION || kind == FunctionKind.K_FUNCTION;
    }

    /** 类型实参的具体类型，星投影返回 null */
    public static IrType typeOrNull(IrTypeArgument argument) {
        return argument != null ? argument.typeOrNull() : null;
    }
}

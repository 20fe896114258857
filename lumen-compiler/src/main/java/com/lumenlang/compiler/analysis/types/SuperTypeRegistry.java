package com.lumenlang.compiler.analysis.types;

import java.util.*;

/**
 * 管理类型继承关系，用于子类型判断。
 * 内置常见类型继承关系 + 注册用户定义类；超类型以完整 LumenType 记录，
 * 因此类可以实现函数类型（class Foo : (Int) -> String）。
 */
public final class SuperTypeRegistry {

    private final Map<String, List<LumenType>> superTypes = new LinkedHashMap<>();

    public SuperTypeRegistry() {
        // 内置继承关系
        register("Int", new ClassLumenType("Number", false), new ClassLumenType("Comparable", false));
        register("Long", new ClassLumenType("Number", false), new ClassLumenType("Comparable", false));
        register("Char", new ClassLumenType("Comparable", false));
        register("String", new ClassLumenType("Comparable", false));
        register("Boolean", LumenTypes.ANY);
        register("Number", LumenTypes.ANY);
        register("Comparable", LumenTypes.ANY);
        register("CharArray", LumenTypes.ANY);
        register("IntArray", LumenTypes.ANY);
        register("Array", LumenTypes.ANY);
        register("List", LumenTypes.ANY);
    }

    private void register(String name, LumenType... supers) {
        superTypes.put(name, new ArrayList<>(Arrays.asList(supers)));
    }

    /**
     * 注册用户定义类的直接超类型（可多次调用，追加）。
     */
    public void registerClass(String name, List<? extends LumenType> supers) {
        List<LumenType> existing = superTypes.get(name);
        if (existing == null) {
            existing = new ArrayList<>();
            superTypes.put(name, existing);
        }
        if (supers != null) {
            existing.addAll(supers);
        }
    }

    public void registerClass(String name, LumenType... supers) {
        registerClass(name, Arrays.asList(supers));
    }

    /** 直接超类型，未注册返回空列表 */
    public List<LumenType> getSuperTypes(String name) {
        List<LumenType> supers = superTypes.get(name);
        return supers != null ? Collections.unmodifiableList(supers) : Collections.<LumenType>emptyList();
    }

    /**
     * 判断 sub 是否是 sup 的子类型（按类名递归向上查找）。
     */
    public boolean isSubtype(String sub, String sup) {
        if (sub == null || sup == null) return false;
        if (sub.equals(sup)) return true;
        if ("Any".equals(sup)) return true;
        if ("Nothing".equals(sub)) return true;

        for (LumenType parent : getSuperTypes(sub)) {
            if (parent instanceof ClassLumenType && isSubtype(((ClassLumenType) parent).getName(), sup)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 结构化子类型判断。函数类型参数逆变、返回值协变；
     * 同名类的类型参数要求相等（* 通配符接受任意实参）。
     */
    public boolean isSubtype(LumenType sub, LumenType sup) {
        if (sub == null || sup == null) return false;
        if (sub.equals(sup)) return true;
        if (sub.isNullable() && !sup.isNullable()) return false;
        if (sup instanceof ClassLumenType && "Any".equals(((ClassLumenType) sup).getName())) return true;
        if (sub instanceof ClassLumenType && "Nothing".equals(((ClassLumenType) sub).getName())) return true;

        if (sub instanceof TypeParameterType) {
            return isSubtype(((TypeParameterType) sub).getUpperBound(), sup);
        }
        if (sub instanceof IntersectionLumenType) {
            for (LumenType component : ((IntersectionLumenType) sub).getComponents()) {
                if (isSubtype(component, sup)) return true;
            }
            return false;
        }
        if (sup instanceof FunctionLumenType) {
            return isSubtypeOfFunction(sub, (FunctionLumenType) sup, new HashSet<>());
        }
        if (sub instanceof ClassLumenType && sup instanceof ClassLumenType) {
            return isSubclass((ClassLumenType) sub, (ClassLumenType) sup, new HashSet<>());
        }
        return false;
    }

    private boolean isSubtypeOfFunction(LumenType sub, FunctionLumenType sup, Set<String> visited) {
        if (sub instanceof FunctionLumenType) {
            FunctionLumenType fn = (FunctionLumenType) sub;
            if (fn.isSuspend() != sup.isSuspend() || fn.getArity() != sup.getArity()) return false;
            List<LumenType> subParams = fn.getParamTypesWithReceiver();
            List<LumenType> supParams = sup.getParamTypesWithReceiver();
            for (int i = 0; i < subParams.size(); i++) {
                if (!isSubtype(supParams.get(i), subParams.get(i))) return false;
            }
            return isSubtype(fn.getReturnType(), sup.getReturnType());
        }
        if (sub instanceof ClassLumenType) {
            String name = ((ClassLumenType) sub).getName();
            if (!visited.add(name)) return false;
            for (LumenType parent : getSuperTypes(name)) {
                if (isSubtypeOfFunction(parent, sup, visited)) return true;
            }
        }
        return false;
    }

    private boolean isSubclass(ClassLumenType sub, ClassLumenType sup, Set<String> visited) {
        if (sub.getName().equals(sup.getName())) {
            return argumentsMatch(sub.getTypeArgs(), sup.getTypeArgs());
        }
        if (!visited.add(sub.getName())) return false;
        for (LumenType parent : getSuperTypes(sub.getName())) {
            if (parent instanceof ClassLumenType && isSubclass((ClassLumenType) parent, sup, visited)) {
                return true;
            }
        }
        return false;
    }

    private static boolean argumentsMatch(List<LumenTypeArgument> subArgs, List<LumenTypeArgument> supArgs) {
        if (supArgs.isEmpty()) return true;
        if (subArgs.size() != supArgs.size()) return false;
        for (int i = 0; i < subArgs.size(); i++) {
            LumenTypeArgument expected = supArgs.get(i);
            if (!expected.isWildcard() && !expected.equals(subArgs.get(i))) return false;
        }
        return true;
    }
}

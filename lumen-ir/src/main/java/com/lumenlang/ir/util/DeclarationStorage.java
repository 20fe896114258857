package com.lumenlang.ir.util;

import com.lumenlang.ir.IrBuiltIns;
import com.lumenlang.ir.declarations.IrClass;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 类名 → IrClass 注册表。用户类优先，找不到时回退到内置类。
 */
public final class DeclarationStorage {

    private final IrBuiltIns builtIns;
    private final Map<String, IrClass> classes = new LinkedHashMap<>();

    public DeclarationStorage(IrBuiltIns builtIns) {
        this.builtIns = builtIns;
    }

    public IrBuiltIns getBuiltIns() {
        return builtIns;
    }

    public void registerClass(IrClass irClass) {
        IrClass previous = classes.putIfAbsent(irClass.getName(), irClass);
        if (previous != null && previous != irClass) {
            throw new IllegalArgumentException("Class already registered: " + irClass.getName());
        }
    }

    /** 未知类名返回 null */
    public IrClass findClass(String name) {
        IrClass irClass = classes.get(name);
        return irClass != null ? irClass : builtIns.findClass(name);
    }
}

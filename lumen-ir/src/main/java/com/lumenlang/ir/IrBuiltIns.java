package com.lumenlang.ir;

import com.lumenlang.compiler.analysis.types.Variance;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.symbols.IrClassSymbol;
import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.symbols.IrTypeParameterSymbol;
import com.lumenlang.ir.symbols.IrValueParameterSymbol;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypeArgument;
import com.lumenlang.ir.types.IrTypePredicates;
import com.lumenlang.ir.types.IrTypePredicates.FunctionKind;
import com.lumenlang.ir.types.IrTypeProjection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内置类声明与常用类型。
 * <p>
 * 基础类在构造时创建；函数类族（FunctionN / SuspendFunctionN / KFunctionN / KSuspendFunctionN）
 * 按元数首次访问时创建，每个类带一个 operator fun invoke。
 */
public final class IrBuiltIns {

    public static final int UNDEFINED_OFFSET = -1;

    private static final Pattern FUNCTION_CLASS_NAME = Pattern.compile("(K?)(Suspend)?Function(\\d+)");

    private final IrFile file = new IrFile("<builtins>");
    private final Map<String, IrClass> classes = new LinkedHashMap<>();
    private final Map<String, IrClass> functionClasses = new HashMap<>();

    private final IrClass anyClass;
    private final IrClass nothingClass;
    private final IrClass unitClass;
    private final IrClass booleanClass;
    private final IrClass charClass;
    private final IrClass intClass;
    private final IrClass longClass;
    private final IrClass stringClass;
    private final IrClass charArrayClass;
    private final IrClass intArrayClass;
    private final IrClass arrayClass;
    private final IrClass listClass;
    private final IrClass kTypeClass;
    private final IrClass kTypeParameterClass;
    private final IrClass kClassClass;

    public IrBuiltIns() {
        anyClass = createClass("Any", ClassKind.CLASS);
        nothingClass = createClass("Nothing", ClassKind.CLASS);
        unitClass = createClass("Unit", ClassKind.OBJECT);
        booleanClass = createClass("Boolean", ClassKind.CLASS);
        charClass = createClass("Char", ClassKind.CLASS);
        intClass = createClass("Int", ClassKind.CLASS);
        longClass = createClass("Long", ClassKind.CLASS);
        stringClass = createClass("String", ClassKind.CLASS);
        charArrayClass = createClass("CharArray", ClassKind.CLASS);
        intArrayClass = createClass("IntArray", ClassKind.CLASS);
        arrayClass = createClass("Array", ClassKind.CLASS);
        addTypeParameter(arrayClass, "T", Variance.INVARIANT);
        listClass = createClass("List", ClassKind.INTERFACE);
        addTypeParameter(listClass, "E", Variance.OUT);

        kTypeClass = createClass("KType", ClassKind.INTERFACE);
        kTypeParameterClass = createClass("KTypeParameter", ClassKind.INTERFACE);
        kClassClass = createClass("KClass", ClassKind.INTERFACE);
        addTypeParameter(kClassClass, "T", Variance.INVARIANT);
        kClassClass.addMember(new IrProperty(UNDEFINED_OFFSET, UNDEFINED_OFFSET, IrDeclarationOrigin.IR_BUILTIN,
                "simpleName", stringType().withNullable(true), false));
        kClassClass.addMember(new IrProperty(UNDEFINED_OFFSET, UNDEFINED_OFFSET, IrDeclarationOrigin.IR_BUILTIN,
                "typeParameters", listType(kTypeParameterClass.getDefaultType()), false));
    }

    private IrClass createClass(String name, ClassKind kind) {
        IrClass irClass = new IrClass(UNDEFINED_OFFSET, UNDEFINED_OFFSET, IrDeclarationOrigin.IR_BUILTIN,
                new IrClassSymbol(), name, kind);
        if (!"Any".equals(name) && !"Nothing".equals(name) && anyClass != null) {
            irClass.addSuperType(anyClass.getDefaultType());
        }
        file.addDeclaration(irClass);
        classes.put(name, irClass);
        return irClass;
    }

    private static IrTypeParameter addTypeParameter(IrClass owner, String name, Variance variance) {
        IrTypeParameter typeParameter = new IrTypeParameter(UNDEFINED_OFFSET, UNDEFINED_OFFSET,
                IrDeclarationOrigin.IR_BUILTIN, new IrTypeParameterSymbol(), name,
                owner.getTypeParameters().size(), variance);
        owner.addTypeParameter(typeParameter);
        return typeParameter;
    }

    // ============ 类 ============

    public IrFile getFile() {
        return file;
    }

    public IrClass getAnyClass() { return anyClass; }
    public IrClass getNothingClass() { return nothingClass; }
    public IrClass getUnitClass() { return unitClass; }
    public IrClass getBooleanClass() { return booleanClass; }
    public IrClass getCharClass() { return charClass; }
    public IrClass getIntClass() { return intClass; }
    public IrClass getLongClass() { return longClass; }
    public IrClass getStringClass() { return stringClass; }
    public IrClass getCharArrayClass() { return charArrayClass; }
    public IrClass getIntArrayClass() { return intArrayClass; }
    public IrClass getArrayClass() { return arrayClass; }
    public IrClass getListClass() { return listClass; }
    public IrClass getKClassClass() { return kClassClass; }
    public IrClass getKTypeParameterClass() { return kTypeParameterClass; }
    public IrClass getKTypeClass() { return kTypeClass; }

    /**
     * 按名称查找内置类，函数类族按需创建。未知名称返回 null。
     */
    public IrClass findClass(String name) {
        IrClass irClass = classes.get(name);
        if (irClass != null) return irClass;
        Matcher m = FUNCTION_CLASS_NAME.matcher(name);
        if (m.matches()) {
            FunctionKind kind = FunctionKind.of(m.group(2) != null, !m.group(1).isEmpty());
            return getFunctionClass(kind, Integer.parseInt(m.group(3)));
        }
        return null;
    }

    /**
     * 函数类：类型参数 P1..Pn（in）与 R（out），成员 operator fun invoke(p1: P1, ..., pn: Pn): R。
     * K 前缀的反射函数类以对应的非反射函数类为超类型。
     */
    public IrClass getFunctionClass(FunctionKind kind, int arity) {
        if (arity < 0) {
            throw new IllegalArgumentException("Negative function arity: " + arity);
        }
        String name = kind.className(arity);
        IrClass existing = functionClasses.get(name);
        if (existing != null) return existing;

        IrClass functionClass = createClass(name, ClassKind.INTERFACE);
        functionClasses.put(name, functionClass);
        List<IrTypeParameter> parameterTypes = new ArrayList<>(arity);
        for (int i = 1; i <= arity; i++) {
            parameterTypes.add(addTypeParameter(functionClass, "P" + i, Variance.IN));
        }
        IrTypeParameter returnTypeParameter = addTypeParameter(functionClass, "R", Variance.OUT);

        if (kind.isReflect()) {
            IrClass base = getFunctionClass(kind.nonReflect(), arity);
            List<IrTypeArgument> arguments = new ArrayList<>();
            for (IrTypeParameter typeParameter : functionClass.getTypeParameters()) {
                arguments.add(typeParameter.getDefaultType());
            }
            functionClass.addSuperType(new IrSimpleType(base.getSymbol(), arguments, false));
        }

        EnumSet<IrModifier> modifiers = EnumSet.of(IrModifier.OPERATOR);
        if (kind.isSuspend()) modifiers.add(IrModifier.SUSPEND);
        IrSimpleFunction invoke = new IrSimpleFunction(UNDEFINED_OFFSET, UNDEFINED_OFFSET,
                IrDeclarationOrigin.IR_BUILTIN, new IrSimpleFunctionSymbol(), "invoke",
                IrVisibility.PUBLIC, IrModality.ABSTRACT, returnTypeParameter.getDefaultType(), modifiers);
        invoke.setDispatchReceiverParameter(new IrValueParameter(UNDEFINED_OFFSET, UNDEFINED_OFFSET,
                IrDeclarationOrigin.IR_BUILTIN, new IrValueParameterSymbol(), "<this>", -1,
                functionClass.getDefaultType(), null, null));
        for (int i = 0; i < arity; i++) {
            invoke.addValueParameter(new IrValueParameter(UNDEFINED_OFFSET, UNDEFINED_OFFSET,
                    IrDeclarationOrigin.IR_BUILTIN, new IrValueParameterSymbol(), "p" + (i + 1), i,
                    parameterTypes.get(i).getDefaultType(), null, null));
        }
        functionClass.addMember(invoke);
        return functionClass;
    }

    /** 函数类的 invoke 成员 */
    public IrSimpleFunction getInvokeFunction(IrClass functionClass) {
        if (IrTypePredicates.functionKindOf(functionClass) == null) {
            throw new IrInternalError("Not a built-in function class: " + functionClass.getName());
        }
        for (IrSimpleFunction function : functionClass.getFunctions()) {
            if ("invoke".equals(function.getName())) return function;
        }
        throw new IrInternalError("Built-in function class without invoke: " + functionClass.getName());
    }

    // ============ 类型 ============

    public IrSimpleType anyType() { return anyClass.getDefaultType(); }
    public IrSimpleType nothingType() { return nothingClass.getDefaultType(); }
    public IrSimpleType unitType() { return unitClass.getDefaultType(); }
    public IrSimpleType booleanType() { return booleanClass.getDefaultType(); }
    public IrSimpleType charType() { return charClass.getDefaultType(); }
    public IrSimpleType intType() { return intClass.getDefaultType(); }
    public IrSimpleType longType() { return longClass.getDefaultType(); }
    public IrSimpleType stringType() { return stringClass.getDefaultType(); }
    public IrSimpleType charArrayType() { return charArrayClass.getDefaultType(); }
    public IrSimpleType intArrayType() { return intArrayClass.getDefaultType(); }

    /** List&lt;element&gt; */
    public IrSimpleType listType(IrTypeArgument element) {
        return new IrSimpleType(listClass.getSymbol(), Collections.singletonList(element), false);
    }

    /**
     * vararg 参数的数组类型：Char → CharArray，Int → IntArray，其余 Array&lt;out T&gt;。
     */
    public IrSimpleType varargArrayType(IrType elementType) {
        if (charType().equals(elementType)) return charArrayType();
        if (intType().equals(elementType)) return intArrayType();
        return new IrSimpleType(arrayClass.getSymbol(),
                Collections.singletonList(new IrTypeProjection(Variance.OUT, elementType)), false);
    }

    /**
     * 函数类型：实参依次为参数类型与返回类型。
     */
    public IrSimpleType functionType(FunctionKind kind, List<? extends IrType> parameterTypes, IrType returnType) {
        IrClass functionClass = getFunctionClass(kind, parameterTypes.size());
        List<IrTypeArgument> arguments = new ArrayList<>(parameterTypes.size() + 1);
        for (IrType parameterType : parameterTypes) {
            arguments.add(asArgument(parameterType));
        }
        arguments.add(asArgument(returnType));
        return new IrSimpleType(functionClass.getSymbol(), arguments, false);
    }

    /**
     * 保留类型实参，替换函数类族，例如 KFunction2&lt;A, B, R&gt; → Function2&lt;A, B, R&gt;。
     */
    public IrSimpleType withFunctionKind(IrSimpleType functionType, FunctionKind kind) {
        IrClass functionClass = functionType.getClassOrNull();
        int arity = IrTypePredicates.functionArityOf(functionClass);
        if (arity < 0) {
            throw new IllegalArgumentException("Not a function type: " + functionType.render());
        }
        return new IrSimpleType(getFunctionClass(kind, arity).getSymbol(),
                functionType.getArguments(), functionType.isNullable());
    }

    private static IrTypeArgument asArgument(IrType type) {
        if (type instanceof IrSimpleType) return (IrSimpleType) type;
        return new IrTypeProjection(Variance.INVARIANT, type);
    }
}

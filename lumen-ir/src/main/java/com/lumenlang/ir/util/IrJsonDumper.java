package com.lumenlang.ir.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.lumenlang.ir.IrElement;
import com.lumenlang.ir.IrStatement;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.*;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.List;

/**
 * 将 IR 树转换为 JSON，供调试输出（LUMEN_DUMP_ADAPTERS）使用。
 * 每个节点是一个带 "kind" 字段的对象。
 */
public final class IrJsonDumper implements IrElementVisitor<JsonElement, Void> {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public JsonElement dump(IrElement element) {
        if (element == null) return JsonNull.INSTANCE;
        return element.accept(this, null);
    }

    public String toJson(IrElement element) {
        return GSON.toJson(dump(element));
    }

    private static JsonObject node(String kind, IrElement element) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", kind);
        obj.addProperty("startOffset", element.getStartOffset());
        obj.addProperty("endOffset", element.getEndOffset());
        return obj;
    }

    private static String type(IrType type) {
        return type == null ? null : type.render();
    }

    private JsonArray statements(List<IrStatement> statements) {
        JsonArray array = new JsonArray();
        for (IrStatement statement : statements) {
            array.add(dump(statement));
        }
        return array;
    }

    // ============ 声明 ============

    @Override
    public JsonElement visitFile(IrFile file, Void data) {
        JsonObject obj = node("file", file);
        obj.addProperty("name", file.getName());
        JsonArray declarations = new JsonArray();
        for (IrDeclaration declaration : file.getDeclarations()) {
            declarations.add(dump(declaration));
        }
        obj.add("declarations", declarations);
        return obj;
    }

    @Override
    public JsonElement visitClass(IrClass declaration, Void data) {
        JsonObject obj = node("class", declaration);
        obj.addProperty("name", declaration.getName());
        obj.addProperty("classKind", declaration.getClassKind().name());
        obj.addProperty("origin", declaration.getOrigin().name());
        JsonArray typeParameters = new JsonArray();
        for (IrTypeParameter typeParameter : declaration.getTypeParameters()) {
            typeParameters.add(dump(typeParameter));
        }
        obj.add("typeParameters", typeParameters);
        return obj;
    }

    @Override
    public JsonElement visitTypeParameter(IrTypeParameter declaration, Void data) {
        JsonObject obj = node("typeParameter", declaration);
        obj.addProperty("name", declaration.getName());
        obj.addProperty("index", declaration.getIndex());
        obj.addProperty("variance", declaration.getVariance().name());
        return obj;
    }

    @Override
    public JsonElement visitProperty(IrProperty declaration, Void data) {
        JsonObject obj = node("property", declaration);
        obj.addProperty("name", declaration.getName());
        obj.addProperty("type", type(declaration.getType()));
        obj.addProperty("var", declaration.isVar());
        return obj;
    }

    @Override
    public JsonElement visitSimpleFunction(IrSimpleFunction declaration, Void data) {
        JsonObject obj = function("function", declaration);
        obj.addProperty("modality", declaration.getModality().name());
        return obj;
    }

    @Override
    public JsonElement visitConstructor(IrConstructor declaration, Void data) {
        JsonObject obj = function("constructor", declaration);
        obj.addProperty("primary", declaration.isPrimary());
        return obj;
    }

    private JsonObject function(String kind, IrFunction function) {
        JsonObject obj = node(kind, function);
        obj.addProperty("name", function.getName());
        obj.addProperty("origin", function.getOrigin().name());
        obj.addProperty("visibility", function.getVisibility().name());
        JsonArray modifiers = new JsonArray();
        for (IrModifier modifier : function.getModifiers()) {
            modifiers.add(modifier.name());
        }
        obj.add("modifiers", modifiers);
        obj.addProperty("returnType", type(function.getReturnType()));
        obj.add("dispatchReceiver", dump(function.getDispatchReceiverParameter()));
        obj.add("extensionReceiver", dump(function.getExtensionReceiverParameter()));
        JsonArray parameters = new JsonArray();
        for (IrValueParameter parameter : function.getValueParameters()) {
            parameters.add(dump(parameter));
        }
        obj.add("valueParameters", parameters);
        obj.add("body", dump(function.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitValueParameter(IrValueParameter declaration, Void data) {
        JsonObject obj = node("valueParameter", declaration);
        obj.addProperty("name", declaration.getName());
        obj.addProperty("index", declaration.getIndex());
        obj.addProperty("origin", declaration.getOrigin().name());
        obj.addProperty("type", type(declaration.getType()));
        if (declaration.isVararg()) {
            obj.addProperty("varargElementType", type(declaration.getVarargElementType()));
        }
        obj.addProperty("hasDefaultValue", declaration.hasDefaultValue());
        return obj;
    }

    @Override
    public JsonElement visitBlockBody(IrBlockBody body, Void data) {
        JsonObject obj = node("blockBody", body);
        obj.add("statements", statements(body.getStatements()));
        return obj;
    }

    // ============ 表达式 ============

    private JsonObject memberAccess(String kind, IrMemberAccessExpression<?> expression) {
        JsonObject obj = node(kind, expression);
        obj.addProperty("type", type(expression.getType()));
        obj.addProperty("callee", IrRenderer.render(expression));
        if (expression.getOrigin() != null) {
            obj.addProperty("origin", expression.getOrigin().name());
        }
        obj.add("dispatchReceiver", dump(expression.getDispatchReceiver()));
        obj.add("extensionReceiver", dump(expression.getExtensionReceiver()));
        JsonArray typeArguments = new JsonArray();
        for (int i = 0; i < expression.getTypeArgumentsCount(); i++) {
            IrType typeArgument = expression.getTypeArgument(i);
            if (typeArgument == null) {
                typeArguments.add(JsonNull.INSTANCE);
            } else {
                typeArguments.add(typeArgument.render());
            }
        }
        obj.add("typeArguments", typeArguments);
        JsonArray valueArguments = new JsonArray();
        for (int i = 0; i < expression.getValueArgumentsCount(); i++) {
            valueArguments.add(dump(expression.getValueArgument(i)));
        }
        obj.add("valueArguments", valueArguments);
        return obj;
    }

    @Override
    public JsonElement visitCall(IrCall expression, Void data) {
        return memberAccess("call", expression);
    }

    @Override
    public JsonElement visitConstructorCall(IrConstructorCall expression, Void data) {
        return memberAccess("constructorCall", expression);
    }

    @Override
    public JsonElement visitFunctionReference(IrFunctionReference expression, Void data) {
        return memberAccess("functionReference", expression);
    }

    @Override
    public JsonElement visitFunctionExpression(IrFunctionExpression expression, Void data) {
        JsonObject obj = node("functionExpression", expression);
        obj.addProperty("type", type(expression.getType()));
        if (expression.getOrigin() != null) {
            obj.addProperty("origin", expression.getOrigin().name());
        }
        obj.add("function", dump(expression.getFunction()));
        return obj;
    }

    @Override
    public JsonElement visitBlock(IrBlock expression, Void data) {
        JsonObject obj = node("block", expression);
        obj.addProperty("type", type(expression.getType()));
        if (expression.getOrigin() != null) {
            obj.addProperty("origin", expression.getOrigin().name());
        }
        obj.add("statements", statements(expression.getStatements()));
        return obj;
    }

    @Override
    public JsonElement visitReturn(IrReturn expression, Void data) {
        JsonObject obj = node("return", expression);
        obj.add("value", dump(expression.getValue()));
        return obj;
    }

    @Override
    public JsonElement visitGetValue(IrGetValue expression, Void data) {
        JsonObject obj = node("getValue", expression);
        obj.addProperty("name", IrRenderer.render(expression));
        obj.addProperty("type", type(expression.getType()));
        return obj;
    }

    @Override
    public JsonElement visitVararg(IrVararg expression, Void data) {
        JsonObject obj = node("vararg", expression);
        obj.addProperty("type", type(expression.getType()));
        obj.addProperty("elementType", type(expression.getVarargElementType()));
        JsonArray elements = new JsonArray();
        for (IrVarargElement element : expression.getElements()) {
            elements.add(dump(element));
        }
        obj.add("elements", elements);
        return obj;
    }

    @Override
    public JsonElement visitSpreadElement(IrSpreadElement element, Void data) {
        JsonObject obj = node("spread", element);
        obj.add("expression", dump(element.getExpression()));
        return obj;
    }

    @Override
    public JsonElement visitConst(IrConst expression, Void data) {
        JsonObject obj = node("const", expression);
        obj.addProperty("type", type(expression.getType()));
        obj.addProperty("value", String.valueOf(expression.getValue()));
        return obj;
    }
}

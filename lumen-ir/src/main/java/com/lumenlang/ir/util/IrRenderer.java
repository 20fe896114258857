package com.lumenlang.ir.util;

import com.lumenlang.ir.IrElement;
import com.lumenlang.ir.IrStatement;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.*;
import com.lumenlang.ir.symbols.IrSymbol;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.List;

/**
 * IR 文本渲染，接近源码形式，用于诊断消息与测试断言。
 * <p>
 * 不传实参的槽位渲染为 {@code _}，展开元素渲染为 {@code *x}。
 */
public final class IrRenderer implements IrElementVisitor<String, Void> {

    private static final IrRenderer INSTANCE = new IrRenderer();

    private IrRenderer() {}

    public static String render(IrElement element) {
        if (element == null) return "<null>";
        return element.accept(INSTANCE, null);
    }

    /** 只渲染声明头部（不含函数体） */
    public static String renderHeader(IrDeclaration declaration) {
        if (declaration instanceof IrFunction) {
            return INSTANCE.functionHeader((IrFunction) declaration);
        }
        return render(declaration);
    }

    // ============ 声明 ============

    @Override
    public String visitFile(IrFile file, Void data) {
        StringBuilder sb = new StringBuilder("file ").append(file.getName());
        for (IrDeclaration declaration : file.getDeclarations()) {
            sb.append('\n').append(render(declaration));
        }
        return sb.toString();
    }

    @Override
    public String visitClass(IrClass declaration, Void data) {
        StringBuilder sb = new StringBuilder();
        sb.append(declaration.getClassKind().name().toLowerCase()).append(' ').append(declaration.getName());
        List<IrTypeParameter> typeParameters = declaration.getTypeParameters();
        if (!typeParameters.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeParameters.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(render(typeParameters.get(i)));
            }
            sb.append('>');
        }
        return sb.toString();
    }

    @Override
    public String visitTypeParameter(IrTypeParameter declaration, Void data) {
        switch (declaration.getVariance()) {
            case IN: return "in " + declaration.getName();
            case OUT: return "out " + declaration.getName();
            default: return declaration.getName();
        }
    }

    @Override
    public String visitProperty(IrProperty declaration, Void data) {
        return (declaration.isVar() ? "var " : "val ") + declaration.getName() + ": " + type(declaration.getType());
    }

    @Override
    public String visitSimpleFunction(IrSimpleFunction declaration, Void data) {
        return functionHeader(declaration) + body(declaration.getBody());
    }

    @Override
    public String visitConstructor(IrConstructor declaration, Void data) {
        return functionHeader(declaration) + body(declaration.getBody());
    }

    @Override
    public String visitValueParameter(IrValueParameter declaration, Void data) {
        StringBuilder sb = new StringBuilder();
        if (declaration.isVararg()) {
            sb.append("vararg ").append(declaration.getName()).append(": ")
                    .append(type(declaration.getVarargElementType()));
        } else {
            sb.append(declaration.getName()).append(": ").append(type(declaration.getType()));
        }
        if (declaration.hasDefaultValue()) sb.append(" = ...");
        return sb.toString();
    }

    @Override
    public String visitBlockBody(IrBlockBody body, Void data) {
        return statements(body.getStatements());
    }

    private String functionHeader(IrFunction function) {
        StringBuilder sb = new StringBuilder();
        if (function.getVisibility() == IrVisibility.LOCAL) sb.append("local ");
        if (function.isSuspend()) sb.append("suspend ");
        sb.append("fun ");
        IrValueParameter extensionReceiver = function.getExtensionReceiverParameter();
        if (extensionReceiver != null) {
            sb.append(type(extensionReceiver.getType())).append('.');
        }
        sb.append(function.getName()).append('(');
        List<IrValueParameter> parameters = function.getValueParameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(render(parameters.get(i)));
        }
        sb.append("): ").append(type(function.getReturnType()));
        return sb.toString();
    }

    private String body(IrBlockBody body) {
        return body == null ? "" : " " + render(body);
    }

    private String statements(List<IrStatement> statements) {
        StringBuilder sb = new StringBuilder("{ ");
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0) sb.append("; ");
            sb.append(render(statements.get(i)));
        }
        return sb.append(" }").toString();
    }

    // ============ 表达式 ============

    @Override
    public String visitCall(IrCall expression, Void data) {
        return receiverPrefix(expression, ".") + name(expression.getSymbol())
                + typeArguments(expression) + valueArguments(expression);
    }

    @Override
    public String visitConstructorCall(IrConstructorCall expression, Void data) {
        String className = expression.getSymbol().isBound()
                ? expression.getSymbol().getOwner().getConstructedClass().getName() : "<unbound>";
        return className + typeArguments(expression) + valueArguments(expression);
    }

    @Override
    public String visitFunctionReference(IrFunctionReference expression, Void data) {
        return receiverPrefix(expression, "") + "::" + name(expression.getSymbol());
    }

    @Override
    public String visitFunctionExpression(IrFunctionExpression expression, Void data) {
        return "fun-expr(" + render(expression.getFunction()) + ")";
    }

    @Override
    public String visitBlock(IrBlock expression, Void data) {
        return statements(expression.getStatements());
    }

    @Override
    public String visitReturn(IrReturn expression, Void data) {
        return "return " + render(expression.getValue());
    }

    @Override
    public String visitGetValue(IrGetValue expression, Void data) {
        return name(expression.getSymbol());
    }

    @Override
    public String visitVararg(IrVararg expression, Void data) {
        StringBuilder sb = new StringBuilder("vararg(");
        List<IrVarargElement> elements = expression.getElements();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(render(elements.get(i)));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitSpreadElement(IrSpreadElement element, Void data) {
        return "*" + render(element.getExpression());
    }

    @Override
    public String visitConst(IrConst expression, Void data) {
        Object value = expression.getValue();
        if (value instanceof String) return "\"" + value + "\"";
        if (value instanceof Character) return "'" + value + "'";
        return String.valueOf(value);
    }

    private static String receiverPrefix(IrMemberAccessExpression<?> expression, String separator) {
        IrExpression receiver = expression.getDispatchReceiver() != null
                ? expression.getDispatchReceiver() : expression.getExtensionReceiver();
        return receiver == null ? "" : render(receiver) + separator;
    }

    private static String typeArguments(IrMemberAccessExpression<?> expression) {
        int count = expression.getTypeArgumentsCount();
        if (count == 0) return "";
        StringBuilder sb = new StringBuilder("<");
        for (int i = 0; i < count; i++) {
            if (i > 0) sb.append(", ");
            IrType typeArgument = expression.getTypeArgument(i);
            sb.append(typeArgument == null ? "_" : typeArgument.render());
        }
        return sb.append('>').toString();
    }

    private static String valueArguments(IrMemberAccessExpression<?> expression) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < expression.getValueArgumentsCount(); i++) {
            if (i > 0) sb.append(", ");
            IrExpression argument = expression.getValueArgument(i);
            sb.append(argument == null ? "_" : render(argument));
        }
        return sb.append(')').toString();
    }

    private static String name(IrSymbol<?> symbol) {
        if (!symbol.isBound()) return "<unbound>";
        Object owner = symbol.getOwner();
        if (owner instanceof IrFunction) return ((IrFunction) owner).getName();
        if (owner instanceof IrValueParameter) return ((IrValueParameter) owner).getName();
        return owner.toString();
    }

    private static String type(IrType type) {
        return type == null ? "?" : type.render();
    }
}

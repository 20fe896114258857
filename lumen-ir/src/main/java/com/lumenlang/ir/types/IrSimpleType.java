package com.lumenlang.ir.types;

import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrTypeParameter;
import com.lumenlang.ir.symbols.IrClassSymbol;
import com.lumenlang.ir.symbols.IrClassifierSymbol;
import com.lumenlang.ir.symbols.IrTypeParameterSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 简单类型：分类器 + 类型实参。作为类型实参出现时即不变投影。
 */
public final class IrSimpleType extends IrType implements IrTypeArgument {

    private final IrClassifierSymbol<?> classifier;
    private final List<IrTypeArgument> arguments;

    public IrSimpleType(IrClassifierSymbol<?> classifier, List<? extends IrTypeArgument> arguments, boolean nullable) {
        super(nullable);
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.arguments = arguments == null || arguments.isEmpty()
                ? Collections.<IrTypeArgument>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public IrSimpleType(IrClassifierSymbol<?> classifier) {
        this(classifier, Collections.<IrTypeArgument>emptyList(), false);
    }

    public IrClassifierSymbol<?> getClassifier() {
        return classifier;
    }

    public List<IrTypeArgument> getArguments() {
        return arguments;
    }

    /** 分类器为类时返回该类，否则返回 null */
    public IrClass getClassOrNull() {
        if (classifier instanceof IrClassSymbol && classifier.isBound()) {
            return ((IrClassSymbol) classifier).getOwner();
        }
        return null;
    }

    @Override
    public IrType typeOrNull() {
        return this;
    }

    @Override
    public <R> R accept(IrTypeArgumentVisitor<R> visitor) {
        return visitor.visitSimpleType(this);
    }

    @Override
    public IrType withNullable(boolean nullable) {
        if (this.nullable == nullable) return this;
        return new IrSimpleType(classifier, arguments, nullable);
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder(classifierName());
        if (!arguments.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments.get(i).render());
            }
            sb.append('>');
        }
        if (nullable) sb.append('?');
        return sb.toString();
    }

    private String classifierName() {
        if (!classifier.isBound()) return "<unbound>";
        if (classifier instanceof IrClassSymbol) {
            return ((IrClassSymbol) classifier).getOwner().getName();
        }
        IrTypeParameter typeParameter = ((IrTypeParameterSymbol) classifier).getOwner();
        return typeParameter.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrSimpleType)) return false;
        IrSimpleType that = (IrSimpleType) o;
        return nullable == that.nullable && classifier == that.classifier && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(classifier), arguments, nullable);
    }
}

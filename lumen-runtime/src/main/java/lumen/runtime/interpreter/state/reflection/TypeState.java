package lumen.runtime.interpreter.state.reflection;

import com.lumenlang.ir.IrBuiltIns;
import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrTypeParameter;
import com.lumenlang.ir.symbols.IrClassifierSymbol;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrStarProjection;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypeArgument;
import com.lumenlang.ir.types.IrTypeArgumentVisitor;
import com.lumenlang.ir.types.IrTypeProjection;
import lumen.runtime.interpreter.IrInterpreter;
import lumen.runtime.interpreter.proxy.reflection.ClassProxy;
import lumen.runtime.interpreter.proxy.reflection.Classifier;
import lumen.runtime.interpreter.proxy.reflection.TypeParameterProxy;
import lumen.runtime.interpreter.proxy.reflection.TypeProjection;
import lumen.runtime.interpreter.proxy.reflection.TypeProxy;
import lumen.runtime.interpreter.util.LazyValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * KType 的状态。
 * <p>
 * 分类器与类型实参投影在首次访问时计算并缓存。相等性只取决于包装的 IrType，与缓存是否已填充无关。
 */
public final class TypeState extends ReflectionState {

    private static final String TYPE_PARAMETERS_PROPERTY = "typeParameters";

    private final IrType irType;
    private final LazyValue<Classifier> classifier = new LazyValue<>();
    private final LazyValue<List<TypeProjection>> arguments = new LazyValue<>();

    public TypeState(IrType irType, IrClass kTypeClass) {
        super(kTypeClass);
        this.irType = irType;
    }

    public IrType getIrType() {
        return irType;
    }

    public Classifier getClassifier(IrInterpreter interpreter) {
        return classifier.get(() -> computeClassifier(interpreter));
    }

    /** 仅对 IrSimpleType 有效 */
    public List<TypeProjection> getArguments(IrInterpreter interpreter) {
        return arguments.get(() -> computeArguments(interpreter));
    }

    public boolean isClassifierComputed() {
        return classifier.isComputed();
    }

    public boolean isArgumentsComputed() {
        return arguments.isComputed();
    }

    private Classifier computeClassifier(IrInterpreter interpreter) {
        IrClassifierSymbol<?> symbol = requireSimpleType().getClassifier();
        IrBuiltIns builtIns = interpreter.getIrBuiltIns();
        switch (symbol.getKind()) {
            case CLASS:
                IrClass irClass = (IrClass) symbol.getOwner();
                return new ClassProxy(new ClassReferenceState(irClass, builtIns.getKClassClass()), interpreter);
            case TYPE_PARAMETER:
                IrTypeParameter typeParameter = (IrTypeParameter) symbol.getOwner();
                IrClass kTypeParameterClass =
                        irClassOfReflectionFromList(builtIns.getKClassClass(), TYPE_PARAMETERS_PROPERTY);
                return new TypeParameterProxy(new TypeParameterState(typeParameter, kTypeParameterClass), interpreter);
            default:
                throw new IrInternalError("Unsupported classifier kind " + symbol.getKind() + " of " + irType.render());
        }
    }

    private List<TypeProjection> computeArguments(IrInterpreter interpreter) {
        List<IrTypeArgument> typeArguments = requireSimpleType().getArguments();
        IrTypeArgumentVisitor<TypeProjection> toProjection = new IrTypeArgumentVisitor<TypeProjection>() {
            @Override
            public TypeProjection visitSimpleType(IrSimpleType argument) {
                return TypeProjection.invariant(proxyOf(argument, interpreter));
            }

            @Override
            public TypeProjection visitTypeProjection(IrTypeProjection argument) {
                TypeProxy type = proxyOf(argument.getType(), interpreter);
                switch (argument.getVariance()) {
                    case IN:
                        return TypeProjection.contravariant(type);
                    case OUT:
                        return TypeProjection.covariant(type);
                    default:
                        return TypeProjection.invariant(type);
                }
            }

            @Override
            public TypeProjection visitStarProjection(IrStarProjection argument) {
                return TypeProjection.STAR;
            }
        };
        List<TypeProjection> result = new ArrayList<>(typeArguments.size());
        for (IrTypeArgument typeArgument : typeArguments) {
            result.add(typeArgument.accept(toProjection));
        }
        return Collections.unmodifiableList(result);
    }

    private TypeProxy proxyOf(IrType type, IrInterpreter interpreter) {
        return new TypeProxy(interpreter.typeOf(type), interpreter);
    }

    private IrSimpleType requireSimpleType() {
        if (!(irType instanceof IrSimpleType)) {
            throw new IrInternalError("Reflected type is not a simple type: " + irType.render());
        }
        return (IrSimpleType) irType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return irType.equals(((TypeState) o).irType);
    }

    @Override
    public int hashCode() {
        return irType.hashCode();
    }

    @Override
    public String toString() {
        return irType.render();
    }
}

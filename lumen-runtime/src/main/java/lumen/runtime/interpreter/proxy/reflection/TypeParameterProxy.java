package lumen.runtime.interpreter.proxy.reflection;

import com.lumenlang.compiler.analysis.types.Variance;
import com.lumenlang.ir.types.IrType;
import lumen.runtime.interpreter.IrInterpreter;
import lumen.runtime.interpreter.state.reflection.TypeParameterState;

import java.util.ArrayList;
import java.util.List;

/**
 * KTypeParameter 代理。
 */
public final class TypeParameterProxy implements Classifier {

    private final TypeParameterState state;
    private final IrInterpreter interpreter;

    public TypeParameterProxy(TypeParameterState state, IrInterpreter interpreter) {
        this.state = state;
        this.interpreter = interpreter;
    }

    @Override
    public TypeParameterState getState() {
        return state;
    }

    public String getName() {
        return state.getTypeParameter().getName();
    }

    public Variance getVariance() {
        return state.getTypeParameter().getVariance();
    }

    /** 未声明上界时为 Any? */
    public List<TypeProxy> getUpperBounds() {
        List<IrType> superTypes = state.getTypeParameter().getSuperTypes();
        List<TypeProxy> result = new ArrayList<>();
        if (superTypes.isEmpty()) {
            IrType nullableAny = interpreter.getIrBuiltIns().anyType().withNullable(true);
            result.add(new TypeProxy(interpreter.typeOf(nullableAny), interpreter));
            return result;
        }
        for (IrType superType : superTypes) {
            result.add(new TypeProxy(interpreter.typeOf(superType), interpreter));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeParameterProxy)) return false;
        return state.equals(((TypeParameterProxy) o).state);
    }

    @Override
    public int hashCode() {
        return state.hashCode();
    }

    @Override
    public String toString() {
        return state.toString();
    }
}

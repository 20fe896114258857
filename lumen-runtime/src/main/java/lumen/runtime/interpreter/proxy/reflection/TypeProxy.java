package lumen.runtime.interpreter.proxy.reflection;

import lumen.runtime.interpreter.IrInterpreter;
import lumen.runtime.interpreter.state.reflection.TypeState;

import java.util.List;

/**
 * KType 代理，委托给 TypeState 的惰性缓存。
 */
public final class TypeProxy {

    private final TypeState state;
    private final IrInterpreter interpreter;

    public TypeProxy(TypeState state, IrInterpreter interpreter) {
        this.state = state;
        this.interpreter = interpreter;
    }

    public TypeState getState() {
        return state;
    }

    public Classifier getClassifier() {
        return state.getClassifier(interpreter);
    }

    public List<TypeProjection> getArguments() {
        return state.getArguments(interpreter);
    }

    public boolean isMarkedNullable() {
        return state.getIrType().isNullable();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeProxy)) return false;
        return state.equals(((TypeProxy) o).state);
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

package lumen.runtime.interpreter.state.reflection;

import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrTypeParameter;

/**
 * KTypeParameter 的状态。
 */
public final class TypeParameterState extends ReflectionState {

    private final IrTypeParameter typeParameter;

    public TypeParameterState(IrTypeParameter typeParameter, IrClass kTypeParameterClass) {
        super(kTypeParameterClass);
        this.typeParameter = typeParameter;
    }

    public IrTypeParameter getTypeParameter() {
        return typeParameter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return typeParameter == ((TypeParameterState) o).typeParameter;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(typeParameter);
    }

    @Override
    public String toString() {
        return typeParameter.getName();
    }
}

package lumen.runtime.interpreter.proxy.reflection;

import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrTypeParameter;
import lumen.runtime.interpreter.IrInterpreter;
import lumen.runtime.interpreter.state.reflection.ClassReferenceState;
import lumen.runtime.interpreter.state.reflection.ReflectionState;
import lumen.runtime.interpreter.state.reflection.TypeParameterState;

import java.util.ArrayList;
import java.util.List;

/**
 * KClass 代理。
 */
public final class ClassProxy implements Classifier {

    private final ClassReferenceState state;
    private final IrInterpreter interpreter;

    public ClassProxy(ClassReferenceState state, IrInterpreter interpreter) {
        this.state = state;
        this.interpreter = interpreter;
    }

    @Override
    public ClassReferenceState getState() {
        return state;
    }

    public String getSimpleName() {
        return state.getClassReference().getName();
    }

    public List<TypeParameterProxy> getTypeParameters() {
        IrClass kTypeParameterClass =
                ReflectionState.irClassOfReflectionFromList(state.getIrClass(), "typeParameters");
        List<TypeParameterProxy> result = new ArrayList<>();
        for (IrTypeParameter typeParameter : state.getClassReference().getTypeParameters()) {
            result.add(new TypeParameterProxy(new TypeParameterState(typeParameter, kTypeParameterClass), interpreter));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassProxy)) return false;
        return state.equals(((ClassProxy) o).state);
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

package lumen.runtime.interpreter.state.reflection;

import com.lumenlang.ir.declarations.IrClass;

/**
 * KClass 的状态：被引用的类。
 */
public final class ClassReferenceState extends ReflectionState {

    private final IrClass classReference;

    public ClassReferenceState(IrClass classReference, IrClass kClassClass) {
        super(kClassClass);
        this.classReference = classReference;
    }

    public IrClass getClassReference() {
        return classReference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return classReference == ((ClassReferenceState) o).classReference;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(classReference);
    }

    @Override
    public String toString() {
        return "class " + classReference.getName();
    }
}

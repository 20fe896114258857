package lumen.runtime.interpreter.state.reflection;

import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.declarations.IrClass;
import com.lumenlang.ir.declarations.IrProperty;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;

/**
 * 反射对象的解释器状态。irClass 是反射对象自身的类（KClass、KType 等）。
 */
public abstract class ReflectionState {

    private final IrClass irClass;

    protected ReflectionState(IrClass irClass) {
        this.irClass = irClass;
    }

    public IrClass getIrClass() {
        return irClass;
    }

    /**
     * 由 List 类型属性的元素类型得到反射类，例如 KClass.typeParameters: List&lt;KTypeParameter&gt; → KTypeParameter。
     */
    public static IrClass irClassOfReflectionFromList(IrClass owner, String propertyName) {
        IrProperty property = owner.findProperty(propertyName);
        if (property == null) {
            throw new IrInternalError("No property " + propertyName + " in " + owner.getName());
        }
        IrType type = property.getType();
        if (type instanceof IrSimpleType && ((IrSimpleType) type).getArguments().size() == 1) {
            IrType elementType = ((IrSimpleType) type).getArguments().get(0).typeOrNull();
            if (elementType instanceof IrSimpleType) {
                IrClass elementClass = ((IrSimpleType) elementType).getClassOrNull();
                if (elementClass != null) return elementClass;
            }
        }
        throw new IrInternalError("Property " + owner.getName() + "." + propertyName
                + " is not a list of classes: " + type.render());
    }
}

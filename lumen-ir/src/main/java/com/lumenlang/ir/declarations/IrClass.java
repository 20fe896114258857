package com.lumenlang.ir.declarations;

import com.lumenlang.ir.symbols.IrClassSymbol;
import com.lumenlang.ir.symbols.IrSymbolOwner;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypeArgument;
import com.lumenlang.ir.visitors.IrElementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 统一的类声明，classKind 区分 CLASS/INTERFACE/ENUM/OBJECT/ANNOTATION。
 */
public class IrClass extends IrDeclaration implements IrSymbolOwner, IrDeclarationParent {

    private final IrClassSymbol symbol;
    private final String name;
    private final ClassKind classKind;
    private final List<IrTypeParameter> typeParameters = new ArrayList<>();
    private final List<IrType> superTypes = new ArrayList<>();
    private final List<IrDeclaration> declarations = new ArrayList<>();

    public IrClass(int startOffset, int endOffset, IrDeclarationOrigin origin,
                   IrClassSymbol symbol, String name, ClassKind classKind) {
        super(startOffset, endOffset, origin);
        this.symbol = symbol;
        this.name = name;
        this.classKind = classKind;
        symbol.bind(this);
    }

    @Override
    public IrClassSymbol getSymbol() {
        return symbol;
    }

    @Override
    public String getName() {
        return name;
    }

    public ClassKind getClassKind() {
        return classKind;
    }

    public List<IrTypeParameter> getTypeParameters() {
        return Collections.unmodifiableList(typeParameters);
    }

    public void addTypeParameter(IrTypeParameter typeParameter) {
        typeParameter.setParent(this);
        typeParameters.add(typeParameter);
    }

    public List<IrType> getSuperTypes() {
        return Collections.unmodifiableList(superTypes);
    }

    public void addSuperType(IrType superType) {
        superTypes.add(superType);
    }

    public List<IrDeclaration> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    public void addMember(IrDeclaration declaration) {
        declaration.setParent(this);
        declarations.add(declaration);
    }

    public List<IrSimpleFunction> getFunctions() {
        List<IrSimpleFunction> result = new ArrayList<>();
        for (IrDeclaration declaration : declarations) {
            if (declaration instanceof IrSimpleFunction) {
                result.add((IrSimpleFunction) declaration);
            }
        }
        return result;
    }

    public List<IrConstructor> getConstructors() {
        List<IrConstructor> result = new ArrayList<>();
        for (IrDeclaration declaration : declarations) {
            if (declaration instanceof IrConstructor) {
                result.add((IrConstructor) declaration);
            }
        }
        return result;
    }

    public IrProperty findProperty(String propertyName) {
        for (IrDeclaration declaration : declarations) {
            if (declaration instanceof IrProperty && ((IrProperty) declaration).getName().equals(propertyName)) {
                return (IrProperty) declaration;
            }
        }
        return null;
    }

    /** 以自身类型参数作为实参的类型：C&lt;T1, T2&gt; */
    public IrSimpleType getDefaultType() {
        List<IrTypeArgument> arguments = new ArrayList<>(typeParameters.size());
        for (IrTypeParameter typeParameter : typeParameters) {
            arguments.add(typeParameter.getDefaultType());
        }
        return new IrSimpleType(symbol, arguments, false);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
        return visitor.visitClass(this, data);
    }
}

package com.lumenlang.ir.expressions;

import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.symbols.IrSymbol;
import com.lumenlang.ir.types.IrType;

/**
 * 成员访问（调用、构造、函数引用）的公共部分。
 * <p>
 * 类型实参与值实参槽位数在创建时固定；值实参槽位为 null 表示“不传实参”，
 * 由被调函数使用默认值或空 vararg。
 */
public abstract class IrMemberAccessExpression<S extends IrSymbol<?>> extends IrExpression {

    private final S symbol;
    private final IrStatementOrigin origin;
    private final IrType[] typeArguments;
    private final IrExpression[] valueArguments;
    private IrExpression dispatchReceiver;
    private IrExpression extensionReceiver;

    protected IrMemberAccessExpression(int startOffset, int endOffset, IrType type, S symbol,
                                       int typeArgumentsCount, int valueArgumentsCount,
                                       IrStatementOrigin origin) {
        super(startOffset, endOffset, type);
        this.symbol = symbol;
        this.origin = origin;
        this.typeArguments = new IrType[typeArgumentsCount];
        this.valueArguments = new IrExpression[valueArgumentsCount];
    }

    public S getSymbol() {
        return symbol;
    }

    public IrStatementOrigin getOrigin() {
        return origin;
    }

    public IrExpression getDispatchReceiver() {
        return dispatchReceiver;
    }

    public void setDispatchReceiver(IrExpression dispatchReceiver) {
        this.dispatchReceiver = dispatchReceiver;
    }

    public IrExpression getExtensionReceiver() {
        return extensionReceiver;
    }

    public void setExtensionReceiver(IrExpression extensionReceiver) {
        this.extensionReceiver = extensionReceiver;
    }

    public int getTypeArgumentsCount() {
        return typeArguments.length;
    }

    public IrType getTypeArgument(int index) {
        checkSlot(index, typeArguments.length, "type argument");
        return typeArguments[index];
    }

    public void putTypeArgument(int index, IrType type) {
        checkSlot(index, typeArguments.length, "type argument");
        typeArguments[index] = type;
    }

    public int getValueArgumentsCount() {
        return valueArguments.length;
    }

    public IrExpression getValueArgument(int index) {
        checkSlot(index, valueArguments.length, "value argument");
        return valueArguments[index];
    }

    /**
     * @param argument null 表示不传实参
     */
    public void putValueArgument(int index, IrExpression argument) {
        checkSlot(index, valueArguments.length, "value argument");
        valueArguments[index] = argument;
    }

    private void checkSlot(int index, int count, String what) {
        if (index < 0 || index >= count) {
            throw new IrInternalError("No " + what + " slot " + index + " in " + getClass().getSimpleName()
                    + " with " + count + " slots");
        }
    }
}

package com.lumenlang.ir.types;

/**
 * 无法解析的类型，携带原因文本。不是简单类型。
 */
public final class IrErrorType extends IrType {

    private final String reason;

    public IrErrorType(String reason, boolean nullable) {
        super(nullable);
        this.reason = reason;
    }

    public IrErrorType(String reason) {
        this(reason, false);
    }

    public String getReason() {
        return reason;
    }

    @Override
    public IrType withNullable(boolean nullable) {
        if (this.nullable == nullable) return this;
        return new IrErrorType(reason, nullable);
    }

    @Override
    public String render() {
        return "<error: " + reason + ">" + (nullable ? "?" : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrErrorType)) return false;
        IrErrorType that = (IrErrorType) o;
        return nullable == that.nullable && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return reason.hashCode() * 31 + (nullable ? 1 : 0);
    }
}

package com.lumenlang.compiler.resolve;

import com.lumenlang.compiler.analysis.types.LumenType;
import com.lumenlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 已解析的可调用引用（如 String::length, obj::run, ::println）。
 * 由类型检查器产出，lowering 只读。
 */
public final class CallableReferenceAccess {

    private final SourceLocation location;
    private final String calleeName;
    private final ExplicitReceiverKind explicitReceiverKind;
    private final boolean hasDispatchReceiver;
    private final boolean hasExtensionReceiver;
    private final List<LumenType> typeArguments;

    private CallableReferenceAccess(Builder builder) {
        this.location = builder.location;
        this.calleeName = builder.calleeName;
        this.explicitReceiverKind = builder.explicitReceiverKind;
        this.hasDispatchReceiver = builder.hasDispatchReceiver;
        this.hasExtensionReceiver = builder.hasExtensionReceiver;
        this.typeArguments = builder.typeArguments;
    }

    public static Builder builder(String calleeName) {
        return new Builder(calleeName);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getCalleeName() {
        return calleeName;
    }

    public ExplicitReceiverKind getExplicitReceiverKind() {
        return explicitReceiverKind;
    }

    /** A::foo 形式的未绑定引用 */
    public boolean hasQualifierReceiver() {
        return explicitReceiverKind == ExplicitReceiverKind.RESOLVED_QUALIFIER;
    }

    public boolean hasDispatchReceiver() {
        return hasDispatchReceiver;
    }

    public boolean hasExtensionReceiver() {
        return hasExtensionReceiver;
    }

    public List<LumenType> getTypeArguments() {
        return typeArguments;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        switch (explicitReceiverKind) {
            case RESOLVED_QUALIFIER:
                sb.append("<qualifier>");
                break;
            case EXPRESSION:
                sb.append("<receiver>");
                break;
            default:
                break;
        }
        sb.append("::").append(calleeName);
        if (!typeArguments.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeArguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeArguments.get(i).toDisplayString());
            }
            sb.append('>');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    public static final class Builder {
        private final String calleeName;
        private SourceLocation location = SourceLocation.UNKNOWN;
        private ExplicitReceiverKind explicitReceiverKind = ExplicitReceiverKind.NONE;
        private boolean hasDispatchReceiver;
        private boolean hasExtensionReceiver;
        private List<LumenType> typeArguments = Collections.emptyList();

        private Builder(String calleeName) {
            this.calleeName = calleeName;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder explicitReceiver(ExplicitReceiverKind kind) {
            this.explicitReceiverKind = kind;
            return this;
        }

        public Builder dispatchReceiver(boolean present) {
            this.hasDispatchReceiver = present;
            return this;
        }

        public Builder extensionReceiver(boolean present) {
            this.hasExtensionReceiver = present;
            return this;
        }

        public Builder typeArguments(List<LumenType> typeArguments) {
            this.typeArguments = typeArguments != null ? typeArguments : Collections.<LumenType>emptyList();
            return this;
        }

        public CallableReferenceAccess build() {
            return new CallableReferenceAccess(this);
        }
    }
}

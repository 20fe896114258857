package com.lumenlang.compiler.analysis.types;

import java.util.Objects;

/**
 * use-site 类型参数（如 List&lt;out String&gt; 中的 out String）。
 */
public final class LumenTypeArgument {

    private static final LumenTypeArgument WILDCARD = new LumenTypeArgument(Variance.INVARIANT, null, true);

    private final Variance variance;
    private final LumenType type;       // null 表示 * 通配符
    private final boolean isWildcard;

    private LumenTypeArgument(Variance variance, LumenType type, boolean isWildcard) {
        this.variance = variance;
        this.type = type;
        this.isWildcard = isWildcard;
    }

    public static LumenTypeArgument of(Variance variance, LumenType type) {
        return new LumenTypeArgument(Objects.requireNonNull(variance, "variance"),
                Objects.requireNonNull(type, "type"), false);
    }

    public static LumenTypeArgument invariant(LumenType type) {
        return of(Variance.INVARIANT, type);
    }

    public static LumenTypeArgument wildcard() {
        return WILDCARD;
    }

    public Variance getVariance() {
        return variance;
    }

    public LumenType getType() {
        return type;
    }

    public boolean isWildcard() {
        return isWildcard;
    }

    public String toDisplayString() {
        if (isWildcard) return "*";
        StringBuilder sb = new StringBuilder();
        if (variance == Variance.IN) sb.append("in ");
        else if (variance == Variance.OUT) sb.append("out ");
        sb.append(type.toDisplayString());
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LumenTypeArgument)) return false;
        LumenTypeArgument that = (LumenTypeArgument) o;
        return isWildcard == that.isWildcard && variance == that.variance && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variance, type, isWildcard);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}

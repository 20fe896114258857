package com.lumenlang.compiler.resolve;

import com.lumenlang.compiler.analysis.types.LumenType;
import com.lumenlang.compiler.ast.SourceLocation;

import java.util.Objects;

/**
 * 调用实参的前端视图：位置 + 静态类型。
 */
public final class ResolvedArgument {

    private final SourceLocation location;
    private final LumenType type;

    public ResolvedArgument(SourceLocation location, LumenType type) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.type = Objects.requireNonNull(type, "type");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public LumenType getType() {
        return type;
    }
}

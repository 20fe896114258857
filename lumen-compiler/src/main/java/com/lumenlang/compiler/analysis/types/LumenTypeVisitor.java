package com.lumenlang.compiler.analysis.types;

/**
 * LumenType 访问者接口，用于替代 instanceof 分派。
 */
public interface LumenTypeVisitor<R> {
    R visitClass(ClassLumenType type);
    R visitFunction(FunctionLumenType type);
    R visitTypeParameter(TypeParameterType type);
    R visitUnit(UnitType type);
    R visitIntersection(IntersectionLumenType type);
}

package lumen.runtime.interpreter.proxy.reflection;

import lumen.runtime.interpreter.state.reflection.ReflectionState;

/**
 * 类型的分类器：ClassProxy 或 TypeParameterProxy。
 */
public interface Classifier {

    ReflectionState getState();
}

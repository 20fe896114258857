package lumen.runtime.interpreter.util;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 只发布一次的惰性值：未计算 / 已计算两种状态。
 * <p>
 * 计算必须是纯的；并发首次访问时可能重复计算，但只有第一个结果被发布，之后所有调用方看到同一个值。
 *
 * @param <T> 值类型，不允许为 null
 */
public final class LazyValue<T> {

    private final AtomicReference<T> value = new AtomicReference<>();

    public T get(Supplier<? extends T> computation) {
        T current = value.get();
        if (current != null) {
            return current;
        }
        T computed = Objects.requireNonNull(computation.get(), "lazy computation returned null");
        value.compareAndSet(null, computed);
        return value.get();
    }

    public boolean isComputed() {
        return value.get() != null;
    }
}

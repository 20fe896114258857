package lumen.runtime.interpreter.cache;

import java.util.function.Function;

/**
 * 有界缓存抽象。解释器用它按类型驻留反射状态。
 */
public interface BoundedCache<K, V> {

    /** 不存在时返回 null */
    V getIfPresent(K key);

    /**
     * 不存在时计算并放入。mappingFunction 内不得再访问同一缓存。
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    long size();

    void clear();

    CacheStats getStats();
}

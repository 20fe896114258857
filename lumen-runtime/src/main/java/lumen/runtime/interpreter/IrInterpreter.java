package lumen.runtime.interpreter;

import com.lumenlang.ir.IrBuiltIns;
import com.lumenlang.ir.types.IrType;
import lumen.runtime.interpreter.cache.BoundedCache;
import lumen.runtime.interpreter.cache.CacheStats;
import lumen.runtime.interpreter.cache.CaffeineCache;
import lumen.runtime.interpreter.state.reflection.TypeState;

import java.util.Objects;

/**
 * IR 解释器的反射环境：内置声明 + 按类型驻留的 TypeState。
 * <p>
 * 同一个 IrType 的查询返回同一个 TypeState，其惰性计算结果因此在查询间共享。
 */
public class IrInterpreter {

    public static final long DEFAULT_TYPE_CACHE_SIZE = 1024;

    private final IrBuiltIns irBuiltIns;
    private final BoundedCache<IrType, TypeState> typeStates;

    public IrInterpreter(IrBuiltIns irBuiltIns) {
        this(irBuiltIns, DEFAULT_TYPE_CACHE_SIZE);
    }

    public IrInterpreter(IrBuiltIns irBuiltIns, long typeCacheSize) {
        this.irBuiltIns = Objects.requireNonNull(irBuiltIns, "irBuiltIns");
        this.typeStates = new CaffeineCache<>(typeCacheSize);
    }

    public IrBuiltIns getIrBuiltIns() {
        return irBuiltIns;
    }

    /** 类型的反射状态（KType） */
    public TypeState typeOf(IrType type) {
        Objects.requireNonNull(type, "type");
        return typeStates.computeIfAbsent(type, t -> new TypeState(t, irBuiltIns.getKTypeClass()));
    }

    public CacheStats getTypeCacheStats() {
        return typeStates.getStats();
    }

    public void clearTypeCache() {
        typeStates.clear();
    }
}

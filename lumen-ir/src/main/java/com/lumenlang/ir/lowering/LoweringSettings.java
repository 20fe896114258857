package com.lumenlang.ir.lowering;

import java.io.PrintStream;
import java.util.Map;

/**
 * Lowering 配置。
 * <p>
 * 环境变量：
 * <ul>
 *   <li>{@code LUMEN_DUMP_ADAPTERS=1}：每个生成的适配器以 JSON 形式打印到 dumpStream</li>
 *   <li>{@code LUMEN_SUSPEND_CONVERSION=0}：关闭挂起转换</li>
 * </ul>
 */
public class LoweringSettings {

    public static final String DUMP_ADAPTERS_ENV = "LUMEN_DUMP_ADAPTERS";
    public static final String SUSPEND_CONVERSION_ENV = "LUMEN_SUSPEND_CONVERSION";

    private boolean suspendConversionEnabled = true;
    private boolean dumpAdapters = false;
    private PrintStream dumpStream = System.err;

    public static LoweringSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static LoweringSettings fromEnvironment(Map<String, String> env) {
        LoweringSettings settings = new LoweringSettings();
        settings.setDumpAdapters("1".equals(env.get(DUMP_ADAPTERS_ENV)));
        settings.setSuspendConversionEnabled(!"0".equals(env.get(SUSPEND_CONVERSION_ENV)));
        return settings;
    }

    public boolean isSuspendConversionEnabled() {
        return suspendConversionEnabled;
    }

    public void setSuspendConversionEnabled(boolean suspendConversionEnabled) {
        this.suspendConversionEnabled = suspendConversionEnabled;
    }

    public boolean isDumpAdapters() {
        return dumpAdapters;
    }

    public void setDumpAdapters(boolean dumpAdapters) {
        this.dumpAdapters = dumpAdapters;
    }

    public PrintStream getDumpStream() {
        return dumpStream;
    }

    public void setDumpStream(PrintStream dumpStream) {
        this.dumpStream = dumpStream != null ? dumpStream : System.err;
    }
}

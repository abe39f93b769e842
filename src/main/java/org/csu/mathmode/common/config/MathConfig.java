package org.csu.mathmode.common.config;

/**
 * 数学模式处理的配置。
 *
 * @param maxNestingDepth 允许的最大嵌套深度 (定界组、上下标、根式、调用)，超过则报 NESTING_TOO_DEEP
 * @param debug           是否向控制台输出 [MathParser] / [MathProcessor] 调试信息
 */
public record MathConfig(int maxNestingDepth, boolean debug) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public static final String MAX_NESTING_DEPTH_PROPERTY = "mathmode.maxNestingDepth";
    public static final String DEBUG_PROPERTY = "mathmode.debug";

    public MathConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }

    public static MathConfig defaults() {
        return new MathConfig(DEFAULT_MAX_NESTING_DEPTH, false);
    }

    /**
     * 从系统属性读取配置，缺省值同 {@link #defaults()}。
     */
    public static MathConfig fromSystemProperties() {
        String depth = System.getProperty(MAX_NESTING_DEPTH_PROPERTY);
        int maxDepth = DEFAULT_MAX_NESTING_DEPTH;
        if (depth != null) {
            try {
                maxDepth = Integer.parseInt(depth.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + MAX_NESTING_DEPTH_PROPERTY + ": " + depth, e);
            }
        }
        return new MathConfig(maxDepth, Boolean.parseBoolean(System.getProperty(DEBUG_PROPERTY)));
    }

    public MathConfig withMaxNestingDepth(int maxNestingDepth) {
        return new MathConfig(maxNestingDepth, debug);
    }

    public MathConfig withDebug(boolean debug) {
        return new MathConfig(maxNestingDepth, debug);
    }
}

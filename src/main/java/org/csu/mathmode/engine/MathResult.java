package org.csu.mathmode.engine;

import org.csu.mathmode.common.exception.MathException;
import org.csu.mathmode.content.ContentElement;

/**
 * 封装一个数学区间的处理结果：内容或错误，二者只有一个非空。
 */
public record MathResult(
        String source,              // 原始数学源码
        ContentElement content,     // 成功时的内容树
        RuntimeException error      // 失败时的异常，通常是 MathException
) {
    public static MathResult success(String source, ContentElement content) {
        return new MathResult(source, content, null);
    }

    public static MathResult failure(String source, RuntimeException error) {
        return new MathResult(source, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * 错误种类：MathException 返回其种类名，其他异常返回类名；成功时为 null。
     */
    public String errorKind() {
        if (error == null) {
            return null;
        }
        return error instanceof MathException math ? math.kindName() : error.getClass().getSimpleName();
    }
}

package org.csu.mathmode.engine;

import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.common.model.Value;
import org.csu.mathmode.content.ContentElement;

/**
 * 显示转换：把任意值转换为可渲染的内容。由通用求值器提供，数学核心只调用它。
 * 实现必须是纯函数。
 */
@FunctionalInterface
public interface DisplayCoercion {

    /**
     * @param value 要显示的值
     * @param span  产生该值的表达式区间，结果内容的顶层节点必须携带它
     */
    ContentElement display(Value value, Span span);
}

package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 内容树节点，交给排版阶段使用。构建后不可变，每个节点都保留其源码区间。
 */
public interface ContentElement {

    Span span();

    /**
     * 返回同样内容但区间替换为 span 的节点。
     */
    ContentElement withSpan(Span span);

    /**
     * 线性化的纯文本形式，仅用于调试输出与测试断言。
     */
    String plainText();
}

package org.csu.mathmode.compiler.classifier;

/**
 * 数学模式节点的分类标签。
 */
public enum ConstituentClass {
    ATOM,
    OPENING,      // ( [ { ⟨ ⟦ ⌊ ⌈
    CLOSING,      // ) ] } ⟩ ⟧ ⌋ ⌉
    FENCE,        // | ‖ : 既可开也可闭
    ATTACH_SUB,   // _
    ATTACH_SUP,   // ^
    FRACTION,     // /
    PRIME,        // ' ′
    FACTORIAL,    // !
    ROOT,         // √ ∛ ∜
    ALIGN_POINT,  // &
    SPACE,
    GROUP         // 上游子表达式
}

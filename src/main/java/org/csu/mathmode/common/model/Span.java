package org.csu.mathmode.common.model;

/**
 * 源码区间 [start, end)，以字符偏移量表示。
 *
 * @param start 起始偏移 (包含)
 * @param end   结束偏移 (不包含)
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    /**
     * 被 other 完全包含且严格更小。
     */
    public boolean strictlyInside(Span other) {
        return other.contains(this) && length() < other.length();
    }

    /**
     * 返回覆盖两个区间的最小区间
     */
    public Span join(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}

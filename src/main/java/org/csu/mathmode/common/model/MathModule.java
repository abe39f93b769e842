package org.csu.mathmode.common.model;

import java.util.Map;

/**
 * 具名的成员集合，支持字段投影。
 */
public record MathModule(String name, Map<String, Value> members) {

    public MathModule {
        members = Map.copyOf(members);
    }

    public Value member(String field) {
        return members.get(field);
    }
}

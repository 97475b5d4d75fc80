package com.telemetry.pumlflow.loop;

import lombok.Getter;

import java.util.Objects;

/**
 * 循环回边：结束点 -> 起点
 */
@Getter
public class LoopEdge {
    private final String source;
    private final String target;

    public LoopEdge(String source, String target) {
        this.source = source;
        this.target = target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LoopEdge that = (LoopEdge) o;
        return source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}

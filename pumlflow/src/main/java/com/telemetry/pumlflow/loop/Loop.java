package com.telemetry.pumlflow.loop;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;

/**
 * 一个检测到的循环（强连通分量）
 *
 * 只在折叠时使用，折叠完成后不保留
 */
@Getter
public class Loop {

    /** 强连通分量内的节点 */
    private final SortedSet<String> nodes;

    /** 有外部入边的节点 */
    private final Set<String> startPoints;

    /** 有边指向外部的节点 */
    private final Set<String> exitPoints;

    /** 有边指向起点的节点 */
    private final Set<String> loopBackPoints;

    /** 每轮循环的最后一个节点 */
    private final Set<String> endPoints;

    /** 非结束点的出口，从这里离开即 break */
    private final Set<String> breakOutPoints;

    /** 只能经由 break 到达的外部节点，并入循环子图 */
    private final Set<String> breakPoints;

    /** 结束点的外部后继：循环正常结束后的去向 */
    private final Set<String> continuation;

    private final Set<LoopEdge> loopEdges;

    Loop(SortedSet<String> nodes, Set<String> startPoints, Set<String> exitPoints, Set<String> loopBackPoints,
         Set<String> endPoints, Set<String> breakOutPoints, Set<String> breakPoints, Set<String> continuation,
         Set<LoopEdge> loopEdges) {
        this.nodes = Collections.unmodifiableSortedSet(nodes);
        this.startPoints = Collections.unmodifiableSet(startPoints);
        this.exitPoints = Collections.unmodifiableSet(exitPoints);
        this.loopBackPoints = Collections.unmodifiableSet(loopBackPoints);
        this.endPoints = Collections.unmodifiableSet(endPoints);
        this.breakOutPoints = Collections.unmodifiableSet(breakOutPoints);
        this.breakPoints = Collections.unmodifiableSet(breakPoints);
        this.continuation = Collections.unmodifiableSet(continuation);
        this.loopEdges = Collections.unmodifiableSet(loopEdges);
    }

    /**
     * 折叠进循环子图的全部节点：分量本身加上 break 专属路径
     */
    public Set<String> getInterior() {
        Set<String> interior = new LinkedHashSet<>(nodes);
        interior.addAll(breakPoints);
        return interior;
    }

    /**
     * 从该节点出发的回边目标
     */
    public Set<String> loopBackTargets(String source) {
        Set<String> targets = new LinkedHashSet<>();
        for (LoopEdge edge : loopEdges) {
            if (edge.getSource().equals(source)) {
                targets.add(edge.getTarget());
            }
        }
        return targets;
    }

    /**
     * 指向该节点的回边来源
     */
    public Set<String> loopBackSources(String target) {
        Set<String> sources = new LinkedHashSet<>();
        for (LoopEdge edge : loopEdges) {
            if (edge.getTarget().equals(target)) {
                sources.add(edge.getSource());
            }
        }
        return sources;
    }

    @Override
    public String toString() {
        return "Loop{nodes=" + nodes + ", start=" + startPoints + ", end=" + endPoints
                + ", breakOut=" + breakOutPoints + ", break=" + breakPoints + "}";
    }
}

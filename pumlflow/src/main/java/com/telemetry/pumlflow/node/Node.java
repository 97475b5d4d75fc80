package com.telemetry.pumlflow.node;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.event.EventSet;
import com.telemetry.pumlflow.logic.GateTree;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 节点图中的节点
 *
 * outgoing/incoming 是全部邻居；逻辑树只有一个叶子时表示普通的顺序连接
 */
@Getter
public class Node {

    private final String uid;
    private final String eventType;
    private final List<Node> incoming = new ArrayList<>();
    private final List<Node> outgoing = new ArrayList<>();
    private final Set<EventSet> incomingSets = new LinkedHashSet<>();
    private final EnumSet<PumlEventTag> tags = EnumSet.noneOf(PumlEventTag.class);

    @Setter
    private GateTree outgoingTree;

    @Setter
    private GateTree incomingTree;

    /** 桩节点：只代表循环外的某个事件，在循环内作为 break 终止点 */
    @Setter
    private boolean stub;

    public Node(String uid, String eventType) {
        this.uid = uid;
        this.eventType = eventType;
    }

    public void addOutgoing(Node target) {
        if (!outgoing.contains(target)) {
            outgoing.add(target);
            target.incoming.add(this);
        }
    }

    public void addIncomingSet(EventSet eventSet) {
        incomingSets.add(eventSet);
    }

    public void addTag(PumlEventTag tag) {
        tags.add(tag);
    }

    public boolean hasTag(PumlEventTag tag) {
        return tags.contains(tag);
    }

    public Set<PumlEventTag> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    /**
     * 按事件类型查找后继
     */
    public Node successor(String type) {
        for (Node node : outgoing) {
            if (node.eventType.equals(type)) {
                return node;
            }
        }
        return null;
    }

    /**
     * 合成节点（起点、循环起止、break 标记），不渲染为事件
     */
    public boolean isDummy() {
        return PumlFlowConstants.DummyEvent.isDummy(eventType);
    }

    public boolean isBreakMarker() {
        return eventType.startsWith(PumlFlowConstants.DummyEvent.BREAK_PREFIX);
    }

    @Override
    public String toString() {
        return uid;
    }
}

package com.telemetry.pumlflow.walker;

import com.telemetry.pumlflow.logic.GateTree;
import com.telemetry.pumlflow.node.Node;

import java.util.Collections;
import java.util.Set;

/**
 * 逻辑块的汇合去向
 */
final class MergeTarget {

    enum Kind {
        /** 所有存活分支在该节点汇合 */
        NODE,
        /** 顶层图没有公共后继：各分支自然结束，结束即汇合 */
        EXIT,
        /** 各分支末尾的节点打开同一个逻辑门：本块结束后紧接着打开它 */
        BUNCHED,
        /** 没有存活分支 */
        NONE
    }

    final Kind kind;
    final Node node;
    final Set<Node> preMerge;
    final GateTree bunchedTree;
    final Node bunchedOwner;

    private MergeTarget(Kind kind, Node node, Set<Node> preMerge, GateTree bunchedTree, Node bunchedOwner) {
        this.kind = kind;
        this.node = node;
        this.preMerge = preMerge;
        this.bunchedTree = bunchedTree;
        this.bunchedOwner = bunchedOwner;
    }

    static MergeTarget node(Node node) {
        return new MergeTarget(Kind.NODE, node, Collections.emptySet(), null, null);
    }

    static MergeTarget exit() {
        return new MergeTarget(Kind.EXIT, null, Collections.emptySet(), null, null);
    }

    static MergeTarget none() {
        return new MergeTarget(Kind.NONE, null, Collections.emptySet(), null, null);
    }

    static MergeTarget bunched(Set<Node> preMerge, GateTree tree, Node owner) {
        return new MergeTarget(Kind.BUNCHED, null, Collections.unmodifiableSet(preMerge), tree, owner);
    }

    boolean isNode(Node candidate) {
        return kind == Kind.NODE && node == candidate;
    }

    @Override
    public String toString() {
        switch (kind) {
            case NODE:
                return "NODE(" + node.getUid() + ")";
            case BUNCHED:
                return "BUNCHED(" + preMerge + " -> " + bunchedTree + ")";
            default:
                return kind.name();
        }
    }
}

package com.telemetry.pumlflow.walker;

import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.node.Node;

import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * 逻辑门树在节点图上的展开：每个分支要么是一个后继节点，要么是嵌套的门
 */
final class Fork {

    final GateType gate;
    final Node owner;
    final List<Branch> branches;

    Fork(GateType gate, Node owner, List<Branch> branches) {
        this.gate = gate;
        this.owner = owner;
        this.branches = Collections.unmodifiableList(branches);
    }

    @Override
    public String toString() {
        return gate + branches.toString();
    }

    static final class Branch {
        final Node target;
        final SortedSet<Integer> counts;
        final Fork fork;
        final BitSet reach;

        Branch(Node target, SortedSet<Integer> counts, BitSet reach) {
            this.target = target;
            this.counts = counts;
            this.fork = null;
            this.reach = reach;
        }

        Branch(Fork fork) {
            this.target = null;
            this.counts = null;
            this.fork = fork;
            BitSet bits = new BitSet();
            for (Branch branch : fork.branches) {
                bits.or(branch.reach);
            }
            this.reach = bits;
        }

        boolean isLeaf() {
            return fork == null;
        }

        @Override
        public String toString() {
            return isLeaf() ? target.getUid() : fork.toString();
        }
    }
}

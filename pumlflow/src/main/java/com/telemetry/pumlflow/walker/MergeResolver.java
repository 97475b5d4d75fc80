package com.telemetry.pumlflow.walker;

import com.telemetry.pumlflow.event.EventSet;
import com.telemetry.pumlflow.logic.GateTree;
import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.node.Node;
import com.telemetry.pumlflow.node.NodeGraph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 汇合点计算
 *
 * 汇合点是所有存活分支（能到达边界节点的分支：外层块的汇合点或循环出口）都能到达的最早节点；
 * AND/OR 块还要求该节点某个入向事件集合同时包含每个分支的前驱，否则各分支分别经过它，继续向后找。
 * 部分分支先行汇合时把它们重新分组为嵌套的同类型门。
 */
class MergeResolver {

    private final NodeGraph graph;
    private final Reachability reachability;

    MergeResolver(NodeGraph graph, Reachability reachability) {
        this.graph = graph;
        this.reachability = reachability;
    }

    /**
     * 逻辑门树 -> 分支结构，叶子按类型映射到 owner 的后继
     */
    Fork toFork(GateTree tree, Node owner) {
        List<Fork.Branch> branches = new ArrayList<>();
        for (GateTree child : tree.getChildren()) {
            if (child.isLeaf()) {
                Node target = owner.successor(child.getEventType());
                if (target == null) {
                    throw new IllegalStateException(owner.getUid() + " 没有类型为 " + child.getEventType() + " 的后继");
                }
                branches.add(new Fork.Branch(target, child.getCounts(), reachability.from(target)));
            } else {
                branches.add(new Fork.Branch(toFork(child, owner)));
            }
        }
        return new Fork(tree.getGate(), owner, branches);
    }

    /**
     * @param boundary 外层汇合点或循环出口；顶层为 null
     */
    MergeTarget resolve(Fork fork, Node boundary) {
        List<Fork.Branch> live = liveBranches(fork, boundary);
        if (live.isEmpty()) {
            return MergeTarget.none();
        }
        BitSet common = commonReach(live);
        while (!common.isEmpty()) {
            List<Node> earliest = reachability.earliest(common);
            if (earliest.size() > 1) {
                MergeTarget bunched = bunched(live, earliest);
                if (bunched != null) {
                    return bunched;
                }
            }
            Node candidate = earliest.get(0);
            if (candidate == boundary || isValidMerge(fork, live, candidate)) {
                return MergeTarget.node(candidate);
            }
            common.clear(reachability.indexOf(candidate));
        }
        return boundary == null ? MergeTarget.exit() : MergeTarget.node(boundary);
    }

    /**
     * 部分分支在汇合点之前先行汇合时，把这些分支收拢为嵌套的同类型门
     */
    Fork regroup(Fork fork, MergeTarget merge, Node boundary) {
        Fork current = fork;
        while (true) {
            List<Fork.Branch> live = liveBranches(current, boundary);
            if (live.size() < 3) {
                return current;
            }
            BitSet all = commonReach(live);
            Node best = null;
            List<Fork.Branch> bestGroup = null;
            for (int i = 0; i < live.size(); i++) {
                for (int j = i + 1; j < live.size(); j++) {
                    BitSet pair = (BitSet) live.get(i).reach.clone();
                    pair.and(live.get(j).reach);
                    pair.andNot(all);
                    for (Node candidate : reachability.earliest(pair)) {
                        if (merge.kind == MergeTarget.Kind.NODE && !reachability.reaches(candidate, merge.node)) {
                            continue;
                        }
                        List<Fork.Branch> group = new ArrayList<>();
                        for (Fork.Branch branch : live) {
                            if (reachability.reaches(branch.reach, candidate)) {
                                group.add(branch);
                            }
                        }
                        if (group.size() < 2 || group.size() >= live.size()
                                || !isValidMerge(current, group, candidate)) {
                            continue;
                        }
                        if (best == null || reachability.indexOf(candidate) < reachability.indexOf(best)) {
                            best = candidate;
                            bestGroup = group;
                        }
                    }
                }
            }
            if (best == null) {
                return current;
            }
            List<Fork.Branch> branches = new ArrayList<>();
            boolean placed = false;
            for (Fork.Branch branch : current.branches) {
                if (!bestGroup.contains(branch)) {
                    branches.add(branch);
                } else if (!placed) {
                    branches.add(new Fork.Branch(new Fork(current.gate, current.owner, bestGroup)));
                    placed = true;
                }
            }
            current = new Fork(current.gate, current.owner, branches);
        }
    }

    List<Fork.Branch> liveBranches(Fork fork, Node boundary) {
        List<Fork.Branch> live = new ArrayList<>();
        for (Fork.Branch branch : fork.branches) {
            if (boundary == null || reachability.reaches(branch.reach, boundary)) {
                live.add(branch);
            }
        }
        return live;
    }

    private static BitSet commonReach(List<Fork.Branch> branches) {
        BitSet common = (BitSet) branches.get(0).reach.clone();
        for (int i = 1; i < branches.size(); i++) {
            common.and(branches.get(i).reach);
        }
        return common;
    }

    /**
     * 多个最早公共节点：若每个分支末尾都有节点恰好指向这些节点且逻辑门相同，视为首尾相接的两个逻辑块
     */
    private MergeTarget bunched(List<Fork.Branch> live, List<Node> earliest) {
        Set<Node> targets = new HashSet<>(earliest);
        Set<Node> preMerge = new LinkedHashSet<>();
        GateTree tree = null;
        for (Node node : graph.getNodes()) {
            GateTree outgoing = node.getOutgoingTree();
            if (outgoing == null || outgoing.isLeaf() || !targets.equals(new HashSet<>(node.getOutgoing()))) {
                continue;
            }
            if (tree != null && !tree.equals(outgoing)) {
                return null;
            }
            tree = outgoing;
            preMerge.add(node);
        }
        if (tree == null) {
            return null;
        }
        for (Fork.Branch branch : live) {
            boolean touches = false;
            for (Node node : preMerge) {
                if (reachability.reaches(branch.reach, node)) {
                    touches = true;
                    break;
                }
            }
            if (!touches) {
                return null;
            }
        }
        return MergeTarget.bunched(preMerge, tree, preMerge.iterator().next());
    }

    /**
     * AND/OR 汇合要求某个入向事件集合覆盖所有分支；XOR 和合成节点不做要求
     */
    private boolean isValidMerge(Fork fork, List<Fork.Branch> branches, Node candidate) {
        if (fork.gate == GateType.XOR || candidate.isDummy() || candidate.getIncomingSets().isEmpty()) {
            return true;
        }
        for (EventSet eventSet : candidate.getIncomingSets()) {
            boolean covers = true;
            for (Fork.Branch branch : branches) {
                if (!branchFeeds(fork, branch, candidate, eventSet)) {
                    covers = false;
                    break;
                }
            }
            if (covers) {
                return true;
            }
        }
        return false;
    }

    private boolean branchFeeds(Fork fork, Fork.Branch branch, Node candidate, EventSet eventSet) {
        for (Node predecessor : candidate.getIncoming()) {
            if (!eventSet.contains(predecessor.getEventType())) {
                continue;
            }
            if (reachability.reaches(branch.reach, predecessor)) {
                return true;
            }
            // 空分支：分支入口就是汇合点，前驱是打开逻辑门的节点
            if (branch.isLeaf() && branch.target == candidate && predecessor == fork.owner) {
                return true;
            }
        }
        return false;
    }
}

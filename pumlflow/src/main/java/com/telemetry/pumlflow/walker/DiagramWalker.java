package com.telemetry.pumlflow.walker;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.exception.DiagramWarning;
import com.telemetry.pumlflow.exception.MergeNotFoundException;
import com.telemetry.pumlflow.logic.GateTree;
import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.node.Node;
import com.telemetry.pumlflow.node.NodeGraph;
import com.telemetry.pumlflow.node.PumlEventTag;
import com.telemetry.pumlflow.node.SubGraphNode;
import com.telemetry.pumlflow.pipeline.JobContext;
import com.telemetry.pumlflow.puml.PumlGraph;
import com.telemetry.pumlflow.puml.PumlNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * 输出图遍历器：节点图 -> 输出图
 *
 * 深度优先，用显式的逻辑块栈代替递归：
 * 1. 节点打开逻辑门时输出 START，计算汇合点，压栈，逐个分支走下去
 * 2. 分支到达汇合点时连到 END；分支走到尽头或遇到 break 时输出终止节点
 * 3. 所有分支走完后出栈，从 END 接着走汇合点
 * 循环节点先输出占位节点，整张图走完后按 uid 遍历一次内嵌图，回填到所有占位节点
 */
@Slf4j
public class DiagramWalker {

    private static final String TAG = PumlFlowConstants.LogTag.WALK;

    private final JobContext context;

    /** 已遍历的循环体：SubGraphNode uid -> 输出图 */
    private final Map<String, PumlGraph> walkedLoops = new HashMap<>();

    public DiagramWalker(JobContext context) {
        this.context = context;
    }

    public PumlGraph walk(NodeGraph nodeGraph) {
        long startTime = System.currentTimeMillis();
        PumlGraph result = walkGraph(nodeGraph);
        log.info("{}-> job={} 遍历完成, 输出节点数: {}, 逻辑块数: {}, 终止节点数: {}, 耗时: {}ms",
                TAG, context.getJobName(), result.size(), result.countOperators(PumlNode.Role.START),
                result.getKillCount(), System.currentTimeMillis() - startTime);
        return result;
    }

    private PumlGraph walkGraph(NodeGraph nodeGraph) {
        GraphWalk walk = new GraphWalk(nodeGraph);
        walk.run();

        // 循环体按 uid 只遍历一次，回填到所有引用它的占位节点
        for (Map.Entry<String, SubGraphNode> entry : walk.loops.entrySet()) {
            String uid = entry.getKey();
            PumlGraph body = walkedLoops.get(uid);
            if (body == null) {
                log.debug("{}-> 遍历循环体 {}", TAG, uid);
                body = walkGraph(entry.getValue().getSubGraph());
                walkedLoops.put(uid, body);
            }
            for (PumlNode placeholder : walk.output.placeholdersFor(uid)) {
                placeholder.setSubDiagram(body);
            }
        }
        return walk.output;
    }

    /**
     * 遍历位置：从 prev 之后走到 node；node 为 null 表示路径在 prev 处结束
     */
    private static final class Cursor {
        final PumlNode prev;
        final Node node;
        final SortedSet<Integer> counts;

        Cursor(PumlNode prev, Node node, SortedSet<Integer> counts) {
            this.prev = prev;
            this.node = node;
            this.counts = counts;
        }
    }

    /**
     * 单张节点图的一次遍历
     */
    private final class GraphWalk {

        private final NodeGraph nodeGraph;
        private final Reachability reachability;
        private final MergeResolver resolver;
        private final PumlGraph output = new PumlGraph();
        private final Deque<LogicBlockContext> frames = new ArrayDeque<>();
        private final Map<String, SubGraphNode> loops = new LinkedHashMap<>();

        GraphWalk(NodeGraph nodeGraph) {
            this.nodeGraph = nodeGraph;
            this.reachability = new Reachability(nodeGraph);
            this.resolver = new MergeResolver(nodeGraph, reachability);
        }

        void run() {
            Cursor cursor = new Cursor(null, nodeGraph.getRoot(), null);
            while (cursor != null) {
                cursor = advance(cursor);
            }
            if (!frames.isEmpty()) {
                throw new IllegalStateException("遍历结束时仍有未关闭的逻辑块: " + frames);
            }
        }

        private Cursor advance(Cursor cursor) {
            if (cursor.node == null) {
                return pathEnded(cursor.prev);
            }
            Node node = cursor.node;
            LogicBlockContext top = frames.peek();

            if (top != null && top.merge.isNode(node)) {
                connect(cursor.prev, top.end);
                warnIfStackedEnd(cursor.prev, top);
                top.branchMerged();
                return nextBranch();
            }
            if (top != null) {
                try {
                    checkEscape(node, top);
                } catch (MergeNotFoundException e) {
                    log.warn("{}-> job={} {}，强制终止该分支", TAG, context.getJobName(), e.getMessage());
                    context.addWarning(DiagramWarning.Kind.MERGE_NOT_FOUND, e.getNodeUid(), e.getMessage());
                    return kill(cursor.prev, false);
                }
            } else if (node == nodeGraph.getExit()) {
                return null;
            }

            if (node.isBreakMarker()) {
                return kill(cursor.prev, true);
            }

            PumlNode current = cursor.prev;
            if (!node.isDummy()) {
                current = emit(node, cursor.counts);
                connect(cursor.prev, current);
            }
            if (node.hasTag(PumlEventTag.BREAK) && node.isStub()) {
                return kill(current, true);
            }
            if (top != null && top.merge.kind == MergeTarget.Kind.BUNCHED && top.merge.preMerge.contains(node)) {
                connect(current, top.end);
                top.branchMerged();
                return nextBranch();
            }
            if (node.getOutgoing().isEmpty()) {
                return new Cursor(current, null, null);
            }

            GateTree tree = outgoingTree(node);
            if (tree.isLeaf()) {
                return new Cursor(current, node.successor(tree.getEventType()), tree.getCounts());
            }
            return open(current, resolver.toFork(tree, node));
        }

        /**
         * 分支越过当前块去了外层块的汇合点，或者直接到达了循环出口
         */
        private void checkEscape(Node node, LogicBlockContext top) {
            Iterator<LogicBlockContext> outer = frames.iterator();
            outer.next();
            while (outer.hasNext()) {
                LogicBlockContext frame = outer.next();
                if (frame.merge.isNode(node)) {
                    throw new MergeNotFoundException(node.getUid(),
                            "分支到达外层逻辑块的汇合点 " + node.getUid() + "，未经过当前块 " + top);
                }
            }
            if (node == nodeGraph.getExit()) {
                throw new MergeNotFoundException(node.getUid(), "分支到达循环出口，未经过当前块 " + top);
            }
        }

        /**
         * 打开逻辑块：计算汇合点，必要时把先行汇合的分支分组，然后走第一个分支
         */
        private Cursor open(PumlNode prev, Fork fork) {
            Node boundary = currentBoundary();
            MergeTarget merge = resolver.resolve(fork, boundary);
            Fork grouped = resolver.regroup(fork, merge, boundary);
            int blockId = output.nextBlockId();
            PumlNode start = output.addOperator(grouped.gate, PumlNode.Role.START, blockId);
            PumlNode end = output.addOperator(grouped.gate, PumlNode.Role.END, blockId);
            connect(prev, start);
            Node inner = merge.kind == MergeTarget.Kind.NODE ? merge.node : boundary;
            frames.push(new LogicBlockContext(grouped, merge, inner, start, end));
            log.debug("{}-> 打开逻辑块 {} 分支: {}", TAG, frames.peek(), grouped.branches);
            return nextBranch();
        }

        private Node currentBoundary() {
            LogicBlockContext top = frames.peek();
            return top != null ? top.boundary : nodeGraph.getExit();
        }

        /**
         * 当前块的下一个分支；分支走完则关闭块
         */
        private Cursor nextBranch() {
            LogicBlockContext top = frames.peek();
            if (!top.hasNextBranch()) {
                return close();
            }
            PumlNode anchor = top.openNextBranch(output);
            Fork.Branch branch = top.currentBranch();
            if (branch.isLeaf()) {
                return new Cursor(anchor, branch.target, branch.counts);
            }
            return open(anchor, branch.fork);
        }

        private Cursor close() {
            LogicBlockContext frame = frames.pop();
            log.debug("{}-> 关闭逻辑块 {} 汇合分支: {}, 终止分支: {}", TAG, frame,
                    frame.getMergedCount(), frame.getKilledCount());
            if (frame.getMergedCount() == 0) {
                // 所有分支都已终止，外层分支随之结束
                LogicBlockContext parent = frames.peek();
                if (parent == null) {
                    return null;
                }
                parent.branchKilled();
                return nextBranch();
            }
            switch (frame.merge.kind) {
                case NODE:
                    return new Cursor(frame.end, frame.merge.node, null);
                case EXIT:
                    return new Cursor(frame.end, null, null);
                case BUNCHED:
                    return openBunched(frame);
                case NONE:
                default:
                    throw new IllegalStateException("逻辑块没有汇合点却有分支汇合: " + frame);
            }
        }

        /**
         * 本块各分支末尾的节点打开了同一个逻辑门：本块结束后紧接着打开它
         */
        private Cursor openBunched(LogicBlockContext frame) {
            GateTree bunchedTree = frame.merge.bunchedTree;
            if (bunchedTree.getGate() == frame.fork.gate) {
                String message = "同类型逻辑块 " + frame.fork.gate + " 首尾相接，保留为两个独立的块";
                log.warn("{}-> job={} {}: {}", TAG, context.getJobName(), message, frame.merge.preMerge);
                context.addWarning(DiagramWarning.Kind.BUNCHED_AMBIGUITY,
                        frame.merge.bunchedOwner.getUid(), message);
            }
            return open(frame.end, resolver.toFork(bunchedTree, frame.merge.bunchedOwner));
        }

        /**
         * 路径在 prev 处结束：顶层且所有块都以出口为汇合点时汇合，否则终止；
         * 循环体内没有到达出口的路径以 break 离开循环
         */
        private Cursor pathEnded(PumlNode prev) {
            boolean inLoop = nodeGraph.getExit() != null;
            LogicBlockContext top = frames.peek();
            if (top == null) {
                if (inLoop && prev != null) {
                    output.addEdge(prev, output.addKill(true));
                }
                return null;
            }
            for (LogicBlockContext frame : frames) {
                if (frame.merge.kind != MergeTarget.Kind.EXIT) {
                    return kill(prev, inLoop);
                }
            }
            connect(prev, top.end);
            warnIfStackedEnd(prev, top);
            top.branchMerged();
            return nextBranch();
        }

        private Cursor kill(PumlNode prev, boolean breakLoop) {
            PumlNode killNode = output.addKill(breakLoop);
            connect(prev, killNode);
            LogicBlockContext top = frames.peek();
            if (top == null) {
                return null;
            }
            top.branchKilled();
            return nextBranch();
        }

        /**
         * 内层块的 END 直接连到同类型外层块的 END，无法区分是嵌套还是同一个块
         */
        private void warnIfStackedEnd(PumlNode prev, LogicBlockContext top) {
            if (prev != null && prev.isOperator(PumlNode.Role.END) && prev.getGate() == top.fork.gate) {
                String message = "同类型逻辑块 " + top.fork.gate + " 的结束相邻，保留为嵌套的块";
                log.warn("{}-> job={} {}: {} -> {}", TAG, context.getJobName(), message, prev.getId(),
                        top.end.getId());
                context.addWarning(DiagramWarning.Kind.BUNCHED_AMBIGUITY, prev.getId(), message);
            }
        }

        private PumlNode emit(Node node, SortedSet<Integer> counts) {
            if (node instanceof SubGraphNode) {
                loops.put(node.getUid(), (SubGraphNode) node);
                return output.addSubGraphEvent(node.getEventType(), node.getTags(), node.getUid());
            }
            return output.addEvent(node.getEventType(), node.getTags(), counts);
        }

        private void connect(PumlNode source, PumlNode target) {
            if (source != null) {
                output.addEdge(source, target);
            }
        }
    }

    /**
     * 节点的出向逻辑树；缺失时按后继构造（单个后继为叶子，多个为 OR）
     */
    private static GateTree outgoingTree(Node node) {
        if (node.getOutgoingTree() != null) {
            return node.getOutgoingTree();
        }
        List<GateTree> leaves = new ArrayList<>();
        for (Node successor : node.getOutgoing()) {
            leaves.add(GateTree.leaf(successor.getEventType()));
        }
        return leaves.size() == 1 ? leaves.get(0) : GateTree.gate(GateType.OR, leaves);
    }
}

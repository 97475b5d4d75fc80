package com.telemetry.pumlflow.walker;

import com.telemetry.pumlflow.node.Node;
import com.telemetry.pumlflow.puml.PumlGraph;
import com.telemetry.pumlflow.puml.PumlNode;

/**
 * 遍历中一个打开的逻辑块
 *
 * 分支按顺序逐个走完：首个分支挂在 START 上，其余分支各由一个 PATH 节点引出。
 * 每个分支要么汇入 END（merged），要么终止（killed）。
 */
class LogicBlockContext {

    final Fork fork;
    final MergeTarget merge;
    /** 本块内新打开的块计算汇合点时使用的边界 */
    final Node boundary;
    final PumlNode start;
    final PumlNode end;

    private int nextBranch;
    private int mergedCount;
    private int killedCount;

    LogicBlockContext(Fork fork, MergeTarget merge, Node boundary, PumlNode start, PumlNode end) {
        this.fork = fork;
        this.merge = merge;
        this.boundary = boundary;
        this.start = start;
        this.end = end;
    }

    boolean hasNextBranch() {
        return nextBranch < fork.branches.size();
    }

    /**
     * 取出下一个分支，返回该分支挂接的输出节点
     */
    PumlNode openNextBranch(PumlGraph graph) {
        PumlNode anchor = start;
        if (nextBranch > 0) {
            anchor = graph.addOperator(fork.gate, PumlNode.Role.PATH, start.getBlockId());
            graph.addEdge(start, anchor);
        }
        return anchor;
    }

    Fork.Branch currentBranch() {
        return fork.branches.get(nextBranch);
    }

    void branchMerged() {
        mergedCount++;
        nextBranch++;
    }

    void branchKilled() {
        killedCount++;
        nextBranch++;
    }

    int getMergedCount() {
        return mergedCount;
    }

    int getKilledCount() {
        return killedCount;
    }

    @Override
    public String toString() {
        return fork.gate + "#" + start.getBlockId() + " -> " + merge;
    }
}

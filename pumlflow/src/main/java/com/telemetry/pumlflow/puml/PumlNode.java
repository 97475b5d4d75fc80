package com.telemetry.pumlflow.puml;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.node.PumlEventTag;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * 图中的一个元素
 *
 * 固定的三种变体：事件 / 逻辑操作符 / 终止（detach 或 break），由 {@link Kind} 区分，
 * 所有消费方按 kind 穷举处理
 */
@Getter
public final class PumlNode {

    public enum Kind {
        EVENT,
        OPERATOR,
        KILL
    }

    public enum Role {
        START,
        PATH,
        END
    }

    private final String id;
    private final Kind kind;

    // 事件
    private final String eventType;
    private final Set<PumlEventTag> tags;
    private final Integer branchNumber;
    private final SortedSet<Integer> branchCounts;
    private final String subGraphUid;

    /** 循环体，由遍历器按 subGraphUid 回填 */
    @Setter
    private PumlGraph subDiagram;

    // 操作符
    private final GateType gate;
    private final Role role;
    private final int blockId;

    // 终止
    private final boolean breakLoop;

    private PumlNode(String id, Kind kind, String eventType, Set<PumlEventTag> tags, Integer branchNumber,
                     SortedSet<Integer> branchCounts, String subGraphUid, GateType gate, Role role, int blockId,
                     boolean breakLoop) {
        this.id = id;
        this.kind = kind;
        this.eventType = eventType;
        this.tags = tags;
        this.branchNumber = branchNumber;
        this.branchCounts = branchCounts;
        this.subGraphUid = subGraphUid;
        this.gate = gate;
        this.role = role;
        this.blockId = blockId;
        this.breakLoop = breakLoop;
    }

    static PumlNode event(String id, String eventType, Set<PumlEventTag> tags, Integer branchNumber,
                          SortedSet<Integer> branchCounts, String subGraphUid) {
        Set<PumlEventTag> copy = tags.isEmpty() ? EnumSet.noneOf(PumlEventTag.class) : EnumSet.copyOf(tags);
        return new PumlNode(id, Kind.EVENT, eventType, Collections.unmodifiableSet(copy), branchNumber,
                branchCounts, subGraphUid, null, null, -1, false);
    }

    static PumlNode operator(String id, GateType gate, Role role, int blockId) {
        return new PumlNode(id, Kind.OPERATOR, null, Collections.emptySet(), null, null, null,
                gate, role, blockId, false);
    }

    static PumlNode kill(String id, boolean breakLoop) {
        return new PumlNode(id, Kind.KILL, null, Collections.emptySet(), null, null, null,
                null, null, -1, breakLoop);
    }

    public boolean isOperator(Role expected) {
        return kind == Kind.OPERATOR && role == expected;
    }

    /**
     * 输出本节点的 PlantUML 行
     *
     * @param indent 当前缩进级别
     * @return 下一行使用的缩进级别
     */
    public int writeLines(List<String> lines, int indent, int tabSize) {
        switch (kind) {
            case EVENT:
                return writeEvent(lines, indent, tabSize);
            case OPERATOR:
                return writeOperator(lines, indent, tabSize);
            case KILL:
                lines.add(pad(indent, tabSize) + (breakLoop ? PumlFlowConstants.Puml.BREAK
                        : PumlFlowConstants.Puml.DETACH));
                return indent;
            default:
                throw new IllegalStateException("未知节点类型: " + kind);
        }
    }

    private int writeEvent(List<String> lines, int indent, int tabSize) {
        if (subDiagram != null) {
            lines.add(pad(indent, tabSize) + PumlFlowConstants.Puml.REPEAT);
            PumlWriter.writeBody(subDiagram, lines, indent + 1, tabSize);
            lines.add(pad(indent, tabSize) + PumlFlowConstants.Puml.REPEAT_WHILE);
            return indent;
        }
        if (branchNumber != null) {
            lines.add(pad(indent, tabSize) + PumlFlowConstants.Puml.REPEAT);
            lines.add(pad(indent + 1, tabSize) + ":" + eventType + ";");
            lines.add(pad(indent, tabSize) + PumlFlowConstants.Puml.REPEAT_WHILE + " (" + branchCondition() + ")");
            return indent;
        }
        lines.add(pad(indent, tabSize) + ":" + eventType + ";");
        return indent;
    }

    private String branchCondition() {
        String variable = PumlFlowConstants.Puml.BRANCH_COUNT_PREFIX + branchNumber;
        if (branchCounts.size() == 1) {
            return variable + " = " + branchCounts.first();
        }
        return variable + " in " + branchCounts.first() + ".." + branchCounts.last();
    }

    private int writeOperator(List<String> lines, int indent, int tabSize) {
        switch (role) {
            case START:
                lines.add(pad(indent, tabSize) + startKeyword());
                return indent + 1;
            case PATH:
                lines.add(pad(indent - 1, tabSize) + pathKeyword());
                return indent;
            case END:
                lines.add(pad(indent - 1, tabSize) + endKeyword());
                return indent - 1;
            default:
                throw new IllegalStateException("未知操作符角色: " + role);
        }
    }

    private String startKeyword() {
        switch (gate) {
            case AND:
                return "fork";
            case OR:
                return "split";
            case XOR:
                return "if (XOR) then (true)";
            default:
                throw new IllegalStateException("未知逻辑门: " + gate);
        }
    }

    private String pathKeyword() {
        switch (gate) {
            case AND:
                return "fork again";
            case OR:
                return "split again";
            case XOR:
                return "elseif (XOR) then (true)";
            default:
                throw new IllegalStateException("未知逻辑门: " + gate);
        }
    }

    private String endKeyword() {
        switch (gate) {
            case AND:
                return "end fork";
            case OR:
                return "end split";
            case XOR:
                return "endif";
            default:
                throw new IllegalStateException("未知逻辑门: " + gate);
        }
    }

    private static String pad(int indent, int tabSize) {
        return " ".repeat(Math.max(indent, 0) * tabSize);
    }

    @Override
    public String toString() {
        return id;
    }
}

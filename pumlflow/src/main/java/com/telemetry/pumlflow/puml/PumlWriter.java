package com.telemetry.pumlflow.puml;

import com.telemetry.pumlflow.constants.PumlFlowConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * PlantUML 文本输出
 */
public final class PumlWriter {

    private PumlWriter() {
    }

    /**
     * 输出完整的 .puml 文件内容：partition + group 包裹图体
     */
    public static String write(PumlGraph graph, String name, int tabSize) {
        String tab = " ".repeat(tabSize);
        List<String> lines = new ArrayList<>();
        lines.add(PumlFlowConstants.Puml.START_UML);
        lines.add(tab + "partition \"" + name + "\" {");
        lines.add(tab + tab + "group \"" + name + "\"");
        writeBody(graph, lines, 3, tabSize);
        lines.add(tab + tab + "end group");
        lines.add(tab + "}");
        lines.add(PumlFlowConstants.Puml.END_UML);
        return String.join("\n", lines) + "\n";
    }

    /**
     * 从起始节点输出图体
     */
    public static void writeBody(PumlGraph graph, List<String> lines, int indent, int tabSize) {
        if (graph.getStartNode() != null) {
            writePath(graph, graph.getStartNode(), null, lines, indent, tabSize);
        }
    }

    /**
     * 沿一条路径输出，直到 stop 节点或路径终止；遇到逻辑块时逐个分支递归
     */
    private static void writePath(PumlGraph graph, PumlNode from, PumlNode stop, List<String> lines,
                                  int indent, int tabSize) {
        PumlNode current = from;
        int level = indent;
        while (current != null && current != stop) {
            switch (current.getKind()) {
                case EVENT:
                    level = current.writeLines(lines, level, tabSize);
                    current = next(graph, current);
                    break;
                case KILL:
                    current.writeLines(lines, level, tabSize);
                    current = null;
                    break;
                case OPERATOR:
                    if (current.getRole() != PumlNode.Role.START) {
                        // 走到了别的块的 PATH/END，说明调用方的 stop 不匹配，停止
                        current = null;
                        break;
                    }
                    PumlNode end = graph.blockEnd(current.getBlockId());
                    int inner = current.writeLines(lines, level, tabSize);
                    for (PumlNode branch : graph.successors(current)) {
                        if (branch.isOperator(PumlNode.Role.PATH) && branch.getBlockId() == current.getBlockId()) {
                            branch.writeLines(lines, inner, tabSize);
                            writePath(graph, next(graph, branch), end, lines, inner, tabSize);
                        } else {
                            writePath(graph, branch, end, lines, inner, tabSize);
                        }
                    }
                    level = end.writeLines(lines, inner, tabSize);
                    current = next(graph, end);
                    break;
                default:
                    throw new IllegalStateException("未知节点类型: " + current.getKind());
            }
        }
    }

    private static PumlNode next(PumlGraph graph, PumlNode node) {
        List<PumlNode> successors = graph.successors(node);
        return successors.isEmpty() ? null : successors.get(0);
    }
}

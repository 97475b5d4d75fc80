package com.telemetry.pumlflow.constants;

/**
 * 图生成相关常量定义
 */
public final class PumlFlowConstants {

    private PumlFlowConstants() {
        // 工具类，防止实例化
    }

    /**
     * 合成事件类型（不会渲染为事件节点）
     */
    public static final class DummyEvent {
        private DummyEvent() {}

        /** 每条序列的合成起点 */
        public static final String START = "|||START|||";

        /** 循环子图的合成起点 */
        public static final String LOOP_START = "|||LOOP_START|||";

        /** 循环子图的合成终点 */
        public static final String LOOP_END = "|||LOOP_END|||";

        /** 循环子图中 break 标记的前缀，后接发起 break 的事件类型 */
        public static final String BREAK_PREFIX = "|||BREAK|||";

        /** 多根节点时补充的合成根 */
        public static final String ROOT = "|||ROOT|||";

        public static boolean isDummy(String eventType) {
            return eventType != null && eventType.startsWith("|||");
        }
    }

    /**
     * 循环事件命名
     */
    public static final class Loop {
        private Loop() {}

        /** 循环事件类型前缀：LOOP_1, LOOP_2 ... */
        public static final String EVENT_PREFIX = "LOOP_";
    }

    /**
     * PlantUML 输出
     */
    public static final class Puml {
        private Puml() {}

        public static final String START_UML = "@startuml";
        public static final String END_UML = "@enduml";
        public static final String DETACH = "detach";
        public static final String BREAK = "break";
        public static final String REPEAT = "repeat";
        public static final String REPEAT_WHILE = "repeat while";

        /** 分支计数变量名前缀：BC1, BC2 ... */
        public static final String BRANCH_COUNT_PREFIX = "BC";

        /** 输出文件扩展名 */
        public static final String FILE_EXTENSION = ".puml";
    }

    /**
     * 日志标签
     */
    public static final class LogTag {
        private LogTag() {}

        public static final String INGEST = "【事件接入】";
        public static final String MARKOV = "【马尔可夫图】";
        public static final String LOGIC = "【逻辑推断】";
        public static final String LOOP = "【循环检测】";
        public static final String NODE_GRAPH = "【节点图构建】";
        public static final String WALK = "【图遍历】";
        public static final String PIPELINE = "【图生成】";
    }
}

package com.telemetry.pumlflow.event;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.model.PvEvent;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.telemetry.pumlflow.PumlFlowTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * EventModelBuilder 单元测试
 *
 * 验证目标：
 * 1. 出向/入向事件集合按一次因果步骤聚合
 * 2. 合成起点指向每条序列的根事件
 * 3. 前驱不在序列内时跳过该链接
 */
public class EventModelBuilderTest {

    private static final Logger log = LoggerFactory.getLogger(EventModelBuilderTest.class);

    private static final String START = PumlFlowConstants.DummyEvent.START;

    @Test
    void testBuild_ForkAndJoinSets() {
        log.info("=== 测试: A 同时触发 B、C，D 同时依赖 B、C ===");

        EventModel model = model(andSequence("j1"));

        assertEquals(5, model.size(), "A, B, C, D 加合成起点");
        assertEquals(Collections.singleton(EventSet.of("B", "C")), model.getEvent("A").getOutgoing());
        assertEquals(Collections.singleton(EventSet.of(START)), model.getEvent("A").getIncoming());
        assertEquals(Collections.singleton(EventSet.of("B", "C")), model.getEvent("D").getIncoming());
        assertTrue(model.getEvent("D").getOutgoing().isEmpty());
        assertEquals(Collections.singleton(EventSet.of("A")), model.getEvent(START).getOutgoing());
        log.info("✅ 测试通过");
    }

    @Test
    void testBuild_DistinctSequencesGiveDistinctSets() {
        List<PvEvent> viaB = sequence(event("j1", "1", "A"), event("j1", "2", "B", "1"));
        List<PvEvent> viaC = sequence(event("j2", "1", "A"), event("j2", "2", "C", "1"));

        EventModel model = model(viaB, viaC);

        assertEquals(2, model.getEvent("A").getOutgoing().size());
        assertTrue(model.getEvent("A").getOutgoing().contains(EventSet.of("B")));
        assertTrue(model.getEvent("A").getOutgoing().contains(EventSet.of("C")));
    }

    @Test
    void testBuild_RepeatedChildrenCounted() {
        List<PvEvent> fanOut = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "B", "1"),
                event("j1", "4", "B", "1"),
                event("j1", "5", "C", "2", "3", "4"));

        EventModel model = model(fanOut);

        assertEquals(Collections.singleton(EventSet.of("B", "B", "B")), model.getEvent("A").getOutgoing());
        assertEquals(3, model.getEvent("C").getIncoming().iterator().next().getCount("B"));
    }

    @Test
    void testBuild_MissingPreviousEventSkipped() {
        log.info("=== 测试: 前驱不在序列内 ===");
        List<PvEvent> broken = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "not-there"));

        EventModel model = model(broken);

        // B 失去唯一的前驱，成为根
        assertEquals(Collections.singleton(EventSet.of("A", "B")), model.getEvent(START).getOutgoing());
        assertEquals(Collections.singleton(EventSet.of(START)), model.getEvent("B").getIncoming());
        assertTrue(model.getEvent("A").getOutgoing().isEmpty());
    }

    @Test
    void testBuild_WithoutDummyStart() {
        EventModel model = new EventModelBuilder(false).build(JOB, Arrays.asList(andSequence("j1")));

        assertNull(model.getEvent(START));
        assertTrue(model.getEvent("A").getIncoming().isEmpty());
        assertEquals(4, model.size());
    }
}

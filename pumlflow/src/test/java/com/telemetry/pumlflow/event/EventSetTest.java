package com.telemetry.pumlflow.event;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventSet 单元测试
 */
public class EventSetTest {

    private static final Logger log = LoggerFactory.getLogger(EventSetTest.class);

    @Test
    void testOf_RepeatedTypesAccumulate() {
        EventSet eventSet = EventSet.of("C", "B", "B");
        log.info("事件集合: {}", eventSet);

        assertEquals(2, eventSet.getCount("B"));
        assertEquals(1, eventSet.getCount("C"));
        assertEquals(0, eventSet.getCount("X"));
        assertEquals("{B:2, C:1}", eventSet.toString());
    }

    @Test
    void testEquality_ByContent() {
        Map<String, Integer> counts = new HashMap<>();
        counts.put("B", 1);
        counts.put("C", 1);

        assertEquals(EventSet.of("B", "C"), EventSet.of("C", "B"));
        assertEquals(EventSet.of("B", "C"), EventSet.ofCounts(counts));
        assertEquals(EventSet.of("B", "C").hashCode(), EventSet.ofTypes(Arrays.asList("C", "B")).hashCode());
        assertNotEquals(EventSet.of("B", "C"), EventSet.of("B", "B", "C"));
    }

    @Test
    void testInvalidSets_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> EventSet.of());
        assertThrows(IllegalArgumentException.class,
                () -> EventSet.ofCounts(Collections.singletonMap("B", 0)));
    }

    @Test
    void testProject_KeepsOnlyGivenTypes() {
        EventSet eventSet = EventSet.of("B", "C", "D");

        assertEquals(EventSet.of("B", "D"), eventSet.project(new HashSet<>(Arrays.asList("B", "D", "X"))));
        assertNull(eventSet.project(Collections.singleton("X")), "投影为空时返回 null");
    }

    @Test
    void testReplace_SingleTypeKeepsCount() {
        EventSet eventSet = EventSet.of("B", "B", "B", "D");

        EventSet replaced = eventSet.replace(Collections.singleton("B"), "LOOP_1");
        log.info("替换结果: {}", replaced);

        assertEquals(3, replaced.getCount("LOOP_1"));
        assertEquals(1, replaced.getCount("D"));
        assertFalse(replaced.contains("B"));
    }

    @Test
    void testReplace_SeveralTypesCollapseToOne() {
        EventSet eventSet = EventSet.of("B", "C", "D");

        EventSet replaced = eventSet.replace(new HashSet<>(Arrays.asList("B", "C")), "LOOP_1");

        assertEquals(EventSet.of("D", "LOOP_1"), replaced);
        assertSame(eventSet, eventSet.replace(Collections.singleton("X"), "LOOP_1"), "未命中时返回原集合");
    }

    @Test
    void testRename_CollidingTargetsCollapse() {
        Map<String, String> renames = new HashMap<>();
        renames.put("E", "|||LOOP_END|||");
        renames.put("F", "|||LOOP_END|||");

        EventSet renamed = EventSet.of("C", "E", "F").rename(renames);

        assertEquals(EventSet.of("C", "|||LOOP_END|||"), renamed);
    }
}

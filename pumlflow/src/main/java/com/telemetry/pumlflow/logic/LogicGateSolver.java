package com.telemetry.pumlflow.logic;

import com.telemetry.pumlflow.event.EventSet;
import com.telemetry.pumlflow.exception.AmbiguousLogicException;

import java.util.Collection;

/**
 * 逻辑门推断接口
 *
 * 由一个事件的全部出向（或入向）事件集合推断逻辑门树。
 * 返回的树必须接受每一个输入事件集合。
 */
public interface LogicGateSolver {

    /**
     * @param eventSets 非空的事件集合
     * @return 逻辑门树，叶子为事件类型
     * @throws AmbiguousLogicException 没有分组能复现全部事件集合
     */
    GateTree inferGroups(Collection<EventSet> eventSets);
}

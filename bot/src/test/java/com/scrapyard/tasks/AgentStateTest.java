package com.scrapyard.tasks;

import com.scrapyard.navigation.GridCoordinate;
import com.scrapyard.navigation.WorldPosition;
import com.scrapyard.targets.TargetRef;
import org.junit.Test;

import static org.junit.Assert.*;

public class AgentStateTest {

    @Test
    public void testOnlyIdleHasNoTask() {
        for (AgentState state : AgentState.values()) {
            assertEquals(state != AgentState.IDLE, state.requiresTaskTarget());
        }
    }

    @Test
    public void testTravellingStates() {
        assertTrue(AgentState.MOVING_TO_TARGET.isTravelling());
        assertTrue(AgentState.RETURNING_TO_BASE.isTravelling());
        assertFalse(AgentState.PERFORMING_ACTION.isTravelling());
        assertFalse(AgentState.IDLE.isTravelling());
    }

    @Test
    public void testTransitions() {
        assertTrue(AgentState.IDLE.canTransitionTo(AgentState.MOVING_TO_TARGET));
        assertTrue(AgentState.MOVING_TO_TARGET.canTransitionTo(AgentState.PERFORMING_ACTION));
        assertTrue(AgentState.PERFORMING_ACTION.canTransitionTo(AgentState.RETURNING_TO_BASE));
        assertTrue(AgentState.RETURNING_TO_BASE.canTransitionTo(AgentState.UNLOADING));
        assertTrue(AgentState.UNLOADING.canTransitionTo(AgentState.IDLE));

        assertFalse(AgentState.IDLE.canTransitionTo(AgentState.UNLOADING));
        assertFalse(AgentState.MOVING_TO_TARGET.canTransitionTo(AgentState.UNLOADING));
        assertFalse(AgentState.UNLOADING.canTransitionTo(AgentState.MOVING_TO_TARGET));
    }

    @Test
    public void testTaskTargetVariants() {
        TaskTarget target = TaskTarget.target(new TargetRef("scrap", WorldPosition.of(1, 2)));
        assertTrue(target.isTarget());
        assertEquals("scrap", target.requireTarget().getId());
        assertNull(target.getBase());

        TaskTarget base = TaskTarget.base(GridCoordinate.of(0, 0));
        assertTrue(base.isBase());
        assertEquals(GridCoordinate.of(0, 0), base.requireBase());
    }

    @Test(expected = IllegalStateException.class)
    public void testWrongPayloadAccess() {
        TaskTarget.base(GridCoordinate.of(0, 0)).requireTarget();
    }
}

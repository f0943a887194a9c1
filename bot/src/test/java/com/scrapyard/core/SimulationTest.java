package com.scrapyard.core;

import com.scrapyard.config.NavigatorConfig;
import com.scrapyard.navigation.ArrayTileGrid;
import com.scrapyard.navigation.GridCoordinate;
import com.scrapyard.navigation.GridPath;
import com.scrapyard.navigation.PathFinder;
import com.scrapyard.navigation.WorldPosition;
import com.scrapyard.state.Agent;
import com.scrapyard.targets.CollectAction;
import com.scrapyard.targets.Collectible;
import com.scrapyard.targets.InMemoryTargetRegistry;
import com.scrapyard.targets.InventorySink;
import com.scrapyard.targets.MaterialStockpile;
import com.scrapyard.tasks.AgentControllerFactory;
import com.scrapyard.tasks.AgentState;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

/**
 * End-to-end runs of the host loop over real grids, registries and actions.
 */
public class SimulationTest {

    private static final double DT = 0.1;

    @Mock
    private InventorySink sink;

    private ArrayTileGrid grid;
    private InMemoryTargetRegistry registry;
    private NavigatorConfig config;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        grid = new ArrayTileGrid(10, 10);
        registry = new InMemoryTargetRegistry();
        config = NavigatorConfig.defaults();
    }

    private Simulation newSimulation(InventorySink inventorySink) {
        AgentControllerFactory factory = new AgentControllerFactory(
                new PathFinder(config), new CollectAction(registry), inventorySink, config);
        return new Simulation(grid, registry, factory);
    }

    // ========================================================================
    // Full collection cycle
    // ========================================================================

    @Test
    @SuppressWarnings("unchecked")
    public void testCollectAndUnloadOnOpenGrid() {
        config = NavigatorConfig.builder().smoothPaths(false).build();
        Simulation simulation = newSimulation(sink);
        simulation.setBase(GridCoordinate.of(0, 0));
        registry.register(new Collectible("scrap-1", "steel", WorldPosition.of(304, 304), 100));
        Agent agent = simulation.spawnAgent(WorldPosition.of(16, 16));

        simulation.tick(DT);

        assertEquals(AgentState.MOVING_TO_TARGET, agent.getState());
        GridPath route = agent.getPath();
        assertEquals(GridCoordinate.of(0, 0), route.getStart());
        assertEquals(GridCoordinate.of(9, 9), route.getGoal());
        assertEquals(9 * Math.sqrt(2), route.weightedLength(), 1e-9);

        List<AgentState> visited = new ArrayList<>();
        visited.add(agent.getState());
        for (int i = 0; i < 300; i++) {
            simulation.tick(DT);
            if (agent.getState() != visited.get(visited.size() - 1)) {
                visited.add(agent.getState());
            }
        }

        assertEquals(Arrays.asList(
                AgentState.MOVING_TO_TARGET,
                AgentState.PERFORMING_ACTION,
                AgentState.RETURNING_TO_BASE,
                AgentState.UNLOADING,
                AgentState.IDLE), visited);

        ArgumentCaptor<Map<String, Double>> captor = ArgumentCaptor.forClass(Map.class);
        verify(sink, times(1)).deposit(captor.capture());
        assertEquals(100.0, captor.getValue().get("steel"), 1e-9);

        assertTrue(agent.getInventory().isEmpty());
        assertTrue(registry.get("scrap-1").isDepleted());
        assertTrue("Agent ends up at base",
                agent.getPosition().distanceTo(grid.gridToWorldCenter(GridCoordinate.of(0, 0))) <= config.getBaseArrivalRadius());
    }

    @Test
    public void testAgentOutOfPowerStillFinishesTheRun() {
        config = NavigatorConfig.builder().powerCapacity(2).lowPowerThreshold(1).build();
        MaterialStockpile stockpile = new MaterialStockpile();
        Simulation simulation = newSimulation(stockpile);
        simulation.setBase(GridCoordinate.of(0, 0));
        registry.register(new Collectible("scrap-1", "steel", WorldPosition.of(304, 304), 100));
        Agent agent = simulation.spawnAgent(WorldPosition.of(16, 16));

        simulation.run(1000, DT);

        assertEquals(1, stockpile.getDepositCount());
        assertEquals(100.0, stockpile.getAmount("steel"), 1e-9);
        assertEquals(AgentState.IDLE, agent.getState());
        assertEquals(2.0, agent.getPower(), 0.0);
    }

    @Test
    public void testUnreachableCollectibleNeverLeavesIdle() {
        grid = ArrayTileGrid.fromRows(32,
                "..........",
                "..........",
                "......###.",
                "......#.#.",
                "......###.",
                "..........");
        Simulation simulation = newSimulation(sink);
        registry.register(new Collectible("walled", "steel", WorldPosition.of(7 * 32 + 16, 3 * 32 + 16), 10));
        Agent agent = simulation.spawnAgent(WorldPosition.of(16, 16));

        for (int i = 0; i < 20; i++) {
            simulation.tick(DT);
            assertEquals(AgentState.IDLE, agent.getState());
        }
        assertEquals(WorldPosition.of(16, 16), agent.getPosition());
        verify(sink, never()).deposit(anyMap());
    }

    @Test
    public void testTwoAgentsShareTheWork() {
        MaterialStockpile stockpile = new MaterialStockpile();
        Simulation simulation = newSimulation(stockpile);
        simulation.setBase(GridCoordinate.of(0, 0));
        registry.register(new Collectible("a", "steel", WorldPosition.of(304, 16), 100));
        registry.register(new Collectible("b", "copper", WorldPosition.of(16, 304), 100));
        simulation.spawnAgent(WorldPosition.of(16, 16));
        simulation.spawnAgent(WorldPosition.of(16, 16));

        simulation.run(300, DT);

        assertEquals(200.0, stockpile.getTotal(), 1e-9);
        assertEquals(2, stockpile.getDepositCount());
        assertEquals(2, simulation.countByState(AgentState.IDLE));
    }

    // ========================================================================
    // Agent management
    // ========================================================================

    @Test
    public void testSpawnOrderAndIds() {
        Simulation simulation = newSimulation(sink);
        Agent first = simulation.spawnAgent(WorldPosition.of(16, 16));
        Agent second = simulation.spawnAgent(WorldPosition.of(48, 16));

        List<Agent> agents = simulation.getAgents();
        assertEquals(2, agents.size());
        assertSame(first, agents.get(0));
        assertSame(second, agents.get(1));
        assertNotEquals(first.getId(), second.getId());
        assertEquals(config.getAgentSpeed(), first.getSpeed(), 0.0);
        assertEquals(config.getAgentCapacity(), first.getInventory().getCapacity(), 0.0);
    }

    @Test
    public void testBaseAppliesToCurrentAndFutureAgents() {
        Simulation simulation = newSimulation(sink);
        Agent before = simulation.spawnAgent(WorldPosition.of(16, 16));
        simulation.setBase(GridCoordinate.of(2, 2));
        Agent after = simulation.spawnAgent(WorldPosition.of(16, 16));

        assertEquals(GridCoordinate.of(2, 2), before.getBase());
        assertEquals(GridCoordinate.of(2, 2), after.getBase());
    }

    @Test
    public void testRemoveAgent() {
        Simulation simulation = newSimulation(sink);
        Agent agent = simulation.spawnAgent(WorldPosition.of(16, 16));

        assertTrue(simulation.removeAgent(agent.getId()));
        assertFalse(simulation.removeAgent(agent.getId()));
        assertNull(simulation.getAgent(agent.getId()));
        assertTrue(simulation.getAgents().isEmpty());

        simulation.tick(DT);
        assertEquals(1, simulation.getTickCount());
    }
}

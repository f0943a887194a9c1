package com.scrapyard.core;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.scrapyard.config.NavigatorConfig;
import com.scrapyard.config.NavigatorConfigLoader;
import com.scrapyard.navigation.TileGrid;
import com.scrapyard.targets.ActionHandler;
import com.scrapyard.targets.InventorySink;
import com.scrapyard.targets.TargetRegistry;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;

/**
 * Guice module for the navigator.
 *
 * <p>The host world supplies the grid, the target registry, the action handler and the sink.
 * {@code PathFinder}, {@code AgentControllerFactory} and {@code Simulation} are built by Guice
 * from their injectable constructors.
 */
@Slf4j
public class ScrapyardModule extends AbstractModule {

    private final TileGrid grid;
    private final TargetRegistry registry;
    private final ActionHandler actionHandler;
    private final InventorySink inventorySink;

    @Nullable
    private final NavigatorConfig config;

    public ScrapyardModule(TileGrid grid, TargetRegistry registry,
                           ActionHandler actionHandler, InventorySink inventorySink) {
        this(grid, registry, actionHandler, inventorySink, null);
    }

    /**
     * @param config explicit configuration, or null to load {@code /config/navigator.json}
     */
    public ScrapyardModule(TileGrid grid, TargetRegistry registry,
                           ActionHandler actionHandler, InventorySink inventorySink,
                           @Nullable NavigatorConfig config) {
        this.grid = grid;
        this.registry = registry;
        this.actionHandler = actionHandler;
        this.inventorySink = inventorySink;
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(TileGrid.class).toInstance(grid);
        bind(TargetRegistry.class).toInstance(registry);
        bind(ActionHandler.class).toInstance(actionHandler);
        bind(InventorySink.class).toInstance(inventorySink);
        bind(Simulation.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public NavigatorConfig provideNavigatorConfig() {
        if (config != null) {
            return config;
        }
        try {
            return NavigatorConfigLoader.loadDefault();
        } catch (IOException e) {
            log.warn("Could not load navigator config, using defaults: {}", e.getMessage());
            return NavigatorConfig.defaults();
        }
    }
}

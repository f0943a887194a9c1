package com.scrapyard.targets;

import com.scrapyard.navigation.WorldPosition;
import lombok.Value;

/**
 * Handle to something an agent can seek, identified by a stable id.
 *
 * <p>The position is the one reported when the handle was issued. Registries whose
 * targets move report the current position through {@link TargetRegistry#locate}.
 */
@Value
public class TargetRef {

    String id;
    WorldPosition position;
}

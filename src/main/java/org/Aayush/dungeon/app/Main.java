package org.Aayush.dungeon.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dungeon.core.DungeonAssembler;
import org.Aayush.dungeon.core.DungeonConfig;
import org.Aayush.dungeon.core.DungeonLayout;
import org.Aayush.dungeon.core.GenerationWarning;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Pass {@code volumetric} as the first argument for a multi-level dungeon; every
 * {@code dungeon.*} system property overrides the preset.</p>
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        boolean volumetric = args.length > 0 && "volumetric".equalsIgnoreCase(args[0]);
        DungeonConfig preset = volumetric ? DungeonConfig.volumetric() : DungeonConfig.planar();
        DungeonConfig config = preset.toBuilder().seed(System.currentTimeMillis()).build().withSystemOverrides();

        DungeonLayout layout = new DungeonAssembler(config).generate();
        for (GenerationWarning warning : layout.getDiagnostics().getWarnings()) {
            log.warn("{}: {}", warning.kind(), warning.message());
        }
        log.info("generated in {} ms, {} settled nodes",
                layout.getDiagnostics().getElapsedNanos() / 1_000_000L,
                layout.getDiagnostics().getSettledNodes());
        log.info("\n{}", LayoutPrinter.renderAll(layout));
    }
}

package surfacetexture.compute.service;

import org.springframework.stereotype.Component;
import surfacetexture.config.SurfaceConfig;
import surfacetexture.physics.simulator.SurfaceDecomposer;

@Component
public class SurfaceDecomposerFactory {

    public SurfaceDecomposer createDecomposer(SurfaceConfig config) {
        return new SurfaceDecomposer(config);
    }
}

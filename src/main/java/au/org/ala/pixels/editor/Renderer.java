package au.org.ala.pixels.editor;

import au.org.ala.pixels.filter.FilterPipeline;
import au.org.ala.pixels.filter.FilterState;
import au.org.ala.pixels.filter.SharpenKernel;
import au.org.ala.pixels.raster.PixelBuffer;
import au.org.ala.pixels.transform.TransformEngine;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the composite the user sees from the committed source and the current filter state:
 * geometry (flips and rotation) first, then the colour pipeline, then sharpening.
 */
public class Renderer {

    private static final Logger log = LoggerFactory.getLogger(Renderer.class);

    private final TransformEngine transforms;
    private final FilterPipeline pipeline;

    public Renderer(TransformEngine transforms, FilterPipeline pipeline) {
        this.transforms = transforms;
        this.pipeline = pipeline;
    }

    public PixelBuffer render(PixelBuffer source, FilterState state) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        PixelBuffer out = source;
        if (state.hasGeometry()) {
            out = transforms.orient(out, state.isFlipHorizontal(), state.isFlipVertical(), state.getRotate());
        }
        out = pipeline.apply(out, state);
        if (state.getSharpen() > 0) {
            out = SharpenKernel.apply(out, state.getSharpen());
        }
        log.debug("Rendered {}x{} in {}", out.getWidth(), out.getHeight(), stopwatch);
        return out;
    }
}

package au.org.ala.pixels.editor;

import au.org.ala.pixels.NoImageLoadedException;
import au.org.ala.pixels.codec.ExportFileNames;
import au.org.ala.pixels.codec.ImageCodec;
import au.org.ala.pixels.crop.CropController;
import au.org.ala.pixels.crop.CropHandle;
import au.org.ala.pixels.crop.CropRect;
import au.org.ala.pixels.crop.CropState;
import au.org.ala.pixels.filter.FilterParameter;
import au.org.ala.pixels.filter.FilterPipeline;
import au.org.ala.pixels.filter.FilterState;
import au.org.ala.pixels.filter.Preset;
import au.org.ala.pixels.history.HistorySnapshot;
import au.org.ala.pixels.history.HistoryStack;
import au.org.ala.pixels.raster.PixelBuffer;
import au.org.ala.pixels.transform.TransformEngine;
import au.org.ala.pixels.util.ByteSinkFactory;
import au.org.ala.pixels.util.DefaultImageReaderSelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.util.Optional;

/**
 * One editing session. Holds the committed source image, the current filter state, the crop tool,
 * the undo history and the rendered composite.
 * <p>
 * Every committed edit pushes exactly one history entry; previews never do. Resize and crop work on
 * the rendered composite and make it the new source, after which the filters return to their
 * defaults. A command that fails leaves the session as it was.
 * <p>
 * Not thread safe. Drive it from a single thread.
 */
public class EditorContext {

    private static final Logger log = LoggerFactory.getLogger(EditorContext.class);

    private final EditorConfig config;
    private final TransformEngine transforms;
    private final Renderer renderer;
    private final CropController crop;
    private final HistoryStack<HistorySnapshot> history;
    private final ImageCodec codec;
    private final Clock clock;

    private PixelBuffer source;
    private FilterState filters = FilterState.defaults();
    private PixelBuffer rendered;

    public EditorContext() {
        this(new EditorConfig());
    }

    public EditorContext(EditorConfig config) {
        this(config, Clock.systemUTC());
    }

    public EditorContext(EditorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.transforms = new TransformEngine(config.getMinCropSize());
        this.renderer = new Renderer(transforms, new FilterPipeline(config.getBlurSigmaScale()));
        this.crop = new CropController(config.getMinCropSize(), config.getCropInset());
        this.history = new HistoryStack<>(config.getHistoryLimit());
        this.codec = new ImageCodec(DefaultImageReaderSelectionStrategy.INSTANCE, config.getFlattenBackground());
    }

    /**
     * Start a new session on {@code image}. Filters, crop and history are all reset.
     */
    public PixelBuffer load(PixelBuffer image) {
        source = image.copy();
        filters = FilterState.defaults();
        crop.cancel();
        history.clear();
        rendered = renderer.render(source, filters);
        history.push(new HistorySnapshot("load", source, filters));
        log.info("Loaded {}x{} image", source.getWidth(), source.getHeight());
        return getRendered();
    }

    public boolean isLoaded() {
        return source != null;
    }

    /**
     * @return a copy of the rendered composite
     */
    public PixelBuffer getRendered() {
        requireLoaded("render");
        return rendered.copy();
    }

    public FilterState getFilters() {
        return filters;
    }

    public int getWidth() {
        requireLoaded("measure");
        return rendered.getWidth();
    }

    public int getHeight() {
        requireLoaded("measure");
        return rendered.getHeight();
    }

    // filters

    /**
     * Live preview of one control while it is being moved. Does not touch the history.
     *
     * @throws IllegalArgumentException if the value is outside the control's range
     */
    public PixelBuffer previewFilter(FilterParameter parameter, double value) {
        requireLoaded("preview " + parameter.getKey());
        return previewFilters(filters.with(parameter, value));
    }

    public PixelBuffer previewFilters(FilterState state) {
        requireLoaded("preview filters");
        rendered = renderer.render(source, state);
        filters = state;
        return getRendered();
    }

    /**
     * Record the current filter state, as when a slider is released.
     */
    public void commitFilters() {
        requireLoaded("commit filters");
        commit("filters");
    }

    public PixelBuffer flipHorizontal() {
        requireLoaded("flip");
        previewFilters(filters.toggleFlipHorizontal());
        commit("flip horizontal");
        return getRendered();
    }

    public PixelBuffer flipVertical() {
        requireLoaded("flip");
        previewFilters(filters.toggleFlipVertical());
        commit("flip vertical");
        return getRendered();
    }

    public PixelBuffer applyPreset(Preset preset) {
        requireLoaded("apply preset");
        previewFilters(preset.applyTo(filters));
        commit("preset " + preset.canonical());
        return getRendered();
    }

    /**
     * Back to default filters with no flips, leaving crop mode. Does nothing before an image is loaded.
     */
    public void resetFilters() {
        crop.cancel();
        filters = FilterState.defaults();
        if (!isLoaded()) {
            return;
        }
        rendered = renderer.render(source, filters);
        commit("reset");
    }

    // geometry

    /**
     * Resize the composite. A null dimension is derived from the other one, keeping the aspect ratio.
     *
     * @throws au.org.ala.pixels.InvalidDimensionsException if neither dimension is given or either is not positive
     */
    public PixelBuffer applyResize(Integer width, Integer height) {
        requireLoaded("resize");
        Dimension size;
        PixelBuffer resized;
        try {
            size = TransformEngine.deriveSize(rendered.getWidth(), rendered.getHeight(), width, height);
            resized = transforms.resize(rendered, size.width, size.height);
        } catch (RuntimeException e) {
            log.warn("Resize to {}x{} rejected: {}", width, height, e.getMessage());
            throw e;
        }
        crop.cancel();
        bake(resized, "resize " + size.width + "x" + size.height);
        return getRendered();
    }

    public CropState startCrop() {
        requireLoaded("crop");
        try {
            return crop.start(rendered.getWidth(), rendered.getHeight());
        } catch (RuntimeException e) {
            log.warn("Crop not started: {}", e.getMessage());
            throw e;
        }
    }

    public CropState cropPointerDown(double x, double y, CropHandle handle) {
        return crop.pointerDown(x, y, handle);
    }

    public CropState cropPointerDown(double x, double y) {
        return crop.pointerDown(x, y);
    }

    public CropState cropPointerMove(double x, double y) {
        return crop.pointerMove(x, y);
    }

    public CropState cropPointerUp() {
        return crop.pointerUp();
    }

    public CropHandle cropHandleAt(double x, double y, double tolerance) {
        return crop.handleAt(x, y, tolerance);
    }

    public CropState getCropState() {
        return crop.state();
    }

    public CropState cancelCrop() {
        return crop.cancel();
    }

    /**
     * Crop the composite to the current crop rectangle and leave crop mode.
     *
     * @throws IllegalStateException if crop mode is not active
     */
    public PixelBuffer applyCrop() {
        requireLoaded("crop");
        CropState state = crop.state();
        if (!state.isActive()) {
            throw new IllegalStateException("Crop mode is not active");
        }
        PixelBuffer cropped;
        try {
            cropped = transforms.crop(rendered, state.getRect());
        } catch (RuntimeException e) {
            log.warn("Crop to {} rejected: {}", state.getRect(), e.getMessage());
            throw e;
        }
        CropRect rect = crop.commit();
        bake(cropped, "crop " + rect.canonical());
        return getRendered();
    }

    /**
     * Crop straight to {@code rect} without the interactive tool.
     */
    public PixelBuffer applyCrop(CropRect rect) {
        requireLoaded("crop");
        PixelBuffer cropped;
        try {
            cropped = transforms.crop(rendered, rect);
        } catch (RuntimeException e) {
            log.warn("Crop to {} rejected: {}", rect, e.getMessage());
            throw e;
        }
        crop.cancel();
        bake(cropped, "crop " + rect.canonical());
        return getRendered();
    }

    // history

    public boolean undo() {
        return restore(history.undo(), "Undo");
    }

    public boolean redo() {
        return restore(history.redo(), "Redo");
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    HistoryStack<HistorySnapshot> getHistory() {
        return history;
    }

    private boolean restore(Optional<HistorySnapshot> snapshot, String action) {
        if (!snapshot.isPresent()) {
            return false;
        }
        HistorySnapshot s = snapshot.get();
        crop.cancel();
        source = s.getSource();
        filters = s.getFilters();
        rendered = renderer.render(source, filters);
        log.info("{} to '{}' ({}/{})", action, s.getLabel(), history.getCursor() + 1, history.size());
        return true;
    }

    // export

    /**
     * Encode the composite in the configured export format. The stream is not closed.
     */
    public ImageCodec.Result download(OutputStream out) throws IOException {
        requireLoaded("download");
        return codec.encode(rendered, config.getExportFormat(), out);
    }

    /**
     * Encode the composite to a new timestamped file from {@code sinkFactory}.
     *
     * @return the file name written
     */
    public String download(ByteSinkFactory sinkFactory) throws IOException {
        requireLoaded("download");
        String name = ExportFileNames.timestamped(config.getExportFilePrefix(), config.getExportFormat(), clock);
        sinkFactory.prepare();
        try (OutputStream out = sinkFactory.getByteSinkForNames(name).openBufferedStream()) {
            ImageCodec.Result result = codec.encode(rendered, config.getExportFormat(), out);
            log.info("Exported {} ({}x{} {})", name, result.width, result.height, result.mimeType);
        }
        return name;
    }

    private void bake(PixelBuffer newSource, String label) {
        source = newSource;
        filters = FilterState.defaults();
        rendered = renderer.render(source, filters);
        commit(label);
    }

    private void commit(String label) {
        history.push(new HistorySnapshot(label, source, filters));
        log.info("Committed {} ({} history entries)", label, history.size());
    }

    private void requireLoaded(String operation) {
        if (!isLoaded()) {
            throw new NoImageLoadedException(operation);
        }
    }
}

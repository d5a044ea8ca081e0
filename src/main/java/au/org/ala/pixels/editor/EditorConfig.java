package au.org.ala.pixels.editor;

import au.org.ala.pixels.codec.ExportFileNames;
import au.org.ala.pixels.codec.ExportFormat;
import au.org.ala.pixels.crop.CropController;
import au.org.ala.pixels.crop.CropRect;
import au.org.ala.pixels.history.HistoryStack;

import java.awt.*;

public class EditorConfig {

    private int _historyLimit = HistoryStack.DEFAULT_LIMIT;
    private int _minCropSize = CropRect.MIN_SIZE;
    private double _cropInset = CropController.DEFAULT_INSET;
    private double _blurSigmaScale = 1.0;
    private ExportFormat _exportFormat = ExportFormat.PNG;
    private String _exportFilePrefix = ExportFileNames.DEFAULT_PREFIX;
    private Color _flattenBackground = Color.white;

    public EditorConfig() {
    }

    public EditorConfig(int historyLimit, int minCropSize, double cropInset, double blurSigmaScale, ExportFormat exportFormat) {
        _historyLimit = historyLimit;
        _minCropSize = minCropSize;
        _cropInset = cropInset;
        _blurSigmaScale = blurSigmaScale;
        _exportFormat = exportFormat;
    }

    public int getHistoryLimit() { return _historyLimit; }
    public void setHistoryLimit(int historyLimit) { _historyLimit = historyLimit; }

    public int getMinCropSize() { return _minCropSize; }
    public void setMinCropSize(int minCropSize) { _minCropSize = minCropSize; }

    /**
     * Fraction of the canvas left between each edge and a freshly started crop rectangle.
     */
    public double getCropInset() { return _cropInset; }
    public void setCropInset(double cropInset) { _cropInset = cropInset; }

    /**
     * Gaussian standard deviation, in pixels, per unit of the blur control.
     */
    public double getBlurSigmaScale() { return _blurSigmaScale; }
    public void setBlurSigmaScale(double blurSigmaScale) { _blurSigmaScale = blurSigmaScale; }

    public ExportFormat getExportFormat() { return _exportFormat; }
    public void setExportFormat(ExportFormat format) { _exportFormat = format; }

    public String getExportFilePrefix() { return _exportFilePrefix; }
    public void setExportFilePrefix(String prefix) { _exportFilePrefix = prefix; }

    public Color getFlattenBackground() { return _flattenBackground; }
    public void setFlattenBackground(Color c) { _flattenBackground = c; }
}

package au.org.ala.pixels.cli;

import au.org.ala.pixels.EditorException;
import au.org.ala.pixels.codec.ImageCodec;
import au.org.ala.pixels.crop.CropRect;
import au.org.ala.pixels.editor.EditorConfig;
import au.org.ala.pixels.editor.EditorContext;
import au.org.ala.pixels.filter.FilterParameter;
import au.org.ala.pixels.filter.Preset;
import au.org.ala.pixels.util.FileByteSinkFactory;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Applies a list of edit commands to an image file and writes the result beside it.
 * <pre>
 * LocalEditor photo.jpg brightness=150 contrast=120 flipH resize=800x crop=10,10,400,300
 * </pre>
 */
public class LocalEditor {

    public static void main(String[] args) {
        if (args.length < 1) {
            usage();
            System.exit(0);
        }

        File f = new File(args[0]);
        if (!f.isFile()) {
            error(String.format("Invalid file name: %s", args[0]));
        }

        try {
            long start = System.currentTimeMillis();
            File written = processFile(f, Arrays.asList(args).subList(1, args.length), new EditorConfig());
            long end = System.currentTimeMillis();
            System.out.printf("Wrote %s in %s%n", written, Duration.ofMillis(end - start));
        } catch (IllegalArgumentException | IllegalStateException | EditorException ex) {
            error(ex.getMessage());
        } catch (IOException ex) {
            ex.printStackTrace();
            error(String.format("Failed to edit %s: %s", f, ex.getMessage()));
        }
    }

    /**
     * Decode {@code input}, run the commands in order and export next to the input.
     *
     * @return the exported file
     */
    static File processFile(File input, List<String> commands, EditorConfig config) throws IOException {
        EditorContext editor = new EditorContext(config);
        editor.load(new ImageCodec().decode(input));
        for (String command : commands) {
            applyCommand(editor, command);
        }
        File dest = input.getAbsoluteFile().getParentFile();
        String name = editor.download(new FileByteSinkFactory(dest));
        return new File(dest, name);
    }

    /**
     * Run one command against the editor. Filter commands commit immediately.
     *
     * @throws IllegalArgumentException if the command is not recognised or its argument is malformed
     */
    static void applyCommand(EditorContext editor, String command) {
        String trimmed = StringUtils.trimToEmpty(command);
        String name = StringUtils.substringBefore(trimmed, "=");
        String arg = trimmed.contains("=") ? StringUtils.substringAfter(trimmed, "=") : null;

        switch (name) {
            case "flipH":
                requireNoArgument(name, arg);
                editor.flipHorizontal();
                return;
            case "flipV":
                requireNoArgument(name, arg);
                editor.flipVertical();
                return;
            case "undo":
                requireNoArgument(name, arg);
                editor.undo();
                return;
            case "redo":
                requireNoArgument(name, arg);
                editor.redo();
                return;
            case "reset":
                requireNoArgument(name, arg);
                editor.resetFilters();
                return;
            case "preset":
                editor.applyPreset(Preset.parse(requireArgument(name, arg)));
                return;
            case "resize":
                applyResize(editor, requireArgument(name, arg));
                return;
            case "crop":
                editor.applyCrop(CropRect.parse(requireArgument(name, arg)));
                return;
            default:
                FilterParameter parameter = FilterParameter.parse(name);
                editor.previewFilter(parameter, parseNumber(name, requireArgument(name, arg)));
                editor.commitFilters();
        }
    }

    // "800x600", "800x" or "x600"
    private static void applyResize(EditorContext editor, String arg) {
        if (StringUtils.countMatches(arg, 'x') != 1) {
            throw new IllegalArgumentException("Resize expects WxH, got: " + arg);
        }
        String w = StringUtils.substringBefore(arg, "x").trim();
        String h = StringUtils.substringAfter(arg, "x").trim();
        Integer width = w.isEmpty() ? null : parseInteger("resize width", w);
        Integer height = h.isEmpty() ? null : parseInteger("resize height", h);
        editor.applyResize(width, height);
    }

    private static double parseNumber(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
        }
    }

    private static int parseInteger(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid whole number for " + name + ": " + value, e);
        }
    }

    private static String requireArgument(String name, String arg) {
        if (StringUtils.isBlank(arg)) {
            throw new IllegalArgumentException("Command " + name + " needs a value");
        }
        return arg;
    }

    private static void requireNoArgument(String name, String arg) {
        if (arg != null) {
            throw new IllegalArgumentException("Command " + name + " takes no value");
        }
    }

    private static void usage() {
        System.out.println("LocalEditor <filename> [brightness=N|contrast=N|saturation=N|blur=N|hue=N|rotate=N|opacity=N|sharpen=N"
                + "|flipH|flipV|preset=NAME|resize=WxH|crop=x,y,w,h|undo|redo|reset]...");
    }

    private static void error(String message) {
        System.err.println(message);
        System.exit(-1);
    }
}

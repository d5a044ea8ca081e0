package au.org.ala.pixels.util;

import com.google.common.io.ByteSink;
import com.google.common.io.MoreFiles;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes exports below a directory. {@link #prepare()} only empties the directory when
 * {@code cleanParentDir} is set.
 */
public class FileByteSinkFactory implements ByteSinkFactory {

    private static final Logger log = LoggerFactory.getLogger(FileByteSinkFactory.class);

    final File parentDir;
    final boolean cleanParentDir;

    public FileByteSinkFactory(File parentDir) {
        this(parentDir, false);
    }

    public FileByteSinkFactory(File parentDir, boolean cleanParentDir) {
        this.parentDir = parentDir;
        this.cleanParentDir = cleanParentDir;
    }

    @Override
    public void prepare() throws IOException {
        if (parentDir.exists() && cleanParentDir) {
            FileUtils.cleanDirectory(parentDir);
        }
        FileUtils.forceMkdir(parentDir);
    }

    @Override
    public ByteSink getByteSinkForNames(String... names) {
        Path path = Paths.get(parentDir.getAbsolutePath(), names);
        File parent = path.getParent().toFile();
        if (!parent.exists() && !parent.mkdirs()) {
            log.error("Unable to create directories for {}", path);
        }
        log.debug("Export destination {}", path);
        return MoreFiles.asByteSink(path);
    }

    public File getParentDir() {
        return parentDir;
    }
}

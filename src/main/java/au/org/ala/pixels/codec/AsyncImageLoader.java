package au.org.ala.pixels.codec;

import au.org.ala.pixels.raster.PixelBuffer;
import com.google.common.base.Stopwatch;
import com.google.common.io.ByteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decodes images off the caller's thread. Starting a new load supersedes any load still in flight:
 * the older future is cancelled and its result, if it ever arrives, is dropped. Callers therefore
 * only ever see the most recently requested image.
 */
public class AsyncImageLoader implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(AsyncImageLoader.class);

    private final ImageCodec codec;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final AtomicLong generation = new AtomicLong();

    private CompletableFuture<PixelBuffer> pending;

    public AsyncImageLoader(ImageCodec codec) {
        this(codec, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "image-decoder");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public AsyncImageLoader(ImageCodec codec, Executor executor) {
        this(codec, executor, false);
    }

    private AsyncImageLoader(ImageCodec codec, Executor executor, boolean owned) {
        this.codec = codec;
        this.executor = executor;
        this.ownedExecutor = owned ? (ExecutorService) executor : null;
    }

    /**
     * Start decoding. The future completes with the decoded buffer, completes exceptionally with the
     * decode failure (for example {@link UnsupportedFileTypeException}), or is cancelled when a later
     * call supersedes it.
     */
    public synchronized CompletableFuture<PixelBuffer> load(ByteSource imageBytes, String filename) {
        long ticket = generation.incrementAndGet();
        if (pending != null && !pending.isDone()) {
            log.debug("Load of {} supersedes an unfinished load", filename);
            pending.cancel(false);
        }

        CompletableFuture<PixelBuffer> future = new CompletableFuture<>();
        pending = future;
        executor.execute(() -> {
            if (future.isCancelled()) {
                return;
            }
            Stopwatch stopwatch = Stopwatch.createStarted();
            try {
                PixelBuffer buffer = codec.decode(imageBytes, filename);
                if (generation.get() != ticket) {
                    log.debug("Dropping superseded decode of {}", filename);
                    future.cancel(false);
                } else {
                    log.debug("Decoded {} in {}", filename, stopwatch);
                    future.complete(buffer);
                }
            } catch (Exception e) {
                log.warn("Failed to decode {}: {}", filename, e.getMessage());
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * @return true if {@code future} belongs to the most recent call to {@link #load(ByteSource, String)}
     */
    public synchronized boolean isLatest(CompletableFuture<PixelBuffer> future) {
        return future == pending;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }
}

package fun.fengwk.scraper.core.service.scrape.export;

import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the result set to every sink as {@code <outputBase>.<extension>}.
 *
 * <p>All sinks write to temporary files first; targets are replaced only after every sink succeeded, so an
 * export either produces all files or none.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ResultExporter {

    private final List<ResultSink> sinks;

    @Autowired
    public ResultExporter(JsonResultSink jsonResultSink, CsvResultSink csvResultSink) {
        this(List.of(jsonResultSink, csvResultSink));
    }

    public ResultExporter(List<ResultSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    /**
     * @return written files in sink order
     */
    public List<Path> export(ScrapeResult result, Path outputBase) {
        Path base = outputBase.toAbsolutePath().normalize();
        Path dir = base.getParent();
        Map<Path, Path> pending = new LinkedHashMap<>();
        List<Path> written = new ArrayList<>(sinks.size());
        try {
            Files.createDirectories(dir);
            for (ResultSink sink : sinks) {
                Path target = withExtension(base, sink.extension());
                Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
                pending.put(temp, target);
                sink.write(result, temp);
            }
            for (Map.Entry<Path, Path> entry : pending.entrySet()) {
                move(entry.getKey(), entry.getValue());
                written.add(entry.getValue());
                log.info("saved output, path={}, records={}", entry.getValue(), result.size());
            }
            return written;
        } catch (IOException ex) {
            deleteQuietly(pending.keySet());
            deleteQuietly(written);
            throw new ExportException("export failed, outputBase=" + outputBase + ", error=" + ex.getMessage(), ex);
        }
    }

    /**
     * Replace the file name suffix, {@code out/data} and {@code out/data.txt} both become {@code out/data.json}.
     */
    static Path withExtension(Path base, String extension) {
        String fileName = base.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return base.resolveSibling(stem + "." + extension);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Iterable<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException ex) {
                log.warn("cleanup failed, path={}, error={}", path, ex.getMessage());
            }
        }
    }

}

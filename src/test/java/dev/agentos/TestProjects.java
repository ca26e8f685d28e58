package dev.agentos;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Copies the sample project under {@code src/test/resources/project} into a scratch directory.
 */
public final class TestProjects {

    private TestProjects() {}

    public static Path copySample(Path target) throws IOException {
        Path source = sampleRoot();
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(source)) {
            paths = walk.sorted().toList();
        }
        for (Path path : paths) {
            Path destination = target.resolve(source.relativize(path).toString());
            if (Files.isDirectory(path)) {
                Files.createDirectories(destination);
            } else {
                Files.copy(path, destination);
            }
        }
        return target;
    }

    private static Path sampleRoot() {
        URL url = TestProjects.class.getResource("/project");
        if (url == null) {
            throw new UncheckedIOException(new IOException("Sample project missing from test resources"));
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}

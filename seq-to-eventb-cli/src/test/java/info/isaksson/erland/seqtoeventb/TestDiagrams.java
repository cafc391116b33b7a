package info.isaksson.erland.seqtoeventb;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Copies bundled diagram fixtures to the filesystem so Main can read them by path. */
final class TestDiagrams {

    private TestDiagrams() {}

    static Path copyTo(Path dir, String name) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = TestDiagrams.class.getResourceAsStream("/diagrams/" + name)) {
            if (in == null) throw new IOException("missing test fixture: " + name);
            Files.copy(in, target);
        }
        return target;
    }
}

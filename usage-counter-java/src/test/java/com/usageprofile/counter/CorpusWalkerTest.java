package com.usageprofile.counter;

import com.usageprofile.counter.config.ConfigException;
import com.usageprofile.counter.corpus.CorpusWalker;
import com.usageprofile.counter.corpus.ExclusionList;
import com.usageprofile.counter.corpus.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusWalkerTest {

    @TempDir
    Path root;

    @BeforeEach
    void createCorpus() throws Exception {
        for (String file : List.of("b/z.py", "b/a.py", "a.py", "notes.txt", "vendored/lib.py",
                "gen/api_pb2.py", "gen/deep/more_pb2.py", "stubs/s.pyi")) {
            Path p = root.resolve(file);
            Files.createDirectories(p.getParent());
            Files.writeString(p, "import sklearn\n");
        }
    }

    private List<String> walk(List<String> extensions, ExclusionList exclusions) {
        CorpusWalker.CorpusListing listing = new CorpusWalker(extensions).walk(root, exclusions);
        return listing.files().stream().map(f -> SourceFile.relativize(listing.root(), f)).toList();
    }

    @Test
    void listsSourceFilesSortedByRelativePath() {
        assertEquals(List.of("a.py", "b/a.py", "b/z.py", "gen/api_pb2.py", "gen/deep/more_pb2.py", "vendored/lib.py"),
                walk(List.of(".py"), ExclusionList.empty()));
    }

    @Test
    void extensionsAreConfigurable() {
        assertTrue(walk(List.of(".py", ".pyi"), ExclusionList.empty()).contains("stubs/s.pyi"));
    }

    @Test
    void literalAndGlobExclusions() {
        ExclusionList exclusions = ExclusionList.parse(List.of(
                "# comment",
                "",
                "vendored/",
                "b/z.py",
                "**/*_pb2.py"));
        assertEquals(List.of("a.py", "b/a.py"), walk(List.of(".py"), exclusions));
    }

    @Test
    void topLevelGlob() {
        ExclusionList exclusions = ExclusionList.parse(List.of("gen/*_pb2.py", "gen/**"));
        assertEquals(List.of("a.py", "b/a.py", "b/z.py", "vendored/lib.py"), walk(List.of(".py"), exclusions));
    }

    @Test
    void absolutePathExclusion() {
        ExclusionList exclusions = ExclusionList.parse(List.of(root.resolve("b").toAbsolutePath().toString()));
        assertEquals(List.of("a.py", "gen/api_pb2.py", "gen/deep/more_pb2.py", "vendored/lib.py"),
                walk(List.of(".py"), exclusions));
    }

    @Test
    void literalDoesNotMatchNamePrefix() {
        ExclusionList exclusions = ExclusionList.parse(List.of("b/a"));
        assertTrue(walk(List.of(".py"), exclusions).contains("b/a.py"));
    }

    @Test
    void exclusionFileIsRead() throws Exception {
        Path file = root.resolve("exclude.txt");
        Files.writeString(file, "vendored/\n**/*_pb2.py\n");
        ExclusionList exclusions = ExclusionList.read(file);
        assertEquals(List.of("a.py", "b/a.py", "b/z.py"), walk(List.of(".py"), exclusions));
    }

    @Test
    void missingExclusionFileExcludesNothing() {
        assertTrue(ExclusionList.read(root.resolve("missing.txt")).isEmpty());
    }

    @Test
    void missingRootIsConfigError() {
        assertThrows(ConfigException.class,
                () -> new CorpusWalker(List.of(".py")).walk(root.resolve("nope"), ExclusionList.empty()));
    }

    @Test
    void fileAsRootIsConfigError() {
        assertThrows(ConfigException.class,
                () -> new CorpusWalker(List.of(".py")).walk(root.resolve("a.py"), ExclusionList.empty()));
    }

    @Test
    void rootIsAbsoluteAndNormalized() {
        CorpusWalker.CorpusListing listing = new CorpusWalker(List.of(".py"))
                .walk(root.resolve("b/.."), ExclusionList.empty());
        assertEquals(root.toAbsolutePath().normalize(), listing.root());
        assertTrue(listing.failures().isEmpty());
    }
}

package org.errers.engine.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

final class FileInserterTest {

    @Test
    void insertsFileWithDefaultExtension() throws Exception {
        Path dir = Files.createTempDirectory("inserter");
        Files.writeString(dir.resolve("sub.tex"), "alpha\nbeta\n");
        FileInserter inserter = new FileInserter(dir, StandardCharsets.UTF_8);
        SourceFile main = SourceFile.primary(dir.resolve("main.tex"));

        FileInserter.Insertion insertion = inserter.insert(" sub ", ".tex", main);

        assertFalse(insertion.isMissing());
        assertEquals("alpha\nbeta\n", insertion.text());
        assertEquals(new SourceLocation("sub.tex", 2), insertion.locationMap().locate(6));
        assertEquals(main, insertion.locationMap().lineAt(0).file().getIncluder().orElseThrow());
    }

    @Test
    void explicitExtensionIsNotDoubled() throws Exception {
        Path dir = Files.createTempDirectory("inserter");
        Files.writeString(dir.resolve("refs.bbl"), "\\bibitem{a} A.");
        FileInserter inserter = new FileInserter(dir, StandardCharsets.UTF_8);

        FileInserter.Insertion insertion = inserter.insert("refs.bbl", ".bbl", SourceFile.anonymous("main.tex"));

        assertEquals("\\bibitem{a} A.", insertion.text());
    }

    @Test
    void missingFileIsReportedNotThrown() throws Exception {
        Path dir = Files.createTempDirectory("inserter");
        FileInserter inserter = new FileInserter(dir, StandardCharsets.UTF_8);

        FileInserter.Insertion insertion = inserter.insert("absent", ".tex", SourceFile.anonymous("main.tex"));

        assertTrue(insertion.isMissing());
        assertEquals("", insertion.text());
        assertNull(insertion.locationMap());
        assertTrue(insertion.problem().startsWith("File not found: "), insertion.problem());
    }

    @Test
    void recursiveInclusionIsRefused() throws Exception {
        Path dir = Files.createTempDirectory("inserter");
        Path mainPath = dir.resolve("main.tex");
        Files.writeString(mainPath, "\\input{chapter}");
        Files.writeString(dir.resolve("chapter.tex"), "\\input{main}");
        FileInserter inserter = new FileInserter(dir, StandardCharsets.UTF_8);
        SourceFile main = SourceFile.primary(mainPath);

        FileInserter.Insertion chapter = inserter.insert("chapter", ".tex", main);
        SourceFile chapterFile = chapter.locationMap().lineAt(0).file();
        FileInserter.Insertion loop = inserter.insert("main", ".tex", chapterFile);

        assertFalse(chapter.isMissing());
        assertTrue(loop.isMissing());
        assertTrue(loop.problem().startsWith("Recursive inclusion of "), loop.problem());
    }

    @Test
    void decodesWithDocumentCharset() throws Exception {
        Path dir = Files.createTempDirectory("inserter");
        Files.write(dir.resolve("latin.tex"), "café".getBytes(StandardCharsets.ISO_8859_1));
        FileInserter inserter = new FileInserter(dir, StandardCharsets.ISO_8859_1);

        assertEquals("café", inserter.insert("latin", ".tex", SourceFile.anonymous("main.tex")).text());
    }
}

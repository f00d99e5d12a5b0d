package net.revivatech.support.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.revivatech.exception.PageConfigReadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;
import tools.jackson.databind.ObjectMapper;

class FileSystemPageConfigSourceTest {

    @TempDir
    Path directory;

    private FileSystemPageConfigSource source;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(directory.resolve("services"));
        Files.writeString(directory.resolve("index.json"), "{\"layout\":\"landing\"}");
        Files.writeString(directory.resolve("services/mac-repair.json"), "{\"layout\":\"service\"}");
        Files.writeString(directory.resolve("notes.txt"), "not a page");
        source = new FileSystemPageConfigSource(new ObjectMapper(), directory);
    }

    @Test
    void should_ReadNestedPage_When_FileExists() {
        StepVerifier.create(source.read("services/mac-repair"))
            .assertNext(raw -> assertThat(raw).containsEntry("layout", "service"))
            .verifyComplete();
    }

    @Test
    void should_ReturnEmpty_When_FileMissing() {
        StepVerifier.create(source.read("services/screen-repair")).verifyComplete();
    }

    @Test
    void should_IgnorePath_When_ItEscapesDirectory() throws IOException {
        Path outside = directory.getParent().resolve("outside-" + directory.getFileName() + ".json");
        Files.writeString(outside, "{\"layout\":\"stolen\"}");
        try {
            StepVerifier.create(source.read("../outside-" + directory.getFileName())).verifyComplete();
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void should_FailWithReadException_When_JsonIsMalformed() throws IOException {
        Files.writeString(directory.resolve("broken.json"), "{\"layout\":");

        StepVerifier.create(source.read("broken"))
            .expectError(PageConfigReadException.class)
            .verify();
    }

    @Test
    void should_ListJsonFilesAsPaths_When_Scanning() {
        StepVerifier.create(source.listPaths().sort().collectList())
            .assertNext(paths -> assertThat(paths).containsExactly("index", "services/mac-repair"))
            .verifyComplete();
    }

    @Test
    void should_StayInactive_When_NoDirectoryConfigured() {
        FileSystemPageConfigSource inactive = new FileSystemPageConfigSource(new ObjectMapper(), (Path) null);

        StepVerifier.create(inactive.read("index")).verifyComplete();
        StepVerifier.create(inactive.listPaths()).verifyComplete();
    }
}

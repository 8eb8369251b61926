package ca.gc.cra.courier.infrastructure.payload;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.domain.payload.Payload;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryPayloadSourceTest {

  @TempDir
  Path dir;

  @Test
  void loadsImagesInNameOrder() throws IOException {
    Files.write(dir.resolve("b.png"), new byte[] {2, 2});
    Files.write(dir.resolve("a.JPG"), new byte[] {1});
    Files.write(dir.resolve("c.jpeg"), new byte[] {3, 3, 3});
    Files.write(dir.resolve("notes.txt"), new byte[] {9});
    Files.write(dir.resolve(".png"), new byte[] {9});
    Files.createDirectory(dir.resolve("nested.png"));

    List<Payload> payloads = new DirectoryPayloadSource(dir).load();

    assertEquals(List.of("a.JPG", "b.png", "c.jpeg"), payloads.stream().map(Payload::label).toList());
    assertEquals(List.of(0, 1, 2), payloads.stream().map(Payload::tag).toList());
    assertArrayEquals(new byte[] {3, 3, 3}, payloads.get(2).data());
  }

  @Test
  void emptyDirectoryYieldsNoPayloads() throws IOException {
    assertTrue(new DirectoryPayloadSource(dir).load().isEmpty());
  }

  @Test
  void missingDirectoryFails() {
    DirectoryPayloadSource source = new DirectoryPayloadSource(dir.resolve("absent"));

    assertThrows(NoSuchFileException.class, source::load);
  }
}

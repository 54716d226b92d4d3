package FSA.Catalog;

import FSA.Model.Automaton;
import FSA.Model.DuplicateIdentifierException;
import FSA.Model.ElementNotFoundException;
import FSA.TestAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class AutomatonCatalogTest {
  @TempDir
  Path tempDir;

  @Test
  void testMissingDirectoryIsCreated() throws IOException {
    Path dir = tempDir.resolve("Automates");
    AutomatonCatalog catalog = new AutomatonCatalog(dir);
    Assertions.assertEquals(0, catalog.loadAll());
    Assertions.assertTrue(Files.isDirectory(dir));
    Assertions.assertTrue(catalog.names().isEmpty());
  }

  @Test
  void testAddAndReload() throws IOException {
    AutomatonCatalog catalog = new AutomatonCatalog(tempDir);
    catalog.add(TestAutomata.singleA());
    catalog.add(TestAutomata.forkOnA());
    Assertions.assertTrue(Files.isRegularFile(tempDir.resolve("single_a.json")));
    Assertions.assertThrows(DuplicateIdentifierException.class, () -> catalog.add(TestAutomata.singleA()));

    AutomatonCatalog reloaded = new AutomatonCatalog(tempDir);
    Assertions.assertEquals(2, reloaded.loadAll());
    Assertions.assertEquals(List.of("fork", "single_a"), reloaded.names());
    Automaton a = reloaded.get("single_a");
    Assertions.assertEquals(2, a.size());
    Assertions.assertTrue(a.getState("q0").isInitial());
    Assertions.assertThrows(ElementNotFoundException.class, () -> reloaded.get("missing"));
  }

  @Test
  void testSaveReplaces() throws IOException {
    AutomatonCatalog catalog = new AutomatonCatalog(tempDir);
    catalog.add(TestAutomata.singleA());
    Automaton changed = TestAutomata.singleA();
    changed.addState("q2", null, false, false);
    catalog.save(changed);

    AutomatonCatalog reloaded = new AutomatonCatalog(tempDir);
    reloaded.loadAll();
    Assertions.assertEquals(3, reloaded.get("single_a").size());
  }

  @Test
  void testBadFilesSkipped() throws IOException {
    AutomatonCatalog catalog = new AutomatonCatalog(tempDir);
    catalog.add(TestAutomata.singleA());
    Files.writeString(tempDir.resolve("broken.json"), "{\"name\": ", StandardCharsets.UTF_8);
    Files.writeString(tempDir.resolve("dangling.json"),
        "{\"name\":\"dangling\",\"transitions\":[{\"id\":\"t\",\"source\":\"x\",\"dest\":\"y\",\"symbol\":\"z\"}]}",
        StandardCharsets.UTF_8);
    Files.writeString(tempDir.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);

    AutomatonCatalog reloaded = new AutomatonCatalog(tempDir);
    Assertions.assertEquals(1, reloaded.loadAll());
    Assertions.assertEquals(List.of("single_a"), reloaded.names());
  }

  @Test
  void testRemove() throws IOException {
    AutomatonCatalog catalog = new AutomatonCatalog(tempDir);
    catalog.add(TestAutomata.singleA());
    catalog.remove("single_a");
    Assertions.assertFalse(catalog.contains("single_a"));
    Assertions.assertFalse(Files.exists(catalog.fileOf("single_a")));
    Assertions.assertThrows(ElementNotFoundException.class, () -> catalog.remove("single_a"));
  }
}

package FSA.Catalog;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import FSA.JsonFormat;
import FSA.Model.Automaton;
import FSA.Model.AutomatonException;
import FSA.Model.DuplicateIdentifierException;
import FSA.Model.ElementNotFoundException;

/**
 * Named automata backed by a directory with one {@code <name>.json} file each.
 * Names are unique within a catalog. Not thread-safe.
 */
public class AutomatonCatalog {
    public static final String DEFAULT_DIRECTORY = "Automates";
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final Map<String, Automaton> automata = new TreeMap<>();

    public AutomatonCatalog(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Loads every {@code .json} file of the directory, creating the directory if missing.
     * Files that fail to parse or validate are reported on stderr and skipped.
     * @return number of automata loaded
     */
    public int loadAll() throws IOException {
        if (!Files.isDirectory(directory)) {
            Files.createDirectories(directory);
            return 0;
        }
        int loaded = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - EXTENSION.length());
                try {
                    automata.put(name, JsonFormat.read(file));
                    loaded++;
                } catch (IOException | AutomatonException e) {
                    System.err.println("Error while loading " + name + ": " + e.getMessage());
                }
            }
        }
        return loaded;
    }

    /**
     * Registers a new automaton and writes it to disk.
     * @throws DuplicateIdentifierException - when the name is already taken
     */
    public void add(Automaton automaton) throws IOException {
        if (automata.containsKey(automaton.getName())) {
            throw new DuplicateIdentifierException("Automaton", automaton.getName());
        }
        save(automaton);
    }

    /**
     * Writes the automaton, replacing any automaton of the same name.
     */
    public void save(Automaton automaton) throws IOException {
        JsonFormat.write(automaton, fileOf(automaton.getName()));
        automata.put(automaton.getName(), automaton);
    }

    public Automaton get(String name) {
        Automaton automaton = automata.get(name);
        if (automaton == null) {
            throw new ElementNotFoundException("Automaton", name);
        }
        return automaton;
    }

    public boolean contains(String name) {
        return automata.containsKey(name);
    }

    /**
     * Forgets the automaton and deletes its file.
     */
    public void remove(String name) throws IOException {
        if (automata.remove(name) == null) {
            throw new ElementNotFoundException("Automaton", name);
        }
        Files.deleteIfExists(fileOf(name));
    }

    /**
     * @return names in lexicographic order
     */
    public List<String> names() {
        return new ArrayList<>(automata.keySet());
    }

    public int size() {
        return automata.size();
    }

    Path fileOf(String name) {
        return directory.resolve(name + EXTENSION);
    }
}

package FSA;

import FSA.Catalog.AutomatonCatalog;
import FSA.Model.Automaton;
import FSA.Model.AutomatonException;
import FSA.Model.ElementNotFoundException;
import FSA.Model.State;
import FSA.Model.StateRole;
import FSA.Model.Symbol;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class FSACommandLine {
  static final Set<String> TRANSFORMS =
      Set.of("complete", "determinize", "minimize", "trim", "complement", "union", "intersection");
  static final Set<String> BINARY = Set.of("union", "intersection", "equivalent", "equivalent-exact");
  static final Set<String> QUERIES =
      Set.of("info", "show", "is-minimal", "simulate", "words", "equivalent", "equivalent-exact");
  // catalog edits and their argument counts, automaton name included
  static final Map<String, Integer> EDITS = Map.of(
      "create", 1, "delete", 1,
      "add-symbol", 2, "remove-symbol", 2,
      "add-state", 3, "remove-state", 2, "set-role", 3, "set-label", 3,
      "add-transition", 4, "remove-transition", 2);

  public static void main(String[] args) {
    String outFile = null;
    String directory = AutomatonCatalog.DEFAULT_DIRECTORY;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        PowersetDeterminizer.DEBUG = true;
        PartitionMinimizer.DEBUG = true;
      } else if ("--out".equalsIgnoreCase(arg) || "--dir".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for " + arg);
          printUsageAndExit(1);
        }
        if ("--out".equalsIgnoreCase(arg)) {
          outFile = args[++i];
        } else {
          directory = args[++i];
        }
      } else if (arg.startsWith("--")) {
        // Unknown flag
        printUsageAndExit(1);
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      printUsageAndExit(1);
    }
    String operation = positional.get(0).toLowerCase(Locale.ROOT);
    AutomatonCatalog catalog = new AutomatonCatalog(Paths.get(directory));

    try {
      if ("list".equals(operation)) {
        listCatalog(catalog);
        return;
      }
      if (EDITS.containsKey(operation)) {
        int given = positional.size() - 1;
        int expected = EDITS.get(operation);
        // add-state takes an optional label
        if (given != expected && !("add-state".equals(operation) && given == expected + 1)) {
          printUsageAndExit(1);
        }
        catalog.loadAll();
        Automaton edited = edit(operation, positional.subList(1, positional.size()), catalog);
        if (edited == null) {
          System.out.println("Deleted automaton " + positional.get(1));
        } else {
          System.out.println(operation + " result: " + describe(edited));
        }
        return;
      }
      boolean validInvocation = (TRANSFORMS.contains(operation) || QUERIES.contains(operation))
          && positional.size() == (needsArgument(operation) ? 3 : 2);
      if (!validInvocation) {
        printUsageAndExit(1);
      }

      Automaton automaton = resolve(positional.get(1), catalog);
      String argument = positional.size() > 2 ? positional.get(2) : null;
      Automaton other = BINARY.contains(operation) ? resolve(argument, catalog) : null;

      if (TRANSFORMS.contains(operation)) {
        Automaton result = transform(operation, automaton, other);
        System.out.println(operation + " result: " + describe(result));
        if (outFile != null) {
          System.out.println("Writing to file: " + outFile);
          JsonFormat.write(result, Paths.get(outFile));
        }
      } else {
        query(operation, automaton, argument, other);
      }
    } catch (IOException e) {
      System.err.println("I/O error: " + e.getMessage());
      System.exit(2);
    } catch (AutomatonException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    } catch (NumberFormatException e) {
      System.err.println("Error: expected a number, got " + positional.get(positional.size() - 1));
      System.exit(1);
    }
  }

  private static boolean needsArgument(String operation) {
    return BINARY.contains(operation) || "simulate".equals(operation) || "words".equals(operation);
  }

  private static void printUsageAndExit(int status) {
    System.out.println(
        "FSA [--debug] [--dir <catalog dir>] [--out <JSON output file>] <operation> <automaton> [<argument>]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--dir <catalog dir>] : Directory of named automata (default: "
        + AutomatonCatalog.DEFAULT_DIRECTORY + ")");
    System.out.println("[--out <JSON output file>] : Write the resulting automaton to the specified file");
    System.out.println();
    System.out.println("<automaton> : path to a JSON file, or the name of an automaton in the catalog.");
    System.out.println();
    System.out.println("<operation> : one of the choices below:");
    System.out.println("  list: List the automata of the catalog.");
    System.out.println("  info: Sizes, determinism and completeness.");
    System.out.println("  show: Print the automaton as JSON.");
    System.out.println("  complete: Add a sink state receiving every missing transition.");
    System.out.println("  determinize: Subset construction.");
    System.out.println("  minimize: Partition refinement of a deterministic automaton.");
    System.out.println("  is-minimal: Whether minimization would remove states.");
    System.out.println("  trim: Drop inaccessible states.");
    System.out.println("  complement: Flip final states of a deterministic, complete automaton.");
    System.out.println("  union <other>, intersection <other>: Product construction.");
    System.out.println("  simulate <word>: Run a word, one symbol per character.");
    System.out.println("  words <maxLength>: Accepted words up to the given length.");
    System.out.println("  equivalent <other>: Bounded equivalence check (words up to length "
        + LanguageOperations.EQUIVALENCE_DEPTH + ").");
    System.out.println("  equivalent-exact <other>: Exact equivalence check.");
    System.out.println();
    System.out.println("Catalog edits, saved immediately (<name> is a catalog name):");
    System.out.println("  create <name>, delete <name>");
    System.out.println("  add-symbol <name> <value>, remove-symbol <name> <value>");
    System.out.println("  add-state <name> <id> <initial|final|normal> [<label>], remove-state <name> <id>");
    System.out.println("  set-role <name> <id> <initial|final|normal>, set-label <name> <id> <label>");
    System.out.println("  add-transition <name> <source> <dest> <value>, remove-transition <name> <transition id>");
    System.exit(status);
  }

  /**
   * Choose transform to run.
   * @param operation - operation passed in from command-line
   * @param automaton - input automaton; mutated only by "complete"
   * @param other - second operand of binary operations, otherwise ignored
   * @return - resulting automaton
   */
  static Automaton transform(String operation, Automaton automaton, Automaton other) {
    return switch (operation) {
      case "complete" -> StructuralAnalyzer.complete(automaton);
      case "determinize" -> PowersetDeterminizer.determinize(automaton);
      case "minimize" -> PartitionMinimizer.minimize(automaton);
      case "trim" -> AutomatonTrim.trim(automaton);
      case "complement" -> LanguageOperations.complement(automaton);
      case "union" -> LanguageOperations.union(automaton, other);
      case "intersection" -> LanguageOperations.intersection(automaton, other);
      default -> throw new IllegalStateException("Unexpected operation choice: " + operation);
    };
  }

  private static void query(String operation, Automaton automaton, String argument, Automaton other)
      throws IOException {
    switch (operation) {
      case "info" -> {
        System.out.println(describe(automaton));
        System.out.println("Alphabet: " + automaton.symbolValues());
        System.out.println("Initial states: " + ids(automaton.getInitialStates()));
        System.out.println("Final states: " + ids(automaton.getFinalStates()));
        System.out.println("Deterministic: " + StructuralAnalyzer.isDeterministic(automaton));
        System.out.println("Complete: " + StructuralAnalyzer.isComplete(automaton));
      }
      case "show" -> System.out.println(JsonFormat.writeString(automaton));
      case "is-minimal" -> System.out.println("Minimal: " + PartitionMinimizer.isMinimal(automaton));
      case "simulate" -> System.out.println(
          "Word '" + argument + "' accepted? " + LanguageOperations.simulate(automaton, argument));
      case "words" -> {
        int maxLength = Integer.parseInt(argument);
        System.out.println("Accepted words up to length " + maxLength + ": "
            + LanguageOperations.acceptedWords(automaton, maxLength));
      }
      case "equivalent" -> System.out.println("Equivalent (words up to length "
          + LanguageOperations.EQUIVALENCE_DEPTH + "): " + LanguageOperations.equivalent(automaton, other));
      case "equivalent-exact" -> {
        List<String> word = AutomataLibBridge.separatingWord(automaton, other);
        System.out.println("Equivalent: " + (word == null));
        if (word != null) {
          System.out.println("Separating word: '" + String.join("", word) + "'");
        }
      }
      default -> throw new IllegalStateException("Unexpected operation choice: " + operation);
    }
  }

  /**
   * Apply a catalog edit and save the automaton. Nothing is saved when the model rejects the edit.
   * @param operation - edit operation passed in from command-line
   * @param args - catalog name of the automaton, followed by the operation's arguments
   * @return - edited automaton, or null after "delete"
   */
  static Automaton edit(String operation, List<String> args, AutomatonCatalog catalog) throws IOException {
    String name = args.get(0);
    if ("create".equals(operation)) {
      Automaton created = new Automaton(name);
      catalog.add(created);
      return created;
    }
    if ("delete".equals(operation)) {
      catalog.remove(name);
      return null;
    }

    Automaton automaton = catalog.get(name);
    switch (operation) {
      case "add-symbol" -> automaton.addSymbol(freshSymbolId(automaton), args.get(1));
      case "remove-symbol" -> automaton.removeSymbol(symbolForValue(automaton, args.get(1)).id());
      case "add-state" -> automaton.addState(args.get(1), args.size() > 3 ? args.get(3) : null,
          StateRole.parse(args.get(2)));
      case "remove-state" -> automaton.removeState(args.get(1));
      case "set-role" -> automaton.setRole(args.get(1), args.get(2));
      case "set-label" -> automaton.getState(args.get(1)).setLabel(args.get(2));
      case "add-transition" -> automaton.addTransition(args.get(1), args.get(2),
          symbolForValue(automaton, args.get(3)).id());
      case "remove-transition" -> automaton.removeTransition(args.get(1));
      default -> throw new IllegalStateException("Unexpected operation choice: " + operation);
    }
    catalog.save(automaton);
    return automaton;
  }

  private static String freshSymbolId(Automaton automaton) {
    int n = automaton.getSymbols().size();
    while (automaton.containsSymbol("sym_" + n)) {
      n++;
    }
    return "sym_" + n;
  }

  private static Symbol symbolForValue(Automaton automaton, String value) {
    Symbol symbol = automaton.symbolForValue(value);
    if (symbol == null) {
      throw new ElementNotFoundException("Symbol", value);
    }
    return symbol;
  }

  /**
   * A path to an existing file is read directly, anything else is looked up in the catalog.
   */
  static Automaton resolve(String reference, AutomatonCatalog catalog) throws IOException {
    Path path = Paths.get(reference);
    if (Files.isRegularFile(path)) {
      return JsonFormat.read(path);
    }
    if (catalog.size() == 0) {
      catalog.loadAll();
    }
    return catalog.get(reference);
  }

  private static void listCatalog(AutomatonCatalog catalog) throws IOException {
    catalog.loadAll();
    System.out.println("Available automata in " + catalog.getDirectory() + ":");
    for (String name : catalog.names()) {
      System.out.println("- " + name + " (" + describe(catalog.get(name)) + ")");
    }
  }

  static String describe(Automaton automaton) {
    return automaton.getName() + ": " + automaton.size() + " states, "
        + automaton.getSymbols().size() + " symbols, " + automaton.getTransitions().size() + " transitions";
  }

  private static List<String> ids(List<State> states) {
    List<String> ids = new ArrayList<>(states.size());
    for (State s : states) {
      ids.add(s.getId());
    }
    return ids;
  }
}
